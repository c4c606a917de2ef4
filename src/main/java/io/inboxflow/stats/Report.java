package io.inboxflow.stats;

import java.util.List;

/**
 * Dashboard statistics. Every count can be rebuilt from the vault's folders.
 */
public record Report(
        int completedToday,
        int pendingToday,
        int failedToday,
        int totalProcessed,
        double averageDurationSeconds,
        double successRatePercent,
        String mostCommonAnalysisType,
        List<ActivityEntry> recentActivity
) {
    public static final String NO_TYPE = "N/A";

    public Report {
        recentActivity = List.copyOf(recentActivity);
    }

    public static Report empty() {
        return new Report(0, 0, 0, 0, 0d, 100d, NO_TYPE, List.of());
    }

    public static double successRate(int completed, int failed) {
        int total = completed + failed;
        return total == 0 ? 100d : completed * 100d / total;
    }
}
