package io.inboxflow.stats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code Dashboard.md} and reads the activity table back out of it.
 */
public final class DashboardRenderer {
    static final String ACTIVITY_HEADING = "## Recent Activity";
    private static final Pattern ACTIVITY_ROW = Pattern.compile(
            "^\\|\\s*(\\d{2}:\\d{2})\\s*\\|\\s*\\[\\[([^|\\]]+)\\|([^\\]]*)]]\\s*\\|\\s*(\\S+)\\s*\\|\\s*(.*?)\\s*\\|$");

    public String render(Report report, Instant updatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("# AI Assistant Dashboard\n\n");
        sb.append("**Last Updated**: ").append(updatedAt).append("\n\n");
        sb.append("## Today's Summary\n\n");
        sb.append("- ✅ Completed: ").append(report.completedToday()).append(" tasks\n");
        sb.append("- ⏳ Pending: ").append(report.pendingToday()).append(" tasks\n");
        sb.append("- ❌ Failed: ").append(report.failedToday()).append(" tasks\n\n");
        sb.append(ACTIVITY_HEADING).append("\n\n");
        sb.append("| Time | File | Status | Summary |\n");
        sb.append("|------|------|--------|---------|\n");
        if (report.recentActivity().isEmpty()) {
            sb.append("| -- | No activity yet | -- | Drop files in Inbox/ to get started |\n");
        }
        for (ActivityEntry entry : report.recentActivity()) {
            sb.append("| ").append(entry.time())
                    .append(" | [[").append(entry.taskId()).append('|').append(entry.displayName()).append("]]")
                    .append(" | ").append(entry.statusGlyph())
                    .append(" | ").append(entry.summary())
                    .append(" |\n");
        }
        sb.append('\n');
        sb.append("## Statistics\n\n");
        sb.append("- **Total tasks processed**: ").append(report.totalProcessed()).append('\n');
        sb.append("- **Average processing time**: ")
                .append(String.format(Locale.ROOT, "%.1f", report.averageDurationSeconds())).append("s\n");
        sb.append("- **Success rate**: ")
                .append(String.format(Locale.ROOT, "%.1f", report.successRatePercent())).append("%\n");
        sb.append("- **Most common type**: ").append(report.mostCommonAnalysisType()).append("\n\n");
        sb.append("## Quick Links\n\n");
        sb.append("- [[Company_Handbook]] - Edit processing rules\n");
        sb.append("- [[Needs_Action/]] - View pending tasks\n");
        sb.append("- [[Done/]] - View completed tasks\n");
        sb.append("- [[Logs/]] - View error logs\n");
        return sb.toString();
    }

    public List<ActivityEntry> parseActivity(String dashboard) {
        List<ActivityEntry> entries = new ArrayList<>();
        if (dashboard == null) {
            return entries;
        }
        boolean inside = false;
        for (String line : dashboard.replace("\r\n", "\n").split("\n")) {
            String trimmed = line.strip();
            if (trimmed.equals(ACTIVITY_HEADING)) {
                inside = true;
                continue;
            }
            if (!inside) {
                continue;
            }
            if (trimmed.startsWith("#")) {
                break;
            }
            Matcher matcher = ACTIVITY_ROW.matcher(trimmed);
            if (matcher.matches()) {
                entries.add(new ActivityEntry(
                        matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4), matcher.group(5)));
            }
        }
        return entries;
    }
}
