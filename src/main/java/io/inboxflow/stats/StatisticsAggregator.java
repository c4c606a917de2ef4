package io.inboxflow.stats;

import io.inboxflow.config.VaultConfig;
import io.inboxflow.model.Task;
import io.inboxflow.model.TaskStatus;
import io.inboxflow.observability.ErrorRecorder;
import io.inboxflow.storage.TaskRecordException;
import io.inboxflow.storage.TaskRecordFormat;
import io.inboxflow.storage.TaskStore;
import io.inboxflow.util.AtomicFiles;
import io.inboxflow.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the dashboard report. {@link #recompute()} rebuilds the counts from disk; the bump methods
 * adjust them in between so the report stays current without a full scan.
 */
public final class StatisticsAggregator {
    public static final int MAX_RECENT_ACTIVITY = 10;
    private static final DateTimeFormatter ACTIVITY_TIME = DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    private final VaultConfig config;
    private final TaskStore store;
    private final ErrorRecorder errors;
    private final DashboardRenderer renderer;
    private final Clock clock;
    private final Logger log;

    private int completed;
    private int pending;
    private int failed;
    private double averageDurationSeconds;
    private String mostCommonType;
    private final List<ActivityEntry> recentActivity;

    public StatisticsAggregator(VaultConfig config, TaskStore store, ErrorRecorder errors) {
        this(config, store, errors, new DashboardRenderer(), Clock.systemUTC(),
                LoggerFactory.getLogger(StatisticsAggregator.class));
    }

    public StatisticsAggregator(
            VaultConfig config,
            TaskStore store,
            ErrorRecorder errors,
            DashboardRenderer renderer,
            Clock clock,
            Logger log
    ) {
        this.config = config;
        this.store = store;
        this.errors = errors;
        this.renderer = renderer;
        this.clock = clock;
        this.log = log;
        this.mostCommonType = Report.NO_TYPE;
        this.recentActivity = new ArrayList<>();
    }

    /**
     * Picks up the recent activity table from an existing dashboard.
     */
    public synchronized void load() {
        Path dashboard = config.dashboardFile();
        if (!Files.isRegularFile(dashboard)) {
            return;
        }
        try {
            List<ActivityEntry> parsed = renderer.parseActivity(Files.readString(dashboard, StandardCharsets.UTF_8));
            recentActivity.clear();
            recentActivity.addAll(parsed.subList(0, Math.min(parsed.size(), MAX_RECENT_ACTIVITY)));
        } catch (IOException e) {
            log.warn("Could not read dashboard {}: {}", dashboard, e.getMessage());
        }
    }

    public synchronized Report recompute() {
        pending = store.listPending().size();
        List<Path> done = store.listDone();
        completed = done.size();
        failed = (int) errors.count();

        double totalDuration = 0d;
        int timed = 0;
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        TaskRecordFormat format = store.format();
        for (Path record : done) {
            Map<String, Object> header;
            try {
                header = format.header(Files.readString(record, StandardCharsets.UTF_8));
            } catch (IOException | TaskRecordException e) {
                log.debug("Counting {} without metadata: {}", record.getFileName(), e.getMessage());
                continue;
            }
            Object type = header.get("type");
            if (type != null && !String.valueOf(type).isBlank()) {
                typeCounts.merge(String.valueOf(type), 1, Integer::sum);
            }
            Object processing = header.get("processing");
            if (processing instanceof Map) {
                Object duration = ((Map<?, ?>) processing).get("duration_seconds");
                Double seconds = asDouble(duration);
                if (seconds != null) {
                    totalDuration += seconds;
                    timed++;
                }
            }
        }
        averageDurationSeconds = timed == 0 ? 0d : totalDuration / timed;
        mostCommonType = mostCommon(typeCounts);
        return current();
    }

    public synchronized void bumpCompleted() {
        completed++;
        if (pending > 0) {
            pending--;
        }
    }

    public synchronized void bumpFailed() {
        failed++;
        if (pending > 0) {
            pending--;
        }
    }

    public synchronized void recordActivity(ActivityEntry entry) {
        recentActivity.add(0, entry);
        while (recentActivity.size() > MAX_RECENT_ACTIVITY) {
            recentActivity.remove(recentActivity.size() - 1);
        }
    }

    public void recordActivity(Task task, String summary) {
        String glyph = task.status() == TaskStatus.COMPLETED
                ? ActivityEntry.COMPLETED
                : task.status() == TaskStatus.FAILED ? ActivityEntry.FAILED : ActivityEntry.PENDING;
        recordActivity(new ActivityEntry(ACTIVITY_TIME.format(clock.instant()), task.id(), task.displayName(), glyph, summary));
    }

    /**
     * Rewrites the dashboard in full.
     *
     * @return false when the file could not be written; the error is logged
     */
    public synchronized boolean render() {
        try {
            AtomicFiles.writeString(config.dashboardFile(), renderer.render(current(), clock.instant()));
            return true;
        } catch (IOException e) {
            log.error("Failed to write dashboard {}: {}", config.dashboardFile(), e.getMessage());
            return false;
        }
    }

    public synchronized Report current() {
        return new Report(
                completed,
                pending,
                failed,
                completed,
                averageDurationSeconds,
                Report.successRate(completed, failed),
                mostCommonType,
                recentActivity
        );
    }

    private static String mostCommon(Map<String, Integer> counts) {
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best == null ? Report.NO_TYPE : Texts.titleCase(best);
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
