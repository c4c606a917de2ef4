package io.inboxflow.stats;

import io.inboxflow.codec.YamlFrontmatterCodec;
import io.inboxflow.config.VaultConfig;
import io.inboxflow.observability.ErrorRecorder;
import io.inboxflow.storage.TaskRecordFormat;
import io.inboxflow.storage.TaskStore;
import io.inboxflow.testing.MutableClock;
import io.inboxflow.testing.TestVaults;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;

final class StatisticsAggregatorTest {

    @Test
    void recomputeMatchesFolderContents() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-stats-");
        try {
            for (int i = 1; i <= 3; i++) {
                Files.writeString(config.pendingDir().resolve("task-p" + i + ".md"), "pending " + i);
            }
            TestVaults.writeDoneRecord(config, "task-d1", "invoice", 10.0d);
            TestVaults.writeDoneRecord(config, "task-d2", "invoice", 20.0d);
            TestVaults.writeDoneRecord(config, "task-d3", "meeting_notes", null);
            TestVaults.writeDoneRecord(config, "task-d4", "invoice", null);
            Files.writeString(config.doneDir().resolve("task-d5.md"), "not a task record at all");
            new ErrorRecorder(config.logsDir()).record("test failure", "TestError", "boom");
            Files.createDirectories(config.quarantineDir());
            Files.writeString(config.quarantineDir().resolve("error-ignored.md"), "quarantined files are not counted");

            Report report = aggregator(config).recompute();

            Assertions.assertEquals(3, report.pendingToday());
            Assertions.assertEquals(5, report.completedToday());
            Assertions.assertEquals(5, report.totalProcessed());
            Assertions.assertEquals(1, report.failedToday());
            Assertions.assertEquals(15.0d, report.averageDurationSeconds(), 0.0001d);
            Assertions.assertEquals(83.333d, report.successRatePercent(), 0.01d);
            Assertions.assertEquals("Invoice", report.mostCommonAnalysisType());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void emptyVaultReportsFullSuccessAndNoType() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-stats-empty-");
        try {
            Report report = aggregator(config).recompute();

            Assertions.assertEquals(0, report.completedToday());
            Assertions.assertEquals(0d, report.averageDurationSeconds());
            Assertions.assertEquals(100d, report.successRatePercent());
            Assertions.assertEquals(Report.NO_TYPE, report.mostCommonAnalysisType());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void mostCommonTypeIsFormattedAndTiesGoToFirstSeen() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-stats-type-");
        try {
            TestVaults.writeDoneRecord(config, "task-a", "meeting_notes", null);
            TestVaults.writeDoneRecord(config, "task-b", "invoice", null);

            Assertions.assertEquals("Meeting Notes", aggregator(config).recompute().mostCommonAnalysisType());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void bumpsAdjustCountsBetweenRecomputes() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-stats-bump-");
        try {
            Files.writeString(config.pendingDir().resolve("task-p1.md"), "x");
            Files.writeString(config.pendingDir().resolve("task-p2.md"), "y");
            StatisticsAggregator aggregator = aggregator(config);
            aggregator.recompute();

            aggregator.bumpCompleted();
            aggregator.bumpFailed();
            aggregator.bumpFailed();

            Report report = aggregator.current();
            Assertions.assertEquals(1, report.completedToday());
            Assertions.assertEquals(2, report.failedToday());
            Assertions.assertEquals(0, report.pendingToday());
            Assertions.assertEquals(100d / 3d, report.successRatePercent(), 0.0001d);
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void activityIsCappedAndSurvivesReload() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-stats-activity-");
        try {
            StatisticsAggregator aggregator = aggregator(config);
            for (int i = 1; i <= 12; i++) {
                aggregator.recordActivity(new ActivityEntry("10:0" + (i % 10), "task-" + i, "file-" + i + ".txt",
                        ActivityEntry.COMPLETED, "Task completed successfully and this summary is far longer than fifty characters"));
            }
            Assertions.assertEquals(10, aggregator.current().recentActivity().size());
            Assertions.assertEquals("task-12", aggregator.current().recentActivity().get(0).taskId());
            Assertions.assertEquals(50, aggregator.current().recentActivity().get(0).summary().length());
            Assertions.assertTrue(aggregator.render());

            String dashboard = Files.readString(config.dashboardFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(dashboard.contains("| [[task-12|file-12.txt]] | ✅ |"));

            StatisticsAggregator reloaded = aggregator(config);
            reloaded.load();
            Assertions.assertEquals(10, reloaded.current().recentActivity().size());
            Assertions.assertEquals("task-12", reloaded.current().recentActivity().get(0).taskId());
            Assertions.assertEquals("file-12.txt", reloaded.current().recentActivity().get(0).displayName());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    private static StatisticsAggregator aggregator(VaultConfig config) {
        return new StatisticsAggregator(
                config,
                new TaskStore(config, new TaskRecordFormat(new YamlFrontmatterCodec())),
                new ErrorRecorder(config.logsDir()),
                new DashboardRenderer(),
                new MutableClock(Instant.parse("2025-01-15T10:00:00Z")),
                LoggerFactory.getLogger(StatisticsAggregatorTest.class)
        );
    }
}
