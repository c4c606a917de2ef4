package io.inboxflow.watch;

import io.inboxflow.codec.YamlFrontmatterCodec;
import io.inboxflow.config.PipelineSettings;
import io.inboxflow.config.VaultConfig;
import io.inboxflow.content.FileContentExtractor;
import io.inboxflow.creator.FileTaskCreator;
import io.inboxflow.creator.TaskCreator;
import io.inboxflow.model.CreationResult;
import io.inboxflow.observability.ErrorRecorder;
import io.inboxflow.storage.LedgerStore;
import io.inboxflow.storage.TaskRecordFormat;
import io.inboxflow.storage.TaskStore;
import io.inboxflow.testing.MutableClock;
import io.inboxflow.testing.TestVaults;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

final class InboxHandlerTest {
    private static final PipelineSettings FAST = PipelineSettings.defaults().withRetryDelayMs(0L);

    @Test
    void repeatNotificationWithinOneSecondIsDebounced() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-debounce-");
        try {
            MutableClock clock = new MutableClock(Instant.parse("2025-01-15T10:00:00Z"));
            CountingCreator creator = new CountingCreator(realCreator(config), 0);
            InboxHandler handler = handler(config, creator, clock, FAST);
            Path file = TestVaults.drop(config, "a.txt", "hello");

            assertEquals(InboxHandler.Outcome.CREATED, handler.handle(file));
            clock.advance(Duration.ofMillis(500));
            assertEquals(InboxHandler.Outcome.DEBOUNCED, handler.handle(file));
            assertEquals(1, creator.calls.get());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void notificationsMoreThanOneSecondApartBothAttempt() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-spaced-");
        try {
            MutableClock clock = new MutableClock(Instant.parse("2025-01-15T10:00:00Z"));
            CountingCreator creator = new CountingCreator(realCreator(config), 0);
            InboxHandler handler = handler(config, creator, clock, FAST);
            Path file = TestVaults.drop(config, "a.txt", "hello");

            assertEquals(InboxHandler.Outcome.CREATED, handler.handle(file));
            clock.advance(Duration.ofMillis(1_100));
            assertEquals(InboxHandler.Outcome.ALREADY_PROCESSED, handler.handle(file));
            assertEquals(2, creator.calls.get());
            assertEquals(1, pendingCount(config));
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void transientFailuresBelowCeilingStillCreateOneTask() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-retry-");
        try {
            CountingCreator creator = new CountingCreator(realCreator(config), 2);
            InboxHandler handler = handler(config, creator, clock(), FAST);

            InboxHandler.Outcome outcome = handler.handle(TestVaults.drop(config, "a.txt", "hello"));

            assertEquals(InboxHandler.Outcome.CREATED, outcome);
            assertEquals(3, creator.calls.get());
            assertEquals(1, pendingCount(config));
            assertEquals(0, errorRecords(config).size());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void exhaustedRetriesLeaveOneErrorRecordCitingAttempts() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-exhausted-");
        try {
            CountingCreator creator = new CountingCreator(realCreator(config), 3);
            InboxHandler handler = handler(config, creator, clock(), FAST);

            InboxHandler.Outcome outcome = handler.handle(TestVaults.drop(config, "a.txt", "hello"));

            assertEquals(InboxHandler.Outcome.FAILED, outcome);
            assertEquals(3, creator.calls.get());
            assertEquals(0, pendingCount(config));
            List<Path> records = errorRecords(config);
            assertEquals(1, records.size());
            assertTrue(Files.readString(records.get(0), StandardCharsets.UTF_8).contains("after 3 attempts"));
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void unsupportedExtensionIsSkippedWithoutRecord() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-ext-");
        try {
            CountingCreator creator = new CountingCreator(realCreator(config), 0);
            InboxHandler handler = handler(config, creator, clock(), FAST);

            assertEquals(InboxHandler.Outcome.UNSUPPORTED, handler.handle(TestVaults.drop(config, "tool.exe", "MZ")));
            assertEquals(InboxHandler.Outcome.UNSUPPORTED, handler.handle(TestVaults.drop(config, ".gitkeep", "")));
            assertEquals(0, creator.calls.get());
            assertEquals(0, errorRecords(config).size());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void extensionCheckIgnoresCase() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-case-");
        try {
            CountingCreator creator = new CountingCreator(realCreator(config), 0);
            InboxHandler handler = handler(config, creator, clock(), FAST);

            assertEquals(InboxHandler.Outcome.CREATED, handler.handle(TestVaults.drop(config, "NOTES.TXT", "hi")));
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void oversizedFileProducesErrorRecordAndNoAttempt() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-size-");
        try {
            CountingCreator creator = new CountingCreator(realCreator(config), 0);
            InboxHandler handler = handler(config, creator, clock(), FAST.withMaxFileSizeBytes(8L));

            assertEquals(InboxHandler.Outcome.OVERSIZED, handler.handle(TestVaults.drop(config, "big.txt", "0123456789")));
            assertEquals(0, creator.calls.get());
            assertEquals(1, errorRecords(config).size());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void vanishedFilesAndDirectoriesAreDropped() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-gone-");
        try {
            CountingCreator creator = new CountingCreator(realCreator(config), 0);
            InboxHandler handler = handler(config, creator, clock(), FAST);
            Path dir = Files.createDirectory(config.inboxDir().resolve("folder.txt"));

            assertEquals(InboxHandler.Outcome.VANISHED, handler.handle(config.inboxDir().resolve("gone.txt")));
            assertEquals(InboxHandler.Outcome.DIRECTORY, handler.handle(dir));
            assertEquals(0, creator.calls.get());
            assertEquals(0, errorRecords(config).size());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void permissionDeniedFromCreatorIsRecordedOnce() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-perm-");
        try {
            AtomicInteger calls = new AtomicInteger();
            TaskCreator denied = new TaskCreator() {
                @Override
                public CreationResult createFromFile(Path file) {
                    calls.incrementAndGet();
                    return CreationResult.permanentError(CreationResult.PermanentReason.PERMISSION_DENIED,
                            "permission denied: " + file.getFileName(), null);
                }

                @Override
                public void markCompleted(String taskId) {
                }
            };
            InboxHandler handler = handler(config, denied, clock(), FAST);

            assertEquals(InboxHandler.Outcome.UNREADABLE, handler.handle(TestVaults.drop(config, "a.txt", "x")));
            assertEquals(1, calls.get());
            assertEquals(1, errorRecords(config).size());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void inboxFileWithoutReadPermissionIsRecordedAndNeverCreated() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-chmod-");
        try {
            CountingCreator creator = new CountingCreator(realCreator(config), 0);
            InboxHandler handler = handler(config, creator, clock(), FAST);
            Path file = TestVaults.drop(config, "locked.txt", "secret");
            Files.setPosixFilePermissions(file, Set.of());
            assumeFalse(Files.isReadable(file), "file stays readable for this user");

            assertEquals(InboxHandler.Outcome.UNREADABLE, handler.handle(file));
            assertEquals(0, creator.calls.get());
            List<Path> records = errorRecords(config);
            assertEquals(1, records.size());
            assertTrue(Files.readString(records.get(0), StandardCharsets.UTF_8).contains("Permission denied"));
            assertEquals(0, pendingCount(config));
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void watcherSweepPicksUpExistingFilesOnce() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-handler-sweep-");
        try {
            CountingCreator creator = new CountingCreator(realCreator(config), 0);
            MutableClock clock = clock();
            InboxHandler handler = handler(config, creator, clock, FAST);
            TestVaults.drop(config, "a.txt", "one");
            TestVaults.drop(config, "b.md", "two");
            InboxWatcher watcher = new InboxWatcher(config.inboxDir(), handler, 100L, true);

            assertEquals(2, watcher.sweep());
            clock.advance(Duration.ofSeconds(5));
            assertEquals(2, watcher.sweep());

            assertEquals(2, pendingCount(config));
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    private static MutableClock clock() {
        return new MutableClock(Instant.parse("2025-01-15T10:00:00Z"));
    }

    private static InboxHandler handler(VaultConfig config, TaskCreator creator, MutableClock clock, PipelineSettings settings) {
        return new InboxHandler(settings, creator, new ErrorRecorder(config.logsDir()),
                new DebounceFilter(clock, settings.debounceMs()));
    }

    private static FileTaskCreator realCreator(VaultConfig config) {
        TaskStore store = new TaskStore(config, new TaskRecordFormat(new YamlFrontmatterCodec()));
        return new FileTaskCreator(new LedgerStore(config.ledgerFile()), store, new FileContentExtractor());
    }

    private static int pendingCount(VaultConfig config) throws IOException {
        try (Stream<Path> files = Files.list(config.pendingDir())) {
            return (int) files.filter(p -> p.toString().endsWith(".md")).count();
        }
    }

    private static List<Path> errorRecords(VaultConfig config) throws IOException {
        try (Stream<Path> files = Files.list(config.logsDir())) {
            return files.filter(ErrorRecorder::isErrorRecord).collect(Collectors.toList());
        }
    }

    private static final class CountingCreator implements TaskCreator {
        private final TaskCreator delegate;
        private final int transientFailures;
        private final AtomicInteger calls = new AtomicInteger();

        private CountingCreator(TaskCreator delegate, int transientFailures) {
            this.delegate = delegate;
            this.transientFailures = transientFailures;
        }

        @Override
        public CreationResult createFromFile(Path file) {
            int call = calls.incrementAndGet();
            if (call <= transientFailures) {
                return CreationResult.transientError("disk busy (call " + call + ")", new IOException("disk busy"));
            }
            return delegate.createFromFile(file);
        }

        @Override
        public void markCompleted(String taskId) {
            delegate.markCompleted(taskId);
        }
    }
}
