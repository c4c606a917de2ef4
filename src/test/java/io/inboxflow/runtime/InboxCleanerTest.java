package io.inboxflow.runtime;

import io.inboxflow.codec.YamlFrontmatterCodec;
import io.inboxflow.config.VaultConfig;
import io.inboxflow.storage.TaskRecordFormat;
import io.inboxflow.storage.TaskStore;
import io.inboxflow.testing.TestVaults;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.util.List;
import java.util.Set;

final class InboxCleanerTest {

    @Test
    void onlyFilesTrackedInLedgerAndFinishedInDoneAreRemoved() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-cleaner-");
        try {
            TaskStore store = new TaskStore(config, new TaskRecordFormat(new YamlFrontmatterCodec()));
            TestVaults.writeDoneRecord(config, "task-done", "invoice", 1.0);
            TestVaults.writeDoneRecord(config, "task-untracked", "invoice", 1.0);
            TestVaults.drop(config, "task-done.txt", "finished");
            TestVaults.drop(config, "task-untracked.txt", "done but not in ledger");
            TestVaults.drop(config, "still-pending.txt", "in ledger, not done");
            TestVaults.drop(config, ".gitkeep", "");
            Set<String> ledger = Set.of("task-done.txt", "still-pending.txt", ".gitkeep");

            InboxCleaner cleaner = new InboxCleaner(config, store);
            InboxCleaner.CleanupReport dryRun = cleaner.cleanup(ledger, false);

            Assertions.assertTrue(dryRun.dryRun());
            Assertions.assertEquals(1, dryRun.total());
            Assertions.assertEquals(List.of("task-done.txt"), dryRun.files());
            Assertions.assertTrue(Files.exists(config.inboxDir().resolve("task-done.txt")));

            InboxCleaner.CleanupReport executed = cleaner.cleanup(ledger, true);

            Assertions.assertFalse(executed.dryRun());
            Assertions.assertEquals(1, executed.deleted());
            Assertions.assertFalse(Files.exists(config.inboxDir().resolve("task-done.txt")));
            Assertions.assertTrue(Files.exists(config.inboxDir().resolve("task-untracked.txt")));
            Assertions.assertTrue(Files.exists(config.inboxDir().resolve("still-pending.txt")));
            Assertions.assertTrue(Files.exists(config.inboxDir().resolve(".gitkeep")));
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }

    @Test
    void emptyInboxProducesEmptyReport() throws Exception {
        VaultConfig config = TestVaults.create("inboxflow-cleaner-empty-");
        try {
            TaskStore store = new TaskStore(config, new TaskRecordFormat(new YamlFrontmatterCodec()));

            InboxCleaner.CleanupReport report = new InboxCleaner(config, store).cleanup(Set.of(), true);

            Assertions.assertEquals(0, report.total());
            Assertions.assertEquals(0, report.failed());
        } finally {
            TestVaults.deleteRecursively(config.rootDir());
        }
    }
}
