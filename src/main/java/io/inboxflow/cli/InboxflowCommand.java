package io.inboxflow.cli;

import io.inboxflow.config.VaultConfig;
import io.inboxflow.model.Task;
import io.inboxflow.runtime.InboxCleaner;
import io.inboxflow.runtime.InboxflowRuntime;
import io.inboxflow.runtime.ProcessingOrchestrator;
import io.inboxflow.stats.Report;
import io.inboxflow.util.Jsons;
import io.inboxflow.watch.InboxWatcher;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "inboxflow",
        mixinStandardHelpOptions = true,
        description = "Inbox-to-task pipeline for a markdown vault",
        subcommands = {
                InboxflowCommand.InitCommand.class,
                InboxflowCommand.WatchCommand.class,
                InboxflowCommand.ProcessCommand.class,
                InboxflowCommand.RebuildDashboardCommand.class,
                InboxflowCommand.CleanupInboxCommand.class,
                InboxflowCommand.RequeueCommand.class,
                InboxflowCommand.RebuildLedgerCommand.class
        }
)
public final class InboxflowCommand implements Runnable {
    static final String LOG_DIR_PROPERTY = "inboxflow.log.dir";

    @Option(names = {"--vault"}, description = "Vault root directory", defaultValue = "vault")
    String vault;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | watch | process | rebuild-dashboard | cleanup-inbox | requeue | rebuild-ledger");
    }

    VaultConfig config() {
        return VaultConfig.fromRoot(vault);
    }

    InboxflowRuntime runtime() {
        VaultConfig config = config();
        System.setProperty(LOG_DIR_PROPERTY, config.logsDir().toString());
        return new InboxflowRuntime(config);
    }

    /**
     * Prints why the vault is unusable. Checked before any logger exists so a bad path never gets
     * a log directory created under it.
     */
    boolean vaultMissing() {
        VaultConfig config = config();
        List<Path> missing = config.missingDirectories();
        if (missing.isEmpty()) {
            return false;
        }
        System.err.println("Error: Vault not found or incomplete at " + config.rootDir());
        for (Path dir : missing) {
            System.err.println("  missing: " + dir);
        }
        System.err.println("Run: inboxflow --vault " + config.rootDir() + " init");
        return true;
    }

    @Command(name = "init", description = "Create vault folders, Dashboard.md and a default Company_Handbook.md")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        InboxflowCommand parent;

        @Override
        public Integer call() {
            InboxflowRuntime.InitOutcome outcome = parent.runtime().init();
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "watch", description = "Watch Inbox/ and create tasks until interrupted")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        InboxflowCommand parent;

        @Option(names = {"--no-scan-on-start"}, description = "Skip the startup sweep of files already in Inbox/")
        boolean noScanOnStart;

        @Override
        public Integer call() throws Exception {
            if (parent.vaultMissing()) {
                return 1;
            }
            InboxflowRuntime runtime = parent.runtime();
            InboxWatcher watcher = runtime.watcher(!noScanOnStart);
            Thread shutdown = new Thread(() -> {
                watcher.stop();
                try {
                    watcher.awaitStopped(runtime.settings().watchPollMs() * 4L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "inboxflow-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdown);
            System.out.println("Watching " + runtime.config().inboxDir() + " (Ctrl+C to stop)");
            watcher.run();
            return 0;
        }
    }

    @Command(name = "process", description = "Process every pending task once")
    static final class ProcessCommand implements Callable<Integer> {
        @ParentCommand
        InboxflowCommand parent;

        @Option(names = {"--watch-interval"}, defaultValue = "0",
                description = "Seconds between batches; 0 runs a single batch")
        long watchIntervalSec;

        @Override
        public Integer call() throws Exception {
            if (parent.vaultMissing()) {
                return 1;
            }
            InboxflowRuntime runtime = parent.runtime();
            while (true) {
                ProcessingOrchestrator.BatchOutcome outcome = runtime.processBatch();
                System.out.println(Jsons.toJson(outcome));
                if (watchIntervalSec <= 0) {
                    return 0;
                }
                Thread.sleep(watchIntervalSec * 1000L);
            }
        }
    }

    @Command(name = "rebuild-dashboard", description = "Recompute statistics from the vault and rewrite Dashboard.md")
    static final class RebuildDashboardCommand implements Callable<Integer> {
        @ParentCommand
        InboxflowCommand parent;

        @Override
        public Integer call() {
            if (parent.vaultMissing()) {
                return 1;
            }
            Report report = parent.runtime().rebuildDashboard();
            System.out.println(Jsons.toJson(report));
            return 0;
        }
    }

    @Command(name = "cleanup-inbox", description = "Remove Inbox files whose task reached Done/ (dry run by default)")
    static final class CleanupInboxCommand implements Callable<Integer> {
        @ParentCommand
        InboxflowCommand parent;

        @Option(names = {"--execute"}, description = "Actually delete files")
        boolean execute;

        @Override
        public Integer call() {
            if (parent.vaultMissing()) {
                return 1;
            }
            InboxCleaner.CleanupReport report = parent.runtime().cleanupInbox(execute);
            System.out.println(Jsons.toJson(report));
            return report.failed() == 0 ? 0 : 2;
        }
    }

    @Command(name = "requeue", description = "Move a failed task back to pending")
    static final class RequeueCommand implements Callable<Integer> {
        @ParentCommand
        InboxflowCommand parent;

        @Parameters(index = "0", description = "Task id, e.g. task-20250101-120000-1a2b3c4d")
        String taskId;

        @Override
        public Integer call() {
            if (parent.vaultMissing()) {
                return 1;
            }
            Task task;
            try {
                task = parent.runtime().requeue(taskId);
            } catch (IllegalArgumentException | IllegalStateException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("taskId", task.id());
            out.put("status", task.status().wireName());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "rebuild-ledger", description = "Rebuild .watcher-state.json from the task records")
    static final class RebuildLedgerCommand implements Callable<Integer> {
        @ParentCommand
        InboxflowCommand parent;

        @Override
        public Integer call() {
            if (parent.vaultMissing()) {
                return 1;
            }
            int count = parent.runtime().rebuildLedger();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("processedFiles", count);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }
}
