package io.inboxflow.runtime;

import io.inboxflow.codec.YamlFrontmatterCodec;
import io.inboxflow.config.PipelineSettings;
import io.inboxflow.config.VaultConfig;
import io.inboxflow.content.FileContentExtractor;
import io.inboxflow.creator.FileTaskCreator;
import io.inboxflow.model.Task;
import io.inboxflow.model.TaskLoadResult;
import io.inboxflow.observability.ErrorRecorder;
import io.inboxflow.rules.FlagEvaluator;
import io.inboxflow.rules.HandbookRuleLoader;
import io.inboxflow.stats.DashboardRenderer;
import io.inboxflow.stats.Report;
import io.inboxflow.stats.StatisticsAggregator;
import io.inboxflow.storage.LedgerStore;
import io.inboxflow.storage.TaskRecordFormat;
import io.inboxflow.storage.TaskStore;
import io.inboxflow.summarize.ScriptSummarizer;
import io.inboxflow.summarize.Summarizer;
import io.inboxflow.summarize.TemplateSummarizer;
import io.inboxflow.watch.DebounceFilter;
import io.inboxflow.watch.InboxHandler;
import io.inboxflow.watch.InboxWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Wires the pipeline components for one vault. Each CLI invocation builds one runtime.
 */
public final class InboxflowRuntime {
    static final String DEFAULT_HANDBOOK_RESOURCE = "/default-handbook.md";
    private static final Logger LOG = LoggerFactory.getLogger(InboxflowRuntime.class);

    private final VaultConfig config;
    private final PipelineSettings settings;
    private final Clock clock;
    private final TaskStore taskStore;
    private final LedgerStore ledgerStore;
    private final ErrorRecorder errorRecorder;
    private final StatisticsAggregator statistics;
    private final Summarizer summarizer;
    private FileTaskCreator creator;

    public InboxflowRuntime(VaultConfig config) {
        this(config, PipelineSettings.load(config.settingsFile()), null, Clock.systemUTC());
    }

    /**
     * @param summarizer analysis backend; when null one is chosen from the settings
     */
    public InboxflowRuntime(VaultConfig config, PipelineSettings settings, Summarizer summarizer, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.taskStore = new TaskStore(config, new TaskRecordFormat(new YamlFrontmatterCodec()));
        this.ledgerStore = new LedgerStore(config.ledgerFile(), clock, LoggerFactory.getLogger(LedgerStore.class));
        this.errorRecorder = new ErrorRecorder(config.logsDir(), clock, LoggerFactory.getLogger(ErrorRecorder.class));
        this.statistics = new StatisticsAggregator(config, taskStore, errorRecorder, new DashboardRenderer(), clock,
                LoggerFactory.getLogger(StatisticsAggregator.class));
        this.summarizer = summarizer != null ? summarizer : defaultSummarizer(settings);
    }

    public InitOutcome init() {
        List<String> created = new ArrayList<>();
        List<String> existing = new ArrayList<>();
        List<Path> dirs = new ArrayList<>(config.requiredDirectories());
        dirs.add(config.approvalDir());
        try {
            for (Path dir : dirs) {
                (Files.isDirectory(dir) ? existing : created).add(config.rootDir().relativize(dir) + "/");
                Files.createDirectories(dir);
            }
            if (Files.exists(config.handbookFile())) {
                existing.add(VaultConfig.HANDBOOK_FILE);
            } else {
                Files.writeString(config.handbookFile(), defaultHandbook(), StandardCharsets.UTF_8);
                created.add(VaultConfig.HANDBOOK_FILE);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize vault: " + config.rootDir(), e);
        }
        if (Files.exists(config.dashboardFile())) {
            existing.add(VaultConfig.DASHBOARD_FILE);
        } else {
            statistics.recompute();
            if (!statistics.render()) {
                throw new IllegalStateException("Failed to write " + config.dashboardFile());
            }
            created.add(VaultConfig.DASHBOARD_FILE);
        }
        LOG.info("Initialized vault at {}", config.rootDir());
        return new InitOutcome(config.rootDir().toString(), created, existing);
    }

    public List<Path> missingDirectories() {
        return config.missingDirectories();
    }

    public InboxWatcher watcher(boolean scanOnStart) {
        InboxHandler handler = new InboxHandler(
                settings,
                creator(),
                errorRecorder,
                new DebounceFilter(clock, settings.debounceMs())
        );
        return new InboxWatcher(config.inboxDir(), handler, settings.watchPollMs(), scanOnStart);
    }

    public ProcessingOrchestrator.BatchOutcome processBatch() {
        statistics.load();
        ProcessingOrchestrator orchestrator = new ProcessingOrchestrator(
                taskStore,
                new HandbookRuleLoader(config.handbookFile()),
                new FlagEvaluator(),
                summarizer,
                creator(),
                statistics,
                errorRecorder,
                clock,
                LoggerFactory.getLogger(ProcessingOrchestrator.class)
        );
        return orchestrator.processBatch();
    }

    public Report rebuildDashboard() {
        statistics.load();
        Report report = statistics.recompute();
        if (!statistics.render()) {
            throw new IllegalStateException("Failed to write " + config.dashboardFile());
        }
        return report;
    }

    public InboxCleaner.CleanupReport cleanupInbox(boolean execute) {
        return new InboxCleaner(config, taskStore).cleanup(new LinkedHashSet<>(creator().processedFilenames()), execute);
    }

    /**
     * Returns a failed task to the pending store.
     *
     * @throws IllegalArgumentException when no readable record exists for the id
     * @throws IllegalStateException when the task is not failed
     */
    public Task requeue(String taskId) {
        Optional<Path> location = taskStore.locate(taskId);
        if (location.isEmpty()) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        TaskLoadResult loaded = taskStore.load(location.get());
        if (loaded.kind() != TaskLoadResult.Kind.LOADED) {
            throw new IllegalArgumentException("Task record for " + taskId + " is unreadable: " + loaded.message());
        }
        Task task = loaded.task();
        task.requeue();
        try {
            taskStore.save(task, location.get());
            taskStore.moveToPending(location.get(), task);
        } catch (IOException e) {
            throw new RuntimeException("Failed to re-queue task: " + taskId, e);
        }
        creator().trackPending(taskId);
        LOG.info("Re-queued task {}", taskId);
        return task;
    }

    public int rebuildLedger() {
        return creator().rebuildLedger();
    }

    public VaultConfig config() {
        return config;
    }

    public PipelineSettings settings() {
        return settings;
    }

    private synchronized FileTaskCreator creator() {
        if (creator == null) {
            creator = new FileTaskCreator(ledgerStore, taskStore, new FileContentExtractor(), clock,
                    LoggerFactory.getLogger(FileTaskCreator.class));
        }
        return creator;
    }

    private static Summarizer defaultSummarizer(PipelineSettings settings) {
        if (settings.summarizerCommand().isEmpty()) {
            return new TemplateSummarizer();
        }
        return new ScriptSummarizer(settings.summarizerCommand(), settings.summarizerTimeoutMs());
    }

    private static String defaultHandbook() {
        try (InputStream in = InboxflowRuntime.class.getResourceAsStream(DEFAULT_HANDBOOK_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + DEFAULT_HANDBOOK_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read bundled handbook", e);
        }
    }

    public record InitOutcome(String root, List<String> created, List<String> existing) {
    }
}
