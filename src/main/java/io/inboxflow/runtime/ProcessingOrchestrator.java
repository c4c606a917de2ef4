package io.inboxflow.runtime;

import io.inboxflow.creator.TaskCreator;
import io.inboxflow.model.ProcessingMetadata;
import io.inboxflow.model.Task;
import io.inboxflow.model.TaskLoadResult;
import io.inboxflow.model.TaskStatus;
import io.inboxflow.observability.ErrorRecorder;
import io.inboxflow.rules.FlagEvaluator;
import io.inboxflow.rules.FlagRuleParser;
import io.inboxflow.rules.RuleLoader;
import io.inboxflow.rules.RuleSet;
import io.inboxflow.stats.StatisticsAggregator;
import io.inboxflow.storage.TaskStore;
import io.inboxflow.summarize.Summarizer;
import io.inboxflow.summarize.SummaryResult;
import io.inboxflow.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Runs one batch over the pending store. Tasks are handled one at a time and a failure in one
 * never stops the others.
 */
public final class ProcessingOrchestrator {
    static final String INTERRUPTED = "processing interrupted";

    private final TaskStore store;
    private final RuleLoader ruleLoader;
    private final FlagEvaluator flagEvaluator;
    private final Summarizer summarizer;
    private final TaskCreator creator;
    private final StatisticsAggregator stats;
    private final ErrorRecorder errors;
    private final Clock clock;
    private final Logger log;

    public ProcessingOrchestrator(
            TaskStore store,
            RuleLoader ruleLoader,
            Summarizer summarizer,
            TaskCreator creator,
            StatisticsAggregator stats,
            ErrorRecorder errors
    ) {
        this(store, ruleLoader, new FlagEvaluator(), summarizer, creator, stats, errors, Clock.systemUTC(),
                LoggerFactory.getLogger(ProcessingOrchestrator.class));
    }

    public ProcessingOrchestrator(
            TaskStore store,
            RuleLoader ruleLoader,
            FlagEvaluator flagEvaluator,
            Summarizer summarizer,
            TaskCreator creator,
            StatisticsAggregator stats,
            ErrorRecorder errors,
            Clock clock,
            Logger log
    ) {
        this.store = store;
        this.ruleLoader = ruleLoader;
        this.flagEvaluator = flagEvaluator;
        this.summarizer = summarizer;
        this.creator = creator;
        this.stats = stats;
        this.errors = errors;
        this.clock = clock;
        this.log = log;
    }

    public BatchOutcome processBatch() {
        int succeeded = 0;
        int failed = 0;
        try {
            List<Path> records = store.listPending();
            if (records.isEmpty()) {
                log.info("No pending tasks to process");
            } else {
                log.info("Found {} pending tasks", records.size());
                RuleSet rules = loadRules();
                for (Path record : records) {
                    switch (processOne(record, rules)) {
                        case SUCCEEDED:
                            succeeded++;
                            break;
                        case FAILED:
                            failed++;
                            break;
                        default:
                            break;
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Batch aborted while listing pending tasks: {}", e.getMessage(), e);
            errors.record("Batch aborted while listing pending tasks", e);
        }
        try {
            stats.recompute();
            stats.render();
        } catch (RuntimeException e) {
            log.error("Failed to refresh dashboard after batch: {}", e.getMessage(), e);
        }
        log.info("Processing complete: {} succeeded, {} failed", succeeded, failed);
        return new BatchOutcome(succeeded, failed);
    }

    private RuleSet loadRules() {
        try {
            RuleSet rules = ruleLoader.loadRules();
            log.info("Loaded handbook rules");
            return rules;
        } catch (RuntimeException e) {
            log.warn("Could not load handbook rules, using defaults: {}", e.getMessage());
            return RuleSet.defaults(new FlagRuleParser());
        }
    }

    private Disposition processOne(Path record, RuleSet rules) {
        Task task = null;
        try {
            TaskLoadResult loaded = store.load(record);
            switch (loaded.kind()) {
                case MISSING:
                    log.warn("Task record vanished before processing: {}", record);
                    return Disposition.SKIPPED;
                case IO_ERROR:
                    log.error("Failed to read task record {}: {}", record, loaded.cause().getMessage());
                    errors.record("Failed to read task record: " + record, loaded.cause());
                    return Disposition.FAILED;
                case CORRUPTED:
                    quarantine(record, loaded);
                    return Disposition.FAILED;
                default:
                    break;
            }
            task = loaded.task();
            switch (task.status()) {
                case FAILED:
                    log.debug("Skipping failed task {} until it is re-queued", task.id());
                    return Disposition.SKIPPED;
                case COMPLETED:
                    relocate(task, record);
                    return Disposition.SKIPPED;
                case PROCESSING:
                    return failInterrupted(task, record);
                default:
                    return process(task, record, rules);
            }
        } catch (Exception e) {
            log.error("Unexpected error processing {}: {}", record, e.getMessage(), e);
            errors.record("Unexpected error processing task: " + record, e);
            markFailedBestEffort(task, record, e);
            return Disposition.FAILED;
        }
    }

    private Disposition process(Task task, Path record, RuleSet rules) throws IOException {
        log.info("Processing: {}", record.getFileName());
        task.startProcessing();
        store.save(task, record);

        List<String> flags = evaluateFlags(rules, task);
        if (!flags.isEmpty()) {
            task.addFlags(flags);
            log.info("Applied flags to {}: {}", task.id(), String.join(", ", flags));
        }

        long startedAt = clock.millis();
        SummaryResult result;
        Exception failure = null;
        try {
            result = summarizer.summarize(task.originalBody(), rules, task.flags());
            if (result == null) {
                result = SummaryResult.fail("summarizer returned no result");
            }
        } catch (Exception e) {
            failure = e;
            result = SummaryResult.fail(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        double durationSeconds = (clock.millis() - startedAt) / 1000d;

        if (!result.success() || result.text() == null || result.text().isBlank()) {
            String error = result.error() == null ? "summarizer returned an empty analysis" : result.error();
            log.error("Failed to generate analysis for {}: {}", task.id(), error);
            task.fail(error);
            store.save(task, record);
            if (failure != null) {
                errors.record("Analysis failed for task " + task.id(), failure);
            } else {
                errors.record("Analysis failed for task " + task.id(), "SummarizerFailure", error);
            }
            stats.bumpFailed();
            stats.recordActivity(task, "Failed: " + Texts.truncate(error, 30));
            return Disposition.FAILED;
        }

        task.addFlags(result.flags());
        task.categorize(result.category());
        String model = result.model() == null ? summarizer.id() : result.model();
        task.complete(result.text(), new ProcessingMetadata(model, durationSeconds, result.tokens()));
        store.save(task, record);
        relocate(task, record);
        creator.markCompleted(task.id());
        stats.bumpCompleted();
        stats.recordActivity(task, "Task completed successfully");
        log.info("Completed: {}", task.id());
        return Disposition.SUCCEEDED;
    }

    private List<String> evaluateFlags(RuleSet rules, Task task) {
        try {
            return flagEvaluator.evaluate(rules.flagRules(), task.originalBody(), LocalDate.now(clock));
        } catch (RuntimeException e) {
            log.warn("Flag evaluation failed for {}: {}", task.id(), e.getMessage());
            return List.of();
        }
    }

    private Disposition failInterrupted(Task task, Path record) throws IOException {
        log.warn("Task {} was left in processing by an earlier run; marking it failed", task.id());
        task.fail(INTERRUPTED);
        store.save(task, record);
        errors.record("Task " + task.id() + " found in processing state", "ProcessingInterrupted", INTERRUPTED);
        stats.bumpFailed();
        stats.recordActivity(task, "Failed: " + INTERRUPTED);
        return Disposition.FAILED;
    }

    private void relocate(Task task, Path record) {
        try {
            store.moveToDone(record, task);
        } catch (IOException e) {
            log.warn("Task {} processed but not moved to Done/: {}", task.id(), e.getMessage());
        }
    }

    private void quarantine(Path record, TaskLoadResult loaded) {
        log.error("Failed to load task file {}: {}", record, loaded.message());
        try {
            Path moved = store.quarantine(record);
            log.info("Moved corrupted task to: {}", moved);
        } catch (IOException e) {
            log.error("Failed to move corrupted task {}: {}", record, e.getMessage());
        }
        if (loaded.cause() != null) {
            errors.record("Corrupted task file: " + record, loaded.cause());
        } else {
            errors.record("Corrupted task file: " + record, "CorruptedTask", loaded.message());
        }
    }

    private void markFailedBestEffort(Task task, Path record, Exception cause) {
        if (task == null || task.status().isTerminal() || task.status() == TaskStatus.PENDING) {
            return;
        }
        try {
            task.fail(cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
            store.save(task, record);
            stats.bumpFailed();
            stats.recordActivity(task, "Failed: " + Texts.truncate(task.error(), 30));
        } catch (IOException | RuntimeException e) {
            log.warn("Could not mark task {} failed: {}", task.id(), e.getMessage());
        }
    }

    private enum Disposition { SUCCEEDED, FAILED, SKIPPED }

    public record BatchOutcome(int succeeded, int failed) {
    }
}
