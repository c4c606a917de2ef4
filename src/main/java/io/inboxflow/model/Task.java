package io.inboxflow.model;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One ingested file and its progress through {@code pending -> processing -> completed|failed}.
 *
 * <p>Instances are short-lived: a component loads the task from its record, applies one or more
 * transitions and writes it back. The persisted record is authoritative between operations.
 */
public final class Task {
    public static final String ANALYSIS_PLACEHOLDER = "[To be generated by AI processing]";
    private static final int MAX_ERROR_CHARS = 500;

    private final String id;
    private final Instant createdAt;
    private final OriginalFile originalFile;
    private final String originalBody;
    private final Set<String> flags;
    private String type;
    private TaskStatus status;
    private String analysisBody;
    private ProcessingMetadata processing;
    private String error;

    private Task(
            String id,
            String type,
            TaskStatus status,
            Instant createdAt,
            OriginalFile originalFile,
            String originalBody,
            String analysisBody,
            ProcessingMetadata processing,
            String error,
            Collection<String> flags
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task id cannot be empty");
        }
        this.id = id;
        this.type = type;
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = createdAt;
        this.originalFile = originalFile;
        this.originalBody = originalBody == null ? "" : originalBody;
        this.analysisBody = analysisBody;
        this.processing = processing;
        this.error = error;
        this.flags = new LinkedHashSet<>();
        if (flags != null) {
            addFlags(flags);
        }
    }

    public static Task newPending(String id, String type, OriginalFile originalFile, String originalBody, Instant createdAt) {
        return new Task(id, type, TaskStatus.PENDING, createdAt, originalFile, originalBody, null, null, null, List.of());
    }

    /**
     * Rebuilds a task from its persisted representation without running any transition checks.
     */
    public static Task restore(
            String id,
            String type,
            TaskStatus status,
            Instant createdAt,
            OriginalFile originalFile,
            String originalBody,
            String analysisBody,
            ProcessingMetadata processing,
            String error,
            Collection<String> flags
    ) {
        return new Task(id, type, status, createdAt, originalFile, originalBody, analysisBody, processing, error, flags);
    }

    public void startProcessing() {
        advance(TaskStatus.PROCESSING);
    }

    public void complete(String analysis, ProcessingMetadata metadata) {
        if (analysis == null || analysis.isBlank()) {
            throw new IllegalArgumentException("analysis cannot be empty for task " + id);
        }
        advance(TaskStatus.COMPLETED);
        this.analysisBody = analysis;
        this.processing = metadata;
        this.error = null;
    }

    public void fail(String diagnostic) {
        advance(TaskStatus.FAILED);
        this.error = shorten(diagnostic);
    }

    /**
     * Operator-initiated resubmission of a failed task.
     */
    public void requeue() {
        if (status != TaskStatus.FAILED) {
            throw new IllegalStateException("Only failed tasks can be re-queued: " + id + " is " + status.wireName());
        }
        status = TaskStatus.PENDING;
        error = null;
    }

    public void addFlags(Collection<String> newFlags) {
        for (String flag : newFlags) {
            if (flag != null && !flag.isBlank()) {
                flags.add(flag.trim());
            }
        }
    }

    public void categorize(String category) {
        if (category != null && !category.isBlank()) {
            this.type = category.trim();
        }
    }

    private void advance(TaskStatus next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition for task " + id + ": " + status.wireName() + " -> " + next.wireName()
            );
        }
        status = next;
    }

    private static String shorten(String diagnostic) {
        String value = diagnostic == null || diagnostic.isBlank() ? "unknown error" : diagnostic.trim();
        return value.length() <= MAX_ERROR_CHARS ? value : value.substring(0, MAX_ERROR_CHARS);
    }

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public OriginalFile originalFile() {
        return originalFile;
    }

    public String originalBody() {
        return originalBody;
    }

    public String analysisBody() {
        return analysisBody;
    }

    public ProcessingMetadata processing() {
        return processing;
    }

    public String error() {
        return error;
    }

    public List<String> flags() {
        return List.copyOf(flags);
    }

    public String displayName() {
        return originalFile == null || originalFile.name() == null || originalFile.name().isBlank()
                ? "Unknown"
                : originalFile.name();
    }
}
