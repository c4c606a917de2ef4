package io.inboxflow.watch;

import io.inboxflow.config.PipelineSettings;
import io.inboxflow.content.FileContentExtractor;
import io.inboxflow.creator.TaskCreator;
import io.inboxflow.model.CreationResult;
import io.inboxflow.observability.ErrorRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns one creation notification for an Inbox file into at most one task-creation attempt
 * sequence. Every failure is handled here; nothing propagates to the watch loop.
 */
public final class InboxHandler {
    public enum Outcome {
        CREATED,
        ALREADY_PROCESSED,
        DIRECTORY,
        DEBOUNCED,
        VANISHED,
        UNSUPPORTED,
        OVERSIZED,
        UNREADABLE,
        FAILED
    }

    private final PipelineSettings settings;
    private final TaskCreator creator;
    private final ErrorRecorder errors;
    private final DebounceFilter debounce;
    private final Logger log;

    public InboxHandler(PipelineSettings settings, TaskCreator creator, ErrorRecorder errors, DebounceFilter debounce) {
        this(settings, creator, errors, debounce, LoggerFactory.getLogger(InboxHandler.class));
    }

    public InboxHandler(
            PipelineSettings settings,
            TaskCreator creator,
            ErrorRecorder errors,
            DebounceFilter debounce,
            Logger log
    ) {
        this.settings = settings;
        this.creator = creator;
        this.errors = errors;
        this.debounce = debounce;
        this.log = log;
    }

    public Outcome handle(Path file) {
        if (Files.isDirectory(file)) {
            return Outcome.DIRECTORY;
        }
        if (!debounce.accept(file)) {
            log.debug("Debounced duplicate event for {}", file);
            return Outcome.DEBOUNCED;
        }
        if (!Files.exists(file)) {
            log.warn("File no longer exists: {}", file);
            return Outcome.VANISHED;
        }
        String extension = FileContentExtractor.extensionOf(file);
        if (!settings.isAllowedExtension(extension)) {
            log.info("Skipping unsupported file type: {}", file);
            return Outcome.UNSUPPORTED;
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            log.error("Error checking file size for {}: {}", file, e.getMessage());
            return Outcome.UNREADABLE;
        }
        if (size > settings.maxFileSizeBytes()) {
            log.warn("File too large ({} > {} bytes): {}", size, settings.maxFileSizeBytes(), file);
            errors.record("File too large to process: " + file, "FileTooLarge",
                    "File exceeds " + settings.maxFileSizeBytes() + " byte size limit: " + file.getFileName());
            return Outcome.OVERSIZED;
        }

        try (InputStream in = Files.newInputStream(file)) {
            in.read();
        } catch (AccessDeniedException e) {
            log.error("Permission denied reading file: {}", file);
            errors.record("Permission denied: " + file, e);
            return Outcome.UNREADABLE;
        } catch (IOException e) {
            log.error("File not readable: {} - {}", file, e.getMessage());
            return Outcome.UNREADABLE;
        }

        return createWithRetry(file);
    }

    private Outcome createWithRetry(Path file) {
        int maxAttempts = settings.maxCreateAttempts();
        CreationResult last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            log.info("New file detected: {} (attempt {}/{})", file.getFileName(), attempt, maxAttempts);
            CreationResult result;
            try {
                result = creator.createFromFile(file);
            } catch (RuntimeException e) {
                result = CreationResult.transientError(e.getMessage(), e);
            }
            switch (result.kind()) {
                case CREATED:
                    log.info("Task created: {}", result.task().id());
                    return Outcome.CREATED;
                case ALREADY_PROCESSED:
                    return Outcome.ALREADY_PROCESSED;
                case PERMANENT_ERROR:
                    return handlePermanent(file, result);
                default:
                    last = result;
                    log.error("Error creating task for {} (attempt {}/{}): {}", file, attempt, maxAttempts, result.message());
                    if (attempt < maxAttempts && !pause()) {
                        return Outcome.FAILED;
                    }
            }
        }
        log.error("Failed to create task after {} attempts: {}", maxAttempts, file);
        String context = "Failed to create task from file after " + maxAttempts + " attempts: " + file;
        if (last != null && last.cause() != null) {
            errors.record(context, last.cause());
        } else {
            errors.record(context, "TransientError", last == null ? null : last.message());
        }
        return Outcome.FAILED;
    }

    private Outcome handlePermanent(Path file, CreationResult result) {
        switch (result.reason()) {
            case FILE_MISSING:
                log.error("File disappeared during processing: {}", file);
                return Outcome.VANISHED;
            case PERMISSION_DENIED:
                log.error("Permission error creating task: {} - {}", file, result.message());
                recordPermanent("Permission denied: " + file, result);
                return Outcome.UNREADABLE;
            default:
                log.error("Task creation failed permanently for {}: {}", file, result.message());
                recordPermanent("Task creation failed for " + file, result);
                return Outcome.FAILED;
        }
    }

    private void recordPermanent(String context, CreationResult result) {
        if (result.cause() != null) {
            errors.record(context, result.cause());
        } else {
            errors.record(context, result.reason().name(), result.message());
        }
    }

    private boolean pause() {
        long delay = settings.retryDelayMs();
        if (delay <= 0) {
            return true;
        }
        log.info("Retrying in {} ms...", delay);
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to retry; giving up on this file");
            return false;
        }
    }
}
