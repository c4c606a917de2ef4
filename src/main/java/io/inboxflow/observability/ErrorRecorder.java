package io.inboxflow.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Writes one {@code error-<timestamp>.md} file per failure into the vault's log directory.
 * These records are what the statistics count as failures.
 */
public final class ErrorRecorder {
    public static final String FILE_PREFIX = "error-";
    public static final String FILE_SUFFIX = ".md";
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");
    private static final int MAX_NAME_COLLISIONS = 1_000;

    private final Path logsDir;
    private final Clock clock;
    private final Logger log;

    public ErrorRecorder(Path logsDir) {
        this(logsDir, Clock.systemDefaultZone(), LoggerFactory.getLogger(ErrorRecorder.class));
    }

    public ErrorRecorder(Path logsDir, Clock clock, Logger log) {
        this.logsDir = logsDir;
        this.clock = clock;
        this.log = log;
    }

    public Optional<Path> record(ErrorEvent event) {
        Instant now = clock.instant();
        String content = render(event, now);
        try {
            Files.createDirectories(logsDir);
            String stamp = FILE_STAMP.format(now.atZone(zone()));
            for (int i = 0; i < MAX_NAME_COLLISIONS; i++) {
                String name = FILE_PREFIX + stamp + (i == 0 ? "" : "-" + i) + FILE_SUFFIX;
                Path target = logsDir.resolve(name);
                try {
                    Files.writeString(target, content, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    return Optional.of(target);
                } catch (FileAlreadyExistsException ignored) {
                    // Same millisecond as an earlier record; try the next suffix.
                }
            }
            log.error("Could not find a free error record name for {} in {}", stamp, logsDir);
        } catch (IOException e) {
            log.error("Failed to write error record for '{}': {}", event.context(), e.getMessage(), e);
        }
        return Optional.empty();
    }

    public Optional<Path> record(String context, Throwable error) {
        return record(ErrorEvent.of(context, error));
    }

    public Optional<Path> record(String context, String errorType, String message) {
        return record(new ErrorEvent(context, errorType, message, null));
    }

    public long count() {
        if (!Files.isDirectory(logsDir)) {
            return 0L;
        }
        try (Stream<Path> stream = Files.list(logsDir)) {
            return stream.filter(Files::isRegularFile).filter(ErrorRecorder::isErrorRecord).count();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list error records in " + logsDir, e);
        }
    }

    public static boolean isErrorRecord(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(FILE_PREFIX) && name.endsWith(FILE_SUFFIX);
    }

    private String render(ErrorEvent event, Instant now) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Error Log\n\n");
        sb.append("**Timestamp**: ").append(now.atZone(zone()).toOffsetDateTime()).append('\n');
        sb.append("**Context**: ").append(event.context()).append("\n\n");
        sb.append("## Error Details\n\n");
        sb.append("**Type**: ").append(event.errorType()).append('\n');
        sb.append("**Message**: ").append(event.message()).append("\n\n");
        sb.append("## Stack Trace\n\n```\n");
        sb.append(event.stackTrace() == null || event.stackTrace().isBlank()
                ? "No stack trace available\n"
                : event.stackTrace());
        if (event.stackTrace() != null && !event.stackTrace().endsWith("\n")) {
            sb.append('\n');
        }
        sb.append("```\n\n");
        sb.append("## Resolution\n\n");
        sb.append("Check the error message above. Fix the source file or the vault and drop it into Inbox/ again, ");
        sb.append("or re-queue the task with `inboxflow requeue <task-id>`.\n");
        return sb.toString();
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    public record ErrorEvent(String context, String errorType, String message, String stackTrace) {
        public ErrorEvent {
            context = context == null || context.isBlank() ? "unspecified" : context.trim();
            errorType = errorType == null || errorType.isBlank() ? "Error" : errorType.trim();
            message = message == null || message.isBlank() ? "(no message)" : message.trim();
        }

        public static ErrorEvent of(String context, Throwable error) {
            if (error == null) {
                return new ErrorEvent(context, null, null, null);
            }
            StringWriter trace = new StringWriter();
            error.printStackTrace(new PrintWriter(trace));
            return new ErrorEvent(context, error.getClass().getSimpleName(), error.getMessage(), trace.toString());
        }
    }
}
