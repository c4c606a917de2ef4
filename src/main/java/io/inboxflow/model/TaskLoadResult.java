package io.inboxflow.model;

import java.nio.file.Path;

public record TaskLoadResult(Kind kind, Path path, Task task, String message, Throwable cause) {
    public enum Kind { LOADED, MISSING, CORRUPTED, IO_ERROR }

    public static TaskLoadResult loaded(Path path, Task task) {
        return new TaskLoadResult(Kind.LOADED, path, task, null, null);
    }

    public static TaskLoadResult missing(Path path) {
        return new TaskLoadResult(Kind.MISSING, path, null, "task record not found: " + path, null);
    }

    public static TaskLoadResult corrupted(Path path, String message, Throwable cause) {
        return new TaskLoadResult(Kind.CORRUPTED, path, null, message, cause);
    }

    public static TaskLoadResult ioError(Path path, Throwable cause) {
        return new TaskLoadResult(Kind.IO_ERROR, path, null, "failed to read task record: " + path, cause);
    }
}
