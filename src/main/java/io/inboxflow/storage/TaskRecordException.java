package io.inboxflow.storage;

/**
 * A task record that exists but cannot be turned back into a task.
 */
public final class TaskRecordException extends RuntimeException {
    public TaskRecordException(String message) {
        super(message);
    }

    public TaskRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
