package io.inboxflow.model;

/**
 * Outcome of turning one Inbox file into a task. Callers branch on {@link #kind()}; the
 * watch layer retries {@link Kind#TRANSIENT_ERROR} only.
 */
public record CreationResult(Kind kind, Task task, PermanentReason reason, String message, Throwable cause) {
    public enum Kind { CREATED, ALREADY_PROCESSED, TRANSIENT_ERROR, PERMANENT_ERROR }

    public enum PermanentReason { FILE_MISSING, PERMISSION_DENIED, LEDGER_WRITE_FAILED }

    public static CreationResult created(Task task) {
        return new CreationResult(Kind.CREATED, task, null, null, null);
    }

    public static CreationResult alreadyProcessed(String sourceFilename) {
        return new CreationResult(Kind.ALREADY_PROCESSED, null, null, "already processed: " + sourceFilename, null);
    }

    public static CreationResult transientError(String message, Throwable cause) {
        return new CreationResult(Kind.TRANSIENT_ERROR, null, null, message, cause);
    }

    public static CreationResult permanentError(PermanentReason reason, String message, Throwable cause) {
        return new CreationResult(Kind.PERMANENT_ERROR, null, reason, message, cause);
    }

    public static CreationResult permanentError(PermanentReason reason, Task task, String message, Throwable cause) {
        return new CreationResult(Kind.PERMANENT_ERROR, task, reason, message, cause);
    }

    public boolean isCreated() {
        return kind == Kind.CREATED;
    }
}
