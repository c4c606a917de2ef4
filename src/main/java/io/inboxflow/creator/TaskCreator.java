package io.inboxflow.creator;

import io.inboxflow.model.CreationResult;

import java.nio.file.Path;

/**
 * The only component that writes new tasks and the processed-files ledger.
 */
public interface TaskCreator {
    /**
     * Creates at most one task per source filename, ever. Never throws for file or ledger problems;
     * those come back as a tagged {@link CreationResult}.
     */
    CreationResult createFromFile(Path file);

    /**
     * Drops the task from the ledger's pending bookkeeping. Calling it twice is harmless.
     */
    void markCompleted(String taskId);
}
