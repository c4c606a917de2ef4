package io.inboxflow.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class TaskLifecycleTest {
    private static Task newTask() {
        OriginalFile file = new OriginalFile("note.txt", ".txt", 12L, Instant.parse("2025-01-15T10:00:00Z"));
        return Task.newPending("task-1", "text_note", file, "hello", Instant.parse("2025-01-15T10:00:00Z"));
    }

    @Test
    void advancesThroughProcessingToCompleted() {
        Task task = newTask();
        task.startProcessing();
        assertEquals(TaskStatus.PROCESSING, task.status());

        task.complete("summary", new ProcessingMetadata("m", 1.5d, 10L));

        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals("summary", task.analysisBody());
        assertEquals(10L, task.processing().tokenCount());
    }

    @Test
    void pendingCannotFailOrCompleteDirectly() {
        Task task = newTask();
        assertThrows(IllegalStateException.class, () -> task.fail("boom"));
        assertThrows(IllegalStateException.class, () -> task.complete("x", null));
        assertEquals(TaskStatus.PENDING, task.status());
    }

    @Test
    void terminalStatesDoNotMove() {
        Task completed = newTask();
        completed.startProcessing();
        completed.complete("done", null);
        assertThrows(IllegalStateException.class, completed::startProcessing);
        assertThrows(IllegalStateException.class, () -> completed.fail("late"));
        assertThrows(IllegalStateException.class, completed::requeue);

        Task failed = newTask();
        failed.startProcessing();
        failed.fail("boom");
        assertThrows(IllegalStateException.class, failed::startProcessing);
        assertThrows(IllegalStateException.class, () -> failed.complete("x", null));
    }

    @Test
    void requeueOnlyFromFailedAndClearsError() {
        Task task = newTask();
        assertThrows(IllegalStateException.class, task::requeue);

        task.startProcessing();
        task.fail("summarizer down");
        assertEquals("summarizer down", task.error());

        task.requeue();

        assertEquals(TaskStatus.PENDING, task.status());
        assertNull(task.error());
    }

    @Test
    void flagsAreOrderedAndDeduplicated() {
        Task task = newTask();
        task.addFlags(List.of("b", "a", " b ", ""));
        task.addFlags(List.of("c", "a"));
        assertEquals(List.of("b", "a", "c"), task.flags());
    }

    @Test
    void blankIdIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Task.newPending(" ", "text_note", null, "", Instant.EPOCH));
    }
}
