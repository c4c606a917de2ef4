package io.inboxflow.creator;

import io.inboxflow.content.ContentExtractor;
import io.inboxflow.content.FileContentExtractor;
import io.inboxflow.model.CreationResult;
import io.inboxflow.model.OriginalFile;
import io.inboxflow.model.Task;
import io.inboxflow.model.TaskStatus;
import io.inboxflow.storage.LedgerEntry;
import io.inboxflow.storage.LedgerStore;
import io.inboxflow.storage.TaskRecordException;
import io.inboxflow.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class FileTaskCreator implements TaskCreator {
    private static final DateTimeFormatter ID_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final LedgerStore ledger;
    private final TaskStore store;
    private final ContentExtractor extractor;
    private final Clock clock;
    private final Logger log;

    public FileTaskCreator(LedgerStore ledger, TaskStore store, ContentExtractor extractor) {
        this(ledger, store, extractor, Clock.systemUTC(), LoggerFactory.getLogger(FileTaskCreator.class));
    }

    public FileTaskCreator(LedgerStore ledger, TaskStore store, ContentExtractor extractor, Clock clock, Logger log) {
        this.ledger = ledger;
        this.store = store;
        this.extractor = extractor;
        this.clock = clock;
        this.log = log;
        this.ledger.load();
    }

    @Override
    public synchronized CreationResult createFromFile(Path file) {
        String filename = file.getFileName().toString();
        if (ledger.read(l -> l.contains(filename))) {
            log.debug("Skipping {}: already processed", filename);
            return CreationResult.alreadyProcessed(filename);
        }

        long size;
        String content;
        try {
            size = Files.size(file);
            content = extractor.extract(file);
        } catch (NoSuchFileException e) {
            return CreationResult.permanentError(CreationResult.PermanentReason.FILE_MISSING,
                    "file not found: " + filename, e);
        } catch (AccessDeniedException e) {
            return CreationResult.permanentError(CreationResult.PermanentReason.PERMISSION_DENIED,
                    "permission denied: " + filename, e);
        } catch (IOException e) {
            return CreationResult.transientError("failed to read " + filename + ": " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        OriginalFile original = new OriginalFile(filename, FileContentExtractor.extensionOf(file), size, now);
        Task task = Task.newPending(newTaskId(now), extractor.initialType(file), original, content, now);
        try {
            store.writePending(task);
        } catch (IOException e) {
            return CreationResult.transientError("failed to write task for " + filename + ": " + e.getMessage(), e);
        }

        boolean recorded;
        try {
            recorded = ledger.update(l -> {
                if (!l.append(new LedgerEntry(filename, now.toString(), task.id()))) {
                    return false;
                }
                l.addPending(task.id());
                l.touchScan(now.toString());
                return true;
            });
        } catch (IOException e) {
            // The task file exists; retrying would write a second one.
            log.error("Task {} written for {} but the ledger could not be saved: {}", task.id(), filename, e.getMessage());
            return CreationResult.permanentError(CreationResult.PermanentReason.LEDGER_WRITE_FAILED, task,
                    "ledger write failed after creating " + task.id(), e);
        }
        if (!recorded) {
            log.info("{} was recorded by another process meanwhile; discarding {}", filename, task.id());
            discard(task);
            return CreationResult.alreadyProcessed(filename);
        }
        log.info("Created task {} from {}", task.id(), filename);
        return CreationResult.created(task);
    }

    @Override
    public void markCompleted(String taskId) {
        try {
            ledger.update(l -> {
                if (!l.removePending(taskId)) {
                    return false;
                }
                l.touchScan(clock.instant().toString());
                return true;
            });
        } catch (IOException e) {
            log.warn("Could not save ledger after completing {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Puts a re-queued task back into the ledger's pending bookkeeping.
     */
    public void trackPending(String taskId) {
        try {
            ledger.update(l -> l.addPending(taskId));
        } catch (IOException e) {
            log.warn("Could not save ledger after re-queueing {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Re-derives the ledger from every task record in the pending, done and quarantine stores.
     *
     * @return number of source files now in the ledger
     */
    public synchronized int rebuildLedger() {
        List<LedgerEntry> entries = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        List<Path> records = new ArrayList<>(store.listPending());
        records.addAll(store.listDone());
        records.addAll(store.listQuarantined());
        for (Path record : records) {
            Map<String, Object> header;
            try {
                header = store.format().header(Files.readString(record, StandardCharsets.UTF_8));
            } catch (IOException | TaskRecordException e) {
                log.warn("Skipping unreadable task record {}: {}", record.getFileName(), e.getMessage());
                continue;
            }
            Object id = header.get("id");
            Object original = header.get("original_file");
            if (!(id instanceof String) || !(original instanceof Map)) {
                continue;
            }
            Object name = ((Map<?, ?>) original).get("name");
            if (name == null || String.valueOf(name).isBlank()) {
                continue;
            }
            Object created = header.get("created");
            entries.add(new LedgerEntry(String.valueOf(name), created == null ? null : String.valueOf(created), (String) id));
            Object status = header.get("status");
            boolean open = TaskStatus.PENDING.wireName().equals(status) || TaskStatus.PROCESSING.wireName().equals(status);
            if (open && record.getParent().equals(store.pendingPath((String) id).getParent())) {
                pending.add((String) id);
            }
        }
        try {
            ledger.update(l -> {
                l.clear();
                for (LedgerEntry entry : entries) {
                    l.append(entry);
                }
                for (String id : pending) {
                    l.addPending(id);
                }
                l.touchScan(clock.instant().toString());
                return true;
            });
        } catch (IOException e) {
            throw new RuntimeException("Failed to write rebuilt ledger: " + ledger.path(), e);
        }
        int count = ledger.read(l -> l.entries().size());
        log.info("Rebuilt ledger with {} processed files from {} task records", count, records.size());
        return count;
    }

    public List<String> processedFilenames() {
        return ledger.read(l -> {
            List<String> names = new ArrayList<>();
            for (LedgerEntry entry : l.entries()) {
                names.add(entry.sourceFilename());
            }
            return names;
        });
    }

    private void discard(Task task) {
        try {
            Files.deleteIfExists(store.pendingPath(task.id()));
        } catch (IOException e) {
            log.warn("Could not remove duplicate task record {}: {}", task.id(), e.getMessage());
        }
    }

    private String newTaskId(Instant now) {
        String stamp = ID_STAMP.format(now);
        while (true) {
            String id = "task-" + stamp + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
            if (store.locate(id).isEmpty()) {
                return id;
            }
        }
    }
}
