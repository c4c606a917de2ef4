package io.inboxflow.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.inboxflow.util.AtomicFiles;
import io.inboxflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Single-file store for the idempotency ledger. The whole document is loaded into memory and
 * written back in one atomic rename. {@link #update(Predicate)} re-reads the file before applying
 * a change, so entries written by another process sharing the vault (the watcher while a batch
 * runs) survive; only a write landing between that read and the rename can still be lost.
 */
public final class LedgerStore {
    private final Path ledgerFile;
    private final Clock clock;
    private final Logger log;
    private final Object lock;
    private Ledger ledger;

    public LedgerStore(Path ledgerFile) {
        this(ledgerFile, Clock.systemUTC(), LoggerFactory.getLogger(LedgerStore.class));
    }

    public LedgerStore(Path ledgerFile, Clock clock, Logger log) {
        this.ledgerFile = ledgerFile;
        this.clock = clock;
        this.log = log;
        this.lock = new Object();
        this.ledger = new Ledger();
    }

    /**
     * Replaces the in-memory ledger with the file contents. A missing file yields an empty
     * ledger; an unreadable or malformed one is set aside and also yields an empty ledger.
     */
    public void load() {
        synchronized (lock) {
            ledger = readFromDisk(new Ledger());
        }
    }

    public <T> T read(Function<Ledger, T> query) {
        synchronized (lock) {
            return query.apply(ledger);
        }
    }

    public void mutate(Consumer<Ledger> change) {
        synchronized (lock) {
            change.accept(ledger);
        }
    }

    /**
     * Re-reads the file, applies {@code change} and writes the result back, all under the store
     * lock. Nothing is written when {@code change} reports no difference. When the write fails the
     * in-memory ledger still holds the change.
     *
     * @param change returns true when the ledger was modified
     * @return whatever {@code change} returned
     */
    public boolean update(Predicate<Ledger> change) throws IOException {
        synchronized (lock) {
            Ledger current = readFromDisk(ledger);
            boolean modified = change.test(current);
            ledger = current;
            if (modified) {
                commitAtomically();
            }
            return modified;
        }
    }

    public void commitAtomically() throws IOException {
        synchronized (lock) {
            String json = Jsons.toJson(ledger.toDocument());
            AtomicFiles.writeString(ledgerFile, json + System.lineSeparator());
        }
    }

    public Path path() {
        return ledgerFile;
    }

    /**
     * @param unreadable returned when the file exists but cannot be read
     */
    private Ledger readFromDisk(Ledger unreadable) {
        if (!Files.exists(ledgerFile)) {
            return new Ledger();
        }
        String raw;
        try {
            raw = Files.readString(ledgerFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read ledger {}, keeping the copy in memory: {}", ledgerFile, e.getMessage());
            return unreadable;
        }
        if (raw.isBlank()) {
            return new Ledger();
        }
        try {
            Ledger.Document document = Jsons.mapper().readValue(raw, Ledger.Document.class);
            return Ledger.fromDocument(document);
        } catch (JsonProcessingException e) {
            Path backup = ledgerFile.resolveSibling(ledgerFile.getFileName() + ".corrupt-" + clock.millis());
            try {
                Files.move(ledgerFile, backup);
                log.warn("Malformed ledger {} moved to {}, starting empty: {}", ledgerFile, backup, e.getOriginalMessage());
            } catch (IOException moveError) {
                log.warn("Malformed ledger {} could not be set aside ({}), starting empty: {}",
                        ledgerFile, moveError.getMessage(), e.getOriginalMessage());
            }
            return new Ledger();
        }
    }
}
