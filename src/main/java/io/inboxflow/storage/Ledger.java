package io.inboxflow.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory view of {@code .watcher-state.json}. Only {@link LedgerStore} hands these out, and
 * only while holding its lock.
 */
public final class Ledger {
    public static final String CURRENT_VERSION = "1.0.0";

    private final Map<String, LedgerEntry> entriesByFilename;
    private final Set<String> pendingTaskIds;
    private String lastScanTimestamp;
    private String version;

    Ledger() {
        this.entriesByFilename = new LinkedHashMap<>();
        this.pendingTaskIds = new LinkedHashSet<>();
        this.version = CURRENT_VERSION;
    }

    static Ledger fromDocument(Document document) {
        Ledger ledger = new Ledger();
        if (document == null) {
            return ledger;
        }
        ledger.lastScanTimestamp = document.lastScanTimestamp();
        ledger.version = document.version() == null || document.version().isBlank()
                ? CURRENT_VERSION
                : document.version();
        if (document.processedFiles() != null) {
            for (LedgerEntry entry : document.processedFiles()) {
                if (entry != null && entry.sourceFilename() != null && !entry.sourceFilename().isBlank()) {
                    ledger.entriesByFilename.putIfAbsent(entry.sourceFilename(), entry);
                }
            }
        }
        if (document.pendingTaskIds() != null) {
            for (String id : document.pendingTaskIds()) {
                if (id != null && !id.isBlank()) {
                    ledger.pendingTaskIds.add(id);
                }
            }
        }
        return ledger;
    }

    Document toDocument() {
        return new Document(
                lastScanTimestamp,
                new ArrayList<>(entriesByFilename.values()),
                new ArrayList<>(pendingTaskIds),
                version
        );
    }

    public Optional<LedgerEntry> find(String sourceFilename) {
        return Optional.ofNullable(entriesByFilename.get(sourceFilename));
    }

    public boolean contains(String sourceFilename) {
        return entriesByFilename.containsKey(sourceFilename);
    }

    /**
     * @return false when the filename already has an entry; the existing entry is kept
     */
    public boolean append(LedgerEntry entry) {
        return entriesByFilename.putIfAbsent(entry.sourceFilename(), entry) == null;
    }

    public boolean addPending(String taskId) {
        return pendingTaskIds.add(taskId);
    }

    public boolean removePending(String taskId) {
        return pendingTaskIds.remove(taskId);
    }

    public void touchScan(String timestamp) {
        this.lastScanTimestamp = timestamp;
    }

    public void clear() {
        entriesByFilename.clear();
        pendingTaskIds.clear();
    }

    public List<LedgerEntry> entries() {
        return List.copyOf(entriesByFilename.values());
    }

    public List<String> pendingTaskIds() {
        return List.copyOf(pendingTaskIds);
    }

    public String lastScanTimestamp() {
        return lastScanTimestamp;
    }

    public String version() {
        return version;
    }

    record Document(
            @JsonProperty("lastScanTimestamp") String lastScanTimestamp,
            @JsonProperty("processedFiles") List<LedgerEntry> processedFiles,
            @JsonProperty("pendingTaskIds") List<String> pendingTaskIds,
            @JsonProperty("version") String version
    ) {
    }
}
