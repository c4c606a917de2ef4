package io.inboxflow.runtime;

import io.inboxflow.config.VaultConfig;
import io.inboxflow.storage.TaskRecordException;
import io.inboxflow.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes Inbox files whose task has reached the done store. A file qualifies only when the
 * ledger lists it and a done record names it as its original file.
 */
public final class InboxCleaner {
    private final VaultConfig config;
    private final TaskStore store;
    private final Logger log;

    public InboxCleaner(VaultConfig config, TaskStore store) {
        this(config, store, LoggerFactory.getLogger(InboxCleaner.class));
    }

    public InboxCleaner(VaultConfig config, TaskStore store, Logger log) {
        this.config = config;
        this.store = store;
        this.log = log;
    }

    public CleanupReport cleanup(Set<String> processedFilenames, boolean execute) {
        Set<String> doneOriginals = doneOriginalNames();
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(config.inboxDir())) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (!Files.isRegularFile(file) || name.equals(".gitkeep") || !processedFilenames.contains(name)) {
                    continue;
                }
                if (doneOriginals.contains(name)) {
                    candidates.add(file);
                } else {
                    log.warn("File processed but task not in Done: {}", name);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list inbox: " + config.inboxDir(), e);
        }
        candidates.sort(null);

        List<String> removed = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Path file : candidates) {
            String name = file.getFileName().toString();
            if (!execute) {
                log.info("[DRY RUN] Would delete: {}", name);
                removed.add(name);
                continue;
            }
            try {
                Files.deleteIfExists(file);
                log.info("Deleted: {}", name);
                removed.add(name);
            } catch (IOException e) {
                log.error("Failed to delete {}: {}", name, e.getMessage());
                failures.put(name, e.getMessage());
            }
        }
        return new CleanupReport(!execute, candidates.size(), removed, failures);
    }

    private Set<String> doneOriginalNames() {
        Set<String> names = new HashSet<>();
        for (Path record : store.listDone()) {
            try {
                Map<String, Object> header = store.format().header(Files.readString(record, StandardCharsets.UTF_8));
                Object original = header.get("original_file");
                if (original instanceof Map) {
                    Object name = ((Map<?, ?>) original).get("name");
                    if (name != null) {
                        names.add(String.valueOf(name));
                    }
                }
            } catch (IOException | TaskRecordException e) {
                log.warn("Error reading {}: {}", record.getFileName(), e.getMessage());
            }
        }
        return names;
    }

    public record CleanupReport(boolean dryRun, int total, List<String> files, Map<String, String> errors) {
        public CleanupReport {
            files = List.copyOf(files);
            errors = Map.copyOf(errors);
        }

        public int deleted() {
            return files.size();
        }

        public int failed() {
            return errors.size();
        }
    }
}
