package io.inboxflow.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public final class VaultConfig {
    public static final String DEFAULT_VAULT_DIR = "vault";
    public static final String INBOX_DIR = "Inbox";
    public static final String PENDING_DIR = "Needs_Action";
    public static final String DONE_DIR = "Done";
    public static final String LOGS_DIR = "Logs";
    public static final String QUARANTINE_DIR = "failed";
    public static final String APPROVAL_DIR = "Pending_Approval";
    public static final String LEDGER_FILE = ".watcher-state.json";
    public static final String DASHBOARD_FILE = "Dashboard.md";
    public static final String HANDBOOK_FILE = "Company_Handbook.md";
    public static final String SETTINGS_FILE = "inboxflow-settings.json";

    private final Path rootDir;

    public VaultConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static VaultConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_VAULT_DIR)
                : Paths.get(root);
        return new VaultConfig(resolved.toAbsolutePath().normalize());
    }

    public static VaultConfig fromRoot(Path root) {
        return new VaultConfig(root.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path inboxDir() {
        return rootDir.resolve(INBOX_DIR);
    }

    public Path pendingDir() {
        return rootDir.resolve(PENDING_DIR);
    }

    public Path doneDir() {
        return rootDir.resolve(DONE_DIR);
    }

    public Path logsDir() {
        return rootDir.resolve(LOGS_DIR);
    }

    public Path quarantineDir() {
        return logsDir().resolve(QUARANTINE_DIR);
    }

    public Path approvalDir() {
        return rootDir.resolve(APPROVAL_DIR);
    }

    public Path ledgerFile() {
        return rootDir.resolve(LEDGER_FILE);
    }

    public Path dashboardFile() {
        return rootDir.resolve(DASHBOARD_FILE);
    }

    public Path handbookFile() {
        return rootDir.resolve(HANDBOOK_FILE);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public List<Path> requiredDirectories() {
        return List.of(inboxDir(), pendingDir(), doneDir(), logsDir());
    }

    /**
     * Directories the pipeline expects that are absent; empty when the vault is usable.
     */
    public List<Path> missingDirectories() {
        List<Path> missing = new ArrayList<>();
        if (!Files.isDirectory(rootDir)) {
            missing.add(rootDir);
            return missing;
        }
        for (Path dir : requiredDirectories()) {
            if (!Files.isDirectory(dir)) {
                missing.add(dir);
            }
        }
        return missing;
    }
}
