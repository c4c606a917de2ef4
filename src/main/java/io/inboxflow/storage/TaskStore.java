package io.inboxflow.storage;

import io.inboxflow.config.VaultConfig;
import io.inboxflow.model.Task;
import io.inboxflow.model.TaskLoadResult;
import io.inboxflow.util.AtomicFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Task records on disk. A record lives in exactly one of the pending store, the done store or
 * quarantine; moves between them are single rename calls.
 */
public final class TaskStore {
    public static final String RECORD_SUFFIX = ".md";

    private final VaultConfig config;
    private final TaskRecordFormat format;

    public TaskStore(VaultConfig config, TaskRecordFormat format) {
        this.config = config;
        this.format = format;
    }

    public Path writePending(Task task) throws IOException {
        Path target = pendingPath(task.id());
        if (Files.exists(target)) {
            throw new IOException("Task record already exists: " + target);
        }
        AtomicFiles.writeString(target, format.render(task));
        return target;
    }

    public void save(Task task, Path location) throws IOException {
        AtomicFiles.writeString(location, format.render(task));
    }

    public TaskLoadResult load(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return TaskLoadResult.missing(path);
        } catch (IOException e) {
            return TaskLoadResult.ioError(path, e);
        }
        try {
            return TaskLoadResult.loaded(path, format.parse(content));
        } catch (TaskRecordException e) {
            return TaskLoadResult.corrupted(path, e.getMessage(), e);
        }
    }

    public Path moveToDone(Path current, Task task) throws IOException {
        Files.createDirectories(config.doneDir());
        Path target = donePath(task.id());
        AtomicFiles.move(current, target);
        return target;
    }

    public Path quarantine(Path current) throws IOException {
        Files.createDirectories(config.quarantineDir());
        Path target = config.quarantineDir().resolve(current.getFileName().toString());
        if (Files.exists(target)) {
            target = config.quarantineDir().resolve(System.currentTimeMillis() + "_" + current.getFileName());
        }
        AtomicFiles.move(current, target);
        return target;
    }

    /**
     * Moves a re-queued task back into the pending store when it is not already there.
     */
    public Path moveToPending(Path current, Task task) throws IOException {
        Path target = pendingPath(task.id());
        if (current.equals(target)) {
            return target;
        }
        Files.createDirectories(config.pendingDir());
        AtomicFiles.move(current, target);
        return target;
    }

    public Optional<Path> locate(String taskId) {
        for (Path candidate : List.of(pendingPath(taskId), donePath(taskId))) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public List<Path> listPending() {
        return listRecords(config.pendingDir());
    }

    public List<Path> listDone() {
        return listRecords(config.doneDir());
    }

    public List<Path> listQuarantined() {
        return listRecords(config.quarantineDir());
    }

    public Path pendingPath(String taskId) {
        return config.pendingDir().resolve(taskId + RECORD_SUFFIX);
    }

    public Path donePath(String taskId) {
        return config.doneDir().resolve(taskId + RECORD_SUFFIX);
    }

    public TaskRecordFormat format() {
        return format;
    }

    private static List<Path> listRecords(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + RECORD_SUFFIX)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list task records in " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}
