package io.inboxflow.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches the Inbox directory (non-recursively) on the calling thread until {@link #stop()} or an
 * interrupt. In-flight work is not drained on shutdown.
 */
public final class InboxWatcher {
    private final Path inboxDir;
    private final InboxHandler handler;
    private final long pollMs;
    private final boolean scanOnStart;
    private final Logger log;
    private final AtomicBoolean running;
    private final CountDownLatch stopped;

    public InboxWatcher(Path inboxDir, InboxHandler handler, long pollMs, boolean scanOnStart) {
        this(inboxDir, handler, pollMs, scanOnStart, LoggerFactory.getLogger(InboxWatcher.class));
    }

    public InboxWatcher(Path inboxDir, InboxHandler handler, long pollMs, boolean scanOnStart, Logger log) {
        this.inboxDir = inboxDir;
        this.handler = handler;
        this.pollMs = Math.max(50L, pollMs);
        this.scanOnStart = scanOnStart;
        this.log = log;
        this.running = new AtomicBoolean(false);
        this.stopped = new CountDownLatch(1);
    }

    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Inbox watcher already running");
        }
        try (WatchService watchService = FileSystems.getDefault().newWatchService()) {
            inboxDir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
            log.info("File watcher started, monitoring {}", inboxDir);
            if (scanOnStart) {
                sweep();
            }
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                WatchKey key = watchService.poll(pollMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        log.warn("Watch events overflowed; rescanning {}", inboxDir);
                        sweep();
                        continue;
                    }
                    Path relative = (Path) event.context();
                    handleSafely(inboxDir.resolve(relative));
                }
                if (!key.reset()) {
                    log.error("Inbox {} is no longer watchable; stopping", inboxDir);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service closed");
        } catch (IOException e) {
            throw new RuntimeException("Failed to watch inbox: " + inboxDir, e);
        } finally {
            running.set(false);
            stopped.countDown();
            log.info("File watcher stopped");
        }
    }

    /**
     * Passes every regular file already in the Inbox through the handler.
     *
     * @return number of files seen
     */
    public int sweep() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inboxDir)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            log.error("Could not scan inbox {}: {}", inboxDir, e.getMessage());
            return 0;
        }
        files.sort(null);
        for (Path file : files) {
            handleSafely(file);
        }
        log.info("Inbox sweep saw {} files", files.size());
        return files.size();
    }

    public void stop() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean awaitStopped(long timeoutMs) throws InterruptedException {
        return stopped.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private void handleSafely(Path file) {
        try {
            handler.handle(file);
        } catch (RuntimeException e) {
            log.error("Unexpected error handling {}: {}", file, e.getMessage(), e);
        }
    }
}
