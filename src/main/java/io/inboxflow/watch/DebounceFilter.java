package io.inboxflow.watch;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Drops repeat notifications for the same path inside a fixed window. Only accepted notifications
 * restart the window.
 */
public final class DebounceFilter {
    private static final int PRUNE_THRESHOLD = 1_024;

    private final Clock clock;
    private final long windowMs;
    private final Map<Path, Long> lastAccepted;

    public DebounceFilter(Clock clock, long windowMs) {
        this.clock = clock;
        this.windowMs = Math.max(0L, windowMs);
        this.lastAccepted = new HashMap<>();
    }

    public synchronized boolean accept(Path path) {
        long now = clock.millis();
        Long last = lastAccepted.get(path);
        if (last != null && now - last < windowMs) {
            return false;
        }
        lastAccepted.put(path, now);
        if (lastAccepted.size() > PRUNE_THRESHOLD) {
            prune(now);
        }
        return true;
    }

    private void prune(long now) {
        Iterator<Map.Entry<Path, Long>> it = lastAccepted.entrySet().iterator();
        while (it.hasNext()) {
            if (now - it.next().getValue() >= windowMs) {
                it.remove();
            }
        }
    }
}
