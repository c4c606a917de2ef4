package io.inboxflow.model;

import java.time.Instant;

public record OriginalFile(
        String name,
        String extension,
        long sizeBytes,
        Instant discoveredAt
) {
}
