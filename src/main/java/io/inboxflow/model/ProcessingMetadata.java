package io.inboxflow.model;

public record ProcessingMetadata(
        String model,
        double durationSeconds,
        long tokenCount
) {
}
