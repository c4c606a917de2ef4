package io.inboxflow.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LedgerEntry(
        @JsonProperty("filename") String sourceFilename,
        @JsonProperty("processedAt") String processedAt,
        @JsonProperty("taskId") String taskId
) {
}
