package io.vigil.model;

import com.fasterxml.jackson.databind.JsonNode;

public record TranscriptEntry(
        String entryId,
        String executionId,
        String instanceId,
        String taskId,
        long sequence,
        EntryType entryType,
        String category,
        String summary,
        JsonNode payload,
        long committedAtMs
) {
}
