package io.vigil.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolUseRecord(
        String toolUseId,
        String executionId,
        String entryId,
        long sequence,
        String tool,
        String toolCategory,
        JsonNode input,
        String inputSummary,
        ToolResultStatus resultStatus,
        JsonNode output,
        String errorMessage,
        Long durationMs,
        long recordedAtMs
) {
}
