package io.vigil.model;

import com.fasterxml.jackson.databind.JsonNode;

public record AssertionRecord(
        String assertionId,
        String executionId,
        String entryId,
        long sequence,
        String category,
        String description,
        AssertionOutcome result,
        JsonNode evidence,
        String chainId,
        long recordedAtMs
) {
}
