package io.vigil.transcript;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vigil.model.EntryType;

public record EmitRequest(
        String executionId,
        String instanceId,
        String taskId,
        EntryType entryType,
        String category,
        String summary,
        ObjectNode payload
) {
}
