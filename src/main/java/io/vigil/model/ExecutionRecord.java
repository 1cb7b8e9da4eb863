package io.vigil.model;

public record ExecutionRecord(
        String executionId,
        String instanceId,
        String taskId,
        long startedAtMs,
        Long completedAtMs,
        String outcome,
        long droppedEvents,
        long entryCount,
        long lastSequence
) {
}
