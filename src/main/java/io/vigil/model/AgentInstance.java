package io.vigil.model;

public record AgentInstance(
        String instanceId,
        String taskId,
        String taskListId,
        String executionId,
        InstanceStatus status,
        Long pid,
        long createdAtMs,
        Long startedAtMs,
        Long lastHeartbeatAtMs,
        Long terminatedAtMs,
        String terminationReason,
        boolean archived
) {
}
