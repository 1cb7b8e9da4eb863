package io.vigil.model;

public record InstanceHandle(String instanceId, String executionId, String taskId, long createdAtMs) {
}
