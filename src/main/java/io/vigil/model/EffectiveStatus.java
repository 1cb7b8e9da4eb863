package io.vigil.model;

/**
 * Reconciled view of one instance. {@code found=false} means the id is unknown, which is
 * never conflated with a terminated instance.
 */
public record EffectiveStatus(
        boolean found,
        String instanceId,
        InstanceStatus status,
        boolean isStale,
        Long lastSeenAgoMs,
        String terminationReason,
        String taskId,
        String taskListId,
        String executionId,
        boolean archived
) {
    public static EffectiveStatus notFound(String instanceId) {
        return new EffectiveStatus(false, instanceId, null, false, null, null, null, null, null, false);
    }
}
