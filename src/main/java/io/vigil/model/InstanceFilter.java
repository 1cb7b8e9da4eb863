package io.vigil.model;

public record InstanceFilter(
        InstanceStatus status,
        String taskListId,
        String taskId,
        boolean staleOnly,
        boolean includeArchived,
        int limit
) {
    public static InstanceFilter all() {
        return new InstanceFilter(null, null, null, false, false, 500);
    }

    public InstanceFilter withStatus(InstanceStatus value) {
        return new InstanceFilter(value, taskListId, taskId, staleOnly, includeArchived, limit);
    }

    public InstanceFilter withTaskListId(String value) {
        return new InstanceFilter(status, value, taskId, staleOnly, includeArchived, limit);
    }

    public InstanceFilter staleOnly(boolean value) {
        return new InstanceFilter(status, taskListId, taskId, value, includeArchived, limit);
    }
}
