package io.vigil.error;

import io.vigil.model.InstanceStatus;

public final class InstanceTerminatedException extends SupervisorException {
    private final String instanceId;
    private final InstanceStatus status;

    public InstanceTerminatedException(String instanceId, InstanceStatus status) {
        super("Instance " + instanceId + " is already " + status.wireName());
        this.instanceId = instanceId;
        this.status = status;
    }

    public String instanceId() {
        return instanceId;
    }

    public InstanceStatus status() {
        return status;
    }

    @Override
    public String code() {
        return "instance_terminated";
    }
}
