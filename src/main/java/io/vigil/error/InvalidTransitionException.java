package io.vigil.error;

import io.vigil.model.InstanceStatus;

/**
 * The requested edge is not in pending → running → {completed, failed, terminated}.
 */
public final class InvalidTransitionException extends SupervisorException {
    private final String instanceId;
    private final InstanceStatus from;
    private final InstanceStatus to;

    public InvalidTransitionException(String instanceId, InstanceStatus from, InstanceStatus to) {
        super("Invalid transition for " + instanceId + ": " + from + " -> " + to);
        this.instanceId = instanceId;
        this.from = from;
        this.to = to;
    }

    public String instanceId() {
        return instanceId;
    }

    public InstanceStatus from() {
        return from;
    }

    public InstanceStatus to() {
        return to;
    }

    @Override
    public String code() {
        return "invalid_transition";
    }
}
