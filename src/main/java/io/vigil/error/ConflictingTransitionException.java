package io.vigil.error;

import io.vigil.model.InstanceStatus;

/**
 * A terminal transition was requested on an instance that already holds a different terminal
 * value. The stored value is never overwritten.
 */
public final class ConflictingTransitionException extends SupervisorException {
    private final String instanceId;
    private final InstanceStatus storedStatus;
    private final String storedReason;
    private final InstanceStatus attemptedStatus;
    private final String attemptedReason;

    public ConflictingTransitionException(
            String instanceId,
            InstanceStatus storedStatus,
            String storedReason,
            InstanceStatus attemptedStatus,
            String attemptedReason
    ) {
        super("Conflicting transition for " + instanceId
                + ": stored=" + storedStatus + "/" + storedReason
                + ", attempted=" + attemptedStatus + "/" + attemptedReason);
        this.instanceId = instanceId;
        this.storedStatus = storedStatus;
        this.storedReason = storedReason;
        this.attemptedStatus = attemptedStatus;
        this.attemptedReason = attemptedReason;
    }

    public String instanceId() {
        return instanceId;
    }

    public InstanceStatus storedStatus() {
        return storedStatus;
    }

    public String storedReason() {
        return storedReason;
    }

    public InstanceStatus attemptedStatus() {
        return attemptedStatus;
    }

    public String attemptedReason() {
        return attemptedReason;
    }

    @Override
    public String code() {
        return "conflicting_transition";
    }
}
