package io.vigil.error;

/**
 * Base of the supervisor's error taxonomy. {@link #code()} is the stable machine-readable name
 * surfaced by the HTTP API and CLI.
 */
public abstract class SupervisorException extends RuntimeException {
    protected SupervisorException(String message) {
        super(message);
    }

    protected SupervisorException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();
}
