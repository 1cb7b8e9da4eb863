package io.vigil.error;

/**
 * The durable store could not be reached or did not answer within its busy timeout.
 * Callers may retry; nothing was committed.
 */
public final class StoreUnavailableException extends SupervisorException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "store_unavailable";
    }
}
