package io.vigil.model;

public enum ToolResultStatus {
    DONE,
    ERROR,
    BLOCKED;

    public static ToolResultStatus of(boolean isError, boolean isBlocked) {
        if (isBlocked) {
            return BLOCKED;
        }
        return isError ? ERROR : DONE;
    }
}
