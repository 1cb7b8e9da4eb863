package io.vigil.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InstanceStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    TERMINATED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TERMINATED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InstanceStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        for (InstanceStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown instance status: " + raw);
    }
}
