package io.vigil.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntryType {
    LIFECYCLE,
    TOOL_USE,
    ERROR,
    HEARTBEAT,
    ASSERTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EntryType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("entryType must not be blank");
        }
        String normalized = raw.trim().replace('-', '_');
        for (EntryType value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown entry type: " + raw);
    }
}
