package io.vigil.model;

public enum AssertionOutcome {
    PASS,
    FAIL,
    SKIP,
    WARN;

    public static AssertionOutcome fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("assertion result must not be blank");
        }
        for (AssertionOutcome value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown assertion result: " + raw);
    }
}
