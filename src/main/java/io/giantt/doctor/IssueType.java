package io.giantt.doctor;

import java.util.Locale;

public enum IssueType {
    DANGLING_REFERENCE,
    INCOMPLETE_CHAIN;

    public static IssueType fromString(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Issue type is required");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (IssueType value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown issue type: " + raw);
    }
}
