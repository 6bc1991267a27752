package com.example.investigator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Missing severity is treated as a warning, matching how the alert router labels most rules. */
    @JsonCreator
    public static Severity fromId(String value) {
        if (value == null || value.isBlank()) {
            return WARNING;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
