package com.example.investigator.model;

import java.util.Locale;
import java.util.Optional;

public enum Verdict {
    ACTIONABLE,
    BENIGN,
    INCONCLUSIVE;

    /**
     * Lenient parse of a model-produced verdict. Also accepts the older FALSE_POSITIVE / UNKNOWN
     * vocabulary some prompts still elicit.
     */
    public static Optional<Verdict> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toUpperCase(Locale.ROOT).replace('-', '_')) {
            case "ACTIONABLE" -> Optional.of(ACTIONABLE);
            case "BENIGN", "FALSE_POSITIVE" -> Optional.of(BENIGN);
            case "INCONCLUSIVE", "UNKNOWN" -> Optional.of(INCONCLUSIVE);
            default -> Optional.empty();
        };
    }
}
