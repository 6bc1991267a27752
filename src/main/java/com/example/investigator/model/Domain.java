package com.example.investigator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The fixed set of specialist domains. Declaration order is identifier order and is the order
 * findings are rendered in.
 */
public enum Domain {
    DATA,
    NETWORK,
    PLATFORM,
    RELIABILITY,
    SECURITY;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Domain fromId(String id) {
        for (Domain domain : values()) {
            if (domain.id().equalsIgnoreCase(id.trim())) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown specialist domain: " + id);
    }
}
