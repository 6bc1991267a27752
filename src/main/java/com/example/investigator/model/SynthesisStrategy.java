package com.example.investigator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SynthesisStrategy {
    PRIMARY("primary"),
    SECONDARY("secondary"),
    RULE_BASED("rule-based");

    private final String id;

    SynthesisStrategy(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
