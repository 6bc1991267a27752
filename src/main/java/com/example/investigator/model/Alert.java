package com.example.investigator.model;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public record Alert(
        @NotBlank String name,
        Map<String, String> labels,
        Severity severity,
        String description) {

    public Alert {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        severity = severity == null ? Severity.WARNING : severity;
        description = description == null ? "" : description;
    }

    public String label(String key) {
        return labels.get(key);
    }

    /** First non-blank label among the given keys, or null. */
    public String firstLabel(String... keys) {
        for (String key : keys) {
            String value = labels.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public String namespace() {
        String namespace = label("namespace");
        return namespace == null || namespace.isBlank() ? "default" : namespace;
    }

    /** Prompt rendering; labels sorted so the same alert always renders the same text. */
    public String describe() {
        return """
                Alert: %s
                Severity: %s
                Labels: %s
                Description: %s
                """
                .formatted(
                        name,
                        severity.id(),
                        renderLabels(),
                        description.isBlank() ? "N/A" : description);
    }

    private String renderLabels() {
        if (labels.isEmpty()) {
            return "none";
        }
        return new TreeMap<>(labels)
                .entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
