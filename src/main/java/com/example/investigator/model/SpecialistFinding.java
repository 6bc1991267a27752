package com.example.investigator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;
import java.util.List;

/**
 * Result of one specialist's investigation of one alert.
 *
 * @param confidence confidence that the alert reflects a real, actionable problem in this domain.
 *     Always 0 unless {@code status} is {@link FindingStatus#OK}.
 * @param evidence ordered excerpts gathered through the domain's tools
 * @param recommendation what the specialist would check or change first, may be null
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SpecialistFinding(
        Domain domain,
        FindingStatus status,
        String summary,
        double confidence,
        List<String> evidence,
        String recommendation,
        List<String> toolsUsed,
        long latencyMs) {

    public SpecialistFinding {
        if (domain == null || status == null) {
            throw new IllegalArgumentException("domain and status are required");
        }
        if (status != FindingStatus.OK) {
            confidence = 0.0;
        } else if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "confidence must be within [0,1] but was " + confidence);
        }
        summary = summary == null ? "" : summary;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
    }

    public static SpecialistFinding ok(
            Domain domain,
            String summary,
            double confidence,
            List<String> evidence,
            String recommendation,
            List<String> toolsUsed,
            long latencyMs) {
        return new SpecialistFinding(
                domain,
                FindingStatus.OK,
                summary,
                confidence,
                evidence,
                recommendation,
                toolsUsed,
                latencyMs);
    }

    public static SpecialistFinding error(
            Domain domain, String diagnostic, List<String> toolsUsed, long latencyMs) {
        return new SpecialistFinding(
                domain, FindingStatus.ERROR, diagnostic, 0.0, List.of(), null, toolsUsed, latencyMs);
    }

    public static SpecialistFinding timeout(Domain domain, Duration deadline) {
        return new SpecialistFinding(
                domain,
                FindingStatus.TIMEOUT,
                "No finding within the " + deadline.toMillis() + "ms investigation deadline",
                0.0,
                List.of(),
                null,
                List.of(),
                deadline.toMillis());
    }

    @JsonIgnore
    public boolean isOk() {
        return status == FindingStatus.OK;
    }
}
