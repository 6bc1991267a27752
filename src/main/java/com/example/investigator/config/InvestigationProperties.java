package com.example.investigator.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Everything tunable about an investigation. Bound once at startup and read-only afterwards.
 *
 * @param deadline shared deadline for the whole specialist fan-out
 */
@ConfigurationProperties("investigation")
public record InvestigationProperties(
        @DefaultValue("15s") Duration deadline,
        @DefaultValue Synthesis synthesis,
        @DefaultValue Authority authority,
        @DefaultValue Tools tools,
        @DefaultValue Models models,
        @DefaultValue Logs logs) {

    public InvestigationProperties {
        if (deadline == null || deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("investigation.deadline must be positive");
        }
    }

    /**
     * @param budget time allowed for the model tiers before falling straight to rule-based scoring
     * @param retryBackoff fixed pause before the single retry of a transient failure
     * @param secondaryConfidenceCap upper bound on confidence reported by the secondary model
     */
    public record Synthesis(
            @DefaultValue("30s") Duration budget,
            @DefaultValue("250ms") Duration retryBackoff,
            @DefaultValue("0.6") double actionableThreshold,
            @DefaultValue("0.3") double benignThreshold,
            @DefaultValue("0.7") double secondaryConfidenceCap) {

        public Synthesis {
            if (benignThreshold < 0.0
                    || actionableThreshold > 1.0
                    || benignThreshold >= actionableThreshold) {
                throw new IllegalArgumentException(
                        "Thresholds must satisfy 0 <= benign < actionable <= 1 but were "
                                + benignThreshold
                                + " / "
                                + actionableThreshold);
            }
        }
    }

    public record Authority(@DefaultValue List<Category> categories) {

        public Authority {
            categories = categories == null ? List.of() : List.copyOf(categories);
        }
    }

    /**
     * One alert category and how much each domain is trusted for it.
     *
     * @param alertNames exact alert names belonging to this category
     * @param labelPatterns label key to regex; all must fully match for a label-based match
     * @param weights domain id to non-negative weight; unlisted domains weigh 1.0
     */
    public record Category(
            String name,
            List<String> alertNames,
            Map<String, String> labelPatterns,
            Map<String, Double> weights) {

        public Category {
            alertNames = alertNames == null ? List.of() : List.copyOf(alertNames);
            labelPatterns = labelPatterns == null ? Map.of() : Map.copyOf(labelPatterns);
            weights = weights == null ? Map.of() : Map.copyOf(weights);
        }
    }

    /**
     * @param servers tool server id (infrastructure, observability, knowledge, home) to base URL
     * @param token bearer token for the REST bridge, blank for none
     */
    public record Tools(
            @DefaultValue("10s") Duration callTimeout, String token, Map<String, String> servers) {

        public Tools {
            servers = servers == null ? Map.of() : Map.copyOf(servers);
        }
    }

    public record Models(
            @DefaultValue Model specialist, @DefaultValue Model primary, @DefaultValue Model secondary) {}

    /**
     * @param model model id; null keeps the provider starter's default
     */
    public record Model(
            @DefaultValue("true") boolean enabled,
            String model,
            @DefaultValue("0.2") double temperature,
            @DefaultValue("800") int maxTokens) {}

    /** @param scenario log index scenario seeded at startup */
    public record Logs(@DefaultValue("healthy") String scenario) {}
}
