package com.example.investigator.service;

import com.example.investigator.config.InvestigationProperties;
import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Alert category to per-domain authority weight. Built once from configuration; lookups are pure.
 *
 * <p>Resolution order: exact alert name, then label patterns (first matching category in
 * declaration order), then the default category where every domain weighs 1.0.
 */
@Service
public class AuthorityWeightTable {

    public static final String DEFAULT_CATEGORY = "default";
    static final double NEUTRAL_WEIGHT = 1.0;

    private record Category(
            String name, List<String> alertNames, Map<String, Pattern> labelPatterns,
            Map<Domain, Double> weights) {

        boolean matchesLabels(Map<String, String> labels) {
            if (labelPatterns.isEmpty()) {
                return false;
            }
            for (Map.Entry<String, Pattern> entry : labelPatterns.entrySet()) {
                String value = labels.get(entry.getKey());
                if (value == null || !entry.getValue().matcher(value).matches()) {
                    return false;
                }
            }
            return true;
        }
    }

    private final List<Category> categories;
    private final Map<Domain, Double> uniform;

    @Autowired
    public AuthorityWeightTable(InvestigationProperties properties) {
        this(properties.authority().categories());
    }

    public AuthorityWeightTable(List<InvestigationProperties.Category> configured) {
        List<Category> compiled = new ArrayList<>();
        for (InvestigationProperties.Category category : configured) {
            compiled.add(compile(category));
        }
        this.categories = List.copyOf(compiled);

        Map<Domain, Double> neutral = new EnumMap<>(Domain.class);
        for (Domain domain : Domain.values()) {
            neutral.put(domain, NEUTRAL_WEIGHT);
        }
        this.uniform = Collections.unmodifiableMap(neutral);
    }

    private static Category compile(InvestigationProperties.Category category) {
        if (category.name() == null || category.name().isBlank()) {
            throw new IllegalArgumentException("Authority category without a name");
        }
        Map<Domain, Double> weights = new EnumMap<>(Domain.class);
        for (Domain domain : Domain.values()) {
            weights.put(domain, NEUTRAL_WEIGHT);
        }
        for (Map.Entry<String, Double> entry : category.weights().entrySet()) {
            Domain domain = Domain.fromId(entry.getKey());
            Double weight = entry.getValue();
            if (weight == null || weight.isNaN() || weight < 0.0) {
                throw new IllegalArgumentException(
                        "Category '" + category.name() + "' has invalid weight " + weight
                                + " for " + domain.id());
            }
            weights.put(domain, weight);
        }

        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : category.labelPatterns().entrySet()) {
            try {
                patterns.put(entry.getKey(), Pattern.compile(entry.getValue()));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(
                        "Category '" + category.name() + "' has an invalid pattern for label "
                                + entry.getKey(),
                        e);
            }
        }
        return new Category(
                category.name(),
                category.alertNames(),
                Collections.unmodifiableMap(patterns),
                Collections.unmodifiableMap(weights));
    }

    public Map<Domain, Double> weightsFor(Alert alert) {
        Category category = resolve(alert);
        return category == null ? uniform : category.weights();
    }

    public String categoryFor(Alert alert) {
        Category category = resolve(alert);
        return category == null ? DEFAULT_CATEGORY : category.name();
    }

    /** Every configured category's weights, for the agents listing. */
    public Map<String, Map<Domain, Double>> describe() {
        Map<String, Map<Domain, Double>> all = new LinkedHashMap<>();
        for (Category category : categories) {
            all.put(category.name(), category.weights());
        }
        all.putIfAbsent(DEFAULT_CATEGORY, uniform);
        return Collections.unmodifiableMap(all);
    }

    private Category resolve(Alert alert) {
        for (Category category : categories) {
            if (category.alertNames().contains(alert.name())) {
                return category;
            }
        }
        for (Category category : categories) {
            if (category.matchesLabels(alert.labels())) {
                return category;
            }
        }
        return null;
    }
}
