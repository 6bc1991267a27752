package com.example.investigator.service;

import com.example.investigator.model.Domain;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.model.SynthesisResult;
import com.example.investigator.model.SynthesisStrategy;
import com.example.investigator.model.Verdict;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic last synthesis tier: normalized authority-weighted mean of the OK findings'
 * confidences, mapped to a verdict by two thresholds. Only failed findings' absence matters; ERROR
 * and TIMEOUT findings are excluded from both numerator and denominator.
 */
public class RuleBasedScorer {

    private static final int CITED_FINDINGS = 3;

    private final double actionableThreshold;
    private final double benignThreshold;

    public RuleBasedScorer(double actionableThreshold, double benignThreshold) {
        this.actionableThreshold = actionableThreshold;
        this.benignThreshold = benignThreshold;
    }

    private record Contribution(SpecialistFinding finding, double weight) {
        double score() {
            return weight * finding.confidence();
        }
    }

    /**
     * @throws IllegalStateException on a negative or NaN weight or confidence, a configuration or
     *     programming defect that no retry can fix
     */
    public SynthesisResult score(
            Map<Domain, SpecialistFinding> findings, Map<Domain, Double> weights) {
        List<Contribution> contributions = new ArrayList<>();
        double weightSum = 0.0;
        double weightedSum = 0.0;
        for (SpecialistFinding finding : findings.values()) {
            if (!finding.isOk()) {
                continue;
            }
            Double weight = weights.get(finding.domain());
            if (weight == null || weight.isNaN() || weight < 0.0) {
                throw new IllegalStateException(
                        "No usable authority weight for domain " + finding.domain().id() + ": " + weight);
            }
            if (Double.isNaN(finding.confidence()) || finding.confidence() < 0.0) {
                throw new IllegalStateException(
                        "Invalid confidence " + finding.confidence() + " from " + finding.domain().id());
            }
            contributions.add(new Contribution(finding, weight));
            weightSum += weight;
            weightedSum += weight * finding.confidence();
        }

        long failed = findings.values().stream().filter(f -> !f.isOk()).count();
        if (contributions.isEmpty() || weightSum == 0.0) {
            return new SynthesisResult(
                    Verdict.INCONCLUSIVE,
                    0.0,
                    "No usable specialist findings (" + failed + " of " + findings.size()
                            + " failed or timed out); manual review required.",
                    "Review the alert context and related metrics manually",
                    SynthesisStrategy.RULE_BASED);
        }

        double weightedConfidence = weightedSum / weightSum;
        Verdict verdict = verdictFor(weightedConfidence);

        contributions.sort(
                Comparator.comparingDouble(Contribution::score)
                        .reversed()
                        .thenComparing(c -> c.finding().domain()));
        String cited =
                contributions.stream()
                        .limit(CITED_FINDINGS)
                        .map(
                                c ->
                                        String.format(
                                                Locale.ROOT,
                                                "%s (%.2f): %s",
                                                c.finding().domain().id(),
                                                c.finding().confidence(),
                                                c.finding().summary()))
                        .collect(Collectors.joining("; "));
        String synthesis =
                String.format(
                        Locale.ROOT,
                        "Weighted confidence %.2f across %d of %d specialists. %s",
                        weightedConfidence,
                        contributions.size(),
                        findings.size(),
                        cited);

        String action = "";
        if (verdict != Verdict.BENIGN) {
            action =
                    contributions.stream()
                            .map(c -> c.finding().recommendation())
                            .filter(r -> r != null && !r.isBlank())
                            .findFirst()
                            .orElse("");
        }
        return new SynthesisResult(
                verdict, weightedConfidence, synthesis, action, SynthesisStrategy.RULE_BASED);
    }

    Verdict verdictFor(double weightedConfidence) {
        if (weightedConfidence >= actionableThreshold) {
            return Verdict.ACTIONABLE;
        }
        if (weightedConfidence <= benignThreshold) {
            return Verdict.BENIGN;
        }
        return Verdict.INCONCLUSIVE;
    }
}
