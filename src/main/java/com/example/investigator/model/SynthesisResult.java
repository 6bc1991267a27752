package com.example.investigator.model;

public record SynthesisResult(
        Verdict verdict,
        double confidence,
        String synthesis,
        String suggestedAction,
        SynthesisStrategy strategy) {

    public SynthesisResult {
        suggestedAction = suggestedAction == null ? "" : suggestedAction;
    }

    public boolean fallbackUsed() {
        return strategy != SynthesisStrategy.PRIMARY;
    }

    /** Degraded answer when no tier, rule-based included, could produce a verdict. */
    public static SynthesisResult unavailable(String reason) {
        return new SynthesisResult(
                Verdict.INCONCLUSIVE,
                0.0,
                "Synthesis unavailable: " + reason,
                "",
                SynthesisStrategy.RULE_BASED);
    }
}
