package com.example.investigator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InvestigationResponse(
        String requestId,
        Verdict verdict,
        double confidence,
        SynthesisStrategy strategy,
        List<SpecialistFinding> findings,
        String synthesis,
        String suggestedAction,
        boolean fallbackUsed,
        long latencyMs) {

    public static InvestigationResponse of(
            String requestId,
            List<SpecialistFinding> findings,
            SynthesisResult result,
            long latencyMs) {
        return new InvestigationResponse(
                requestId,
                result.verdict(),
                result.confidence(),
                result.strategy(),
                List.copyOf(findings),
                result.synthesis(),
                result.suggestedAction(),
                result.fallbackUsed(),
                latencyMs);
    }
}
