package com.example.investigator.service;

import com.example.investigator.model.Domain;
import com.example.investigator.model.InvestigationRequest;
import com.example.investigator.model.InvestigationResponse;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.model.SynthesisResult;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/** End-to-end investigation of one alert: validate, weigh, dispatch, synthesize. */
@Service
public class InvestigationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(InvestigationOrchestrator.class);

    static final String REQUEST_ID = "requestId";

    private final AuthorityWeightTable weightTable;
    private final SpecialistDispatcher dispatcher;
    private final Synthesizer synthesizer;

    public InvestigationOrchestrator(
            AuthorityWeightTable weightTable,
            SpecialistDispatcher dispatcher,
            Synthesizer synthesizer) {
        this.weightTable = weightTable;
        this.dispatcher = dispatcher;
        this.synthesizer = synthesizer;
    }

    /**
     * @throws InvalidRequestException if the request cannot be investigated; nothing is dispatched
     */
    public InvestigationResponse investigate(InvestigationRequest request) {
        validate(request);
        long startTime = System.nanoTime();
        MDC.put(REQUEST_ID, request.requestId());
        try {
            log.info(
                    ">>> Investigating {} [{}] ({})",
                    request.alert().name(),
                    request.alert().severity().id(),
                    weightTable.categoryFor(request.alert()));
            Map<Domain, Double> weights = weightTable.weightsFor(request.alert());
            Map<Domain, SpecialistFinding> findings = dispatcher.dispatch(request.alert());

            SynthesisResult result;
            try {
                result = synthesizer.synthesize(request.alert(), findings, weights);
            } catch (SynthesisFailedException e) {
                log.error(">>> Synthesis failed on every tier", e);
                result = SynthesisResult.unavailable(e.getMessage());
            }

            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            log.info(
                    ">>> Verdict {} ({}) via {} in {}ms",
                    result.verdict(),
                    result.confidence(),
                    result.strategy().id(),
                    latencyMs);
            return InvestigationResponse.of(
                    request.requestId(), List.copyOf(findings.values()), result, latencyMs);
        } finally {
            MDC.remove(REQUEST_ID);
        }
    }

    private static void validate(InvestigationRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request is required");
        }
        if (request.requestId() == null || request.requestId().isBlank()) {
            throw new InvalidRequestException("request_id must not be blank");
        }
        if (request.alert() == null) {
            throw new InvalidRequestException("alert is required");
        }
        if (request.alert().name() == null || request.alert().name().isBlank()) {
            throw new InvalidRequestException("alert.name must not be blank");
        }
    }
}
