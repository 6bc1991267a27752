package com.example.investigator.service;

import com.example.investigator.config.InvestigationProperties;
import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.model.SynthesisResult;
import com.example.investigator.model.SynthesisStrategy;
import com.example.investigator.model.SynthesisVerdict;
import com.example.investigator.model.Verdict;
import com.example.investigator.reasoning.FailureKind;
import com.example.investigator.reasoning.ReasoningBackend;
import com.example.investigator.reasoning.ReasoningException;
import com.example.investigator.reasoning.ReasoningPrompt;
import com.example.investigator.service.FallbackController.Tier;
import com.example.investigator.service.FallbackController.Transition;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns the collected findings into one verdict. Tiers run strictly one after another: primary
 * model, secondary model, rule-based scoring. The {@link FallbackController} decides every move.
 *
 * <p>Model calls run on {@code synthesisExecutor} and are abandoned once the synthesis budget runs
 * out, so a hung backend cannot hold the caller past the budget.
 */
@Service
public class Synthesizer {

    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private static final String SYSTEM_PROMPT =
            """
            You are the lead incident investigator. Several domain specialists have investigated the
            same alert. Combine their findings into a single verdict.

            Each finding carries an authority weight for this alert category. Trust findings with a
            higher weight more when they disagree. Findings with status ERROR or TIMEOUT carry no
            information about the system; do not treat them as evidence of health.

            Respond with:
            - verdict: ACTIONABLE (real problem requiring action), BENIGN (no action needed) or
              INCONCLUSIVE (evidence insufficient)
            - confidence: 0.0-1.0
            - synthesis: a short explanation citing the findings that drove the verdict
            - suggestedAction: the first concrete step for the on-call engineer, empty if BENIGN
            """;

    private final ReasoningBackend primary;
    private final ReasoningBackend secondary;
    private final RuleBasedScorer scorer;
    private final FallbackController fallback;
    private final Duration budget;
    private final double secondaryConfidenceCap;
    private final ExecutorService executor;

    @Autowired
    public Synthesizer(
            @Qualifier("primarySynthesisBackend") ReasoningBackend primary,
            @Qualifier("secondarySynthesisBackend") ReasoningBackend secondary,
            @Qualifier("synthesisExecutor") ExecutorService executor,
            InvestigationProperties properties) {
        this(primary, secondary, executor, properties.synthesis());
    }

    public Synthesizer(
            ReasoningBackend primary,
            ReasoningBackend secondary,
            ExecutorService executor,
            InvestigationProperties.Synthesis settings) {
        this.primary = primary;
        this.secondary = secondary;
        this.executor = executor;
        this.scorer =
                new RuleBasedScorer(settings.actionableThreshold(), settings.benignThreshold());
        this.fallback = new FallbackController(settings.retryBackoff());
        this.budget = settings.budget();
        this.secondaryConfidenceCap = settings.secondaryConfidenceCap();
    }

    /**
     * @throws SynthesisFailedException when the rule-based tier itself fails
     */
    public SynthesisResult synthesize(
            Alert alert, Map<Domain, SpecialistFinding> findings, Map<Domain, Double> weights) {
        long deadline = System.nanoTime() + budget.toNanos();
        ReasoningPrompt prompt = prompt(alert, findings, weights);

        Tier tier = fallback.start();
        int attempt = 1;
        while (tier != Tier.RULE_BASED && tier != Tier.DONE) {
            if (System.nanoTime() >= deadline) {
                log.warn(">>> Synthesis budget of {}ms exhausted at {} tier", budget.toMillis(), tier);
                tier = Tier.RULE_BASED;
                break;
            }
            try {
                SynthesisResult result = callModel(tier, prompt, deadline);
                fallback.onSuccess(tier);
                log.info(
                        ">>> Synthesis by {} tier: {} ({})",
                        result.strategy().id(),
                        result.verdict(),
                        result.confidence());
                return result;
            } catch (ReasoningException e) {
                Transition next = fallback.onFailure(tier, e.kind(), attempt);
                log.warn(
                        ">>> {} synthesis attempt {} failed ({}): {}",
                        tier,
                        attempt,
                        e.kind(),
                        e.getMessage());
                if (next.retry()) {
                    long remaining = deadline - System.nanoTime();
                    if (next.backoff().toNanos() >= remaining) {
                        log.warn(">>> Skipping {} retry, backoff would overrun the budget", tier);
                        tier = fallback.onFailure(tier, e.kind(), attempt + 1).tier();
                        attempt = 1;
                        continue;
                    }
                    if (!pause(next.backoff())) {
                        tier = Tier.RULE_BASED;
                        break;
                    }
                    attempt++;
                } else {
                    tier = next.tier();
                    attempt = 1;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn(">>> Interrupted during {} synthesis, falling back to rule-based scoring", tier);
                tier = Tier.RULE_BASED;
                break;
            }
        }

        try {
            SynthesisResult result = scorer.score(findings, weights);
            log.info(
                    ">>> Synthesis by rule-based tier: {} ({})",
                    result.verdict(),
                    result.confidence());
            return result;
        } catch (RuntimeException e) {
            throw new SynthesisFailedException("Rule-based scoring failed: " + e.getMessage(), e);
        }
    }

    private SynthesisResult callModel(Tier tier, ReasoningPrompt prompt, long deadline)
            throws ReasoningException, InterruptedException {
        ReasoningBackend backend = tier == Tier.PRIMARY ? primary : secondary;
        SynthesisVerdict output = completeWithin(backend, prompt, deadline);
        if (output == null) {
            throw ReasoningException.malformedOutput(backend.name(), "no output");
        }
        Verdict verdict =
                Verdict.parse(output.verdict())
                        .orElseThrow(
                                () ->
                                        ReasoningException.malformedOutput(
                                                backend.name(),
                                                "unknown verdict '" + output.verdict() + "'"));
        Double confidence = output.confidence();
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw ReasoningException.malformedOutput(
                    backend.name(), "confidence " + confidence + " outside [0,1]");
        }
        if (output.synthesis() == null || output.synthesis().isBlank()) {
            throw ReasoningException.malformedOutput(backend.name(), "empty synthesis");
        }

        if (tier == Tier.PRIMARY) {
            return new SynthesisResult(
                    verdict,
                    confidence,
                    output.synthesis(),
                    output.suggestedAction(),
                    SynthesisStrategy.PRIMARY);
        }
        // Smaller model, less trusted
        return new SynthesisResult(
                verdict,
                Math.min(confidence, secondaryConfidenceCap),
                output.synthesis(),
                output.suggestedAction(),
                SynthesisStrategy.SECONDARY);
    }

    private SynthesisVerdict completeWithin(
            ReasoningBackend backend, ReasoningPrompt prompt, long deadline)
            throws ReasoningException, InterruptedException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<SynthesisVerdict> call =
                executor.submit(
                        () -> {
                            if (mdc != null) {
                                MDC.setContextMap(mdc);
                            }
                            try {
                                return backend.complete(prompt, SynthesisVerdict.class);
                            } finally {
                                MDC.clear();
                            }
                        });
        try {
            return call.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ReasoningException(
                    backend.name(),
                    FailureKind.UNAVAILABLE,
                    "no answer within the synthesis budget of " + budget.toMillis() + "ms");
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReasoningException reasoning) {
                throw reasoning;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Synthesis call failed", cause);
        }
    }

    private static boolean pause(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn(">>> Interrupted during synthesis backoff, falling back to rule-based scoring");
            return false;
        }
    }

    static ReasoningPrompt prompt(
            Alert alert, Map<Domain, SpecialistFinding> findings, Map<Domain, Double> weights) {
        String rendered =
                findings.values().stream()
                        .map(f -> render(f, weights.get(f.domain())))
                        .collect(Collectors.joining("\n"));
        String user =
                """
                %s
                Specialist findings:
                %s

                Provide the combined verdict.
                """
                        .formatted(alert.describe(), rendered);
        return new ReasoningPrompt(SYSTEM_PROMPT, user);
    }

    private static String render(SpecialistFinding finding, Double weight) {
        return String.format(
                Locale.ROOT,
                "[%s] weight=%.2f status=%s confidence=%.2f%n  summary: %s%n  recommendation: %s",
                finding.domain().id(),
                weight == null ? AuthorityWeightTable.NEUTRAL_WEIGHT : weight,
                finding.status(),
                finding.confidence(),
                finding.summary(),
                finding.recommendation() == null ? "none" : finding.recommendation());
    }
}
