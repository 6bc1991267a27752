package com.example.investigator.service;

import static com.example.investigator.service.RuleBasedScorerTest.allOk;
import static com.example.investigator.service.RuleBasedScorerTest.uniform;

import com.example.investigator.config.InvestigationProperties;
import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.model.Severity;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.model.SynthesisResult;
import com.example.investigator.model.SynthesisStrategy;
import com.example.investigator.model.SynthesisVerdict;
import com.example.investigator.model.Verdict;
import com.example.investigator.reasoning.FailureKind;
import com.example.investigator.reasoning.ScriptedBackend;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SynthesizerTest {

    private static final Alert ALERT =
            new Alert("KubePodCrashLooping", Map.of("namespace", "shop"), Severity.CRITICAL, "");

    private final ScriptedBackend primary = new ScriptedBackend("primary");
    private final ScriptedBackend secondary = new ScriptedBackend("secondary");
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Synthesizer synthesizer(Duration budget, Duration backoff) {
        return new Synthesizer(
                primary,
                secondary,
                executor,
                new InvestigationProperties.Synthesis(budget, backoff, 0.6, 0.3, 0.7));
    }

    private Synthesizer synthesizer() {
        return synthesizer(Duration.ofSeconds(30), Duration.ofMillis(10));
    }

    private static SynthesisVerdict verdict(String verdict, double confidence) {
        return new SynthesisVerdict(verdict, confidence, "Pods are crash looping", "Roll back");
    }

    @Test
    void primarySuccessIsUsedDirectly() {
        primary.thenReturn(verdict("ACTIONABLE", 0.85));

        SynthesisResult result =
                synthesizer().synthesize(ALERT, allOk(0.9), uniform());

        Assertions.assertEquals(SynthesisStrategy.PRIMARY, result.strategy());
        Assertions.assertFalse(result.fallbackUsed());
        Assertions.assertEquals(Verdict.ACTIONABLE, result.verdict());
        Assertions.assertEquals(0.85, result.confidence());
        Assertions.assertEquals("Roll back", result.suggestedAction());
        Assertions.assertEquals(0, secondary.calls());
    }

    @Test
    void transientFailureIsRetriedOnceOnSameTier() {
        primary.thenFail(FailureKind.TRANSIENT).thenReturn(verdict("BENIGN", 0.2));

        SynthesisResult result =
                synthesizer().synthesize(ALERT, allOk(0.1), uniform());

        Assertions.assertEquals(2, primary.calls());
        Assertions.assertEquals(0, secondary.calls());
        Assertions.assertEquals(SynthesisStrategy.PRIMARY, result.strategy());
        Assertions.assertEquals(Verdict.BENIGN, result.verdict());
    }

    @Test
    void secondTransientFailureEscalates() {
        primary.thenFail(FailureKind.TRANSIENT).thenFail(FailureKind.TRANSIENT);
        secondary.thenReturn(verdict("ACTIONABLE", 0.95));

        SynthesisResult result =
                synthesizer().synthesize(ALERT, allOk(0.9), uniform());

        Assertions.assertEquals(2, primary.calls());
        Assertions.assertEquals(1, secondary.calls());
        Assertions.assertEquals(SynthesisStrategy.SECONDARY, result.strategy());
        Assertions.assertTrue(result.fallbackUsed());
        // capped
        Assertions.assertEquals(0.7, result.confidence());
    }

    @Test
    void rateLimitEscalatesWithoutRetry() {
        primary.thenFail(FailureKind.RATE_LIMITED);
        secondary.thenReturn(verdict("INCONCLUSIVE", 0.5));

        SynthesisResult result =
                synthesizer().synthesize(ALERT, allOk(0.5), uniform());

        Assertions.assertEquals(1, primary.calls());
        Assertions.assertEquals(SynthesisStrategy.SECONDARY, result.strategy());
        Assertions.assertEquals(0.5, result.confidence());
    }

    @Test
    void bothModelsUnavailableFallsBackToRuleBased() {
        primary.thenFail(FailureKind.UNAVAILABLE);
        secondary.thenFail(FailureKind.UNAVAILABLE);

        SynthesisResult result =
                synthesizer().synthesize(ALERT, allOk(0.9), uniform());

        Assertions.assertEquals(1, primary.calls());
        Assertions.assertEquals(1, secondary.calls());
        Assertions.assertEquals(SynthesisStrategy.RULE_BASED, result.strategy());
        Assertions.assertEquals(Verdict.ACTIONABLE, result.verdict());
        Assertions.assertEquals(0.9, result.confidence(), 1e-9);
        Assertions.assertTrue(result.fallbackUsed());
    }

    @Test
    void malformedOutputCountsAsTransient() {
        primary.thenReturn(verdict("MAYBE", 0.5))
                .thenReturn(new SynthesisVerdict("ACTIONABLE", 1.4, "too sure", ""));
        secondary.thenReturn(new SynthesisVerdict("BENIGN", 0.3, " ", ""))
                .thenReturn(new SynthesisVerdict("FALSE_POSITIVE", 0.2, "Expected restart", null));

        SynthesisResult result =
                synthesizer().synthesize(ALERT, allOk(0.2), uniform());

        Assertions.assertEquals(2, primary.calls());
        Assertions.assertEquals(2, secondary.calls());
        Assertions.assertEquals(SynthesisStrategy.SECONDARY, result.strategy());
        Assertions.assertEquals(Verdict.BENIGN, result.verdict());
        Assertions.assertEquals("", result.suggestedAction());
    }

    @Test
    void exhaustedBudgetSkipsModelTiers() {
        SynthesisResult result =
                synthesizer(Duration.ZERO, Duration.ofMillis(10))
                        .synthesize(ALERT, allOk(0.9), uniform());

        Assertions.assertEquals(0, primary.calls());
        Assertions.assertEquals(0, secondary.calls());
        Assertions.assertEquals(SynthesisStrategy.RULE_BASED, result.strategy());
    }

    @Test
    void retryIsSkippedWhenBackoffWouldOverrunBudget() {
        primary.thenFail(FailureKind.TRANSIENT).thenReturn(verdict("ACTIONABLE", 0.9));
        secondary.thenReturn(verdict("ACTIONABLE", 0.6));

        long start = System.nanoTime();
        SynthesisResult result =
                synthesizer(Duration.ofSeconds(2), Duration.ofSeconds(10))
                        .synthesize(ALERT, allOk(0.9), uniform());

        Assertions.assertTrue(System.nanoTime() - start < Duration.ofSeconds(2).toNanos());
        Assertions.assertEquals(1, primary.calls());
        Assertions.assertEquals(SynthesisStrategy.SECONDARY, result.strategy());
    }

    @Test
    void hungPrimaryIsAbandonedAtTheBudget() {
        primary.thenHang(Duration.ofSeconds(5), verdict("ACTIONABLE", 0.9));
        secondary.thenReturn(verdict("ACTIONABLE", 0.6));

        long start = System.nanoTime();
        SynthesisResult result =
                synthesizer(Duration.ofMillis(500), Duration.ofMillis(10))
                        .synthesize(ALERT, allOk(0.9), uniform());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        Assertions.assertTrue(
                elapsed.compareTo(Duration.ofSeconds(2)) < 0, "took " + elapsed.toMillis() + "ms");
        Assertions.assertEquals(SynthesisStrategy.RULE_BASED, result.strategy());
        Assertions.assertEquals(Verdict.ACTIONABLE, result.verdict());
        Assertions.assertEquals(0, secondary.calls());
    }

    @Test
    void missingOutputCountsAsMalformed() {
        primary.thenReturnNothing().thenReturn(verdict("BENIGN", 0.1));

        SynthesisResult result =
                synthesizer().synthesize(ALERT, allOk(0.1), uniform());

        Assertions.assertEquals(2, primary.calls());
        Assertions.assertEquals(SynthesisStrategy.PRIMARY, result.strategy());
        Assertions.assertEquals(Verdict.BENIGN, result.verdict());
    }

    @Test
    void ruleBasedDefectSurfacesAsSynthesisFailure() {
        primary.thenFail(FailureKind.UNAVAILABLE);
        secondary.thenFail(FailureKind.UNAVAILABLE);
        Map<Domain, Double> weights = uniform();
        weights.put(Domain.DATA, Double.NaN);

        Assertions.assertThrows(
                SynthesisFailedException.class,
                () -> synthesizer().synthesize(ALERT, allOk(0.9), weights));
    }

    @Test
    void promptCarriesWeightsAndFailedFindings() {
        primary.thenReturn(verdict("ACTIONABLE", 0.8));
        Map<Domain, SpecialistFinding> findings = allOk(0.9);
        findings.put(Domain.NETWORK, SpecialistFinding.timeout(Domain.NETWORK, Duration.ofSeconds(15)));
        Map<Domain, Double> weights = uniform();
        weights.put(Domain.PLATFORM, 0.9);

        synthesizer().synthesize(ALERT, findings, weights);

        String user = primary.prompts().get(0).user();
        Assertions.assertTrue(user.contains("Alert: KubePodCrashLooping"));
        Assertions.assertTrue(user.contains("[platform] weight=0.90 status=OK"));
        Assertions.assertTrue(user.contains("[network] weight=1.00 status=TIMEOUT confidence=0.00"));
        Assertions.assertTrue(
                user.indexOf("[data]") < user.indexOf("[network]")
                        && user.indexOf("[network]") < user.indexOf("[security]"));
    }
}
