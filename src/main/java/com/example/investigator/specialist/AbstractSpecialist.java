package com.example.investigator.specialist;

import com.example.investigator.model.Alert;
import com.example.investigator.model.Domain;
import com.example.investigator.model.SpecialistAssessment;
import com.example.investigator.model.SpecialistFinding;
import com.example.investigator.reasoning.ReasoningBackend;
import com.example.investigator.reasoning.ReasoningException;
import com.example.investigator.reasoning.ReasoningPrompt;
import com.example.investigator.tools.DomainCapabilities;
import com.example.investigator.tools.ToolCallException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared flow for all specialists: gather evidence through the domain tools, ask the specialist
 * model for an assessment, turn the outcome (or any failure) into exactly one finding.
 */
public abstract class AbstractSpecialist implements Specialist {

    static final int DIAGNOSTIC_CHARS = 200;

    private static final Set<String> STATUSES = Set.of("PASS", "WARN", "FAIL");
    private static final String OUTPUT_RULES =
            """

            Respond with:
            - status: PASS (no issue in your domain), WARN or FAIL
            - confidence: 0.0-1.0, how confident you are that this alert reflects a real, actionable problem
            - summary: one or two sentences naming the actual issue, not general advice
            - recommendation: the first thing to check or change, or null
            """;

    protected final Logger log = LoggerFactory.getLogger(getClass());
    private final Domain domain;
    private final ReasoningBackend backend;

    protected AbstractSpecialist(Domain domain, ReasoningBackend backend) {
        this.domain = domain;
        this.backend = backend;
    }

    @Override
    public Domain domain() {
        return domain;
    }

    /** Domain role and what to look for; the output format is appended. */
    protected abstract String systemPrompt();

    protected abstract void gatherEvidence(Alert alert, Evidence evidence) throws ToolCallException;

    @Override
    public final SpecialistFinding investigate(Alert alert, DomainCapabilities capabilities) {
        long startTime = System.nanoTime();
        Evidence evidence = new Evidence(capabilities);
        try {
            gatherEvidence(alert, evidence);
            evidence.checkCancelled();

            SpecialistAssessment assessment =
                    backend.complete(
                            new ReasoningPrompt(systemPrompt() + OUTPUT_RULES, userPrompt(alert, evidence)),
                            SpecialistAssessment.class);
            return toFinding(assessment, evidence, elapsedMs(startTime));
        } catch (ToolCallException e) {
            log.warn("{} specialist tool call failed: {}", domain.id(), e.getMessage());
            return failed("Tool call failed: " + e.getMessage(), evidence, startTime);
        } catch (ReasoningException e) {
            log.warn("{} specialist analysis failed: {}", domain.id(), e.getMessage());
            return failed("Analysis failed: " + e.getMessage(), evidence, startTime);
        } catch (CancellationException e) {
            log.debug("{} specialist cancelled", domain.id());
            return failed("Cancelled: " + e.getMessage(), evidence, startTime);
        } catch (RuntimeException e) {
            log.error("{} specialist investigation failed", domain.id(), e);
            return failed("Investigation failed: " + e, evidence, startTime);
        }
    }

    private String userPrompt(Alert alert, Evidence evidence) {
        String gathered =
                evidence.isEmpty()
                        ? "No " + domain.id() + " data available"
                        : String.join("\n\n", evidence.excerpts());
        return """
                %s
                Evidence from investigation:
                %s

                Analyze this alert and provide your assessment.
                """
                .formatted(alert.describe(), gathered);
    }

    private SpecialistFinding toFinding(
            SpecialistAssessment assessment, Evidence evidence, long latencyMs) {
        Double confidence = assessment.confidence();
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            return SpecialistFinding.error(
                    domain,
                    "Malformed assessment: confidence " + confidence + " outside [0,1]",
                    evidence.toolsUsed(),
                    latencyMs);
        }
        if (assessment.summary() == null || assessment.summary().isBlank()) {
            return SpecialistFinding.error(
                    domain, "Malformed assessment: empty summary", evidence.toolsUsed(), latencyMs);
        }
        String status =
                assessment.status() == null
                        ? "WARN"
                        : assessment.status().trim().toUpperCase(Locale.ROOT);
        if (!STATUSES.contains(status)) {
            status = "WARN";
        }
        log.info(">>> {} specialist: {} ({}) in {}ms", domain.id(), status, confidence, latencyMs);
        return SpecialistFinding.ok(
                domain,
                status + ": " + assessment.summary().trim(),
                confidence,
                evidence.excerpts(),
                assessment.recommendation(),
                evidence.toolsUsed(),
                latencyMs);
    }

    private SpecialistFinding failed(String diagnostic, Evidence evidence, long startTime) {
        String summary =
                diagnostic.length() > DIAGNOSTIC_CHARS
                        ? diagnostic.substring(0, DIAGNOSTIC_CHARS)
                        : diagnostic;
        return SpecialistFinding.error(domain, summary, evidence.toolsUsed(), elapsedMs(startTime));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /** Lines of a multi-line tool output that mention any of the needles, case-insensitively. */
    protected static List<String> linesMentioning(String output, String... needles) {
        return output.lines()
                .filter(
                        line -> {
                            String lower = line.toLowerCase(Locale.ROOT);
                            for (String needle : needles) {
                                if (needle != null && lower.contains(needle.toLowerCase(Locale.ROOT))) {
                                    return true;
                                }
                            }
                            return false;
                        })
                .toList();
    }

    protected static boolean nameMentions(Alert alert, String... keywords) {
        String name = alert.name().toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (name.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
