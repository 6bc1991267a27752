package com.example.investigator.service;

import com.example.investigator.reasoning.FailureKind;
import java.time.Duration;

/**
 * Escalation policy for synthesis, as an explicit state machine over {@link Tier}. A transient
 * failure on a model tier's first attempt earns one retry after a fixed backoff; every other
 * failure escalates to the next tier at once. The rule-based tier has no failure transition.
 */
public class FallbackController {

    public enum Tier {
        PRIMARY,
        SECONDARY,
        RULE_BASED,
        DONE;

        Tier next() {
            return switch (this) {
                case PRIMARY -> SECONDARY;
                case SECONDARY -> RULE_BASED;
                case RULE_BASED, DONE -> DONE;
            };
        }
    }

    /** What to do after a failure: run {@code tier} again (a retry) or move to it. */
    public record Transition(Tier tier, boolean retry, Duration backoff) {

        static Transition retry(Tier tier, Duration backoff) {
            return new Transition(tier, true, backoff);
        }

        static Transition escalate(Tier tier) {
            return new Transition(tier, false, Duration.ZERO);
        }
    }

    private final Duration retryBackoff;

    public FallbackController(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public Tier start() {
        return Tier.PRIMARY;
    }

    public Tier onSuccess(Tier tier) {
        return Tier.DONE;
    }

    /**
     * @param attempt 1 for the first call on this tier, 2 for the retry
     * @throws IllegalStateException for the rule-based tier or a finished machine
     */
    public Transition onFailure(Tier tier, FailureKind kind, int attempt) {
        if (tier == Tier.RULE_BASED || tier == Tier.DONE) {
            throw new IllegalStateException("No fallback after tier " + tier);
        }
        if (kind == FailureKind.TRANSIENT && attempt == 1) {
            return Transition.retry(tier, retryBackoff);
        }
        return Transition.escalate(tier.next());
    }

    public Duration retryBackoff() {
        return retryBackoff;
    }
}
