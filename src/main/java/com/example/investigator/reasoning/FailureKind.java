package com.example.investigator.reasoning;

/** How a failed reasoning call should be treated by the synthesis fallback policy. */
public enum FailureKind {
    /** Worth one more attempt on the same backend: 5xx, read timeout, unparseable output. */
    TRANSIENT,
    /** The backend asked us to slow down (HTTP 429). */
    RATE_LIMITED,
    /** Unreachable, misconfigured, rejected credentials or switched off. */
    UNAVAILABLE
}
