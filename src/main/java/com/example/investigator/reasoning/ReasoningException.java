package com.example.investigator.reasoning;

public class ReasoningException extends Exception {

    private final String backend;
    private final FailureKind kind;

    public ReasoningException(String backend, FailureKind kind, String message, Throwable cause) {
        super(backend + " [" + kind + "]: " + message, cause);
        this.backend = backend;
        this.kind = kind;
    }

    public ReasoningException(String backend, FailureKind kind, String message) {
        this(backend, kind, message, null);
    }

    /** Output that arrived but cannot be used; treated as transient since a rerun may parse. */
    public static ReasoningException malformedOutput(String backend, String detail) {
        return new ReasoningException(backend, FailureKind.TRANSIENT, "malformed output: " + detail);
    }

    public String backend() {
        return backend;
    }

    public FailureKind kind() {
        return kind;
    }
}
