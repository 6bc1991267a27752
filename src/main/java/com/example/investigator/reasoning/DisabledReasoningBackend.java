package com.example.investigator.reasoning;

/** Stand-in for a tier switched off in configuration. */
public class DisabledReasoningBackend implements ReasoningBackend {

    private final String name;

    public DisabledReasoningBackend(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public <T> T complete(ReasoningPrompt prompt, Class<T> outputType) throws ReasoningException {
        throw new ReasoningException(name, FailureKind.UNAVAILABLE, "backend disabled by configuration");
    }
}
