package com.example.investigator.reasoning;

/**
 * A model that turns a prompt into structured output. Handles are built once at startup and shared
 * read-only by all requests.
 */
public interface ReasoningBackend {

    String name();

    /**
     * @throws ReasoningException classified failure; never any other exception for backend trouble
     */
    <T> T complete(ReasoningPrompt prompt, Class<T> outputType) throws ReasoningException;
}
