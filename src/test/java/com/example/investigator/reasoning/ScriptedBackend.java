package com.example.investigator.reasoning;

import java.util.ArrayDeque;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Returns (or throws) the queued outcomes in order; once drained, fails as unavailable. */
public class ScriptedBackend implements ReasoningBackend {

    private static final Object NOTHING = new Object();

    private final String name;
    private final Deque<Object> outcomes = new ArrayDeque<>();
    private final List<ReasoningPrompt> prompts = new ArrayList<>();

    public ScriptedBackend(String name) {
        this.name = name;
    }

    public ScriptedBackend thenReturn(Object output) {
        outcomes.add(output);
        return this;
    }

    public ScriptedBackend thenFail(FailureKind kind) {
        outcomes.add(new ReasoningException(name, kind, "scripted " + kind));
        return this;
    }

    /** Blocks for {@code delay} before answering, unless interrupted first. */
    public ScriptedBackend thenHang(Duration delay, Object output) {
        outcomes.add(new Hang(delay, output));
        return this;
    }

    /** Queues a {@code null} answer, which a well-behaved backend never gives. */
    public ScriptedBackend thenReturnNothing() {
        outcomes.add(NOTHING);
        return this;
    }

    public synchronized int calls() {
        return prompts.size();
    }

    public synchronized List<ReasoningPrompt> prompts() {
        return List.copyOf(prompts);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public <T> T complete(ReasoningPrompt prompt, Class<T> outputType) throws ReasoningException {
        Object next = record(prompt);
        if (next == null) {
            throw new ReasoningException(name, FailureKind.UNAVAILABLE, "nothing scripted");
        }
        if (next instanceof ReasoningException e) {
            throw e;
        }
        if (next == NOTHING) {
            return null;
        }
        if (next instanceof Hang hang) {
            try {
                Thread.sleep(hang.delay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReasoningException(name, FailureKind.UNAVAILABLE, "interrupted", e);
            }
            return outputType.cast(hang.output());
        }
        return outputType.cast(next);
    }

    private synchronized Object record(ReasoningPrompt prompt) {
        prompts.add(prompt);
        return outcomes.poll();
    }

    private record Hang(Duration delay, Object output) {}
}
