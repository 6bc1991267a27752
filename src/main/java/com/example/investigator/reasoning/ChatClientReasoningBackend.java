package com.example.investigator.reasoning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/** {@link ReasoningBackend} over a Spring AI {@link ChatClient} with structured entity output. */
public class ChatClientReasoningBackend implements ReasoningBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatClientReasoningBackend.class);

    private final String name;
    private final ChatClient chatClient;

    public ChatClientReasoningBackend(String name, ChatClient chatClient) {
        this.name = name;
        this.chatClient = chatClient;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public <T> T complete(ReasoningPrompt prompt, Class<T> outputType) throws ReasoningException {
        long startTime = System.currentTimeMillis();
        T output;
        try {
            output =
                    chatClient
                            .prompt()
                            .system(prompt.system())
                            .user(prompt.user())
                            .call()
                            .entity(outputType);
        } catch (RuntimeException e) {
            FailureKind kind = ReasoningFailureClassifier.classify(e);
            log.warn(">>> {} call failed after {}ms, classified {}: {}",
                    name, System.currentTimeMillis() - startTime, kind, e.getMessage());
            throw new ReasoningException(name, kind, String.valueOf(e.getMessage()), e);
        }
        if (output == null) {
            throw ReasoningException.malformedOutput(name, "no " + outputType.getSimpleName());
        }
        log.debug(">>> {} answered in {}ms", name, System.currentTimeMillis() - startTime);
        return output;
    }
}
