package com.example.investigator.config;

import com.example.investigator.reasoning.ChatClientReasoningBackend;
import com.example.investigator.reasoning.DisabledReasoningBackend;
import com.example.investigator.reasoning.ReasoningBackend;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Model handles, built once at startup. Specialists and the primary synthesis tier use Anthropic;
 * the secondary tier uses a small model behind an OpenAI-compatible endpoint.
 */
@Configuration
public class ReasoningConfig {

    private static final Logger log = LoggerFactory.getLogger(ReasoningConfig.class);

    @Bean
    public ReasoningBackend specialistBackend(
            AnthropicChatModel chatModel, InvestigationProperties properties) {
        return anthropic("specialist", chatModel, properties.models().specialist());
    }

    @Bean
    public ReasoningBackend primarySynthesisBackend(
            AnthropicChatModel chatModel, InvestigationProperties properties) {
        return anthropic("primary", chatModel, properties.models().primary());
    }

    @Bean
    public ReasoningBackend secondarySynthesisBackend(
            OpenAiChatModel chatModel, InvestigationProperties properties) {
        InvestigationProperties.Model settings = properties.models().secondary();
        if (!settings.enabled()) {
            log.warn(">>> Secondary synthesis model disabled");
            return new DisabledReasoningBackend("secondary");
        }
        OpenAiChatOptions.Builder options =
                OpenAiChatOptions.builder()
                        .temperature(settings.temperature())
                        .maxTokens(settings.maxTokens());
        if (settings.model() != null) {
            options.model(settings.model());
        }
        ChatClient chatClient =
                ChatClient.builder(chatModel)
                        .defaultOptions(options.build())
                        .defaultAdvisors(new SimpleLoggerAdvisor())
                        .build();
        return new ChatClientReasoningBackend("secondary", chatClient);
    }

    /** Runs synthesis model calls so a hung call can be abandoned at the budget. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService synthesisExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("synthesis-"));
    }

    private static ReasoningBackend anthropic(
            String name, AnthropicChatModel chatModel, InvestigationProperties.Model settings) {
        if (!settings.enabled()) {
            log.warn(">>> {} model disabled", name);
            return new DisabledReasoningBackend(name);
        }
        AnthropicChatOptions.Builder options =
                AnthropicChatOptions.builder()
                        .temperature(settings.temperature())
                        .maxTokens(settings.maxTokens());
        if (settings.model() != null) {
            options.model(settings.model());
        }
        ChatClient chatClient =
                ChatClient.builder(chatModel)
                        // Prompt & token usage at DEBUG
                        .defaultAdvisors(new SimpleLoggerAdvisor())
                        .defaultOptions(options.build())
                        .build();
        return new ChatClientReasoningBackend(name, chatClient);
    }
}
