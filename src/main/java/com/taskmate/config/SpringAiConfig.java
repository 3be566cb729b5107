package com.taskmate.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Chooses the Spring AI {@link ChatModel} the gateway talks to.
 *
 * <p>Both the OpenAI and Ollama starters are on the classpath; {@code spring.ai.model.chat}
 * decides which one auto-configures, and {@link AiProperties#getMode()} must agree with it.</p>
 */
@Configuration
@EnableConfigurationProperties({AiProperties.class, TaskMateProperties.class})
@Slf4j
public class SpringAiConfig {

    private final AiProperties properties;

    public SpringAiConfig(AiProperties properties) {
        this.properties = properties;
    }

    @Bean
    @Primary
    public ChatModel routingChatModel(
            ObjectProvider<OpenAiChatModel> openAiChatModelProvider,
            ObjectProvider<OllamaChatModel> ollamaChatModelProvider) {
        AiProperties.Mode mode = properties.getMode();
        log.info("Configuring Spring AI chat model for mode={} model={}", mode, properties.getModel());
        return switch (mode) {
            case OPENAI -> openAiChatModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("OpenAI mode selected but OpenAiChatModel bean is missing. " +
                        "Set spring.ai.model.chat=openai and configure spring.ai.openai.*.");
            });
            case OLLAMA -> ollamaChatModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("Ollama mode selected but OllamaChatModel bean is missing. " +
                        "Set spring.ai.model.chat=ollama and configure spring.ai.ollama.*.");
            });
        };
    }
}
