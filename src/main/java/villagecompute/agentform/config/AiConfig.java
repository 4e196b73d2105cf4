/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.agentform.config;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Configuration class for the LangChain4j chat model backing the LLM workflow engine.
 *
 * <p>
 * This class performs startup validation to ensure the Anthropic API key is configured, then produces the single
 * {@link ChatModel} used by response analysis and dynamic question generation.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code quarkus.langchain4j.anthropic.api-key} - Anthropic API key (from ANTHROPIC_API_KEY env var)</li>
 * <li>{@code ai.model.name} - model name (default: claude-3-5-sonnet-20241022)</li>
 * <li>{@code ai.model.temperature} - Sampling temperature (default: 0.2)</li>
 * <li>{@code ai.model.max-tokens} - Max output tokens (default: 2048)</li>
 * <li>{@code ai.model.timeout-seconds} - Request timeout (default: 60)</li>
 * <li>{@code ai.model.max-retries} - client-level retries (default: 0; retries are owned by the step's retry
 * policy)</li>
 * </ul>
 *
 * @see villagecompute.agentform.integration.ai.ChatModelLlmWorkflow
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "quarkus.langchain4j.anthropic.api-key",
            defaultValue = "")
    String apiKey;

    @ConfigProperty(
            name = "ai.model.name",
            defaultValue = "claude-3-5-sonnet-20241022")
    String modelName;

    @ConfigProperty(
            name = "ai.model.temperature",
            defaultValue = "0.2")
    double temperature;

    @ConfigProperty(
            name = "ai.model.max-tokens",
            defaultValue = "2048")
    int maxTokens;

    @ConfigProperty(
            name = "ai.model.timeout-seconds",
            defaultValue = "60")
    int timeoutSeconds;

    @ConfigProperty(
            name = "ai.model.max-retries",
            defaultValue = "0")
    int maxRetries;

    /**
     * Fails startup when the Anthropic API key is missing.
     *
     * @throws AiConfigurationException
     *             if the Anthropic API key is not configured
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey == null || apiKey.trim().isEmpty()) {
            String errorMessage = "ANTHROPIC_API_KEY environment variable is not configured. "
                    + "The LLM workflow engine requires a valid Anthropic API key. "
                    + "Please set the ANTHROPIC_API_KEY environment variable and restart the application.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        LOG.infof("LangChain4j configured with model: %s", modelName);
    }

    /**
     * Produces the ChatModel bean for LLM workflows.
     *
     * @return configured Anthropic ChatModel
     */
    @Produces
    @ApplicationScoped
    public ChatModel createChatModel() {
        LOG.infof("Creating ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%ds, maxRetries=%d",
                modelName, temperature, maxTokens, timeoutSeconds, maxRetries);

        return AnthropicChatModel.builder().apiKey(apiKey).modelName(modelName).temperature(temperature)
                .maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds)).maxRetries(maxRetries)
                .logRequests(false).logResponses(false).build();
    }

    /**
     * Exception thrown when AI configuration is invalid or incomplete.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }

        public AiConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
