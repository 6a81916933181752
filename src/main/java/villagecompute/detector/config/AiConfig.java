/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.config;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.exceptions.DetectionException;

/**
 * Configuration for the LangChain4j Anthropic model used by the detector.
 *
 * <p>
 * This class performs startup validation to ensure the process-wide Anthropic API key is configured. Without it the
 * application refuses to boot, so a missing key surfaces as {@link ErrorCode#INIT_ERROR} once, at startup, instead of
 * as a failure on every request.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code detector.model.api-key} - Anthropic API key (from ANTHROPIC_API_KEY env var)</li>
 * <li>{@code detector.model.name} - default model name (default: claude-3-5-haiku-20241022)</li>
 * <li>{@code detector.model.base-url} - optional API base URL override</li>
 * <li>{@code detector.model.temperature} - sampling temperature (default: 0.0)</li>
 * <li>{@code detector.model.max-tokens} - max output tokens (default: 1024)</li>
 * <li>{@code detector.model.timeout} - HTTP request timeout (default: 30s)</li>
 * <li>{@code detector.model.max-retries} - retry attempts inside the client (default: 1)</li>
 * <li>{@code detector.model.call-timeout-seconds} - fault tolerance guard around one whole model call, retries
 * included (default: 60); must cover {@code timeout * (max-retries + 1)}</li>
 * <li>{@code detector.model.max-input-chars} - description truncation length in prompts (default: 1000)</li>
 * <li>{@code detector.model.override-cache-size} - caller-supplied model instances kept (default: 50)</li>
 * </ul>
 *
 * @see villagecompute.detector.integration.ai.AnthropicClientFactory
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "detector.model.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "detector.model.name",
            defaultValue = "claude-3-5-haiku-20241022")
    String modelName;

    @ConfigProperty(
            name = "detector.model.base-url")
    Optional<String> baseUrl;

    @ConfigProperty(
            name = "detector.model.temperature",
            defaultValue = "0.0")
    double temperature;

    @ConfigProperty(
            name = "detector.model.max-tokens",
            defaultValue = "1024")
    int maxTokens;

    @ConfigProperty(
            name = "detector.model.timeout",
            defaultValue = "30s")
    Duration timeout;

    @ConfigProperty(
            name = "detector.model.max-retries",
            defaultValue = "1")
    int maxRetries;

    @ConfigProperty(
            name = "detector.model.call-timeout-seconds",
            defaultValue = "60")
    long callTimeoutSeconds;

    @ConfigProperty(
            name = "detector.model.max-input-chars",
            defaultValue = "1000")
    int maxInputChars;

    @ConfigProperty(
            name = "detector.model.override-cache-size",
            defaultValue = "50")
    int overrideCacheSize;

    /**
     * Performs startup validation to ensure the Anthropic API key is configured.
     *
     * @throws AiConfigurationException
     *             if the Anthropic API key is not configured
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey() == null) {
            String errorMessage = "ANTHROPIC_API_KEY environment variable is not configured. "
                    + "The detector requires a valid Anthropic API key for its default model. "
                    + "Please set the ANTHROPIC_API_KEY environment variable and restart the application.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        if (maxInputChars <= 0) {
            throw new AiConfigurationException("detector.model.max-input-chars must be positive: " + maxInputChars);
        }
        Duration worstCase = timeout.multipliedBy(maxRetries + 1L);
        if (worstCase.compareTo(Duration.ofSeconds(callTimeoutSeconds)) > 0) {
            throw new AiConfigurationException("detector.model.call-timeout-seconds (" + callTimeoutSeconds
                    + ") is shorter than detector.model.timeout x (max-retries + 1) = " + worstCase.toSeconds() + "s");
        }
        LOG.infof("Detector model configured: model=%s, temperature=%.2f, maxTokens=%d, timeout=%s, maxRetries=%d",
                modelName, temperature, maxTokens, timeout, maxRetries);
    }

    /**
     * Configured key, trimmed, or null when absent or blank.
     */
    public String apiKey() {
        if (apiKey == null) {
            return null;
        }
        return apiKey.map(String::trim).filter(key -> !key.isEmpty()).orElse(null);
    }

    public long callTimeoutSeconds() {
        return callTimeoutSeconds;
    }

    public String modelName() {
        return modelName;
    }

    public Optional<String> baseUrl() {
        return baseUrl;
    }

    public double temperature() {
        return temperature;
    }

    public int maxTokens() {
        return maxTokens;
    }

    public Duration timeout() {
        return timeout;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int maxInputChars() {
        return maxInputChars;
    }

    public int overrideCacheSize() {
        return overrideCacheSize;
    }

    /**
     * Exception thrown when model configuration is invalid or incomplete. Always {@link ErrorCode#INIT_ERROR}.
     */
    public static class AiConfigurationException extends DetectionException {

        public AiConfigurationException(String message) {
            super(ErrorCode.INIT_ERROR, message);
        }

        public AiConfigurationException(String message, Throwable cause) {
            super(ErrorCode.INIT_ERROR, message, cause);
        }
    }
}
