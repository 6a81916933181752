/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.integration.ai;

import java.time.Duration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.detector.config.AiConfig;
import villagecompute.detector.util.ContentHasher;

/**
 * Factory for configured Anthropic chat model instances.
 *
 * <p>
 * <b>Model Selection Strategy:</b>
 * <ul>
 * <li><b>Default</b>: built once from {@code detector.model.*} and shared by every request without an override</li>
 * <li><b>Caller override</b>: built on first use for a model/credential pair and kept in a bounded Caffeine cache
 * (size {@code detector.model.override-cache-size}, expiring 30 minutes after last use)</li>
 * </ul>
 *
 * <p>
 * Override entries are keyed by model name and the SHA-256 of the credential, never the credential itself.
 *
 * <p>
 * <b>Retry Configuration:</b> All models share the configured timeout and retry count; the client retries rate-limit
 * and server errors internally before the failure reaches {@link ModelFailureClassifier}.
 *
 * @see villagecompute.detector.config.AiConfig
 */
@ApplicationScoped
public class AnthropicClientFactory {

    private static final Logger LOG = Logger.getLogger(AnthropicClientFactory.class);

    private static final Duration OVERRIDE_IDLE_EXPIRY = Duration.ofMinutes(30);

    @Inject
    AiConfig aiConfig;

    private volatile ChatModel defaultModel;

    private Cache<String, ChatModel> overrideModels;

    @PostConstruct
    void init() {
        overrideModels = Caffeine.newBuilder().maximumSize(aiConfig.overrideCacheSize())
                .expireAfterAccess(OVERRIDE_IDLE_EXPIRY).build();
    }

    /**
     * Returns the selection used when a request carries no override.
     */
    public ModelSelection defaultSelection() {
        return new ModelSelection(aiConfig.modelName(), aiConfig.apiKey(), false);
    }

    /**
     * Returns the chat model for a selection, building it if necessary.
     *
     * @param selection
     *            default or caller-supplied model and credential
     * @return configured chat model
     */
    public ChatModel chatModel(ModelSelection selection) {
        if (!selection.custom()) {
            return defaultChatModel();
        }
        String cacheKey = selection.model() + ":" + ContentHasher.sha256Hex(selection.apiKey());
        return overrideModels.get(cacheKey, k -> {
            LOG.infof("Creating override ChatModel: model=%s", selection.model());
            return createModel(selection.model(), selection.apiKey());
        });
    }

    /**
     * Returns the shared default model, built on first use.
     */
    public ChatModel defaultChatModel() {
        ChatModel model = defaultModel;
        if (model == null) {
            synchronized (this) {
                model = defaultModel;
                if (model == null) {
                    LOG.infof(
                            "Creating default ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%s, maxRetries=%d",
                            aiConfig.modelName(), aiConfig.temperature(), aiConfig.maxTokens(), aiConfig.timeout(),
                            aiConfig.maxRetries());
                    model = createModel(aiConfig.modelName(), aiConfig.apiKey());
                    defaultModel = model;
                }
            }
        }
        return model;
    }

    /**
     * Number of caller-supplied models currently held.
     */
    public long overrideModelCount() {
        overrideModels.cleanUp();
        return overrideModels.estimatedSize();
    }

    /**
     * Creates a configured Anthropic chat model.
     *
     * @param modelName
     *            Anthropic model identifier
     * @param apiKey
     *            credential
     * @return configured chat model instance
     */
    ChatModel createModel(String modelName, String apiKey) {
        AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder().apiKey(apiKey)
                .modelName(modelName).temperature(aiConfig.temperature()).maxTokens(aiConfig.maxTokens())
                .timeout(aiConfig.timeout()).maxRetries(aiConfig.maxRetries()).logRequests(false)
                .logResponses(false);
        aiConfig.baseUrl().ifPresent(builder::baseUrl);
        return builder.build();
    }
}
