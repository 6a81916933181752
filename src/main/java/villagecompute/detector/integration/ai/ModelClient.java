/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.integration.ai;

import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Collectors;

import dev.langchain4j.model.chat.ChatModel;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;

import villagecompute.detector.api.types.AttributeName;
import villagecompute.detector.api.types.AttributeSet;
import villagecompute.detector.config.AiConfig;
import villagecompute.detector.config.DetectorConfig;
import villagecompute.detector.exceptions.ModelCallException;

/**
 * Calls the configured (or caller-supplied) Anthropic model to extract product attributes.
 *
 * <p>
 * <b>Extraction Process:</b>
 * <ol>
 * <li>Construct prompt with the attribute schema and the normalized description (truncated to
 * {@code detector.model.max-input-chars})</li>
 * <li>Send to Claude via LangChain4j</li>
 * <li>Parse JSON response with {@link ModelResponseParser}</li>
 * <li>Classify any failure with {@link ModelFailureClassifier}</li>
 * </ol>
 *
 * <p>
 * <b>Timeout:</b> the HTTP client enforces {@code detector.model.timeout} per attempt; the {@code @Timeout} guard bounds
 * the whole call including retries. Its value is overridden from {@code detector.model.call-timeout-seconds} in
 * {@code application.yaml}, and {@link AiConfig} refuses to start when that guard is shorter than every attempt
 * together. Either expiry surfaces as a failure classified as transient.
 */
@ApplicationScoped
public class ModelClient {

    private static final Logger LOG = Logger.getLogger(ModelClient.class);

    @Inject
    AnthropicClientFactory clientFactory;

    @Inject
    ModelResponseParser responseParser;

    @Inject
    AiConfig aiConfig;

    @Inject
    DetectorConfig detectorConfig;

    /**
     * Extracts attributes from normalized text.
     *
     * @param normalizedText
     *            non-empty normalized text
     * @param selection
     *            model and credential to use
     * @return parsed attributes covering the configured attributes
     * @throws ModelCallException
     *             classified failure
     */
    @Timeout(
            value = 60,
            unit = ChronoUnit.SECONDS)
    public AttributeSet extract(String normalizedText, ModelSelection selection) {
        String prompt = buildPrompt(normalizedText, detectorConfig.attributes());
        String response;
        try {
            ChatModel chatModel = clientFactory.chatModel(selection);
            LOG.debugf("Sending detection request: model=%s, custom=%b, inputChars=%d", selection.model(),
                    selection.custom(), normalizedText.length());
            response = chatModel.chat(prompt);
        } catch (RuntimeException e) {
            ModelCallException failure = ModelFailureClassifier.toModelCallException(e, selection.model());
            LOG.warnf(e, "Model call failed: model=%s, kind=%s", selection.model(), failure.getKind());
            throw failure;
        }

        AttributeSet attributes = responseParser.parse(response, detectorConfig.attributes(),
                detectorConfig.countryCodeFormat());
        LOG.debugf("Model extraction complete: model=%s, maxConfidence=%.2f, outputChars=%d", selection.model(),
                attributes.maxConfidence(), response.length());
        return attributes;
    }

    /**
     * Builds the extraction prompt.
     *
     * @param normalizedText
     *            normalized text (truncated if too long)
     * @param attributes
     *            attributes to request
     * @return formatted prompt string
     */
    String buildPrompt(String normalizedText, List<AttributeName> attributes) {
        int maxInputChars = aiConfig.maxInputChars();
        String description = normalizedText.length() > maxInputChars
                ? normalizedText.substring(0, maxInputChars) + "..."
                : normalizedText;

        String schema = attributes.stream().map(ModelClient::schemaLine).collect(Collectors.joining(",\n"));
        String rules = attributes.stream().map(ModelClient::ruleLine).filter(rule -> !rule.isEmpty())
                .collect(Collectors.joining("\n"));

        return String.format("""
                You extract product attributes from product descriptions written in any language.

                INSTRUCTIONS:
                1. Report only what the text states. Do not infer the country of origin from the shipping origin,
                   the seller's location or the brand's home country.
                2. For each attribute give the value, the exact source text that supports it as evidence, and a
                   confidence between 0.0 and 1.0.
                3. When an attribute is not stated, use the empty value shown below with evidence "none" and
                   confidence 0.0.
                %s

                DESCRIPTION:
                %s

                Respond with ONLY valid JSON in this exact format (no markdown, no explanation):
                {
                  "attributes": {
                %s
                  }
                }
                """, rules, description, schema);
    }

    private static String schemaLine(AttributeName name) {
        String value = name.isListValued() ? "[]" : "\"none\"";
        return "    \"" + name.wireName() + "\": {\"value\": " + value + ", \"evidence\": \"none\", \"confidence\": 0.0}";
    }

    private static String ruleLine(AttributeName name) {
        return switch (name) {
            case COUNTRY -> "- country: ISO 3166-1 alpha-2 codes for the country of manufacture or origin, as a list "
                    + "(e.g. \"Indonesia / Vietnam\" -> [\"ID\", \"VN\"]). Map constituent countries and territories "
                    + "to their sovereign state (\"Made in Wales\" -> [\"GB\"]). Use confidence 1.0 for explicit "
                    + "phrases such as \"Made in\", \"原産国\" or \"製造国\". Use [] when unknown; never \"ZZ\".";
            case SIZE -> "- size: the size designation or dimensions as written (e.g. \"M\", \"23.5cm\").";
            case MATERIAL -> "- material: the main material or composition (e.g. \"cotton 100%\").";
            case BRAND -> "- brand: the brand or manufacturer name.";
            case COLOR -> "- color: the color name as written.";
            case TARGET_USER -> "- target_user: a list chosen from \"children\", \"adult\", \"men\", \"women\", "
                    + "\"senior\", \"baby\", \"unisex\".";
            case HSCODE -> "- hscode: the most specific Harmonized System code for the product, digits only.";
        };
    }
}
