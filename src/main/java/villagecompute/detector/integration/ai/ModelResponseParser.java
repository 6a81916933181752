/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.integration.ai;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.detector.api.types.AttributeField;
import villagecompute.detector.api.types.AttributeName;
import villagecompute.detector.api.types.AttributeSet;
import villagecompute.detector.config.CountryCodeFormat;
import villagecompute.detector.exceptions.ModelCallException;
import villagecompute.detector.exceptions.ModelFailureKind;
import villagecompute.detector.util.CountryCodes;

/**
 * Parses the model's textual answer into an {@link AttributeSet}.
 *
 * <p>
 * <b>Expected format:</b> {@code {"attributes": {"country": {"value": ["JP"], "evidence": "...", "confidence":
 * 1.0}, ...}}}, optionally wrapped in Markdown code fences or surrounded by prose.
 *
 * <p>
 * <b>Sanitization:</b>
 * <ul>
 * <li>Scalar values of list-valued attributes are wrapped into one-element lists</li>
 * <li>Newlines and runs of whitespace in values and evidence collapse to single spaces</li>
 * <li>Confidence is clamped to [0.0, 1.0]; missing confidence counts as 0.0</li>
 * <li>Country codes are validated (alpha-2, alpha-3 or name accepted; unknown and {@code ZZ} dropped) and rendered in
 * the configured profile</li>
 * <li>HS codes keep digits only</li>
 * <li>Attributes the model omitted, or that were not requested, are the unknown field</li>
 * </ul>
 *
 * <p>
 * Anything that is not JSON with an {@code attributes} object fails with {@link ModelFailureKind#PARSE}.
 */
@ApplicationScoped
public class ModelResponseParser {

    private static final Logger LOG = Logger.getLogger(ModelResponseParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGITS = Pattern.compile("[^0-9]");

    @Inject
    ObjectMapper objectMapper;

    /**
     * Parses a model response.
     *
     * @param response
     *            raw model output
     * @param attributes
     *            attributes the result must cover
     * @param format
     *            country code profile
     * @return parsed attributes
     * @throws ModelCallException
     *             of kind PARSE when the response has no usable JSON
     */
    public AttributeSet parse(String response, List<AttributeName> attributes, CountryCodeFormat format) {
        if (response == null || response.isBlank()) {
            throw new ModelCallException(ModelFailureKind.PARSE, "Empty model response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(response));
        } catch (JsonProcessingException e) {
            LOG.warnf("Failed to parse model response as JSON: response=%s", abbreviate(response));
            throw new ModelCallException(ModelFailureKind.PARSE, "Model response is not valid JSON", e);
        }

        JsonNode attributesNode = root == null ? null : root.get("attributes");
        if (attributesNode == null || !attributesNode.isObject()) {
            LOG.warnf("Model response has no attributes object: response=%s", abbreviate(response));
            throw new ModelCallException(ModelFailureKind.PARSE, "Model response has no attributes object");
        }

        AttributeSet result = AttributeSet.unknown(attributes);
        for (AttributeName name : attributes) {
            JsonNode fieldNode = attributesNode.get(name.wireName());
            if (fieldNode != null && fieldNode.isObject()) {
                result = result.with(name, parseField(name, fieldNode, format));
            }
        }
        return result;
    }

    /**
     * Strips Markdown code fences and any prose around the outermost JSON object.
     */
    static String extractJson(String response) {
        String json = response.trim();
        if (json.startsWith("```json")) {
            json = json.substring(7);
        } else if (json.startsWith("```")) {
            json = json.substring(3);
        }
        if (json.endsWith("```")) {
            json = json.substring(0, json.length() - 3);
        }
        json = json.trim();

        if (!json.startsWith("{")) {
            int start = json.indexOf('{');
            int end = json.lastIndexOf('}');
            if (start >= 0 && end > start) {
                json = json.substring(start, end + 1);
            }
        }
        return json;
    }

    private AttributeField parseField(AttributeName name, JsonNode node, CountryCodeFormat format) {
        double confidence = confidence(node.get("confidence"));
        String evidence = clean(text(node.get("evidence")));
        List<String> values = values(node.get("value"));

        Object value = switch (name) {
            case COUNTRY -> countries(values, format);
            case TARGET_USER -> values.stream().map(v -> v.toLowerCase(Locale.ROOT)).distinct().toList();
            case HSCODE -> values.isEmpty() ? null : NON_DIGITS.matcher(values.get(0)).replaceAll("");
            default -> values;
        };
        return AttributeField.of(name, value, evidence, confidence);
    }

    private List<String> countries(List<String> values, CountryCodeFormat format) {
        List<String> codes = new ArrayList<>();
        for (String value : values) {
            CountryCodes.normalize(value).map(code -> CountryCodes.render(code, format)).filter(code -> !codes.contains(code))
                    .ifPresent(codes::add);
        }
        return codes;
    }

    private List<String> values(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                addValue(values, element);
            }
        } else {
            addValue(values, node);
        }
        return values;
    }

    private void addValue(List<String> values, JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return;
        }
        String cleaned = clean(node.asText());
        if (!cleaned.isEmpty() && !AttributeName.NONE.equalsIgnoreCase(cleaned)) {
            values.add(cleaned);
        }
    }

    private static double confidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            LOG.debugf("Non-numeric confidence treated as 0.0: %s", node.asText());
            return 0.0;
        }
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String clean(String value) {
        return value == null ? "" : WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    private static String abbreviate(String response) {
        return response.length() > 200 ? response.substring(0, 200) + "..." : response;
    }
}
