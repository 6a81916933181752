/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One extracted attribute: its value, the source text that supports it, and a confidence score.
 *
 * <p>
 * The value is either a {@link String} (scalar attributes) or an immutable {@code List<String>} (list-valued
 * attributes, see {@link AttributeName#isListValued()}). Instances built through {@link #of} always satisfy the
 * invariant that a confidence of 0.0 goes together with the attribute's sentinel value and {@code "none"} evidence.
 *
 * @param value
 *            extracted value ({@code String} or {@code List<String>})
 * @param evidence
 *            quoted source text supporting the value, or {@code "none"}
 * @param confidence
 *            extractor certainty in [0.0, 1.0]
 */
public record AttributeField(@JsonProperty("value") Object value, @JsonProperty("evidence") String evidence,
        @JsonProperty("confidence") double confidence) {

    public AttributeField {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0]: " + confidence);
        }
        if (value instanceof List<?> list) {
            value = List.copyOf(list);
        } else if (value != null && !(value instanceof String)) {
            throw new IllegalArgumentException("value must be a String or a List<String>: " + value.getClass());
        }
        if (evidence == null || evidence.isBlank()) {
            evidence = AttributeName.NONE;
        }
    }

    /**
     * Returns the "nothing found" field for an attribute.
     */
    public static AttributeField unknown(AttributeName name) {
        return new AttributeField(name.unknownValue(), AttributeName.NONE, 0.0);
    }

    /**
     * Builds a field for a list-valued or scalar attribute, collapsing empty values and zero confidence to
     * {@link #unknown(AttributeName)}.
     *
     * @param name
     *            attribute the field belongs to
     * @param value
     *            {@code String} or {@code List<String>}; a scalar is wrapped for list-valued attributes and a list is
     *            joined with {@code ", "} for scalar ones
     * @param evidence
     *            supporting text
     * @param confidence
     *            certainty, clamped to [0.0, 1.0]
     * @return the field
     */
    public static AttributeField of(AttributeName name, Object value, String evidence, double confidence) {
        double clamped = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        Object shaped = shape(name, value);
        if (clamped == 0.0 || isEmptyValue(shaped)) {
            return unknown(name);
        }
        return new AttributeField(shaped, evidence, clamped);
    }

    /**
     * Returns the value as a list: the list itself for list-valued fields, a one-element list for a known scalar,
     * and an empty list for the sentinel.
     */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public List<String> valueList() {
        if (value instanceof List<?>) {
            return (List<String>) value;
        }
        if (value == null || AttributeName.NONE.equals(value)) {
            return List.of();
        }
        return List.of((String) value);
    }

    @JsonIgnore
    public boolean isUnknown() {
        return confidence == 0.0;
    }

    private static Object shape(AttributeName name, Object value) {
        if (name.isListValued()) {
            if (value instanceof List<?> list) {
                return list.stream().filter(v -> v != null && !v.toString().isBlank()).map(v -> v.toString().trim())
                        .distinct().toList();
            }
            if (value == null || value.toString().isBlank() || AttributeName.NONE.equalsIgnoreCase(value.toString())) {
                return List.of();
            }
            return List.of(value.toString().trim());
        }
        if (value instanceof List<?> list) {
            return String.join(", ", list.stream().filter(v -> v != null).map(v -> v.toString().trim())
                    .filter(v -> !v.isEmpty()).toList());
        }
        return value == null ? AttributeName.NONE : value.toString().trim();
    }

    private static boolean isEmptyValue(Object value) {
        if (value instanceof List<?> list) {
            return list.isEmpty();
        }
        return value == null || value.toString().isBlank() || AttributeName.NONE.equalsIgnoreCase(value.toString());
    }
}
