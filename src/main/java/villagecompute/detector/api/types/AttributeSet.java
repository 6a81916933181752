/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Immutable mapping from attribute name to extracted field.
 *
 * <p>
 * An attribute set is built fresh per request, never mutated after assembly, and is the unit stored in the result
 * cache and returned to callers. Serializes as a JSON object keyed by wire name, e.g.
 *
 * <pre>
 * {"country": {"value": ["GB"], "evidence": "Made in Wales", "confidence": 1.0}, "size": {...}}
 * </pre>
 *
 * @param fields
 *            fields keyed by attribute, iterated in declaration order of {@link AttributeName}
 */
public record AttributeSet(Map<AttributeName, AttributeField> fields) {

    public AttributeSet {
        EnumMap<AttributeName, AttributeField> copy = new EnumMap<>(AttributeName.class);
        if (fields != null) {
            copy.putAll(fields);
        }
        fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a set with the unknown field for every requested attribute.
     */
    public static AttributeSet unknown(Collection<AttributeName> attributes) {
        EnumMap<AttributeName, AttributeField> map = new EnumMap<>(AttributeName.class);
        for (AttributeName name : attributes) {
            map.put(name, AttributeField.unknown(name));
        }
        return new AttributeSet(map);
    }

    /**
     * Returns the field for an attribute, or the unknown field if it was not extracted.
     */
    public AttributeField get(AttributeName name) {
        AttributeField field = fields.get(name);
        return field != null ? field : AttributeField.unknown(name);
    }

    /**
     * Returns a copy of this set with one field replaced.
     */
    public AttributeSet with(AttributeName name, AttributeField field) {
        EnumMap<AttributeName, AttributeField> map = new EnumMap<>(AttributeName.class);
        map.putAll(fields);
        map.put(name, field);
        return new AttributeSet(map);
    }

    /**
     * Highest confidence across all fields (0.0 for an empty set).
     */
    public double maxConfidence() {
        return fields.values().stream().mapToDouble(AttributeField::confidence).max().orElse(0.0);
    }

    @JsonValue
    public Map<String, AttributeField> toJson() {
        Map<String, AttributeField> json = new LinkedHashMap<>();
        fields.forEach((name, field) -> json.put(name.wireName(), field));
        return json;
    }
}
