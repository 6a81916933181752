/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Product attributes the detector knows how to extract.
 *
 * <p>
 * Each attribute carries its wire name (the key used in JSON payloads and model prompts), whether its value is a list
 * or a scalar, and the "unknown" sentinel returned when nothing was found:
 * <ul>
 * <li>{@code country}, {@code target_user}: list-valued, sentinel {@code []}</li>
 * <li>{@code size}, {@code material}, {@code brand}, {@code color}, {@code hscode}: scalar, sentinel
 * {@code "none"}</li>
 * </ul>
 */
public enum AttributeName {

    COUNTRY("country", true),
    SIZE("size", false),
    MATERIAL("material", false),
    BRAND("brand", false),
    COLOR("color", false),
    TARGET_USER("target_user", true),
    HSCODE("hscode", false);

    /** Sentinel for scalar attributes and for evidence when nothing was found. */
    public static final String NONE = "none";

    private final String wireName;
    private final boolean listValued;

    AttributeName(String wireName, boolean listValued) {
        this.wireName = wireName;
        this.listValued = listValued;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isListValued() {
        return listValued;
    }

    /**
     * Returns the sentinel value for this attribute: an empty list for list-valued attributes, {@code "none"}
     * otherwise.
     */
    public Object unknownValue() {
        return listValued ? List.of() : NONE;
    }

    /**
     * Resolves an attribute from its wire name (case-insensitive, surrounding whitespace ignored).
     *
     * @param name
     *            wire name such as {@code "target_user"}
     * @return matching attribute, or empty if the name is unknown
     */
    public static Optional<AttributeName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values()).filter(a -> a.wireName.equalsIgnoreCase(trimmed)).findFirst();
    }
}
