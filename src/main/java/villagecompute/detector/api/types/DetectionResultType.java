/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful single-item detection outcome.
 *
 * @param attributes
 *            extracted attributes
 * @param cache
 *            true when served from the result cache without a model or heuristic call
 * @param custom
 *            true when the caller supplied its own model/credential pair
 * @param model
 *            effective model identifier the result is keyed under
 * @param source
 *            cache, model or heuristic
 * @param timeMs
 *            processing time in milliseconds
 */
public record DetectionResultType(@JsonProperty("attributes") AttributeSet attributes,
        @JsonProperty("cache") boolean cache, @JsonProperty("is_custom") boolean custom,
        @JsonProperty("model") String model, @JsonProperty("source") ResultSource source,
        @JsonProperty("time") long timeMs) {

    /**
     * Returns a copy with the processing time replaced.
     */
    public DetectionResultType withTime(long elapsedMs) {
        return new DetectionResultType(attributes, cache, custom, model, source, elapsedMs);
    }
}
