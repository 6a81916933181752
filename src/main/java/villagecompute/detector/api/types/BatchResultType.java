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
 * Ordered batch outcome with aggregate counters.
 *
 * @param results
 *            per-item outcomes in request order
 * @param total
 *            number of items
 * @param cacheHits
 *            items served from the result cache
 * @param aiCalls
 *            items that invoked the model
 * @param fallbacks
 *            items answered by the heuristic extractor
 * @param errors
 *            items that failed
 * @param model
 *            effective model for the batch
 * @param timeMs
 *            wall-clock time for the whole batch in milliseconds
 */
public record BatchResultType(@JsonProperty("results") List<BatchItemResultType> results,
        @JsonProperty("total") int total, @JsonProperty("cache_hits") int cacheHits,
        @JsonProperty("ai_calls") int aiCalls, @JsonProperty("fallbacks") int fallbacks,
        @JsonProperty("errors") int errors, @JsonProperty("model") String model, @JsonProperty("time") long timeMs) {

    public BatchResultType {
        results = List.copyOf(results);
    }

    @JsonIgnore
    public BatchStatus status() {
        return BatchStatus.of(total, errors);
    }
}
