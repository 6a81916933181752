/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result cache statistics.
 *
 * <p>
 * Tracks hit rate and total hits/misses since startup (or the last statistics reset) alongside the current occupancy.
 * Target hit rate: &gt;50%.
 *
 * @param size
 *            current number of cached entries
 * @param maxEntries
 *            configured capacity
 * @param hits
 *            total cache hits
 * @param misses
 *            total cache misses
 * @param total
 *            total cache lookups (hits + misses)
 * @param hitRate
 *            cache hit rate percentage (0.0-100.0)
 */
public record CacheStatsType(@JsonProperty("size") int size, @JsonProperty("max_entries") int maxEntries,
        @JsonProperty("hits") long hits, @JsonProperty("misses") long misses, @JsonProperty("total") long total,
        @JsonProperty("hit_rate") double hitRate) {

    /**
     * Builds statistics from raw counters, computing the total and hit rate.
     */
    public static CacheStatsType of(int size, int maxEntries, long hits, long misses) {
        long total = hits + misses;
        double hitRate = total == 0 ? 0.0 : (hits * 100.0) / total;
        return new CacheStatsType(size, maxEntries, hits, misses, total, hitRate);
    }

    /**
     * Checks if cache hit rate meets target (>50%).
     *
     * @return true if hit rate exceeds 50%
     */
    @JsonProperty("meets_target")
    public boolean meetsTarget() {
        return hitRate > 50.0;
    }
}
