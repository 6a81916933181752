/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a detection result came from.
 */
public enum ResultSource {

    CACHE,
    MODEL,
    HEURISTIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
