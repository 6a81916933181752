/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of validating an HS code against the catalogue.
 *
 * @param code
 *            code as supplied, digits only
 * @param valid
 *            true on an exact or 6-digit prefix match
 * @param match
 *            matched catalogue entry, when any
 * @param similar
 *            other codes sharing the 4-digit heading, for invalid codes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HsCodeValidationType(@JsonProperty("code") String code, @JsonProperty("valid") boolean valid,
        @JsonProperty("match") HsCodeItemType match, @JsonProperty("similar") List<HsCodeItemType> similar) {

    public HsCodeValidationType {
        similar = similar == null ? List.of() : List.copyOf(similar);
    }
}
