/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured error reported for a failed request or a failed batch item.
 *
 * @param code
 *            error code from the fixed taxonomy
 * @param message
 *            human-readable explanation
 */
public record ErrorEnvelopeType(@JsonProperty("code") ErrorCode code, @JsonProperty("message") String message) {
}
