/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One title/description pair inside a batch request.
 *
 * @param title
 *            optional product title
 * @param description
 *            optional product description
 */
public record BatchItemType(@JsonProperty("title") String title, @JsonProperty("description") String description) {
}
