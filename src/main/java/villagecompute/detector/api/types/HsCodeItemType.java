/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One HS code catalogue entry with its Japanese, Chinese and English descriptions.
 *
 * @param ja
 *            Japanese description
 * @param cn
 *            Chinese description
 * @param en
 *            English description
 * @param hscode
 *            harmonized system code, digits only
 */
public record HsCodeItemType(@JsonProperty("ja") String ja, @JsonProperty("cn") String cn,
        @JsonProperty("en") String en, @JsonProperty("hscode") String hscode) {
}
