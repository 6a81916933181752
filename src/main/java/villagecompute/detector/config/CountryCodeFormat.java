/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.config;

/**
 * ISO 3166-1 profile used when rendering country codes in results.
 */
public enum CountryCodeFormat {

    /** Two-letter codes such as {@code GB}. */
    ALPHA2,

    /** Three-letter codes such as {@code GBR}. */
    ALPHA3
}
