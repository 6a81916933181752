/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.config;

/**
 * How a request's title and description are combined into the text that is fingerprinted and sent to the model.
 */
public enum TextStrategy {

    /** The normalized description when non-empty, otherwise the normalized title. */
    DESCRIPTION_FIRST,

    /** {@code title + " / " + description}, skipping empty parts. */
    CONCATENATE
}
