/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

/**
 * Aggregate status of a batch that passed batch-level validation.
 */
public enum BatchStatus {

    /** Every item produced attributes. */
    COMPLETE,

    /** At least one item failed and at least one succeeded. */
    PARTIAL,

    /** Every item failed. */
    FAILED;

    public static BatchStatus of(int total, int errors) {
        if (errors == 0) {
            return COMPLETE;
        }
        return errors >= total ? FAILED : PARTIAL;
    }
}
