/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

/**
 * Fixed taxonomy of user-visible error codes.
 *
 * <p>
 * Internal parse/transient model failures have no code here: they are absorbed by the heuristic fallback and never
 * reach the caller.
 */
public enum ErrorCode {

    /** Malformed or incomplete request. Never retried by the service. */
    VALIDATION_ERROR,

    /** Invalid or revoked model credential. */
    AUTH_ERROR,

    /** Model rate limit or quota exhausted; the caller should retry later. */
    QUOTA_ERROR,

    /** Unknown or inaccessible model identifier. */
    MODEL_NOT_FOUND,

    /** Required process-wide configuration missing at startup. */
    INIT_ERROR,

    /** Unexpected failure inside the service. */
    INTERNAL_ERROR
}
