/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.exceptions;

import villagecompute.detector.api.types.ErrorCode;

/**
 * Closed classification of model call failures.
 *
 * <p>
 * Recoverable kinds are absorbed by the heuristic fallback; the others surface to the caller with their error code.
 */
public enum ModelFailureKind {

    /** Empty, non-JSON, or attributes-less response. */
    PARSE(true, null),

    /** Transport error, timeout, 5xx, open circuit, or anything unclassified. */
    TRANSIENT(true, null),

    /** Invalid or revoked credential. */
    AUTH(false, ErrorCode.AUTH_ERROR),

    /** Rate limit or quota exhaustion. */
    QUOTA(false, ErrorCode.QUOTA_ERROR),

    /** Unknown or inaccessible model. */
    MODEL_NOT_FOUND(false, ErrorCode.MODEL_NOT_FOUND);

    private final boolean recoverable;
    private final ErrorCode errorCode;

    ModelFailureKind(boolean recoverable, ErrorCode errorCode) {
        this.recoverable = recoverable;
        this.errorCode = errorCode;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    /**
     * Error code surfaced for terminal kinds; null for recoverable ones.
     */
    public ErrorCode errorCode() {
        return errorCode;
    }
}
