/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.exceptions;

/**
 * Exception thrown by the model client when a call fails, classified by {@link ModelFailureKind}.
 */
public class ModelCallException extends RuntimeException {

    private final ModelFailureKind kind;

    public ModelCallException(ModelFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelCallException(ModelFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ModelFailureKind getKind() {
        return kind;
    }

    public boolean isRecoverable() {
        return kind.isRecoverable();
    }
}
