/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.exceptions;

import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.api.types.ErrorEnvelopeType;

/**
 * Exception carrying a user-visible error code out of the detection pipeline.
 *
 * <p>
 * Extends RuntimeException per project standards. REST resources map the code onto an HTTP status; the batch
 * coordinator localizes it to the failing item's slot.
 */
public class DetectionException extends RuntimeException {

    private final ErrorCode code;

    public DetectionException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DetectionException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorEnvelopeType toEnvelope() {
        return new ErrorEnvelopeType(code, getMessage());
    }
}
