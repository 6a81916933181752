package villagecompute.detector.exceptions;

import villagecompute.detector.api.types.ErrorCode;

/**
 * Exception thrown when request validation fails (missing text, unpaired model override, malformed credential).
 *
 * <p>
 * Always maps to {@link ErrorCode#VALIDATION_ERROR} and HTTP 400. Validation failures are raised before the cache or
 * model is touched.
 */
public class ValidationException extends DetectionException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
