/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import villagecompute.detector.api.types.DetectionRequestType;
import villagecompute.detector.exceptions.ValidationException;

/**
 * Validation rules applied before a request touches the cache or the model.
 *
 * <p>
 * <b>Rules:</b>
 * <ul>
 * <li>At least one of title/description must contain non-whitespace text</li>
 * <li>{@code model} and {@code api_key} must be supplied together or not at all</li>
 * <li>A supplied model name must have at least 3 characters</li>
 * <li>A supplied credential must have at least 20 characters</li>
 * </ul>
 */
@ApplicationScoped
public class RequestValidator {

    static final int MIN_MODEL_LENGTH = 3;
    static final int MIN_API_KEY_LENGTH = 20;

    static final String MISSING_TEXT = "Either 'title' or 'description' must be provided";
    static final String MODEL_WITHOUT_KEY = "Custom model requires custom api_key. "
            + "Please provide both 'model' and 'api_key' together, or omit both to use defaults.";
    static final String KEY_WITHOUT_MODEL = "Custom api_key requires custom model. "
            + "Please provide both 'model' and 'api_key' together, or omit both to use defaults.";
    static final String INVALID_MODEL = "Invalid model name format";
    static final String INVALID_API_KEY = "Invalid API key format";

    @Inject
    Validator beanValidator;

    /**
     * Validates a single detection request.
     *
     * @throws ValidationException
     *             on the first violated rule
     */
    public void validate(DetectionRequestType request) {
        if (request == null || (isBlank(request.title()) && isBlank(request.description()))) {
            throw new ValidationException(MISSING_TEXT);
        }
        if (beanValidator != null) {
            Set<ConstraintViolation<DetectionRequestType>> violations = beanValidator.validate(request);
            if (!violations.isEmpty()) {
                ConstraintViolation<DetectionRequestType> first = violations.iterator().next();
                throw new ValidationException("'" + first.getPropertyPath() + "' " + first.getMessage());
            }
        }
        validateOverride(request.model(), request.apiKey());
    }

    /**
     * Validates a model/credential override on its own, as shared by a batch.
     *
     * @throws ValidationException
     *             if the pair is incomplete or malformed
     */
    public void validateOverride(String model, String apiKey) {
        boolean hasModel = !isBlank(model);
        boolean hasKey = !isBlank(apiKey);
        if (hasModel && !hasKey) {
            throw new ValidationException(MODEL_WITHOUT_KEY);
        }
        if (hasKey && !hasModel) {
            throw new ValidationException(KEY_WITHOUT_MODEL);
        }
        if (!hasModel) {
            return;
        }
        if (model.trim().length() < MIN_MODEL_LENGTH) {
            throw new ValidationException(INVALID_MODEL);
        }
        if (apiKey.trim().length() < MIN_API_KEY_LENGTH) {
            throw new ValidationException(INVALID_API_KEY);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
