/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.detector.api.types.DetectionRequestType;
import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.exceptions.ValidationException;

/**
 * Unit tests for {@link RequestValidator}.
 */
class RequestValidatorTest {

    private static final String VALID_KEY = "sk-ant-custom-0123456789";

    private RequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RequestValidator();
    }

    @Test
    void testMissingText() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new DetectionRequestType(null, "  ", null, null)));

        assertEquals(ErrorCode.VALIDATION_ERROR, e.getCode());
        assertEquals(RequestValidator.MISSING_TEXT, e.getMessage());
    }

    @Test
    void testNullRequest() {
        assertThrows(ValidationException.class, () -> validator.validate(null));
    }

    @Test
    void testTitleOnlyIsValid() {
        assertDoesNotThrow(() -> validator.validate(new DetectionRequestType("Cotton T-shirt", null, null, null)));
    }

    @Test
    void testModelWithoutKey() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new DetectionRequestType(null, "Made in Wales", "claude-custom", null)));

        assertEquals(RequestValidator.MODEL_WITHOUT_KEY, e.getMessage());
        assertTrue(e.getMessage().contains("provide both"));
    }

    @Test
    void testKeyWithoutModel() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new DetectionRequestType(null, "Made in Wales", " ", VALID_KEY)));

        assertEquals(RequestValidator.KEY_WITHOUT_MODEL, e.getMessage());
        assertTrue(e.getMessage().contains("provide both"));
    }

    @Test
    void testShortApiKey() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new DetectionRequestType(null, "Made in Wales", "claude-custom", "short")));

        assertEquals("Invalid API key format", e.getMessage());
    }

    @Test
    void testShortModelName() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new DetectionRequestType(null, "Made in Wales", "cl", VALID_KEY)));

        assertEquals("Invalid model name format", e.getMessage());
    }

    @Test
    void testCompleteOverrideIsValid() {
        assertDoesNotThrow(
                () -> validator.validate(new DetectionRequestType(null, "Made in Wales", "claude-custom", VALID_KEY)));
    }

    @Test
    void testValidateOverride_noOverrideIsValid() {
        assertDoesNotThrow(() -> validator.validateOverride(null, null));
        assertDoesNotThrow(() -> validator.validateOverride("", " "));
    }
}
