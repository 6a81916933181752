/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.config.AiConfig.AiConfigurationException;

/**
 * Unit tests for {@link AiConfig} validation logic.
 *
 * <p>
 * These tests verify that:
 * <ul>
 * <li>Validation succeeds when API key is configured</li>
 * <li>Validation fails with {@code INIT_ERROR} when API key is missing, empty or blank</li>
 * </ul>
 */
class AiConfigTest {

    @Test
    void testValidationSucceedsWithValidApiKey() {
        AiConfig config = TestConfigs.aiConfig();

        assertDoesNotThrow(() -> {
            config.validateConfiguration();
        }, "Validation should succeed with a valid API key");
    }

    @Test
    void testValidationFailsWithMissingApiKey() {
        AiConfig config = TestConfigs.aiConfig();
        config.apiKey = Optional.empty();

        AiConfigurationException e = assertThrows(AiConfigurationException.class, () -> {
            config.validateConfiguration();
        }, "Validation should fail when API key is missing");
        assertEquals(ErrorCode.INIT_ERROR, e.getCode());
    }

    @Test
    void testValidationFailsWithEmptyApiKey() {
        AiConfig config = TestConfigs.aiConfig();
        config.apiKey = Optional.of("");

        assertThrows(AiConfigurationException.class, () -> {
            config.validateConfiguration();
        }, "Validation should fail when API key is empty");
    }

    @Test
    void testValidationFailsWithWhitespaceApiKey() {
        AiConfig config = TestConfigs.aiConfig();
        config.apiKey = Optional.of("   ");

        assertThrows(AiConfigurationException.class, () -> {
            config.validateConfiguration();
        }, "Validation should fail when API key is only whitespace");
        assertNull(config.apiKey());
    }

    @Test
    void testValidationFailsWhenCallGuardShorterThanAllAttempts() {
        AiConfig config = TestConfigs.aiConfig();
        config.timeout = Duration.ofSeconds(30);
        config.maxRetries = 2;
        config.callTimeoutSeconds = 60;

        AiConfigurationException e = assertThrows(AiConfigurationException.class, config::validateConfiguration);
        assertEquals(ErrorCode.INIT_ERROR, e.getCode());

        config.callTimeoutSeconds = 90;
        assertDoesNotThrow(config::validateConfiguration);
    }

    @Test
    void testValidationFailsWithNonPositiveInputLimit() {
        AiConfig config = TestConfigs.aiConfig();
        config.maxInputChars = 0;

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testApiKeyIsTrimmed() {
        AiConfig config = TestConfigs.aiConfig();
        config.apiKey = Optional.of("  " + TestConfigs.TEST_API_KEY + "\n");

        assertEquals(TestConfigs.TEST_API_KEY, config.apiKey());
    }
}
