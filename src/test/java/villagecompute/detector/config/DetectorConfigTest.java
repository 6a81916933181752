/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import villagecompute.detector.api.types.AttributeName;
import villagecompute.detector.config.AiConfig.AiConfigurationException;

/**
 * Unit tests for {@link DetectorConfig}.
 */
class DetectorConfigTest {

    @Test
    void testAttributesResolvedInDeclarationOrder() {
        DetectorConfig config = TestConfigs.detectorConfig();
        config.attributeNames = List.of("hscode", " Country ", "size");

        config.validateConfiguration();

        assertEquals(List.of(AttributeName.COUNTRY, AttributeName.SIZE, AttributeName.HSCODE), config.attributes());
    }

    @Test
    void testUnknownAttributeRejected() {
        DetectorConfig config = TestConfigs.detectorConfig();
        config.attributeNames = List.of("country", "weight");

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testEmptyAttributesRejected() {
        DetectorConfig config = TestConfigs.detectorConfig();
        config.attributeNames = List.of();

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testAdmissionThresholdOutOfRangeRejected() {
        DetectorConfig config = TestConfigs.detectorConfig();
        config.cacheAdmissionThreshold = 1.5;

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testNonPositiveCacheBoundRejected() {
        DetectorConfig config = TestConfigs.detectorConfig();
        config.cacheMaxEntries = 0;

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testBlankSecurityKeyDisablesCheck() {
        DetectorConfig config = TestConfigs.securedConfig("   ");

        assertTrue(config.securityApiKey().isEmpty());
        assertEquals(Optional.of("secret"), TestConfigs.securedConfig(" secret ").securityApiKey());
    }
}
