/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.integration.ai;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.detector.api.types.AttributeName;
import villagecompute.detector.config.TestConfigs;

/**
 * Unit tests for prompt construction in {@link ModelClient}.
 */
class ModelClientTest {

    private ModelClient modelClient;

    @BeforeEach
    void setUp() {
        modelClient = new ModelClient();
        modelClient.aiConfig = TestConfigs.aiConfig();
        modelClient.detectorConfig = TestConfigs.detectorConfig();
    }

    @Test
    void testBuildPrompt_listsRequestedAttributesOnly() {
        String prompt = modelClient.buildPrompt("Made in Wales", List.of(AttributeName.COUNTRY, AttributeName.SIZE));

        assertTrue(prompt.contains("Made in Wales"));
        assertTrue(prompt.contains("\"country\": {\"value\": []"));
        assertTrue(prompt.contains("\"size\": {\"value\": \"none\""));
        assertFalse(prompt.contains("\"hscode\""));
    }

    @Test
    void testBuildPrompt_truncatesLongInput() {
        String longText = "x".repeat(1500);

        String prompt = modelClient.buildPrompt(longText, List.of(AttributeName.COUNTRY));

        assertTrue(prompt.contains("x".repeat(1000) + "..."));
        assertFalse(prompt.contains("x".repeat(1001)));
    }
}
