/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.detector.api.types.AttributeField;
import villagecompute.detector.api.types.AttributeName;
import villagecompute.detector.api.types.AttributeSet;
import villagecompute.detector.api.types.DetectionRequestType;
import villagecompute.detector.api.types.DetectionResultType;
import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.api.types.ResultSource;
import villagecompute.detector.config.DetectorConfig;
import villagecompute.detector.config.TestConfigs;
import villagecompute.detector.exceptions.DetectionException;
import villagecompute.detector.exceptions.ModelCallException;
import villagecompute.detector.exceptions.ModelFailureKind;
import villagecompute.detector.exceptions.ValidationException;
import villagecompute.detector.integration.ai.AnthropicClientFactory;
import villagecompute.detector.integration.ai.ModelClient;
import villagecompute.detector.integration.ai.ModelSelection;
import villagecompute.detector.observability.DetectionMetrics;
import villagecompute.detector.services.DetectionService.DetectionOutcome;

/**
 * Unit tests for {@link DetectionService}.
 *
 * <p>
 * Real normalizer, cache, heuristic extractor and HS code catalogue; the model client, client factory and metrics are
 * mocked.
 */
class DetectionServiceTest {

    private static final String CUSTOM_KEY = "sk-ant-custom-0123456789";

    @Mock
    ModelClient modelClient;

    @Mock
    AnthropicClientFactory clientFactory;

    @Mock
    DetectionMetrics metrics;

    private DetectionService service;
    private HeuristicExtractor heuristicExtractor;
    private ResultCache resultCache;
    private DetectorConfig detectorConfig;

    @BeforeEach
    void setUp() throws IOException {
        MockitoAnnotations.openMocks(this);
        service = newDetectionService(modelClient, clientFactory, metrics);
        heuristicExtractor = service.heuristicExtractor;
        resultCache = service.resultCache;
        detectorConfig = service.detectorConfig;
    }

    /**
     * Wires a detection service around the given mocks with default configuration.
     */
    static DetectionService newDetectionService(ModelClient modelClient, AnthropicClientFactory clientFactory,
            DetectionMetrics metrics) throws IOException {
        DetectorConfig config = TestConfigs.detectorConfig();

        TextNormalizer normalizer = new TextNormalizer();
        normalizer.detectorConfig = config;
        ResultCache cache = new ResultCache();
        cache.detectorConfig = config;
        HeuristicExtractor heuristic = new HeuristicExtractor();
        heuristic.detectorConfig = config;
        HsCodeCatalog catalog = new HsCodeCatalog();
        catalog.objectMapper = new ObjectMapper();
        try (InputStream is = DetectionServiceTest.class.getResourceAsStream("/hscode/hscode-catalog.json")) {
            catalog.load(is);
        }

        DetectionService service = new DetectionService();
        service.requestValidator = new RequestValidator();
        service.textNormalizer = normalizer;
        service.resultCache = cache;
        service.modelClient = modelClient;
        service.heuristicExtractor = heuristic;
        service.hsCodeCatalog = catalog;
        service.clientFactory = clientFactory;
        service.detectorConfig = config;
        service.metrics = metrics;

        when(clientFactory.defaultSelection())
                .thenReturn(new ModelSelection(TestConfigs.DEFAULT_MODEL, TestConfigs.TEST_API_KEY, false));
        return service;
    }

    @Test
    void testDetect_secondIdenticalRequestServedFromCache() {
        AttributeSet modelResult = modelResult(List.of("GB"), "Made in Wales", 1.0);
        when(modelClient.extract(anyString(), any(ModelSelection.class))).thenReturn(modelResult);

        DetectionResultType first = service.detect(DetectionRequestType.ofDescription("Made in Wales"));
        DetectionResultType second = service.detect(DetectionRequestType.ofDescription("Made in Wales"));

        assertFalse(first.cache());
        assertEquals(ResultSource.MODEL, first.source());
        assertTrue(second.cache());
        assertEquals(ResultSource.CACHE, second.source());
        assertEquals(first.attributes(), second.attributes());
        assertEquals(TestConfigs.DEFAULT_MODEL, second.model());
        verify(modelClient, times(1)).extract(eq("Made in Wales"), any(ModelSelection.class));
        verify(metrics).incrementCacheHit();
    }

    @Test
    void testDetect_normalizationMakesMarkupVariantsShareCacheEntry() {
        when(modelClient.extract(anyString(), any(ModelSelection.class)))
                .thenReturn(modelResult(List.of("GB"), "Made in Wales", 1.0));

        service.detect(DetectionRequestType.ofDescription("<p>Made in <b>Wales</b></p>"));
        DetectionResultType second = service.detect(DetectionRequestType.ofDescription("Made   in Wales"));

        assertTrue(second.cache());
    }

    @Test
    void testDetect_lowConfidenceResultNotCached() {
        when(modelClient.extract(anyString(), any(ModelSelection.class)))
                .thenReturn(modelResult(List.of("CN"), "ships from China", 0.4));

        DetectionResultType first = service.detect(DetectionRequestType.ofDescription("Ships from China"));
        DetectionResultType second = service.detect(DetectionRequestType.ofDescription("Ships from China"));

        assertFalse(first.cache());
        assertFalse(second.cache());
        assertEquals(0, resultCache.size());
        verify(modelClient, times(2)).extract(anyString(), any(ModelSelection.class));
    }

    @Test
    void testDetect_parseFailureFallsBackToHeuristic() {
        when(modelClient.extract(anyString(), any(ModelSelection.class)))
                .thenThrow(new ModelCallException(ModelFailureKind.PARSE, "Model response is not valid JSON"));

        DetectionOutcome outcome = service.detectWithOutcome(DetectionRequestType.ofDescription("Made in Wales"));

        assertEquals(heuristicExtractor.extract("Made in Wales"), outcome.result().attributes());
        assertEquals(ResultSource.HEURISTIC, outcome.result().source());
        assertFalse(outcome.result().cache());
        assertTrue(outcome.modelInvoked());
        assertTrue(outcome.fallback());
        assertEquals(List.of("GB"), outcome.result().attributes().get(AttributeName.COUNTRY).value());
    }

    @Test
    void testDetect_unclassifiedFailureTreatedAsTransient() {
        when(modelClient.extract(anyString(), any(ModelSelection.class)))
                .thenThrow(new IllegalStateException("connection reset"));

        DetectionResultType result = service.detect(DetectionRequestType.ofDescription("日本製 タオル"));

        assertEquals(ResultSource.HEURISTIC, result.source());
        assertEquals(List.of("JP"), result.attributes().get(AttributeName.COUNTRY).value());
    }

    @Test
    void testDetect_lowConfidenceFallbackNotCached() {
        when(modelClient.extract(anyString(), any(ModelSelection.class)))
                .thenThrow(new ModelCallException(ModelFailureKind.TRANSIENT, "timeout"));

        service.detect(DetectionRequestType.ofDescription("Soft cashmere scarf"));

        assertEquals(0, resultCache.size());
    }

    @Test
    void testDetect_authFailureIsTerminal() {
        when(modelClient.extract(anyString(), any(ModelSelection.class)))
                .thenThrow(new ModelCallException(ModelFailureKind.AUTH, "Invalid credentials"));

        DetectionException e = assertThrows(DetectionException.class,
                () -> service.detect(DetectionRequestType.ofDescription("Made in Wales")));

        assertEquals(ErrorCode.AUTH_ERROR, e.getCode());
        assertEquals(0, resultCache.size());
    }

    @Test
    void testDetect_quotaAndModelNotFoundAreTerminal() {
        when(modelClient.extract(anyString(), any(ModelSelection.class)))
                .thenThrow(new ModelCallException(ModelFailureKind.QUOTA, "Quota exceeded"))
                .thenThrow(new ModelCallException(ModelFailureKind.MODEL_NOT_FOUND, "Model not found"));

        DetectionException quota = assertThrows(DetectionException.class,
                () -> service.detect(DetectionRequestType.ofDescription("Made in Wales")));
        DetectionException notFound = assertThrows(DetectionException.class,
                () -> service.detect(DetectionRequestType.ofDescription("Made in Wales")));

        assertEquals(ErrorCode.QUOTA_ERROR, quota.getCode());
        assertEquals(ErrorCode.MODEL_NOT_FOUND, notFound.getCode());
    }

    @Test
    void testDetect_emptyNormalizedTextSkipsModel() {
        DetectionOutcome outcome = service.detectWithOutcome(DetectionRequestType.ofDescription("<div><br></div>"));

        assertEquals(ResultSource.HEURISTIC, outcome.result().source());
        assertEquals(List.of(), outcome.result().attributes().get(AttributeName.COUNTRY).value());
        assertEquals(0.0, outcome.result().attributes().maxConfidence());
        assertFalse(outcome.modelInvoked());
        assertFalse(outcome.fallback());
        verify(modelClient, never()).extract(anyString(), any(ModelSelection.class));
    }

    @Test
    void testDetect_validationErrorBeforeAnyWork() {
        assertThrows(ValidationException.class,
                () -> service.detect(new DetectionRequestType(null, null, null, null)));

        verify(modelClient, never()).extract(anyString(), any(ModelSelection.class));
        verify(metrics).incrementOutcome("validation_error");
    }

    @Test
    void testDetect_customModelUsesSeparateCacheEntry() {
        when(modelClient.extract(anyString(), any(ModelSelection.class)))
                .thenReturn(modelResult(List.of("GB"), "Made in Wales", 1.0));

        service.detect(DetectionRequestType.ofDescription("Made in Wales"));
        DetectionResultType custom = service
                .detect(new DetectionRequestType(null, "Made in Wales", "claude-custom-model", CUSTOM_KEY));

        assertFalse(custom.cache());
        assertTrue(custom.custom());
        assertEquals("claude-custom-model", custom.model());
        verify(modelClient).extract("Made in Wales", new ModelSelection("claude-custom-model", CUSTOM_KEY, true));
        verify(metrics).incrementAiCall(true);
    }

    @Test
    void testCheckHsCode_unknownCodeCapped() {
        AttributeSet attributes = modelResult(List.of("GB"), "Made in Scotland", 1.0).with(AttributeName.HSCODE,
                AttributeField.of(AttributeName.HSCODE, "999999", "cashmere sweater", 0.9));

        AttributeField hscode = service.checkHsCode(attributes, "Soft cashmere sweater made in Scotland")
                .get(AttributeName.HSCODE);

        assertEquals("999999", hscode.value());
        assertEquals(DetectionService.UNVERIFIED_HSCODE_CONFIDENCE, hscode.confidence());
        assertTrue(hscode.evidence().contains("611012"));
    }

    @Test
    void testCheckHsCode_knownCodeUnchanged() {
        AttributeSet attributes = modelResult(List.of("GB"), "Made in Scotland", 1.0).with(AttributeName.HSCODE,
                AttributeField.of(AttributeName.HSCODE, "611012", "cashmere sweater", 0.9));

        assertEquals(attributes, service.checkHsCode(attributes, "Soft cashmere sweater"));
    }

    private AttributeSet modelResult(List<String> countries, String evidence, double confidence) {
        return AttributeSet.unknown(detectorConfig.attributes()).with(AttributeName.COUNTRY,
                AttributeField.of(AttributeName.COUNTRY, countries, evidence, confidence));
    }
}
