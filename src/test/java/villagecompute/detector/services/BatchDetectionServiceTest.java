/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Scope;

import org.jboss.logging.MDC;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.detector.api.types.AttributeName;
import villagecompute.detector.api.types.BatchDetectionRequestType;
import villagecompute.detector.api.types.BatchItemResultType;
import villagecompute.detector.api.types.BatchItemType;
import villagecompute.detector.api.types.BatchResultType;
import villagecompute.detector.api.types.BatchStatus;
import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.api.types.ResultSource;
import villagecompute.detector.config.TestConfigs;
import villagecompute.detector.exceptions.ModelCallException;
import villagecompute.detector.exceptions.ModelFailureKind;
import villagecompute.detector.exceptions.ValidationException;
import villagecompute.detector.integration.ai.AnthropicClientFactory;
import villagecompute.detector.integration.ai.ModelClient;
import villagecompute.detector.integration.ai.ModelSelection;
import villagecompute.detector.observability.DetectionMetrics;
import villagecompute.detector.observability.LoggingConfig;

/**
 * Unit tests for {@link BatchDetectionService}.
 *
 * <p>
 * The mocked model answers with the heuristic extraction of each text after a per-text delay, so items complete in a
 * different order than they were submitted.
 */
class BatchDetectionServiceTest {

    private static final String TRACE_ID = "0af7651916cd43dd8448eb211c80319c";
    private static final String SPAN_ID = "b7ad6b7169203331";

    @Mock
    ModelClient modelClient;

    @Mock
    AnthropicClientFactory clientFactory;

    @Mock
    DetectionMetrics metrics;

    private BatchDetectionService batchService;
    private HeuristicExtractor heuristicExtractor;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws IOException {
        MockitoAnnotations.openMocks(this);
        DetectionService detectionService = DetectionServiceTest.newDetectionService(modelClient, clientFactory,
                metrics);
        heuristicExtractor = detectionService.heuristicExtractor;
        executor = Executors.newFixedThreadPool(4);

        batchService = new BatchDetectionService();
        batchService.detectionService = detectionService;
        batchService.requestValidator = new RequestValidator();
        batchService.detectorConfig = TestConfigs.batchConfig(5);
        batchService.executor = executor;
        batchService.tracer = OpenTelemetry.noop().getTracer("test");

        when(modelClient.extract(anyString(), any(ModelSelection.class))).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            if (text.contains("Wales")) {
                Thread.sleep(150);
            } else if (text.contains("日本")) {
                Thread.sleep(50);
            }
            if (text.contains("Nowhere")) {
                throw new ModelCallException(ModelFailureKind.AUTH, "Invalid credentials");
            }
            if (text.contains("garbled")) {
                throw new ModelCallException(ModelFailureKind.PARSE, "Model response is not valid JSON");
            }
            return heuristicExtractor.extract(text);
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testDetectBatch_resultsKeepInputOrder() {
        BatchResultType result = batchService
                .detectBatch(BatchDetectionRequestType.ofDescriptions(List.of("Made in Wales", "日本製", "Made in China")));

        assertEquals(3, result.total());
        assertEquals(BatchStatus.COMPLETE, result.status());
        assertEquals(List.of("GB"), country(result.results().get(0)));
        assertEquals(List.of("JP"), country(result.results().get(1)));
        assertEquals(List.of("CN"), country(result.results().get(2)));
        for (int i = 0; i < 3; i++) {
            assertEquals(i, result.results().get(i).index());
        }
        assertEquals(3, result.aiCalls());
        assertEquals(0, result.cacheHits());
        assertEquals(0, result.errors());
        assertEquals(TestConfigs.DEFAULT_MODEL, result.model());
    }

    @Test
    void testDetectBatch_itemsRunInCallerTrace() {
        Queue<String> spanTraceIds = new ConcurrentLinkedQueue<>();
        Queue<String> mdcTraceIds = new ConcurrentLinkedQueue<>();
        doAnswer(invocation -> {
            spanTraceIds.add(Span.current().getSpanContext().getTraceId());
            Object mdcTraceId = MDC.get(LoggingConfig.MDC_TRACE_ID);
            mdcTraceIds.add(mdcTraceId != null ? mdcTraceId.toString() : "");
            return heuristicExtractor.extract(invocation.getArgument(0));
        }).when(modelClient).extract(anyString(), any(ModelSelection.class));

        Span parent = Span.wrap(
                SpanContext.create(TRACE_ID, SPAN_ID, TraceFlags.getSampled(), TraceState.getDefault()));
        try (Scope scope = parent.makeCurrent()) {
            // the second batch runs on reused pool threads
            batchService.detectBatch(BatchDetectionRequestType
                    .ofDescriptions(List.of("Made in Italy", "Made in France", "Made in Spain", "Made in Chile")));
            batchService.detectBatch(BatchDetectionRequestType
                    .ofDescriptions(List.of("Made in Peru", "Made in Kenya", "Made in Egypt", "Made in Nepal")));
        }

        assertEquals(8, spanTraceIds.size());
        assertTrue(spanTraceIds.stream().allMatch(TRACE_ID::equals));
        assertEquals(8, mdcTraceIds.size());
        assertTrue(mdcTraceIds.stream().allMatch(TRACE_ID::equals));
    }

    @Test
    void testDetectBatch_repeatedBatchServedFromCache() {
        BatchDetectionRequestType batch = BatchDetectionRequestType
                .ofDescriptions(List.of("Made in Wales", "日本製", "Made in China"));

        batchService.detectBatch(batch);
        BatchResultType second = batchService.detectBatch(batch);

        assertEquals(3, second.cacheHits());
        assertEquals(0, second.aiCalls());
        assertTrue(second.results().stream().allMatch(BatchItemResultType::cache));
    }

    @Test
    void testDetectBatch_itemFailuresRecordedInPlace() {
        BatchResultType result = batchService.detectBatch(
                BatchDetectionRequestType.ofDescriptions(List.of("Made in Wales", "Made in Nowhere", "", "garbled 日本製")));

        assertEquals(BatchStatus.PARTIAL, result.status());
        assertEquals(4, result.total());
        assertEquals(2, result.errors());
        assertEquals(1, result.fallbacks());

        assertNull(result.results().get(0).error());
        assertEquals(ErrorCode.AUTH_ERROR, result.results().get(1).error().code());
        assertEquals(ErrorCode.VALIDATION_ERROR, result.results().get(2).error().code());
        assertEquals(ResultSource.HEURISTIC, result.results().get(3).source());
        assertEquals(List.of("JP"), country(result.results().get(3)));
    }

    @Test
    void testDetectBatch_allItemsFailing() {
        BatchResultType result = batchService
                .detectBatch(BatchDetectionRequestType.ofDescriptions(List.of("Made in Nowhere", " ")));

        assertEquals(BatchStatus.FAILED, result.status());
        assertEquals(2, result.errors());
    }

    @Test
    void testDetectBatch_itemsAndDescriptionsFlattenedInOrder() {
        BatchDetectionRequestType batch = new BatchDetectionRequestType(
                List.of(new BatchItemType("Cotton towel", "日本製")), List.of("Made in China"), null, null);

        BatchResultType result = batchService.detectBatch(batch);

        assertEquals(List.of("JP"), country(result.results().get(0)));
        assertEquals(List.of("CN"), country(result.results().get(1)));
    }

    @Test
    void testDetectBatch_emptyBatchRejected() {
        assertThrows(ValidationException.class,
                () -> batchService.detectBatch(BatchDetectionRequestType.ofDescriptions(List.of())));
        assertThrows(ValidationException.class,
                () -> batchService.detectBatch(new BatchDetectionRequestType(null, null, null, null)));
    }

    @Test
    void testDetectBatch_oversizedBatchRejected() {
        List<String> descriptions = Collections.nCopies(6, "Made in Wales");

        assertThrows(ValidationException.class,
                () -> batchService.detectBatch(BatchDetectionRequestType.ofDescriptions(descriptions)));
    }

    @Test
    void testDetectBatch_incompleteSharedOverrideRejected() {
        BatchDetectionRequestType batch = new BatchDetectionRequestType(null, List.of("Made in Wales"),
                "claude-custom-model", null);

        assertThrows(ValidationException.class, () -> batchService.detectBatch(batch));
    }

    private static List<String> country(BatchItemResultType item) {
        return item.attributes().get(AttributeName.COUNTRY).valueList();
    }
}
