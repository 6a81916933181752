/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import org.jboss.logging.Logger;

import villagecompute.detector.api.types.BatchDetectionRequestType;
import villagecompute.detector.api.types.BatchItemResultType;
import villagecompute.detector.api.types.BatchResultType;
import villagecompute.detector.api.types.DetectionRequestType;
import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.api.types.ErrorEnvelopeType;
import villagecompute.detector.config.DetectionExecutorConfig;
import villagecompute.detector.config.DetectorConfig;
import villagecompute.detector.exceptions.DetectionException;
import villagecompute.detector.exceptions.ValidationException;
import villagecompute.detector.integration.ai.ModelSelection;
import villagecompute.detector.observability.LoggingConfig;
import villagecompute.detector.services.DetectionService.DetectionOutcome;

/**
 * Fans a batch of detection requests out to {@link DetectionService} concurrently and aggregates the outcomes.
 *
 * <p>
 * <b>Batch Processing Behavior:</b>
 * <ul>
 * <li>Empty batches, batches over {@code detector.batch.max-items}, and invalid shared overrides fail as a whole with
 * {@code VALIDATION_ERROR}</li>
 * <li>Each item runs as its own task on the bounded detection executor and writes into the slot of its index</li>
 * <li>All tasks are joined at one point; results keep input order regardless of completion order</li>
 * <li>A failing item records its error envelope in its slot; the other items are unaffected</li>
 * <li>Each item runs in its own {@code detector.batch_item} span, child of the caller's span, with the caller's
 * request id and the item's trace ids in the MDC</li>
 * </ul>
 *
 * <p>
 * <b>Counters:</b> {@code cache_hits} counts items served from cache, {@code ai_calls} items that invoked the model,
 * {@code fallbacks} items answered by the heuristic after a model failure, {@code errors} failed items.
 */
@ApplicationScoped
public class BatchDetectionService {

    private static final Logger LOG = Logger.getLogger(BatchDetectionService.class);

    @Inject
    DetectionService detectionService;

    @Inject
    RequestValidator requestValidator;

    @Inject
    DetectorConfig detectorConfig;

    @Inject
    @Named(DetectionExecutorConfig.EXECUTOR_NAME)
    ExecutorService executor;

    @Inject
    Tracer tracer;

    /**
     * Detects attributes for every item of a batch.
     *
     * @param batch
     *            items plus optional shared model override
     * @return ordered per-item results with aggregate counters
     * @throws ValidationException
     *             if the batch as a whole is invalid
     */
    public BatchResultType detectBatch(BatchDetectionRequestType batch) {
        long start = System.nanoTime();
        if (batch == null) {
            throw new ValidationException("Request body is required");
        }
        List<DetectionRequestType> requests = batch.toRequests();
        if (requests.isEmpty()) {
            throw new ValidationException("Batch must contain at least one item in 'items' or 'descriptions'");
        }
        int maxItems = detectorConfig.batchMaxItems();
        if (requests.size() > maxItems) {
            throw new ValidationException("Batch size " + requests.size() + " exceeds the maximum of " + maxItems);
        }
        requestValidator.validateOverride(batch.model(), batch.apiKey());

        ModelSelection selection = detectionService.selectModel(requests.get(0));
        LOG.infof("Processing batch: items=%d, model=%s, custom=%b", requests.size(), selection.model(),
                selection.custom());

        BatchItemResultType[] slots = new BatchItemResultType[requests.size()];
        boolean[] modelInvoked = new boolean[requests.size()];
        boolean[] fallback = new boolean[requests.size()];
        String requestId = LoggingConfig.getRequestId();
        Context parentContext = Context.current();

        CompletableFuture<?>[] tasks = new CompletableFuture<?>[requests.size()];
        for (int i = 0; i < requests.size(); i++) {
            final int index = i;
            final DetectionRequestType request = requests.get(i);
            tasks[i] = CompletableFuture.runAsync(() -> {
                Span span = tracer.spanBuilder("detector.batch_item").setParent(parentContext)
                        .setAttribute("batch.index", index).setAttribute("batch.size", slots.length).startSpan();
                try (Scope scope = span.makeCurrent()) {
                    LoggingConfig.enrichWithTraceContext();
                    LoggingConfig.setRequestId(requestId);
                    LoggingConfig.setRequestOrigin("batch[" + index + "]");

                    DetectionOutcome outcome = detectionService.detectWithOutcome(request);
                    slots[index] = BatchItemResultType.success(index, outcome.result());
                    modelInvoked[index] = outcome.modelInvoked();
                    fallback[index] = outcome.fallback();
                    span.setAttribute("detection.source", outcome.result().source().wireName());
                } catch (DetectionException e) {
                    LOG.debugf("Batch item %d failed: code=%s, message=%s", index, e.getCode(), e.getMessage());
                    slots[index] = BatchItemResultType.failure(index, e.toEnvelope());
                    span.setStatus(StatusCode.ERROR, e.getCode().name());
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Unexpected failure in batch item %d", index);
                    slots[index] = BatchItemResultType.failure(index,
                            new ErrorEnvelopeType(ErrorCode.INTERNAL_ERROR, "Unexpected error processing item"));
                    span.recordException(e);
                    span.setStatus(StatusCode.ERROR, "Unexpected error processing item");
                } finally {
                    span.end();
                    LoggingConfig.clearMDC();
                }
            }, executor);
        }
        CompletableFuture.allOf(tasks).join();

        int cacheHits = 0;
        int aiCalls = 0;
        int fallbacks = 0;
        int errors = 0;
        for (int i = 0; i < slots.length; i++) {
            BatchItemResultType slot = slots[i];
            if (!slot.isSuccess()) {
                errors++;
                continue;
            }
            if (slot.cache()) {
                cacheHits++;
            }
            if (modelInvoked[i]) {
                aiCalls++;
            }
            if (fallback[i]) {
                fallbacks++;
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        BatchResultType result = new BatchResultType(Arrays.asList(slots), slots.length, cacheHits, aiCalls,
                fallbacks, errors, selection.model(), elapsedMs);
        LOG.infof("Batch complete: items=%d, cacheHits=%d, aiCalls=%d, fallbacks=%d, errors=%d, status=%s, time=%dms",
                slots.length, cacheHits, aiCalls, fallbacks, errors, result.status(), elapsedMs);
        return result;
    }
}
