/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.detector.api.types.AttributeField;
import villagecompute.detector.api.types.AttributeName;
import villagecompute.detector.api.types.AttributeSet;
import villagecompute.detector.api.types.DetectionRequestType;
import villagecompute.detector.api.types.DetectionResultType;
import villagecompute.detector.api.types.HsCodeItemType;
import villagecompute.detector.api.types.ResultSource;
import villagecompute.detector.config.DetectorConfig;
import villagecompute.detector.exceptions.DetectionException;
import villagecompute.detector.exceptions.ModelCallException;
import villagecompute.detector.exceptions.ModelFailureKind;
import villagecompute.detector.integration.ai.AnthropicClientFactory;
import villagecompute.detector.integration.ai.ModelClient;
import villagecompute.detector.integration.ai.ModelFailureClassifier;
import villagecompute.detector.integration.ai.ModelSelection;
import villagecompute.detector.observability.DetectionMetrics;
import villagecompute.detector.observability.LoggingConfig;

/**
 * Runs one detection request through validation, normalization, cache, model and fallback.
 *
 * <p>
 * <b>Detection Process:</b>
 * <ol>
 * <li>Validate the request ({@link RequestValidator}); failures never reach the cache or model</li>
 * <li>Normalize title/description ({@link TextNormalizer}); empty text short-circuits to the heuristic no-match</li>
 * <li>Look up the fingerprint of text + effective model in the {@link ResultCache}</li>
 * <li>On a miss, call the model; check a suggested HS code against the {@link HsCodeCatalog}; admit the result</li>
 * <li>On a recoverable model failure (parse, transient), answer with the {@link HeuristicExtractor} instead</li>
 * <li>On a terminal failure (auth, quota, unknown model), raise {@link DetectionException} without fallback</li>
 * </ol>
 *
 * <p>
 * <b>Caching:</b> a result is cached only when some field's confidence exceeds the admission threshold, so weak
 * heuristic answers are recomputed on the next request. Repeating a cached request returns the identical attribute
 * set with {@code cache=true}.
 */
@ApplicationScoped
public class DetectionService {

    private static final Logger LOG = Logger.getLogger(DetectionService.class);

    static final double UNVERIFIED_HSCODE_CONFIDENCE = 0.3;

    @Inject
    RequestValidator requestValidator;

    @Inject
    TextNormalizer textNormalizer;

    @Inject
    ResultCache resultCache;

    @Inject
    ModelClient modelClient;

    @Inject
    HeuristicExtractor heuristicExtractor;

    @Inject
    HsCodeCatalog hsCodeCatalog;

    @Inject
    AnthropicClientFactory clientFactory;

    @Inject
    DetectorConfig detectorConfig;

    @Inject
    DetectionMetrics metrics;

    /**
     * Detects attributes for one request.
     *
     * @param request
     *            title/description with optional model override
     * @return detection result
     * @throws DetectionException
     *             on validation failure or terminal model failure
     */
    public DetectionResultType detect(DetectionRequestType request) {
        return detectWithOutcome(request).result();
    }

    /**
     * Detects attributes for one request and reports whether the model was invoked.
     *
     * @param request
     *            title/description with optional model override
     * @return result plus invocation details for batch counters
     * @throws DetectionException
     *             on validation failure or terminal model failure
     */
    public DetectionOutcome detectWithOutcome(DetectionRequestType request) {
        long start = System.nanoTime();
        try {
            requestValidator.validate(request);
        } catch (DetectionException e) {
            metrics.incrementOutcome(outcomeName(e));
            throw e;
        }

        ModelSelection selection = selectModel(request);
        LoggingConfig.setModel(selection.model());
        String text = textNormalizer.normalize(request);

        DetectionOutcome outcome;
        if (text.isEmpty()) {
            LOG.debug("Normalized text is empty, returning heuristic no-match");
            outcome = heuristic(text, selection, false, false);
        } else {
            outcome = detectText(text, selection);
        }
        metrics.incrementOutcome(outcome.result().source().wireName());
        return outcome.withTime(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }

    /**
     * Resolves the model and credential for a request: the caller's override when both are present, otherwise the
     * configured default.
     */
    public ModelSelection selectModel(DetectionRequestType request) {
        if (request.hasOverride()) {
            return new ModelSelection(request.model().trim(), request.apiKey().trim(), true);
        }
        return clientFactory.defaultSelection();
    }

    private DetectionOutcome detectText(String text, ModelSelection selection) {
        String fingerprint = ResultCache.fingerprint(text, selection.model());

        Optional<AttributeSet> cached = resultCache.lookup(fingerprint);
        if (cached.isPresent()) {
            metrics.incrementCacheHit();
            LOG.debugf("Cache HIT: fingerprint=%s", fingerprint);
            return new DetectionOutcome(
                    new DetectionResultType(cached.get(), true, selection.custom(), selection.model(),
                            ResultSource.CACHE, 0),
                    false, false);
        }
        metrics.incrementCacheMiss();
        LOG.debugf("Cache MISS: fingerprint=%s", fingerprint);

        AttributeSet attributes;
        try {
            metrics.incrementAiCall(selection.custom());
            attributes = modelClient.extract(text, selection);
        } catch (RuntimeException e) {
            ModelCallException failure = ModelFailureClassifier.toModelCallException(e, selection.model());
            return handleFailure(failure, text, fingerprint, selection);
        }

        attributes = checkHsCode(attributes, text);
        boolean admitted = resultCache.admit(fingerprint, attributes);
        LOG.debugf("Model result: fingerprint=%s, cached=%b", fingerprint, admitted);
        return new DetectionOutcome(
                new DetectionResultType(attributes, false, selection.custom(), selection.model(), ResultSource.MODEL, 0),
                true, false);
    }

    private DetectionOutcome handleFailure(ModelCallException failure, String text, String fingerprint,
            ModelSelection selection) {
        ModelFailureKind kind = failure.getKind();
        switch (kind) {
            case PARSE, TRANSIENT -> {
                LOG.warnf("Model call failed (%s), falling back to heuristic extraction: model=%s, reason=%s", kind,
                        selection.model(), failure.getMessage());
                DetectionOutcome outcome = heuristic(text, selection, true, true);
                resultCache.admit(fingerprint, outcome.result().attributes());
                return outcome;
            }
            case AUTH, QUOTA, MODEL_NOT_FOUND -> {
                LOG.warnf("Model call failed with terminal error %s: model=%s", kind, selection.model());
                metrics.incrementOutcome(kind.errorCode().name().toLowerCase());
                throw new DetectionException(kind.errorCode(), failure.getMessage(), failure);
            }
            default -> throw new IllegalStateException("Unhandled failure kind: " + kind);
        }
    }

    private DetectionOutcome heuristic(String text, ModelSelection selection, boolean modelInvoked,
            boolean fallback) {
        AttributeSet attributes = heuristicExtractor.extract(text);
        return new DetectionOutcome(
                new DetectionResultType(attributes, false, selection.custom(), selection.model(),
                        ResultSource.HEURISTIC, 0),
                modelInvoked, fallback);
    }

    /**
     * Caps the confidence of a model-suggested HS code the catalogue does not know, adding a keyword suggestion to
     * its evidence when one exists.
     */
    AttributeSet checkHsCode(AttributeSet attributes, String text) {
        if (!attributes.fields().containsKey(AttributeName.HSCODE) || hsCodeCatalog.total() == 0) {
            return attributes;
        }
        AttributeField field = attributes.get(AttributeName.HSCODE);
        if (field.isUnknown()) {
            return attributes;
        }
        String code = (String) field.value();
        if (hsCodeCatalog.isValid(code)) {
            return attributes;
        }

        String evidence = field.evidence();
        Optional<HsCodeItemType> suggestion = hsCodeCatalog.suggestFor(text);
        if (suggestion.isPresent()) {
            HsCodeItemType item = suggestion.get();
            evidence = evidence + " (catalogue suggests " + item.hscode() + ": " + item.en() + ")";
        }
        LOG.infof("Model suggested unknown HS code %s, confidence capped at %.1f", code, UNVERIFIED_HSCODE_CONFIDENCE);
        return attributes.with(AttributeName.HSCODE, AttributeField.of(AttributeName.HSCODE, code, evidence,
                Math.min(field.confidence(), UNVERIFIED_HSCODE_CONFIDENCE)));
    }

    private static String outcomeName(DetectionException e) {
        return e.getCode().name().toLowerCase();
    }

    /**
     * Result of one detection plus how it was produced.
     *
     * @param result
     *            the detection result
     * @param modelInvoked
     *            true if the model was called (successfully or not)
     * @param fallback
     *            true if the result came from the heuristic after a recoverable model failure
     */
    public record DetectionOutcome(DetectionResultType result, boolean modelInvoked, boolean fallback) {

        DetectionOutcome withTime(long elapsedMs) {
            return new DetectionOutcome(result.withTime(elapsedMs), modelInvoked, fallback);
        }
    }
}
