/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.detector.api.types.AttributeSet;
import villagecompute.detector.api.types.CacheStatsType;
import villagecompute.detector.config.DetectorConfig;
import villagecompute.detector.util.ContentHasher;

/**
 * Bounded in-memory store of detection results keyed by input fingerprint.
 *
 * <p>
 * <b>Cache Key Strategy:</b> SHA-256(normalized text + NUL + effective model), so the same text analysed by two models
 * occupies two entries.
 *
 * <p>
 * <b>Admission:</b> a result is stored only if at least one field's confidence exceeds
 * {@code detector.cache.admission-threshold}; low-confidence results are recomputed next time.
 *
 * <p>
 * <b>Eviction:</b> when {@code detector.cache.max-entries} is reached, the least-recently-inserted entry is evicted.
 * Re-admitting a fingerprint counts as a new insertion. With {@code detector.cache.refresh-on-read} a hit also counts
 * as one.
 *
 * <p>
 * <b>Thread Safety:</b> all reads and writes of the entry map are serialized on the entry map's monitor; hit and miss
 * counters are atomic.
 */
@ApplicationScoped
public class ResultCache {

    private static final Logger LOG = Logger.getLogger(ResultCache.class);

    private static final char FINGERPRINT_SEPARATOR = '\u0000';

    @Inject
    DetectorConfig detectorConfig;

    /** Fingerprint → entry, iterated oldest insertion first. */
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private long insertionSequence;

    /**
     * Computes the cache key for a normalized text analysed by a model.
     *
     * @param normalizedText
     *            output of {@link TextNormalizer}
     * @param model
     *            effective model identifier
     * @return 64-character lowercase hex string
     */
    public static String fingerprint(String normalizedText, String model) {
        return ContentHasher.sha256Hex(normalizedText + FINGERPRINT_SEPARATOR + model);
    }

    /**
     * Looks up a previously admitted result.
     *
     * @param fingerprint
     *            cache key from {@link #fingerprint(String, String)}
     * @return cached attributes, or empty on miss
     */
    public Optional<AttributeSet> lookup(String fingerprint) {
        CacheEntry entry;
        synchronized (entries) {
            entry = entries.get(fingerprint);
            if (entry != null && detectorConfig.cacheRefreshOnRead()) {
                entries.remove(fingerprint);
                entry = new CacheEntry(fingerprint, entry.attributes(), ++insertionSequence);
                entries.put(fingerprint, entry);
            }
        }
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.attributes());
    }

    /**
     * Stores a result if it clears the admission threshold, evicting the oldest entry when full.
     *
     * @param fingerprint
     *            cache key
     * @param attributes
     *            result to store
     * @return true if the result was stored
     */
    public boolean admit(String fingerprint, AttributeSet attributes) {
        if (!isAdmissible(attributes)) {
            LOG.debugf("Result below admission threshold, not cached: fingerprint=%s, maxConfidence=%.2f",
                    fingerprint, attributes.maxConfidence());
            return false;
        }
        int maxEntries = detectorConfig.cacheMaxEntries();
        synchronized (entries) {
            // remove first so a re-admitted key moves to the newest position
            entries.remove(fingerprint);
            Iterator<String> oldest = entries.keySet().iterator();
            while (entries.size() >= maxEntries && oldest.hasNext()) {
                String evicted = oldest.next();
                oldest.remove();
                LOG.debugf("Evicted oldest cache entry: fingerprint=%s", evicted);
            }
            entries.put(fingerprint, new CacheEntry(fingerprint, attributes, ++insertionSequence));
        }
        return true;
    }

    /**
     * Checks whether a result would be admitted: at least one field must be strictly above the threshold.
     */
    public boolean isAdmissible(AttributeSet attributes) {
        return attributes != null && attributes.maxConfidence() > detectorConfig.cacheAdmissionThreshold();
    }

    /**
     * Removes every entry.
     *
     * @return number of entries removed
     */
    public int clear() {
        int cleared;
        synchronized (entries) {
            cleared = entries.size();
            entries.clear();
        }
        LOG.infof("Result cache cleared: entries=%d", cleared);
        return cleared;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    boolean contains(String fingerprint) {
        synchronized (entries) {
            return entries.containsKey(fingerprint);
        }
    }

    /**
     * Returns occupancy and hit statistics.
     */
    public CacheStatsType stats() {
        return CacheStatsType.of(size(), detectorConfig.cacheMaxEntries(), hits.get(), misses.get());
    }

    /**
     * One stored result with its insertion sequence number.
     */
    record CacheEntry(String fingerprint, AttributeSet attributes, long sequence) {
    }
}
