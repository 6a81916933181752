/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.detector.api.types.AttributeName;

/**
 * Detection pipeline settings: extracted attributes, text combination, country code profile, result cache sizing,
 * batch limits and the endpoint API key.
 *
 * <p>
 * Validated at startup; an unknown attribute name or a non-positive limit aborts boot with
 * {@link AiConfig.AiConfigurationException}.
 */
@ApplicationScoped
@Startup
public class DetectorConfig {

    private static final Logger LOG = Logger.getLogger(DetectorConfig.class);

    @ConfigProperty(
            name = "detector.attributes",
            defaultValue = "country,size,material,brand,target_user,hscode")
    List<String> attributeNames;

    @ConfigProperty(
            name = "detector.text-strategy",
            defaultValue = "DESCRIPTION_FIRST")
    TextStrategy textStrategy;

    @ConfigProperty(
            name = "detector.country-code-format",
            defaultValue = "ALPHA2")
    CountryCodeFormat countryCodeFormat;

    @ConfigProperty(
            name = "detector.cache.max-entries",
            defaultValue = "1000")
    int cacheMaxEntries;

    @ConfigProperty(
            name = "detector.cache.admission-threshold",
            defaultValue = "0.5")
    double cacheAdmissionThreshold;

    @ConfigProperty(
            name = "detector.cache.refresh-on-read",
            defaultValue = "false")
    boolean cacheRefreshOnRead;

    @ConfigProperty(
            name = "detector.batch.max-items",
            defaultValue = "100")
    int batchMaxItems;

    @ConfigProperty(
            name = "detector.batch.max-concurrency",
            defaultValue = "8")
    int batchMaxConcurrency;

    @ConfigProperty(
            name = "detector.security.api-key")
    Optional<String> securityApiKey;

    private List<AttributeName> attributes;

    @PostConstruct
    public void validateConfiguration() {
        attributes = resolveAttributes(attributeNames);
        requirePositive("detector.cache.max-entries", cacheMaxEntries);
        requirePositive("detector.batch.max-items", batchMaxItems);
        requirePositive("detector.batch.max-concurrency", batchMaxConcurrency);
        if (cacheAdmissionThreshold < 0.0 || cacheAdmissionThreshold > 1.0) {
            throw new AiConfig.AiConfigurationException(
                    "detector.cache.admission-threshold must be within [0.0, 1.0]: " + cacheAdmissionThreshold);
        }
        if (securityApiKey().isEmpty()) {
            LOG.warn("detector.security.api-key is not set; X-API-Key checking is disabled");
        }
        LOG.infof("Detector configured: attributes=%s, textStrategy=%s, countryCodes=%s, cacheMax=%d, batchMax=%d",
                attributes, textStrategy, countryCodeFormat, cacheMaxEntries, batchMaxItems);
    }

    /**
     * Attributes every result covers, in declaration order.
     */
    public List<AttributeName> attributes() {
        if (attributes == null) {
            attributes = resolveAttributes(attributeNames);
        }
        return attributes;
    }

    public TextStrategy textStrategy() {
        return textStrategy;
    }

    public CountryCodeFormat countryCodeFormat() {
        return countryCodeFormat;
    }

    public int cacheMaxEntries() {
        return cacheMaxEntries;
    }

    public double cacheAdmissionThreshold() {
        return cacheAdmissionThreshold;
    }

    public boolean cacheRefreshOnRead() {
        return cacheRefreshOnRead;
    }

    public int batchMaxItems() {
        return batchMaxItems;
    }

    public int batchMaxConcurrency() {
        return batchMaxConcurrency;
    }

    /**
     * Expected {@code X-API-Key} header value; empty disables the check.
     */
    public Optional<String> securityApiKey() {
        return securityApiKey == null ? Optional.empty()
                : securityApiKey.map(String::trim).filter(key -> !key.isEmpty());
    }

    private static List<AttributeName> resolveAttributes(List<String> names) {
        EnumSet<AttributeName> resolved = EnumSet.noneOf(AttributeName.class);
        if (names != null) {
            for (String name : names) {
                if (name == null || name.isBlank()) {
                    continue;
                }
                resolved.add(AttributeName.fromWireName(name).orElseThrow(
                        () -> new AiConfig.AiConfigurationException("Unknown attribute in detector.attributes: " + name)));
            }
        }
        if (resolved.isEmpty()) {
            throw new AiConfig.AiConfigurationException("detector.attributes must name at least one attribute");
        }
        return Collections.unmodifiableList(new ArrayList<>(resolved));
    }

    private static void requirePositive(String property, int value) {
        if (value <= 0) {
            throw new AiConfig.AiConfigurationException(property + " must be positive: " + value);
        }
    }
}
