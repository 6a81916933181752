/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.detector.api.types.HsCodeItemType;
import villagecompute.detector.api.types.HsCodeValidationType;

/**
 * Unit tests for {@link HsCodeCatalog} against the bundled catalogue.
 */
class HsCodeCatalogTest {

    private HsCodeCatalog catalog;

    @BeforeEach
    void setUp() throws IOException {
        catalog = new HsCodeCatalog();
        catalog.objectMapper = new ObjectMapper();
        try (InputStream is = getClass().getResourceAsStream("/hscode/hscode-catalog.json")) {
            catalog.load(is);
        }
    }

    @Test
    void testCatalogueLoaded() {
        assertEquals(45, catalog.total());
        assertEquals("T-shirts, cotton", catalog.getByCode("6109.10").orElseThrow().en());
    }

    @Test
    void testSearch_matchesAllLanguagesCaseInsensitive() {
        List<String> cotton = catalog.search("COTTON", 10).stream().map(HsCodeItemType::hscode).toList();
        assertEquals(List.of("610910", "611020", "620342", "620442", "630260"), cotton);

        assertEquals(4, catalog.search("綿", 10).size());
        assertEquals(List.of("851713"), catalog.search("智能手机", 10).stream().map(HsCodeItemType::hscode).toList());
    }

    @Test
    void testSearch_respectsLimit() {
        assertEquals(2, catalog.search("cotton", 2).size());
        assertTrue(catalog.search(" ", 10).isEmpty());
    }

    @Test
    void testIsValid_exactAndPrefix() {
        assertTrue(catalog.isValid("610910"));
        assertTrue(catalog.isValid("6109.10.00"));
        assertFalse(catalog.isValid("6109"));
        assertFalse(catalog.isValid("999999"));
        assertFalse(catalog.isValid(null));
    }

    @Test
    void testValidate_exactMatch() {
        HsCodeValidationType validation = catalog.validate("611012");

        assertTrue(validation.valid());
        assertEquals("Sweaters, pullovers, cashmere", validation.match().en());
    }

    @Test
    void testValidate_unknownCodeSuggestsSameHeading() {
        HsCodeValidationType validation = catalog.validate("611090");

        assertFalse(validation.valid());
        assertNull(validation.match());
        assertEquals(List.of("611011", "611012", "611020", "611030"),
                validation.similar().stream().map(HsCodeItemType::hscode).toList());
    }

    @Test
    void testSuggestFor_longestTermWins() {
        assertEquals("611012", catalog.suggestFor("soft cashmere knit, made in scotland").orElseThrow().hscode());
        assertEquals("090210", catalog.suggestFor("静岡県産 緑茶 100g").orElseThrow().hscode());
        assertTrue(catalog.suggestFor("something unrelated").isEmpty());
    }

    @Test
    void testLoad_skipsEntriesWithoutCode() throws IOException {
        String json = "{\"items\":[{\"en\":\"No code\"},{\"hscode\":\"0902.10\",\"en\":\"Green tea\"}]}";

        catalog.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, catalog.total());
        assertTrue(catalog.isValid("090210"));
    }
}
