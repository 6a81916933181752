/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.detector.api.types.HsCodeItemType;
import villagecompute.detector.api.types.HsCodeValidationType;

/**
 * In-memory HS code catalogue loaded from a bundled JSON resource.
 *
 * <p>
 * <b>Resource format</b> ({@code detector.hscode.catalog-resource}, default {@code hscode/hscode-catalog.json}):
 *
 * <pre>
 * {"items": [{"ja": "Tシャツ（綿製）", "cn": "棉制T恤衫", "en": "T-shirts, cotton", "hscode": "610910"}]}
 * </pre>
 *
 * <p>
 * <b>Validation rules:</b> a code is valid on an exact match, or when it has at least 6 digits and another catalogue
 * code shares its first 6 digits. Similar codes share the first 4 digits (the HS heading).
 *
 * <p>
 * A missing resource leaves the catalogue empty: every lookup misses and every code is invalid.
 */
@ApplicationScoped
public class HsCodeCatalog {

    private static final Logger LOG = Logger.getLogger(HsCodeCatalog.class);

    private static final Pattern NON_DIGITS = Pattern.compile("[^0-9]");
    private static final Pattern TERM_SEPARATORS = Pattern.compile("[,、，;（）()/]+");
    private static final int MIN_PREFIX_DIGITS = 6;
    private static final int HEADING_DIGITS = 4;
    private static final int MIN_TERM_LENGTH = 2;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(
            name = "detector.hscode.catalog-resource",
            defaultValue = "hscode/hscode-catalog.json")
    String catalogResource;

    private volatile List<HsCodeItemType> items = List.of();
    private volatile Map<String, HsCodeItemType> byCode = Map.of();

    @PostConstruct
    void init() {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(catalogResource)) {
            if (is == null) {
                LOG.warnf("HS code catalogue %s not found, lookup features disabled", catalogResource);
                return;
            }
            load(is);
        } catch (IOException e) {
            LOG.errorf(e, "Failed to load HS code catalogue %s, lookup features disabled", catalogResource);
        }
    }

    /**
     * Replaces the catalogue with the items of a JSON document.
     *
     * @param is
     *            catalogue JSON
     * @throws IOException
     *             if the document cannot be read
     */
    void load(InputStream is) throws IOException {
        JsonNode root = objectMapper.readTree(is);
        List<HsCodeItemType> loaded = new ArrayList<>();
        Map<String, HsCodeItemType> index = new LinkedHashMap<>();
        JsonNode itemsNode = root == null ? null : root.get("items");
        if (itemsNode != null && itemsNode.isArray()) {
            for (JsonNode node : itemsNode) {
                String code = digits(node.path("hscode").asText(""));
                if (code.isEmpty()) {
                    continue;
                }
                HsCodeItemType item = new HsCodeItemType(node.path("ja").asText(""), node.path("cn").asText(""),
                        node.path("en").asText(""), code);
                loaded.add(item);
                index.putIfAbsent(code, item);
            }
        }
        items = Collections.unmodifiableList(loaded);
        byCode = Collections.unmodifiableMap(index);
        LOG.infof("Loaded %d HS codes", loaded.size());
    }

    public int total() {
        return items.size();
    }

    /**
     * Searches descriptions (Japanese, Chinese, English, case-insensitive) and codes for a keyword.
     *
     * @param keyword
     *            search term
     * @param limit
     *            maximum results
     * @return matching items in catalogue order
     */
    public List<HsCodeItemType> search(String keyword, int limit) {
        if (keyword == null || keyword.isBlank() || limit <= 0) {
            return List.of();
        }
        String needle = keyword.trim().toLowerCase(Locale.ROOT);
        List<HsCodeItemType> results = new ArrayList<>();
        for (HsCodeItemType item : items) {
            if (matches(item.ja(), needle) || matches(item.en(), needle) || matches(item.cn(), needle)
                    || item.hscode().contains(needle)) {
                results.add(item);
                if (results.size() >= limit) {
                    break;
                }
            }
        }
        return results;
    }

    public Optional<HsCodeItemType> getByCode(String code) {
        return Optional.ofNullable(byCode.get(digits(code)));
    }

    /**
     * Checks a code against the catalogue: exact match, or 6-digit prefix match.
     */
    public boolean isValid(String code) {
        String clean = digits(code);
        if (clean.isEmpty()) {
            return false;
        }
        if (byCode.containsKey(clean)) {
            return true;
        }
        if (clean.length() < MIN_PREFIX_DIGITS) {
            return false;
        }
        String prefix = clean.substring(0, MIN_PREFIX_DIGITS);
        return byCode.keySet().stream().anyMatch(known -> known.startsWith(prefix));
    }

    /**
     * Returns catalogue entries sharing the code's 4-digit heading.
     */
    public List<HsCodeItemType> findSimilar(String code, int limit) {
        String clean = digits(code);
        if (clean.length() < HEADING_DIGITS) {
            return List.of();
        }
        String heading = clean.substring(0, HEADING_DIGITS);
        return items.stream().filter(item -> item.hscode().startsWith(heading)).limit(Math.max(0, limit)).toList();
    }

    /**
     * Validates a code and reports the match or similar alternatives.
     */
    public HsCodeValidationType validate(String code) {
        String clean = digits(code);
        Optional<HsCodeItemType> exact = getByCode(clean);
        if (exact.isPresent()) {
            return new HsCodeValidationType(clean, true, exact.get(), List.of());
        }
        boolean valid = isValid(clean);
        return new HsCodeValidationType(clean, valid, null, findSimilar(clean, 5));
    }

    /**
     * Suggests the catalogue entry whose description terms best match a product text: the entry with the longest
     * description term contained in the text wins, ties going to the earlier entry.
     *
     * @param text
     *            normalized product text
     * @return best keyword match, if any
     */
    public Optional<HsCodeItemType> suggestFor(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        HsCodeItemType best = null;
        int bestLength = 0;
        for (HsCodeItemType item : items) {
            for (String description : List.of(item.ja(), item.cn(), item.en())) {
                for (String term : TERM_SEPARATORS.split(description.toLowerCase(Locale.ROOT))) {
                    String trimmed = term.trim();
                    if (trimmed.length() >= MIN_TERM_LENGTH && trimmed.length() > bestLength
                            && haystack.contains(trimmed)) {
                        best = item;
                        bestLength = trimmed.length();
                    }
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean matches(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String digits(String code) {
        return code == null ? "" : NON_DIGITS.matcher(code).replaceAll("");
    }
}
