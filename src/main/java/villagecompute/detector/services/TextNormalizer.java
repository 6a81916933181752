/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import villagecompute.detector.api.types.DetectionRequestType;
import villagecompute.detector.config.DetectorConfig;
import villagecompute.detector.config.TextStrategy;

/**
 * Reduces raw product text to the canonical form used as cache key and model input.
 *
 * <p>
 * <b>Normalization steps:</b>
 * <ol>
 * <li>Parse with Jsoup and keep text content only; table cells are separated by spaces, table rows by
 * {@code "; "}</li>
 * <li>Drop control and format characters, and pictographic symbols (emoji, dingbats) except ™ ® ©</li>
 * <li>Collapse whitespace (including ideographic and no-break spaces) and trim</li>
 * </ol>
 *
 * <p>
 * {@code null} and empty input yield {@code ""}. The result is deterministic: equal input always gives equal output.
 */
@ApplicationScoped
public class TextNormalizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}\\p{Cf}\\uFE0E\\uFE0F]");
    private static final Pattern SYMBOLS = Pattern.compile("[\\p{So}&&[^\\u2122\\u00AE\\u00A9]]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u3000]+");
    private static final Pattern SPACE_BEFORE_SEPARATOR = Pattern.compile(" ;");
    private static final Pattern REPEATED_SEPARATOR = Pattern.compile("(?:; *){2,}");
    private static final String ROW_SEPARATOR = "; ";
    private static final String TITLE_SEPARATOR = " / ";

    @Inject
    DetectorConfig detectorConfig;

    /**
     * Normalizes one raw text.
     *
     * @param raw
     *            text, possibly containing HTML
     * @return normalized text, never null
     */
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = raw.indexOf('<') >= 0 || raw.indexOf('&') >= 0 ? htmlToText(raw) : raw;
        // control characters become spaces so adjacent words stay apart
        text = CONTROL_CHARS.matcher(text).replaceAll(" ");
        text = SYMBOLS.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        text = SPACE_BEFORE_SEPARATOR.matcher(text).replaceAll(";");
        text = REPEATED_SEPARATOR.matcher(text).replaceAll(ROW_SEPARATOR).trim();
        while (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        return text;
    }

    /**
     * Normalizes a request's title and description and combines them per {@code detector.text-strategy}.
     *
     * @param request
     *            detection request
     * @return combined normalized text, empty if neither part has content
     */
    public String normalize(DetectionRequestType request) {
        String title = normalize(request.title());
        String description = normalize(request.description());
        TextStrategy strategy = detectorConfig != null ? detectorConfig.textStrategy() : TextStrategy.DESCRIPTION_FIRST;
        return combine(title, description, strategy);
    }

    static String combine(String title, String description, TextStrategy strategy) {
        return switch (strategy) {
            case CONCATENATE -> {
                if (title.isEmpty()) {
                    yield description;
                }
                yield description.isEmpty() ? title : title + TITLE_SEPARATOR + description;
            }
            case DESCRIPTION_FIRST -> description.isEmpty() ? title : description;
        };
    }

    private static String htmlToText(String raw) {
        Document doc = Jsoup.parseBodyFragment(raw);
        for (Element cell : doc.select("td, th")) {
            cell.appendText(" ");
        }
        for (Element row : doc.select("tr")) {
            row.appendText(ROW_SEPARATOR);
        }
        return doc.body().text();
    }
}
