/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.services;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.detector.api.types.AttributeField;
import villagecompute.detector.api.types.AttributeName;
import villagecompute.detector.api.types.AttributeSet;
import villagecompute.detector.config.CountryCodeFormat;
import villagecompute.detector.config.DetectorConfig;
import villagecompute.detector.util.CountryCodes;

/**
 * Pattern-based attribute extractor used when the model is unavailable or its answer cannot be parsed, and as the sole
 * path for empty text.
 *
 * <p>
 * <b>Confidence levels:</b>
 * <ul>
 * <li><b>1.0</b>: explicit origin phrase ({@code Made in Wales}, {@code 原産国：日本}, {@code 日本製})</li>
 * <li><b>0.3</b>: labelled or keyword matches for size, material, brand, color and target user</li>
 * <li><b>0.0</b>: nothing found (attribute sentinel)</li>
 * </ul>
 *
 * <p>
 * The extractor is pure and synchronous: it never blocks, never throws for any input, and returns the same
 * {@link AttributeSet} for the same text. HS codes are never produced heuristically.
 */
@ApplicationScoped
public class HeuristicExtractor {

    private static final Logger LOG = Logger.getLogger(HeuristicExtractor.class);

    static final double EXPLICIT_CONFIDENCE = 1.0;
    static final double KEYWORD_CONFIDENCE = 0.3;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String NAME = CountryCodes.nameRegex();
    private static final String COUNTRY_LIST = NAME + "(?:\\s*(?:/|,|、|・|&|and(?=\\s))\\s*" + NAME + ")*";

    private static final Pattern ORIGIN_PHRASE = Pattern.compile("[【\\[]?\\s*(?:(?<![A-Za-z])made\\s+in"
            + "|country\\s+of\\s+origin|原産国|原産地|製造国|生産国)\\s*[】\\]]?\\s*[:：]?\\s*(?:the\\s+)?("
            + COUNTRY_LIST + ")", FLAGS);
    private static final Pattern ORIGIN_SUFFIX = Pattern.compile("(" + NAME + ")製(?!造)", FLAGS);

    private static final String JA = "\\u3040-\\u30ff\\u4e00-\\u9fff";

    private static final Pattern SIZE_LABEL = Pattern.compile("((?<![A-Za-z])(?:size|サイズ)\\s*[:：/]?\\s*"
            + "([0-9A-Za-z][0-9A-Za-z.×/\\-]*(?:\\s?(?:cm|mm|kg|g|inch))?))", FLAGS);

    private static final Pattern MATERIAL_LABEL = Pattern.compile("((?<![A-Za-z])(?:material|素材|材質|材料)\\s*[:：]?\\s*"
            + "([A-Za-z0-9" + JA + "％%/・]+))", FLAGS);
    private static final Pattern MATERIAL_KEYWORD = Pattern.compile("(?<![A-Za-z])(cashmere|カシミヤ|cotton|コットン|綿"
            + "|wool|ウール|silk|シルク|linen|リネン|leather|レザー|本革|polyester|ポリエステル|nylon|ナイロン"
            + "|stainless steel|ステンレス)(?![A-Za-z])", FLAGS);

    private static final Pattern BRAND_LABEL = Pattern.compile("((?<![A-Za-z])(?:brand|ブランド)\\s*[:：]?\\s*"
            + "([A-Za-z0-9" + JA + "（）&'\\-]+))", FLAGS);
    private static final Pattern BRAND_KEYWORD = Pattern.compile(
            "(?<![A-Za-z])(ASICS|RASW|Nike|adidas|Puma|Uniqlo|Patagonia|Sony|Panasonic)(?![A-Za-z])", FLAGS);

    private static final Pattern COLOR_LABEL = Pattern.compile("((?<![A-Za-z])(?:colou?r|カラー|颜色|色\\s*[:：])\\s*[:：]?\\s*"
            + "([A-Za-z" + JA + "]+(?:\\s*/\\s*[A-Za-z" + JA + "]+(?:\\s[A-Za-z]+)?)*))", FLAGS);
    private static final Pattern COLOR_KEYWORD = Pattern.compile("(?<![A-Za-z])(アイボリー|ivory|black|white|red|blue"
            + "|green|grey|gray|navy|beige|brown|pink|ブラック|ホワイト|黒|白|赤|青)(?![A-Za-z])", FLAGS);

    private static final List<UserPattern> TARGET_USERS = List.of(
            new UserPattern("children",
                    "(?:for|向け|対象)\\s*[:：]?\\s*(?:kids?|children|baby|infant|toddler|キッズ|子供|こども|ベビー|赤ちゃん|幼児)"),
            new UserPattern("adult", "(?:for|向け|対象)\\s*[:：]?\\s*(?:adults?|大人|おとな|成人)"),
            new UserPattern("men", "(?:for|向け|対象)\\s*[:：]?\\s*(?:men|male|メンズ|男性|紳士)(?![A-Za-z])"),
            new UserPattern("women", "(?:for|向け|対象)\\s*[:：]?\\s*(?:women|ladies|female|レディース|女性|婦人)"),
            new UserPattern("senior", "(?:for|向け|対象)\\s*[:：]?\\s*(?:seniors?|elderly|シニア|高齢者|お年寄り)"),
            new UserPattern("unisex", "(?:unisex|ユニセックス|男女兼用)"),
            new UserPattern("children", "(?:キッズ|子供用|子ども用)"),
            new UserPattern("baby", "(?:ベビー用|赤ちゃん用|乳児用)"),
            new UserPattern("men", "(?:メンズ|男性用|紳士用)"),
            new UserPattern("women", "(?:レディース|女性用|婦人用)"),
            new UserPattern("senior", "(?:シニア|高齢者用)"));

    @Inject
    DetectorConfig detectorConfig;

    /**
     * Extracts the configured attributes from normalized text, rendering country codes in the configured profile.
     *
     * @param text
     *            normalized text, may be empty
     * @return attribute set covering every configured attribute
     */
    public AttributeSet extract(String text) {
        return extract(text, detectorConfig.attributes(), detectorConfig.countryCodeFormat());
    }

    /**
     * Extracts the given attributes from normalized text.
     *
     * @param text
     *            normalized text, may be null or empty
     * @param attributes
     *            attributes the result must cover
     * @param format
     *            country code profile
     * @return attribute set covering exactly {@code attributes}
     */
    public AttributeSet extract(String text, List<AttributeName> attributes, CountryCodeFormat format) {
        AttributeSet result = AttributeSet.unknown(attributes);
        if (text == null || text.isBlank()) {
            return result;
        }
        for (AttributeName name : attributes) {
            AttributeField field = switch (name) {
                case COUNTRY -> country(text, format);
                case SIZE -> labelled(name, text, SIZE_LABEL, null);
                case MATERIAL -> labelled(name, text, MATERIAL_LABEL, MATERIAL_KEYWORD);
                case BRAND -> labelled(name, text, BRAND_LABEL, BRAND_KEYWORD);
                case COLOR -> labelled(name, text, COLOR_LABEL, COLOR_KEYWORD);
                case TARGET_USER -> targetUser(text);
                case HSCODE -> AttributeField.unknown(name);
            };
            result = result.with(name, field);
        }
        LOG.debugf("Heuristic extraction: maxConfidence=%.2f", result.maxConfidence());
        return result;
    }

    private AttributeField country(String text, CountryCodeFormat format) {
        Set<String> codes = new LinkedHashSet<>();
        List<String> evidence = new ArrayList<>();
        collectCountries(ORIGIN_PHRASE.matcher(text), codes, evidence);
        if (text.indexOf('製') >= 0) {
            collectCountries(ORIGIN_SUFFIX.matcher(text), codes, evidence);
        }
        if (codes.isEmpty()) {
            return AttributeField.unknown(AttributeName.COUNTRY);
        }
        List<String> rendered = codes.stream().map(code -> CountryCodes.render(code, format)).toList();
        return AttributeField.of(AttributeName.COUNTRY, rendered, String.join(" ", evidence), EXPLICIT_CONFIDENCE);
    }

    private void collectCountries(Matcher matcher, Set<String> codes, List<String> evidence) {
        while (matcher.find()) {
            List<String> found = CountryCodes.findAll(matcher.group(1));
            if (!found.isEmpty()) {
                codes.addAll(found);
                String phrase = matcher.group().trim();
                if (!evidence.contains(phrase)) {
                    evidence.add(phrase);
                }
            }
        }
    }

    private AttributeField labelled(AttributeName name, String text, Pattern label, Pattern keyword) {
        Matcher matcher = label.matcher(text);
        if (matcher.find()) {
            return AttributeField.of(name, matcher.group(2).trim(), matcher.group(1).trim(), KEYWORD_CONFIDENCE);
        }
        if (keyword != null) {
            matcher = keyword.matcher(text);
            if (matcher.find()) {
                String value = matcher.group(1).trim();
                return AttributeField.of(name, value, value, KEYWORD_CONFIDENCE);
            }
        }
        return AttributeField.unknown(name);
    }

    private AttributeField targetUser(String text) {
        Set<String> users = new LinkedHashSet<>();
        List<String> evidence = new ArrayList<>();
        for (UserPattern candidate : TARGET_USERS) {
            if (users.contains(candidate.userType())) {
                continue;
            }
            Matcher matcher = candidate.pattern().matcher(text);
            if (matcher.find()) {
                users.add(candidate.userType());
                evidence.add(matcher.group().trim());
            }
        }
        if (users.isEmpty()) {
            return AttributeField.unknown(AttributeName.TARGET_USER);
        }
        return AttributeField.of(AttributeName.TARGET_USER, new ArrayList<>(users), String.join(" ", evidence),
                KEYWORD_CONFIDENCE);
    }

    private record UserPattern(String userType, Pattern pattern) {

        UserPattern(String userType, String regex) {
            this(userType, Pattern.compile(regex, FLAGS));
        }
    }
}
