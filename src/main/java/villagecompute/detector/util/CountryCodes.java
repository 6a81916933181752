/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import villagecompute.detector.config.CountryCodeFormat;

/**
 * ISO 3166-1 country code utility: code validation, alpha-2/alpha-3 conversion and country name lookup.
 *
 * <p>
 * Codes are validated against {@link Locale#getISOCountries()}. The name table combines the JDK's English and
 * Japanese display names with a fixed alias list covering common short forms and constituent countries or territories
 * that map to their sovereign state:
 * <ul>
 * <li>{@code Wales}, {@code Scotland}, {@code England}, {@code Northern Ireland}, {@code UK} → {@code GB}</li>
 * <li>{@code Puerto Rico}, {@code USA}, {@code アメリカ}, {@code 米国} → {@code US}</li>
 * <li>{@code 日本} → {@code JP}, {@code 中国} → {@code CN}, {@code ベトナム} → {@code VN}</li>
 * </ul>
 *
 * <p>
 * <b>Usage Examples:</b>
 *
 * <pre>
 * CountryCodes.normalize("gbr"); // Optional[GB]
 * CountryCodes.fromName("Wales"); // Optional[GB]
 * CountryCodes.findAll("Indonesia / Vietnam"); // [ID, VN]
 * CountryCodes.render("GB", CountryCodeFormat.ALPHA3); // GBR
 * </pre>
 */
public final class CountryCodes {

    private static final Logger LOG = Logger.getLogger(CountryCodes.class);

    /** Placeholder some models emit for "unknown country"; never a valid result. */
    public static final String UNKNOWN = "ZZ";

    private static final Set<String> ALPHA2 = Set.of(Locale.getISOCountries());

    private static final Map<String, String> ALPHA3_TO_ALPHA2;
    private static final Map<String, String> ALPHA2_TO_ALPHA3;

    /** Lower-cased country name → alpha-2. */
    private static final Map<String, String> NAMES;

    /** Alternation of every known name, longest first, for embedding in larger patterns. */
    private static final String NAME_REGEX;

    private static final Pattern NAME_PATTERN;

    private static final String[][] ALIASES = {
            // constituent countries and territories
            {"Wales", "GB"}, {"Scotland", "GB"}, {"England", "GB"}, {"Northern Ireland", "GB"},
            {"Great Britain", "GB"}, {"Britain", "GB"}, {"UK", "GB"}, {"U.K.", "GB"}, {"Puerto Rico", "US"},
            {"USA", "US"}, {"U.S.A.", "US"}, {"U.S.", "US"}, {"America", "US"}, {"United States of America", "US"},
            {"Hong Kong", "HK"}, {"Macau", "MO"}, {"Macao", "MO"}, {"Korea", "KR"}, {"South Korea", "KR"},
            {"Viet Nam", "VN"}, {"Vietnam", "VN"}, {"Taiwan", "TW"}, {"Holland", "NL"}, {"Czech Republic", "CZ"},
            {"Turkey", "TR"}, {"Russia", "RU"}, {"PRC", "CN"},
            // Japanese
            {"日本", "JP"}, {"中国", "CN"}, {"中華人民共和国", "CN"}, {"韓国", "KR"}, {"台湾", "TW"}, {"香港", "HK"},
            {"ベトナム", "VN"}, {"タイ", "TH"}, {"インドネシア", "ID"}, {"マレーシア", "MY"}, {"フィリピン", "PH"},
            {"インド", "IN"}, {"バングラデシュ", "BD"}, {"カンボジア", "KH"}, {"ミャンマー", "MM"}, {"アメリカ", "US"},
            {"米国", "US"}, {"アメリカ合衆国", "US"}, {"カナダ", "CA"}, {"メキシコ", "MX"}, {"イギリス", "GB"},
            {"英国", "GB"}, {"ウェールズ", "GB"}, {"スコットランド", "GB"}, {"イングランド", "GB"}, {"フランス", "FR"},
            {"ドイツ", "DE"}, {"イタリア", "IT"}, {"スペイン", "ES"}, {"ポルトガル", "PT"}, {"オランダ", "NL"},
            {"ベルギー", "BE"}, {"スイス", "CH"}, {"オーストリア", "AT"}, {"スウェーデン", "SE"}, {"デンマーク", "DK"},
            {"ポーランド", "PL"}, {"チェコ", "CZ"}, {"トルコ", "TR"}, {"ロシア", "RU"}, {"オーストラリア", "AU"},
            {"ニュージーランド", "NZ"}, {"ブラジル", "BR"}, {"ペルー", "PE"}, {"南アフリカ", "ZA"}, {"エジプト", "EG"}};

    static {
        Map<String, String> alpha3To2 = new HashMap<>();
        Map<String, String> alpha2To3 = new HashMap<>();
        Map<String, String> names = new HashMap<>();
        for (String alpha2 : ALPHA2) {
            Locale locale = new Locale("", alpha2);
            try {
                String alpha3 = locale.getISO3Country();
                if (!alpha3.isEmpty()) {
                    alpha3To2.put(alpha3, alpha2);
                    alpha2To3.put(alpha2, alpha3);
                }
            } catch (MissingResourceException e) {
                LOG.debugf("No alpha-3 code for %s", alpha2);
            }
            addName(names, locale.getDisplayCountry(Locale.ENGLISH), alpha2);
            addName(names, locale.getDisplayCountry(Locale.JAPANESE), alpha2);
        }
        // aliases win over JDK display names (Puerto Rico → US)
        for (String[] alias : ALIASES) {
            names.put(alias[0].toLowerCase(Locale.ROOT), alias[1]);
        }
        ALPHA3_TO_ALPHA2 = Collections.unmodifiableMap(alpha3To2);
        ALPHA2_TO_ALPHA3 = Collections.unmodifiableMap(alpha2To3);
        NAMES = Collections.unmodifiableMap(names);

        List<String> sorted = new ArrayList<>(NAMES.keySet());
        sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        NAME_REGEX = sorted.stream().map(CountryCodes::nameAlternative).collect(Collectors.joining("|", "(?:", ")"));
        NAME_PATTERN = Pattern.compile(NAME_REGEX, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private CountryCodes() {
    }

    /**
     * Checks whether a string is an assigned ISO 3166-1 alpha-2 code (upper case, {@code ZZ} excluded).
     */
    public static boolean isValidAlpha2(String code) {
        return code != null && ALPHA2.contains(code) && !UNKNOWN.equals(code);
    }

    /**
     * Normalizes a model- or user-supplied country reference to alpha-2.
     *
     * <p>
     * Accepts alpha-2 and alpha-3 codes in any case, and country names from the name table. {@code ZZ}, blanks and
     * unknown values yield empty.
     *
     * @param value
     *            code or name
     * @return alpha-2 code, or empty
     */
    public static Optional<String> normalize(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (UNKNOWN.equals(upper)) {
            return Optional.empty();
        }
        if (upper.matches("[A-Z]{2}") && isValidAlpha2(upper)) {
            return Optional.of(upper);
        }
        if (upper.matches("[A-Z]{3}") && ALPHA3_TO_ALPHA2.containsKey(upper)) {
            return Optional.of(ALPHA3_TO_ALPHA2.get(upper));
        }
        return fromName(trimmed);
    }

    /**
     * Looks up a country name (English or Japanese, case-insensitive).
     */
    public static Optional<String> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(NAMES.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Finds every country name inside a text fragment, in order of appearance, without duplicates.
     *
     * @param fragment
     *            text such as {@code "Indonesia / Vietnam"}
     * @return alpha-2 codes
     */
    public static List<String> findAll(String fragment) {
        Map<String, Boolean> found = new LinkedHashMap<>();
        Matcher matcher = NAME_PATTERN.matcher(fragment == null ? "" : fragment);
        while (matcher.find()) {
            fromName(matcher.group()).ifPresent(code -> found.put(code, Boolean.TRUE));
        }
        return new ArrayList<>(found.keySet());
    }

    /**
     * Renders an alpha-2 code in the requested profile. Codes without an alpha-3 form are returned unchanged.
     */
    public static String render(String alpha2, CountryCodeFormat format) {
        if (format == CountryCodeFormat.ALPHA3) {
            return ALPHA2_TO_ALPHA3.getOrDefault(alpha2, alpha2);
        }
        return alpha2;
    }

    /**
     * Non-capturing alternation of all country names, longest first. Latin names must not touch another letter.
     */
    public static String nameRegex() {
        return NAME_REGEX;
    }

    private static void addName(Map<String, String> names, String displayName, String alpha2) {
        if (displayName == null || displayName.isBlank() || displayName.equals(alpha2)) {
            return;
        }
        names.putIfAbsent(displayName.toLowerCase(Locale.ROOT), alpha2);
    }

    private static String nameAlternative(String name) {
        String alternative = Pattern.quote(name);
        if (isLatinLetter(name.charAt(0))) {
            alternative = "(?<![A-Za-z])" + alternative;
        }
        if (isLatinLetter(name.charAt(name.length() - 1))) {
            alternative = alternative + "(?![A-Za-z])";
        }
        return alternative;
    }

    private static boolean isLatinLetter(char c) {
        return Character.isLetter(c) && c < 0x0250;
    }
}
