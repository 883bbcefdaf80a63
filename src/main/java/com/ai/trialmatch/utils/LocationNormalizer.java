package com.ai.trialmatch.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites free-form US locations into the registry's "City, ST" form.
 * <ul>
 *   <li>"Boston, MA" passes through untouched</li>
 *   <li>"Boston Massachusetts" and "Boston, Massachusetts" become "Boston, MA"</li>
 *   <li>anything else passes through unmodified</li>
 * </ul>
 */
public final class LocationNormalizer {

    private static final Pattern CITY_WITH_CODE = Pattern.compile("^(.+?),\\s*([A-Za-z]{2})$");
    private static final Pattern CITY_WITH_NAME = Pattern.compile("^(.+?),\\s*([A-Za-z][A-Za-z ]+)$");
    private static final int LONGEST_STATE_NAME_WORDS = 2;

    private static final Map<String, String> STATE_CODES;
    /** "new", "north", "west"... never a city on their own in front of a state name. */
    private static final Set<String> STATE_NAME_PREFIXES;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("alabama", "AL");
        m.put("alaska", "AK");
        m.put("arizona", "AZ");
        m.put("arkansas", "AR");
        m.put("california", "CA");
        m.put("colorado", "CO");
        m.put("connecticut", "CT");
        m.put("delaware", "DE");
        m.put("florida", "FL");
        m.put("georgia", "GA");
        m.put("hawaii", "HI");
        m.put("idaho", "ID");
        m.put("illinois", "IL");
        m.put("indiana", "IN");
        m.put("iowa", "IA");
        m.put("kansas", "KS");
        m.put("kentucky", "KY");
        m.put("louisiana", "LA");
        m.put("maine", "ME");
        m.put("maryland", "MD");
        m.put("massachusetts", "MA");
        m.put("michigan", "MI");
        m.put("minnesota", "MN");
        m.put("mississippi", "MS");
        m.put("missouri", "MO");
        m.put("montana", "MT");
        m.put("nebraska", "NE");
        m.put("nevada", "NV");
        m.put("new hampshire", "NH");
        m.put("new jersey", "NJ");
        m.put("new mexico", "NM");
        m.put("new york", "NY");
        m.put("north carolina", "NC");
        m.put("north dakota", "ND");
        m.put("ohio", "OH");
        m.put("oklahoma", "OK");
        m.put("oregon", "OR");
        m.put("pennsylvania", "PA");
        m.put("rhode island", "RI");
        m.put("south carolina", "SC");
        m.put("south dakota", "SD");
        m.put("tennessee", "TN");
        m.put("texas", "TX");
        m.put("utah", "UT");
        m.put("vermont", "VT");
        m.put("virginia", "VA");
        m.put("washington", "WA");
        m.put("west virginia", "WV");
        m.put("wisconsin", "WI");
        m.put("wyoming", "WY");
        STATE_CODES = Collections.unmodifiableMap(m);
        STATE_NAME_PREFIXES = m.keySet().stream()
                .filter(name -> name.contains(" "))
                .map(name -> name.substring(0, name.indexOf(' ')))
                .collect(Collectors.toUnmodifiableSet());
    }

    private LocationNormalizer() {
    }

    /**
     * @return the "City, ST" form when the input can be recognised, the trimmed input otherwise,
     *         or {@code null} for a blank input
     */
    public static String normalize(String location) {
        if (StringUtils.isBlank(location)) return null;
        String raw = location.trim();
        String collapsed = StringUtils.normalizeSpace(raw);

        if (CITY_WITH_CODE.matcher(collapsed).matches()) {
            return raw;
        }

        Matcher named = CITY_WITH_NAME.matcher(collapsed);
        if (named.matches()) {
            String code = STATE_CODES.get(named.group(2).trim().toLowerCase(Locale.ROOT));
            if (code != null) {
                return qualify(named.group(1), code);
            }
            return raw;
        }

        if (STATE_CODES.containsKey(collapsed.toLowerCase(Locale.ROOT))) {
            return raw;
        }

        if (!collapsed.contains(",")) {
            Optional<String[]> split = splitTrailingStateName(collapsed);
            if (split.isPresent()) {
                return qualify(split.get()[0], split.get()[1]);
            }
        }
        return raw;
    }

    /**
     * Two-letter code of a state given by full name or code, e.g. "california" or "CA".
     */
    public static Optional<String> stateCode(String state) {
        if (StringUtils.isBlank(state)) return Optional.empty();
        String s = StringUtils.normalizeSpace(state).toLowerCase(Locale.ROOT);
        String byName = STATE_CODES.get(s);
        if (byName != null) return Optional.of(byName);
        String upper = s.toUpperCase(Locale.ROOT);
        return STATE_CODES.containsValue(upper) ? Optional.of(upper) : Optional.empty();
    }

    /**
     * True when the location already names a state: a bare state, "City, XX", "City, State" or "City State".
     */
    public static boolean hasState(String location) {
        if (StringUtils.isBlank(location)) return false;
        String collapsed = StringUtils.normalizeSpace(location);
        if (stateCode(collapsed).isPresent()) return true;
        if (CITY_WITH_CODE.matcher(collapsed).matches()) return true;
        Matcher named = CITY_WITH_NAME.matcher(collapsed);
        if (named.matches()) {
            return STATE_CODES.containsKey(named.group(2).trim().toLowerCase(Locale.ROOT));
        }
        return splitTrailingStateName(collapsed).isPresent();
    }

    public static String qualify(String city, String stateCode) {
        return StringUtils.normalizeSpace(city) + ", " + stateCode.toUpperCase(Locale.ROOT);
    }

    public static int stateCount() {
        return STATE_CODES.size();
    }

    /**
     * Longest state name wins, so "Charleston West Virginia" is not read as Virginia.
     * A bare state name such as "West Virginia" is never split.
     */
    private static Optional<String[]> splitTrailingStateName(String collapsed) {
        if (STATE_CODES.containsKey(collapsed.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        String[] words = collapsed.split(" ");
        for (int n = Math.min(LONGEST_STATE_NAME_WORDS, words.length - 1); n >= 1; n--) {
            String candidate = String.join(" ", Arrays.copyOfRange(words, words.length - n, words.length));
            String code = STATE_CODES.get(candidate.toLowerCase(Locale.ROOT));
            if (code != null) {
                String city = String.join(" ", Arrays.copyOfRange(words, 0, words.length - n));
                if (city.isEmpty() || STATE_NAME_PREFIXES.contains(city.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                return Optional.of(new String[]{city, code});
            }
        }
        return Optional.empty();
    }
}
