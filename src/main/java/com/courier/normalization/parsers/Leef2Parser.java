package com.courier.normalization.parsers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for IBM QRadar LEEF 2.0.
 * Format: LEEF:2.0|Vendor|Product|Version|EventID|EventCategory|Delimiter|Extension
 *
 * The delimiter field is either a single character or a hex code such as
 * {@code 0x09} or {@code x5E}. An empty delimiter means tab.
 */
public class Leef2Parser implements MessageParser<Map<String, String>> {

    private static final Logger log = LoggerFactory.getLogger(Leef2Parser.class);

    public static final String CACHE_KEY = "leef2";

    private static final String PREFIX = "LEEF:2.";

    private static final Pattern HEX_DELIMITER = Pattern.compile("0?[xX]([0-9a-fA-F]{1,4})");

    @Override
    public String cacheKey() {
        return CACHE_KEY;
    }

    @Override
    public Map<String, String> parse(String message) {
        if (message == null || !message.startsWith(PREFIX)) {
            return null;
        }
        String[] parts = message.split("\\|", 8);
        if (parts.length != 8 || parts[7].isEmpty()) {
            return null;
        }

        Map<String, String> result = new LinkedHashMap<>();
        result.put("leef_version", parts[0].substring("LEEF:".length()));
        result.put("vendor", parts[1]);
        result.put("product", parts[2]);
        result.put("version", parts[3]);
        result.put("event_id", parts[4]);
        result.put("event_category", parts[5]);

        String delimiter = decodeDelimiter(parts[6]);
        if (delimiter == null) {
            log.debug("Unusable LEEF 2.0 delimiter '{}'", parts[6]);
            return null;
        }
        for (String pair : parts[7].split(Pattern.quote(delimiter))) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            result.put(pair.substring(0, eq), Leef1Parser.unescape(pair.substring(eq + 1)));
        }

        CefParser.applyLabels(result);
        return result;
    }

    /**
     * Decode the header delimiter field
     *
     * @return the delimiter string, or null if it cannot be used
     */
    static String decodeDelimiter(String field) {
        if (field.isEmpty()) {
            return "\t";
        }
        if (field.length() == 1) {
            return field;
        }
        Matcher matcher = HEX_DELIMITER.matcher(field);
        if (matcher.matches()) {
            int codePoint = Integer.parseInt(matcher.group(1), 16);
            return codePoint == 0 ? null : new String(Character.toChars(codePoint));
        }
        return null;
    }
}
