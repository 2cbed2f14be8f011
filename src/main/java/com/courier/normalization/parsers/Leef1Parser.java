package com.courier.normalization.parsers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for IBM QRadar LEEF 1.0.
 * Format: LEEF:Version|Vendor|Product|Version|EventID|Extension
 *
 * Extension pairs are tab delimited; when the extension has no tab, spaces
 * are used instead.
 */
public class Leef1Parser implements MessageParser<Map<String, String>> {

    public static final String CACHE_KEY = "leef1";

    private static final String PREFIX = "LEEF:";

    private static final String[] HEADER_FIELDS = {
        "leef_version",
        "vendor",
        "product",
        "version",
        "event_id"
    };

    @Override
    public String cacheKey() {
        return CACHE_KEY;
    }

    @Override
    public Map<String, String> parse(String message) {
        if (message == null || !message.startsWith(PREFIX)) {
            return null;
        }
        List<String> parts = splitHeader(message.substring(PREFIX.length()));
        if (parts.size() < HEADER_FIELDS.length + 1) {
            return null;
        }

        Map<String, String> result = new LinkedHashMap<>();
        for (int i = 0; i < HEADER_FIELDS.length; i++) {
            result.put(HEADER_FIELDS[i], parts.get(i));
        }

        String extension = parts.get(HEADER_FIELDS.length);
        if (!extension.isEmpty()) {
            String delimiter = extension.indexOf('\t') >= 0 ? "\t" : " ";
            for (String pair : extension.split(delimiter)) {
                int eq = pair.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                String key = pair.substring(0, eq).trim();
                String value = unescape(pair.substring(eq + 1).trim());
                result.put(key, value);
            }
        }
        return result;
    }

    private static List<String> splitHeader(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == '|') {
                current.append('|');
                i += 2;
            } else if (c == '|') {
                parts.add(current.toString());
                current.setLength(0);
                if (parts.size() == HEADER_FIELDS.length) {
                    parts.add(text.substring(i + 1));
                    return parts;
                }
                i++;
            } else {
                current.append(c);
                i++;
            }
        }
        parts.add(current.toString());
        return parts;
    }

    /**
     * Resolve LEEF escape sequences ({@code \\ \= \| \n \r \t \s}). An unknown
     * escape yields the escaped character.
     */
    static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(i + 1);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 's':
                        sb.append(' ');
                        break;
                    default:
                        sb.append(next);
                }
                i += 2;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }
}
