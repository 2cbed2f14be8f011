package com.courier.normalization.parsers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for Common Event Format (CEF).
 * Format: CEF:Version|Device Vendor|Device Product|Device Version|Signature ID|Name|Severity|Extension
 *
 * Header fields are split on unescaped pipes. Extension values run until the
 * next {@code key=} token, so they may contain spaces. Custom string labels
 * ({@code cs1Label=Policy cs1=Allow}) are added as aliases ({@code Policy=Allow}).
 */
public class CefParser implements MessageParser<Map<String, String>> {

    public static final String CACHE_KEY = "cef";

    private static final String PREFIX = "CEF:";

    private static final String[] HEADER_FIELDS = {
        "cef_version",
        "device_vendor",
        "device_product",
        "device_version",
        "signature_id",
        "name",
        "severity"
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
            Map<String, String> extensions = parseExtension(extension);
            extensions.forEach(result::putIfAbsent);
            applyLabels(result);
        }
        return result;
    }

    /**
     * Split the header on unescaped pipes, stopping after the seventh pipe
     */
    static List<String> splitHeader(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && (text.charAt(i + 1) == '|' || text.charAt(i + 1) == '\\')) {
                current.append(text.charAt(i + 1));
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
     * Parse extension key=value pairs. A space ends a value only when the
     * next token looks like {@code key=}.
     */
    static Map<String, String> parseExtension(String extension) {
        Map<String, String> result = new LinkedHashMap<>();
        int len = extension.length();
        int i = 0;
        while (i < len) {
            while (i < len && Character.isWhitespace(extension.charAt(i))) {
                i++;
            }
            if (i >= len) {
                break;
            }
            int keyStart = i;
            while (i < len && extension.charAt(i) != '=' && !Character.isWhitespace(extension.charAt(i))) {
                i++;
            }
            if (i >= len || extension.charAt(i) != '=') {
                while (i < len && !Character.isWhitespace(extension.charAt(i))) {
                    i++;
                }
                continue;
            }
            String key = extension.substring(keyStart, i);
            i++;

            StringBuilder value = new StringBuilder();
            while (i < len) {
                char c = extension.charAt(i);
                if (Character.isWhitespace(c)) {
                    int spaceStart = i;
                    while (i < len && Character.isWhitespace(extension.charAt(i))) {
                        i++;
                    }
                    if (i >= len || startsWithKey(extension, i)) {
                        break;
                    }
                    value.append(extension, spaceStart, i);
                } else if (c == '\\' && i + 1 < len) {
                    value.append(unescape(extension.charAt(i + 1)));
                    i += 2;
                } else {
                    value.append(c);
                    i++;
                }
            }
            result.put(key, value.toString());
        }
        return result;
    }

    private static boolean startsWithKey(String text, int pos) {
        for (int j = pos; j < text.length() && !Character.isWhitespace(text.charAt(j)); j++) {
            char c = text.charAt(j);
            if (c == '=') {
                return j > pos;
            }
            if (c == '\\') {
                return false;
            }
        }
        return false;
    }

    private static char unescape(char c) {
        switch (c) {
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case 's':
                return ' ';
            default:
                return c;
        }
    }

    static void applyLabels(Map<String, String> fields) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            String key = entry.getKey();
            if (key.endsWith("Label") && key.length() > 5) {
                String base = key.substring(0, key.length() - 5);
                if (fields.containsKey(base)) {
                    aliases.put(entry.getValue(), fields.get(base));
                }
            }
        }
        aliases.forEach(fields::putIfAbsent);
    }
}
