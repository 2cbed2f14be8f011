package com.courier.normalization.parsers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parser for {@code key1=val1 key2="val 2"} messages (FortiGate, generic
 * appliance logs). Double-quoted values may contain spaces and backslash
 * escapes. Tokens without {@code =} are skipped.
 */
public class KeyValueParser implements MessageParser<Map<String, String>> {

    public static final String CACHE_KEY = "kv";

    @Override
    public String cacheKey() {
        return CACHE_KEY;
    }

    @Override
    public Map<String, String> parse(String message) {
        if (message == null || message.indexOf('=') < 0) {
            return null;
        }
        Map<String, String> result = new LinkedHashMap<>();
        int length = message.length();
        int i = 0;
        while (i < length) {
            while (i < length && Character.isWhitespace(message.charAt(i))) {
                i++;
            }
            int keyStart = i;
            while (i < length && message.charAt(i) != '=' && !Character.isWhitespace(message.charAt(i))) {
                i++;
            }
            String key = message.substring(keyStart, i);
            if (key.isEmpty() || i >= length || message.charAt(i) != '=') {
                // not a key=value token
                while (i < length && !Character.isWhitespace(message.charAt(i))) {
                    i++;
                }
                continue;
            }
            i++;

            String value;
            if (i < length && message.charAt(i) == '"') {
                i++;
                StringBuilder sb = new StringBuilder();
                while (i < length && message.charAt(i) != '"') {
                    if (message.charAt(i) == '\\' && i + 1 < length) {
                        sb.append(message.charAt(i + 1));
                        i += 2;
                    } else {
                        sb.append(message.charAt(i));
                        i++;
                    }
                }
                i++; // closing quote
                value = sb.toString();
            } else {
                int valueStart = i;
                while (i < length && !Character.isWhitespace(message.charAt(i))) {
                    i++;
                }
                value = message.substring(valueStart, i);
            }
            result.put(key, value);
        }
        return result.isEmpty() ? null : result;
    }
}
