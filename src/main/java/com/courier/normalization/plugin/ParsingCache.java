package com.courier.normalization.plugin;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Memoises parser results for one message so that several plugins can share
 * a single parse of the same payload (e.g. FortiGate and generic key=value).
 *
 * A null result ("not this format") is cached too. One instance lives for a
 * single decode call and is not thread safe.
 */
public class ParsingCache {

    private final Map<String, Object> results = new HashMap<>();

    /**
     * Return the cached result for key, computing it on first use
     *
     * @param key        parser cache key
     * @param rawMessage the message text handed to the parser
     * @param parser     the parse function
     * @return the parse result, possibly null
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, String rawMessage, Function<String, T> parser) {
        if (results.containsKey(key)) {
            return (T) results.get(key);
        }
        T result = parser.apply(rawMessage);
        results.put(key, result);
        return result;
    }

    public boolean contains(String key) {
        return results.containsKey(key);
    }

    public int size() {
        return results.size();
    }
}
