package com.courier.normalization.parsers;

/**
 * Parser for one payload format carried in the free-text message of a
 * record (key=value, CEF, LEEF, JSON, ...).
 *
 * Implementations are stateless and their results are memoised per message
 * in the parsing cache under {@link #cacheKey()}.
 *
 * @param <T> the parsed representation
 */
public interface MessageParser<T> {

    /**
     * Parses the message text
     *
     * @param message the free-text message of a record
     * @return the parsed representation, or null if the text is not in this format
     */
    T parse(String message);

    /**
     * Returns the key under which results of this parser are cached
     *
     * @return cache key, unique per parser (e.g., "kv", "cef")
     */
    String cacheKey();
}
