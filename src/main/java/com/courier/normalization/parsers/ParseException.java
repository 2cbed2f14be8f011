package com.courier.normalization.parsers;

/**
 * Exception thrown when a grammar cannot parse a message at all.
 * Carries the grammar name and the offending text to help diagnose failures.
 */
public class ParseException extends RuntimeException {

    private final String grammar;
    private final String rawData;

    public ParseException(String message, String grammar, String rawData) {
        super(message);
        this.grammar = grammar;
        this.rawData = rawData;
    }

    public String getGrammar() {
        return grammar;
    }

    public String getRawData() {
        return rawData;
    }
}
