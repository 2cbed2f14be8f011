package com.courier.normalization.syslog;

import com.courier.domain.StructuredDataElement;
import com.courier.normalization.parsers.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the STRUCTURED-DATA part of an RFC5424 message.
 *
 * PARAM-VALUE escaping covers exactly {@code "}, {@code \} and {@code ]};
 * a backslash before any other character is kept literally. A malformed
 * element is dropped and scanning resumes after its closing bracket; an
 * unescaped ']' inside a value is skipped together with the rest of that
 * value. Only a quote or element still open at end of text is fatal.
 */
public final class StructuredDataCodec {

    private static final Logger log = LoggerFactory.getLogger(StructuredDataCodec.class);

    private StructuredDataCodec() {
    }

    /**
     * Outcome of parsing a structured-data section
     */
    public static final class Result {

        private final List<StructuredDataElement> elements;
        private final int end;
        private final int droppedElements;

        Result(List<StructuredDataElement> elements, int end, int droppedElements) {
            this.elements = Collections.unmodifiableList(elements);
            this.end = end;
            this.droppedElements = droppedElements;
        }

        public List<StructuredDataElement> getElements() {
            return elements;
        }

        /**
         * @return index of the first character after the section
         */
        public int getEnd() {
            return end;
        }

        public int getDroppedElements() {
            return droppedElements;
        }
    }

    /**
     * Parse the structured-data section starting at the given index
     *
     * @param text the full message text
     * @param start index of the {@code -} or first {@code [}
     * @return parsed elements and the index just past the section
     * @throws ParseException if the section does not start correctly or an
     *         element or quoted value is never closed
     */
    public static Result parse(String text, int start) {
        if (start >= text.length()) {
            throw new ParseException("Missing structured data", "rfc5424", text);
        }
        char first = text.charAt(start);
        if (first == '-') {
            return new Result(new ArrayList<>(), start + 1, 0);
        }
        if (first != '[') {
            throw new ParseException("Structured data must start with '[' or '-'", "rfc5424", text);
        }

        List<StructuredDataElement> elements = new ArrayList<>();
        int dropped = 0;
        int pos = start;
        while (pos < text.length() && text.charAt(pos) == '[') {
            ElementScan scan = scanElement(text, pos);
            if (scan.element != null) {
                elements.add(scan.element);
            } else {
                dropped++;
                log.debug("Dropped malformed structured data element at offset {}", pos);
            }
            pos = scan.end;
        }
        return new Result(elements, pos, dropped);
    }

    /**
     * Escape a PARAM-VALUE for inclusion between double quotes
     */
    public static String escapeParamValue(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\' || c == ']') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Reverse {@link #escapeParamValue(String)}
     */
    public static String unescapeParamValue(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length() && isEscapable(value.charAt(i + 1))) {
                sb.append(value.charAt(i + 1));
                i += 2;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Render elements back to RFC5424 structured-data syntax; {@code -} when empty
     */
    public static String format(List<StructuredDataElement> elements) {
        if (elements == null || elements.isEmpty()) {
            return "-";
        }
        StringBuilder sb = new StringBuilder();
        for (StructuredDataElement element : elements) {
            sb.append('[').append(element.getId());
            for (Map.Entry<String, String> param : element.getParams().entrySet()) {
                sb.append(' ')
                    .append(param.getKey())
                    .append("=\"")
                    .append(escapeParamValue(param.getValue()))
                    .append('"');
            }
            sb.append(']');
        }
        return sb.toString();
    }

    static boolean isNameChar(char c) {
        return c > 32 && c < 127 && c != '=' && c != ']' && c != '"';
    }

    private static boolean isEscapable(char c) {
        return c == '"' || c == '\\' || c == ']';
    }

    private static final class ElementScan {
        final StructuredDataElement element;
        final int end;

        ElementScan(StructuredDataElement element, int end) {
            this.element = element;
            this.end = end;
        }
    }

    private static ElementScan scanElement(String text, int start) {
        int len = text.length();
        int pos = start + 1;

        int idStart = pos;
        while (pos < len && isNameChar(text.charAt(pos))) {
            pos++;
        }
        if (pos == idStart) {
            return new ElementScan(null, skipToElementEnd(text, pos));
        }
        String id = text.substring(idStart, pos);
        Map<String, String> params = new LinkedHashMap<>();

        while (true) {
            if (pos >= len) {
                throw new ParseException("Unterminated structured data element '" + id + "'", "rfc5424", text);
            }
            char c = text.charAt(pos);
            if (c == ']') {
                return new ElementScan(new StructuredDataElement(id, params), pos + 1);
            }
            if (c != ' ') {
                return new ElementScan(null, skipToElementEnd(text, pos));
            }
            pos++;

            int nameStart = pos;
            while (pos < len && isNameChar(text.charAt(pos))) {
                pos++;
            }
            if (pos == nameStart || pos + 1 >= len || text.charAt(pos) != '=' || text.charAt(pos + 1) != '"') {
                return new ElementScan(null, skipToElementEnd(text, pos));
            }
            String name = text.substring(nameStart, pos);
            pos += 2;

            StringBuilder value = new StringBuilder();
            while (true) {
                if (pos >= len) {
                    throw new ParseException("Unterminated quoted value for '" + id + "." + name + "'", "rfc5424", text);
                }
                char v = text.charAt(pos);
                if (v == '\\' && pos + 1 < len && isEscapable(text.charAt(pos + 1))) {
                    value.append(text.charAt(pos + 1));
                    pos += 2;
                } else if (v == '"') {
                    pos++;
                    break;
                } else if (v == ']') {
                    // unescaped ']' inside an open value
                    return new ElementScan(null, resyncAfterBrokenValue(text, pos + 1));
                } else {
                    value.append(v);
                    pos++;
                }
            }
            params.putIfAbsent(name, value.toString());
        }
    }

    /**
     * Pick where scanning resumes after an unescaped ']' in a quoted value.
     * If the ']' is followed by '[', a space or end of text it is taken as the
     * element end. Otherwise the value runs on, and scanning resumes after the
     * next unescaped {@code "]}; without one, right after the ']'.
     */
    private static int resyncAfterBrokenValue(String text, int afterBracket) {
        int len = text.length();
        if (afterBracket >= len || text.charAt(afterBracket) == '[' || text.charAt(afterBracket) == ' ') {
            return afterBracket;
        }
        int pos = afterBracket;
        while (pos + 1 < len) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '"' && text.charAt(pos + 1) == ']') {
                return pos + 2;
            }
            pos++;
        }
        return afterBracket;
    }

    /**
     * Find the index after the next unescaped ']' at or after pos
     */
    private static int skipToElementEnd(String text, int pos) {
        int len = text.length();
        while (pos < len) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < len) {
                pos += 2;
                continue;
            }
            if (c == ']') {
                return pos + 1;
            }
            pos++;
        }
        throw new ParseException("Unterminated structured data element", "rfc5424", text);
    }
}
