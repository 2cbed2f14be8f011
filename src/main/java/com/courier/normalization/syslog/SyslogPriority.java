package com.courier.normalization.syslog;

/**
 * Result of scanning a leading syslog PRI token ({@code <N>}).
 *
 * A token is recognised when the text starts with {@code <}, one to three
 * digits and {@code >}. The value is valid only when it is at most 191;
 * larger values are reported as present but invalid so that callers can drop
 * the token without assigning facility and severity.
 */
public final class SyslogPriority {

    public static final int MAX_PRIORITY = 191;

    private static final SyslogPriority ABSENT = new SyslogPriority(false, -1, 0);

    private final boolean present;
    private final int value;
    private final int end;

    private SyslogPriority(boolean present, int value, int end) {
        this.present = present;
        this.value = value;
        this.end = end;
    }

    /**
     * Scan a PRI token at the start of the text
     *
     * @param text the raw message
     * @return the scan result, never null
     */
    public static SyslogPriority scan(String text) {
        if (text == null || text.length() < 3 || text.charAt(0) != '<') {
            return ABSENT;
        }
        int i = 1;
        int value = 0;
        while (i < text.length() && i <= 3 && isAsciiDigit(text.charAt(i))) {
            value = value * 10 + (text.charAt(i) - '0');
            i++;
        }
        if (i == 1 || i >= text.length() || text.charAt(i) != '>') {
            return ABSENT;
        }
        return new SyslogPriority(true, value, i + 1);
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static int facilityOf(int priority) {
        return priority / 8;
    }

    public static int severityOf(int priority) {
        return priority % 8;
    }

    /**
     * @return true if a {@code <digits>} token was found
     */
    public boolean isPresent() {
        return present;
    }

    /**
     * @return true if the token was found and its value is within 0-191
     */
    public boolean isValid() {
        return present && value <= MAX_PRIORITY;
    }

    public int getValue() {
        return value;
    }

    public int getFacility() {
        return facilityOf(value);
    }

    public int getSeverity() {
        return severityOf(value);
    }

    /**
     * @return index just past the closing {@code >}, or 0 when absent
     */
    public int getEnd() {
        return present ? end : 0;
    }
}
