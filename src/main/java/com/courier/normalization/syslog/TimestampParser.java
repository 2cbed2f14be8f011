package com.courier.normalization.syslog;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the leading timestamp of a BSD-style syslog message.
 *
 * Recognised forms, tried in order:
 * <ul>
 *   <li>ISO8601 with explicit offset: {@code 2025-05-13T12:34:56.123Z}</li>
 *   <li>{@code 2025 May 13 12:34:56[.fff]}</li>
 *   <li>{@code May 13 12:34:56[.fff] 2025}</li>
 *   <li>{@code May 13 [2025] 12:34:56[.fff]} (classic RFC3164, day space padded)</li>
 *   <li>Unix epoch seconds, optionally followed by milli/micro/nano digits or a fraction</li>
 * </ul>
 * Forms without a year or zone take them from the supplied {@link Clock}. A
 * year-less date more than {@code futureTolerance} ahead of the clock is
 * moved to the previous year.
 */
public class TimestampParser {

    private static final Pattern RFC3339 = Pattern.compile(
        "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,9})?(?:Z|[+-]\\d{2}:\\d{2})"
    );

    private static final Pattern ISO8601 = Pattern.compile(
        "(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,9})?)([Zz]|[+-]\\d{2}:?\\d{2})(?= |$)"
    );

    private static final Pattern YEAR_FIRST = Pattern.compile(
        "(\\d{4}) ([A-Z][a-z]{2}) {1,2}(\\d{1,2}) (\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,9}))?(?= |$)"
    );

    private static final Pattern YEAR_LAST = Pattern.compile(
        "([A-Z][a-z]{2}) {1,2}(\\d{1,2}) (\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,9}))? (\\d{4})(?= |$)"
    );

    private static final Pattern BSD = Pattern.compile(
        "([A-Z][a-z]{2}) {1,2}(\\d{1,2})(?: (\\d{4}))? (\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,9}))?(?= |$)"
    );

    private static final Pattern EPOCH = Pattern.compile(
        "(\\d{10,19})(?:[.,](\\d{1,9}))?(?= |$)"
    );

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("Jan", 1), Map.entry("Feb", 2), Map.entry("Mar", 3),
        Map.entry("Apr", 4), Map.entry("May", 5), Map.entry("Jun", 6),
        Map.entry("Jul", 7), Map.entry("Aug", 8), Map.entry("Sep", 9),
        Map.entry("Oct", 10), Map.entry("Nov", 11), Map.entry("Dec", 12)
    );

    private final Clock clock;
    private final Duration futureTolerance;

    public TimestampParser(Clock clock, Duration futureTolerance) {
        this.clock = clock;
        this.futureTolerance = futureTolerance;
    }

    /**
     * A timestamp found at the start of the text
     */
    public static final class Match {
        private final Instant instant;
        private final int end;

        Match(Instant instant, int end) {
            this.instant = instant;
            this.end = end;
        }

        public Instant getInstant() {
            return instant;
        }

        /**
         * @return index of the remainder, past the timestamp and one separating space
         */
        public int getEnd() {
            return end;
        }
    }

    /**
     * Parse a strict RFC3339 timestamp as used by RFC5424
     *
     * @param value the TIMESTAMP header field
     * @return the instant, or null if the value is not a valid RFC3339 timestamp
     */
    public static Instant parseRfc3339(String value) {
        if (value == null || !RFC3339.matcher(value).matches()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Try every known form at the given index
     *
     * @param text the message text
     * @param start index where the timestamp would begin
     * @return the match, or null if no form parses
     */
    public Match parseLeading(String text, int start) {
        Match match = tryIso(text, start);
        if (match == null) {
            match = tryYearFirst(text, start);
        }
        if (match == null) {
            match = tryYearLast(text, start);
        }
        if (match == null) {
            match = tryBsd(text, start);
        }
        if (match == null) {
            match = tryEpoch(text, start);
        }
        return match;
    }

    private Match tryIso(String text, int start) {
        Matcher m = lookingAt(ISO8601, text, start);
        if (m == null) {
            return null;
        }
        String offset = m.group(2).toUpperCase();
        if (offset.length() == 5) {
            offset = offset.substring(0, 3) + ":" + offset.substring(3);
        }
        Instant instant = parseRfc3339(m.group(1) + offset);
        return instant == null ? null : new Match(instant, remainderIndex(text, m.end()));
    }

    private Match tryYearFirst(String text, int start) {
        Matcher m = lookingAt(YEAR_FIRST, text, start);
        if (m == null) {
            return null;
        }
        Instant instant = toInstant(Integer.valueOf(m.group(1)), m.group(2), m.group(3),
            m.group(4), m.group(5), m.group(6), m.group(7));
        return instant == null ? null : new Match(instant, remainderIndex(text, m.end()));
    }

    private Match tryYearLast(String text, int start) {
        Matcher m = lookingAt(YEAR_LAST, text, start);
        if (m == null) {
            return null;
        }
        Instant instant = toInstant(Integer.valueOf(m.group(7)), m.group(1), m.group(2),
            m.group(3), m.group(4), m.group(5), m.group(6));
        return instant == null ? null : new Match(instant, remainderIndex(text, m.end()));
    }

    private Match tryBsd(String text, int start) {
        Matcher m = lookingAt(BSD, text, start);
        if (m == null) {
            return null;
        }
        Integer year = m.group(3) != null ? Integer.valueOf(m.group(3)) : null;
        Instant instant = toInstant(year, m.group(1), m.group(2),
            m.group(4), m.group(5), m.group(6), m.group(7));
        return instant == null ? null : new Match(instant, remainderIndex(text, m.end()));
    }

    private Match tryEpoch(String text, int start) {
        Matcher m = lookingAt(EPOCH, text, start);
        if (m == null) {
            return null;
        }
        String digits = m.group(1);
        String fraction = digits.substring(10) + (m.group(2) != null ? m.group(2) : "");
        long seconds = Long.parseLong(digits.substring(0, 10));
        Instant instant = Instant.ofEpochSecond(seconds, nanos(fraction));
        return new Match(instant, remainderIndex(text, m.end()));
    }

    private Instant toInstant(Integer year, String monthName, String day,
                              String hour, String minute, String second, String fraction) {
        Integer month = MONTHS.get(monthName);
        if (month == null) {
            return null;
        }
        try {
            ZonedDateTime now = ZonedDateTime.now(clock);
            int resolvedYear = year != null ? year : now.getYear();
            ZonedDateTime candidate = LocalDateTime.of(resolvedYear, month, Integer.parseInt(day),
                    Integer.parseInt(hour), Integer.parseInt(minute), Integer.parseInt(second),
                    nanos(fraction))
                .atZone(clock.getZone());
            if (year == null && candidate.isAfter(now.plus(futureTolerance))) {
                candidate = candidate.minusYears(1);
            }
            return candidate.toInstant();
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static int nanos(String fraction) {
        if (fraction == null || fraction.isEmpty()) {
            return 0;
        }
        String padded = fraction.length() >= 9 ? fraction.substring(0, 9)
            : fraction + "000000000".substring(fraction.length());
        return Integer.parseInt(padded);
    }

    private static Matcher lookingAt(Pattern pattern, String text, int start) {
        Matcher m = pattern.matcher(text);
        m.region(start, text.length());
        return m.lookingAt() ? m : null;
    }

    private static int remainderIndex(String text, int end) {
        return end < text.length() && text.charAt(end) == ' ' ? end + 1 : end;
    }
}
