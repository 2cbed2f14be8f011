package com.courier.normalization.syslog;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar for BSD-style syslog (RFC3164): {@code [<PRI>][TIMESTAMP ][HOSTNAME ]TAG[PID]: MSG}.
 *
 * Every header part is optional and the grammar degrades to "whole text is
 * the message" instead of failing, so legacy devices that omit the hostname
 * or tag still produce a record. It never throws for non-null input.
 */
public class Rfc3164Grammar {

    private static final Logger log = LoggerFactory.getLogger(Rfc3164Grammar.class);

    // TAG[PID]: or TAG:
    private static final Pattern TAG_PATTERN = Pattern.compile(
        "([^\\s\\[\\]:]+)(?:\\[([^\\]\\s]+)\\])?:"
    );

    private final TimestampParser timestampParser;

    public Rfc3164Grammar(TimestampParser timestampParser) {
        this.timestampParser = timestampParser;
    }

    /**
     * Parse a BSD syslog message into a new record
     *
     * @param text the raw message
     * @return the record; variant is {@link RecordVariant#SYSLOG_RFC3164} when a
     *         timestamp, hostname or tag was found, {@link RecordVariant#SYSLOG}
     *         when only a valid PRI was found and {@link RecordVariant#ENVELOPE} otherwise
     */
    public EventEnvelope parse(String text) {
        Objects.requireNonNull(text, "text");
        int len = text.length();

        SyslogPriority pri = SyslogPriority.scan(text);
        int pos = pri.getEnd();
        if (pri.isPresent()) {
            if (!pri.isValid()) {
                log.debug("Ignoring out of range PRI value {}", pri.getValue());
            }
            while (pos < len && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        TimestampParser.Match timestamp = timestampParser.parseLeading(text, pos);
        if (timestamp != null) {
            pos = timestamp.getEnd();
        }

        String hostname = null;
        String appName = null;
        String procId = null;

        int firstSpace = text.indexOf(' ', pos);
        String first = firstSpace < 0 ? text.substring(pos) : text.substring(pos, firstSpace);
        Matcher bareTag = TAG_PATTERN.matcher(first);

        // without a timestamp the rest is free text, not a header
        if (timestamp == null) {
            log.debug("No RFC3164 timestamp, keeping text as message");
        } else if (bareTag.matches()) {
            appName = bareTag.group(1);
            procId = bareTag.group(2);
            pos = firstSpace < 0 ? len : firstSpace + 1;
        } else if (firstSpace > pos && isHostToken(first)) {
            int secondSpace = text.indexOf(' ', firstSpace + 1);
            String second = secondSpace < 0 ? text.substring(firstSpace + 1) : text.substring(firstSpace + 1, secondSpace);
            Matcher tag = TAG_PATTERN.matcher(second);
            if (tag.matches()) {
                hostname = first;
                appName = tag.group(1);
                procId = tag.group(2);
                pos = secondSpace < 0 ? len : secondSpace + 1;
            }
        }

        RecordVariant variant;
        if (timestamp != null || hostname != null || appName != null) {
            variant = RecordVariant.SYSLOG_RFC3164;
        } else if (pri.isValid()) {
            variant = RecordVariant.SYSLOG;
        } else {
            variant = RecordVariant.ENVELOPE;
        }

        EventEnvelope record = new EventEnvelope(variant, text);
        if (pri.isValid()) {
            record.setPriority(pri.getFacility(), pri.getSeverity());
        }
        if (timestamp != null) {
            record.setTimestamp(timestamp.getInstant());
        }
        record.setHostname(hostname);
        record.setAppName(appName);
        record.setProcId(procId);
        record.setMessage(text.substring(pos));

        log.debug("Parsed RFC3164 header: variant={}, hostname={}, appName={}", variant, hostname, appName);
        return record;
    }

    private static boolean isHostToken(String token) {
        return !token.isEmpty() && !token.endsWith(":") && token.indexOf('[') < 0;
    }
}
