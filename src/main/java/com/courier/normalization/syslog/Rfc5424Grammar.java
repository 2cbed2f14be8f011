package com.courier.normalization.syslog;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.domain.StructuredDataElement;
import com.courier.normalization.parsers.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Grammar for structured syslog (RFC5424):
 * {@code <PRI>VERSION SP TIMESTAMP SP HOSTNAME SP APP-NAME SP PROCID SP MSGID SP STRUCTURED-DATA [SP MSG]}.
 *
 * The header shape is fixed, so a missing PRI, a VERSION other than 1 or a
 * truncated header fail the whole message with {@link ParseException}. A bad
 * PRI value, an unparsable TIMESTAMP or a malformed structured-data element
 * only drop that piece.
 */
public class Rfc5424Grammar {

    private static final Logger log = LoggerFactory.getLogger(Rfc5424Grammar.class);

    public static final String NAME = "rfc5424";

    private static final String NIL = "-";
    private static final char BOM = '\uFEFF';

    /**
     * Parse an RFC5424 message into a new record
     *
     * @param text the raw message
     * @return a record of variant {@link RecordVariant#SYSLOG_RFC5424}
     * @throws ParseException if the header is malformed
     */
    public EventEnvelope parse(String text) {
        Objects.requireNonNull(text, "text");

        SyslogPriority pri = SyslogPriority.scan(text);
        if (!pri.isPresent()) {
            throw new ParseException("Missing PRI header", NAME, text);
        }

        Cursor cursor = new Cursor(text, pri.getEnd());
        String version = cursor.firstToken();
        if (!"1".equals(version)) {
            throw new ParseException("Unsupported syslog version: " + version, NAME, text);
        }
        String timestamp = cursor.nextToken("TIMESTAMP");
        String hostname = cursor.nextToken("HOSTNAME");
        String appName = cursor.nextToken("APP-NAME");
        String procId = cursor.nextToken("PROCID");
        String msgId = cursor.nextToken("MSGID");
        cursor.expectSpace("STRUCTURED-DATA");

        StructuredDataCodec.Result structuredData = StructuredDataCodec.parse(text, cursor.pos);
        int end = structuredData.getEnd();

        String message;
        if (end >= text.length()) {
            message = "";
        } else if (text.charAt(end) == ' ') {
            message = text.substring(end + 1);
            if (!message.isEmpty() && message.charAt(0) == BOM) {
                message = message.substring(1);
            }
        } else {
            throw new ParseException("Unexpected character after structured data at offset " + end, NAME, text);
        }

        EventEnvelope record = new EventEnvelope(RecordVariant.SYSLOG_RFC5424, text);
        if (pri.isValid()) {
            record.setPriority(pri.getFacility(), pri.getSeverity());
        } else {
            log.debug("Ignoring out of range PRI value {}", pri.getValue());
        }
        record.setTimestamp(parseTimestamp(timestamp));
        record.setHostname(nilToNull(hostname));
        record.setAppName(nilToNull(appName));
        record.setProcId(nilToNull(procId));
        record.setMsgId(nilToNull(msgId));
        for (StructuredDataElement element : structuredData.getElements()) {
            record.addStructuredData(element);
        }
        record.setMessage(message);

        log.debug("Parsed RFC5424 header: hostname={}, appName={}, sdElements={}, sdDropped={}",
            record.getHostname(), record.getAppName(),
            structuredData.getElements().size(), structuredData.getDroppedElements());
        return record;
    }

    private static Instant parseTimestamp(String value) {
        if (NIL.equals(value)) {
            return null;
        }
        Instant instant = TimestampParser.parseRfc3339(value);
        if (instant == null) {
            log.debug("Unparsable RFC5424 timestamp '{}'", value);
        }
        return instant;
    }

    private static String nilToNull(String value) {
        return NIL.equals(value) ? null : value;
    }

    /**
     * Walks the space separated header fields
     */
    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text, int pos) {
            this.text = text;
            this.pos = pos;
        }

        String firstToken() {
            int start = pos;
            while (pos < text.length() && text.charAt(pos) != ' ') {
                pos++;
            }
            return text.substring(start, pos);
        }

        String nextToken(String field) {
            expectSpace(field);
            String token = firstToken();
            if (token.isEmpty()) {
                throw new ParseException("Empty " + field + " field", NAME, text);
            }
            return token;
        }

        void expectSpace(String field) {
            if (pos >= text.length() || text.charAt(pos) != ' ') {
                throw new ParseException("Missing " + field + " field", NAME, text);
            }
            pos++;
        }
    }
}
