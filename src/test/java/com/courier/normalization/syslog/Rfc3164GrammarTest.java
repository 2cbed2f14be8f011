package com.courier.normalization.syslog;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Rfc3164Grammar Tests")
class Rfc3164GrammarTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
    private final Rfc3164Grammar grammar = new Rfc3164Grammar(new TimestampParser(clock, Duration.ofDays(1)));

    @Test
    @DisplayName("Should decode a classic BSD message")
    void shouldDecodeClassicMessage() {
        EventEnvelope record = grammar.parse("<34>Oct 11 22:14:15 mymachine su[230]: 'su root' failed for lonvick on /dev/pts/8");

        assertThat(record.getVariant()).isEqualTo(RecordVariant.SYSLOG_RFC3164);
        assertThat(record.getFacility()).isEqualTo(4);
        assertThat(record.getSeverity()).isEqualTo(2);
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-10-11T22:14:15Z"));
        assertThat(record.getHostname()).isEqualTo("mymachine");
        assertThat(record.getAppName()).isEqualTo("su");
        assertThat(record.getProcId()).isEqualTo("230");
        assertThat(record.getMessage()).isEqualTo("'su root' failed for lonvick on /dev/pts/8");
    }

    @Test
    @DisplayName("Should degrade to a bare message when there is no header")
    void shouldDegradeWithoutHeader() {
        String text = "this is just some text from a device";
        EventEnvelope record = grammar.parse(text);

        assertThat(record.getVariant()).isEqualTo(RecordVariant.ENVELOPE);
        assertThat(record.getFacility()).isNull();
        assertThat(record.getSeverity()).isNull();
        assertThat(record.getTimestamp()).isNull();
        assertThat(record.getHostname()).isNull();
        assertThat(record.getAppName()).isNull();
        assertThat(record.getProcId()).isNull();
        assertThat(record.getMessage()).isEqualTo(text);
    }

    @Test
    @DisplayName("Should not split host and tag out of text without a timestamp")
    void shouldKeepHostTagShapedTextWithoutTimestamp() {
        String text = "User alice: login denied";

        EventEnvelope record = grammar.parse(text);

        assertThat(record.getVariant()).isEqualTo(RecordVariant.ENVELOPE);
        assertThat(record.getHostname()).isNull();
        assertThat(record.getAppName()).isNull();
        assertThat(record.getMessage()).isEqualTo(text);
    }

    @Test
    @DisplayName("Should keep the text after a PRI as message when no timestamp follows")
    void shouldKeepTextAfterPriWithoutTimestamp() {
        EventEnvelope record = grammar.parse("<13>host app: hello");

        assertThat(record.getVariant()).isEqualTo(RecordVariant.SYSLOG);
        assertThat(record.getHostname()).isNull();
        assertThat(record.getAppName()).isNull();
        assertThat(record.getMessage()).isEqualTo("host app: hello");
    }

    @Test
    @DisplayName("Should reject PRI 192 without failing")
    void shouldRejectLargePri() {
        EventEnvelope record = grammar.parse("<192>plain text");

        assertThat(record.getFacility()).isNull();
        assertThat(record.getSeverity()).isNull();
        assertThat(record.getVariant()).isEqualTo(RecordVariant.ENVELOPE);
        assertThat(record.getMessage()).isEqualTo("plain text");
    }

    @Test
    @DisplayName("Should tag PRI-only messages as syslog")
    void shouldTagPriOnlyMessage() {
        EventEnvelope record = grammar.parse("<14>date=2025-05-13 type=event");

        assertThat(record.getVariant()).isEqualTo(RecordVariant.SYSLOG);
        assertThat(record.getFacility()).isEqualTo(1);
        assertThat(record.getSeverity()).isEqualTo(6);
        assertThat(record.getMessage()).isEqualTo("date=2025-05-13 type=event");
    }

    @Test
    @DisplayName("Should take a tag with no hostname after a timestamp")
    void shouldTakeTagWithoutHostname() {
        EventEnvelope record = grammar.parse("<13>Jun 15 10:00:00 sshd[42]: Accepted password");

        assertThat(record.getHostname()).isNull();
        assertThat(record.getAppName()).isEqualTo("sshd");
        assertThat(record.getProcId()).isEqualTo("42");
        assertThat(record.getMessage()).isEqualTo("Accepted password");
    }

    @Test
    @DisplayName("Should keep hostname case as written")
    void shouldKeepHostnameCase() {
        EventEnvelope record = grammar.parse("<13>Jun 15 10:00:00 FW-Edge01 kernel: link up");

        assertThat(record.getHostname()).isEqualTo("FW-Edge01");
        assertThat(record.getAppName()).isEqualTo("kernel");
        assertThat(record.getProcId()).isNull();
    }

    @Test
    @DisplayName("Should leave a tag without colon in the message")
    void shouldLeaveTagWithoutColon() {
        EventEnvelope record = grammar.parse("<13>Jun 15 10:00:00 host app hello");

        assertThat(record.getHostname()).isNull();
        assertThat(record.getAppName()).isNull();
        assertThat(record.getMessage()).isEqualTo("host app hello");
        assertThat(record.getVariant()).isEqualTo(RecordVariant.SYSLOG_RFC3164);
    }

    @Test
    @DisplayName("Should parse single-digit days padded with a space")
    void shouldParsePaddedDay() {
        EventEnvelope record = grammar.parse("<13>Jun  5 10:00:00 host app: hi");

        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2025-06-05T10:00:00Z"));
        assertThat(record.getHostname()).isEqualTo("host");
    }

    @Test
    @DisplayName("Should parse an ISO timestamp")
    void shouldParseIsoTimestamp() {
        EventEnvelope record = grammar.parse("<13>2025-05-13T12:34:56.123Z host app: hi");

        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2025-05-13T12:34:56.123Z"));
        assertThat(record.getMessage()).isEqualTo("hi");
    }
}
