package com.courier.normalization.syslog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SyslogPriority Tests")
class SyslogPriorityTest {

    @Test
    @DisplayName("Should split PRI into facility and severity")
    void shouldSplitPri() {
        SyslogPriority pri = SyslogPriority.scan("<34>rest");

        assertThat(pri.isPresent()).isTrue();
        assertThat(pri.isValid()).isTrue();
        assertThat(pri.getFacility()).isEqualTo(4);
        assertThat(pri.getSeverity()).isEqualTo(2);
        assertThat(pri.getEnd()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should accept the bounds 0 and 191")
    void shouldAcceptBounds() {
        assertThat(SyslogPriority.scan("<0>x").isValid()).isTrue();
        assertThat(SyslogPriority.scan("<191>x").getFacility()).isEqualTo(23);
        assertThat(SyslogPriority.scan("<191>x").getSeverity()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should flag values above 191 as present but invalid")
    void shouldFlagLargeValues() {
        SyslogPriority pri = SyslogPriority.scan("<192>x");

        assertThat(pri.isPresent()).isTrue();
        assertThat(pri.isValid()).isFalse();
        assertThat(pri.getEnd()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should not recognise malformed tokens")
    void shouldIgnoreMalformedTokens() {
        assertThat(SyslogPriority.scan("<>x").isPresent()).isFalse();
        assertThat(SyslogPriority.scan("<1234>x").isPresent()).isFalse();
        assertThat(SyslogPriority.scan("<ab>x").isPresent()).isFalse();
        assertThat(SyslogPriority.scan("34>x").isPresent()).isFalse();
        assertThat(SyslogPriority.scan("<34").getEnd()).isZero();
    }

    @Test
    @DisplayName("Should accept only ASCII digits")
    void shouldRejectNonAsciiDigits() {
        // Arabic-Indic three and four
        assertThat(SyslogPriority.scan("<\u0663\u0664>x").isPresent()).isFalse();
        assertThat(SyslogPriority.scan("<3\u0664>x").isPresent()).isFalse();
    }
}
