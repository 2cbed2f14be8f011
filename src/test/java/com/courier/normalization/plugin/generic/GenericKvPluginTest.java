package com.courier.normalization.plugin.generic;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.domain.StructureClassification;
import com.courier.normalization.DecoderMetrics;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.ParsingCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GenericKvPlugin Tests")
class GenericKvPluginTest {

    private final GenericKvPlugin plugin = new GenericKvPlugin(new FieldMapper(new DecoderMetrics(new SimpleMeterRegistry())));

    @Test
    @DisplayName("Should classify unclaimed key=value messages as generic")
    void shouldClassifyGenericKv() {
        EventEnvelope record = new EventEnvelope(RecordVariant.ENVELOPE, "user=bob action=login");
        record.setMessage("user=bob action=login");

        assertThat(plugin.tryDecode(record, new ParsingCache())).isTrue();
        assertThat(record.getStructureClassification())
            .isEqualTo(new StructureClassification("generic", "unknown_kv", "unknown"));
        assertThat(record.getEventData()).containsEntry("user", "bob").containsEntry("action", "login");
    }

    @Test
    @DisplayName("Should skip records that are already classified")
    void shouldSkipClassifiedRecords() {
        EventEnvelope record = new EventEnvelope(RecordVariant.SYSLOG, "a=1");
        record.setMessage("a=1");
        record.classifyIfAbsent(new StructureClassification("v", "p", "m"));

        assertThat(plugin.tryDecode(record, new ParsingCache())).isFalse();
        assertThat(record.getEventData()).isEmpty();
    }

    @Test
    @DisplayName("Should not match free text")
    void shouldNotMatchFreeText() {
        EventEnvelope record = new EventEnvelope(RecordVariant.ENVELOPE, "hello world");
        record.setMessage("hello world");

        assertThat(plugin.tryDecode(record, new ParsingCache())).isFalse();
    }
}
