package com.courier.normalization.plugin;

import com.courier.domain.EventEnvelope;
import com.courier.domain.FieldCollision;
import com.courier.domain.HandlerEntry;
import com.courier.domain.RecordVariant;
import com.courier.domain.StructureClassification;
import com.courier.normalization.DecoderMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FieldMapper Tests")
class FieldMapperTest {

    private SimpleMeterRegistry meterRegistry;
    private FieldMapper fieldMapper;
    private EventEnvelope record;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        fieldMapper = new FieldMapper(new DecoderMetrics(meterRegistry));
        record = new EventEnvelope(RecordVariant.SYSLOG, "raw");
    }

    @Test
    @DisplayName("Should classify the record and copy fields in order")
    void shouldClassifyAndCopyFields() {
        fieldMapper.applyFieldMapping(record, List.of("b", "a"), List.of("2", "1"),
            "acme", "fw", "traffic", "AcmePlugin");

        assertThat(record.getStructureClassification()).isEqualTo(new StructureClassification("acme", "fw", "traffic"));
        assertThat(record.getEventData()).containsExactly(entry("b", "2"), entry("a", "1"));
        assertThat(record.getHandlerData())
            .containsEntry("AcmePlugin", new HandlerEntry("acme", "fw", "traffic", List.of("b", "a")));
    }

    @Test
    @DisplayName("Should keep the first value and record the collision")
    void shouldKeepFirstValueOnCollision() {
        fieldMapper.mergeEventData(record, List.of("src"), List.of("10.0.0.1"), "First");
        fieldMapper.mergeEventData(record, List.of("src", "dst"), List.of("192.168.0.1", "10.0.0.2"), "Second");

        assertThat(record.getEventData()).containsEntry("src", "10.0.0.1").containsEntry("dst", "10.0.0.2");
        assertThat(record.getCollisions())
            .containsExactly(new FieldCollision("src", "10.0.0.1", "192.168.0.1", "Second"));
        assertThat(meterRegistry.get("courier.decoder.field.collisions").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record a conflicting classification without replacing the first")
    void shouldRecordClassificationConflict() {
        fieldMapper.applyFieldMapping(record, List.of(), List.of(), "fortinet", "fortigate", "event_system", "A");
        fieldMapper.applyFieldMapping(record, List.of(), List.of(), "generic", "unknown_kv", "unknown", "B");
        fieldMapper.applyFieldMapping(record, List.of(), List.of(), "fortinet", "fortigate", "event_system", "C");

        assertThat(record.getStructureClassification().getVendor()).isEqualTo("fortinet");
        assertThat(record.getClassificationConflicts())
            .containsExactly(new StructureClassification("generic", "unknown_kv", "unknown"));
        assertThat(meterRegistry.get("courier.decoder.classification.conflicts").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should classify even when there are no fields")
    void shouldClassifyWithNoFields() {
        fieldMapper.applyFieldMapping(record, List.of(), List.of(), "v", "p", "m", "P");

        assertThat(record.getStructureClassification()).isNotNull();
        assertThat(record.getEventData()).isEmpty();
    }

    @Test
    @DisplayName("Should reject lists of different length")
    void shouldRejectMismatchedLists() {
        assertThatThrownBy(() -> fieldMapper.mergeEventData(record, List.of("a", "b"), List.of("1"), "P"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(record.getEventData()).isEmpty();
    }

    @Test
    @DisplayName("Should keep map order in the map overload")
    void shouldKeepMapOrder() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("z", 1);
        fields.put("y", 2);

        fieldMapper.applyFieldMapping(record, fields, "v", "p", "m", "P");

        assertThat(record.getEventData().keySet()).containsExactly("z", "y");
    }
}
