package com.courier.normalization.plugin.generic;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.normalization.parsers.Leef2Parser;
import com.courier.normalization.plugin.AbstractMessageDecoderPlugin;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.ParsingCache;
import com.courier.normalization.plugin.PluginStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Decoder for LEEF 2.0 payloads. The message class is the event id, prefixed
 * by the event category when the header carries one.
 */
@Component
@Order(320)
public class Leef2Plugin extends AbstractMessageDecoderPlugin {

    private final Leef2Parser parser = new Leef2Parser();

    public Leef2Plugin(FieldMapper fieldMapper) {
        super(fieldMapper);
    }

    @Override
    public Set<RecordVariant> variants() {
        return Set.of(RecordVariant.SYSLOG);
    }

    @Override
    public PluginStage stage() {
        return PluginStage.UNPROCESSED_STRUCTURED;
    }

    @Override
    public boolean tryDecode(EventEnvelope record, ParsingCache cache) {
        Map<String, String> fields = parseMessage(record, cache, parser);
        if (fields == null) {
            return false;
        }
        String category = fields.get("event_category");
        String msgclass = category == null || category.isEmpty()
            ? fields.get("event_id")
            : category + "_" + fields.get("event_id");
        fieldMapper.applyFieldMapping(record, fields,
            fields.get("vendor"), fields.get("product"), msgclass, name());
        return true;
    }
}
