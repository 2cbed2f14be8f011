package com.courier.normalization.plugin.generic;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.normalization.parsers.Leef1Parser;
import com.courier.normalization.plugin.AbstractMessageDecoderPlugin;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.ParsingCache;
import com.courier.normalization.plugin.PluginStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Decoder for LEEF 1.0 payloads, classified as vendor/product/event id.
 */
@Component
@Order(310)
public class Leef1Plugin extends AbstractMessageDecoderPlugin {

    private final Leef1Parser parser = new Leef1Parser();

    public Leef1Plugin(FieldMapper fieldMapper) {
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
        String message = record.getMessage();
        if (message == null || !message.startsWith("LEEF:1.")) {
            return false;
        }
        Map<String, String> fields = parseMessage(record, cache, parser);
        if (fields == null) {
            return false;
        }
        fieldMapper.applyFieldMapping(record, fields,
            fields.get("vendor"), fields.get("product"), fields.get("event_id"), name());
        return true;
    }
}
