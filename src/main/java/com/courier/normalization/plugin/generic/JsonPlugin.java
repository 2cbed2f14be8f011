package com.courier.normalization.plugin.generic;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.normalization.parsers.JsonMessageParser;
import com.courier.normalization.plugin.AbstractMessageDecoderPlugin;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.ParsingCache;
import com.courier.normalization.plugin.PluginStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Fallback decoder for messages carrying a JSON object. Skips records that
 * an earlier plugin already classified.
 */
@Component
@Order(400)
public class JsonPlugin extends AbstractMessageDecoderPlugin {

    private final JsonMessageParser parser;

    public JsonPlugin(FieldMapper fieldMapper, JsonMessageParser parser) {
        super(fieldMapper);
        this.parser = parser;
    }

    @Override
    public Set<RecordVariant> variants() {
        return Set.of(RecordVariant.ENVELOPE);
    }

    @Override
    public PluginStage stage() {
        return PluginStage.UNPROCESSED_STRUCTURED;
    }

    @Override
    public boolean tryDecode(EventEnvelope record, ParsingCache cache) {
        if (record.getStructureClassification() != null) {
            return false;
        }
        Map<String, Object> fields = parseMessage(record, cache, parser);
        if (fields == null) {
            return false;
        }
        fieldMapper.applyFieldMapping(record, fields, "generic", "unknown_json", "unknown", name());
        return true;
    }
}
