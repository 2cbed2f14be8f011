package com.courier.normalization.plugin.generic;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.normalization.parsers.KeyValueParser;
import com.courier.normalization.plugin.AbstractMessageDecoderPlugin;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.ParsingCache;
import com.courier.normalization.plugin.PluginStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Fallback decoder for key=value messages that no vendor plugin claimed.
 */
@Component
@Order(500)
public class GenericKvPlugin extends AbstractMessageDecoderPlugin {

    private final KeyValueParser parser = new KeyValueParser();

    public GenericKvPlugin(FieldMapper fieldMapper) {
        super(fieldMapper);
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
        Map<String, String> fields = parseMessage(record, cache, parser);
        if (fields == null) {
            return false;
        }
        fieldMapper.applyFieldMapping(record, fields, "generic", "unknown_kv", "unknown", name());
        return true;
    }
}
