package com.courier.normalization.plugin.generic;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.normalization.parsers.CefParser;
import com.courier.normalization.plugin.AbstractMessageDecoderPlugin;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.ParsingCache;
import com.courier.normalization.plugin.PluginStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decoder for CEF payloads. The classification comes from the CEF header:
 * device vendor, device product and event name, lower-cased.
 */
@Component
@Order(300)
public class CefPlugin extends AbstractMessageDecoderPlugin {

    private final CefParser parser = new CefParser();

    public CefPlugin(FieldMapper fieldMapper) {
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
        fieldMapper.applyFieldMapping(record, fields,
            lower(fields.get("device_vendor")),
            lower(fields.get("device_product")),
            lower(fields.get("name")),
            name());
        return true;
    }

    private static String lower(String value) {
        return value == null || value.isEmpty() ? "unknown" : value.toLowerCase(Locale.ROOT);
    }
}
