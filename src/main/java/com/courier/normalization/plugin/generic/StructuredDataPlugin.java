package com.courier.normalization.plugin.generic;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.domain.StructuredDataElement;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.MessageDecoderPlugin;
import com.courier.normalization.plugin.ParsingCache;
import com.courier.normalization.plugin.PluginStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens RFC5424 structured data into event data as {@code sdid.param}.
 * Does not classify the record.
 */
@Component
@Order(100)
public class StructuredDataPlugin implements MessageDecoderPlugin {

    private final FieldMapper fieldMapper;

    public StructuredDataPlugin(FieldMapper fieldMapper) {
        this.fieldMapper = fieldMapper;
    }

    @Override
    public Set<RecordVariant> variants() {
        return Set.of(RecordVariant.SYSLOG_RFC5424);
    }

    @Override
    public PluginStage stage() {
        return PluginStage.FIRST_PASS;
    }

    @Override
    public boolean tryDecode(EventEnvelope record, ParsingCache cache) {
        List<StructuredDataElement> elements = record.getStructuredData();
        if (elements.isEmpty()) {
            return false;
        }
        List<String> names = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (StructuredDataElement element : elements) {
            for (Map.Entry<String, String> param : element.getParams().entrySet()) {
                names.add(element.getId() + "." + param.getKey());
                values.add(param.getValue());
            }
        }
        fieldMapper.mergeEventData(record, names, values, name());
        return true;
    }
}
