package com.courier.normalization.plugin.fortinet;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import com.courier.normalization.parsers.KeyValueParser;
import com.courier.normalization.plugin.AbstractMessageDecoderPlugin;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.ParsingCache;
import com.courier.normalization.plugin.PluginStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Decoder for Fortinet FortiGate key=value syslog payloads, e.g.
 * {@code date=2025-05-13 time=12:34:56 devname=fgt logid=0100032003 type=event subtype=system eventtime=...}.
 *
 * Shares the key=value parse with {@link com.courier.normalization.plugin.generic.GenericKvPlugin}.
 */
@Component
@Order(200)
public class FortiGateKvPlugin extends AbstractMessageDecoderPlugin {

    private static final Logger log = LoggerFactory.getLogger(FortiGateKvPlugin.class);

    private static final int LOGID_LENGTH = 10;

    private final KeyValueParser parser = new KeyValueParser();

    public FortiGateKvPlugin(FieldMapper fieldMapper) {
        super(fieldMapper);
    }

    @Override
    public Set<RecordVariant> variants() {
        return Set.of(RecordVariant.SYSLOG);
    }

    @Override
    public PluginStage stage() {
        return PluginStage.SECOND_PASS;
    }

    @Override
    public boolean tryDecode(EventEnvelope record, ParsingCache cache) {
        Map<String, String> fields = parseMessage(record, cache, parser);
        if (fields == null
                || !fields.containsKey("eventtime")
                || !fields.containsKey("type")
                || !fields.containsKey("subtype")
                || fields.get("logid") == null
                || fields.get("logid").length() != LOGID_LENGTH) {
            return false;
        }

        String msgclass = fields.get("type") + "_" + fields.get("subtype");
        fieldMapper.applyFieldMapping(record, fields, "fortinet", "fortigate", msgclass, name());
        log.debug("FortiGate log {} decoded as {}", fields.get("logid"), msgclass);
        return true;
    }
}
