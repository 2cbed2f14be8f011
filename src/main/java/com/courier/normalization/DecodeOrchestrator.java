package com.courier.normalization;

import com.courier.domain.EventEnvelope;
import com.courier.normalization.parsers.ParseException;
import com.courier.normalization.plugin.MessageDecoderPlugin;
import com.courier.normalization.plugin.ParsingCache;
import com.courier.normalization.plugin.PluginRegistry;
import com.courier.normalization.plugin.PluginStage;
import com.courier.normalization.syslog.Rfc3164Grammar;
import com.courier.normalization.syslog.Rfc5424Grammar;
import com.courier.normalization.syslog.SyslogFormatDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the decoding engine.
 *
 * Turns one raw message into a frozen {@link EventEnvelope}: a top-level
 * grammar builds the record, then every plugin registered for the record's
 * variant runs, stage by stage. A plugin match does not stop the chain, so
 * later plugins can add fields that earlier ones did not set.
 *
 * Instances are stateless apart from metrics and can be shared between threads.
 */
public class DecodeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DecodeOrchestrator.class);

    private final SyslogFormatDetector formatDetector;
    private final Rfc5424Grammar rfc5424Grammar;
    private final Rfc3164Grammar rfc3164Grammar;
    private final PluginRegistry pluginRegistry;
    private final DecoderMetrics metrics;

    public DecodeOrchestrator(
            SyslogFormatDetector formatDetector,
            Rfc5424Grammar rfc5424Grammar,
            Rfc3164Grammar rfc3164Grammar,
            PluginRegistry pluginRegistry,
            DecoderMetrics metrics) {
        this.formatDetector = formatDetector;
        this.rfc5424Grammar = rfc5424Grammar;
        this.rfc3164Grammar = rfc3164Grammar;
        this.pluginRegistry = pluginRegistry;
        this.metrics = metrics;
    }

    /**
     * Decode a raw message, picking the grammar from the message shape.
     * RFC5424-shaped text that the RFC5424 grammar rejects is decoded as BSD syslog.
     *
     * @param raw the raw message
     * @return the frozen record, never null
     */
    public EventEnvelope decode(String raw) {
        Objects.requireNonNull(raw, "raw");
        return metrics.timeDecode(() -> {
            EventEnvelope record = null;
            if (formatDetector.detect(raw) == SyslogFormatDetector.Format.RFC5424) {
                try {
                    record = rfc5424Grammar.parse(raw);
                } catch (ParseException e) {
                    metrics.recordGrammarFailure(Rfc5424Grammar.NAME);
                    log.debug("RFC5424 grammar rejected message, falling back to RFC3164: {}", e.getMessage());
                }
            }
            if (record == null) {
                record = rfc3164Grammar.parse(raw);
            }
            return runPlugins(record);
        });
    }

    /**
     * Decode a message that must be RFC5424
     *
     * @throws ParseException if the RFC5424 grammar rejects the message
     */
    public EventEnvelope decodeRfc5424(String raw) {
        Objects.requireNonNull(raw, "raw");
        return metrics.timeDecode(() -> {
            try {
                return runPlugins(rfc5424Grammar.parse(raw));
            } catch (ParseException e) {
                metrics.recordGrammarFailure(Rfc5424Grammar.NAME);
                throw e;
            }
        });
    }

    /**
     * Decode a message with the BSD syslog grammar, which accepts any text
     */
    public EventEnvelope decodeRfc3164(String raw) {
        Objects.requireNonNull(raw, "raw");
        return metrics.timeDecode(() -> runPlugins(rfc3164Grammar.parse(raw)));
    }

    private EventEnvelope runPlugins(EventEnvelope record) {
        ParsingCache cache = new ParsingCache();
        for (PluginStage stage : PluginStage.values()) {
            for (MessageDecoderPlugin plugin : pluginRegistry.pluginsFor(record.getVariant(), stage)) {
                runPlugin(plugin, record, cache);
            }
        }
        record.freeze();
        metrics.recordDecoded(record.getVariant());
        log.debug("Decoded {} record classified as {}", record.getVariant(), record.getStructureClassification());
        return record;
    }

    private void runPlugin(MessageDecoderPlugin plugin, EventEnvelope record, ParsingCache cache) {
        String name = plugin.name();
        try {
            if (plugin.tryDecode(record, cache)) {
                metrics.recordPluginMatch(name);
                log.debug("Plugin {} matched {} record", name, record.getVariant());
            }
        } catch (RuntimeException e) {
            metrics.recordPluginFailure(name);
            log.warn("Plugin {} failed on {} record, skipping it: {}", name, record.getVariant(), e.toString());
        }
    }
}
