package com.courier.normalization;

import com.courier.domain.RecordVariant;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer meters for the decoding engine.
 * Tagged counters are created lazily and cached per tag value.
 */
public class DecoderMetrics {

    private final MeterRegistry meterRegistry;

    private final Map<RecordVariant, Counter> decodedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> grammarFailureCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> pluginMatchCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> pluginFailureCounters = new ConcurrentHashMap<>();
    private final Counter fieldCollisions;
    private final Counter classificationConflicts;
    private final Timer latency;

    public DecoderMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.fieldCollisions = Counter.builder("courier.decoder.field.collisions")
            .description("Event-data writes rejected because the key was already set")
            .register(meterRegistry);
        this.classificationConflicts = Counter.builder("courier.decoder.classification.conflicts")
            .description("Classifications rejected because the record was already classified")
            .register(meterRegistry);
        this.latency = Timer.builder("courier.decoder.latency")
            .description("Time to decode one message through grammar and plugin chain")
            .register(meterRegistry);
    }

    public void recordDecoded(RecordVariant variant) {
        decodedCounters.computeIfAbsent(variant, v ->
            Counter.builder("courier.decoder.decoded")
                .tag("variant", v.getValue())
                .description("Number of decoded messages by record variant")
                .register(meterRegistry)
        ).increment();
    }

    public void recordGrammarFailure(String grammar) {
        grammarFailureCounters.computeIfAbsent(grammar, g ->
            Counter.builder("courier.decoder.grammar.failures")
                .tag("grammar", g)
                .description("Number of messages a grammar rejected")
                .register(meterRegistry)
        ).increment();
    }

    public void recordPluginMatch(String plugin) {
        pluginMatchCounters.computeIfAbsent(plugin, p ->
            Counter.builder("courier.decoder.plugin.matches")
                .tag("plugin", p)
                .description("Number of messages a plugin decoded")
                .register(meterRegistry)
        ).increment();
    }

    public void recordPluginFailure(String plugin) {
        pluginFailureCounters.computeIfAbsent(plugin, p ->
            Counter.builder("courier.decoder.plugin.failures")
                .tag("plugin", p)
                .description("Number of exceptions thrown by a plugin")
                .register(meterRegistry)
        ).increment();
    }

    public void recordFieldCollision() {
        fieldCollisions.increment();
    }

    public void recordClassificationConflict() {
        classificationConflicts.increment();
    }

    public <T> T timeDecode(Supplier<T> decode) {
        return latency.record(decode);
    }
}
