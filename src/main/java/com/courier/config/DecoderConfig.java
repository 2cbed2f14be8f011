package com.courier.config;

import com.courier.normalization.DecodeOrchestrator;
import com.courier.normalization.DecoderMetrics;
import com.courier.normalization.parsers.JsonMessageParser;
import com.courier.normalization.plugin.FieldMapper;
import com.courier.normalization.plugin.MessageDecoderPlugin;
import com.courier.normalization.plugin.PluginRegistry;
import com.courier.normalization.syslog.Rfc3164Grammar;
import com.courier.normalization.syslog.Rfc5424Grammar;
import com.courier.normalization.syslog.SyslogFormatDetector;
import com.courier.normalization.syslog.TimestampParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wiring for the decoding engine.
 *
 * Plugins are picked up as {@link MessageDecoderPlugin} beans in {@code @Order}
 * order; those named in {@code courier.decoder.disabled-plugins} are left out.
 * The registry is frozen before the orchestrator sees it.
 */
@Configuration
public class DecoderConfig {

    private static final Logger log = LoggerFactory.getLogger(DecoderConfig.class);

    @Value("${courier.decoder.default-zone:UTC}")
    private String defaultZone;

    @Value("${courier.decoder.disabled-plugins:}")
    private String[] disabledPlugins;

    @Value("${courier.decoder.future-tolerance:P1D}")
    private Duration futureTolerance;

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock decoderClock() {
        return Clock.system(ZoneId.of(defaultZone));
    }

    @Bean
    public DecoderMetrics decoderMetrics(MeterRegistry meterRegistry) {
        return new DecoderMetrics(meterRegistry);
    }

    @Bean
    public TimestampParser timestampParser(Clock decoderClock) {
        return new TimestampParser(decoderClock, futureTolerance);
    }

    @Bean
    public Rfc3164Grammar rfc3164Grammar(TimestampParser timestampParser) {
        return new Rfc3164Grammar(timestampParser);
    }

    @Bean
    public Rfc5424Grammar rfc5424Grammar() {
        return new Rfc5424Grammar();
    }

    @Bean
    public SyslogFormatDetector syslogFormatDetector() {
        return new SyslogFormatDetector();
    }

    @Bean
    public FieldMapper fieldMapper(DecoderMetrics decoderMetrics) {
        return new FieldMapper(decoderMetrics);
    }

    @Bean
    public JsonMessageParser jsonMessageParser(ObjectMapper objectMapper) {
        return new JsonMessageParser(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public PluginRegistry pluginRegistry(List<MessageDecoderPlugin> plugins) {
        Set<String> disabled = Arrays.stream(disabledPlugins)
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toSet());

        PluginRegistry registry = new PluginRegistry();
        for (MessageDecoderPlugin plugin : plugins) {
            if (disabled.contains(plugin.name())) {
                log.info("Decoder plugin {} is disabled", plugin.name());
                continue;
            }
            registry.register(plugin);
        }
        registry.freeze();
        return registry;
    }

    @Bean
    public DecodeOrchestrator decodeOrchestrator(
            SyslogFormatDetector syslogFormatDetector,
            Rfc5424Grammar rfc5424Grammar,
            Rfc3164Grammar rfc3164Grammar,
            PluginRegistry pluginRegistry,
            DecoderMetrics decoderMetrics) {
        return new DecodeOrchestrator(syslogFormatDetector, rfc5424Grammar, rfc3164Grammar,
            pluginRegistry, decoderMetrics);
    }
}
