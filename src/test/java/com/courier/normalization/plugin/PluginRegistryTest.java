package com.courier.normalization.plugin;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PluginRegistry Tests")
class PluginRegistryTest {

    @Test
    @DisplayName("Should resolve plugins through the variant hierarchy")
    void shouldResolveVariantHierarchy() {
        PluginRegistry registry = new PluginRegistry();
        MessageDecoderPlugin syslog = new NamedPlugin("syslog", PluginStage.SECOND_PASS, RecordVariant.SYSLOG);
        MessageDecoderPlugin any = new NamedPlugin("any", PluginStage.SECOND_PASS, RecordVariant.ENVELOPE);
        MessageDecoderPlugin rfc5424 = new NamedPlugin("rfc5424", PluginStage.SECOND_PASS, RecordVariant.SYSLOG_RFC5424);
        registry.register(syslog);
        registry.register(any);
        registry.register(rfc5424);
        registry.freeze();

        assertThat(registry.pluginsFor(RecordVariant.SYSLOG_RFC3164, PluginStage.SECOND_PASS))
            .containsExactly(syslog, any);
        assertThat(registry.pluginsFor(RecordVariant.SYSLOG_RFC5424, PluginStage.SECOND_PASS))
            .containsExactly(syslog, any, rfc5424);
        assertThat(registry.pluginsFor(RecordVariant.ENVELOPE, PluginStage.SECOND_PASS))
            .containsExactly(any);
        assertThat(registry.pluginsFor(RecordVariant.SYSLOG, PluginStage.FIRST_PASS)).isEmpty();
    }

    @Test
    @DisplayName("Should keep registration order within a stage")
    void shouldKeepRegistrationOrder() {
        PluginRegistry registry = new PluginRegistry();
        MessageDecoderPlugin b = new NamedPlugin("b", PluginStage.FIRST_PASS, RecordVariant.ENVELOPE);
        MessageDecoderPlugin a = new NamedPlugin("a", PluginStage.FIRST_PASS, RecordVariant.ENVELOPE);
        registry.register(b);
        registry.register(a);
        registry.freeze();

        assertThat(registry.pluginsFor(RecordVariant.ENVELOPE, PluginStage.FIRST_PASS)).containsExactly(b, a);
    }

    @Test
    @DisplayName("Should refuse registration after freeze")
    void shouldRefuseRegistrationAfterFreeze() {
        PluginRegistry registry = new PluginRegistry();
        registry.freeze();

        assertThatThrownBy(() -> registry.register(new NamedPlugin("late", PluginStage.FIRST_PASS, RecordVariant.ENVELOPE)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should refuse lookups before freeze")
    void shouldRefuseLookupBeforeFreeze() {
        PluginRegistry registry = new PluginRegistry();

        assertThat(registry.isFrozen()).isFalse();
        assertThatThrownBy(() -> registry.pluginsFor(RecordVariant.SYSLOG, PluginStage.FIRST_PASS))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject plugins without variants")
    void shouldRejectPluginWithoutVariants() {
        PluginRegistry registry = new PluginRegistry();

        assertThatThrownBy(() -> registry.register(new NamedPlugin("none", PluginStage.FIRST_PASS)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class NamedPlugin implements MessageDecoderPlugin {
        private final String name;
        private final PluginStage stage;
        private final Set<RecordVariant> variants;

        NamedPlugin(String name, PluginStage stage, RecordVariant... variants) {
            this.name = name;
            this.stage = stage;
            this.variants = Set.of(variants);
        }

        @Override
        public Set<RecordVariant> variants() {
            return variants;
        }

        @Override
        public PluginStage stage() {
            return stage;
        }

        @Override
        public boolean tryDecode(EventEnvelope record, ParsingCache cache) {
            return false;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
