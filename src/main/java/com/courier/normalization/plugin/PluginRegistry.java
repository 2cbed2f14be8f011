package com.courier.normalization.plugin;

import com.courier.domain.RecordVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of message decoder plugins.
 *
 * Plugins are registered while the registry is open and looked up once it is
 * frozen. Lookups resolve the variant hierarchy, so a plugin declared for
 * {@link RecordVariant#SYSLOG} is returned for RFC3164 and RFC5424 records.
 * After {@link #freeze()} the registry is immutable and safe to share.
 */
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final List<MessageDecoderPlugin> plugins = new ArrayList<>();
    private volatile Map<RecordVariant, Map<PluginStage, List<MessageDecoderPlugin>>> index;

    /**
     * Register a plugin. Plugins run in registration order within a stage.
     *
     * @throws IllegalStateException if the registry is frozen
     */
    public synchronized void register(MessageDecoderPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        if (index != null) {
            throw new IllegalStateException("Plugin registry is frozen, cannot register " + plugin.name());
        }
        if (plugin.variants() == null || plugin.variants().isEmpty()) {
            throw new IllegalArgumentException("Plugin " + plugin.name() + " declares no record variants");
        }
        Objects.requireNonNull(plugin.stage(), "stage of " + plugin.name());
        plugins.add(plugin);
        log.debug("Registered decoder plugin {} for {} in stage {}", plugin.name(), plugin.variants(), plugin.stage());
    }

    /**
     * End registration and build the lookup index. Calling it again has no effect.
     */
    public synchronized void freeze() {
        if (index != null) {
            return;
        }
        Map<RecordVariant, Map<PluginStage, List<MessageDecoderPlugin>>> built = new EnumMap<>(RecordVariant.class);
        for (RecordVariant variant : RecordVariant.values()) {
            Map<PluginStage, List<MessageDecoderPlugin>> byStage = new EnumMap<>(PluginStage.class);
            for (PluginStage stage : PluginStage.values()) {
                List<MessageDecoderPlugin> matching = new ArrayList<>();
                for (MessageDecoderPlugin plugin : plugins) {
                    if (plugin.stage() == stage && appliesTo(plugin, variant)) {
                        matching.add(plugin);
                    }
                }
                byStage.put(stage, Collections.unmodifiableList(matching));
            }
            built.put(variant, Collections.unmodifiableMap(byStage));
        }
        index = Collections.unmodifiableMap(built);
        log.info("Plugin registry frozen with {} plugins", plugins.size());
    }

    public boolean isFrozen() {
        return index != null;
    }

    /**
     * Plugins for a record variant and stage, in registration order
     *
     * @throws IllegalStateException if the registry is not frozen yet
     */
    public List<MessageDecoderPlugin> pluginsFor(RecordVariant variant, PluginStage stage) {
        Map<RecordVariant, Map<PluginStage, List<MessageDecoderPlugin>>> current = index;
        if (current == null) {
            throw new IllegalStateException("Plugin registry is not frozen yet");
        }
        return current.get(variant).get(stage);
    }

    /**
     * Every registered plugin, in registration order
     */
    public synchronized List<MessageDecoderPlugin> getPlugins() {
        return List.copyOf(plugins);
    }

    private static boolean appliesTo(MessageDecoderPlugin plugin, RecordVariant variant) {
        for (RecordVariant declared : plugin.variants()) {
            if (variant.satisfies(declared)) {
                return true;
            }
        }
        return false;
    }
}
