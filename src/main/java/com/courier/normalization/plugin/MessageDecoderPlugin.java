package com.courier.normalization.plugin;

import com.courier.domain.EventEnvelope;
import com.courier.domain.RecordVariant;

import java.util.Set;

/**
 * A decoder that recognises one payload format in the message of a record
 * and enriches the record in place.
 */
public interface MessageDecoderPlugin {

    /**
     * Record variants this plugin applies to. A record matches when its
     * variant is one of these or a descendant of one.
     */
    Set<RecordVariant> variants();

    PluginStage stage();

    /**
     * Attempt to decode the record's message
     *
     * @param record the record being decoded, still mutable
     * @param cache  per-message parse cache
     * @return true if the plugin recognised the message and enriched the record
     */
    boolean tryDecode(EventEnvelope record, ParsingCache cache);

    default String name() {
        return getClass().getSimpleName();
    }
}
