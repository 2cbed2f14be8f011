package com.courier.normalization.plugin;

/**
 * Ordered phases of the plugin chain. Stages run in declaration order.
 */
public enum PluginStage {

    /**
     * Generic enrichment of structured input (e.g. RFC5424 structured data).
     */
    FIRST_PASS,

    /**
     * Vendor specific decoders.
     */
    SECOND_PASS,

    /**
     * Self-describing structured payloads (CEF, LEEF, JSON, key=value).
     */
    UNPROCESSED_STRUCTURED,

    /**
     * Last-chance handlers for free text.
     */
    UNPROCESSED_MESSAGES
}
