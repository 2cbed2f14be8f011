package com.courier.domain;

/**
 * Variant tag of a canonical event record.
 *
 * The tag says which top-level grammar produced the record. Variants form a
 * small hierarchy so that a plugin declaring {@link #SYSLOG} also applies to
 * RFC3164 and RFC5424 records, and a plugin declaring {@link #ENVELOPE}
 * applies to every record.
 */
public enum RecordVariant {

    /**
     * Plain text with no recognised syslog header.
     */
    ENVELOPE("envelope", null),

    /**
     * Text carrying only a syslog PRI header followed by the message.
     */
    SYSLOG("syslog", ENVELOPE),

    /**
     * BSD syslog with a timestamp and/or hostname and tag.
     */
    SYSLOG_RFC3164("syslog:rfc3164", SYSLOG),

    /**
     * Structured syslog as defined by RFC5424.
     */
    SYSLOG_RFC5424("syslog:rfc5424", SYSLOG);

    private final String value;
    private final RecordVariant parent;

    RecordVariant(String value, RecordVariant parent) {
        this.value = value;
        this.parent = parent;
    }

    public String getValue() {
        return value;
    }

    /**
     * Check whether a record of this variant satisfies a plugin declared for
     * the given variant
     *
     * @param declared the variant a plugin was registered for
     * @return true if declared is this variant or one of its ancestors
     */
    public boolean satisfies(RecordVariant declared) {
        for (RecordVariant current = this; current != null; current = current.parent) {
            if (current == declared) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return value;
    }
}
