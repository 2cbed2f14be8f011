package com.courier.normalization.syslog;

import java.util.regex.Pattern;

/**
 * Detects the syslog flavour of raw text using cheap prefix heuristics.
 * Used by the orchestrator to pick the first grammar to try.
 */
public class SyslogFormatDetector {

    public enum Format {
        RFC5424,
        RFC3164
    }

    // <PRI> followed by a version number and a space
    private static final Pattern RFC5424_PREFIX = Pattern.compile("<\\d{1,3}>[1-9]\\d{0,2} .*", Pattern.DOTALL);

    /**
     * Detect the format of the raw text
     *
     * @param raw the raw message
     * @return {@link Format#RFC5424} when the text starts with a PRI and an RFC5424
     *         version number, {@link Format#RFC3164} otherwise
     */
    public Format detect(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Format.RFC3164;
        }
        if (RFC5424_PREFIX.matcher(raw).matches()) {
            return Format.RFC5424;
        }
        return Format.RFC3164;
    }
}
