package com.courier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Courier normalizer.
 *
 * Hosts the decoding engine that turns BSD syslog, RFC5424 syslog and the
 * CEF, LEEF, key=value and JSON payloads they carry into one canonical event
 * record. Callers obtain a {@link com.courier.normalization.DecodeOrchestrator}
 * bean and hand it raw message text.
 */
@SpringBootApplication
public class CourierApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourierApplication.class, args);
    }
}
