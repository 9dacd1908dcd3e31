package com.seshlog.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Session Logger Ingest Service - persists surf session observations.
 *
 * Responsibilities:
 * - Accept session observations via REST
 * - Validate the observation (required fields, cardinal lengths, finite readings)
 * - Resolve the spot name and username against reference data
 * - Persist temperature, swell, tide, wind and the linking session row atomically
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class IngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestApplication.class, args);
    }
}
