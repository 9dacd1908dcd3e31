package com.seshlog.ingest.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for the session ingest service
 */
@Data
@ConfigurationProperties(prefix = "seshlog.ingest")
public class IngestProperties {

    /**
     * Username applied by the REST layer when a submission names none.
     * Unset means every submission must name its user.
     */
    private String defaultUsername;

    /**
     * Upper bound for one ingestion unit of work. Exceeding it rolls the unit back.
     */
    private Duration transactionTimeout = Duration.ofSeconds(10);
}
