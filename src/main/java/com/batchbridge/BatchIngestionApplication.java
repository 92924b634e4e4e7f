package com.batchbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Batch File Ingestion and Webhook Delivery Pipeline
 *
 * Turns flat files dropped by legacy batch processors into deduplicated
 * domain records and reliably delivered webhook callbacks.
 *
 * Architecture:
 * - Intake watcher: checksum dedup, content-addressed object storage, Kafka announcement
 * - Ingestion worker: manual-ack Kafka consumer, per-type parsers, conditional upserts
 * - Delivery dispatcher: persisted retry state machine with exponential backoff
 *
 * Every stage treats its input as replayable and its output as idempotent.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableTransactionManagement
@EnableScheduling
public class BatchIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchIngestionApplication.class, args);
    }
}
