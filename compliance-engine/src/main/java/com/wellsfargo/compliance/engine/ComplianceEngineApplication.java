package com.wellsfargo.compliance.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Payment Compliance Engine Application.
 *
 * Main entry point for the compliance engine.
 *
 * This service:
 * - Normalizes field maps, JSON documents and pacs.008 XML into canonical records
 * - Ingests scheme rulebooks and keeps their rules in memory
 * - Evaluates records against the most trusted rule source of their scheme
 * - Queues records for asynchronous evaluation on a worker pool
 * - Optionally publishes completed results to Kafka
 */
@SpringBootApplication
public class ComplianceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceEngineApplication.class, args);
    }
}
