package com.pulseanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Pulse Analytics Service
 * 
 * Multi-tenant event analytics backend.
 * 
 * Architecture:
 * - REST API to track single events and batches, authenticated per tenant by API key
 * - PostgreSQL as the durable, append-only event store (source of truth)
 * - OpenSearch as the per-tenant-per-day aggregation index (best-effort mirror)
 * - Server-Sent Events stream pushing new events to live dashboards
 * - Redis caching for dashboard aggregations
 * 
 * Consistency:
 * - Durable-store-strong, index-eventually-consistent: a successful track call
 *   is always stored, but may briefly be missing from aggregations
 * - Single process: realtime streams only see events ingested on this node
 */
@SpringBootApplication
@EnableScheduling
public class PulseAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PulseAnalyticsApplication.class, args);
    }
}
