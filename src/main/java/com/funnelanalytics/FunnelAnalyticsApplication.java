package com.funnelanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Funnel Analytics Engine
 *
 * Reconstructs user sessions from tracked funnel events and reports on them.
 *
 * Architecture:
 * - Event ingestion (trackEvent) appends to the event store
 * - Session reconstruction per funnel and time window, batch-fetched once
 * - Step, funnel, cohort and segment analysis computed at query time
 * - Per-period metrics materialized by idempotent upsert
 * - Redis cache in front of materialized metric reads
 */
@SpringBootApplication
public class FunnelAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunnelAnalyticsApplication.class, args);
    }
}
