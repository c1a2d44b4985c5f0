package com.sparky.suppress.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

/**
 * Metrics counters for a suppression list run.
 *
 * Tracks:
 * - Number of rows read from the input file
 * - Number of entries the remote accepted (upserted or deleted)
 * - Number of rate limit pauses
 */
public class SuppressionMetrics {

    private final Counter recordsProcessed;
    private final Counter entriesTransacted;
    private final Counter rateLimitBackoffs;

    public SuppressionMetrics() {
        this(Metrics.globalRegistry);
    }

    public SuppressionMetrics(MeterRegistry registry) {
        this.recordsProcessed = Counter
            .builder("suppression_records_processed_total")
            .description("counter for how many input rows are processed")
            .register(registry);

        this.entriesTransacted = Counter
            .builder("suppression_entries_transacted_total")
            .description("counter for how many entries the remote list accepted")
            .register(registry);

        this.rateLimitBackoffs = Counter
            .builder("suppression_rate_limit_backoffs_total")
            .description("counter for how many times a request paused for rate limiting")
            .register(registry);
    }

    public void recordProcessed() {
        recordsProcessed.increment();
    }

    public void recordTransacted(int count) {
        entriesTransacted.increment(count);
    }

    public void recordRateLimitBackoff() {
        rateLimitBackoffs.increment();
    }

    public double rateLimitBackoffs() {
        return rateLimitBackoffs.count();
    }
}
