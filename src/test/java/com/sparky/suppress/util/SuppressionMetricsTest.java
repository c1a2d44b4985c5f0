package com.sparky.suppress.util;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SuppressionMetricsTest {

    @Test
    void testCounters_incrementOnTheGivenRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SuppressionMetrics metrics = new SuppressionMetrics(registry);

        metrics.recordProcessed();
        metrics.recordProcessed();
        metrics.recordTransacted(7);
        metrics.recordRateLimitBackoff();

        assertEquals(2.0, registry.get("suppression_records_processed_total").counter().count());
        assertEquals(7.0, registry.get("suppression_entries_transacted_total").counter().count());
        assertEquals(1.0, metrics.rateLimitBackoffs());
    }
}
