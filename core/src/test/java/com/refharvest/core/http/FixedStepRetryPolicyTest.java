package com.refharvest.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FixedStepRetryPolicyTest {

    @Test
    void shouldRetry_on_any_non_2xx_or_minus1_and_respect_maxAttempts_3() {
        var p = new FixedStepRetryPolicy();

        assertEquals(3, p.maxAttempts(), "maxAttempts must be 3");

        int[] retryables = {-1, 301, 403, 404, 429, 500, 503};
        for (int sc : retryables) {
            assertTrue(p.shouldRetry(sc, 1), "should retry on first failure for " + sc);
            assertTrue(p.shouldRetry(sc, 2), "should retry on second failure for " + sc);
            assertFalse(p.shouldRetry(sc, 3), "must stop retrying at attempt=3 for " + sc);
        }

        int[] success = {200, 201, 204, 299};
        for (int sc : success) {
            assertFalse(p.shouldRetry(sc, 1), "must not retry on success " + sc);
        }
    }

    @Test
    void delay_grows_linearly_with_fixed_step() {
        var p = new FixedStepRetryPolicy(3, 1000);

        assertEquals(Duration.ofMillis(1000), p.nextDelay(1));
        assertEquals(Duration.ofMillis(2000), p.nextDelay(2));
        assertEquals(Duration.ofMillis(3000), p.nextDelay(3));
    }

    @Test
    void bounds_are_clamped() {
        var p = new FixedStepRetryPolicy(0, -5);
        assertEquals(1, p.maxAttempts());
        assertFalse(p.shouldRetry(500, 1));
        assertEquals(Duration.ZERO, p.nextDelay(1));
    }

    @Test
    void counting_policy_counts_only_granted_retries() {
        var c = new CountingRetryPolicy(new FixedStepRetryPolicy(3, 10));
        assertTrue(c.shouldRetry(503, 1));
        assertTrue(c.shouldRetry(503, 2));
        assertFalse(c.shouldRetry(503, 3));
        assertFalse(c.shouldRetry(200, 1));
        assertEquals(2, c.getRetryCount());
        assertEquals(java.util.List.of(503, 503, 503), c.failedStatuses());

        var stats = new com.refharvest.core.model.CrawlStats();
        c.flushTo(stats, 3);
        assertEquals(3, stats.snapshot().requestsTotal);
        assertEquals(2, stats.snapshot().retriesTotal);
    }
}
