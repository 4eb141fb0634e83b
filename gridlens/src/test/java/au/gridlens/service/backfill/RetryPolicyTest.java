package au.gridlens.service.backfill;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Attempt limit
 * - Reset and fresh trackers
 * - Builder validation
 */
class RetryPolicyTest {

    @Test
    void testInitialState() {
        RetryPolicy policy = RetryPolicy.forArchive();

        assertTrue(policy.shouldRetry(), "Should allow initial retry");
        assertEquals(0, policy.getAttemptCount(), "Initial attempt count should be 0");
        assertEquals(4, policy.getMaxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.getInitialDelay());
    }

    @Test
    void testExponentialBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(5))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();

        assertEquals(Duration.ofSeconds(1), policy.recordFailure(), "First backoff should be initial delay");
        assertEquals(Duration.ofSeconds(2), policy.recordFailure(), "Second backoff should be 2s");
        assertEquals(Duration.ofSeconds(4), policy.recordFailure(), "Third backoff should be 4s");
        assertEquals(3, policy.getAttemptCount());
    }

    @Test
    void testMaxDelayCap() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(15))
            .multiplier(3.0)
            .maxAttempts(5)
            .build();

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(15), policy.recordFailure(), "Backoff should be capped at max delay");
        assertEquals(Duration.ofSeconds(15), policy.recordFailure());
    }

    @Test
    void testAttemptLimit() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(1))
            .maxAttempts(3)
            .build();

        policy.recordFailure();
        policy.recordFailure();
        assertTrue(policy.shouldRetry());
        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "No retry after max attempts");
    }

    @Test
    void testFreshTrackerIsIndependent() {
        RetryPolicy policy = RetryPolicy.forArchive();
        policy.recordFailure();
        policy.recordFailure();

        RetryPolicy fresh = policy.fresh();
        assertEquals(0, fresh.getAttemptCount());
        assertEquals(Duration.ofSeconds(1), fresh.recordFailure());
        assertEquals(2, policy.getAttemptCount(), "Fresh tracker does not touch the original");
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxDelay(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .initialDelay(Duration.ofMinutes(5))
            .maxDelay(Duration.ofMinutes(1))
            .build());
    }
}
