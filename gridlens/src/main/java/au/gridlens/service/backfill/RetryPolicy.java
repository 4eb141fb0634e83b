package au.gridlens.service.backfill;

import java.time.Duration;

/**
 * Retry policy with exponential backoff for archive fetches.
 *
 * One instance tracks the attempts of one (source, day) unit; {@link #fresh()} hands out a
 * new tracker with the same settings.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = template.fresh();
 * while (true) {
 *     try {
 *         return fetch();
 *     } catch (TransientFailure e) {
 *         Duration backoff = policy.recordFailure();
 *         if (!policy.shouldRetry()) throw e;
 *         sleeper.sleep(backoff);
 *     }
 * }
 * </pre>
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while fewer than maxAttempts attempts have failed
     */
    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Record a failed attempt.
     *
     * @return backoff to wait before the next attempt
     */
    public synchronized Duration recordFailure() {
        attemptCount++;
        Duration backoff = currentDelay;
        long nextMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(nextMillis, maxDelay.toMillis()));
        return backoff;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    /**
     * New tracker with the same settings and no recorded attempts.
     */
    public RetryPolicy fresh() {
        return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Archive defaults: 1s, 2s, 4s between four attempts, capped at one minute.
     */
    public static RetryPolicy forArchive() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(1))
            .multiplier(2.0)
            .maxAttempts(4)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private int maxAttempts = 4;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
