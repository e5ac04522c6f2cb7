package in.ledgerguard.infrastructure.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounded retry policy with exponential backoff.
 *
 * A policy instance tracks one operation's attempts. Use {@link #fresh()} to get an
 * independent instance with the same settings for each new operation.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = template.fresh();
 * while (policy.shouldRetry()) {
 *     try {
 *         write();
 *         policy.recordSuccess();
 *         break;
 *     } catch (Exception e) {
 *         policy.recordFailure();
 *         policy.pause();
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
    private Instant lastAttemptTime;
    private boolean exhausted = false;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while attempts remain
     */
    public synchronized boolean shouldRetry() {
        if (exhausted) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt and grow the backoff delay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();

        if (attemptCount > 1) {
            long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
            currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
        }

        if (attemptCount >= maxAttempts) {
            exhausted = true;
        }
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
        exhausted = false;
    }

    /**
     * Sleep for the current backoff delay when another attempt remains.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void pause() throws InterruptedException {
        if (shouldRetry()) {
            Thread.sleep(getNextDelay().toMillis());
        }
    }

    public synchronized boolean isExhausted() {
        return exhausted;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    /**
     * New policy with the same settings and no attempts recorded.
     */
    public RetryPolicy fresh() {
        return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default for ledger writes: 3 attempts starting at 200ms.
     */
    public static RetryPolicy forLedgerWrites() {
        return builder()
            .initialDelay(Duration.ofMillis(200))
            .maxDelay(Duration.ofSeconds(2))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Default for idempotent exchange reads: 3 attempts starting at 500ms.
     */
    public static RetryPolicy forExchangeReads() {
        return builder()
            .initialDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(5))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

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
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
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
