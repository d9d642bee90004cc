package in.shopwire.client;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * Reconnection policy with exponential backoff for the realtime client.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum backoff duration (cap)
 * - Optional jitter of up to {@code jitterRatio} of the base delay, added on top
 * - Circuit breaker after max consecutive failures
 * - Reset after successful connection
 *
 * The jitter ratio may not exceed {@code multiplier - 1}, so successive delays
 * never decrease.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(1.5)
 *     .jitterRatio(0.2)
 *     .maxAttempts(5)
 *     .build();
 *
 * if (policy.shouldRetry()) {
 *     Duration delay = policy.getNextDelay();
 *     policy.recordFailure();
 *     scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitterRatio;
    private final int maxAttempts;
    private final Random random;

    private int attemptCount = 0;
    private Duration baseDelay;
    private Duration currentDelay;
    private Instant lastAttemptTime;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
                               double jitterRatio, int maxAttempts, Random random) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.jitterRatio = jitterRatio;
        this.maxAttempts = maxAttempts;
        this.random = random;
        this.baseDelay = initialDelay;
        this.currentDelay = withJitter(initialDelay);
    }

    /**
     * Check if another retry attempt should be made.
     *
     * @return true if retry should be attempted, false if circuit is open
     */
    public synchronized boolean shouldRetry() {
        if (circuitOpen) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * Get the delay before the next retry attempt.
     *
     * @return Duration to wait before next attempt
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed connection attempt.
     * Increments attempt count and calculates next backoff delay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();

        long newBaseMillis = (long) (baseDelay.toMillis() * multiplier);
        baseDelay = Duration.ofMillis(Math.min(newBaseMillis, maxDelay.toMillis()));
        currentDelay = withJitter(baseDelay);

        if (attemptCount >= maxAttempts) {
            circuitOpen = true;
        }
    }

    /**
     * Record a successful connection.
     * Resets all counters and closes circuit breaker.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        baseDelay = initialDelay;
        currentDelay = withJitter(initialDelay);
        lastAttemptTime = null;
        circuitOpen = false;
    }

    /**
     * Reset the policy to initial state.
     */
    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * @return Number of failed attempts since last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /**
     * @return Instant of last failed attempt, or null if none since the last success
     */
    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    private Duration withJitter(Duration base) {
        if (jitterRatio == 0.0) {
            return base;
        }
        long jitter = (long) (base.toMillis() * jitterRatio * random.nextDouble());
        return Duration.ofMillis(Math.min(base.toMillis() + jitter, maxDelay.toMillis()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for realtime clients: 1s growing 1.5x per failure up to 30s,
     * 20% jitter, 5 attempts before going offline.
     */
    public static ReconnectionPolicy forRealtimeClient() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(1.5)
            .jitterRatio(0.2)
            .maxAttempts(5)
            .build();
    }

    /**
     * Builder for ReconnectionPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private double jitterRatio = 0.0;
        private int maxAttempts = 5;
        private Random random = new Random();

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

        public Builder jitterRatio(double jitterRatio) {
            if (jitterRatio < 0.0 || jitterRatio > 1.0) {
                throw new IllegalArgumentException("Jitter ratio must be between 0 and 1");
            }
            this.jitterRatio = jitterRatio;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Source of jitter; pass a seeded Random for reproducible delays.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            if (jitterRatio > multiplier - 1.0) {
                throw new IllegalArgumentException("Jitter ratio cannot exceed multiplier - 1");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, jitterRatio, maxAttempts, random);
        }
    }
}
