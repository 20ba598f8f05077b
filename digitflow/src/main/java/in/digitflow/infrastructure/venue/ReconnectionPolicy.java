package in.digitflow.infrastructure.venue;

import java.time.Duration;
import java.time.Instant;

/**
 * Reconnection policy with linearly increasing backoff.
 *
 * The n-th consecutive failure waits {@code n × baseDelay} (capped at maxDelay).
 * After maxAttempts failures the policy gives up until {@link #recordSuccess()} or {@link #reset()}.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.forTickStream();
 *
 * // on close / failed connect:
 * if (policy.shouldRetry()) {
 *     policy.recordFailure();
 *     schedule(this::connect, policy.getNextDelay());
 * } else {
 *     markUnavailable();
 * }
 * // on open:
 * policy.recordSuccess();
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Instant lastAttemptTime;
    private boolean exhausted = false;

    private ReconnectionPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Check if another retry attempt should be made.
     *
     * @return true if retry should be attempted, false once max attempts are used up
     */
    public synchronized boolean shouldRetry() {
        if (exhausted) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * Delay before the next attempt: attempt count × base delay, at least one base delay.
     */
    public synchronized Duration getNextDelay() {
        long multiple = Math.max(1, attemptCount);
        long millis = baseDelay.toMillis() * multiple;
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    /**
     * Record a failed connection attempt.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();
        if (attemptCount >= maxAttempts) {
            exhausted = true;
        }
    }

    /**
     * Record a successful connection. Resets all counters.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        lastAttemptTime = null;
        exhausted = false;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    /**
     * @return true once max attempts have failed
     */
    public synchronized boolean isExhausted() {
        return exhausted;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tick feed: 5s, 10s, 15s ... up to 10 attempts.
     */
    public static ReconnectionPolicy forTickStream() {
        return builder()
            .baseDelay(Duration.ofSeconds(5))
            .maxDelay(Duration.ofSeconds(50))
            .maxAttempts(10)
            .build();
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofMinutes(5);
        private int maxAttempts = 10;

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("Base delay must be positive");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Base delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(baseDelay, maxDelay, maxAttempts);
        }
    }
}
