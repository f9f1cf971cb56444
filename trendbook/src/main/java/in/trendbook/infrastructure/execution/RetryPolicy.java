package in.trendbook.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for calls to the execution venue.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum attempt limit (first call included)
 * - Maximum backoff duration (cap)
 * - Retryable-failure predicate (invalid arguments are never retried)
 * - Pluggable sleeper so tests run without real delays
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(5))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .build();
 *
 * String orderId = policy.execute("placeOrder", () -> gateway.placeOrder(...), attempt -> {});
 * </pre>
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /**
     * Blocking wait between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * Notified after every failed attempt that will be retried.
     */
    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int failedAttempt, RuntimeException cause);
    }

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Predicate<RuntimeException> retryable;
    private final Sleeper sleeper;

    private RetryPolicy(Builder b) {
        this.initialDelay = b.initialDelay;
        this.maxDelay = b.maxDelay;
        this.multiplier = b.multiplier;
        this.maxAttempts = b.maxAttempts;
        this.retryable = b.retryable;
        this.sleeper = b.sleeper;
    }

    /**
     * Run {@code action}, retrying retryable failures until it succeeds or attempts run out.
     *
     * @throws RetryExhaustedException when every attempt failed, or the thread was interrupted while waiting
     * @throws RuntimeException        a non-retryable failure, rethrown as is
     */
    public <T> T execute(String operation, Supplier<T> action, RetryListener listener) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = delayAfter(attempt);
                log.warn("[{}] Attempt {}/{} failed: {} - retrying in {}ms",
                    operation, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                listener.onRetry(attempt, e);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(operation, attempt, ie);
                }
            }
        }
        throw new RetryExhaustedException(operation, maxAttempts, last);
    }

    /**
     * Backoff after the given failed attempt: initialDelay * multiplier^(attempt-1), capped at maxDelay.
     */
    public Duration delayAfter(int failedAttempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for order commands: few quick attempts so a decision cycle is not stalled.
     */
    public static RetryPolicy forOrders() {
        return builder()
            .initialDelay(Duration.ofMillis(200))
            .maxDelay(Duration.ofSeconds(2))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Default policy for startup account fetches.
     */
    public static RetryPolicy forBootstrap() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .maxAttempts(5)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private int maxAttempts = 3;
        private Predicate<RuntimeException> retryable = e -> !(e instanceof IllegalArgumentException);
        private Sleeper sleeper = d -> Thread.sleep(d.toMillis());

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

        public Builder retryOn(Predicate<RuntimeException> retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(this);
        }
    }
}
