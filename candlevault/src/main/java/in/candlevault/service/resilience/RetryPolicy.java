package in.candlevault.service.resilience;

import in.candlevault.config.IngestionConfig;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.IngestionException;
import in.candlevault.domain.error.SourcesExhaustedException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry policy with exponential backoff and jitter for fetch tasks.
 *
 * Delay for attempt n (0-based) is {@code min(maxDelay, baseDelay * 2^n)},
 * multiplied by {@code 1 + u} with u uniform in [-jitter, +jitter].
 * A task gets at most {@code maxAttempts} attempts in total.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .baseDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofMinutes(5))
 *     .maxAttempts(5)
 *     .build();
 *
 * RetryDecision decision = policy.decide(attempt, failure);
 * if (decision.retry()) {
 *     scheduler.resubmitAfter(task, decision.delay());
 * }
 * </pre>
 */
public class RetryPolicy {

    /**
     * What to do after a failed attempt.
     *
     * @param nextAttempt 0-based index of the attempt to run next, when retrying
     */
    public record RetryDecision(boolean retry, FailureKind kind, Duration delay, int nextAttempt, String reason) {
    }

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final double jitter;
    private final DoubleSupplier random;

    private RetryPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts, double jitter, DoubleSupplier random) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.jitter = jitter;
        this.random = random;
    }

    public static RetryPolicy fromConfig(IngestionConfig config) {
        return builder()
            .baseDelay(config.getRetryBaseDelay())
            .maxDelay(config.getRetryMaxDelay())
            .maxAttempts(config.getRetryMaxAttempts())
            .jitter(config.getRetryJitter())
            .build();
    }

    /**
     * Backoff before jitter. Non-decreasing in {@code attempt}, capped at maxDelay.
     */
    public Duration baseDelayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (attempt >= 62) {
            return maxDelay;
        }
        long multiplier = 1L << attempt;
        long baseMillis = baseDelay.toMillis();
        if (baseMillis > maxDelay.toMillis() / multiplier) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMillis * multiplier, maxDelay.toMillis()));
    }

    /**
     * Jittered delay, within {@code baseDelayFor(attempt) * (1 ± jitter)}.
     */
    public Duration delayFor(int attempt) {
        long base = baseDelayFor(attempt).toMillis();
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.round(base * factor));
    }

    public FailureKind classify(Throwable failure) {
        if (failure instanceof IngestionException ingestion) {
            return ingestion.getKind();
        }
        return FailureKind.UNAVAILABLE;
    }

    /**
     * Whether another attempt may succeed, regardless of the attempt budget.
     */
    public boolean isRetryable(Throwable failure) {
        if (failure instanceof SourcesExhaustedException exhausted) {
            return exhausted.isRetryable();
        }
        return classify(failure).isTransient();
    }

    /**
     * Decide after attempt {@code attempt} (0-based) failed with {@code failure}.
     */
    public RetryDecision decide(int attempt, Throwable failure) {
        FailureKind kind = classify(failure);
        if (!isRetryable(failure)) {
            return new RetryDecision(false, kind, Duration.ZERO, attempt, "fatal " + kind);
        }
        if (attempt + 1 >= maxAttempts) {
            return new RetryDecision(false, kind, Duration.ZERO, attempt,
                "gave up after " + (attempt + 1) + " attempts (" + kind + ")");
        }
        return new RetryDecision(true, kind, delayFor(attempt), attempt + 1, "transient " + kind);
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public double getJitter() {
        return jitter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private int maxAttempts = 5;
        private double jitter = 0.1;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * Source of uniform values in [0, 1) used for jitter.
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public RetryPolicy build() {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("Base delay must be positive");
            }
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("Max delay must be >= base delay");
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("Max attempts must be >= 1");
            }
            if (jitter < 0 || jitter >= 1) {
                throw new IllegalArgumentException("Jitter must be in [0, 1)");
            }
            return new RetryPolicy(baseDelay, maxDelay, maxAttempts, jitter, random);
        }
    }
}
