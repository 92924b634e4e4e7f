package com.batchbridge.domain.service.delivery;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with one-sided jitter.
 *
 * <p>Delay for attempt {@code n}: {@code initialDelay * multiplier^(n-1) * (1 + jitter * r)}
 * with {@code r} in [0, 1), capped at {@code maxDelay}. Requiring
 * {@code multiplier > 1 + jitter} makes successive delays strictly increasing
 * until the cap is reached.
 */
public final class ExponentialBackoffPolicy {

    private final long initialDelayMs;
    private final double multiplier;
    private final double jitter;
    private final long maxDelayMs;
    private final DoubleSupplier random;

    public ExponentialBackoffPolicy(Duration initialDelay, double multiplier, double jitter, Duration maxDelay) {
        this(initialDelay, multiplier, jitter, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoffPolicy(Duration initialDelay, double multiplier, double jitter, Duration maxDelay,
                             DoubleSupplier random) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be > 0, got: " + initialDelay);
        }
        if (jitter < 0) {
            throw new IllegalArgumentException("jitter must be >= 0, got: " + jitter);
        }
        if (multiplier <= 1.0 + jitter) {
            throw new IllegalArgumentException(
                    "multiplier must exceed 1 + jitter, got multiplier=" + multiplier + " jitter=" + jitter);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        this.initialDelayMs = initialDelay.toMillis();
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.maxDelayMs = maxDelay.toMillis();
        this.random = random;
    }

    /**
     * @param attempt number of failed attempts so far (1-based)
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        double base = initialDelayMs * Math.pow(multiplier, attempt - 1);
        if (base >= maxDelayMs || Double.isInfinite(base)) {
            return Duration.ofMillis(maxDelayMs);
        }
        double withJitter = base * (1.0 + jitter * random.getAsDouble());
        return Duration.ofMillis(Math.min(maxDelayMs, (long) withJitter));
    }

    public Duration maxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }
}
