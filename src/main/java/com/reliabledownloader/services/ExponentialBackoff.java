package com.reliabledownloader.services;

import java.time.Duration;

// Exponential backoff: initial, 2x initial, 4x initial ... capped at max
public class ExponentialBackoff implements BackoffStrategy {

    private final Duration initialDelay;
    private final Duration maxDelay;

    public ExponentialBackoff(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    @Override
    public Duration delayBeforeRetry(int retry) {
        int shift = Math.min(Math.max(retry - 1, 0), 30);
        long millis;
        try {
            millis = Math.multiplyExact(initialDelay.toMillis(), 1L << shift);
        } catch (ArithmeticException e) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(millis);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
