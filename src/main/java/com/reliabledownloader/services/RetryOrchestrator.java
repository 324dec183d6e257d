package com.reliabledownloader.services;

import com.reliabledownloader.models.AttemptResult;
import com.reliabledownloader.utils.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.IntFunction;

/**
 * Runs whole attempts until one succeeds or the retry policy gives up. Nothing carries over between
 * attempts; each one starts from byte zero.
 */
@Component
@Slf4j
public class RetryOrchestrator {

    private static final long WAIT_SLICE_MILLIS = 100;

    private final RetryPolicy.Factory policyFactory;
    private final BackoffStrategy backoff;

    public RetryOrchestrator(RetryPolicy.Factory policyFactory, BackoffStrategy backoff) {
        this.policyFactory = policyFactory;
        this.backoff = backoff;
    }

    /**
     * @param attempt runs one attempt, given its 1-based number
     */
    public Completion execute(IntFunction<AttemptResult> attempt, CancellationSignal signal) {
        RetryPolicy policy = policyFactory.createPolicy();
        int attempts = 0;

        while (true) {
            attempts++;
            AttemptResult result = runGuarded(attempt, attempts);
            if (result.isSuccess()) {
                return new Completion(result, attempts);
            }

            if (!policy.shouldRetry(result, attempts)) {
                return new Completion(result, attempts);
            }

            Duration delay = backoff.delayBeforeRetry(attempts);
            log.warn("Attempt {} failed ({}: {}), retrying in {} ms", attempts, result.outcome(),
                    result.message(), delay.toMillis());
            if (!await(delay, signal)) {
                return new Completion(AttemptResult.cancelled(0), attempts);
            }
        }
    }

    private static AttemptResult runGuarded(IntFunction<AttemptResult> attempt, int number) {
        try {
            return attempt.apply(number);
        } catch (RuntimeException e) {
            log.warn("Attempt {} threw: {}", number, e.getMessage(), e);
            return AttemptResult.transportFailure(0, e.getMessage());
        }
    }

    /**
     * Sleeps in short slices so a cancel during backoff is noticed promptly.
     *
     * @return false if cancelled or interrupted while waiting
     */
    private static boolean await(Duration delay, CancellationSignal signal) {
        long deadline = System.nanoTime() + delay.toNanos();
        while (!signal.isCancelled()) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMillis <= 0) {
                return true;
            }
            try {
                Thread.sleep(Math.min(remainingMillis, WAIT_SLICE_MILLIS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    public record Completion(AttemptResult result, int attempts) {
    }
}
