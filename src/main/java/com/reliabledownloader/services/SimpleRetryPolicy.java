package com.reliabledownloader.services;

import com.reliabledownloader.models.AttemptResult;
import com.reliabledownloader.models.TransferOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Retries transport and integrity failures up to a fixed count. Stops early when a failure is plainly
 * deterministic: the probe answers the same non-OK status twice in a row, or two consecutive complete
 * transfers hash to the same wrong digest.
 */
@Slf4j
public final class SimpleRetryPolicy implements RetryPolicy {

    private final int maxRetries;

    private int lastProbeStatus;
    private byte[] lastMismatchedHash;

    private SimpleRetryPolicy(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    @Override
    public boolean shouldRetry(AttemptResult result, int attempt) {
        TransferOutcome outcome = result.outcome();
        if (outcome == TransferOutcome.SUCCESS || outcome == TransferOutcome.CANCELLED) {
            return false;
        }
        if (attempt > maxRetries) {
            return false;
        }

        if (result.isProbeFailure()) {
            if (result.probeStatus() == lastProbeStatus) {
                log.info("Probe answered {} again, not retrying", lastProbeStatus);
                return false;
            }
            lastProbeStatus = result.probeStatus();
        } else {
            lastProbeStatus = 0;
        }

        if (outcome == TransferOutcome.INTEGRITY_FAILURE) {
            if (lastMismatchedHash != null && Arrays.equals(lastMismatchedHash, result.computedHash())) {
                log.info("Same content hash mismatch twice in a row, not retrying");
                return false;
            }
            lastMismatchedHash = result.computedHash();
        } else {
            lastMismatchedHash = null;
        }
        return true;
    }

    public static final class Factory implements RetryPolicy.Factory {

        private final int maxRetries;

        private Factory(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public static Factory create(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
            }
            return new Factory(maxRetries);
        }

        @Override
        public RetryPolicy createPolicy() {
            return new SimpleRetryPolicy(maxRetries);
        }
    }
}
