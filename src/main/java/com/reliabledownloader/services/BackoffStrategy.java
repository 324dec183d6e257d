package com.reliabledownloader.services;

import java.time.Duration;

@FunctionalInterface
public interface BackoffStrategy {

    BackoffStrategy NONE = retry -> Duration.ZERO;

    // retry is 1 for the first retry
    Duration delayBeforeRetry(int retry);
}
