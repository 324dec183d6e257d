package com.reliabledownloader.services;

import com.reliabledownloader.models.AttemptResult;

// one instance per download; policies may keep state between attempts
public interface RetryPolicy {

    boolean shouldRetry(AttemptResult result, int attempt);

    interface Factory {

        RetryPolicy createPolicy();
    }
}
