package com.reliabledownloader.models;

public enum TransferOutcome {
    SUCCESS,
    INTEGRITY_FAILURE,
    /** Network or I/O failure, including a non-OK capability probe. Eligible for retry. */
    TRANSPORT_FAILURE,
    CANCELLED
}
