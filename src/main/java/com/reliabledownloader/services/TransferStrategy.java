package com.reliabledownloader.services;

import com.reliabledownloader.models.ServerCapabilities;
import com.reliabledownloader.models.TransferPlan;

public enum TransferStrategy {
    /** Sequential range requests of a fixed chunk size. */
    CHUNKED,
    /** One unranged request for the whole body. */
    FULL_STREAM;

    /**
     * Ranges are only usable when the length is known, since it bounds the range loop.
     */
    public static TransferStrategy select(ServerCapabilities capabilities) {
        if (capabilities.supportsRangeRequests()
                && capabilities.hasKnownLength()
                && capabilities.declaredContentLength() > 0) {
            return CHUNKED;
        }
        return FULL_STREAM;
    }

    public TransferPlan plan(ServerCapabilities capabilities, long chunkSize) {
        if (this == CHUNKED) {
            return TransferPlan.chunked(capabilities.declaredContentLength(), chunkSize);
        }
        return TransferPlan.fullStream(capabilities.declaredContentLength());
    }
}
