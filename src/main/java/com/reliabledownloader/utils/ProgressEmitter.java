package com.reliabledownloader.utils;

import com.reliabledownloader.models.TransferProgress;
import lombok.extern.slf4j.Slf4j;

/**
 * Reports progress for one attempt to a caller-supplied listener, synchronously with the buffer loop.
 */
@Slf4j
public class ProgressEmitter {

    private final ProgressListener listener;
    private final long totalBytes;

    public ProgressEmitter(ProgressListener listener, long totalBytes) {
        this.listener = listener == null ? ProgressListener.NONE : listener;
        this.totalBytes = totalBytes;
    }

    public void emit(long bytesTransferred, String statusNote) {
        TransferProgress progress = TransferProgress.of(totalBytes, bytesTransferred, statusNote);
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            // a broken listener must not fail the transfer
            log.warn("Progress listener failed at {} bytes: {}", bytesTransferred, e.getMessage(), e);
        }
    }
}
