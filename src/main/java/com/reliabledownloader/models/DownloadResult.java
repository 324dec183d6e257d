package com.reliabledownloader.models;

// DownloadResult.java
public record DownloadResult(
        TransferOutcome outcome,
        String filePath,
        String errorMessage,
        long bytesDownloaded,
        int attempts
) {
    public boolean success() {
        return outcome == TransferOutcome.SUCCESS;
    }
}
