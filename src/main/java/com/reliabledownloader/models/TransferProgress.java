package com.reliabledownloader.models;

// TransferProgress.java
public record TransferProgress(
        Long totalBytes,
        long bytesTransferred,
        Double percentComplete,
        String statusNote
) {
    public static TransferProgress of(long totalBytes, long bytesTransferred, String statusNote) {
        if (totalBytes < 0) {
            return new TransferProgress(null, bytesTransferred, null, statusNote);
        }
        Double percent = totalBytes > 0 ? (double) bytesTransferred / totalBytes : null;
        return new TransferProgress(totalBytes, bytesTransferred, percent, statusNote);
    }
}
