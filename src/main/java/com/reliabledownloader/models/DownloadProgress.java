package com.reliabledownloader.models;

import java.time.Duration;
import java.time.Instant;

public record DownloadProgress(
        String downloadId,
        String url,
        String destinationPath,
        long totalSize,
        long bytesDownloaded,
        String status,
        int attempts,
        Instant startedAt,
        Instant lastUpdated,
        Instant completedAt,
        String errorMessage
) {
    public static final String QUEUED = "QUEUED";
    public static final String DOWNLOADING = "DOWNLOADING";
    public static final String CANCELLING = "CANCELLING";

    public DownloadProgress {
        if (status == null) status = QUEUED;
        if (startedAt == null) startedAt = Instant.now();
        if (lastUpdated == null) lastUpdated = startedAt;
    }

    public DownloadProgress(String downloadId, String url, String destinationPath) {
        this(downloadId, url, destinationPath, -1, 0, QUEUED, 0, Instant.now(), Instant.now(), null, null);
    }

    public boolean isFinished() {
        return completedAt != null;
    }

    public Double getProgressPercentage() {
        return totalSize > 0 ? (double) bytesDownloaded / totalSize * 100 : null;
    }

    public long getDownloadSpeed() {
        Duration elapsed = Duration.between(startedAt, lastUpdated);
        long seconds = elapsed.getSeconds();
        return seconds > 0 ? bytesDownloaded / seconds : 0;
    }
}
