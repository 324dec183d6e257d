package com.reliabledownloader.utils;

import com.reliabledownloader.models.DownloadProgress;
import com.reliabledownloader.models.DownloadResult;
import com.reliabledownloader.models.TransferProgress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// ProgressTracker.java
@Component
@Slf4j
@EnableScheduling
public class ProgressTracker {

    static final Duration RETENTION = Duration.ofHours(24);

    private final Map<String, DownloadProgress> activeDownloads = new ConcurrentHashMap<>();

    public void initializeDownload(String downloadId, String url, String destinationPath) {
        activeDownloads.put(downloadId, new DownloadProgress(downloadId, url, destinationPath));
        log.info("Initialized download tracking: {} ({} -> {})", downloadId, url, destinationPath);
    }

    public void updateProgress(String downloadId, TransferProgress transfer) {
        activeDownloads.computeIfPresent(downloadId, (id, progress) -> new DownloadProgress(
                progress.downloadId(),
                progress.url(),
                progress.destinationPath(),
                transfer.totalBytes() == null ? -1 : transfer.totalBytes(),
                transfer.bytesTransferred(),
                DownloadProgress.CANCELLING.equals(progress.status()) ? progress.status() : DownloadProgress.DOWNLOADING,
                progress.attempts(),
                progress.startedAt(),
                Instant.now(),
                progress.completedAt(),
                progress.errorMessage()
        ));
    }

    public void updateStatus(String downloadId, String status) {
        // a finished download keeps its final status
        activeDownloads.computeIfPresent(downloadId, (id, progress) -> progress.isFinished() ? progress : new DownloadProgress(
                progress.downloadId(),
                progress.url(),
                progress.destinationPath(),
                progress.totalSize(),
                progress.bytesDownloaded(),
                status,
                progress.attempts(),
                progress.startedAt(),
                Instant.now(),
                progress.completedAt(),
                progress.errorMessage()
        ));
    }

    public void completeDownload(String downloadId, DownloadResult result) {
        activeDownloads.computeIfPresent(downloadId, (id, progress) -> new DownloadProgress(
                progress.downloadId(),
                progress.url(),
                progress.destinationPath(),
                progress.totalSize(),
                result.success() ? result.bytesDownloaded() : progress.bytesDownloaded(),
                result.outcome().name(),
                result.attempts(),
                progress.startedAt(),
                progress.lastUpdated(),
                Instant.now(),
                result.errorMessage()
        ));
    }

    public void failDownload(String downloadId, String errorMessage) {
        activeDownloads.computeIfPresent(downloadId, (id, progress) -> new DownloadProgress(
                progress.downloadId(),
                progress.url(),
                progress.destinationPath(),
                progress.totalSize(),
                progress.bytesDownloaded(),
                "FAILED",
                progress.attempts(),
                progress.startedAt(),
                progress.lastUpdated(),
                Instant.now(),
                errorMessage
        ));
    }

    public DownloadProgress getProgress(String downloadId) {
        return activeDownloads.get(downloadId);
    }

    public Map<String, DownloadProgress> getAllActiveDownloads() {
        return new HashMap<>(activeDownloads);
    }

    @Scheduled(fixedRate = 300000) // Clean up every 5 minutes
    public void cleanupCompletedDownloads() {
        evictCompletedBefore(Instant.now().minus(RETENTION));
    }

    int evictCompletedBefore(Instant cutoff) {
        int before = activeDownloads.size();
        activeDownloads.entrySet().removeIf(entry -> {
            DownloadProgress progress = entry.getValue();
            return progress.completedAt() != null && progress.completedAt().isBefore(cutoff);
        });
        int evicted = before - activeDownloads.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished downloads", evicted);
        }
        return evicted;
    }
}
