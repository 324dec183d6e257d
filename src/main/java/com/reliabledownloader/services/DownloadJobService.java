package com.reliabledownloader.services;

import com.reliabledownloader.models.DownloadProgress;
import com.reliabledownloader.models.DownloadRequest;
import com.reliabledownloader.models.DownloadResult;
import com.reliabledownloader.models.DownloaderProperties;
import com.reliabledownloader.utils.CancellationSignal;
import com.reliabledownloader.utils.ProgressTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs downloads in the background, one executor thread per download, and keeps them cancellable by id.
 */
@Service
@Slf4j
public class DownloadJobService {

    private final FileDownloader fileDownloader;
    private final ProgressTracker progressTracker;
    private final AsyncTaskExecutor taskExecutor;
    private final Path downloadDir;

    private final Map<String, CancellationSignal> runningDownloads = new ConcurrentHashMap<>();

    public DownloadJobService(FileDownloader fileDownloader, ProgressTracker progressTracker,
                              AsyncTaskExecutor downloadTaskExecutor, DownloaderProperties properties) {
        this.fileDownloader = fileDownloader;
        this.progressTracker = progressTracker;
        this.taskExecutor = downloadTaskExecutor;
        this.downloadDir = Path.of(properties.downloadDir()).toAbsolutePath().normalize();
    }

    public Job start(DownloadRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (request.destinationPath() == null || request.destinationPath().isBlank()) {
            throw new IllegalArgumentException("destinationPath is required");
        }
        Path destination = resolveDestination(request.destinationPath());

        String downloadId = UUID.randomUUID().toString();
        CancellationSignal signal = new CancellationSignal();
        runningDownloads.put(downloadId, signal);
        progressTracker.initializeDownload(downloadId, request.url(), destination.toString());

        try {
            CompletableFuture<DownloadResult> result = CompletableFuture.supplyAsync(
                    () -> run(downloadId, request.url(), destination, signal), taskExecutor);
            return new Job(downloadId, result);
        } catch (TaskRejectedException e) {
            runningDownloads.remove(downloadId);
            progressTracker.failDownload(downloadId, "Download rejected: too many downloads in progress");
            log.warn("Download {} of {} rejected by executor: {}", downloadId, request.url(), e.getMessage());
            throw e;
        }
    }

    private DownloadResult run(String downloadId, String url, Path destination, CancellationSignal signal) {
        try {
            if (!signal.isCancelled()) {
                progressTracker.updateStatus(downloadId, DownloadProgress.DOWNLOADING);
            }
            DownloadResult result = fileDownloader.download(url, destination,
                    progress -> progressTracker.updateProgress(downloadId, progress), signal);
            progressTracker.completeDownload(downloadId, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Download {} failed for {}: {}", downloadId, url, e.getMessage(), e);
            progressTracker.failDownload(downloadId, e.getMessage());
            throw e;
        } finally {
            runningDownloads.remove(downloadId);
        }
    }

    /**
     * Requests cooperative cancellation. Returns false when the download is unknown or already finished.
     */
    public boolean cancel(String downloadId) {
        CancellationSignal signal = runningDownloads.get(downloadId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        progressTracker.updateStatus(downloadId, DownloadProgress.CANCELLING);
        log.info("Cancellation requested for download {}", downloadId);
        return true;
    }

    public DownloadProgress getProgress(String downloadId) {
        return progressTracker.getProgress(downloadId);
    }

    public Map<String, DownloadProgress> getAllProgress() {
        return progressTracker.getAllActiveDownloads();
    }

    Path resolveDestination(String destinationPath) {
        Path destination = downloadDir.resolve(destinationPath).normalize();
        if (!destination.startsWith(downloadDir) || destination.equals(downloadDir)) {
            throw new IllegalArgumentException("destinationPath must name a file inside " + downloadDir);
        }
        return destination;
    }

    public record Job(String downloadId, CompletableFuture<DownloadResult> result) {
    }
}
