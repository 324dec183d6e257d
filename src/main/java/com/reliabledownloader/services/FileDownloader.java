package com.reliabledownloader.services;

import com.reliabledownloader.models.AttemptResult;
import com.reliabledownloader.models.DownloadResult;
import com.reliabledownloader.models.DownloaderProperties;
import com.reliabledownloader.models.ServerCapabilities;
import com.reliabledownloader.models.TransferPlan;
import com.reliabledownloader.models.TransferRequest;
import com.reliabledownloader.utils.CancellationSignal;
import com.reliabledownloader.utils.ProgressListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CancellationException;

/**
 * Downloads one remote file: probe, pick a strategy, transfer while hashing, verify, and retry whole
 * attempts on failure. Network and file errors never escape; they are reported in the {@link DownloadResult}.
 */
@Service
@Slf4j
public class FileDownloader {

    private final CapabilityProber prober;
    private final TransferEngine transferEngine;
    private final RetryOrchestrator retryOrchestrator;
    private final long chunkSize;

    public FileDownloader(CapabilityProber prober, TransferEngine transferEngine,
                          RetryOrchestrator retryOrchestrator, DownloaderProperties properties) {
        this.prober = prober;
        this.transferEngine = transferEngine;
        this.retryOrchestrator = retryOrchestrator;
        this.chunkSize = properties.chunkSize();
    }

    public DownloadResult download(String url, Path destination, ProgressListener onProgress,
                                   CancellationSignal signal) {
        TransferRequest request = new TransferRequest(url, destination);
        ProgressListener listener = onProgress == null ? ProgressListener.NONE : onProgress;
        CancellationSignal cancellation = signal == null ? CancellationSignal.none() : signal;

        log.info("Starting download: {} -> {}", url, destination);
        RetryOrchestrator.Completion completion = retryOrchestrator.execute(
                attempt -> runAttempt(request, listener, cancellation, attempt), cancellation);

        AttemptResult result = completion.result();
        DownloadResult downloadResult = new DownloadResult(
                result.outcome(),
                destination.toString(),
                result.message(),
                result.bytesTransferred(),
                completion.attempts());

        if (downloadResult.success()) {
            log.info("Download completed successfully: {} ({} bytes, {} attempt(s))", destination,
                    result.bytesTransferred(), completion.attempts());
        } else {
            log.error("Download of {} ended with {} after {} attempt(s): {}", url, result.outcome(),
                    completion.attempts(), result.message());
        }
        return downloadResult;
    }

    public DownloadResult download(String url, Path destination) {
        return download(url, destination, ProgressListener.NONE, CancellationSignal.none());
    }

    public boolean tryDownload(String url, Path destination, ProgressListener onProgress,
                               CancellationSignal signal) {
        return download(url, destination, onProgress, signal).success();
    }

    AttemptResult runAttempt(TransferRequest request, ProgressListener listener, CancellationSignal signal,
                             int attempt) {
        log.debug("Attempt {} for {}", attempt, request.url());
        if (signal.isCancelled()) {
            return AttemptResult.cancelled(0);
        }
        ServerCapabilities capabilities;
        try {
            capabilities = prober.probe(request.url(), signal);
        } catch (CancellationException e) {
            return AttemptResult.cancelled(0);
        } catch (IOException | RuntimeException e) {
            log.warn("Capability probe of {} failed: {}", request.url(), e.getMessage());
            return AttemptResult.transportFailure(0, e.getMessage());
        }

        if (!capabilities.isOk()) {
            log.error("{} for capability probe of {}", capabilities.httpStatus(), request.url());
            return AttemptResult.probeFailure(capabilities.httpStatus());
        }

        TransferStrategy strategy = TransferStrategy.select(capabilities);
        TransferPlan plan = strategy.plan(capabilities, chunkSize);
        log.info("Downloading {} with {} strategy ({} bytes declared, {} range(s))", request.url(), strategy,
                capabilities.hasKnownLength() ? capabilities.declaredContentLength() : "unknown",
                plan.rangeCount());
        return transferEngine.transfer(request, capabilities, plan, listener, signal);
    }
}
