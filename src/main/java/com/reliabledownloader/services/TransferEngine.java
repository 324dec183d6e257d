package com.reliabledownloader.services;

import com.reliabledownloader.client.RemoteContentClient;
import com.reliabledownloader.models.AttemptResult;
import com.reliabledownloader.models.ByteRange;
import com.reliabledownloader.models.DownloaderProperties;
import com.reliabledownloader.models.ServerCapabilities;
import com.reliabledownloader.models.TransferOutcome;
import com.reliabledownloader.models.TransferPlan;
import com.reliabledownloader.models.TransferRequest;
import com.reliabledownloader.utils.CancellationSignal;
import com.reliabledownloader.utils.DestinationFiles;
import com.reliabledownloader.utils.ProgressEmitter;
import com.reliabledownloader.utils.ProgressListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.util.concurrent.CancellationException;

/**
 * Streams a {@link TransferPlan} into the destination file. Chunked and full-stream transfers share
 * this one loop; they differ only in the ranges the plan yields and whether they are requested ranged.
 * <p>
 * Every buffer is written, hashed, counted and reported, in that order. Cancellation is checked
 * before each range request and after each buffer read.
 */
@Component
@Slf4j
public class TransferEngine {

    private final RemoteContentClient client;
    private final IntegrityVerifier integrityVerifier;
    private final int bufferSize;
    private final boolean keepPartialOnCancel;

    public TransferEngine(RemoteContentClient client, IntegrityVerifier integrityVerifier,
                          DownloaderProperties properties) {
        this.client = client;
        this.integrityVerifier = integrityVerifier;
        this.bufferSize = properties.bufferSize();
        this.keepPartialOnCancel = properties.keepPartialOnCancel();
    }

    public AttemptResult transfer(TransferRequest request, ServerCapabilities capabilities, TransferPlan plan,
                                  ProgressListener listener, CancellationSignal signal) {
        Path destination = request.destination();
        MessageDigest digest = IntegrityVerifier.newDigest();
        ProgressEmitter emitter = new ProgressEmitter(listener, capabilities.declaredContentLength());
        long transferred = 0;
        boolean cancelled = false;

        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (OutputStream out = Files.newOutputStream(destination, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                byte[] buffer = new byte[bufferSize];
                long rangeCount = plan.rangeCount();
                long rangeIndex = 0;

                for (ByteRange range : plan) {
                    if (signal.isCancelled()) {
                        cancelled = true;
                        break;
                    }
                    rangeIndex++;
                    String note = plan.ranged() ? "range " + rangeIndex + "/" + rangeCount : null;
                    long received = 0;

                    try (InputStream body = open(request.url(), plan, range, signal)) {
                        int read;
                        while ((read = body.read(buffer)) > 0) {
                            if (signal.isCancelled()) {
                                cancelled = true;
                                break;
                            }
                            out.write(buffer, 0, read);
                            digest.update(buffer, 0, read);
                            received += read;
                            transferred += read;
                            emitter.emit(transferred, note);
                        }
                    }
                    if (cancelled) {
                        break;
                    }

                    long expected = plan.expectedLength(range);
                    if (expected >= 0 && received != expected) {
                        throw new IOException("Incomplete transfer of " + range + ". Expected: " + expected
                                + ", Actual: " + received);
                    }
                    log.debug("{} of {} downloaded: {} bytes", range, request.url(), received);
                }
            }
        } catch (CancellationException e) {
            cancelled = true;
        } catch (IOException | RuntimeException e) {
            log.warn("Transfer of {} failed after {} bytes: {}", request.url(), transferred, e.getMessage(), e);
            DestinationFiles.deleteQuietly(destination);
            return AttemptResult.transportFailure(transferred, e.getMessage());
        }

        if (cancelled) {
            return onCancelled(destination, transferred);
        }

        byte[] hash = digest.digest();
        TransferOutcome outcome = integrityVerifier.verify(hash, capabilities, destination);
        if (outcome == TransferOutcome.INTEGRITY_FAILURE) {
            return AttemptResult.integrityFailure(transferred, hash);
        }
        return AttemptResult.success(transferred, hash);
    }

    private InputStream open(String url, TransferPlan plan, ByteRange range, CancellationSignal signal)
            throws IOException {
        if (plan.ranged()) {
            return client.fetchRange(url, range.start(), range.end(), signal);
        }
        return client.fetchAll(url, signal);
    }

    private AttemptResult onCancelled(Path destination, long transferred) {
        if (keepPartialOnCancel) {
            log.info("Download to {} cancelled after {} bytes, partial file kept", destination, transferred);
        } else {
            DestinationFiles.deleteQuietly(destination);
            log.info("Download to {} cancelled after {} bytes, partial file removed", destination, transferred);
        }
        return AttemptResult.cancelled(transferred);
    }
}
