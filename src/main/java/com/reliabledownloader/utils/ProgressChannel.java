package com.reliabledownloader.utils;

import com.reliabledownloader.models.TransferProgress;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pull-based view of download progress. Hand it to the downloader as a {@link ProgressListener}
 * and consume the values from another thread, or drain them after the download returns.
 */
public class ProgressChannel implements ProgressListener {

    private final BlockingQueue<TransferProgress> queue;

    public ProgressChannel() {
        this.queue = new LinkedBlockingQueue<>();
    }

    public ProgressChannel(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Blocks the transfer while a bounded channel is full.
     */
    @Override
    public void onProgress(TransferProgress progress) {
        try {
            queue.put(progress);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing progress", e);
        }
    }

    public TransferProgress poll() {
        return queue.poll();
    }

    public TransferProgress poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public TransferProgress take() throws InterruptedException {
        return queue.take();
    }

    public List<TransferProgress> drain() {
        List<TransferProgress> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
