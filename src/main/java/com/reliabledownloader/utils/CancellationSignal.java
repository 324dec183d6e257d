package com.reliabledownloader.utils;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag threaded through a download.
 * <p>
 * The engine observes it between buffer reads and before each network request, so a cancel
 * takes effect after at most one buffer's worth of I/O. Nothing is interrupted preemptively.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    public CancellationSignal() {
        this(true);
    }

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationSignal.none() cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Download cancelled");
        }
    }
}
