package com.creditintel.backend.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Cooperative cancellation flag checked by long-running training and audit loops. An operation can
 * {@link #commit} its result once; after that the token refuses cancellation, so a cancel either
 * lands before the commit or has no effect at all.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private boolean committed;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * @return {@code false} when the operation already committed and the cancel was refused
     */
    public synchronized boolean cancel() {
        if (committed) {
            return false;
        }
        cancelled.set(true);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Operation cancelled");
        }
    }

    /**
     * Runs {@code action} unless cancelled, with no cancel able to interleave.
     */
    public synchronized <T> T commit(Supplier<T> action) {
        throwIfCancelled();
        T result = action.get();
        committed = true;
        return result;
    }

    public synchronized boolean isCommitted() {
        return committed;
    }
}
