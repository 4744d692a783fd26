package io.peermesh.network.transport.local;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Unbounded queue whose consumers wait on futures instead of threads.
 * After {@link #close} pending polls complete with {@code null}, or fail with the
 * supplied error.
 */
final class AsyncQueue<T> {

    private final Deque<T> items = new ArrayDeque<>();
    private final Deque<CompletableFuture<T>> waiters = new ArrayDeque<>();
    private boolean closed;
    private Throwable closeError;

    boolean offer(T item) {
        while (true) {
            CompletableFuture<T> waiter;
            synchronized (this) {
                if (closed) {
                    return false;
                }
                waiter = waiters.poll();
                if (waiter == null) {
                    items.add(item);
                    return true;
                }
            }
            // a waiter abandoned by its deadline is skipped
            if (waiter.complete(item)) {
                return true;
            }
        }
    }

    CompletableFuture<T> poll() {
        synchronized (this) {
            T item = items.poll();
            if (item != null) {
                return CompletableFuture.completedFuture(item);
            }
            if (closed) {
                return closeError == null
                    ? CompletableFuture.completedFuture(null)
                    : CompletableFuture.failedFuture(closeError);
            }
            CompletableFuture<T> waiter = new CompletableFuture<>();
            waiters.add(waiter);
            return waiter;
        }
    }

    /**
     * @param error   failure for pending and future polls, {@code null} for a clean end
     * @param discard drop queued items instead of letting consumers drain them
     */
    void close(Throwable error, boolean discard) {
        List<CompletableFuture<T>> pending;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            closeError = error;
            if (discard) {
                items.clear();
            }
            pending = new ArrayList<>(waiters);
            waiters.clear();
        }
        for (CompletableFuture<T> waiter : pending) {
            if (error == null) {
                waiter.complete(null);
            } else {
                waiter.completeExceptionally(error);
            }
        }
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
