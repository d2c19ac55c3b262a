package com.dcruver.ragindex.embedding;

import com.dcruver.ragindex.config.ConfigurationException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs at most {@code maxConcurrent} tasks at once. Further tasks wait in a FIFO
 * queue and are started, in submission order, as running tasks finish.
 */
public class AdmissionLimiter {

    private final int maxConcurrent;
    private final Executor executor;
    private final Deque<Pending<?>> waiting = new ArrayDeque<>();
    private int active;
    private boolean closed;

    public AdmissionLimiter(int maxConcurrent, Executor executor) {
        if (maxConcurrent < 1) {
            throw new ConfigurationException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.executor = executor;
    }

    /**
     * Submit a task. The returned future completes with the task's outcome once it
     * has been admitted and run.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        return submit(task, null);
    }

    /**
     * Submit a task that must finish within {@code timeout} of being admitted.
     * Time spent waiting in the queue does not count. When the timeout expires the
     * future fails with a {@link java.util.concurrent.TimeoutException}, but the
     * slot stays taken until the task itself returns.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task, Duration timeout) {
        Pending<T> pending = new Pending<>(task, timeout, new CompletableFuture<>());

        boolean startNow;
        synchronized (this) {
            if (closed) {
                pending.result().cancel(false);
                return pending.result();
            }
            if (active < maxConcurrent) {
                active++;
                startNow = true;
            } else {
                waiting.addLast(pending);
                startNow = false;
            }
        }

        if (startNow) {
            dispatch(pending);
        }
        return pending.result();
    }

    /**
     * Stop admitting work. Queued tasks are cancelled without running and later
     * submissions come back cancelled; tasks already running are left to finish.
     */
    public void close() {
        List<Pending<?>> dropped;
        synchronized (this) {
            closed = true;
            dropped = new ArrayList<>(waiting);
            waiting.clear();
        }
        for (Pending<?> pending : dropped) {
            pending.result().cancel(false);
        }
    }

    public synchronized int getActiveCount() {
        return active;
    }

    public synchronized int getQueuedCount() {
        return waiting.size();
    }

    private <T> void dispatch(Pending<T> pending) {
        CompletableFuture<T> result = pending.result();
        if (pending.timeout() != null) {
            result.orTimeout(pending.timeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        try {
            executor.execute(() -> {
                try {
                    result.complete(pending.task().call());
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                } finally {
                    release();
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
            release();
        }
    }

    private void release() {
        Pending<?> next;
        synchronized (this) {
            next = waiting.pollFirst();
            // The freed slot passes straight to the next waiter
            if (next == null) {
                active--;
            }
        }
        if (next != null) {
            dispatch(next);
        }
    }

    private record Pending<T>(Callable<T> task, Duration timeout, CompletableFuture<T> result) {}
}
