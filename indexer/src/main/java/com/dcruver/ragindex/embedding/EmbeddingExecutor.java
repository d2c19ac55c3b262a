package com.dcruver.ragindex.embedding;

import com.dcruver.ragindex.config.ConfigurationException;
import com.dcruver.ragindex.domain.Batch;
import com.dcruver.ragindex.domain.IndexedUnit;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Submits batches to an embedding backend with bounded concurrency.
 *
 * Results are collected in completion order and sorted by batch sequence number
 * before merging, so the output follows input unit order whatever the timing of
 * the calls. The first batch that fails after retries aborts the whole call and
 * discards every partial result; batches still waiting for a slot are never sent.
 * Each batch must finish within the timeout, counted from the moment it is admitted.
 */
@Slf4j
public class EmbeddingExecutor {

    private final int maxConcurrent;
    private final int retryDepth;
    private final Duration batchTimeout;

    public EmbeddingExecutor(int maxConcurrent, int retryDepth, Duration batchTimeout) {
        if (maxConcurrent < 1) {
            throw new ConfigurationException("Max concurrent embeddings must be at least 1, got " + maxConcurrent);
        }
        if (retryDepth < 0) {
            throw new ConfigurationException("Retry depth must be non-negative, got " + retryDepth);
        }
        if (batchTimeout == null || batchTimeout.isNegative() || batchTimeout.isZero()) {
            throw new ConfigurationException("Batch timeout must be positive, got " + batchTimeout);
        }
        this.maxConcurrent = maxConcurrent;
        this.retryDepth = retryDepth;
        this.batchTimeout = batchTimeout;
    }

    public List<IndexedUnit> execute(List<Batch> batches, EmbeddingBackend backend) {
        if (batches.isEmpty()) {
            return List.of();
        }

        ExecutorService pool = Executors.newFixedThreadPool(maxConcurrent, new EmbeddingThreadFactory());
        try {
            return run(batches, backend, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<IndexedUnit> run(List<Batch> batches, EmbeddingBackend backend, ExecutorService pool) {
        AdmissionLimiter limiter = new AdmissionLimiter(maxConcurrent, pool);
        BisectingEmbedder embedder = new BisectingEmbedder(backend, retryDepth);
        Queue<BatchResult> completed = new ConcurrentLinkedQueue<>();
        AtomicInteger completedCount = new AtomicInteger();
        int total = batches.size();

        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        List<CompletableFuture<BatchResult>> futures = new ArrayList<>(total);

        for (Batch batch : batches) {
            // The timeout clock starts when the batch gets a slot, not when it is queued
            CompletableFuture<BatchResult> future = limiter.submit(() -> embedBatch(embedder, batch, total), batchTimeout);

            // Track the callback stage so results are recorded before allOf completes
            CompletableFuture<BatchResult> tracked = future.whenComplete((result, error) -> {
                if (error != null) {
                    // Queued batches would only be thrown away
                    limiter.close();
                    firstFailure.completeExceptionally(error);
                } else {
                    completed.add(result);
                    log.info("Completed batch {}/{} ({} of {} done)",
                        batch.getSequenceNumber(), total, completedCount.incrementAndGet(), total);
                }
            });
            futures.add(tracked);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            CompletableFuture.anyOf(all, firstFailure).join();
        } catch (CompletionException e) {
            throw asEmbeddingException(e.getCause(), completedCount.get(), total);
        }

        List<BatchResult> ordered = new ArrayList<>(completed);
        ordered.sort(Comparator.comparingInt(r -> r.batch().getSequenceNumber()));
        return merge(ordered);
    }

    private BatchResult embedBatch(BisectingEmbedder embedder, Batch batch, int total) {
        log.info("Starting batch {}/{} ({} texts, ~{} tokens)",
            batch.getSequenceNumber(), total, batch.size(), batch.getEstimatedTokens());
        long started = System.nanoTime();

        List<float[]> vectors = embedder.embed(batch.getTexts());

        log.debug("Batch {} embedded in {}ms", batch.getSequenceNumber(),
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return new BatchResult(batch, vectors);
    }

    private static List<IndexedUnit> merge(List<BatchResult> ordered) {
        List<IndexedUnit> indexed = new ArrayList<>();
        int dimensions = -1;

        for (BatchResult result : ordered) {
            Batch batch = result.batch();
            for (int i = 0; i < batch.size(); i++) {
                float[] vector = result.vectors().get(i);
                if (dimensions < 0) {
                    dimensions = vector.length;
                } else if (vector.length != dimensions) {
                    throw new EmbeddingException(String.format(
                        "Inconsistent embedding dimensions in batch %d: expected %d, got %d",
                        batch.getSequenceNumber(), dimensions, vector.length));
                }
                indexed.add(IndexedUnit.of(batch.getUnits().get(i), vector));
            }
        }
        return indexed;
    }

    private static EmbeddingException asEmbeddingException(Throwable cause, int completed, int total) {
        log.error("Embedding aborted after {}/{} batches completed", completed, total);
        if (cause instanceof EmbeddingException) {
            return (EmbeddingException) cause;
        }
        if (cause instanceof TimeoutException) {
            return new EmbeddingException("Embedding batch timed out", cause);
        }
        return new EmbeddingException("Embedding failed: " + cause.getMessage(), cause);
    }

    private record BatchResult(Batch batch, List<float[]> vectors) {}

    private static final class EmbeddingThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "embedding-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
