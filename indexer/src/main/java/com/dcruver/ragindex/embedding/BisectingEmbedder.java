package com.dcruver.ragindex.embedding;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Calls the backend and, on failure, splits the input in half and retries each
 * half independently until the depth budget runs out. A single bad input in a
 * batch is isolated without discarding the rest of the batch.
 */
@Slf4j
public class BisectingEmbedder {

    public static final int DEFAULT_MAX_DEPTH = 3;

    private final EmbeddingBackend backend;
    private final int maxDepth;

    public BisectingEmbedder(EmbeddingBackend backend, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative, got " + maxDepth);
        }
        this.backend = backend;
        this.maxDepth = maxDepth;
    }

    public List<float[]> embed(List<String> texts) {
        return embedWithRetry(texts, maxDepth);
    }

    /**
     * Embed {@code texts}, splitting at the midpoint on failure while {@code depth} > 0.
     * Each split consumes one level of the budget.
     */
    List<float[]> embedWithRetry(List<String> texts, int depth) {
        try {
            return checkResult(texts, backend.embed(texts));
        } catch (RuntimeException e) {
            if (depth == 0 || texts.size() <= 1) {
                throw e instanceof EmbeddingException
                    ? e
                    : new EmbeddingException("Embedding failed for " + texts.size() + " texts: " + e.getMessage(), e);
            }

            int mid = texts.size() / 2;
            log.warn("Embedding call for {} texts failed ({}), retrying as {} + {}",
                texts.size(), e.getMessage(), mid, texts.size() - mid);

            List<float[]> left = embedWithRetry(texts.subList(0, mid), depth - 1);
            List<float[]> right = embedWithRetry(texts.subList(mid, texts.size()), depth - 1);

            List<float[]> combined = new ArrayList<>(texts.size());
            combined.addAll(left);
            combined.addAll(right);
            return combined;
        }
    }

    private static List<float[]> checkResult(List<String> texts, List<float[]> vectors) {
        if (vectors == null || vectors.size() != texts.size()) {
            throw new EmbeddingException(String.format("Backend returned %d vectors for %d texts",
                vectors == null ? 0 : vectors.size(), texts.size()));
        }
        int dimensions = -1;
        for (float[] vector : vectors) {
            if (vector == null) {
                throw new EmbeddingException("Backend returned a null vector");
            }
            if (dimensions >= 0 && vector.length != dimensions) {
                throw new EmbeddingException(String.format(
                    "Backend returned vectors of %d and %d dimensions in one call", dimensions, vector.length));
            }
            dimensions = vector.length;
        }
        return vectors;
    }
}
