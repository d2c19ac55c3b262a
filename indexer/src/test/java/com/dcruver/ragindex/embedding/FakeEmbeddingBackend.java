package com.dcruver.ragindex.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic in-memory embedding backend for tests.
 *
 * Each vector encodes its text, so callers can check that a vector landed next
 * to the text it was computed from. Failure modes and latency are configurable.
 */
public class FakeEmbeddingBackend implements EmbeddingBackend {

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private int maxTextsPerCall = Integer.MAX_VALUE;
    private Set<String> poisonTexts = Set.of();
    private int maxLatencyMillis;
    private int fixedLatencyMillis;
    private boolean alwaysFail;

    public FakeEmbeddingBackend failingAbove(int maxTexts) {
        this.maxTextsPerCall = maxTexts;
        return this;
    }

    public FakeEmbeddingBackend failingOn(Set<String> texts) {
        this.poisonTexts = texts;
        return this;
    }

    public FakeEmbeddingBackend withRandomLatency(int maxMillis) {
        this.maxLatencyMillis = maxMillis;
        return this;
    }

    public FakeEmbeddingBackend withLatency(int millis) {
        this.fixedLatencyMillis = millis;
        return this;
    }

    public FakeEmbeddingBackend alwaysFailing() {
        this.alwaysFail = true;
        return this;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        calls.incrementAndGet();
        int running = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(running, Math::max);
        try {
            if (fixedLatencyMillis > 0) {
                sleep(fixedLatencyMillis);
            }
            if (maxLatencyMillis > 0) {
                sleep(ThreadLocalRandom.current().nextInt(maxLatencyMillis + 1));
            }
            if (alwaysFail) {
                throw new IllegalStateException("backend unavailable");
            }
            if (texts.size() > maxTextsPerCall) {
                throw new IllegalStateException("request too large: " + texts.size() + " texts");
            }
            for (String text : texts) {
                if (poisonTexts.contains(text)) {
                    throw new IllegalStateException("cannot embed: " + text);
                }
            }

            List<float[]> vectors = new ArrayList<>(texts.size());
            for (String text : texts) {
                vectors.add(vectorFor(text));
            }
            return vectors;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public static float[] vectorFor(String text) {
        return new float[] {text.hashCode(), text.length(), 1.0f};
    }

    public int getCalls() {
        return calls.get();
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }
}
