package com.dcruver.ragindex.embedding;

import com.dcruver.ragindex.config.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionLimiterTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void testExtraTasksWaitForFreeSlot() throws Exception {
        AdmissionLimiter limiter = new AdmissionLimiter(2, pool);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            int id = i;
            futures.add(limiter.submit(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    assertTrue(release.await(5, TimeUnit.SECONDS));
                    return id;
                } finally {
                    running.decrementAndGet();
                }
            }));
        }

        assertEquals(2, limiter.getActiveCount());
        assertEquals(4, limiter.getQueuedCount());

        release.countDown();
        for (int i = 0; i < futures.size(); i++) {
            assertEquals(i, futures.get(i).get(5, TimeUnit.SECONDS));
        }

        assertTrue(maxRunning.get() <= 2);
        assertEquals(0, limiter.getActiveCount());
        assertEquals(0, limiter.getQueuedCount());
    }

    @Test
    void testQueuedTasksStartInSubmissionOrder() throws Exception {
        AdmissionLimiter limiter = new AdmissionLimiter(1, pool);
        List<Integer> started = Collections.synchronizedList(new ArrayList<>());

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int id = i;
            futures.add(limiter.submit(() -> {
                started.add(id);
                return null;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add(i);
        }
        assertEquals(expected, started);
    }

    @Test
    void testFailureReleasesSlot() throws Exception {
        AdmissionLimiter limiter = new AdmissionLimiter(1, pool);

        CompletableFuture<String> failing = limiter.submit(() -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = limiter.submit(() -> "after");

        CompletionException e = assertThrows(CompletionException.class, failing::join);
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("after", next.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testTimeoutStartsWhenTaskIsAdmitted() throws Exception {
        AdmissionLimiter limiter = new AdmissionLimiter(1, pool);
        Duration timeout = Duration.ofMillis(500);

        CompletableFuture<String> first = limiter.submit(() -> {
            Thread.sleep(300);
            return "first";
        }, timeout);
        CompletableFuture<String> second = limiter.submit(() -> {
            Thread.sleep(300);
            return "second";
        }, timeout);

        assertEquals("first", first.get(5, TimeUnit.SECONDS));
        assertEquals("second", second.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testSlowTaskTimesOut() {
        AdmissionLimiter limiter = new AdmissionLimiter(1, pool);

        CompletableFuture<String> slow = limiter.submit(() -> {
            Thread.sleep(5_000);
            return "late";
        }, Duration.ofMillis(100));

        CompletionException e = assertThrows(CompletionException.class, slow::join);
        assertInstanceOf(TimeoutException.class, e.getCause());
    }

    @Test
    void testCloseCancelsQueuedTasks() throws Exception {
        AdmissionLimiter limiter = new AdmissionLimiter(1, pool);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger();

        CompletableFuture<Integer> running = limiter.submit(() -> {
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return ran.incrementAndGet();
        });
        CompletableFuture<Integer> queued = limiter.submit(ran::incrementAndGet);

        limiter.close();
        CompletableFuture<Integer> late = limiter.submit(ran::incrementAndGet);
        release.countDown();

        assertEquals(1, running.get(5, TimeUnit.SECONDS));
        assertTrue(queued.isCancelled());
        assertTrue(late.isCancelled());
        assertEquals(0, limiter.getQueuedCount());
        assertEquals(1, ran.get());
    }

    @Test
    void testRequiresAtLeastOneSlot() {
        assertThrows(ConfigurationException.class, () -> new AdmissionLimiter(0, pool));
    }
}
