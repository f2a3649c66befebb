package com.sqlrecorder.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTraceStoreTest {

    private AtomicLong now;
    private InMemoryTraceStore store;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_000_000L);
        store = new InMemoryTraceStore(now::get);
    }

    // --- Values ---

    @Test
    void setGetDelete() {
        store.set("k", "v");
        assertEquals("v", store.get("k"));
        store.delete("k");
        assertNull(store.get("k"));
    }

    @Test
    void getMissingKeyReturnsNull() {
        assertNull(store.get("missing"));
    }

    @Test
    void valueExpiresAfterTtl() {
        store.set("k", "v", Duration.ofSeconds(10));
        now.addAndGet(9_999);
        assertEquals("v", store.get("k"));
        now.addAndGet(1);
        assertNull(store.get("k"));
    }

    @Test
    void zeroTtlNeverExpires() {
        store.set("k", "v", Duration.ZERO);
        now.addAndGet(Duration.ofDays(365).toMillis());
        assertEquals("v", store.get("k"));
    }

    // --- Lists ---

    @Test
    void pushPutsNewestFirst() {
        store.push("list", "a");
        store.push("list", "b");
        store.push("list", "c");
        assertEquals(List.of("c", "b", "a"), store.range("list", 0, -1));
    }

    @Test
    void rangeWithNegativeAndOutOfBoundsIndices() {
        for (String s : List.of("a", "b", "c", "d")) store.push("list", s);
        assertEquals(List.of("d", "c"), store.range("list", 0, 1));
        assertEquals(List.of("b", "a"), store.range("list", -2, -1));
        assertEquals(List.of("d", "c", "b", "a"), store.range("list", 0, 100));
        assertTrue(store.range("list", 3, 1).isEmpty());
        assertTrue(store.range("missing", 0, -1).isEmpty());
    }

    @Test
    void trimKeepsHead() {
        for (String s : List.of("a", "b", "c", "d")) store.push("list", s);
        store.trim("list", 0, 1);
        assertEquals(List.of("d", "c"), store.range("list", 0, -1));
    }

    @Test
    void deleteRemovesList() {
        store.push("list", "a");
        store.delete("list");
        assertTrue(store.range("list", 0, -1).isEmpty());
    }

    // --- Concurrency ---

    @Test
    void concurrentPushesAreAllKept() throws InterruptedException {
        int threadCount = 50;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        ExecutorService pool = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            String value = "v" + i;
            pool.submit(() -> {
                try {
                    start.await();
                    store.push("list", value);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        done.await(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(threadCount, store.range("list", 0, -1).size());
    }

    @Test
    void pushesRacingDeletesKeepEachWritersLatestValues() throws InterruptedException {
        int writers = 8;
        int perWriter = 200;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch deletesDone = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers + 1);
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);

        for (int w = 0; w < writers; w++) {
            String writer = "w" + w;
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perWriter; i++) store.push("list", writer + ":" + i);
                    deletesDone.await();
                    store.push("list", writer + ":" + perWriter);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        pool.submit(() -> {
            try {
                start.await();
                for (int i = 0; i < 500; i++) store.delete("list");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                deletesDone.countDown();
                done.countDown();
            }
        });
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        List<String> list = store.range("list", 0, -1);
        for (int w = 0; w < writers; w++) {
            String prefix = "w" + w + ":";
            List<Integer> seqs = list.stream()
                .filter(v -> v.startsWith(prefix))
                .map(v -> Integer.parseInt(v.substring(prefix.length())))
                .toList();
            assertFalse(seqs.isEmpty(), "writer w" + w + " lost its final push");
            // what survives is an unbroken run of the writer's most recent pushes, newest first
            for (int i = 0; i < seqs.size(); i++) {
                assertEquals(perWriter - i, seqs.get(i), "gap in writer w" + w + ": " + seqs);
            }
        }
    }

    @Test
    void concurrentPushAndTrimStayBounded() throws InterruptedException {
        int threadCount = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        ExecutorService pool = Executors.newFixedThreadPool(threadCount);

        for (int t = 0; t < threadCount; t++) {
            String prefix = "t" + t + ":";
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 300; i++) {
                        store.push("list", prefix + i);
                        store.trim("list", 0, 9);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(10, store.range("list", 0, -1).size());
    }
}
