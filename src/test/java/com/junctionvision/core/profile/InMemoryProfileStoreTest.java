package com.junctionvision.core.profile;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProfileStoreTest {

    private final InMemoryProfileStore store =
            new InMemoryProfileStore(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void firstViolationCreatesProfile() {
        ProfileAggregate p = store.upsert("AB123", "v1");
        assertEquals(1, p.totalViolations());
        assertEquals(3, p.points());
        assertEquals(1.5, p.riskScore());
        assertEquals(List.of("v1"), p.history());
        assertEquals(p, store.get("AB123").orElseThrow());
    }

    @Test
    void riskGrowsAndHistoryAppends() {
        store.upsert("AB123", "v1");
        ProfileAggregate p2 = store.upsert("AB123", "v2");
        assertEquals(1.65, p2.riskScore(), 1e-9);
        ProfileAggregate p3 = store.upsert("AB123", "v3");
        assertEquals(1.815, p3.riskScore(), 1e-9);
        assertEquals(9, p3.points());
        assertEquals(List.of("v1", "v2", "v3"), p3.history());
    }

    @Test
    void riskCappedAtFive() {
        ProfileAggregate p = null;
        for (int i = 0; i < 50; i++) p = store.upsert("CAP1", "v" + i);
        assertEquals(5.0, p.riskScore());
        assertEquals(50, p.history().size());
    }

    @Test
    void unknownPlateHasNoProfile() {
        assertTrue(store.get("NOPE").isEmpty());
    }

    @Test
    void concurrentUpsertsAreNotLost() throws Exception {
        int threads = 8, perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> fs = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int tt = t;
                fs.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) store.upsert("RACE1", tt + "-" + i);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : fs) f.get();
        } finally {
            pool.shutdownNow();
        }
        ProfileAggregate p = store.get("RACE1").orElseThrow();
        assertEquals(threads * perThread, p.totalViolations());
        assertEquals(threads * perThread, p.history().size());
        assertEquals(3 * threads * perThread, p.points());
    }

    @Test
    void nullHistoryTreatedAsEmpty() {
        ProfileAggregate legacy = new ProfileAggregate("OLD1", 2, null, 6, 1.65, null);
        assertEquals(List.of("x"), legacy.next("x", Instant.EPOCH).history());
    }
}
