package com.querytrace.engine.storage;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StatementRegistryTest {

    @Test
    void registerLookupUnregister() {
        StatementRegistry registry = new StatementRegistry();
        assertEquals(100, registry.capacity());

        assertTrue(registry.register(1001, 7));
        assertEquals(OptionalLong.of(7), registry.lookup(1001));
        assertEquals(OptionalLong.empty(), registry.lookup(1002));

        registry.unregister(1001);
        assertEquals(OptionalLong.empty(), registry.lookup(1001));
        assertEquals(0, registry.activeCount());
    }

    @Test
    void reRegisteringReusesOwnedSlot() {
        StatementRegistry registry = new StatementRegistry(2);
        registry.register(1, 10);
        registry.register(1, 11);
        assertEquals(1, registry.activeCount());
        assertEquals(OptionalLong.of(11), registry.lookup(1));
    }

    @Test
    void fullTableRejectsNewProcessesOnly() {
        StatementRegistry registry = new StatementRegistry(2);
        assertTrue(registry.register(1, 10));
        assertTrue(registry.register(2, 20));

        assertFalse(registry.register(3, 30));
        assertEquals(OptionalLong.empty(), registry.lookup(3));
        assertTrue(registry.register(2, 21), "an owning process can always update its slot");

        registry.unregister(1);
        assertTrue(registry.register(3, 30));
        assertEquals(OptionalLong.of(30), registry.lookup(3));
    }

    @Test
    void unregisterUnknownPidIsHarmless() {
        StatementRegistry registry = new StatementRegistry(1);
        assertDoesNotThrow(() -> registry.unregister(99));
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new StatementRegistry(0));
    }

    @Test
    void concurrentSessionsKeepTheirOwnSlots() throws Exception {
        int sessions = 16;
        int rounds = 2_000;
        StatementRegistry registry = new StatementRegistry(sessions);
        ExecutorService pool = Executors.newFixedThreadPool(sessions);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        for (int s = 0; s < sessions; s++) {
            long pid = 5000 + s;
            results.add(pool.submit(() -> {
                start.await();
                for (long stmt = 1; stmt <= rounds; stmt++) {
                    if (!registry.register(pid, stmt)) return false;
                    if (registry.lookup(pid).orElse(-1) != stmt) return false;
                    registry.unregister(pid);
                }
                return true;
            }));
        }
        start.countDown();
        for (Future<Boolean> r : results) {
            assertTrue(r.get(30, TimeUnit.SECONDS));
        }
        pool.shutdown();
        assertEquals(0, registry.activeCount());
    }
}
