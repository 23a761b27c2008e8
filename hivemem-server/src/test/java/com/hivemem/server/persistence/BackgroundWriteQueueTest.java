/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * Legal Notice: This module and the associated software architecture are proprietary
 * and confidential. Unauthorized copying, distribution, modification, or use is
 * strictly prohibited without explicit written permission from the copyright holder.
 *
 * Patent Pending: Certain architectural patterns and implementations described in
 * this module may be subject to patent applications.
 */
package com.hivemem.server.persistence;

import com.hivemem.core.model.MemoryEvent;
import com.hivemem.server.config.HiveMemProperties;
import com.hivemem.server.config.ProjectPaths;
import com.hivemem.server.support.StoreHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.hivemem.server.support.Entries.entry;
import static org.junit.jupiter.api.Assertions.*;

class BackgroundWriteQueueTest {

    @TempDir
    Path root;

    private SlowEventBackend backend;

    @BeforeEach
    void setUp() {
        HiveMemProperties properties = StoreHarness.properties(root, "file");
        properties.getPersistence().setAsyncQueueCapacity(2);
        backend = new SlowEventBackend(properties, ProjectPaths.resolve(root.toString()));
        backend.initialize();
    }

    @AfterEach
    void tearDown() {
        backend.release.countDown();
        backend.shutdown();
    }

    @Test
    void fullQueueDropsWritesAndCountsThem() throws Exception {
        CompletableFuture<Void> running = backend.recordEventAsync(event("k"));
        assertTrue(backend.started.await(5, TimeUnit.SECONDS));

        List<CompletableFuture<Void>> queued = List.of(
                backend.recordEventAsync(event("k")),
                backend.recordEventAsync(event("k")));
        List<CompletableFuture<Void>> dropped = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            dropped.add(backend.recordEventAsync(event("k")));
        }

        assertEquals(3, backend.getDroppedBackgroundWrites());
        dropped.forEach(f -> assertTrue(f.isDone()));
        queued.forEach(f -> assertFalse(f.isDone()));

        backend.release.countDown();
        running.get(5, TimeUnit.SECONDS);
        for (CompletableFuture<Void> f : queued) {
            f.get(5, TimeUnit.SECONDS);
        }
        assertEquals(3, backend.recorded.get());
        assertEquals(3, backend.getDroppedBackgroundWrites());
    }

    @Test
    void queuedAccessStatsForAKeyAreCoalesced() throws Exception {
        backend.recordEventAsync(event("k"));
        assertTrue(backend.started.await(5, TimeUnit.SECONDS));

        List<CompletableFuture<Void>> updates = new ArrayList<>();
        for (int count = 1; count <= 50; count++) {
            updates.add(backend.updateAccessStatsAsync("k", count, Instant.now()));
        }
        assertEquals(0, backend.getDroppedBackgroundWrites());

        backend.release.countDown();
        for (CompletableFuture<Void> f : updates) {
            f.get(5, TimeUnit.SECONDS);
        }
        assertEquals(List.of(50L), backend.accessCounts);
    }

    private static MemoryEvent event(String key) {
        return MemoryEvent.set(entry(key, "v", 1), "agent-1");
    }

    /**
     * Event writes block until released, holding up the executor for their key.
     */
    private static class SlowEventBackend extends FilePersistenceBackend {

        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger recorded = new AtomicInteger();
        final List<Long> accessCounts = new CopyOnWriteArrayList<>();

        SlowEventBackend(HiveMemProperties properties, ProjectPaths paths) {
            super(properties, paths);
        }

        @Override
        public void recordEvent(MemoryEvent event) {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            recorded.incrementAndGet();
            super.recordEvent(event);
        }

        @Override
        public void updateAccessStats(String key, long accessCount, Instant lastAccessed) {
            accessCounts.add(accessCount);
            super.updateAccessStats(key, accessCount, lastAccessed);
        }
    }
}
