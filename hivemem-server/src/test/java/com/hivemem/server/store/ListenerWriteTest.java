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
package com.hivemem.server.store;

import com.hivemem.core.model.MemoryEvent;
import com.hivemem.server.support.StoreHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Subscribers run after the mutating call has released its key, so they can write other keys.
 */
class ListenerWriteTest {

    private static final String WRITER = "writer";
    private static final String MIRROR = "mirror";

    @TempDir
    Path root;

    private StoreHarness harness;
    private EntryStore store;

    @BeforeEach
    void setUp() {
        harness = StoreHarness.start(StoreHarness.properties(root, "file"));
        store = harness.getStore();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void crossKeyListenerWritesFromTwoThreadsDoNotDeadlock() throws Exception {
        AtomicInteger mirrored = new AtomicInteger();
        store.subscribe("a", event -> mirror(event, "b", mirrored), EnumSet.of(MemoryEvent.EventType.SET), "on-a");
        store.subscribe("b", event -> mirror(event, "a", mirrored), EnumSet.of(MemoryEvent.EventType.SET), "on-b");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> first = pool.submit(() -> writeRepeatedly("a"));
            Future<?> second = pool.submit(() -> writeRepeatedly("b"));
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(400, mirrored.get());
        assertEquals(0, harness.getNotifier().getListenerErrorCount());
        assertTrue(store.get("a").isFound());
        assertTrue(store.get("b").isFound());
    }

    @Test
    void expireListenerCanWaitOnAnotherThreadWritingTheSameKey() throws Exception {
        List<Boolean> renewed = new CopyOnWriteArrayList<>();
        ExecutorService renewer = Executors.newSingleThreadExecutor();
        try {
            store.subscribe("session:*", event -> {
                Future<SetResult> renewal = renewer.submit(() -> store.set(event.getKey(), "renewed"));
                try {
                    renewed.add(renewal.get(5, TimeUnit.SECONDS).getVersion() > 0);
                } catch (Exception e) {
                    renewed.add(false);
                }
            }, EnumSet.of(MemoryEvent.EventType.EXPIRE), "renewer");

            store.set("session:1", "old", SetOptions.builder().ttlMs(20L).build());
            Thread.sleep(60);

            assertEquals(1, harness.getGc().runNow().getExpired());
        } finally {
            renewer.shutdownNow();
        }

        assertEquals(List.of(true), renewed);
        GetResult result = store.get("session:1");
        assertTrue(result.isFound());
        assertEquals("renewed", result.getValue().asText());
    }

    private void writeRepeatedly(String key) {
        for (int i = 0; i < 200; i++) {
            store.set(key, i, SetOptions.builder().agentId(WRITER).build());
        }
    }

    private void mirror(MemoryEvent event, String target, AtomicInteger mirrored) {
        if (WRITER.equals(event.getAgentId())) {
            store.set(target, event.getValue(), SetOptions.builder().agentId(MIRROR).build());
            mirrored.incrementAndGet();
        }
    }
}
