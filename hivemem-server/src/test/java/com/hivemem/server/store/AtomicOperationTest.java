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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.hivemem.core.exception.HiveMemTimeoutException;
import com.hivemem.core.exception.PermissionDeniedException;
import com.hivemem.core.exception.ResourceExhaustedException;
import com.hivemem.core.exception.RetryExhaustedException;
import com.hivemem.core.exception.ValidationException;
import com.hivemem.core.model.DataType;
import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.Namespaces;
import com.hivemem.server.lock.RetryPolicy;
import com.hivemem.server.support.StoreHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class AtomicOperationTest {

    private static final UnaryOperator<JsonNode> INCREMENT =
            v -> IntNode.valueOf(v == null || v.isNull() ? 1 : v.asInt() + 1);

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
    void concurrentIncrementsAreNeverLost() throws Exception {
        AtomicOptions options = AtomicOptions.builder()
                .dataType(DataType.TRANSIENT)
                .maxAttempts(10)
                .lockPolicy(RetryPolicy.builder().maxAttempts(500).baseDelayMs(1).maxDelayMs(10).jitterMs(3).build())
                .build();

        ExecutorService pool = Executors.newFixedThreadPool(10);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int caller = 0; caller < 10; caller++) {
                String agent = "agent-" + caller;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 10; i++) {
                        store.atomic("counter", INCREMENT, options.toBuilder().agentId(agent).build());
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100, store.get("counter").getValue().asInt());
        assertEquals(100, store.get("counter").getVersion());
        assertEquals(0, harness.getLockManager().activeLockCount());
    }

    @Test
    void atomicOnPersistentEntryKeepsItsSettings() {
        store.set("score", 41, SetOptions.builder().namespace(Namespaces.METRICS).dataType(DataType.SHARED).build());

        AtomicResult result = store.atomic("score", INCREMENT);

        assertTrue(result.isChanged());
        assertEquals(1, result.getAttempts());
        assertEquals(2, result.getVersion());
        assertEquals(42, result.getValue().asInt());
        assertEquals(List.of("score"), store.keys(KeyFilter.builder()
                .namespace(Namespaces.METRICS).dataType(DataType.SHARED).build()));
        assertNull(harness.getLockManager().getLock("score"));
    }

    @Test
    void nullResultLeavesTheEntryUnchanged() {
        store.set("k", "v");

        AtomicResult result = store.atomic("k", current -> null);

        assertFalse(result.isChanged());
        assertEquals(1, result.getVersion());
        assertEquals("v", result.getValue().asText());
        assertEquals(1, store.get("k").getVersion());
    }

    @Test
    void failingFunctionIsRetriedThenReportedAndTheLockIsReleased() {
        AtomicInteger calls = new AtomicInteger();
        AtomicOptions options = AtomicOptions.builder().maxAttempts(3).build();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> store.atomic("k", v -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("boom");
                }, options));

        assertEquals(3, calls.get());
        assertEquals(3, e.getAttempts());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertNull(harness.getLockManager().getLock("k"));
        assertFalse(store.get("k").isFound());
    }

    @Test
    void contendedLockExhaustsTheRetryBudget() {
        store.acquireLock("busy", "other", 60000);
        AtomicOptions options = AtomicOptions.builder()
                .maxAttempts(2)
                .lockPolicy(RetryPolicy.builder().maxAttempts(2).baseDelayMs(1).maxDelayMs(2).jitterMs(0).build())
                .build();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> store.atomic("busy", INCREMENT, options));

        assertInstanceOf(HiveMemTimeoutException.class, e.getCause());
        assertTrue(harness.getLockManager().isHeldBy("busy", "other"));
        assertFalse(store.get("busy").isFound());
    }

    @Test
    void transientFailureIsRetriedUntilItSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        AtomicResult result = store.atomic("flaky", v -> {
            if (calls.incrementAndGet() < 2) {
                throw new IllegalStateException("first try fails");
            }
            return IntNode.valueOf(7);
        });

        assertEquals(2, result.getAttempts());
        assertEquals(7, store.get("flaky").getValue().asInt());
    }

    @Test
    void capacityErrorsAreNotRetried() {
        harness.close();
        var properties = StoreHarness.properties(root, "file");
        properties.getStore().setMaxMemorySize(64);
        harness = StoreHarness.start(properties);
        store = harness.getStore();

        AtomicInteger calls = new AtomicInteger();
        assertThrows(ResourceExhaustedException.class, () -> store.atomic("grow", v -> {
            calls.incrementAndGet();
            return TextNode.valueOf("w".repeat(100));
        }));

        assertEquals(1, calls.get());
        assertNull(harness.getLockManager().getLock("grow"));
    }

    @Test
    void nonPositiveAttemptBudgetIsAValidationError() {
        AtomicInteger calls = new AtomicInteger();
        UnaryOperator<JsonNode> counting = v -> {
            calls.incrementAndGet();
            return INCREMENT.apply(v);
        };

        assertThrows(ValidationException.class,
                () -> store.atomic("counter", counting, AtomicOptions.builder().maxAttempts(0).build()));
        assertThrows(ValidationException.class,
                () -> store.atomic("counter", counting, AtomicOptions.builder().maxAttempts(-3).build()));

        assertEquals(0, calls.get());
        assertFalse(store.get("counter").isFound());
        assertNull(harness.getLockManager().getLock("counter"));
    }

    @Test
    void lockedEntryCanBeUpdatedAtomicallyByAnyAgent() {
        store.acquireLock("guarded", "A", 60000);
        store.set("guarded", 1, SetOptions.builder().dataType(DataType.LOCKED).agentId("A").build());
        store.releaseLock("guarded", "A");

        AtomicResult result = store.atomic("guarded", INCREMENT, AtomicOptions.builder().agentId("B").build());

        assertEquals(2, result.getValue().asInt());
        assertNull(harness.getLockManager().getLock("guarded"));
        assertThrows(PermissionDeniedException.class,
                () -> store.set("guarded", 5, SetOptions.builder().agentId("B").build()));
    }
}
