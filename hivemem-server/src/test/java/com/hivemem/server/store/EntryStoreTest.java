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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hivemem.core.exception.HiveMemException;
import com.hivemem.core.exception.PermissionDeniedException;
import com.hivemem.core.exception.ResourceExhaustedException;
import com.hivemem.core.exception.SerializationException;
import com.hivemem.core.exception.ValidationException;
import com.hivemem.core.model.DataType;
import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.MemoryEvent;
import com.hivemem.core.model.Namespaces;
import com.hivemem.core.util.JsonUtils;
import com.hivemem.server.support.StoreHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class EntryStoreTest {

    @TempDir
    Path root;

    private StoreHarness harness;
    private EntryStore store;

    @BeforeEach
    void setUp() {
        harness = StoreHarness.start(StoreHarness.properties(root, "sqlite"));
        store = harness.getStore();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void setThenGetReturnsTheValue() {
        SetResult written = store.set("agent:1:ctx", Map.of("task", "x"),
                SetOptions.builder().dataType(DataType.PERSISTENT).build());

        assertEquals(1, written.getVersion());
        assertTrue(written.getSizeBytes() > 0);
        assertNull(written.getExpiresAt());

        GetResult result = store.get("agent:1:ctx");
        assertTrue(result.isFound());
        assertTrue(result.isFromCache());
        assertEquals(1, result.getVersion());
        assertEquals(JsonUtils.toTree(Map.of("task", "x")), result.getValue());
        assertEquals("x", result.valueAs(Map.class).get("task"));
    }

    @Test
    void missingKeyIsNotFound() {
        GetResult result = store.get("nothing:here");
        assertFalse(result.isFound());
        assertNull(result.getValue());
    }

    @Test
    void returnedValuesAreDetachedCopies() {
        store.set("doc", Map.of("a", 1));
        JsonNode value = store.get("doc").getValue();
        ((ObjectNode) value).put("a", 99);

        assertEquals(1, store.get("doc").getValue().get("a").asInt());
    }

    @Test
    void versionsIncreaseAndAreNeverReusedAfterDelete() {
        assertEquals(1, store.set("k", "a").getVersion());
        assertEquals(2, store.set("k", "b").getVersion());
        assertTrue(store.delete("k"));
        assertFalse(store.get("k").isFound());
        assertEquals(3, store.set("k", "c").getVersion());
    }

    @Test
    void versionFloorSurvivesRestartAfterDelete() {
        store.set("k", "a");
        store.set("k", "b");
        store.delete("k");

        harness = harness.restart();
        store = harness.getStore();

        assertFalse(store.get("k").isFound());
        assertEquals(3, store.set("k", "c").getVersion());
    }

    @Test
    void persistentEntriesSurviveRestartAndTransientOnesDoNot() {
        store.set("agent:1:ctx", Map.of("task", "x"));
        store.set("scratch", "gone", SetOptions.builder().dataType(DataType.TRANSIENT).build());

        harness = harness.restart();
        store = harness.getStore();

        GetResult persisted = store.get("agent:1:ctx");
        assertTrue(persisted.isFound());
        assertEquals("x", persisted.getValue().get("task").asText());
        assertFalse(store.get("scratch").isFound());
    }

    @Test
    void expiredEntryIsNotReturnedBeforeAnySweep() throws Exception {
        List<MemoryEvent> expired = new CopyOnWriteArrayList<>();
        store.subscribe("temp:*", expired::add, EnumSet.of(MemoryEvent.EventType.EXPIRE), null);

        SetResult written = store.set("temp:1", "v", SetOptions.builder().ttlMs(100L).build());
        assertNotNull(written.getExpiresAt());
        assertTrue(store.get("temp:1").isFound());

        Thread.sleep(150);

        assertFalse(store.get("temp:1").isFound());
        assertFalse(store.keys().contains("temp:1"));
        assertEquals(1, expired.size());
        assertEquals("temp:1", expired.get(0).getKey());
    }

    @Test
    void cachedEntriesGetTheDefaultTtl() {
        SetResult written = store.set("cache:q", "answer", SetOptions.builder().dataType(DataType.CACHED).build());
        assertNotNull(written.getExpiresAt());
    }

    @Test
    void nonPositiveTtlIsRejected() {
        assertThrows(ValidationException.class,
                () -> store.set("k", "v", SetOptions.builder().ttlMs(0L).build()));
    }

    @Test
    void malformedKeysFailFast() {
        assertThrows(ValidationException.class, () -> store.get(null));
        assertThrows(ValidationException.class, () -> store.get(""));
        assertThrows(ValidationException.class, () -> store.set("   ", "v"));
        assertThrows(ValidationException.class, () -> store.set("bad\0key", "v"));
        assertThrows(ValidationException.class, () -> store.delete("x".repeat(1025)));
    }

    @Test
    void unserializableValueIsRejected() {
        assertThrows(SerializationException.class, () -> store.set("k", new Object()));
        assertFalse(store.get("k").isFound());
    }

    @Test
    void createdAtIsKeptAcrossUpdates() throws Exception {
        store.set("k", 1);
        GetResult first = store.get("k");
        Thread.sleep(5);
        store.set("k", 2);
        GetResult second = store.get("k");

        assertEquals(first.getMetadata().getCreatedAt(), second.getMetadata().getCreatedAt());
        assertTrue(second.getMetadata().getUpdatedAt().isAfter(first.getMetadata().getCreatedAt()));
        assertTrue(second.getMetadata().getAccessCount() >= 2);
    }

    @Test
    void largeValuesAreMarkedCompressed() {
        harness.close();
        var properties = StoreHarness.properties(root, "sqlite");
        properties.getStore().setCompressionThreshold(64);
        harness = StoreHarness.start(properties);
        store = harness.getStore();

        store.set("big", "y".repeat(500));
        harness = harness.restart();
        store = harness.getStore();

        GetResult result = store.get("big");
        assertTrue(result.getMetadata().isCompressed());
        assertEquals("y".repeat(500), result.getValue().asText());
    }

    @Test
    void bypassCacheReadsFromTheBackend() {
        store.set("k", "v");
        GetResult result = store.get("k", GetOptions.builder().bypassCache(true).build());
        assertTrue(result.isFound());
        assertFalse(result.isFromCache());

        store.set("t", "memory only", SetOptions.builder().dataType(DataType.TRANSIENT).build());
        GetResult transientResult = store.get("t", GetOptions.builder().bypassCache(true).build());
        assertTrue(transientResult.isFound());
        assertTrue(transientResult.isFromCache());
    }

    @Test
    void deleteReportsWhetherAnEntryExisted() {
        store.set("k", "v");
        assertTrue(store.delete("k"));
        assertFalse(store.delete("k"));
        assertFalse(store.delete("never"));
    }

    @Test
    void versionedEntriesKeepTheirHistory() {
        SetOptions versioned = SetOptions.builder().dataType(DataType.VERSIONED).build();
        store.set("plan", "draft", versioned);
        store.set("plan", "review", versioned);
        store.set("plan", "final", versioned);

        assertEquals("final", store.get("plan").getValue().asText());
        assertEquals("draft", store.get("plan", GetOptions.builder().version(1L).build()).getValue().asText());
        assertEquals("review", store.getVersion("plan", 2).orElseThrow().getValue().asText());
        assertTrue(store.getVersion("plan", 9).isEmpty());

        List<Long> versions = new ArrayList<>();
        store.listVersions("plan").forEach(record -> versions.add(record.getVersion()));
        assertEquals(List.of(1L, 2L, 3L), versions);

        store.delete("plan", DeleteOptions.builder().purgeVersions(true).build());
        assertTrue(store.listVersions("plan").isEmpty());
    }

    @Test
    void keysFilterByNamespaceTypeAgentAndPattern() {
        store.set("agent:1:ctx", "a", SetOptions.builder().namespace(Namespaces.AGENT_CONTEXT).agentId("agent-1").build());
        store.set("agent:2:ctx", "b", SetOptions.builder().namespace(Namespaces.AGENT_CONTEXT).agentId("agent-2").build());
        store.set("task:1", "c", SetOptions.builder().namespace(Namespaces.TASK_RESULTS)
                .dataType(DataType.TRANSIENT).agentId("agent-1").build());

        assertEquals(List.of("agent:1:ctx", "agent:2:ctx", "task:1"), store.keys());
        assertEquals(List.of("agent:1:ctx", "agent:2:ctx"),
                store.keys(KeyFilter.builder().namespace(Namespaces.AGENT_CONTEXT).build()));
        assertEquals(List.of("task:1"),
                store.keys(KeyFilter.builder().dataType(DataType.TRANSIENT).build()));
        assertEquals(List.of("agent:1:ctx", "task:1"),
                store.keys(KeyFilter.builder().agentId("agent-1").build()));
        assertEquals(List.of("agent:2:ctx"),
                store.keys(KeyFilter.builder().pattern("agent:2:*").build()));
        assertEquals(List.of("task:1"),
                store.keys(KeyFilter.builder().pattern("^task:\\d+$").build()));
        assertTrue(store.keys(KeyFilter.builder().namespace("nope").build()).isEmpty());
    }

    @Test
    void lockedEntriesRequireTheLock() {
        SetOptions locked = SetOptions.builder().dataType(DataType.LOCKED).agentId("A").build();
        assertThrows(PermissionDeniedException.class, () -> store.set("job:42", "v1", locked));

        store.acquireLock("job:42", "A", 5000);
        assertEquals(1, store.set("job:42", "v1", locked).getVersion());
        store.releaseLock("job:42", "A");

        SetOptions byB = SetOptions.builder().agentId("B").build();
        assertThrows(PermissionDeniedException.class, () -> store.set("job:42", "v2", byB));

        SetOptions withLock = locked.toBuilder().agentId("B").lock(true).build();
        assertEquals(2, store.set("job:42", "v2", withLock).getVersion());
        assertNull(harness.getLockManager().getLock("job:42"));
    }

    @Test
    void lockedEntryCannotBeDeletedWhileSomeoneElseHoldsTheLock() {
        store.acquireLock("job:1", "A", 5000);
        store.set("job:1", "v", SetOptions.builder().dataType(DataType.LOCKED).agentId("A").build());

        assertThrows(PermissionDeniedException.class,
                () -> store.delete("job:1", DeleteOptions.builder().agentId("B").build()));
        assertTrue(store.delete("job:1", DeleteOptions.builder().agentId("A").build()));
    }

    @Test
    void subscribersSeeMutationsUntilTheyUnsubscribe() {
        List<MemoryEvent> events = new CopyOnWriteArrayList<>();
        var subscription = store.subscribe("task:*", events::add);

        store.set("task:1", Map.of("status", "pending"), SetOptions.builder().agentId("A").build());
        store.set("other", "ignored");
        store.delete("task:1", DeleteOptions.builder().agentId("A").build());

        assertEquals(2, events.size());
        assertEquals(MemoryEvent.EventType.SET, events.get(0).getEventType());
        assertEquals("pending", events.get(0).getValue().get("status").asText());
        assertEquals("A", events.get(0).getAgentId());
        assertEquals(MemoryEvent.EventType.DELETE, events.get(1).getEventType());
        assertEquals("explicit", events.get(1).getReason());

        assertTrue(subscription.unsubscribe());
        store.set("task:2", "late");
        assertEquals(2, events.size());
    }

    @Test
    void failingListenerDoesNotFailTheWrite() {
        store.subscribe("*", event -> {
            throw new IllegalStateException("listener bug");
        });
        List<MemoryEvent> events = new CopyOnWriteArrayList<>();
        store.subscribe("*", events::add);

        assertEquals(1, store.set("k", "v").getVersion());
        assertEquals(1, events.size());
        assertEquals(1, harness.getNotifier().getListenerErrorCount());
    }

    @Test
    void setAllReportsPerKeyOutcome() {
        BulkResult result = store.setAll(List.of(
                new BulkEntry("a", 1),
                new BulkEntry("", 2),
                new BulkEntry("c", 3, SetOptions.builder().namespace(Namespaces.METRICS).build())));

        assertFalse(result.isAllSucceeded());
        assertEquals(List.of("a", "c"), new ArrayList<>(result.getWritten().keySet()));
        assertTrue(result.getFailed().get("").startsWith(HiveMemException.ErrorCode.INVALID_ARGUMENT.getPrefix()));
        assertEquals(List.of("c"), store.keys(KeyFilter.builder().namespace(Namespaces.METRICS).build()));
    }

    @Test
    void valueLargerThanTheMemoryCeilingFailsImmediately() {
        harness.close();
        var properties = StoreHarness.properties(root, "file");
        properties.getStore().setMaxMemorySize(100);
        harness = StoreHarness.start(properties);
        store = harness.getStore();

        ResourceExhaustedException e = assertThrows(ResourceExhaustedException.class,
                () -> store.set("huge", "z".repeat(200)));
        assertEquals(HiveMemException.ErrorCode.MEMORY_LIMIT, e.getErrorCode());
        assertFalse(store.get("huge").isFound());
    }

    @Test
    void statsReflectActivity() {
        store.set("a", 1);
        store.set("b", 2, SetOptions.builder().dataType(DataType.TRANSIENT).build());
        store.get("a");
        store.get("missing");
        store.delete("b");

        MemoryStats stats = store.getStats();
        assertEquals(2, stats.getWrites());
        assertEquals(2, stats.getReads());
        assertEquals(1, stats.getDeletes());
        assertEquals(1, stats.getHits());
        assertEquals(1, stats.getEntryCount());
        assertTrue(stats.getMemoryUsage() > 0);
        assertEquals(50.0, stats.getCacheHitRate(), 0.001);
        assertEquals("sqlite", stats.getBackendType());
        assertFalse(stats.isDegraded());
        assertEquals(0, stats.getDroppedBackgroundWrites());
        assertNotNull(stats.getIndexSizes());
    }
}
