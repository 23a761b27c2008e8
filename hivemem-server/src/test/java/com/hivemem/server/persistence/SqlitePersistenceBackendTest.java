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

import com.hivemem.core.exception.BackendUnavailableException;
import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.MemoryEntry;
import com.hivemem.core.model.MemoryEvent;
import com.hivemem.core.model.VersionRecord;
import com.hivemem.server.config.ProjectPaths;
import com.hivemem.server.support.StoreHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.hivemem.server.support.Entries.entry;
import static org.junit.jupiter.api.Assertions.*;

class SqlitePersistenceBackendTest {

    @TempDir
    Path root;

    private SqlitePersistenceBackend backend;

    private SqlitePersistenceBackend open() {
        SqlitePersistenceBackend sqlite = new SqlitePersistenceBackend(StoreHarness.properties(root, "sqlite"),
                ProjectPaths.resolve(root.toString()));
        sqlite.initialize();
        return sqlite;
    }

    @BeforeEach
    void setUp() {
        backend = open();
    }

    @AfterEach
    void tearDown() {
        backend.shutdown();
    }

    @Test
    void createsBothDatabasesUnderTheDataDirectory() {
        assertTrue(backend.isAvailable());
        assertTrue(backend.probe());
        assertTrue(Files.exists(root.resolve(".hive-mind").resolve("memory.db")));
        assertTrue(Files.exists(root.resolve(".hive-mind").resolve("hive.db")));
    }

    @Test
    void savedEntriesSurviveReopening() {
        backend.saveEntry(entry("plan", "ship it", 4));
        backend.shutdown();

        backend = open();
        MemoryEntry loaded = backend.loadEntry("plan");
        assertNotNull(loaded);
        assertEquals("ship it", loaded.getValue().asText());
        assertEquals(4, loaded.getVersion());
        assertEquals("agent-1", loaded.getAgentId());
    }

    @Test
    void deletionLeavesAVersionFloor() {
        backend.saveEntry(entry("plan", "a", 3));

        assertTrue(backend.deleteEntry("plan", false, 3));
        assertNull(backend.loadEntry("plan"));
        assertFalse(backend.deleteEntry("plan", false, 3));
        assertEquals(3L, backend.loadVersionFloors().get("plan"));
    }

    @Test
    void versionsAreNeverOverwritten() {
        Instant now = Instant.now();
        assertTrue(backend.appendVersion(VersionRecord.of(entry("plan", "first", 1), now)));
        assertFalse(backend.appendVersion(VersionRecord.of(entry("plan", "second", 1), now)));
        assertTrue(backend.appendVersion(VersionRecord.of(entry("plan", "third", 2), now)));

        List<VersionRecord> versions = backend.loadVersions("plan");
        assertEquals(2, versions.size());
        assertEquals("first", versions.get(0).getValue().asText());
        assertEquals("third", backend.loadVersion("plan", 2).getValue().asText());
        assertEquals(2, backend.purgeVersions("plan"));
        assertTrue(backend.loadVersions("plan").isEmpty());
    }

    @Test
    void expiredRowsAreDeletedAndKeepTheirFloor() {
        Instant now = Instant.now();
        backend.saveEntry(entry("old", "x", 7, now.minusSeconds(10)));
        backend.saveEntry(entry("fresh", "y", 1, now.plusSeconds(600)));

        assertEquals(List.of("fresh"), backend.loadActiveEntries(now).stream().map(MemoryEntry::getKey).toList());
        assertEquals(1, backend.deleteExpiredEntries(now));
        assertNull(backend.loadEntry("old"));
        assertEquals(7L, backend.loadVersionFloors().get("old"));
    }

    @Test
    void findKeysAppliesFilterAndPattern() {
        backend.saveEntry(entry("task:1", "a", 1));
        backend.saveEntry(entry("task:2", "b", 1));
        backend.saveEntry(entry("note", "c", 1));

        assertEquals(List.of("task:1", "task:2"),
                backend.findKeys(KeyFilter.builder().pattern("task:*").build(), Instant.now()));
        assertEquals(List.of("note", "task:1", "task:2"),
                backend.findKeys(KeyFilter.builder().agentId("agent-1").build(), Instant.now()));
        assertTrue(backend.findKeys(KeyFilter.builder().namespace("other").build(), Instant.now()).isEmpty());
    }

    @Test
    void recordsEventsAndAgentAccess() {
        MemoryEntry stored = entry("plan", "a", 1);
        backend.recordEvent(MemoryEvent.set(stored, "agent-1"));
        backend.recordEvent(MemoryEvent.deleted(stored, "agent-1", "explicit"));
        backend.logAgentAccess("agent-1", "plan", "write", Instant.now());
        backend.logAgentAccess("agent-1", "plan", "delete", Instant.now());

        assertEquals(2, backend.countEvents("plan"));
        assertEquals("delete", backend.lastAccessType("agent-1", "plan"));
        assertNull(backend.lastAccessType("agent-2", "plan"));
    }

    @Test
    void closedBackendReportsUnavailable() {
        backend.shutdown();

        assertFalse(backend.probe());
        assertThrows(BackendUnavailableException.class, () -> backend.saveEntry(entry("plan", "a", 1)));
    }
}
