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
package com.hivemem.server.version;

import com.fasterxml.jackson.databind.node.TextNode;
import com.hivemem.core.model.DataType;
import com.hivemem.core.model.EntryMetadata;
import com.hivemem.core.model.MemoryEntry;
import com.hivemem.core.model.VersionRecord;
import com.hivemem.server.config.ProjectPaths;
import com.hivemem.server.persistence.SqlitePersistenceBackend;
import com.hivemem.server.support.StoreHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class VersionStoreTest {

    @TempDir
    Path root;

    private SqlitePersistenceBackend backend;
    private VersionStore versions;

    @BeforeEach
    void setUp() {
        backend = new SqlitePersistenceBackend(StoreHarness.properties(root, "sqlite"),
                ProjectPaths.resolve(root.toString()));
        backend.initialize();
        versions = new VersionStore(backend);
    }

    @AfterEach
    void tearDown() {
        backend.shutdown();
    }

    private static MemoryEntry entry(long version, String value) {
        return MemoryEntry.builder()
                .key("plan")
                .value(TextNode.valueOf(value))
                .namespace("shared_state")
                .dataType(DataType.VERSIONED)
                .version(version)
                .metadata(EntryMetadata.builder().createdAt(Instant.now()).sizeBytes(value.length() + 2).build())
                .build();
    }

    @Test
    void appendedVersionsAreListedInOrder() {
        assertTrue(versions.append(entry(1, "draft")));
        assertTrue(versions.append(entry(2, "final")));

        assertEquals(2, versions.list("plan").size());
        assertEquals(1, versions.list("plan").get(0).getVersion());
        assertEquals("final", versions.latest("plan").orElseThrow().getValue().asText());
        assertEquals("draft", versions.get("plan", 1).orElseThrow().getValue().asText());
        assertTrue(versions.get("plan", 3).isEmpty());
        assertTrue(versions.latest("other").isEmpty());
    }

    @Test
    void existingVersionIsNeverOverwritten() {
        versions.append(entry(1, "original"));
        assertFalse(versions.append(entry(1, "rewrite")));

        VersionRecord kept = versions.get("plan", 1).orElseThrow();
        assertEquals("original", kept.getValue().asText());
    }

    @Test
    void purgeIsTheOnlyRemoval() {
        versions.append(entry(1, "a"));
        versions.append(entry(2, "b"));

        assertEquals(2, versions.purge("plan"));
        assertTrue(versions.list("plan").isEmpty());
    }
}
