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
package com.hivemem.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hivemem.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MemoryEntryTest {

    @Test
    void copyIsDeep() {
        ObjectNode value = JsonUtils.getObjectMapper().createObjectNode().put("task", "x");
        EntryMetadata metadata = EntryMetadata.builder().createdAt(Instant.now()).build();
        metadata.getAttributes().put("priority", 1);
        MemoryEntry entry = MemoryEntry.builder().key("k").value(value).version(1).metadata(metadata).build();

        MemoryEntry copy = entry.copy();
        value.put("task", "y");
        metadata.getAttributes().put("priority", 2);
        metadata.recordAccess(Instant.now());

        assertEquals("x", copy.getValue().get("task").asText());
        assertEquals(1, copy.getMetadata().getAttributes().get("priority"));
        assertEquals(0, copy.getMetadata().getAccessCount());
    }

    @Test
    void expiryIsStrictlyAfterDeadline() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        EntryMetadata metadata = EntryMetadata.builder().expiresAt(now).build();
        MemoryEntry entry = MemoryEntry.builder().key("k").metadata(metadata).build();

        assertFalse(entry.isExpired(now));
        assertTrue(entry.isExpired(now.plusMillis(1)));
        assertFalse(MemoryEntry.builder().key("k").metadata(new EntryMetadata()).build().isExpired(now));
    }

    @Test
    void metadataSurvivesJsonRoundTrip() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        EntryMetadata metadata = EntryMetadata.builder()
                .createdAt(now).updatedAt(now).sizeBytes(12).agentId("A").build();
        metadata.getAttributes().put("tag", "t");

        EntryMetadata parsed = JsonUtils.fromJson(JsonUtils.toJson(metadata), EntryMetadata.class);

        assertEquals(metadata, parsed);
    }
}
