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
package com.hivemem.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.hivemem.core.exception.SerializationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueCodecTest {

    @Test
    void uncompressedValueIsPlainJson() {
        JsonNode value = JsonUtils.toTree(Map.of("task", "x"));
        String stored = ValueCodec.encode(value, false);

        assertEquals("{\"task\":\"x\"}", stored);
        assertFalse(ValueCodec.isCompressed(stored));
        assertEquals(value, ValueCodec.decode(stored));
    }

    @Test
    void compressedValueCarriesPrefixAndShrinks() {
        JsonNode value = JsonUtils.toTree(Map.of("blob", "a".repeat(10000)));
        String stored = ValueCodec.encode(value, true);

        assertTrue(stored.startsWith("gz:"));
        assertTrue(stored.length() < 1000);
        assertEquals(value, ValueCodec.decode(stored));
    }

    @Test
    void corruptPayloadRaisesSerializationError() {
        assertThrows(SerializationException.class, () -> ValueCodec.decode("gz:not base64!"));
        assertThrows(SerializationException.class, () -> ValueCodec.decode("{broken"));
        assertNull(ValueCodec.decode(null));
    }
}
