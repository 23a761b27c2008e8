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
import com.hivemem.core.constants.HiveMemConstants;
import com.hivemem.core.exception.SerializationException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Encodes entry values for storage. Values are JSON text, or base64 GZIP
 * behind a {@code gz:} prefix once compressed.
 */
public final class ValueCodec {
    
    private ValueCodec() {
        // Prevent instantiation
    }
    
    public static String encode(JsonNode value, boolean compress) {
        String json = JsonUtils.toJson(value);
        if (!compress) {
            return json;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
            gzip.write(json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SerializationException("Failed to compress value", e);
        }
        return HiveMemConstants.COMPRESSED_PREFIX + Base64.getEncoder().encodeToString(bytes.toByteArray());
    }
    
    public static JsonNode decode(String stored) {
        if (stored == null) {
            return null;
        }
        if (!isCompressed(stored)) {
            return JsonUtils.parse(stored);
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(stored.substring(HiveMemConstants.COMPRESSED_PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Compressed value is not valid base64", e);
        }
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return JsonUtils.parse(new String(gzip.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SerializationException("Failed to decompress value", e);
        }
    }
    
    public static boolean isCompressed(String stored) {
        return stored != null && stored.startsWith(HiveMemConstants.COMPRESSED_PREFIX);
    }
}
