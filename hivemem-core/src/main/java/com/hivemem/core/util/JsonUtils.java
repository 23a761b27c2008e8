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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hivemem.core.exception.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * Utility class for JSON operations on entry payloads and snapshots.
 */
public final class JsonUtils {
    
    private static final ObjectMapper objectMapper;
    
    static {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
    
    private JsonUtils() {
        // Prevent instantiation
    }
    
    /**
     * Get the shared ObjectMapper instance
     */
    public static ObjectMapper getObjectMapper() {
        return objectMapper;
    }
    
    /**
     * Parse JSON string to JsonNode
     */
    public static JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Parse JSON string to specified type
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Convert a tree node to the given type
     */
    public static <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to convert JSON: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Convert object to JSON string
     */
    public static String toJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize to JSON: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Convert any value to a detached tree. A JsonNode is deep-copied, null becomes JSON null.
     */
    public static JsonNode toTree(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Value of type " + value.getClass().getName()
                    + " cannot be serialized: " + e.getMessage(), e);
        }
    }
    
    /**
     * Serialized size of a value in UTF-8 bytes
     */
    public static long sizeOf(JsonNode value) {
        return toJson(value).getBytes(StandardCharsets.UTF_8).length;
    }
}
