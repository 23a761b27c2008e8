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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A mutation notification delivered to subscribers and recorded in the event log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemoryEvent {
    
    private String key;
    
    private EventType eventType;
    
    /**
     * New value, for SET events
     */
    private JsonNode value;
    
    private long version;
    
    private String namespace;
    
    private DataType dataType;
    
    private EntryMetadata metadata;
    
    /**
     * Agent that caused the mutation, if known
     */
    private String agentId;
    
    /**
     * Why the entry went away (explicit, evicted), for DELETE events
     */
    private String reason;
    
    private Instant timestamp;
    
    public enum EventType {
        SET("set"),
        DELETE("delete"),
        EXPIRE("expire");
        
        private final String value;
        
        EventType(String value) {
            this.value = value;
        }
        
        @JsonValue
        public String getValue() {
            return value;
        }
    }
    
    public static MemoryEvent set(MemoryEntry entry, String agentId) {
        return MemoryEvent.builder()
                .key(entry.getKey())
                .eventType(EventType.SET)
                .value(entry.getValue() != null ? entry.getValue().deepCopy() : null)
                .version(entry.getVersion())
                .namespace(entry.getNamespace())
                .dataType(entry.getDataType())
                .metadata(entry.getMetadata() != null ? entry.getMetadata().copy() : null)
                .agentId(agentId)
                .timestamp(Instant.now())
                .build();
    }
    
    public static MemoryEvent deleted(MemoryEntry entry, String agentId, String reason) {
        return removal(entry, EventType.DELETE, agentId, reason);
    }
    
    public static MemoryEvent expired(MemoryEntry entry) {
        return removal(entry, EventType.EXPIRE, null, "expired");
    }
    
    private static MemoryEvent removal(MemoryEntry entry, EventType type, String agentId, String reason) {
        return MemoryEvent.builder()
                .key(entry.getKey())
                .eventType(type)
                .version(entry.getVersion())
                .namespace(entry.getNamespace())
                .dataType(entry.getDataType())
                .metadata(entry.getMetadata() != null ? entry.getMetadata().copy() : null)
                .agentId(agentId)
                .reason(reason)
                .timestamp(Instant.now())
                .build();
    }
}
