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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bookkeeping carried alongside every entry value.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EntryMetadata implements Serializable {
    
    private static final long serialVersionUID = 1L;
    
    private Instant createdAt;
    
    private Instant updatedAt;
    
    /**
     * Null when the entry never expires
     */
    private Instant expiresAt;
    
    /**
     * Size of the serialized (uncompressed) value in bytes
     */
    private long sizeBytes;
    
    private long accessCount;
    
    private Instant lastAccessed;
    
    /**
     * Owning agent, if the writer identified itself
     */
    private String agentId;
    
    /**
     * Whether the value is stored compressed at the persistence boundary
     */
    private boolean compressed;
    
    /**
     * Caller supplied attributes
     */
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();
    
    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
    
    /**
     * Last access time, or creation time for an entry that was never read.
     */
    @JsonIgnore
    public Instant getRecency() {
        if (lastAccessed != null) {
            return lastAccessed;
        }
        return createdAt != null ? createdAt : Instant.EPOCH;
    }
    
    public void recordAccess(Instant now) {
        this.accessCount++;
        this.lastAccessed = now;
    }
    
    public EntryMetadata copy() {
        return toBuilder()
                .attributes(attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>())
                .build();
    }
}
