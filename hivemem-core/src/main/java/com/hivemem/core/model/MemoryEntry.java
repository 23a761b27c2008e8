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
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * A versioned key/value pair with its metadata.
 * The value is an opaque JSON payload; the envelope around it is typed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemoryEntry implements Serializable {
    
    private static final long serialVersionUID = 1L;
    
    private String key;
    
    private JsonNode value;
    
    private String namespace;
    
    private DataType dataType;
    
    /**
     * Strictly increasing per key, never reused
     */
    private long version;
    
    private EntryMetadata metadata;
    
    @JsonIgnore
    public boolean isExpired(Instant now) {
        return metadata != null && metadata.isExpired(now);
    }
    
    @JsonIgnore
    public long getSizeBytes() {
        return metadata != null ? metadata.getSizeBytes() : 0;
    }
    
    @JsonIgnore
    public String getAgentId() {
        return metadata != null ? metadata.getAgentId() : null;
    }
    
    /**
     * Deep copy, so callers can never mutate stored state.
     */
    public MemoryEntry copy() {
        return toBuilder()
                .value(value != null ? value.deepCopy() : null)
                .metadata(metadata != null ? metadata.copy() : null)
                .build();
    }
}
