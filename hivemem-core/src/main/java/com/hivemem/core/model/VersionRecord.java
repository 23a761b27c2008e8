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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable historical snapshot of a versioned entry, keyed by (key, version).
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VersionRecord {
    
    String key;
    
    long version;
    
    JsonNode value;
    
    EntryMetadata metadata;
    
    Instant createdAt;
    
    @Builder
    @JsonCreator
    public VersionRecord(@JsonProperty("key") String key,
                         @JsonProperty("version") long version,
                         @JsonProperty("value") JsonNode value,
                         @JsonProperty("metadata") EntryMetadata metadata,
                         @JsonProperty("createdAt") Instant createdAt) {
        this.key = key;
        this.version = version;
        this.value = value != null ? value.deepCopy() : null;
        this.metadata = metadata != null ? metadata.copy() : null;
        this.createdAt = createdAt;
    }
    
    public static VersionRecord of(MemoryEntry entry, Instant createdAt) {
        return new VersionRecord(entry.getKey(), entry.getVersion(), entry.getValue(),
                entry.getMetadata(), createdAt);
    }
    
    public JsonNode getValue() {
        return value != null ? value.deepCopy() : null;
    }
}
