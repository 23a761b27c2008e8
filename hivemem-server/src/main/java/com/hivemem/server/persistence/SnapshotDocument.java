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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.hivemem.core.model.DataType;
import com.hivemem.core.model.EntryMetadata;
import com.hivemem.core.model.MemoryEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk layout of the whole-store snapshot file.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SnapshotDocument {

    private Map<String, StoredValue> entries = new LinkedHashMap<>();

    private Map<String, EntryMetadata> metadata = new LinkedHashMap<>();

    private Map<String, List<StoredVersion>> versions = new LinkedHashMap<>();

    /**
     * Last version of deleted keys
     */
    private Map<String, Long> tombstones = new LinkedHashMap<>();

    private List<MemoryEvent> history = new ArrayList<>();

    private Map<String, Long> stats = new LinkedHashMap<>();

    private Instant timestamp;

    /**
     * Written while the durable backend was unavailable
     */
    private boolean degraded;

    /**
     * Envelope of a stored value; the payload is an encoded blob.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoredValue {
        private String namespace;
        private DataType dataType;
        private long version;
        private String value;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoredVersion {
        private long version;
        private String value;
        private EntryMetadata metadata;
        private Instant createdAt;
    }
}
