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
package com.hivemem.server.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.hivemem.core.model.EntryMetadata;
import com.hivemem.core.util.JsonUtils;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a read. Value and metadata are detached copies.
 */
@Value
@Builder
public class GetResult {
    
    private static final GetResult NOT_FOUND = GetResult.builder().found(false).build();
    
    JsonNode value;
    EntryMetadata metadata;
    long version;
    boolean found;
    
    /**
     * Served from the in-memory entry table
     */
    boolean fromCache;
    
    public static GetResult notFound() {
        return NOT_FOUND;
    }
    
    public <T> T valueAs(Class<T> type) {
        return value != null ? JsonUtils.convert(value, type) : null;
    }
}
