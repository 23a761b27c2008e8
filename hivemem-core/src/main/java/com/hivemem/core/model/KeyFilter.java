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

import com.hivemem.core.util.KeyPattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Criteria for listing keys. Null fields do not constrain the result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyFilter {
    
    private String namespace;
    
    private DataType dataType;
    
    private String agentId;
    
    /**
     * Literal, glob or regular expression, see {@link KeyPattern}
     */
    private String pattern;
    
    private boolean includeExpired;
    
    public static KeyFilter all() {
        return new KeyFilter();
    }
    
    public KeyPattern compiledPattern() {
        return KeyPattern.compile(pattern);
    }
    
    /**
     * Check an entry against every criterion except the key pattern.
     */
    public boolean matchesAttributes(MemoryEntry entry, Instant now) {
        if (namespace != null && !namespace.equals(entry.getNamespace())) {
            return false;
        }
        if (dataType != null && dataType != entry.getDataType()) {
            return false;
        }
        if (agentId != null && !agentId.equals(entry.getAgentId())) {
            return false;
        }
        return includeExpired || !entry.isExpired(now);
    }
}
