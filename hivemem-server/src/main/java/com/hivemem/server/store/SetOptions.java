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

import com.hivemem.core.constants.HiveMemConstants;
import com.hivemem.core.model.DataType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for writing an entry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SetOptions {
    
    @Builder.Default
    private String namespace = HiveMemConstants.DEFAULT_NAMESPACE;
    
    @Builder.Default
    private DataType dataType = DataType.PERSISTENT;
    
    /**
     * Time to live in milliseconds; null for no expiry (cached entries get the default cache TTL)
     */
    private Long ttlMs;
    
    private String agentId;
    
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();
    
    /**
     * Store the value compressed regardless of its size
     */
    private boolean compress;
    
    /**
     * Take the key lock for the duration of the write
     */
    private boolean lock;
    
    public static SetOptions defaults() {
        return new SetOptions();
    }
}
