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

import com.hivemem.core.model.DataType;
import com.hivemem.server.lock.RetryPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for a read-modify-write under the key lock.
 * Null fields fall back to the configured defaults or to the current entry's settings.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AtomicOptions {
    
    /**
     * Lock holder, {@code system} when absent
     */
    private String agentId;
    
    /**
     * Namespace for a new entry; an existing entry keeps its own unless set
     */
    private String namespace;
    
    private DataType dataType;
    
    private Long ttlMs;
    
    private Long lockTtlMs;
    
    /**
     * Attempts of the whole acquire, read, apply, write sequence
     */
    private Integer maxAttempts;
    
    /**
     * Backoff between lock acquisition attempts within one sequence
     */
    private RetryPolicy lockPolicy;
    
    public static AtomicOptions defaults() {
        return new AtomicOptions();
    }
}
