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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for reading an entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GetOptions {
    
    /**
     * Historical version to read instead of the current value
     */
    private Long version;
    
    /**
     * Read from the persistence backend even when the entry is held in memory
     */
    private boolean bypassCache;
    
    /**
     * Reader identity for the agent access log
     */
    private String agentId;
    
    public static GetOptions defaults() {
        return new GetOptions();
    }
}
