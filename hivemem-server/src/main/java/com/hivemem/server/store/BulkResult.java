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

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-key outcome of a bulk write, in input order.
 */
@Data
public class BulkResult {
    
    private final Map<String, SetResult> written = new LinkedHashMap<>();
    
    /**
     * Key to coded error message
     */
    private final Map<String, String> failed = new LinkedHashMap<>();
    
    public boolean isAllSucceeded() {
        return failed.isEmpty();
    }
}
