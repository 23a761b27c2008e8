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
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One item of a bulk write.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkEntry {
    private String key;
    private Object value;
    private SetOptions options;
    
    public BulkEntry(String key, Object value) {
        this(key, value, null);
    }
}
