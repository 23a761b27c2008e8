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

import com.hivemem.core.model.MemoryEvent;

import java.util.List;

/**
 * Frees capacity ahead of a write that would pass a ceiling.
 */
@FunctionalInterface
public interface CapacityReclaimer {
    
    /**
     * Expire and evict entries until the incoming write fits below the low watermark.
     * @param incomingBytes bytes the pending write adds
     * @param incomingEntries entries the pending write adds (0 or 1)
     * @param protectedKey key being written, never evicted
     * @return removal events, delivered by the caller once it has released its key
     */
    List<MemoryEvent> reclaim(long incomingBytes, int incomingEntries, String protectedKey);
}
