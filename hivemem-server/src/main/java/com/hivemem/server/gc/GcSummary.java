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
package com.hivemem.server.gc;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one garbage collection sweep.
 */
@Value
@Builder
public class GcSummary {
    
    Trigger trigger;
    int expired;
    int evicted;
    int locksExpired;
    int backendRowsDeleted;
    long bytesFreed;
    long durationMs;
    Instant timestamp;
    
    public boolean didWork() {
        return expired > 0 || evicted > 0 || locksExpired > 0 || backendRowsDeleted > 0;
    }
    
    public enum Trigger {
        SCHEDULED,
        PRESSURE,
        EXPIRED_ONLY,
        CAPACITY,
        SHUTDOWN,
        MANUAL
    }
}
