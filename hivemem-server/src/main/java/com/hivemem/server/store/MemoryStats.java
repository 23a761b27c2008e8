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

import com.hivemem.server.gc.GcSummary;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time statistics of the entry store.
 */
@Value
@Builder
public class MemoryStats {
    long reads;
    long writes;
    long deletes;
    long hits;
    long misses;
    long evictions;
    long expirations;
    long gcRuns;
    
    long memoryUsage;
    long entryCount;
    long maxMemorySize;
    long maxEntries;
    double memoryUtilization;
    double entryUtilization;
    double cacheHitRate;
    double averageReadMicros;
    double averageWriteMicros;
    
    int activeLocks;
    int activeSubscriptions;
    
    String backendType;
    boolean degraded;
    long droppedBackgroundWrites;
    
    /**
     * Persisted entries were left unloaded at startup because a ceiling was reached
     */
    boolean partiallyLoaded;
    
    Map<String, Integer> indexSizes;
    GcSummary lastGcSummary;
}
