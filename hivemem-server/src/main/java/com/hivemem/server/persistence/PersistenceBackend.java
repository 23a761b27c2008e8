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
package com.hivemem.server.persistence;

import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.MemoryEntry;
import com.hivemem.core.model.MemoryEvent;
import com.hivemem.core.model.MemoryLock;
import com.hivemem.core.model.VersionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence backend interface.
 * The entry store depends only on this; implementations are SQLite and a snapshot file.
 */
public interface PersistenceBackend {
    
    /**
     * Get the type of this backend.
     */
    PersistenceType getType();
    
    /**
     * Initialize the backend.
     * Called once at startup.
     */
    void initialize();
    
    /**
     * Shutdown the backend, draining pending background writes first.
     */
    void shutdown();
    
    /**
     * Check if the backend is available.
     */
    boolean isAvailable();
    
    /**
     * Run a cheap round trip to verify the backend can serve requests.
     */
    default boolean probe() {
        return isAvailable();
    }
    
    /**
     * Periodic health check hook.
     */
    default void healthCheck() {
    }
    
    /**
     * True while writes are served by a fallback path.
     */
    default boolean isDegraded() {
        return false;
    }
    
    // ==================== Entry Operations ====================
    
    /**
     * Save an entry (insert or replace).
     */
    void saveEntry(MemoryEntry entry);
    
    /**
     * Load a single entry, expired or not. Null if absent.
     */
    MemoryEntry loadEntry(String key);
    
    /**
     * Load all unexpired entries, most recently used first.
     */
    List<MemoryEntry> loadActiveEntries(Instant now);
    
    /**
     * Delete an entry and record its last version so the number is never handed out again.
     * @return true if a row existed
     */
    boolean deleteEntry(String key, boolean purgeVersions, long lastVersion);
    
    /**
     * Update access statistics of a stored entry.
     */
    void updateAccessStats(String key, long accessCount, Instant lastAccessed);
    
    /**
     * Keys of stored entries matching the filter.
     */
    List<String> findKeys(KeyFilter filter, Instant now);
    
    /**
     * Delete entries whose TTL has passed.
     * @return number of entries deleted
     */
    int deleteExpiredEntries(Instant now);
    
    /**
     * Highest version ever assigned per key, including deleted keys.
     */
    Map<String, Long> loadVersionFloors();
    
    // ==================== Version Operations ====================
    
    /**
     * Append a version record. An existing (key, version) is never overwritten.
     * @return true if the record was inserted
     */
    boolean appendVersion(VersionRecord record);
    
    VersionRecord loadVersion(String key, long version);
    
    /**
     * All versions of a key in ascending order.
     */
    List<VersionRecord> loadVersions(String key);
    
    int purgeVersions(String key);
    
    // ==================== Lock Mirror ====================
    
    void saveLock(MemoryLock lock);
    
    void removeLock(String key);
    
    /**
     * Remove every mirrored lock.
     * @return number of locks removed
     */
    int clearLocks();
    
    // ==================== Access Log and Events ====================
    
    void logAgentAccess(String agentId, String key, String accessType, Instant at);
    
    void recordEvent(MemoryEvent event);
    
    CompletableFuture<Void> updateAccessStatsAsync(String key, long accessCount, Instant lastAccessed);
    
    CompletableFuture<Void> logAgentAccessAsync(String agentId, String key, String accessType, Instant at);
    
    CompletableFuture<Void> recordEventAsync(MemoryEvent event);
    
    /**
     * Background writes dropped because their queue was full.
     */
    long getDroppedBackgroundWrites();
    
    /**
     * Force buffered state to durable storage.
     */
    void flush();
}
