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
package com.hivemem.server.lock;

import com.hivemem.core.exception.ConflictException;
import com.hivemem.core.exception.HiveMemTimeoutException;
import com.hivemem.core.exception.PermissionDeniedException;
import com.hivemem.core.exception.ValidationException;
import com.hivemem.core.model.MemoryLock;
import com.hivemem.server.config.HiveMemProperties;
import com.hivemem.server.persistence.PersistenceBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Grants and releases TTL-bounded exclusive locks on keys.
 * 
 * <p>Per key: {@code Unlocked -> Locked(holder)} on acquire, back to {@code Unlocked} on a
 * matching release or once the TTL passes. An expired lock counts as absent. Acquisition is
 * not re-entrant: a second acquire by the same holder conflicts too.
 * 
 * <p>Locks are mirrored to the backend's {@code memory_locks} table on a best-effort basis.
 */
@Slf4j
@Component
public class LockManager {
    
    private final Map<String, MemoryLock> locks = new ConcurrentHashMap<>();
    
    private final PersistenceBackend backend;
    private final HiveMemProperties.Lock config;
    private final RetryPolicy defaultPolicy;
    
    public LockManager(HiveMemProperties properties, PersistenceBackend backend) {
        this.backend = backend;
        this.config = properties.getLock();
        this.defaultPolicy = RetryPolicy.forLocks(config);
    }
    
    /**
     * Acquire the lock on a key. A TTL of 0 takes the configured default.
     * @throws ValidationException if the TTL is negative
     * @throws ConflictException if a live lock exists
     */
    public MemoryLock acquire(String key, String holder, long ttlMs) {
        requireText(key, "key");
        requireText(holder, "holder");
        if (ttlMs < 0) {
            throw new ValidationException("Lock TTL must not be negative, got " + ttlMs);
        }
        long ttl = ttlMs > 0 ? ttlMs : config.getDefaultTtlMs();
        
        Instant now = Instant.now();
        MemoryLock granted = MemoryLock.builder()
                .key(key)
                .holder(holder)
                .acquiredAt(now)
                .expiresAt(now.plusMillis(ttl))
                .token(UUID.randomUUID().toString())
                .build();
        
        locks.compute(key, (k, current) -> {
            if (current != null && !current.isExpired(now)) {
                throw new ConflictException(key, current.getHolder());
            }
            return granted;
        });
        
        log.debug("Lock on '{}' granted to {} for {} ms", key, holder, ttl);
        mirrorSave(granted);
        return granted;
    }
    
    /**
     * Acquire with bounded exponential backoff on contention.
     * @throws HiveMemTimeoutException once the attempts run out
     */
    public MemoryLock acquireWithRetry(String key, String holder, long ttlMs, RetryPolicy policy) {
        RetryPolicy retry = policy != null ? policy : defaultPolicy;
        ConflictException lastConflict = null;
        for (int attempt = 0; attempt < retry.getMaxAttempts(); attempt++) {
            try {
                return acquire(key, holder, ttlMs);
            } catch (ConflictException e) {
                lastConflict = e;
                if (attempt + 1 < retry.getMaxAttempts()) {
                    retry.pause(attempt);
                }
            }
        }
        log.debug("Giving up on lock '{}' for {}: {}", key, holder,
                lastConflict != null ? lastConflict.getMessage() : "no attempts");
        throw HiveMemTimeoutException.lockNotAcquired(key, retry.getMaxAttempts());
    }
    
    public MemoryLock acquireWithRetry(String key, String holder, long ttlMs) {
        return acquireWithRetry(key, holder, ttlMs, defaultPolicy);
    }
    
    /**
     * Release the lock held by a holder.
     * @return false if no live lock existed
     * @throws PermissionDeniedException if the live lock belongs to someone else
     */
    public boolean release(String key, String holder) {
        requireText(key, "key");
        Instant now = Instant.now();
        AtomicBoolean released = new AtomicBoolean(false);
        
        locks.computeIfPresent(key, (k, current) -> {
            if (current.isExpired(now)) {
                return null;
            }
            if (!current.getHolder().equals(holder)) {
                throw PermissionDeniedException.releaseByNonHolder(key, holder, current.getHolder());
            }
            released.set(true);
            return null;
        });
        
        if (released.get()) {
            log.debug("Lock on '{}' released by {}", key, holder);
            mirrorRemove(key);
        }
        return released.get();
    }
    
    /**
     * Release one exact grant. A lock re-acquired by someone else after this grant expired is left alone.
     * @return true if the grant was still held
     */
    public boolean release(MemoryLock grant) {
        AtomicBoolean released = new AtomicBoolean(false);
        locks.computeIfPresent(grant.getKey(), (k, current) -> {
            if (current.getToken().equals(grant.getToken())) {
                released.set(true);
                return null;
            }
            return current;
        });
        if (released.get()) {
            mirrorRemove(grant.getKey());
        }
        return released.get();
    }
    
    /**
     * Whether a grant is still the live lock on its key.
     */
    public boolean isLive(MemoryLock grant) {
        MemoryLock current = locks.get(grant.getKey());
        return current != null
                && current.getToken().equals(grant.getToken())
                && !current.isExpired(Instant.now());
    }
    
    /**
     * The live lock on a key, or null.
     */
    public MemoryLock getLock(String key) {
        MemoryLock current = locks.get(key);
        return current != null && !current.isExpired(Instant.now()) ? current : null;
    }
    
    public boolean isHeldBy(String key, String holder) {
        MemoryLock current = getLock(key);
        return current != null && current.getHolder().equals(holder);
    }
    
    public int activeLockCount() {
        Instant now = Instant.now();
        return (int) locks.values().stream().filter(lock -> !lock.isExpired(now)).count();
    }
    
    /**
     * Drop every expired lock.
     * @return number of locks removed
     */
    public int purgeExpired() {
        Instant now = Instant.now();
        AtomicInteger purged = new AtomicInteger();
        for (String key : locks.keySet()) {
            locks.computeIfPresent(key, (k, current) -> {
                if (current.isExpired(now)) {
                    purged.incrementAndGet();
                    return null;
                }
                return current;
            });
        }
        if (purged.get() > 0) {
            log.debug("Purged {} expired locks", purged.get());
        }
        return purged.get();
    }
    
    /**
     * Remove locks left in the backend by a previous process.
     */
    public void clearStaleLocks() {
        try {
            int cleared = backend.clearLocks();
            if (cleared > 0) {
                log.info("Cleared {} stale locks from a previous session", cleared);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to clear stale locks: {}", e.getMessage());
        }
    }
    
    public long getDefaultTtlMs() {
        return config.getDefaultTtlMs();
    }
    
    private void mirrorSave(MemoryLock lock) {
        try {
            backend.saveLock(lock);
        } catch (RuntimeException e) {
            log.warn("Failed to persist lock on '{}': {}", lock.getKey(), e.getMessage());
        }
    }
    
    private void mirrorRemove(String key) {
        try {
            backend.removeLock(key);
        } catch (RuntimeException e) {
            log.warn("Failed to remove persisted lock on '{}': {}", key, e.getMessage());
        }
    }
    
    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Lock " + name + " must be a non-empty string");
        }
    }
}
