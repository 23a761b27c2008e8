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

import com.hivemem.core.exception.BackendUnavailableException;
import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.MemoryEntry;
import com.hivemem.core.model.MemoryEvent;
import com.hivemem.core.model.MemoryLock;
import com.hivemem.core.model.VersionRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * SQLite backend with a snapshot file fallback.
 *
 * <p>Every write goes to the primary and is mirrored into the file backend's in-memory
 * state. Reads are served by the primary. When the primary reports itself unavailable
 * the backend switches to degraded mode for the rest of the session: the failure is
 * logged and every later call is served by the file backend. A call fails only when both
 * paths fail.
 *
 * <p>On the next start with a healthy primary, entries written during the degraded
 * session are written back to SQLite.
 */
@Slf4j
public class FailoverPersistenceBackend extends AbstractPersistenceBackend {

    private final PersistenceBackend primary;
    private final FilePersistenceBackend fallback;

    private volatile boolean degraded = false;

    public FailoverPersistenceBackend(PersistenceBackend primary, FilePersistenceBackend fallback) {
        this(primary, fallback, DEFAULT_ASYNC_QUEUE_CAPACITY);
    }

    public FailoverPersistenceBackend(PersistenceBackend primary, FilePersistenceBackend fallback,
                                      int asyncQueueCapacity) {
        super(asyncQueueCapacity);
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public PersistenceType getType() {
        return degraded ? PersistenceType.FILE : primary.getType();
    }

    @Override
    public void initialize() {
        fallback.initialize();
        primary.initialize();

        if (!primary.isAvailable() || !primary.probe()) {
            log.warn("Primary {} backend unavailable at startup, running on the snapshot file",
                    primary.getType().getValue());
            markDegraded();
        } else {
            reconcile();
            fallback.replaceContents(primary.loadActiveEntries(Instant.now()), primary.loadVersionFloors());
            fallback.setDegraded(false);
        }

        available = primary.isAvailable() || fallback.isAvailable();
        if (!available) {
            log.error("Neither the primary backend nor the snapshot file could be initialized");
        }
    }

    /**
     * Write entries, versions and deletions recorded during a degraded session back to the primary.
     */
    private void reconcile() {
        if (!fallback.wasDegradedAtLoad()) {
            return;
        }
        log.info("Snapshot from {} was written in degraded mode, reconciling with {}",
                fallback.getLoadedTimestamp(), primary.getType().getValue());

        Map<String, Long> primaryFloors = primary.loadVersionFloors();
        int restored = 0;
        for (MemoryEntry entry : fallback.allEntries()) {
            long primaryVersion = primaryFloors.getOrDefault(entry.getKey(), 0L);
            if (entry.getVersion() > primaryVersion) {
                primary.saveEntry(entry);
                restored++;
            }
        }

        int removed = 0;
        for (Map.Entry<String, Long> tombstone : fallback.getTombstones().entrySet()) {
            long primaryVersion = primaryFloors.getOrDefault(tombstone.getKey(), 0L);
            if (tombstone.getValue() >= primaryVersion) {
                if (primary.deleteEntry(tombstone.getKey(), false, tombstone.getValue())) {
                    removed++;
                }
            }
        }

        int versionsAdded = 0;
        for (List<VersionRecord> records : fallback.allVersions().values()) {
            for (VersionRecord record : records) {
                if (primary.appendVersion(record)) {
                    versionsAdded++;
                }
            }
        }

        log.info("Reconciled degraded snapshot: {} entries restored, {} deletions applied, {} versions added",
                restored, removed, versionsAdded);
    }

    @Override
    public boolean probe() {
        return degraded ? fallback.probe() : primary.probe();
    }

    @Override
    public void healthCheck() {
        if (degraded) {
            if (primary.isAvailable() && primary.probe()) {
                log.info("Primary {} backend reachable again; the snapshot file serves until restart",
                        primary.getType().getValue());
            } else {
                log.warn("Running degraded on the snapshot file; primary {} backend unavailable",
                        primary.getType().getValue());
            }
            return;
        }
        primary.healthCheck();
        if (!primary.probe()) {
            markDegraded();
        }
    }

    @Override
    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public void shutdown() {
        log.info("Shutting down failover persistence backend (degraded: {})", degraded);
        shutdownAsyncExecutor();
        fallback.shutdown();
        primary.shutdown();
        available = false;
    }

    private void markDegraded() {
        if (!degraded) {
            degraded = true;
            fallback.setDegraded(true);
        }
    }

    private void degrade(String operation, BackendUnavailableException cause) {
        if (!degraded) {
            log.warn("Primary {} backend failed during {}: {}. Switching to the snapshot file",
                    primary.getType().getValue(), operation, cause.getMessage());
            markDegraded();
            try {
                fallback.flush();
            } catch (BackendUnavailableException e) {
                log.error("Snapshot write after degradation failed: {}", e.getMessage());
            }
        }
    }

    /**
     * Apply a write to the primary unless degraded, then mirror it to the file backend.
     * After degradation the file backend alone serves the write.
     */
    private <T> T write(String operation, Supplier<T> onPrimary, Supplier<T> onFallback) {
        if (!degraded) {
            T result;
            try {
                result = onPrimary.get();
            } catch (BackendUnavailableException e) {
                degrade(operation, e);
                return writeFallback(operation, onFallback);
            }
            try {
                onFallback.get();
            } catch (BackendUnavailableException e) {
                log.warn("Snapshot mirror failed during {}: {}", operation, e.getMessage());
            }
            return result;
        }
        return writeFallback(operation, onFallback);
    }

    private <T> T writeFallback(String operation, Supplier<T> onFallback) {
        try {
            return onFallback.get();
        } catch (BackendUnavailableException e) {
            log.error("Both persistence paths failed during {}", operation);
            throw new BackendUnavailableException("Both persistence paths failed during " + operation, e);
        }
    }

    private void writeVoid(String operation, Runnable onPrimary, Runnable onFallback) {
        write(operation, () -> {
            onPrimary.run();
            return null;
        }, () -> {
            onFallback.run();
            return null;
        });
    }

    private <T> T read(String operation, Supplier<T> onPrimary, Supplier<T> onFallback) {
        if (!degraded) {
            try {
                return onPrimary.get();
            } catch (BackendUnavailableException e) {
                degrade(operation, e);
            }
        }
        return onFallback.get();
    }

    // ==================== Entry Operations ====================

    @Override
    public void saveEntry(MemoryEntry entry) {
        writeVoid("save entry", () -> primary.saveEntry(entry), () -> fallback.saveEntry(entry));
    }

    @Override
    public MemoryEntry loadEntry(String key) {
        return read("load entry", () -> primary.loadEntry(key), () -> fallback.loadEntry(key));
    }

    @Override
    public List<MemoryEntry> loadActiveEntries(Instant now) {
        return read("load entries", () -> primary.loadActiveEntries(now), () -> fallback.loadActiveEntries(now));
    }

    @Override
    public boolean deleteEntry(String key, boolean purgeVersions, long lastVersion) {
        return write("delete entry",
                () -> primary.deleteEntry(key, purgeVersions, lastVersion),
                () -> fallback.deleteEntry(key, purgeVersions, lastVersion));
    }

    @Override
    public void updateAccessStats(String key, long accessCount, Instant lastAccessed) {
        writeVoid("update access stats",
                () -> primary.updateAccessStats(key, accessCount, lastAccessed),
                () -> fallback.updateAccessStats(key, accessCount, lastAccessed));
    }

    @Override
    public List<String> findKeys(KeyFilter filter, Instant now) {
        return read("find keys", () -> primary.findKeys(filter, now), () -> fallback.findKeys(filter, now));
    }

    @Override
    public int deleteExpiredEntries(Instant now) {
        return write("delete expired entries",
                () -> primary.deleteExpiredEntries(now),
                () -> fallback.deleteExpiredEntries(now));
    }

    @Override
    public Map<String, Long> loadVersionFloors() {
        return read("load version floors", primary::loadVersionFloors, fallback::loadVersionFloors);
    }

    // ==================== Version Operations ====================

    @Override
    public boolean appendVersion(VersionRecord record) {
        return write("append version", () -> primary.appendVersion(record), () -> fallback.appendVersion(record));
    }

    @Override
    public VersionRecord loadVersion(String key, long version) {
        return read("load version", () -> primary.loadVersion(key, version), () -> fallback.loadVersion(key, version));
    }

    @Override
    public List<VersionRecord> loadVersions(String key) {
        return read("load versions", () -> primary.loadVersions(key), () -> fallback.loadVersions(key));
    }

    @Override
    public int purgeVersions(String key) {
        return write("purge versions", () -> primary.purgeVersions(key), () -> fallback.purgeVersions(key));
    }

    // ==================== Lock Mirror ====================

    @Override
    public void saveLock(MemoryLock lock) {
        writeVoid("save lock", () -> primary.saveLock(lock), () -> fallback.saveLock(lock));
    }

    @Override
    public void removeLock(String key) {
        writeVoid("remove lock", () -> primary.removeLock(key), () -> fallback.removeLock(key));
    }

    @Override
    public int clearLocks() {
        return write("clear locks", primary::clearLocks, fallback::clearLocks);
    }

    // ==================== Access Log and Events ====================

    @Override
    public void logAgentAccess(String agentId, String key, String accessType, Instant at) {
        writeVoid("log agent access",
                () -> primary.logAgentAccess(agentId, key, accessType, at),
                () -> fallback.logAgentAccess(agentId, key, accessType, at));
    }

    @Override
    public void recordEvent(MemoryEvent event) {
        writeVoid("record event", () -> primary.recordEvent(event), () -> fallback.recordEvent(event));
    }

    @Override
    public void flush() {
        if (!degraded) {
            primary.flush();
        }
        fallback.flush();
    }

    public PersistenceBackend getPrimary() {
        return primary;
    }

    public FilePersistenceBackend getFallback() {
        return fallback;
    }
}
