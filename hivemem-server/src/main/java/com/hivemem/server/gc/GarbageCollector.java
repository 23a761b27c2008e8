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

import com.hivemem.core.exception.HiveMemException;
import com.hivemem.core.model.MemoryEvent;
import com.hivemem.server.config.HiveMemProperties;
import com.hivemem.server.index.IndexManager;
import com.hivemem.server.lock.LockManager;
import com.hivemem.server.persistence.PersistenceBackend;
import com.hivemem.server.store.CapacityReclaimer;
import com.hivemem.server.store.EntryStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Removes expired entries and locks, and evicts least recently used entries under memory pressure.
 *
 * <p>Sweeps work key by key through {@link EntryStore#tryExpire} and {@link EntryStore#tryEvict},
 * which skip keys being mutated, so a sweep never blocks writers for its whole duration.
 * Only one sweep runs at a time; a scheduled sweep that finds another one running is skipped.
 * Removal events reach subscribers after the sweep lock is released.
 */
@Slf4j
@Service
public class GarbageCollector implements CapacityReclaimer {

    private final EntryStore entryStore;
    private final IndexManager indexManager;
    private final LockManager lockManager;
    private final PersistenceBackend backend;
    private final HiveMemProperties.Gc config;

    private final ReentrantLock sweepLock = new ReentrantLock();
    private final List<Consumer<GcSummary>> sweepListeners = new CopyOnWriteArrayList<>();

    private volatile GcSummary lastSummary;

    public GarbageCollector(EntryStore entryStore, IndexManager indexManager, LockManager lockManager,
                            PersistenceBackend backend, HiveMemProperties properties) {
        this.entryStore = entryStore;
        this.indexManager = indexManager;
        this.lockManager = lockManager;
        this.backend = backend;
        this.config = properties.getGc();
    }

    @PostConstruct
    public void registerWithStore() {
        entryStore.registerReclaimer(this);
        log.info("Garbage collector registered: full sweep every {} ms, pressure check every {} ms, watermarks {}/{}",
                config.getIntervalMs(), config.getPressureCheckIntervalMs(),
                config.getHighWatermark(), config.getLowWatermark());
    }

    @PreDestroy
    public void shutdown() {
        SweepCounts counts = new SweepCounts();
        sweepLock.lock();
        try {
            publish(runFullSweep(GcSummary.Trigger.SHUTDOWN, counts));
        } catch (HiveMemException e) {
            log.warn("Final sweep failed: {}", e.getMessage());
        } finally {
            sweepLock.unlock();
            entryStore.publishEvents(counts.events);
        }
    }

    // ==================== Scheduled Triggers ====================

    @Scheduled(fixedDelayString = "${hivemem.gc.interval-ms:300000}",
               initialDelayString = "${hivemem.gc.interval-ms:300000}")
    public void scheduledSweep() {
        sweepIfIdle(GcSummary.Trigger.SCHEDULED);
    }

    /**
     * Sweep ahead of schedule once usage or entry count passes the high watermark.
     */
    @Scheduled(fixedDelayString = "${hivemem.gc.pressure-check-interval-ms:30000}",
               initialDelayString = "${hivemem.gc.pressure-check-interval-ms:30000}")
    public void checkMemoryPressure() {
        if (isUnderPressure()) {
            log.debug("Memory pressure detected ({} bytes, {} entries)",
                    entryStore.getProjectedMemoryUsage(), entryStore.getProjectedEntryCount());
            sweepIfIdle(GcSummary.Trigger.PRESSURE);
        }
    }

    @Scheduled(fixedDelayString = "${hivemem.gc.expired-cleanup-interval-ms:60000}",
               initialDelayString = "${hivemem.gc.expired-cleanup-interval-ms:60000}")
    public void expiredCleanup() {
        if (!sweepLock.tryLock()) {
            return;
        }
        SweepCounts counts = new SweepCounts();
        try {
            long start = System.currentTimeMillis();
            expireEntries(counts);
            publish(counts.toSummary(GcSummary.Trigger.EXPIRED_ONLY, start));
        } finally {
            sweepLock.unlock();
            entryStore.publishEvents(counts.events);
        }
    }

    /**
     * Run a full sweep now, waiting for a running sweep to finish first.
     */
    public GcSummary runNow() {
        SweepCounts counts = new SweepCounts();
        sweepLock.lock();
        try {
            GcSummary summary = runFullSweep(GcSummary.Trigger.MANUAL, counts);
            publish(summary);
            return summary;
        } finally {
            sweepLock.unlock();
            entryStore.publishEvents(counts.events);
        }
    }

    private void sweepIfIdle(GcSummary.Trigger trigger) {
        if (!sweepLock.tryLock()) {
            log.debug("Skipping {} sweep, another sweep is running", trigger);
            return;
        }
        SweepCounts counts = new SweepCounts();
        try {
            publish(runFullSweep(trigger, counts));
        } catch (HiveMemException e) {
            log.warn("{} sweep failed: {}", trigger, e.getMessage());
        } finally {
            sweepLock.unlock();
            entryStore.publishEvents(counts.events);
        }
    }

    // ==================== Capacity ====================

    /**
     * Called by a write that would pass a ceiling. Expires first, then evicts least recently
     * used entries until the write fits below the low watermark. Removal events go back to
     * the writer, which still holds its own key.
     */
    @Override
    public List<MemoryEvent> reclaim(long incomingBytes, int incomingEntries, String protectedKey) {
        SweepCounts counts = new SweepCounts();
        sweepLock.lock();
        try {
            long start = System.currentTimeMillis();
            expireEntries(counts);
            evict(counts, incomingBytes, incomingEntries, protectedKey);
            publish(counts.toSummary(GcSummary.Trigger.CAPACITY, start));
        } finally {
            sweepLock.unlock();
        }
        return counts.events;
    }

    // ==================== Sweep Steps ====================

    private GcSummary runFullSweep(GcSummary.Trigger trigger, SweepCounts counts) {
        long start = System.currentTimeMillis();

        expireEntries(counts);
        counts.locksExpired = lockManager.purgeExpired();

        try {
            counts.backendRowsDeleted = backend.deleteExpiredEntries(Instant.now());
        } catch (HiveMemException e) {
            log.warn("Failed to delete expired rows from the backend: {}", e.getMessage());
        }

        // Eviction deletes entries outright, so a shutdown sweep only expires
        if (trigger != GcSummary.Trigger.SHUTDOWN && isUnderPressure()) {
            evict(counts, 0, 0, null);
        }

        if (indexManager.isExpirationTruncated() || indexManager.isAccessTruncated()) {
            entryStore.rebuildIndexes();
        }
        return counts.toSummary(trigger, start);
    }

    private void expireEntries(SweepCounts counts) {
        Instant now = Instant.now();
        List<String> due = indexManager.dueForExpiry(now)
                .orElseGet(() -> entryStore.scanExpiredKeys(now));
        for (String key : due) {
            long freed = entryStore.tryExpire(key, now, counts.events);
            if (freed > 0) {
                counts.expired++;
                counts.bytesFreed += freed;
            }
        }
    }

    private void evict(SweepCounts counts, long incomingBytes, int incomingEntries, String protectedKey) {
        long bytesTarget = (long) (entryStore.getMaxMemorySize() * config.getLowWatermark());
        long entriesTarget = (long) (entryStore.getMaxEntries() * config.getLowWatermark());

        List<String> order = indexManager.lruOrder().orElseGet(entryStore::keysByRecency);
        for (String key : order) {
            boolean bytesOver = entryStore.getProjectedMemoryUsage() + incomingBytes > bytesTarget;
            boolean entriesOver = entryStore.getProjectedEntryCount() + incomingEntries > entriesTarget;
            if (!bytesOver && !entriesOver) {
                break;
            }
            if (key.equals(protectedKey)) {
                continue;
            }
            long freed = entryStore.tryEvict(key, counts.events);
            if (freed > 0) {
                counts.evicted++;
                counts.bytesFreed += freed;
            }
        }
    }

    private boolean isUnderPressure() {
        double memoryRatio = ratio(entryStore.getProjectedMemoryUsage(), entryStore.getMaxMemorySize());
        double entryRatio = ratio(entryStore.getProjectedEntryCount(), entryStore.getMaxEntries());
        return memoryRatio >= config.getHighWatermark() || entryRatio >= config.getHighWatermark();
    }

    private static double ratio(long value, long max) {
        return max > 0 ? (double) value / max : 0.0;
    }

    // ==================== Summaries ====================

    private void publish(GcSummary summary) {
        lastSummary = summary;
        entryStore.recordSweep(summary);
        if (summary.didWork()) {
            log.info("GC {}: {} expired, {} evicted, {} locks expired, {} backend rows, {} bytes freed in {} ms",
                    summary.getTrigger(), summary.getExpired(), summary.getEvicted(), summary.getLocksExpired(),
                    summary.getBackendRowsDeleted(), summary.getBytesFreed(), summary.getDurationMs());
        } else {
            log.debug("GC {}: nothing to collect ({} ms)", summary.getTrigger(), summary.getDurationMs());
        }
        for (Consumer<GcSummary> listener : sweepListeners) {
            try {
                listener.accept(summary);
            } catch (Exception e) {
                log.warn("Sweep listener failed: {}", e.getMessage());
            }
        }
    }

    public void addSweepListener(Consumer<GcSummary> listener) {
        sweepListeners.add(listener);
    }

    public void removeSweepListener(Consumer<GcSummary> listener) {
        sweepListeners.remove(listener);
    }

    public GcSummary getLastSummary() {
        return lastSummary;
    }

    private static final class SweepCounts {
        int expired;
        int evicted;
        int locksExpired;
        int backendRowsDeleted;
        long bytesFreed;
        final List<MemoryEvent> events = new ArrayList<>();

        GcSummary toSummary(GcSummary.Trigger trigger, long start) {
            return GcSummary.builder()
                    .trigger(trigger)
                    .expired(expired)
                    .evicted(evicted)
                    .locksExpired(locksExpired)
                    .backendRowsDeleted(backendRowsDeleted)
                    .bytesFreed(bytesFreed)
                    .durationMs(System.currentTimeMillis() - start)
                    .timestamp(Instant.now())
                    .build();
        }
    }
}
