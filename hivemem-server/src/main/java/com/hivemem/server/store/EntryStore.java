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

import com.fasterxml.jackson.databind.JsonNode;
import com.hivemem.core.constants.HiveMemConstants;
import com.hivemem.core.exception.HiveMemException;
import com.hivemem.core.exception.HiveMemTimeoutException;
import com.hivemem.core.exception.PermissionDeniedException;
import com.hivemem.core.exception.ResourceExhaustedException;
import com.hivemem.core.exception.RetryExhaustedException;
import com.hivemem.core.exception.SerializationException;
import com.hivemem.core.exception.ValidationException;
import com.hivemem.core.model.DataType;
import com.hivemem.core.model.EntryMetadata;
import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.MemoryEntry;
import com.hivemem.core.model.MemoryEvent;
import com.hivemem.core.model.MemoryLock;
import com.hivemem.core.model.VersionRecord;
import com.hivemem.core.util.JsonUtils;
import com.hivemem.core.util.KeyPattern;
import com.hivemem.server.config.HiveMemProperties;
import com.hivemem.server.event.EventNotifier;
import com.hivemem.server.event.MemoryEventListener;
import com.hivemem.server.event.Subscription;
import com.hivemem.server.gc.GcSummary;
import com.hivemem.server.index.IndexManager;
import com.hivemem.server.lock.LockManager;
import com.hivemem.server.lock.RetryPolicy;
import com.hivemem.server.persistence.PersistenceBackend;
import com.hivemem.server.version.VersionStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Shared, namespaced key/value store.
 *
 * <p>The in-memory entry table is the first lookup tier; the persistence backend is the
 * second and the durable copy of every non-transient entry. Memory usage and entry count
 * are hard ceilings: a write that would pass one first triggers a capacity sweep and fails
 * with {@link ResourceExhaustedException} if that is not enough.
 *
 * <p>Locking: every mutation of a key holds that key's stripe lock for its whole duration,
 * backend I/O included. The entry table, the accounting and the indexes change together
 * under one short state lock. Maintenance work ({@link #tryExpire}, {@link #tryEvict}) only
 * ever try-locks a stripe and skips keys that are busy.
 *
 * <p>Events are recorded while the stripe is held and delivered to subscribers after it is
 * released, still within the mutating call. A listener may therefore write any key.
 */
@Slf4j
@Service
public class EntryStore {

    private static final int STRIPES = 256;

    private final HiveMemProperties.Store config;
    private final HiveMemProperties.Atomic atomicConfig;
    private final boolean recordEvents;

    private final PersistenceBackend backend;
    private final LockManager lockManager;
    private final IndexManager indexManager;
    private final VersionStore versionStore;
    private final EventNotifier notifier;

    private final Map<String, MemoryEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Long> versionFloors = new ConcurrentHashMap<>();
    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    // Guarded by stateLock
    private final Object stateLock = new Object();
    private long memoryUsage = 0;
    private long entryCount = 0;
    private long pendingBytes = 0;
    private long pendingEntries = 0;

    // Statistics
    private final AtomicLong reads = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong gcRuns = new AtomicLong();
    private final AtomicLong readNanos = new AtomicLong();
    private final AtomicLong writeNanos = new AtomicLong();

    private volatile CapacityReclaimer reclaimer;
    private volatile GcSummary lastGcSummary;
    private volatile boolean partiallyLoaded = false;

    public EntryStore(HiveMemProperties properties,
                      PersistenceBackend backend,
                      LockManager lockManager,
                      IndexManager indexManager,
                      VersionStore versionStore,
                      EventNotifier notifier) {
        this.config = properties.getStore();
        this.atomicConfig = properties.getAtomic();
        this.recordEvents = properties.getPersistence().getSqlite().isRecordEvents();
        this.backend = backend;
        this.lockManager = lockManager;
        this.indexManager = indexManager;
        this.versionStore = versionStore;
        this.notifier = notifier;
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Load version floors and the persisted working set, most recently used first,
     * until a ceiling is reached.
     */
    @PostConstruct
    public void initialize() {
        long start = System.currentTimeMillis();
        Instant now = Instant.now();

        versionFloors.putAll(backend.loadVersionFloors());
        lockManager.clearStaleLocks();

        int loaded = 0;
        int skipped = 0;
        for (MemoryEntry entry : backend.loadActiveEntries(now)) {
            synchronized (stateLock) {
                if (memoryUsage + entry.getSizeBytes() > config.getMaxMemorySize()
                        || entryCount + 1 > config.getMaxEntries()) {
                    skipped++;
                    continue;
                }
                entries.put(entry.getKey(), entry);
                memoryUsage += entry.getSizeBytes();
                entryCount++;
            }
            versionFloors.merge(entry.getKey(), entry.getVersion(), Math::max);
            loaded++;
        }
        partiallyLoaded = skipped > 0;
        indexManager.rebuild(entries.values());

        if (partiallyLoaded) {
            log.warn("Loaded {} persisted entries, {} left in the backend because a ceiling was reached",
                    loaded, skipped);
        }
        log.info("Entry store initialized with {} entries ({} bytes) on {} backend in {} ms",
                loaded, memoryUsage, backend.getType().getValue(), System.currentTimeMillis() - start);
    }

    @PreDestroy
    public void shutdown() {
        try {
            backend.flush();
        } catch (HiveMemException e) {
            log.error("Final flush failed: {}", e.getMessage());
        }
        log.info("Entry store stopped with {} entries in memory", entries.size());
    }

    // ==================== Reads ====================

    public GetResult get(String key) {
        return get(key, GetOptions.defaults());
    }

    /**
     * Read an entry from memory, falling back to the backend.
     * An expired entry is never returned; finding one removes it.
     */
    public GetResult get(String key, GetOptions options) {
        validateKey(key);
        GetOptions opts = options != null ? options : GetOptions.defaults();
        long start = System.nanoTime();
        reads.incrementAndGet();
        try {
            if (opts.getVersion() != null) {
                return getVersioned(key, opts.getVersion());
            }
            GetResult result = opts.isBypassCache() ? readThrough(key) : readCached(key);
            if (result.isFound() && opts.getAgentId() != null) {
                backend.logAgentAccessAsync(opts.getAgentId(), key, HiveMemConstants.ACCESS_READ, Instant.now());
            }
            return result;
        } finally {
            readNanos.addAndGet(System.nanoTime() - start);
        }
    }

    private GetResult readCached(String key) {
        Instant now = Instant.now();
        MemoryEntry entry = entries.get(key);
        if (entry != null) {
            if (entry.isExpired(now)) {
                misses.incrementAndGet();
                expireLazily(key);
                return GetResult.notFound();
            }
            MemoryEntry snapshot = recordAccess(key, now);
            if (snapshot != null) {
                hits.incrementAndGet();
                return toResult(snapshot, true);
            }
        }
        misses.incrementAndGet();
        return loadAndPromote(key);
    }

    /**
     * Memory hit: bump access statistics and recency under the state lock.
     * @return a detached copy, or null if the entry vanished meanwhile
     */
    private MemoryEntry recordAccess(String key, Instant now) {
        MemoryEntry snapshot;
        synchronized (stateLock) {
            MemoryEntry current = entries.get(key);
            if (current == null) {
                return null;
            }
            current.getMetadata().recordAccess(now);
            indexManager.touch(key);
            snapshot = current.copy();
        }
        if (snapshot.getDataType().isPersisted()) {
            EntryMetadata metadata = snapshot.getMetadata();
            backend.updateAccessStatsAsync(key, metadata.getAccessCount(), metadata.getLastAccessed());
        }
        return snapshot;
    }

    /**
     * Memory miss: read the backend under the key's stripe so a concurrent delete cannot be undone
     * by the promotion.
     */
    private GetResult loadAndPromote(String key) {
        ReentrantLock stripe = stripeFor(key);
        stripe.lock();
        try {
            MemoryEntry raced = entries.get(key);
            if (raced != null && !raced.isExpired(Instant.now())) {
                return toResult(raced.copy(), true);
            }
            MemoryEntry stored = backend.loadEntry(key);
            if (stored == null || stored.isExpired(Instant.now())) {
                return GetResult.notFound();
            }
            stored.getMetadata().recordAccess(Instant.now());
            promote(stored);
            backend.updateAccessStatsAsync(key, stored.getMetadata().getAccessCount(),
                    stored.getMetadata().getLastAccessed());
            return toResult(stored.copy(), false);
        } finally {
            stripe.unlock();
        }
    }

    /**
     * Back-fill the entry table when capacity allows. Never fails the read.
     */
    private void promote(MemoryEntry stored) {
        synchronized (stateLock) {
            if (entries.containsKey(stored.getKey())) {
                return;
            }
            if (memoryUsage + pendingBytes + stored.getSizeBytes() > config.getMaxMemorySize()
                    || entryCount + pendingEntries + 1 > config.getMaxEntries()) {
                log.debug("Not promoting '{}': store at capacity", stored.getKey());
                return;
            }
            MemoryEntry cached = stored.copy();
            entries.put(cached.getKey(), cached);
            memoryUsage += cached.getSizeBytes();
            entryCount++;
            indexManager.add(cached);
        }
        versionFloors.merge(stored.getKey(), stored.getVersion(), Math::max);
    }

    private GetResult readThrough(String key) {
        Instant now = Instant.now();
        MemoryEntry stored = backend.loadEntry(key);
        if (stored != null && !stored.isExpired(now)) {
            misses.incrementAndGet();
            return toResult(stored, false);
        }
        MemoryEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return GetResult.notFound();
        }
        if (entry.isExpired(now)) {
            misses.incrementAndGet();
            expireLazily(key);
            return GetResult.notFound();
        }
        MemoryEntry snapshot = recordAccess(key, now);
        if (snapshot == null) {
            misses.incrementAndGet();
            return GetResult.notFound();
        }
        hits.incrementAndGet();
        return toResult(snapshot, true);
    }

    private GetResult getVersioned(String key, long version) {
        MemoryEntry current = entries.get(key);
        if (current != null && current.getVersion() == version && !current.isExpired(Instant.now())) {
            hits.incrementAndGet();
            return toResult(current.copy(), true);
        }
        Optional<VersionRecord> record = versionStore.get(key, version);
        if (record.isEmpty()) {
            misses.incrementAndGet();
            return GetResult.notFound();
        }
        misses.incrementAndGet();
        VersionRecord found = record.get();
        return GetResult.builder()
                .value(found.getValue())
                .metadata(found.getMetadata() != null ? found.getMetadata().copy() : null)
                .version(found.getVersion())
                .found(true)
                .fromCache(false)
                .build();
    }

    private void expireLazily(String key) {
        List<MemoryEvent> pending = new ArrayList<>(1);
        ReentrantLock stripe = stripeFor(key);
        stripe.lock();
        try {
            MemoryEntry entry = entries.get(key);
            if (entry != null && entry.isExpired(Instant.now())) {
                removeExpired(entry, pending);
            }
        } finally {
            stripe.unlock();
            publishEvents(pending);
        }
    }

    // ==================== Writes ====================

    public SetResult set(String key, Object value) {
        return set(key, value, SetOptions.defaults());
    }

    /**
     * Write an entry, creating it or bumping its version.
     *
     * @throws ValidationException for a malformed key or options
     * @throws SerializationException if the value cannot be serialized
     * @throws PermissionDeniedException when writing a locked entry without holding its lock
     * @throws ResourceExhaustedException if a ceiling would be passed even after a capacity sweep
     */
    public SetResult set(String key, Object value, SetOptions options) {
        validateKey(key);
        SetOptions opts = options != null ? options : SetOptions.defaults();
        String namespace = opts.getNamespace() != null ? opts.getNamespace() : HiveMemConstants.DEFAULT_NAMESPACE;
        if (namespace.isBlank()) {
            throw new ValidationException("Namespace must be a non-empty string");
        }
        DataType dataType = opts.getDataType() != null ? opts.getDataType() : DataType.PERSISTENT;
        if (opts.getTtlMs() != null && opts.getTtlMs() <= 0) {
            throw new ValidationException("TTL must be positive, got " + opts.getTtlMs());
        }

        JsonNode tree = JsonUtils.toTree(value);
        long size = JsonUtils.sizeOf(tree);
        if (size > config.getMaxMemorySize()) {
            throw ResourceExhaustedException.memoryLimit(size, config.getMaxMemorySize());
        }

        long start = System.nanoTime();
        String holder = opts.getAgentId() != null ? opts.getAgentId() : HiveMemConstants.SYSTEM_AGENT;
        MemoryLock grant = opts.isLock() ? lockManager.acquireWithRetry(key, holder, 0) : null;
        try {
            SetResult result = write(key, tree, size, namespace, dataType, opts, holder);
            writes.incrementAndGet();
            return result;
        } finally {
            if (grant != null) {
                lockManager.release(grant);
            }
            writeNanos.addAndGet(System.nanoTime() - start);
        }
    }

    private SetResult write(String key, JsonNode tree, long size, String namespace, DataType dataType,
                            SetOptions opts, String holder) {
        List<MemoryEvent> pending = new ArrayList<>(1);
        ReentrantLock stripe = stripeFor(key);
        stripe.lock();
        try {
            Instant now = Instant.now();
            MemoryEntry existing = entries.get(key);
            if (existing == null && partiallyLoaded) {
                existing = backend.loadEntry(key);
            }

            boolean lockedWrite = dataType == DataType.LOCKED
                    || (existing != null && existing.getDataType() == DataType.LOCKED && !existing.isExpired(now));
            if (lockedWrite && !lockManager.isHeldBy(key, holder)) {
                throw PermissionDeniedException.writeWithoutLock(key, holder);
            }

            Reservation reservation = reserve(key, size, pending);
            MemoryEntry entry;
            try {
                long version = nextVersion(key, existing);
                entry = buildEntry(key, tree, size, namespace, dataType, opts, existing, version, now);
                persist(entry, existing);
            } catch (RuntimeException e) {
                release(reservation);
                throw e;
            }

            synchronized (stateLock) {
                release(reservation);
                MemoryEntry previous = entries.put(key, entry);
                if (previous != null) {
                    memoryUsage -= previous.getSizeBytes();
                    entryCount--;
                    indexManager.remove(previous);
                }
                memoryUsage += entry.getSizeBytes();
                entryCount++;
                indexManager.add(entry);
            }

            stage(MemoryEvent.set(entry, opts.getAgentId()), pending);
            if (opts.getAgentId() != null) {
                backend.logAgentAccessAsync(opts.getAgentId(), key, HiveMemConstants.ACCESS_WRITE, now);
            }
            log.debug("Set '{}' v{} ({} bytes, {})", key, entry.getVersion(), size, dataType.getValue());

            return SetResult.builder()
                    .version(entry.getVersion())
                    .sizeBytes(size)
                    .expiresAt(entry.getMetadata().getExpiresAt())
                    .build();
        } finally {
            stripe.unlock();
            publishEvents(pending);
        }
    }

    private long nextVersion(String key, MemoryEntry existing) {
        long current = existing != null ? existing.getVersion() : 0L;
        long floor = versionFloors.getOrDefault(key, 0L);
        long version = Math.max(current, floor) + 1;
        versionFloors.merge(key, version, Math::max);
        return version;
    }

    private MemoryEntry buildEntry(String key, JsonNode tree, long size, String namespace, DataType dataType,
                                   SetOptions opts, MemoryEntry existing, long version, Instant now) {
        EntryMetadata previous = existing != null && !existing.isExpired(now) ? existing.getMetadata() : null;

        Long ttl = opts.getTtlMs();
        if (ttl == null && dataType == DataType.CACHED) {
            ttl = config.getCachedDefaultTtlMs();
        }

        EntryMetadata metadata = EntryMetadata.builder()
                .createdAt(previous != null && previous.getCreatedAt() != null ? previous.getCreatedAt() : now)
                .updatedAt(now)
                .expiresAt(ttl != null ? now.plusMillis(ttl) : null)
                .sizeBytes(size)
                .accessCount(previous != null ? previous.getAccessCount() : 0)
                .lastAccessed(now)
                .agentId(opts.getAgentId())
                .compressed(opts.isCompress() || size >= config.getCompressionThreshold())
                .attributes(opts.getAttributes() != null ? new LinkedHashMap<>(opts.getAttributes()) : new LinkedHashMap<>())
                .build();

        return MemoryEntry.builder()
                .key(key)
                .value(tree)
                .namespace(namespace)
                .dataType(dataType)
                .version(version)
                .metadata(metadata)
                .build();
    }

    private void persist(MemoryEntry entry, MemoryEntry existing) {
        if (entry.getDataType().isPersisted()) {
            backend.saveEntry(entry);
            if (entry.getDataType() == DataType.VERSIONED) {
                versionStore.append(entry);
            }
        } else if (existing != null && existing.getDataType().isPersisted()) {
            // Now memory only: the stale durable copy must not come back on restart
            backend.deleteEntry(entry.getKey(), false, entry.getVersion());
        }
    }

    /**
     * Write several entries one by one. A failure of one key does not stop the others.
     */
    public BulkResult setAll(List<BulkEntry> items) {
        BulkResult result = new BulkResult();
        for (BulkEntry item : items) {
            try {
                result.getWritten().put(item.getKey(), set(item.getKey(), item.getValue(), item.getOptions()));
            } catch (HiveMemException e) {
                log.debug("Bulk write of '{}' failed: {}", item.getKey(), e.getMessage());
                result.getFailed().put(String.valueOf(item.getKey()), e.getCodedMessage());
            }
        }
        return result;
    }

    // ==================== Capacity ====================

    /**
     * Capacity held for a write between the ceiling check and the commit.
     */
    private record Reservation(long bytes, long entries) {
    }

    private Reservation reserve(String key, long size, List<MemoryEvent> pending) {
        Reservation reservation = tryReserve(key, size);
        if (reservation != null) {
            return reservation;
        }

        CapacityReclaimer current = reclaimer;
        if (current != null) {
            MemoryEntry existing = entries.get(key);
            long incomingBytes = Math.max(0, size - (existing != null ? existing.getSizeBytes() : 0));
            pending.addAll(current.reclaim(incomingBytes, existing == null ? 1 : 0, key));
            reservation = tryReserve(key, size);
            if (reservation != null) {
                return reservation;
            }
        }

        synchronized (stateLock) {
            MemoryEntry existing = entries.get(key);
            long projectedBytes = memoryUsage + pendingBytes + size - (existing != null ? existing.getSizeBytes() : 0);
            if (projectedBytes > config.getMaxMemorySize()) {
                throw ResourceExhaustedException.memoryLimit(projectedBytes, config.getMaxMemorySize());
            }
            throw ResourceExhaustedException.entryLimit(entryCount + pendingEntries + 1, config.getMaxEntries());
        }
    }

    /**
     * @return the reservation, or null if a ceiling would be passed
     */
    private Reservation tryReserve(String key, long size) {
        synchronized (stateLock) {
            MemoryEntry existing = entries.get(key);
            long deltaBytes = Math.max(0, size - (existing != null ? existing.getSizeBytes() : 0));
            long deltaEntries = existing == null ? 1 : 0;
            if (deltaBytes > 0 && memoryUsage + pendingBytes + deltaBytes > config.getMaxMemorySize()) {
                return null;
            }
            if (deltaEntries > 0 && entryCount + pendingEntries + deltaEntries > config.getMaxEntries()) {
                return null;
            }
            pendingBytes += deltaBytes;
            pendingEntries += deltaEntries;
            return new Reservation(deltaBytes, deltaEntries);
        }
    }

    private void release(Reservation reservation) {
        synchronized (stateLock) {
            pendingBytes -= reservation.bytes();
            pendingEntries -= reservation.entries();
        }
    }

    // ==================== Deletes ====================

    public boolean delete(String key) {
        return delete(key, DeleteOptions.defaults());
    }

    /**
     * Remove an entry from memory and the backend.
     *
     * @return whether a live entry existed
     * @throws PermissionDeniedException when the entry is locked by another agent
     */
    public boolean delete(String key, DeleteOptions options) {
        validateKey(key);
        DeleteOptions opts = options != null ? options : DeleteOptions.defaults();
        String agent = opts.getAgentId() != null ? opts.getAgentId() : HiveMemConstants.SYSTEM_AGENT;

        List<MemoryEvent> pending = new ArrayList<>(1);
        ReentrantLock stripe = stripeFor(key);
        stripe.lock();
        try {
            Instant now = Instant.now();
            MemoryEntry existing = entries.get(key);
            if (existing != null && existing.getDataType() == DataType.LOCKED) {
                MemoryLock lock = lockManager.getLock(key);
                if (lock != null && !lock.getHolder().equals(agent)) {
                    throw PermissionDeniedException.writeWithoutLock(key, agent);
                }
            }

            boolean known = versionFloors.containsKey(key);
            long lastVersion = Math.max(existing != null ? existing.getVersion() : 0L,
                    versionFloors.getOrDefault(key, 0L));
            versionFloors.merge(key, lastVersion, Math::max);

            boolean removedFromBackend = false;
            boolean inBackend = existing != null ? existing.getDataType().isPersisted() : known || partiallyLoaded;
            if (inBackend || opts.isPurgeVersions()) {
                removedFromBackend = backend.deleteEntry(key, opts.isPurgeVersions(), lastVersion);
            }

            if (existing != null) {
                removeFromMemory(existing);
            }

            boolean existed;
            if (existing != null && existing.isExpired(now)) {
                expirations.incrementAndGet();
                stage(MemoryEvent.expired(existing), pending);
                existed = false;
            } else if (existing != null) {
                stage(MemoryEvent.deleted(existing, opts.getAgentId(), HiveMemConstants.REASON_EXPLICIT), pending);
                existed = true;
            } else if (removedFromBackend) {
                stage(MemoryEvent.builder()
                        .key(key)
                        .eventType(MemoryEvent.EventType.DELETE)
                        .version(lastVersion)
                        .agentId(opts.getAgentId())
                        .reason(HiveMemConstants.REASON_EXPLICIT)
                        .timestamp(now)
                        .build(), pending);
                existed = true;
            } else {
                existed = false;
            }

            if (existed) {
                deletes.incrementAndGet();
                if (opts.getAgentId() != null) {
                    backend.logAgentAccessAsync(opts.getAgentId(), key, HiveMemConstants.ACCESS_DELETE, now);
                }
            }
            log.debug("Delete '{}' (existed: {})", key, existed);
            return existed;
        } finally {
            stripe.unlock();
            publishEvents(pending);
        }
    }

    /**
     * Record an event in mutation order. Caller holds the key's stripe and delivers
     * {@code pending} once it is released.
     */
    private void stage(MemoryEvent event, List<MemoryEvent> pending) {
        pending.add(event);
        if (recordEvents) {
            backend.recordEventAsync(event);
        }
    }

    /**
     * Deliver staged events to subscribers. Callers must not hold any stripe.
     */
    public void publishEvents(List<MemoryEvent> events) {
        for (MemoryEvent event : events) {
            notifier.publish(event);
        }
    }

    private void removeFromMemory(MemoryEntry entry) {
        synchronized (stateLock) {
            if (entries.remove(entry.getKey(), entry)) {
                memoryUsage -= entry.getSizeBytes();
                entryCount--;
                indexManager.remove(entry);
            }
        }
    }

    /**
     * Remove an expired entry everywhere. Caller holds the key's stripe.
     */
    private long removeExpired(MemoryEntry entry, List<MemoryEvent> pending) {
        removeFromMemory(entry);
        versionFloors.merge(entry.getKey(), entry.getVersion(), Math::max);
        if (entry.getDataType().isPersisted()) {
            try {
                backend.deleteEntry(entry.getKey(), false, entry.getVersion());
            } catch (HiveMemException e) {
                log.warn("Failed to delete expired '{}' from the backend: {}", entry.getKey(), e.getMessage());
            }
        }
        expirations.incrementAndGet();
        stage(MemoryEvent.expired(entry), pending);
        return entry.getSizeBytes();
    }

    // ==================== Listing ====================

    /**
     * Keys of live entries matching a filter, sorted.
     */
    public List<String> keys(KeyFilter filter) {
        KeyFilter criteria = filter != null ? filter : KeyFilter.all();
        KeyPattern pattern = criteria.compiledPattern();
        Instant now = Instant.now();

        Collection<String> candidates = indexManager.candidates(criteria)
                .map(set -> (Collection<String>) set)
                .orElseGet(() -> new ArrayList<>(entries.keySet()));

        TreeSet<String> result = new TreeSet<>();
        for (String key : candidates) {
            MemoryEntry entry = entries.get(key);
            if (entry != null && pattern.matches(key) && criteria.matchesAttributes(entry, now)) {
                result.add(key);
            }
        }
        if (partiallyLoaded) {
            result.addAll(backend.findKeys(criteria, now));
        }
        return new ArrayList<>(result);
    }

    public List<String> keys() {
        return keys(KeyFilter.all());
    }

    // ==================== Atomic ====================

    public AtomicResult atomic(String key, UnaryOperator<JsonNode> function) {
        return atomic(key, function, AtomicOptions.defaults());
    }

    /**
     * Read-modify-write under the key lock.
     *
     * <p>Each attempt acquires the lock with backoff, reads the current value (null when absent),
     * applies the function and writes the result, releasing the lock whatever happens. A function
     * returning null leaves the entry unchanged. Failed attempts are retried as a whole, except
     * validation, permission, capacity and serialization errors which surface at once.
     *
     * @throws ValidationException if max attempts is not positive
     * @throws RetryExhaustedException once every attempt has failed
     */
    public AtomicResult atomic(String key, UnaryOperator<JsonNode> function, AtomicOptions options) {
        validateKey(key);
        AtomicOptions opts = options != null ? options : AtomicOptions.defaults();
        String holder = opts.getAgentId() != null ? opts.getAgentId() : HiveMemConstants.SYSTEM_AGENT;
        int maxAttempts = opts.getMaxAttempts() != null ? opts.getMaxAttempts() : atomicConfig.getMaxAttempts();
        long lockTtl = opts.getLockTtlMs() != null ? opts.getLockTtlMs() : atomicConfig.getLockTtlMs();
        if (maxAttempts <= 0) {
            throw new ValidationException("Atomic max attempts must be positive, got " + maxAttempts);
        }
        RetryPolicy backoff = RetryPolicy.forAtomic(atomicConfig);

        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return attemptAtomic(key, function, opts, holder, lockTtl, attempt);
            } catch (ValidationException | PermissionDeniedException
                     | ResourceExhaustedException | SerializationException e) {
                throw e;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.debug("Atomic attempt {}/{} on '{}' failed: {}", attempt, maxAttempts, key, e.getMessage());
                if (attempt < maxAttempts) {
                    backoff.pause(attempt - 1);
                }
            }
        }
        throw new RetryExhaustedException(key, maxAttempts, lastFailure);
    }

    private AtomicResult attemptAtomic(String key, UnaryOperator<JsonNode> function, AtomicOptions opts,
                                       String holder, long lockTtl, int attempt) {
        MemoryLock grant = lockManager.acquireWithRetry(key, holder, lockTtl, opts.getLockPolicy());
        try {
            MemoryEntry current = currentEntry(key);
            JsonNode currentValue = current != null ? current.getValue().deepCopy() : null;
            JsonNode next = function.apply(currentValue);
            if (next == null) {
                return AtomicResult.builder()
                        .value(currentValue)
                        .version(current != null ? current.getVersion() : 0)
                        .attempts(attempt)
                        .changed(false)
                        .build();
            }

            if (!lockManager.isLive(grant)) {
                throw HiveMemTimeoutException.lockLapsed(key);
            }
            SetResult written = set(key, next, atomicSetOptions(current, opts, holder));
            return AtomicResult.builder()
                    .value(next.deepCopy())
                    .version(written.getVersion())
                    .attempts(attempt)
                    .changed(true)
                    .build();
        } finally {
            lockManager.release(grant);
        }
    }

    private SetOptions atomicSetOptions(MemoryEntry current, AtomicOptions opts, String holder) {
        SetOptions.SetOptionsBuilder builder = SetOptions.builder().agentId(holder);

        if (opts.getNamespace() != null) {
            builder.namespace(opts.getNamespace());
        } else if (current != null) {
            builder.namespace(current.getNamespace());
        }
        if (opts.getDataType() != null) {
            builder.dataType(opts.getDataType());
        } else if (current != null) {
            builder.dataType(current.getDataType());
        }

        if (opts.getTtlMs() != null) {
            builder.ttlMs(opts.getTtlMs());
        } else if (current != null && current.getMetadata().getExpiresAt() != null) {
            long remaining = Duration.between(Instant.now(), current.getMetadata().getExpiresAt()).toMillis();
            builder.ttlMs(Math.max(1, remaining));
        }
        if (current != null && current.getMetadata().getAttributes() != null) {
            builder.attributes(new LinkedHashMap<>(current.getMetadata().getAttributes()));
        }
        return builder.build();
    }

    /**
     * Live current entry without touching access statistics.
     */
    private MemoryEntry currentEntry(String key) {
        Instant now = Instant.now();
        MemoryEntry entry = entries.get(key);
        if (entry != null) {
            return entry.isExpired(now) ? null : entry.copy();
        }
        MemoryEntry stored = backend.loadEntry(key);
        return stored != null && !stored.isExpired(now) ? stored : null;
    }

    // ==================== Locks, Subscriptions, Versions ====================

    public MemoryLock acquireLock(String key, String agentId, long ttlMs) {
        validateKey(key);
        return lockManager.acquire(key, agentId, ttlMs);
    }

    public MemoryLock acquireLock(String key, String agentId) {
        return acquireLock(key, agentId, 0);
    }

    public boolean releaseLock(String key, String agentId) {
        validateKey(key);
        return lockManager.release(key, agentId);
    }

    public Subscription subscribe(String pattern, MemoryEventListener listener) {
        return notifier.subscribe(pattern, listener);
    }

    public Subscription subscribe(String pattern, MemoryEventListener listener,
                                  Set<MemoryEvent.EventType> events, String ownerId) {
        return notifier.subscribe(pattern, listener, events, ownerId);
    }

    public boolean unsubscribe(Subscription subscription) {
        return notifier.unsubscribe(subscription);
    }

    public Optional<VersionRecord> getVersion(String key, long version) {
        validateKey(key);
        return versionStore.get(key, version);
    }

    public List<VersionRecord> listVersions(String key) {
        validateKey(key);
        return versionStore.list(key);
    }

    // ==================== Maintenance ====================

    public void registerReclaimer(CapacityReclaimer reclaimer) {
        this.reclaimer = reclaimer;
    }

    public long getProjectedMemoryUsage() {
        synchronized (stateLock) {
            return memoryUsage + pendingBytes;
        }
    }

    public long getProjectedEntryCount() {
        synchronized (stateLock) {
            return entryCount + pendingEntries;
        }
    }

    public long getMaxMemorySize() {
        return config.getMaxMemorySize();
    }

    public long getMaxEntries() {
        return config.getMaxEntries();
    }

    /**
     * Expired keys found by scanning the whole entry table.
     */
    public List<String> scanExpiredKeys(Instant now) {
        return entries.values().stream()
                .filter(entry -> entry.isExpired(now))
                .map(MemoryEntry::getKey)
                .collect(Collectors.toList());
    }

    /**
     * Keys ordered from least to most recently used, by last access time.
     */
    public List<String> keysByRecency() {
        return entries.values().stream()
                .sorted(Comparator.comparing((MemoryEntry entry) -> entry.getMetadata().getRecency())
                        .thenComparing(MemoryEntry::getKey))
                .map(MemoryEntry::getKey)
                .collect(Collectors.toList());
    }

    /**
     * Remove a key if it has expired. The EXPIRE event is added to {@code pending} for the
     * caller to deliver through {@link #publishEvents}.
     * @return bytes freed, 0 if the key is absent or live, -1 if the key is busy
     */
    public long tryExpire(String key, Instant now, List<MemoryEvent> pending) {
        ReentrantLock stripe = stripeFor(key);
        if (!stripe.tryLock()) {
            return -1;
        }
        try {
            MemoryEntry entry = entries.get(key);
            if (entry == null || !entry.isExpired(now)) {
                return 0;
            }
            return removeExpired(entry, pending);
        } finally {
            stripe.unlock();
        }
    }

    /**
     * Evict a key to free capacity. Locked entries are never evicted. The DELETE event is
     * added to {@code pending} for the caller to deliver.
     * @return bytes freed, 0 if the key is absent or not evictable, -1 if the key is busy
     */
    public long tryEvict(String key, List<MemoryEvent> pending) {
        ReentrantLock stripe = stripeFor(key);
        if (!stripe.tryLock()) {
            return -1;
        }
        try {
            MemoryEntry entry = entries.get(key);
            if (entry == null || !entry.getDataType().isEvictable()) {
                return 0;
            }
            removeFromMemory(entry);
            versionFloors.merge(key, entry.getVersion(), Math::max);
            if (entry.getDataType().isPersisted()) {
                try {
                    backend.deleteEntry(key, false, entry.getVersion());
                } catch (HiveMemException e) {
                    log.warn("Failed to delete evicted '{}' from the backend: {}", key, e.getMessage());
                }
            }
            evictions.incrementAndGet();
            stage(MemoryEvent.deleted(entry, null, HiveMemConstants.REASON_EVICTED), pending);
            return entry.getSizeBytes();
        } finally {
            stripe.unlock();
        }
    }

    public void recordSweep(GcSummary summary) {
        gcRuns.incrementAndGet();
        lastGcSummary = summary;
    }

    public void rebuildIndexes() {
        synchronized (stateLock) {
            indexManager.rebuild(new ArrayList<>(entries.values()));
        }
    }

    public boolean isPartiallyLoaded() {
        return partiallyLoaded;
    }

    // ==================== Statistics ====================

    public MemoryStats getStats() {
        long usage;
        long count;
        synchronized (stateLock) {
            usage = memoryUsage;
            count = entryCount;
        }
        long readCount = reads.get();
        long writeCount = writes.get();
        long hitCount = hits.get();
        long lookups = hitCount + misses.get();

        return MemoryStats.builder()
                .reads(readCount)
                .writes(writeCount)
                .deletes(deletes.get())
                .hits(hitCount)
                .misses(misses.get())
                .evictions(evictions.get())
                .expirations(expirations.get())
                .gcRuns(gcRuns.get())
                .memoryUsage(usage)
                .entryCount(count)
                .maxMemorySize(config.getMaxMemorySize())
                .maxEntries(config.getMaxEntries())
                .memoryUtilization(percent(usage, config.getMaxMemorySize()))
                .entryUtilization(percent(count, config.getMaxEntries()))
                .cacheHitRate(lookups > 0 ? percent(hitCount, lookups) : 0.0)
                .averageReadMicros(readCount > 0 ? readNanos.get() / 1000.0 / readCount : 0.0)
                .averageWriteMicros(writeCount > 0 ? writeNanos.get() / 1000.0 / writeCount : 0.0)
                .activeLocks(lockManager.activeLockCount())
                .activeSubscriptions(notifier.activeSubscriptions())
                .backendType(backend.getType().getValue())
                .degraded(backend.isDegraded())
                .droppedBackgroundWrites(backend.getDroppedBackgroundWrites())
                .partiallyLoaded(partiallyLoaded)
                .indexSizes(indexManager.sizes())
                .lastGcSummary(lastGcSummary)
                .build();
    }

    private static double percent(long part, long whole) {
        return whole > 0 ? part * 100.0 / whole : 0.0;
    }

    // ==================== Helpers ====================

    private ReentrantLock stripeFor(String key) {
        return stripes[(key.hashCode() & 0x7fffffff) % STRIPES];
    }

    private static GetResult toResult(MemoryEntry entry, boolean fromCache) {
        return GetResult.builder()
                .value(entry.getValue())
                .metadata(entry.getMetadata())
                .version(entry.getVersion())
                .found(true)
                .fromCache(fromCache)
                .build();
    }

    private static void validateKey(String key) {
        if (key == null) {
            throw ValidationException.invalidKey("key is null");
        }
        if (key.isBlank()) {
            throw ValidationException.invalidKey("key is blank");
        }
        if (key.length() > HiveMemConstants.MAX_KEY_LENGTH) {
            throw ValidationException.invalidKey("key longer than " + HiveMemConstants.MAX_KEY_LENGTH + " characters");
        }
        if (key.indexOf('\0') >= 0) {
            throw ValidationException.invalidKey("key contains a NUL character");
        }
    }
}
