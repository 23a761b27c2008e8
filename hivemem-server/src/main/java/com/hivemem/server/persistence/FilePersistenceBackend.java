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

import com.hivemem.core.constants.HiveMemConstants;
import com.hivemem.core.exception.BackendUnavailableException;
import com.hivemem.core.exception.HiveMemException;
import com.hivemem.core.model.EntryMetadata;
import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.MemoryEntry;
import com.hivemem.core.model.MemoryEvent;
import com.hivemem.core.model.MemoryLock;
import com.hivemem.core.model.VersionRecord;
import com.hivemem.core.util.JsonUtils;
import com.hivemem.core.util.KeyPattern;
import com.hivemem.core.util.ValueCodec;
import com.hivemem.server.config.HiveMemProperties;
import com.hivemem.server.config.ProjectPaths;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Snapshot file implementation of PersistenceBackend.
 *
 * <p>State is held in memory and written as one JSON document to
 * {@code .hive-mind/shared-memory.json} on {@link #flush()}, which the maintenance
 * service calls periodically and which runs at shutdown. The document is written to a
 * {@code .tmp} sibling and moved into place, so a crash mid-write leaves the previous
 * snapshot intact. Each flush also drops a timestamped copy into {@code backups/}.
 */
@Slf4j
public class FilePersistenceBackend extends AbstractPersistenceBackend {

    private final HiveMemProperties.File config;
    private final ProjectPaths paths;

    private final Map<String, MemoryEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, ConcurrentSkipListMap<Long, VersionRecord>> versions = new ConcurrentHashMap<>();
    private final Map<String, Long> tombstones = new ConcurrentHashMap<>();
    private final Map<String, MemoryLock> locks = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> agentAccess = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<MemoryEvent> history = new ConcurrentLinkedDeque<>();

    private final AtomicLong flushCount = new AtomicLong();
    private final AtomicLong writeCount = new AtomicLong();

    private final Object flushLock = new Object();

    private volatile boolean dirty = false;
    private volatile boolean degraded = false;
    private volatile boolean alreadyShutdown = false;

    private Instant loadedTimestamp;
    private boolean loadedDegraded;

    public FilePersistenceBackend(HiveMemProperties properties, ProjectPaths paths) {
        super(properties.getPersistence().getAsyncQueueCapacity());
        this.config = properties.getPersistence().getFile();
        this.paths = paths;
    }

    @Override
    public PersistenceType getType() {
        return PersistenceType.FILE;
    }

    @Override
    public void initialize() {
        log.info("Initializing file persistence backend at: {}", paths.snapshotFile());

        try {
            Files.createDirectories(paths.getDataDir());
            Files.createDirectories(paths.backupDir());
        } catch (IOException e) {
            log.error("Failed to create data directory {}: {}", paths.getDataDir(), e.getMessage(), e);
            available = false;
            return;
        }

        Path snapshot = paths.snapshotFile();
        if (Files.exists(snapshot)) {
            if (!loadFrom(snapshot)) {
                loadNewestBackup();
            }
        } else {
            log.info("No snapshot found, starting empty");
        }

        available = true;
        log.info("File persistence backend initialized with {} entries", entries.size());
    }

    private boolean loadFrom(Path file) {
        try {
            SnapshotDocument document = JsonUtils.fromJson(Files.readString(file), SnapshotDocument.class);
            apply(document);
            log.info("Loaded snapshot {} ({} entries, written {})", file.getFileName(),
                    document.getEntries().size(), document.getTimestamp());
            return true;
        } catch (IOException | HiveMemException e) {
            log.error("Failed to load snapshot {}: {}", file, e.getMessage());
            return false;
        }
    }

    private void loadNewestBackup() {
        for (Path backup : listBackups()) {
            clearState();
            if (loadFrom(backup)) {
                log.warn("Recovered state from backup {}", backup.getFileName());
                return;
            }
        }
        clearState();
        log.warn("No readable snapshot or backup, starting empty");
    }

    private void apply(SnapshotDocument document) {
        document.getEntries().forEach((key, stored) -> {
            EntryMetadata metadata = document.getMetadata().getOrDefault(key, new EntryMetadata());
            metadata.setCompressed(ValueCodec.isCompressed(stored.getValue()));
            entries.put(key, MemoryEntry.builder()
                    .key(key)
                    .namespace(stored.getNamespace())
                    .dataType(stored.getDataType())
                    .version(stored.getVersion())
                    .value(ValueCodec.decode(stored.getValue()))
                    .metadata(metadata)
                    .build());
        });
        document.getVersions().forEach((key, list) -> {
            ConcurrentSkipListMap<Long, VersionRecord> records = new ConcurrentSkipListMap<>();
            for (SnapshotDocument.StoredVersion stored : list) {
                records.put(stored.getVersion(), VersionRecord.builder()
                        .key(key)
                        .version(stored.getVersion())
                        .value(ValueCodec.decode(stored.getValue()))
                        .metadata(stored.getMetadata())
                        .createdAt(stored.getCreatedAt())
                        .build());
            }
            versions.put(key, records);
        });
        tombstones.putAll(document.getTombstones());
        history.addAll(document.getHistory());
        loadedTimestamp = document.getTimestamp();
        loadedDegraded = document.isDegraded();
    }

    private void clearState() {
        entries.clear();
        versions.clear();
        tombstones.clear();
        history.clear();
    }

    @Override
    public void shutdown() {
        if (alreadyShutdown) {
            return;
        }
        alreadyShutdown = true;

        log.info("Shutting down file persistence backend...");
        shutdownAsyncExecutor();
        try {
            flush();
        } catch (BackendUnavailableException e) {
            log.error("Final snapshot write failed: {}", e.getMessage(), e);
        }
        available = false;
    }

    // ==================== Entry Operations ====================

    @Override
    public void saveEntry(MemoryEntry entry) {
        entries.put(entry.getKey(), entry.copy());
        markDirty();
    }

    @Override
    public MemoryEntry loadEntry(String key) {
        MemoryEntry entry = entries.get(key);
        return entry != null ? entry.copy() : null;
    }

    @Override
    public List<MemoryEntry> loadActiveEntries(Instant now) {
        return entries.values().stream()
                .filter(entry -> !entry.isExpired(now))
                .sorted(Comparator.comparing((MemoryEntry entry) -> entry.getMetadata().getRecency()).reversed())
                .map(MemoryEntry::copy)
                .collect(Collectors.toList());
    }

    @Override
    public boolean deleteEntry(String key, boolean purgeVersions, long lastVersion) {
        boolean existed = entries.remove(key) != null;
        tombstones.merge(key, lastVersion, Math::max);
        if (purgeVersions) {
            versions.remove(key);
        }
        markDirty();
        return existed;
    }

    @Override
    public void updateAccessStats(String key, long accessCount, Instant lastAccessed) {
        entries.computeIfPresent(key, (k, entry) -> {
            entry.getMetadata().setAccessCount(accessCount);
            entry.getMetadata().setLastAccessed(lastAccessed);
            return entry;
        });
        markDirty();
    }

    @Override
    public List<String> findKeys(KeyFilter filter, Instant now) {
        KeyPattern pattern = filter.compiledPattern();
        return entries.values().stream()
                .filter(entry -> filter.matchesAttributes(entry, now))
                .map(MemoryEntry::getKey)
                .filter(pattern::matches)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public int deleteExpiredEntries(Instant now) {
        int deleted = 0;
        for (MemoryEntry entry : entries.values()) {
            if (entry.isExpired(now) && entries.remove(entry.getKey(), entry)) {
                tombstones.merge(entry.getKey(), entry.getVersion(), Math::max);
                deleted++;
            }
        }
        if (deleted > 0) {
            markDirty();
        }
        return deleted;
    }

    @Override
    public Map<String, Long> loadVersionFloors() {
        Map<String, Long> floors = new HashMap<>(tombstones);
        entries.values().forEach(entry -> floors.merge(entry.getKey(), entry.getVersion(), Math::max));
        versions.forEach((key, records) -> {
            if (!records.isEmpty()) {
                floors.merge(key, records.lastKey(), Math::max);
            }
        });
        return floors;
    }

    // ==================== Version Operations ====================

    @Override
    public boolean appendVersion(VersionRecord record) {
        boolean inserted = versions.computeIfAbsent(record.getKey(), k -> new ConcurrentSkipListMap<>())
                .putIfAbsent(record.getVersion(), record) == null;
        if (inserted) {
            markDirty();
        }
        return inserted;
    }

    @Override
    public VersionRecord loadVersion(String key, long version) {
        ConcurrentSkipListMap<Long, VersionRecord> records = versions.get(key);
        return records != null ? records.get(version) : null;
    }

    @Override
    public List<VersionRecord> loadVersions(String key) {
        ConcurrentSkipListMap<Long, VersionRecord> records = versions.get(key);
        return records != null ? new ArrayList<>(records.values()) : new ArrayList<>();
    }

    @Override
    public int purgeVersions(String key) {
        ConcurrentSkipListMap<Long, VersionRecord> removed = versions.remove(key);
        if (removed == null) {
            return 0;
        }
        markDirty();
        return removed.size();
    }

    // ==================== Lock Mirror ====================

    @Override
    public void saveLock(MemoryLock lock) {
        locks.put(lock.getKey(), lock);
    }

    @Override
    public void removeLock(String key) {
        locks.remove(key);
    }

    @Override
    public int clearLocks() {
        int count = locks.size();
        locks.clear();
        return count;
    }

    // ==================== Access Log and Events ====================

    @Override
    public void logAgentAccess(String agentId, String key, String accessType, Instant at) {
        agentAccess.computeIfAbsent(agentId, k -> new ConcurrentHashMap<>()).put(key, accessType);
    }

    @Override
    public void recordEvent(MemoryEvent event) {
        if (config.getHistorySize() <= 0) {
            return;
        }
        history.addLast(event);
        while (history.size() > config.getHistorySize()) {
            history.pollFirst();
        }
        markDirty();
    }

    public String lastAccessType(String agentId, String key) {
        Map<String, String> accesses = agentAccess.get(agentId);
        return accesses != null ? accesses.get(key) : null;
    }

    public List<MemoryEvent> getHistory() {
        return new ArrayList<>(history);
    }

    // ==================== Snapshot ====================

    @Override
    public void flush() {
        synchronized (flushLock) {
            if (!dirty) {
                return;
            }
            dirty = false;

            SnapshotDocument document = buildDocument();
            try {
                Path target = paths.snapshotFile();
                writeAtomically(target, JsonUtils.toJson(document));
                flushCount.incrementAndGet();
                backup(target, document.getTimestamp());
                log.debug("Wrote snapshot with {} entries", document.getEntries().size());
            } catch (IOException | HiveMemException e) {
                dirty = true;
                log.error("Failed to write snapshot: {}", e.getMessage());
                throw new BackendUnavailableException("Failed to write snapshot: " + e.getMessage(), e);
            }
        }
    }

    private SnapshotDocument buildDocument() {
        SnapshotDocument document = new SnapshotDocument();
        for (MemoryEntry entry : entries.values()) {
            EntryMetadata metadata = entry.getMetadata().copy();
            document.getEntries().put(entry.getKey(), SnapshotDocument.StoredValue.builder()
                    .namespace(entry.getNamespace())
                    .dataType(entry.getDataType())
                    .version(entry.getVersion())
                    .value(ValueCodec.encode(entry.getValue(), metadata.isCompressed()))
                    .build());
            document.getMetadata().put(entry.getKey(), metadata);
        }
        versions.forEach((key, records) -> {
            List<SnapshotDocument.StoredVersion> list = new ArrayList<>();
            for (VersionRecord record : records.values()) {
                boolean compressed = record.getMetadata() != null && record.getMetadata().isCompressed();
                list.add(SnapshotDocument.StoredVersion.builder()
                        .version(record.getVersion())
                        .value(ValueCodec.encode(record.getValue(), compressed))
                        .metadata(record.getMetadata())
                        .createdAt(record.getCreatedAt())
                        .build());
            }
            document.getVersions().put(key, list);
        });
        document.getTombstones().putAll(tombstones);
        document.getHistory().addAll(history);
        document.getStats().put("entries", (long) entries.size());
        document.getStats().put("versionedKeys", (long) versions.size());
        document.getStats().put("writes", writeCount.get());
        document.getStats().put("flushes", flushCount.get() + 1);
        document.setTimestamp(Instant.now());
        document.setDegraded(degraded);
        return document;
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Path tempPath = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tempPath, content);
        try {
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported, replacing snapshot in place");
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void backup(Path snapshot, Instant timestamp) throws IOException {
        if (config.getBackupRetention() <= 0) {
            return;
        }
        Path backupFile = paths.backupDir().resolve(
                HiveMemConstants.BACKUP_PREFIX + timestamp.toEpochMilli() + ".json");
        Files.copy(snapshot, backupFile, StandardCopyOption.REPLACE_EXISTING);
        cleanupOldBackups();
    }

    private void cleanupOldBackups() {
        List<Path> backups = listBackups();
        for (int i = config.getBackupRetention(); i < backups.size(); i++) {
            try {
                Files.deleteIfExists(backups.get(i));
                log.debug("Deleted old backup {}", backups.get(i).getFileName());
            } catch (IOException e) {
                log.warn("Failed to delete old backup {}: {}", backups.get(i), e.getMessage());
            }
        }
    }

    /**
     * Backup files, newest first.
     */
    List<Path> listBackups() {
        if (!Files.isDirectory(paths.backupDir())) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(paths.backupDir())) {
            return files
                    .filter(p -> p.getFileName().toString().startsWith(HiveMemConstants.BACKUP_PREFIX))
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted(Comparator.comparingLong(FilePersistenceBackend::backupMillis).reversed())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list backups: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private static long backupMillis(Path backup) {
        String name = backup.getFileName().toString();
        String millis = name.substring(HiveMemConstants.BACKUP_PREFIX.length(), name.length() - ".json".length());
        try {
            return Long.parseLong(millis);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    // ==================== Failover Support ====================

    /**
     * Replace all entry state with the given entries and version floors.
     */
    public void replaceContents(Collection<MemoryEntry> newEntries, Map<String, Long> floors) {
        entries.clear();
        for (MemoryEntry entry : newEntries) {
            entries.put(entry.getKey(), entry.copy());
        }
        tombstones.clear();
        floors.forEach((key, version) -> {
            if (!entries.containsKey(key)) {
                tombstones.put(key, version);
            }
        });
        markDirty();
    }

    /**
     * Every stored entry, expired or not.
     */
    public List<MemoryEntry> allEntries() {
        return entries.values().stream().map(MemoryEntry::copy).collect(Collectors.toList());
    }

    public Map<String, Long> getTombstones() {
        return new HashMap<>(tombstones);
    }

    public Map<String, List<VersionRecord>> allVersions() {
        Map<String, List<VersionRecord>> copy = new HashMap<>();
        versions.forEach((key, records) -> copy.put(key, new ArrayList<>(records.values())));
        return copy;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
        markDirty();
    }

    @Override
    public boolean isDegraded() {
        return degraded;
    }

    /**
     * Whether the snapshot loaded at startup was written during a degraded session.
     */
    public boolean wasDegradedAtLoad() {
        return loadedDegraded;
    }

    public Instant getLoadedTimestamp() {
        return loadedTimestamp;
    }

    public boolean isDirty() {
        return dirty;
    }

    private void markDirty() {
        writeCount.incrementAndGet();
        dirty = true;
    }
}
