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
package com.hivemem.server.version;

import com.hivemem.core.model.MemoryEntry;
import com.hivemem.core.model.VersionRecord;
import com.hivemem.server.persistence.PersistenceBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of versioned entries.
 * A record, once appended, is never changed; {@link #purge(String)} is the only removal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VersionStore {
    
    private final PersistenceBackend backend;
    
    /**
     * Append a snapshot of the entry as written.
     * @return false if a record for this (key, version) already existed and was kept
     */
    public boolean append(MemoryEntry entry) {
        VersionRecord record = VersionRecord.of(entry, Instant.now());
        boolean inserted = backend.appendVersion(record);
        if (!inserted) {
            log.warn("Version {} of '{}' already recorded, keeping the existing record",
                    entry.getVersion(), entry.getKey());
        }
        return inserted;
    }
    
    public Optional<VersionRecord> get(String key, long version) {
        return Optional.ofNullable(backend.loadVersion(key, version));
    }
    
    /**
     * All recorded versions in ascending order.
     */
    public List<VersionRecord> list(String key) {
        return backend.loadVersions(key);
    }
    
    public Optional<VersionRecord> latest(String key) {
        List<VersionRecord> records = backend.loadVersions(key);
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }
    
    public int purge(String key) {
        int purged = backend.purgeVersions(key);
        log.debug("Purged {} versions of '{}'", purged, key);
        return purged;
    }
}
