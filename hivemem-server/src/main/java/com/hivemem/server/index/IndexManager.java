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
package com.hivemem.server.index;

import com.hivemem.core.model.DataType;
import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.MemoryEntry;
import com.hivemem.server.config.HiveMemProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derived lookup structures over the entry table: keys by namespace, by data type and by
 * owning agent, an expiration queue ordered by {@code (expiresAt, key)}, and an access-order
 * queue with the least recently used key first.
 *
 * <p>All structures are bounded. A tag that outgrows its bound is marked overflowed and
 * dropped, so lookups on it fall back to a scan. A queue that outgrows its bound is
 * truncated and flagged until the next {@link #rebuild(Collection)}. Index contents are only
 * a hint: callers re-validate every key against the entry table.
 *
 * <p>Callers update the index inside the same critical section as the entry mutation.
 */
@Slf4j
@Component
public class IndexManager {

    private static final Comparator<ExpiryKey> EXPIRY_ORDER =
            Comparator.comparing(ExpiryKey::expiresAt).thenComparing(ExpiryKey::key);

    private final HiveMemProperties.Index config;

    private final TagIndex byNamespace = new TagIndex("namespace");
    private final TagIndex byDataType = new TagIndex("dataType");
    private final TagIndex byAgent = new TagIndex("agent");

    private final TreeSet<ExpiryKey> expirationQueue = new TreeSet<>(EXPIRY_ORDER);
    private final Map<String, Instant> expiryByKey = new HashMap<>();
    private boolean expirationTruncated = false;

    private final LinkedHashSet<String> accessQueue = new LinkedHashSet<>();
    private boolean accessTruncated = false;

    public IndexManager(HiveMemProperties properties) {
        this.config = properties.getIndex();
    }

    /**
     * Index a newly stored entry. The previous version, if any, must be removed first.
     */
    public synchronized void add(MemoryEntry entry) {
        String key = entry.getKey();
        byNamespace.add(entry.getNamespace(), key);
        byDataType.add(entry.getDataType() != null ? entry.getDataType().getValue() : null, key);
        byAgent.add(entry.getAgentId(), key);

        Instant expiresAt = entry.getMetadata() != null ? entry.getMetadata().getExpiresAt() : null;
        if (expiresAt != null) {
            enqueueExpiry(key, expiresAt);
        }
        touch(key);
    }

    public synchronized void remove(MemoryEntry entry) {
        String key = entry.getKey();
        byNamespace.remove(entry.getNamespace(), key);
        byDataType.remove(entry.getDataType() != null ? entry.getDataType().getValue() : null, key);
        byAgent.remove(entry.getAgentId(), key);

        Instant expiresAt = expiryByKey.remove(key);
        if (expiresAt != null) {
            expirationQueue.remove(new ExpiryKey(expiresAt, key));
        }
        accessQueue.remove(key);
    }

    /**
     * Move a key to the most recently used end of the access queue.
     */
    public synchronized void touch(String key) {
        accessQueue.remove(key);
        accessQueue.add(key);
        if (accessQueue.size() > config.getMaxAccessQueue()) {
            String dropped = accessQueue.iterator().next();
            accessQueue.remove(dropped);
            accessTruncated = true;
        }
    }

    private void enqueueExpiry(String key, Instant expiresAt) {
        if (expirationQueue.size() >= config.getMaxExpirationQueue()) {
            ExpiryKey latest = expirationQueue.last();
            expirationTruncated = true;
            if (!expiresAt.isBefore(latest.expiresAt())) {
                return;
            }
            expirationQueue.remove(latest);
            expiryByKey.remove(latest.key());
        }
        expirationQueue.add(new ExpiryKey(expiresAt, key));
        expiryByKey.put(key, expiresAt);
    }

    /**
     * Candidate keys for a filter from the most selective usable tag index.
     * Empty when no tag index can serve the filter and a scan is needed.
     */
    public synchronized Optional<Set<String>> candidates(KeyFilter filter) {
        List<Set<String>> usable = new ArrayList<>();
        if (filter.getNamespace() != null) {
            byNamespace.lookup(filter.getNamespace()).ifPresent(usable::add);
        }
        if (filter.getDataType() != null) {
            byDataType.lookup(filter.getDataType().getValue()).ifPresent(usable::add);
        }
        if (filter.getAgentId() != null) {
            byAgent.lookup(filter.getAgentId()).ifPresent(usable::add);
        }
        return usable.stream()
                .min(Comparator.comparingInt(Set::size))
                .map(set -> (Set<String>) new HashSet<>(set));
    }

    /**
     * Keys whose TTL has passed, earliest first. Empty when the queue was truncated
     * and a full expiry scan is needed instead.
     */
    public synchronized Optional<List<String>> dueForExpiry(Instant now) {
        if (expirationTruncated) {
            return Optional.empty();
        }
        List<String> due = new ArrayList<>();
        for (ExpiryKey expiry : expirationQueue) {
            if (!expiry.expiresAt().isBefore(now)) {
                break;
            }
            due.add(expiry.key());
        }
        return Optional.of(due);
    }

    /**
     * Keys from least to most recently used. Empty when the queue was truncated
     * and callers must sort by last access instead.
     */
    public synchronized Optional<List<String>> lruOrder() {
        if (accessTruncated) {
            return Optional.empty();
        }
        return Optional.of(new ArrayList<>(accessQueue));
    }

    /**
     * Rebuild every structure from the authoritative entries, clearing overflow and truncation flags.
     */
    public synchronized void rebuild(Collection<MemoryEntry> entries) {
        clear();
        entries.stream()
                .sorted(Comparator.comparing((MemoryEntry e) -> e.getMetadata().getRecency()))
                .forEach(this::add);
        log.debug("Rebuilt indexes over {} entries", entries.size());
    }

    public synchronized void clear() {
        byNamespace.clear();
        byDataType.clear();
        byAgent.clear();
        expirationQueue.clear();
        expiryByKey.clear();
        expirationTruncated = false;
        accessQueue.clear();
        accessTruncated = false;
    }

    public synchronized boolean isExpirationTruncated() {
        return expirationTruncated;
    }

    public synchronized boolean isAccessTruncated() {
        return accessTruncated;
    }

    public synchronized boolean isOverflowed(DataType dataType) {
        return byDataType.overflowed.contains(dataType.getValue());
    }

    public synchronized boolean isNamespaceOverflowed(String namespace) {
        return byNamespace.overflowed.contains(namespace);
    }

    public synchronized Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new HashMap<>();
        sizes.put("namespaces", byNamespace.tags.size());
        sizes.put("dataTypes", byDataType.tags.size());
        sizes.put("agents", byAgent.tags.size());
        sizes.put("expirationQueue", expirationQueue.size());
        sizes.put("accessQueue", accessQueue.size());
        return sizes;
    }

    private record ExpiryKey(Instant expiresAt, String key) {
    }

    /**
     * Tag to key-set map with a per-tag bound.
     */
    private final class TagIndex {
        private final String name;
        private final Map<String, Set<String>> tags = new HashMap<>();
        private final Set<String> overflowed = new HashSet<>();

        TagIndex(String name) {
            this.name = name;
        }

        void add(String tag, String key) {
            if (tag == null || overflowed.contains(tag)) {
                return;
            }
            Set<String> keys = tags.computeIfAbsent(tag, t -> new HashSet<>());
            keys.add(key);
            if (keys.size() > config.getMaxKeysPerTag()) {
                tags.remove(tag);
                overflowed.add(tag);
                log.debug("{} index for '{}' exceeded {} keys, falling back to scans", name, tag,
                        config.getMaxKeysPerTag());
            }
        }

        void remove(String tag, String key) {
            if (tag == null) {
                return;
            }
            Set<String> keys = tags.get(tag);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    tags.remove(tag);
                }
            }
        }

        /**
         * Keys for a tag, or empty if the tag overflowed and cannot answer.
         */
        Optional<Set<String>> lookup(String tag) {
            if (overflowed.contains(tag)) {
                return Optional.empty();
            }
            return Optional.of(tags.getOrDefault(tag, Set.of()));
        }

        void clear() {
            tags.clear();
            overflowed.clear();
        }
    }
}
