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

import com.hivemem.core.model.MemoryEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for persistence backends with the background write executors.
 * 
 * <p>Background writes (access statistics, access log, event log) run on 4 single-thread
 * executors. Each key is consistently mapped to one executor, so writes for a key stay
 * in order while different keys proceed in parallel.
 * 
 * <p>Each executor queues a bounded number of writes. A write that finds its queue full is
 * dropped and counted. Access statistics for a key are coalesced: while one update is queued,
 * later ones only replace the values it will write.
 */
@Slf4j
public abstract class AbstractPersistenceBackend implements PersistenceBackend {
    
    public static final int DEFAULT_ASYNC_QUEUE_CAPACITY = 10_000;
    
    protected volatile boolean available = false;
    
    private static final int EXECUTOR_COUNT = 4;
    
    private final ExecutorService[] asyncExecutors = new ExecutorService[EXECUTOR_COUNT];
    
    private final Map<String, AccessStats> pendingAccessStats = new ConcurrentHashMap<>();
    
    private final AtomicLong droppedWrites = new AtomicLong();
    
    // Rejects new background writes once shutdown starts
    protected volatile boolean asyncShuttingDown = false;
    
    private record AccessStats(long accessCount, Instant lastAccessed) {
    }
    
    protected AbstractPersistenceBackend() {
        this(DEFAULT_ASYNC_QUEUE_CAPACITY);
    }
    
    protected AbstractPersistenceBackend(int asyncQueueCapacity) {
        int capacity = Math.max(1, asyncQueueCapacity);
        String prefix = getClass().getSimpleName().toLowerCase().replace("persistencebackend", "");
        for (int i = 0; i < EXECUTOR_COUNT; i++) {
            final int executorId = i;
            asyncExecutors[i] = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(capacity),
                    r -> {
                        Thread t = new Thread(r, "hivemem-" + prefix + "-async-" + executorId);
                        t.setDaemon(true);
                        return t;
                    },
                    new ThreadPoolExecutor.AbortPolicy());
        }
    }
    
    private ExecutorService executorFor(String key) {
        int index = Math.abs(key.hashCode() % EXECUTOR_COUNT);
        return asyncExecutors[index];
    }
    
    @Override
    public boolean isAvailable() {
        return available;
    }
    
    @Override
    public CompletableFuture<Void> updateAccessStatsAsync(String key, long accessCount, Instant lastAccessed) {
        if (pendingAccessStats.put(key, new AccessStats(accessCount, lastAccessed)) != null) {
            return CompletableFuture.completedFuture(null);
        }
        return runAsync(key, "access stats", () -> {
            AccessStats latest = pendingAccessStats.remove(key);
            if (latest != null) {
                updateAccessStats(key, latest.accessCount(), latest.lastAccessed());
            }
        }, () -> pendingAccessStats.remove(key));
    }
    
    @Override
    public CompletableFuture<Void> logAgentAccessAsync(String agentId, String key, String accessType, Instant at) {
        return runAsync(key, "agent access", () -> logAgentAccess(agentId, key, accessType, at));
    }
    
    @Override
    public CompletableFuture<Void> recordEventAsync(MemoryEvent event) {
        return runAsync(event.getKey(), "event", () -> recordEvent(event));
    }
    
    @Override
    public long getDroppedBackgroundWrites() {
        return droppedWrites.get();
    }
    
    /**
     * Run a best-effort write on the key's executor. Failures are logged, never rethrown.
     * The returned future completes once the write has run or has been dropped.
     */
    protected CompletableFuture<Void> runAsync(String key, String what, Runnable task) {
        return runAsync(key, what, task, () -> { });
    }
    
    private CompletableFuture<Void> runAsync(String key, String what, Runnable task, Runnable onDropped) {
        if (asyncShuttingDown) {
            log.debug("Rejecting background {} write during shutdown for key: {}", what, key);
            onDropped.run();
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            executorFor(key).execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("Background {} write failed for key '{}': {}", what, key, e.getMessage());
                } finally {
                    done.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            onDropped.run();
            long dropped = droppedWrites.incrementAndGet();
            if (dropped == 1 || dropped % 1000 == 0) {
                log.warn("Background write queue full, dropped {} write for key '{}' ({} dropped so far)",
                        what, key, dropped);
            } else {
                log.debug("Dropped background {} write for key '{}'", what, key);
            }
            done.complete(null);
        }
        return done;
    }
    
    /**
     * Shutdown the background executors and wait for pending writes.
     * Called by subclass shutdown methods BEFORE closing their storage.
     */
    protected void shutdownAsyncExecutor() {
        asyncShuttingDown = true;
        
        for (ExecutorService executor : asyncExecutors) {
            executor.shutdown();
        }
        
        try {
            for (int i = 0; i < EXECUTOR_COUNT; i++) {
                if (!asyncExecutors[i].awaitTermination(30, TimeUnit.SECONDS)) {
                    List<Runnable> pending = asyncExecutors[i].shutdownNow();
                    log.warn("Dropped {} pending background writes from executor {}", pending.size(), i);
                }
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for background writes, forcing shutdown");
            for (ExecutorService executor : asyncExecutors) {
                executor.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
    }
}
