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
import com.hivemem.server.config.ProjectPaths;
import com.hivemem.server.persistence.FilePersistenceBackend;
import com.hivemem.server.support.StoreHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LockManagerTest {

    @TempDir
    Path root;

    private FilePersistenceBackend backend;
    private LockManager locks;

    @BeforeEach
    void setUp() {
        HiveMemProperties properties = StoreHarness.properties(root, "file");
        backend = new FilePersistenceBackend(properties, ProjectPaths.resolve(root.toString()));
        backend.initialize();
        locks = new LockManager(properties, backend);
    }

    @AfterEach
    void tearDown() {
        backend.shutdown();
    }

    @Test
    void secondHolderConflictsUntilTheTtlPasses() throws Exception {
        MemoryLock grant = locks.acquire("job:42", "A", 200);
        assertEquals("A", grant.getHolder());
        assertEquals(MemoryLock.LockMode.EXCLUSIVE, grant.getMode());
        assertNotNull(grant.getToken());

        ConflictException conflict = assertThrows(ConflictException.class, () -> locks.acquire("job:42", "B", 200));
        assertEquals("A", conflict.getHolder());

        Thread.sleep(250);

        MemoryLock taken = locks.acquire("job:42", "B", 200);
        assertEquals("B", taken.getHolder());
        assertTrue(locks.isHeldBy("job:42", "B"));
    }

    @Test
    void negativeTtlIsRejectedAndZeroTakesTheDefault() {
        assertThrows(ValidationException.class, () -> locks.acquire("k", "A", -1));
        assertNull(locks.getLock("k"));

        MemoryLock grant = locks.acquire("k", "A", 0);
        long granted = grant.getExpiresAt().toEpochMilli() - grant.getAcquiredAt().toEpochMilli();
        assertEquals(locks.getDefaultTtlMs(), granted);
    }

    @Test
    void acquisitionIsNotReentrant() {
        locks.acquire("k", "A", 5000);
        assertThrows(ConflictException.class, () -> locks.acquire("k", "A", 5000));
    }

    @Test
    void releaseRequiresTheHolder() {
        locks.acquire("k", "A", 5000);

        assertThrows(PermissionDeniedException.class, () -> locks.release("k", "B"));
        assertTrue(locks.isHeldBy("k", "A"));

        assertTrue(locks.release("k", "A"));
        assertFalse(locks.release("k", "A"));
        assertNull(locks.getLock("k"));
    }

    @Test
    void releasingAnExpiredLockReportsNothingReleased() throws Exception {
        locks.acquire("k", "A", 50);
        Thread.sleep(80);
        assertFalse(locks.release("k", "B"));
    }

    @Test
    void staleGrantDoesNotReleaseANewerLock() throws Exception {
        MemoryLock stale = locks.acquire("k", "A", 50);
        Thread.sleep(80);
        assertFalse(locks.isLive(stale));

        MemoryLock fresh = locks.acquire("k", "B", 5000);
        assertFalse(locks.release(stale));
        assertTrue(locks.isLive(fresh));
        assertTrue(locks.release(fresh));
    }

    @Test
    void defaultTtlAppliesWhenNoneIsGiven() {
        MemoryLock grant = locks.acquire("k", "A", 0);
        long ttl = grant.getExpiresAt().toEpochMilli() - grant.getAcquiredAt().toEpochMilli();
        assertEquals(locks.getDefaultTtlMs(), ttl);
    }

    @Test
    void acquireWithRetryWaitsForTheLockToLapse() {
        locks.acquire("k", "A", 60);
        RetryPolicy patient = RetryPolicy.builder().maxAttempts(20).baseDelayMs(10).maxDelayMs(20).jitterMs(0).build();

        MemoryLock grant = locks.acquireWithRetry("k", "B", 1000, patient);
        assertEquals("B", grant.getHolder());
    }

    @Test
    void acquireWithRetryGivesUpWithTimeout() {
        locks.acquire("k", "A", 60000);
        RetryPolicy impatient = RetryPolicy.builder().maxAttempts(3).baseDelayMs(1).maxDelayMs(2).jitterMs(0).build();

        assertThrows(HiveMemTimeoutException.class, () -> locks.acquireWithRetry("k", "B", 1000, impatient));
    }

    @Test
    void purgeDropsOnlyExpiredLocks() throws Exception {
        locks.acquire("short", "A", 30);
        locks.acquire("long", "A", 60000);
        Thread.sleep(60);

        assertEquals(1, locks.activeLockCount());
        assertEquals(1, locks.purgeExpired());
        assertEquals(0, locks.purgeExpired());
        assertTrue(locks.isHeldBy("long", "A"));
    }

    @Test
    void blankKeyOrHolderIsRejected() {
        assertThrows(ValidationException.class, () -> locks.acquire(" ", "A", 100));
        assertThrows(ValidationException.class, () -> locks.acquire("k", null, 100));
    }

    @Test
    void staleLocksFromAPreviousSessionAreCleared() {
        backend.saveLock(MemoryLock.builder().key("old").holder("ghost")
                .acquiredAt(Instant.now()).expiresAt(Instant.now().plusSeconds(60))
                .token("t").build());
        locks.clearStaleLocks();
        assertEquals(0, backend.clearLocks());
    }
}
