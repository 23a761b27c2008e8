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

import com.hivemem.core.exception.HiveMemException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled snapshot flushes and backend health checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersistenceMaintenanceService {
    
    private final PersistenceBackend backend;
    
    @Scheduled(fixedDelayString = "${hivemem.persistence.file.flush-interval-ms:30000}",
            initialDelayString = "${hivemem.persistence.file.flush-interval-ms:30000}")
    public void flushSnapshot() {
        try {
            backend.flush();
        } catch (HiveMemException e) {
            log.warn("Scheduled snapshot flush failed: {}", e.getMessage());
        }
    }
    
    @Scheduled(fixedDelayString = "${hivemem.persistence.sqlite.health-check-interval-ms:60000}",
            initialDelayString = "${hivemem.persistence.sqlite.health-check-interval-ms:60000}")
    public void healthCheck() {
        try {
            backend.healthCheck();
        } catch (RuntimeException e) {
            log.warn("Backend health check failed: {}", e.getMessage());
        }
    }
}
