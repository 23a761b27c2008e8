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
package com.hivemem.server.config;

import com.hivemem.server.persistence.FailoverPersistenceBackend;
import com.hivemem.server.persistence.FilePersistenceBackend;
import com.hivemem.server.persistence.PersistenceBackend;
import com.hivemem.server.persistence.PersistenceType;
import com.hivemem.server.persistence.SqlitePersistenceBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration for the persistence backend.
 * Creates the backend selected by {@code hivemem.persistence.type}.
 */
@Slf4j
@Configuration
public class PersistenceConfig {
    
    @Autowired
    private HiveMemProperties properties;
    
    @Bean
    public ProjectPaths projectPaths() {
        return ProjectPaths.resolve(properties.getProjectRoot());
    }
    
    @Bean(destroyMethod = "shutdown")
    @Primary
    public PersistenceBackend persistenceBackend(ProjectPaths projectPaths) {
        PersistenceBackend backend = createBackend(properties, projectPaths);
        
        backend.initialize();
        
        log.info("Persistence backend initialized: {} (available: {}, degraded: {})",
                backend.getType().getValue(), backend.isAvailable(), backend.isDegraded());
        
        return backend;
    }
    
    /**
     * Build an uninitialized backend for the configured type.
     */
    public static PersistenceBackend createBackend(HiveMemProperties properties, ProjectPaths paths) {
        String type = properties.getPersistence().getType().toLowerCase();
        log.info("Creating persistence backend of type: {}", type);
        
        PersistenceType persistenceType;
        try {
            persistenceType = PersistenceType.fromValue(type);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown persistence type '{}', defaulting to sqlite", type);
            persistenceType = PersistenceType.SQLITE;
        }
        
        return switch (persistenceType) {
            case FILE -> new FilePersistenceBackend(properties, paths);
            case SQLITE -> new FailoverPersistenceBackend(
                    new SqlitePersistenceBackend(properties, paths),
                    new FilePersistenceBackend(properties, paths),
                    properties.getPersistence().getAsyncQueueCapacity());
        };
    }
}
