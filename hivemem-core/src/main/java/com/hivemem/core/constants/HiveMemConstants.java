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
package com.hivemem.core.constants;

/**
 * Constants used throughout HiveMem.
 */
public final class HiveMemConstants {
    
    private HiveMemConstants() {
        // Prevent instantiation
    }
    
    // Default configuration values
    public static final long DEFAULT_MAX_MEMORY_SIZE = 2L * 1024 * 1024 * 1024; // 2GB
    public static final int DEFAULT_MAX_ENTRIES = 500000;
    public static final long DEFAULT_GC_INTERVAL_MS = 300000;
    public static final int DEFAULT_COMPRESSION_THRESHOLD = 1048576; // 1MB
    public static final long DEFAULT_CACHED_TTL_MS = 3600000;
    public static final long DEFAULT_LOCK_TTL_MS = 30000;
    public static final String DEFAULT_NAMESPACE = "shared_state";
    public static final String SYSTEM_AGENT = "system";
    
    // Key validation
    public static final int MAX_KEY_LENGTH = 1024;
    
    // On-disk layout under the project root
    public static final String DATA_DIR = ".hive-mind";
    public static final String MEMORY_DB_FILE = "memory.db";
    public static final String HIVE_DB_FILE = "hive.db";
    public static final String SNAPSHOT_FILE = "shared-memory.json";
    public static final String BACKUP_DIR = "backups";
    public static final String BACKUP_PREFIX = "shared-memory-";
    
    // Value encoding
    public static final String COMPRESSED_PREFIX = "gz:";
    
    // Event reasons
    public static final String REASON_EXPLICIT = "explicit";
    public static final String REASON_EVICTED = "evicted";
    public static final String REASON_EXPIRED = "expired";
    
    // Access log types
    public static final String ACCESS_READ = "read";
    public static final String ACCESS_WRITE = "write";
    public static final String ACCESS_DELETE = "delete";
}
