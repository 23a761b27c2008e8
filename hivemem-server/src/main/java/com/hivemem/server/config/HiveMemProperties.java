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

import com.hivemem.core.constants.HiveMemConstants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the HiveMem shared memory store.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hivemem")
@Validated
public class HiveMemProperties {
    
    /**
     * Base directory; data lives under {@code <projectRoot>/.hive-mind}
     */
    @NotBlank
    private String projectRoot = ".";
    
    @Valid
    private Store store = new Store();
    
    @Valid
    private Gc gc = new Gc();
    
    @Valid
    private Index index = new Index();
    
    @Valid
    private Lock lock = new Lock();
    
    @Valid
    private Atomic atomic = new Atomic();
    
    @Valid
    private Persistence persistence = new Persistence();
    
    @Data
    public static class Store {
        /**
         * Ceiling on tracked value bytes
         */
        @Min(1)
        private long maxMemorySize = HiveMemConstants.DEFAULT_MAX_MEMORY_SIZE;
        
        /**
         * Ceiling on live entries held in memory
         */
        @Min(1)
        private int maxEntries = HiveMemConstants.DEFAULT_MAX_ENTRIES;
        
        /**
         * Values at or above this serialized size are compressed when persisted
         */
        @Min(0)
        private int compressionThreshold = HiveMemConstants.DEFAULT_COMPRESSION_THRESHOLD;
        
        /**
         * TTL applied to cached entries written without one
         */
        @Min(1)
        private long cachedDefaultTtlMs = HiveMemConstants.DEFAULT_CACHED_TTL_MS;
    }
    
    @Data
    public static class Gc {
        @Min(100)
        private long intervalMs = HiveMemConstants.DEFAULT_GC_INTERVAL_MS;
        
        @Min(100)
        private long pressureCheckIntervalMs = 30000;
        
        @Min(100)
        private long expiredCleanupIntervalMs = 60000;
        
        /**
         * Usage ratio at which a sweep runs ahead of schedule
         */
        @DecimalMin("0.1")
        @DecimalMax("1.0")
        private double highWatermark = 0.8;
        
        /**
         * Usage ratio eviction brings the store down to
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lowWatermark = 0.8;
    }
    
    @Data
    public static class Index {
        @Min(1)
        private int maxKeysPerTag = 100000;
        
        @Min(1)
        private int maxExpirationQueue = 10000;
        
        @Min(1)
        private int maxAccessQueue = 50000;
    }
    
    @Data
    public static class Lock {
        @Min(1)
        private long defaultTtlMs = HiveMemConstants.DEFAULT_LOCK_TTL_MS;
        
        @Min(1)
        private int maxAttempts = 5;
        
        @Min(0)
        private long baseDelayMs = 100;
        
        @Min(0)
        private long maxDelayMs = 2000;
        
        @Min(0)
        private long jitterMs = 50;
    }
    
    @Data
    public static class Atomic {
        @Min(1)
        private int maxAttempts = 3;
        
        @Min(0)
        private long baseDelayMs = 100;
        
        @Min(0)
        private long maxDelayMs = 2000;
        
        @Min(0)
        private long jitterMs = 50;
        
        /**
         * TTL of the lock held around one read-modify-write attempt
         */
        @Min(1)
        private long lockTtlMs = 10000;
    }
    
    @Data
    public static class Persistence {
        /**
         * Persistence type: sqlite (with file fallback) or file
         */
        @NotBlank
        private String type = "sqlite";
        
        /**
         * Queued background writes per executor before new ones are dropped
         */
        @Min(1)
        private int asyncQueueCapacity = 10000;
        
        @Valid
        private Sqlite sqlite = new Sqlite();
        
        @Valid
        private File file = new File();
    }
    
    @Data
    public static class Sqlite {
        @Min(0)
        private int minPoolSize = 2;
        
        @Min(1)
        private int maxPoolSize = 10;
        
        /**
         * How long a caller waits for a pooled connection
         */
        @Min(250)
        private long connectionTimeoutMs = 10000;
        
        @Min(1000)
        private long queryTimeoutMs = 30000;
        
        @Min(1000)
        private long healthCheckIntervalMs = 60000;
        
        /**
         * Retries of a statement that hit SQLITE_BUSY
         */
        @Min(0)
        private int busyRetries = 3;
        
        /**
         * Record mutations in the memory_events table
         */
        private boolean recordEvents = true;
    }
    
    @Data
    public static class File {
        @Min(100)
        private long flushIntervalMs = 30000;
        
        @Min(0)
        private int backupRetention = 5;
        
        /**
         * Mutation events kept in the snapshot history
         */
        @Min(0)
        private int historySize = 1000;
    }
}
