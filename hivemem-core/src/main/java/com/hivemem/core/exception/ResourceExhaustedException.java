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
package com.hivemem.core.exception;

/**
 * Thrown when a memory or entry ceiling would be exceeded after GC, or when a
 * connection pool has no connection available within its acquire timeout.
 */
public class ResourceExhaustedException extends HiveMemException {
    
    public ResourceExhaustedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public ResourceExhaustedException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
    
    public static ResourceExhaustedException memoryLimit(long projected, long max) {
        return new ResourceExhaustedException(ErrorCode.MEMORY_LIMIT,
                "Memory limit exceeded: " + projected + " > " + max);
    }
    
    public static ResourceExhaustedException entryLimit(long projected, long max) {
        return new ResourceExhaustedException(ErrorCode.ENTRY_LIMIT,
                "Entry limit exceeded: " + projected + " > " + max);
    }
    
    public static ResourceExhaustedException poolExhausted(String pool, Throwable cause) {
        return new ResourceExhaustedException(ErrorCode.POOL_EXHAUSTED,
                "No connection available in pool '" + pool + "'", cause);
    }
}
