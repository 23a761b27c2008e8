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
 * Thrown when a lock or operation deadline passes.
 */
public class HiveMemTimeoutException extends HiveMemException {
    
    public HiveMemTimeoutException(String message) {
        super(ErrorCode.TIMEOUT, message);
    }
    
    public HiveMemTimeoutException(String message, Throwable cause) {
        super(ErrorCode.TIMEOUT, message, cause);
    }
    
    public static HiveMemTimeoutException lockNotAcquired(String key, int attempts) {
        return new HiveMemTimeoutException(
                "Failed to acquire lock for key " + key + " after " + attempts + " attempts");
    }
    
    public static HiveMemTimeoutException lockLapsed(String key) {
        return new HiveMemTimeoutException("Lock on key " + key + " expired before the write completed");
    }
}
