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
 * Thrown by atomic operations once every attempt has failed. The cause is the last failure.
 */
public class RetryExhaustedException extends HiveMemException {
    
    private final int attempts;
    
    public RetryExhaustedException(String key, int attempts, Throwable cause) {
        super(ErrorCode.RETRY_EXHAUSTED,
                "Atomic operation on " + key + " failed after " + attempts + " attempts: " + cause.getMessage(),
                cause);
        this.attempts = attempts;
    }
    
    public int getAttempts() {
        return attempts;
    }
}
