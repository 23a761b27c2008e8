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
 * Thrown when a live lock on the key is held by someone.
 */
public class ConflictException extends HiveMemException {
    
    private final String holder;
    
    public ConflictException(String key, String holder) {
        super(ErrorCode.LOCK_CONFLICT, "Key " + key + " is already locked by agent " + holder);
        this.holder = holder;
    }
    
    public String getHolder() {
        return holder;
    }
}
