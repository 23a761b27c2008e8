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
 * Thrown when a caller releases or writes under a lock it does not hold.
 */
public class PermissionDeniedException extends HiveMemException {
    
    public PermissionDeniedException(String message) {
        super(ErrorCode.NOT_LOCK_HOLDER, message);
    }
    
    public static PermissionDeniedException releaseByNonHolder(String key, String agentId, String holder) {
        return new PermissionDeniedException(
                "Agent " + agentId + " cannot release lock on " + key + " held by " + holder);
    }
    
    public static PermissionDeniedException writeWithoutLock(String key, String agentId) {
        return new PermissionDeniedException(
                "Agent " + agentId + " does not hold the lock required to modify locked key " + key);
    }
}
