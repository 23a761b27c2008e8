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
package com.hivemem.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An exclusive, TTL-bounded claim on a key. The token identifies one grant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryLock {
    
    private String key;
    
    private String holder;
    
    @Builder.Default
    private LockMode mode = LockMode.EXCLUSIVE;
    
    private Instant acquiredAt;
    
    private Instant expiresAt;
    
    private String token;
    
    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
    
    public enum LockMode {
        EXCLUSIVE
    }
}
