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

/**
 * Persistence backend types.
 */
public enum PersistenceType {
    SQLITE("sqlite"),
    FILE("file");
    
    private final String value;
    
    PersistenceType(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    public static PersistenceType fromValue(String value) {
        for (PersistenceType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown persistence type: " + value);
    }
}
