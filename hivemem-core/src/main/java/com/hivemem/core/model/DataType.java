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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.hivemem.core.exception.ValidationException;

/**
 * Persistence and access policy of an entry.
 */
public enum DataType {
    /** Survives process restarts */
    PERSISTENT("persistent"),
    /** Memory only, cleared on restart */
    TRANSIENT("transient"),
    /** Persisted, expires after the default cache TTL unless one is given */
    CACHED("cached"),
    /** Persisted with a full version history */
    VERSIONED("versioned"),
    /** Cross-agent shared data */
    SHARED("shared"),
    /** Writes require holding the key lock; never evicted */
    LOCKED("locked");
    
    private final String value;
    
    DataType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public boolean isPersisted() {
        return this != TRANSIENT;
    }
    
    public boolean isEvictable() {
        return this != LOCKED;
    }
    
    @JsonCreator
    public static DataType fromValue(String value) {
        for (DataType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException("Unknown data type: " + value);
    }
}
