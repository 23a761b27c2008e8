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

/**
 * Well-known namespaces. Any non-blank string is accepted as a namespace.
 */
public final class Namespaces {
    
    private Namespaces() {
        // Prevent instantiation
    }
    
    public static final String AGENT_CONTEXT = "agent_context";
    public static final String TASK_RESULTS = "task_results";
    public static final String SHARED_STATE = "shared_state";
    public static final String CROSS_AGENT = "cross_agent";
    public static final String CACHE = "cache";
    public static final String TEMP = "temp";
    public static final String CONFIG = "config";
    public static final String METRICS = "metrics";
}
