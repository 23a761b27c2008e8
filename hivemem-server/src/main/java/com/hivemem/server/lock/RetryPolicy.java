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
package com.hivemem.server.lock;

import com.hivemem.core.exception.HiveMemTimeoutException;
import com.hivemem.server.config.HiveMemProperties;
import lombok.Builder;
import lombok.Value;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff with jitter: {@code delay = min(base * 2^attempt, max) + jitter}.
 */
@Value
@Builder
public class RetryPolicy {
    
    int maxAttempts;
    
    long baseDelayMs;
    
    long maxDelayMs;
    
    long jitterMs;
    
    public static RetryPolicy forLocks(HiveMemProperties.Lock config) {
        return RetryPolicy.builder()
                .maxAttempts(config.getMaxAttempts())
                .baseDelayMs(config.getBaseDelayMs())
                .maxDelayMs(config.getMaxDelayMs())
                .jitterMs(config.getJitterMs())
                .build();
    }
    
    public static RetryPolicy forAtomic(HiveMemProperties.Atomic config) {
        return RetryPolicy.builder()
                .maxAttempts(config.getMaxAttempts())
                .baseDelayMs(config.getBaseDelayMs())
                .maxDelayMs(config.getMaxDelayMs())
                .jitterMs(config.getJitterMs())
                .build();
    }
    
    /**
     * Delay before the retry following the given zero-based attempt.
     */
    public long delayFor(int attempt) {
        long exponential = baseDelayMs << Math.min(attempt, 30);
        if (exponential < 0 || exponential > maxDelayMs) {
            exponential = maxDelayMs;
        }
        long jitter = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0;
        return exponential + jitter;
    }
    
    /**
     * Sleep for {@link #delayFor(int)}.
     */
    public void pause(int attempt) {
        long delay = delayFor(attempt);
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HiveMemTimeoutException("Interrupted while backing off", e);
        }
    }
}
