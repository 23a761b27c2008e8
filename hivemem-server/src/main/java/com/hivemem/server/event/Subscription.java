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
package com.hivemem.server.event;

import com.hivemem.core.model.MemoryEvent;
import com.hivemem.core.util.KeyPattern;
import lombok.Getter;

import java.util.Collections;
import java.util.Set;

/**
 * Handle of a registered listener. Once unsubscribed, the listener is never invoked again.
 */
@Getter
public class Subscription implements AutoCloseable {
    
    private final long id;
    private final KeyPattern pattern;
    private final Set<MemoryEvent.EventType> events;
    private final String ownerId;
    
    @Getter(lombok.AccessLevel.NONE)
    private final MemoryEventListener listener;
    
    @Getter(lombok.AccessLevel.NONE)
    private final EventNotifier notifier;
    
    private volatile boolean active = true;
    
    Subscription(long id, KeyPattern pattern, Set<MemoryEvent.EventType> events, String ownerId,
                 MemoryEventListener listener, EventNotifier notifier) {
        this.id = id;
        this.pattern = pattern;
        this.events = Collections.unmodifiableSet(events);
        this.ownerId = ownerId;
        this.listener = listener;
        this.notifier = notifier;
    }
    
    boolean accepts(MemoryEvent event) {
        return active && events.contains(event.getEventType()) && pattern.matches(event.getKey());
    }
    
    void deliver(MemoryEvent event) {
        if (active) {
            listener.onEvent(event);
        }
    }
    
    void deactivate() {
        active = false;
    }
    
    /**
     * Cancel this subscription.
     * @return false if it was already cancelled
     */
    public boolean unsubscribe() {
        return notifier.unsubscribe(this);
    }
    
    @Override
    public void close() {
        unsubscribe();
    }
}
