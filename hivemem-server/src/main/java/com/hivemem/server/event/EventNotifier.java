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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pub/sub for entry mutations.
 * Delivery is synchronous on the mutating thread; a listener that throws is logged and
 * skipped without affecting the mutation or the other listeners.
 */
@Slf4j
@Component
public class EventNotifier {
    
    private static final Set<MemoryEvent.EventType> ALL_EVENTS = EnumSet.allOf(MemoryEvent.EventType.class);
    
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong listenerErrors = new AtomicLong();
    
    /**
     * Subscribe to set, delete and expire events on keys matching the pattern.
     */
    public Subscription subscribe(String pattern, MemoryEventListener listener) {
        return subscribe(pattern, listener, ALL_EVENTS, null);
    }
    
    /**
     * Subscribe to the given event types on keys matching the pattern.
     * @param events empty or null means every event type
     */
    public Subscription subscribe(String pattern, MemoryEventListener listener,
                                  Set<MemoryEvent.EventType> events, String ownerId) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        Set<MemoryEvent.EventType> filter = events == null || events.isEmpty()
                ? EnumSet.copyOf(ALL_EVENTS) : EnumSet.copyOf(events);
        Subscription subscription = new Subscription(nextId.getAndIncrement(), KeyPattern.compile(pattern),
                filter, ownerId, listener, this);
        subscriptions.add(subscription);
        log.debug("Subscription {} registered for {} on {}", subscription.getId(), subscription.getPattern(), filter);
        return subscription;
    }
    
    /**
     * @return false if the subscription was not registered
     */
    public boolean unsubscribe(Subscription subscription) {
        subscription.deactivate();
        boolean removed = subscriptions.remove(subscription);
        if (removed) {
            log.debug("Subscription {} cancelled", subscription.getId());
        }
        return removed;
    }
    
    /**
     * Cancel every subscription of an owner.
     * @return number of subscriptions cancelled
     */
    public int unsubscribeOwner(String ownerId) {
        int count = 0;
        for (Subscription subscription : subscriptions) {
            if (ownerId != null && ownerId.equals(subscription.getOwnerId()) && unsubscribe(subscription)) {
                count++;
            }
        }
        return count;
    }
    
    /**
     * Deliver an event to every matching subscription.
     * @return number of listeners invoked
     */
    public int publish(MemoryEvent event) {
        int count = 0;
        for (Subscription subscription : subscriptions) {
            if (!subscription.accepts(event)) {
                continue;
            }
            try {
                subscription.deliver(event);
                count++;
            } catch (Exception e) {
                listenerErrors.incrementAndGet();
                log.warn("Subscription {} listener failed on {} of '{}': {}", subscription.getId(),
                        event.getEventType().getValue(), event.getKey(), e.getMessage());
            }
        }
        delivered.addAndGet(count);
        return count;
    }
    
    public int activeSubscriptions() {
        return subscriptions.size();
    }
    
    public long getDeliveredCount() {
        return delivered.get();
    }
    
    public long getListenerErrorCount() {
        return listenerErrors.get();
    }
}
