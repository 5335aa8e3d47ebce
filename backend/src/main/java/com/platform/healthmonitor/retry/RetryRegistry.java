package com.platform.healthmonitor.retry;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Containers with a retry task currently queued or running.
 * 
 * Used only for deduplication. {@link #tryAcquire(String)} is the single atomic
 * check-and-set that guarantees at most one retry in flight per container.
 */
@Component
public class RetryRegistry {
    
    private final Set<String> armed = ConcurrentHashMap.newKeySet();
    
    /**
     * Claim the retry slot of a container.
     * 
     * @return true if the slot was free and is now held by the caller
     */
    public boolean tryAcquire(String entityId) {
        return armed.add(entityId);
    }
    
    public void release(String entityId) {
        armed.remove(entityId);
    }
    
    public boolean isArmed(String entityId) {
        return armed.contains(entityId);
    }
    
    public int size() {
        return armed.size();
    }
    
    /**
     * Armed container ids in natural order.
     */
    public Set<String> snapshot() {
        return new TreeSet<>(armed);
    }
}
