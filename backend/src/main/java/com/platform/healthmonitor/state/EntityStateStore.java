package com.platform.healthmonitor.state;

import com.platform.healthmonitor.model.EntityRecord;
import com.platform.healthmonitor.model.EntityStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last observed status of every tracked container.
 * 
 * Every operation is atomic with respect to the others. Sequences of calls are not:
 * callers read, decide and write explicitly, and concurrent writers of the same
 * container resolve as last-write-wins.
 */
@Slf4j
@Component
public class EntityStateStore {
    
    private final Map<String, EntityRecord> records = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    
    public Optional<EntityRecord> get(String entityId) {
        lock.lock();
        try {
            return Optional.ofNullable(records.get(entityId));
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Status currently tracked for a container, UNKNOWN when untracked.
     */
    public EntityStatus statusOf(String entityId) {
        return get(entityId).map(EntityRecord::status).orElse(EntityStatus.UNKNOWN);
    }
    
    /**
     * Create or replace the record of a container.
     * A null group keeps the previously recorded group.
     */
    public EntityRecord upsert(String entityId, EntityStatus status, String group, Instant checkedAt) {
        lock.lock();
        try {
            EntityRecord existing = records.get(entityId);
            String effectiveGroup = group != null ? group
                : existing != null ? existing.group() : "unknown";
            
            EntityRecord updated = new EntityRecord(entityId, effectiveGroup, status, checkedAt);
            records.put(entityId, updated);
            
            if (existing == null) {
                log.debug("Started tracking {} [{}] as {}", entityId, effectiveGroup, status);
            }
            return updated;
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<EntityRecord> remove(String entityId) {
        lock.lock();
        try {
            EntityRecord removed = records.remove(entityId);
            if (removed != null) {
                log.debug("Stopped tracking {} [{}]", entityId, removed.group());
            }
            return Optional.ofNullable(removed);
        } finally {
            lock.unlock();
        }
    }
    
    public Set<String> snapshotIds() {
        lock.lock();
        try {
            return Set.copyOf(records.keySet());
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * All records, ordered by container id.
     */
    public List<EntityRecord> snapshot() {
        lock.lock();
        try {
            return records.values().stream()
                .sorted(Comparator.comparing(EntityRecord::entityId))
                .toList();
        } finally {
            lock.unlock();
        }
    }
    
    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }
}
