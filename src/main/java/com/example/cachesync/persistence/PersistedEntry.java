package com.example.cachesync.persistence;

import com.example.cachesync.core.CacheEntry;

/**
 * JSON form of a {@link CacheEntry}. Values come back as plain JSON structures
 * (maps, lists, strings, numbers, booleans).
 */
public class PersistedEntry {

    public Object value;
    public long createdAt;
    public long ttlMillis;
    public long accessCount;
    public long lastAccessedAt;

    public PersistedEntry() {
    }

    static PersistedEntry from(CacheEntry<Object> entry) {
        PersistedEntry persisted = new PersistedEntry();
        persisted.value = entry.getValue();
        persisted.createdAt = entry.getCreatedAt();
        persisted.ttlMillis = entry.getTtlMillis();
        persisted.accessCount = entry.getAccessCount();
        persisted.lastAccessedAt = entry.getLastAccessedAt();
        return persisted;
    }

    CacheEntry<Object> toEntry() {
        return new CacheEntry<>(value, createdAt, ttlMillis, accessCount, lastAccessedAt);
    }
}
