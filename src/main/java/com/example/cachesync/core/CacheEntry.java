package com.example.cachesync.core;

public class CacheEntry<V> {

    private final V value;
    private final long createdAt;      // epoch millis of the write
    private final long ttlMillis;
    private long accessCount;
    private long lastAccessedAt;

    public CacheEntry(V value, long createdAt, long ttlMillis) {
        this(value, createdAt, ttlMillis, 1, createdAt);
    }

    public CacheEntry(V value, long createdAt, long ttlMillis, long accessCount, long lastAccessedAt) {
        this.value = value;
        this.createdAt = createdAt;
        this.ttlMillis = ttlMillis;
        this.accessCount = accessCount;
        this.lastAccessedAt = lastAccessedAt;
    }

    public V getValue() {
        return value;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getTtlMillis() {
        return ttlMillis;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    public boolean isExpired(long now) {
        return now - createdAt > ttlMillis;
    }

    void recordAccess(long now) {
        accessCount++;
        lastAccessedAt = now;
    }

    CacheEntry<V> copy() {
        return new CacheEntry<>(value, createdAt, ttlMillis, accessCount, lastAccessedAt);
    }

    @Override
    public String toString() {
        return "CacheEntry{value=" + value + ", createdAt=" + createdAt + ", ttlMillis=" + ttlMillis
            + ", accessCount=" + accessCount + "}";
    }
}
