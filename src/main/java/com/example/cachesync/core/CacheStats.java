package com.example.cachesync.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time diagnostics. Rates are percentages of facade lookups.
 */
public final class CacheStats {

    private final long hits;
    private final long misses;
    private final long evictionCount;
    private final int size;
    private final long memoryUsage;
    private final Map<String, Long> topAccessedKeys;
    private final int pendingCalls;
    private final long coalescedCalls;

    public CacheStats(long hits, long misses, long evictionCount, int size, long memoryUsage,
                      Map<String, Long> topAccessedKeys, int pendingCalls, long coalescedCalls) {
        this.hits = hits;
        this.misses = misses;
        this.evictionCount = evictionCount;
        this.size = size;
        this.memoryUsage = memoryUsage;
        this.topAccessedKeys = Collections.unmodifiableMap(new LinkedHashMap<>(topAccessedKeys));
        this.pendingCalls = pendingCalls;
        this.coalescedCalls = coalescedCalls;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getTotalRequests() {
        return hits + misses;
    }

    public double getHitRate() {
        long total = getTotalRequests();
        return total > 0 ? (hits * 100.0) / total : 0.0;
    }

    public double getMissRate() {
        long total = getTotalRequests();
        return total > 0 ? (misses * 100.0) / total : 0.0;
    }

    public long getEvictionCount() {
        return evictionCount;
    }

    public int getSize() {
        return size;
    }

    /** Rough byte estimate: UTF-16 keys, serialized values, fixed overhead per entry. */
    public long getMemoryUsage() {
        return memoryUsage;
    }

    public Map<String, Long> getTopAccessedKeys() {
        return topAccessedKeys;
    }

    public int getPendingCalls() {
        return pendingCalls;
    }

    public long getCoalescedCalls() {
        return coalescedCalls;
    }
}
