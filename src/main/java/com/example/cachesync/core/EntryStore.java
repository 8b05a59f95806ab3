package com.example.cachesync.core;

import com.example.cachesync.eviction.EvictionTracker;
import com.example.cachesync.policy.NamespacePolicyTable;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory entry table kept in lockstep with the {@link EvictionTracker}.
 *
 * <p>Every key in the table is in the tracker exactly once and vice versa. Each public
 * method is one atomic step under {@link #lock}; removal notifications are delivered
 * after the lock is released. Stale entries are invisible to reads and are dropped
 * on access or by {@link #sweepExpired()}.
 *
 * <p>Values handed out are the stored objects; entries handed out are copies.
 */
public class EntryStore {

    private static final Logger log = LoggerFactory.getLogger(EntryStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry<Object>> entries = new HashMap<>();
    private final EvictionTracker tracker;
    private final NamespacePolicyTable policies;
    private final Clock clock;
    private final RemovalListener listener;

    public EntryStore(NamespacePolicyTable policies, Clock clock, RemovalListener listener) {
        this.policies = policies;
        this.tracker = new EvictionTracker(policies);
        this.clock = clock;
        this.listener = listener != null ? listener : (key, cause) -> { };
    }

    public EntryStore(NamespacePolicyTable policies, Clock clock) {
        this(policies, clock, null);
    }

    public Optional<Object> get(String key) {
        return lookup(key).map(CacheEntry::getValue);
    }

    /**
     * Returns a copy of the live entry for {@code key}, counting the access.
     */
    public Optional<CacheEntry<Object>> lookup(String key) {
        long now = clock.millis();
        List<String> expired = new ArrayList<>(1);
        CacheEntry<Object> result = null;
        lock.lock();
        try {
            CacheEntry<Object> entry = entries.get(key);
            if (entry != null) {
                if (entry.isExpired(now)) {
                    removeLocked(key);
                    expired.add(key);
                } else {
                    entry.recordAccess(now);
                    tracker.touch(key);
                    result = entry.copy();
                }
            }
        } finally {
            lock.unlock();
        }
        notify(expired, RemovalCause.EXPIRED);
        return Optional.ofNullable(result);
    }

    /** Returns a copy of the live entry without touching recency or access count. */
    public Optional<CacheEntry<Object>> peek(String key) {
        long now = clock.millis();
        lock.lock();
        try {
            CacheEntry<Object> entry = entries.get(key);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.of(entry.copy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes {@code value}, replacing any previous entry, and evicts from the key's
     * namespace before returning if the write pushed it over its max size.
     *
     * @return a copy of the stored entry
     */
    public CacheEntry<Object> put(String key, Object value, Duration ttl) {
        CacheEntry<Object> entry = new CacheEntry<>(value, clock.millis(), ttl.toMillis());
        insert(key, entry);
        return entry.copy();
    }

    /**
     * Puts back a previously captured entry with its original timestamps, e.g. when
     * loading from persistence or rolling back a mutation. Stale entries are ignored.
     *
     * @return whether the entry was stored
     */
    public boolean restore(String key, CacheEntry<Object> entry) {
        if (entry.isExpired(clock.millis())) {
            return false;
        }
        insert(key, entry.copy());
        return true;
    }

    /**
     * Restores {@code previous} (or removes the key when {@code previous} is null), but only
     * while the current value is still {@code expected}. A value written by someone else
     * in the meantime is left alone.
     */
    public boolean restoreIfCurrent(String key, Object expected, CacheEntry<Object> previous) {
        List<String> removed = new ArrayList<>(1);
        boolean restored = false;
        List<String> evicted = List.of();
        List<String> expired = new ArrayList<>();
        lock.lock();
        try {
            CacheEntry<Object> current = entries.get(key);
            if (current != null && current.getValue() == expected) {
                if (previous == null || previous.isExpired(clock.millis())) {
                    removeLocked(key);
                    removed.add(key);
                } else {
                    evicted = insertLocked(key, previous.copy(), expired);
                }
                restored = true;
            }
        } finally {
            lock.unlock();
        }
        notify(removed, RemovalCause.EXPLICIT);
        notify(expired, RemovalCause.EXPIRED);
        notify(evicted, RemovalCause.EVICTED);
        return restored;
    }

    public boolean delete(String key) {
        boolean removed;
        lock.lock();
        try {
            removed = removeLocked(key);
        } finally {
            lock.unlock();
        }
        if (removed) {
            listener.onRemoval(key, RemovalCause.EXPLICIT);
        }
        return removed;
    }

    /**
     * Removes every key accepted by {@code filter}.
     *
     * @return the removed keys
     */
    public List<String> deleteIf(Predicate<String> filter) {
        List<String> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                String key = it.next();
                if (filter.test(key)) {
                    it.remove();
                    tracker.remove(key);
                    removed.add(key);
                }
            }
        } finally {
            lock.unlock();
        }
        notify(removed, RemovalCause.EXPLICIT);
        return removed;
    }

    /**
     * Physically removes every stale entry.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        long now = clock.millis();
        List<String> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Map.Entry<String, CacheEntry<Object>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry<Object>> e = it.next();
                if (e.getValue().isExpired(now)) {
                    it.remove();
                    tracker.remove(e.getKey());
                    expired.add(e.getKey());
                }
            }
        } finally {
            lock.unlock();
        }
        notify(expired, RemovalCause.EXPIRED);
        if (!expired.isEmpty()) {
            log.debug("Swept {} expired entries", expired.size());
        }
        return expired.size();
    }

    public void clear() {
        List<String> removed;
        lock.lock();
        try {
            removed = new ArrayList<>(entries.keySet());
            entries.clear();
            tracker.clear();
        } finally {
            lock.unlock();
        }
        notify(removed, RemovalCause.EXPLICIT);
    }

    /** Copies of all live entries, in no particular order. */
    public Map<String, CacheEntry<Object>> snapshot() {
        long now = clock.millis();
        Map<String, CacheEntry<Object>> copy = new LinkedHashMap<>();
        lock.lock();
        try {
            entries.forEach((key, entry) -> {
                if (!entry.isExpired(now)) {
                    copy.put(key, entry.copy());
                }
            });
        } finally {
            lock.unlock();
        }
        return copy;
    }

    /** Most accessed live keys with their access counts, highest first. */
    public Map<String, Long> topAccessed(int limit) {
        Map<String, Long> top = new LinkedHashMap<>();
        snapshot().entrySet().stream()
            .sorted(Comparator.comparingLong((Map.Entry<String, CacheEntry<Object>> e) -> e.getValue().getAccessCount())
                .reversed()
                .thenComparing(Map.Entry::getKey))
            .limit(limit)
            .forEach(e -> top.put(e.getKey(), e.getValue().getAccessCount()));
        return top;
    }

    /** Entries physically held, stale ones included. */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /** Keys of a namespace, least recently used first. */
    public List<String> recencyOrder(String namespace) {
        lock.lock();
        try {
            return tracker.keys(namespace);
        } finally {
            lock.unlock();
        }
    }

    private void insert(String key, CacheEntry<Object> entry) {
        List<String> expired = new ArrayList<>();
        List<String> evicted;
        lock.lock();
        try {
            evicted = insertLocked(key, entry, expired);
        } finally {
            lock.unlock();
        }
        notify(expired, RemovalCause.EXPIRED);
        notify(evicted, RemovalCause.EVICTED);
    }

    private List<String> insertLocked(String key, CacheEntry<Object> entry, List<String> expired) {
        entries.put(key, entry);
        tracker.touch(key);

        String namespace = policies.namespaceOf(key);
        if (tracker.size(namespace) <= policies.maxSizeOf(namespace)) {
            return List.of();
        }
        // stale entries go first so they never cost a live one its slot
        long now = clock.millis();
        for (String candidate : tracker.keys(namespace)) {
            CacheEntry<Object> existing = entries.get(candidate);
            if (existing != null && existing.isExpired(now)) {
                removeLocked(candidate);
                expired.add(candidate);
            }
        }
        List<String> evicted = tracker.evictIfOverCapacity(namespace);
        for (String victim : evicted) {
            entries.remove(victim);
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} from namespace {}", evicted, namespace);
        }
        return evicted;
    }

    private boolean removeLocked(String key) {
        if (entries.remove(key) != null) {
            tracker.remove(key);
            return true;
        }
        return false;
    }

    private void notify(List<String> keys, RemovalCause cause) {
        for (String key : keys) {
            listener.onRemoval(key, cause);
        }
    }
}
