package com.example.cachesync.core;

import com.example.cachesync.backend.RemoteDataService;
import com.example.cachesync.coalesce.CallCoalescer;
import com.example.cachesync.coalesce.CallSignature;
import com.example.cachesync.coalesce.RemoteCallException;
import com.example.cachesync.coalesce.RemoteCallExecutor;
import com.example.cachesync.persistence.PersistenceAdapter;
import com.example.cachesync.policy.NamespacePolicy;
import com.example.cachesync.policy.NamespacePolicyTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache facade in front of the remote data service.
 *
 * <p>Combines the {@link EntryStore}, the {@link CallCoalescer} and the
 * {@link PersistenceAdapter}. All writes to the cache go through this class.
 *
 * <ul>
 *   <li>{@link #read} serves hits locally and coalesces misses per key.</li>
 *   <li>{@link #mutate} shows a speculative value while the remote mutation runs and
 *       either commits the confirmed value and invalidates dependent namespaces, or
 *       puts the previous entry back.</li>
 *   <li>Only {@link RemoteCallException} escapes; persistence problems are logged.</li>
 * </ul>
 */
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    // key chars counted as UTF-16 plus a fixed per-entry overhead
    private static final int ENTRY_OVERHEAD_BYTES = 32;

    private final NamespacePolicyTable policies;
    private final EntryStore store;
    private final CallCoalescer coalescer;
    private final RemoteCallExecutor callExecutor;
    private final PersistenceAdapter persistence;
    private final RemoteDataService remote;
    private final ObjectMapper objectMapper;
    private final Duration speculativeTtl;
    private final int topKeys;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public SyncEngine(
        NamespacePolicyTable policies,
        CallCoalescer coalescer,
        RemoteCallExecutor callExecutor,
        PersistenceAdapter persistence,
        RemoteDataService remote,
        ObjectMapper objectMapper,
        Clock clock,
        Duration speculativeTtl,
        int topKeys
    ) {
        this.policies = policies;
        this.coalescer = coalescer;
        this.callExecutor = callExecutor;
        this.persistence = persistence;
        this.remote = remote;
        this.objectMapper = objectMapper;
        this.speculativeTtl = speculativeTtl;
        this.topKeys = topKeys;
        this.store = new EntryStore(policies, clock, this::onRemoval);
    }

    // --- lifecycle ---

    /**
     * Restores durable entries from persistent storage in order of last access. Entries of
     * namespaces that are no longer durable are dropped.
     */
    public void start() {
        List<Map.Entry<String, CacheEntry<Object>>> loaded = new ArrayList<>(persistence.loadAll().entrySet());
        // oldest access first, so the rebuilt recency lists match the persisted ones
        loaded.sort(Comparator.comparingLong((Map.Entry<String, CacheEntry<Object>> e) -> e.getValue().getLastAccessedAt())
            .thenComparingLong(e -> e.getValue().getCreatedAt()));
        int restored = 0;
        for (Map.Entry<String, CacheEntry<Object>> e : loaded) {
            if (policies.resolve(e.getKey()).isDurable() && store.restore(e.getKey(), e.getValue())) {
                restored++;
            } else {
                persistence.remove(e.getKey());
            }
        }
        log.info("Restored {} cache entries from persistent storage", restored);
    }

    /** Final snapshot of durable entries. */
    public void shutdown() {
        int saved = snapshot();
        log.info("Saved {} cache entries to persistent storage on shutdown", saved);
    }

    /**
     * Rewrites persistent storage from the live durable entries.
     *
     * @return number of entries written
     */
    public int snapshot() {
        Map<String, CacheEntry<Object>> durable = store.snapshot();
        durable.keySet().removeIf(key -> !policies.resolve(key).isDurable());
        return persistence.saveAll(durable);
    }

    public int sweepExpired() {
        return store.sweepExpired();
    }

    // --- read path ---

    public <T> T read(String key, Callable<T> loader) {
        return read(key, loader, ReadOptions.defaults());
    }

    /**
     * Returns the cached value for {@code key}, or loads it. Concurrent misses on the same
     * key share one loader call. The loaded value is cached with the override TTL or the
     * namespace TTL; a failed load caches nothing. Null results are returned but not cached.
     *
     * @throws RemoteCallException when the loader fails or times out
     */
    public <T> T read(String key, Callable<T> loader, ReadOptions options) {
        if (!options.isSkipCache()) {
            Optional<T> cached = get(key);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        // first completing caller's TTL wins for coalesced readers
        Duration ttl = options.getTtlOverride() != null
            ? options.getTtlOverride()
            : policies.resolve(key).getTtl();
        CompletableFuture<T> result = coalescer.submit(key, loader, options.getTimeout(), value -> {
            if (value != null) {
                write(key, value, ttl);
            }
        });
        return RemoteCallExecutor.await(key, result);
    }

    /** {@link #read} with a remote call as loader. */
    public <T> T readRemote(String key, String name, Map<String, ?> params, ReadOptions options) {
        return read(key, () -> {
            @SuppressWarnings("unchecked")
            T value = (T) remote.call(name, params);
            return value;
        }, options);
    }

    /**
     * Uncached remote call, coalesced with identical concurrent calls regardless of
     * parameter order.
     */
    public Object call(String name, Map<String, ?> params) {
        String signature = CallSignature.of(name, params).value();
        return coalescer.invoke(signature, () -> remote.call(name, params));
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        Optional<Object> value = store.get(key);
        if (value.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return (Optional<T>) value;
    }

    /** Live entry without touching recency, access count or stats. */
    public Optional<CacheEntry<Object>> peek(String key) {
        return store.peek(key);
    }

    public List<KeyedValue> batchGet(List<String> keys) {
        List<KeyedValue> results = new ArrayList<>(keys.size());
        for (String key : keys) {
            results.add(new KeyedValue(key, get(key).orElse(null)));
        }
        return results;
    }

    // --- direct writes ---

    public void put(String key, Object value) {
        write(key, value, policies.resolve(key).getTtl());
    }

    public void put(String key, Object value, Duration ttl) {
        write(key, value, ttl != null ? ttl : policies.resolve(key).getTtl());
    }

    public void batchPut(Map<String, ?> values) {
        values.forEach(this::put);
    }

    // --- write path ---

    public <T> T mutate(String key, UnaryOperator<T> patch, Callable<T> remoteMutation) {
        return mutate(key, patch, remoteMutation, MutateOptions.defaults());
    }

    /**
     * Optimistic mutation of {@code key}.
     *
     * <p>If a value is cached, {@code patch} is applied to it and the result is cached with
     * the speculative TTL before the remote mutation starts. {@code patch} must return a
     * new object and leave its argument untouched.
     *
     * <p>On success the confirmed value replaces the speculative one with the namespace
     * TTL and every dependent namespace is invalidated (except {@code key} itself). On
     * failure the previous entry is put back, or the key is removed when nothing was
     * cached, and the failure is rethrown. Mutations are never coalesced or retried.
     *
     * @throws RemoteCallException when the remote mutation fails or times out
     */
    @SuppressWarnings("unchecked")
    public <T> T mutate(String key, UnaryOperator<T> patch, Callable<T> remoteMutation, MutateOptions options) {
        Optional<CacheEntry<Object>> previous = store.lookup(key);
        Object speculative = null;
        boolean speculated = false;
        if (previous.isPresent() && patch != null) {
            speculative = patch.apply((T) previous.get().getValue());
            // a null patch result is not cached; the previous value stays visible
            if (speculative != null) {
                Duration ttl = options.getSpeculativeTtl() != null ? options.getSpeculativeTtl() : speculativeTtl;
                write(key, speculative, ttl);
                speculated = true;
            }
        }

        String signature = "mutate:" + key;
        T confirmed;
        try {
            confirmed = RemoteCallExecutor.await(signature,
                callExecutor.execute(signature, remoteMutation, options.getTimeout()));
        } catch (RemoteCallException e) {
            rollback(key, speculated, speculative, previous.orElse(null));
            log.warn("Mutation of {} failed, optimistic value rolled back", key, e);
            throw e;
        }

        if (confirmed != null) {
            write(key, confirmed, policies.resolve(key).getTtl());
        } else {
            store.delete(key);
        }
        cascade(key);
        return confirmed;
    }

    // --- invalidation ---

    public void invalidate(Collection<String> keys) {
        for (String key : keys) {
            store.delete(key);
        }
    }

    /**
     * Removes {@code prefix} itself and every key under {@code prefix + ":"}.
     *
     * @return the removed keys
     */
    public List<String> invalidateNamespace(String prefix) {
        return store.deleteIf(key -> inNamespace(key, prefix));
    }

    public void clear() {
        store.clear();
        persistence.clear();
    }

    // --- diagnostics ---

    public CacheStats stats() {
        Map<String, CacheEntry<Object>> entries = store.snapshot();
        long memory = 0;
        for (Map.Entry<String, CacheEntry<Object>> e : entries.entrySet()) {
            memory += e.getKey().length() * 2L + estimateSize(e.getValue().getValue()) * 2L + ENTRY_OVERHEAD_BYTES;
        }
        return new CacheStats(hits.get(), misses.get(), evictions.get(), entries.size(), memory,
            store.topAccessed(topKeys), coalescer.pendingCount(), coalescer.getJoinedCalls());
    }

    // --- preload ---

    /**
     * Loads every task whose key is not cached yet. Loaders start in descending priority
     * (ties keep list order) and run concurrently; a failing task is logged and skipped.
     * Returns once every task has settled.
     *
     * @return number of tasks that loaded a value
     */
    public int preload(List<PreloadTask> tasks) {
        List<PreloadTask> ordered = new ArrayList<>(tasks);
        ordered.sort(Comparator.comparingInt(PreloadTask::getPriority).reversed());

        AtomicInteger loaded = new AtomicInteger();
        List<CompletableFuture<?>> settled = new ArrayList<>();
        for (PreloadTask task : ordered) {
            String key = task.getKey();
            if (get(key).isPresent()) {
                continue;
            }
            Duration ttl = policies.resolve(key).getTtl();
            CompletableFuture<Object> load = coalescer.submit(key, loaderOf(task), null, value -> {
                if (value != null) {
                    write(key, value, ttl);
                }
            });
            settled.add(load.handle((value, error) -> {
                if (error != null) {
                    log.warn("Preload failed for key: {}", key, error);
                } else {
                    loaded.incrementAndGet();
                }
                return null;
            }));
        }
        CompletableFuture.allOf(settled.toArray(new CompletableFuture[0])).join();
        return loaded.get();
    }

    // --- internals ---

    private void write(String key, Object value, Duration ttl) {
        CacheEntry<Object> entry = store.put(key, value, ttl);
        if (policies.resolve(key).isDurable()) {
            persistence.save(key, entry);
        }
    }

    private void rollback(String key, boolean speculated, Object speculative, CacheEntry<Object> previous) {
        if (previous == null) {
            store.delete(key);
            return;
        }
        if (!speculated) {
            return;
        }
        if (store.restoreIfCurrent(key, speculative, previous) && policies.resolve(key).isDurable()) {
            persistence.save(key, previous);
        }
    }

    private void cascade(String key) {
        NamespacePolicy policy = policies.resolve(key);
        for (String dependent : policy.getDependents()) {
            List<String> removed = store.deleteIf(candidate -> !candidate.equals(key) && inNamespace(candidate, dependent));
            if (!removed.isEmpty()) {
                log.debug("Mutation of {} invalidated {}", key, removed);
            }
        }
    }

    private void onRemoval(String key, RemovalCause cause) {
        if (cause == RemovalCause.EVICTED) {
            evictions.incrementAndGet();
        }
        if (policies.resolve(key).isDurable()) {
            persistence.remove(key);
        }
    }

    private long estimateSize(Object value) {
        try {
            return objectMapper.writeValueAsString(value).length();
        } catch (JsonProcessingException e) {
            return String.valueOf(value).length();
        }
    }

    private static boolean inNamespace(String key, String prefix) {
        return key.equals(prefix) || key.startsWith(prefix + NamespacePolicyTable.SEPARATOR);
    }

    @SuppressWarnings("unchecked")
    private static Callable<Object> loaderOf(PreloadTask task) {
        return (Callable<Object>) task.getLoader();
    }
}
