package com.example.cachesync.persistence;

import com.example.cachesync.core.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort mirror of durable entries in a {@link BlobStore}.
 *
 * <p>No method throws: failures are logged and the in-memory cache stays authoritative.
 */
public class PersistenceAdapter {

    private static final Logger log = LoggerFactory.getLogger(PersistenceAdapter.class);

    private final BlobStore blobStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PersistenceAdapter(BlobStore blobStore, ObjectMapper objectMapper, Clock clock) {
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Reads every stored entry. Stale and unreadable blobs are dropped from the store
     * instead of being returned.
     */
    public Map<String, CacheEntry<Object>> loadAll() {
        Map<String, CacheEntry<Object>> loaded = new LinkedHashMap<>();
        Map<String, byte[]> blobs;
        try {
            blobs = blobStore.readAll();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load cache from persistent storage", e);
            return loaded;
        }
        long now = clock.millis();
        for (Map.Entry<String, byte[]> blob : blobs.entrySet()) {
            String key = blob.getKey();
            try {
                CacheEntry<Object> entry = objectMapper.readValue(blob.getValue(), PersistedEntry.class).toEntry();
                if (entry.isExpired(now)) {
                    remove(key);
                } else {
                    loaded.put(key, entry);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Discarding unreadable persisted cache entry: {}", key, e);
                remove(key);
            }
        }
        return loaded;
    }

    /**
     * Makes the store hold exactly {@code entries}: writes all of them and deletes
     * stored keys that are not among them.
     *
     * @return number of entries written
     */
    public int saveAll(Map<String, CacheEntry<Object>> entries) {
        int written = 0;
        for (Map.Entry<String, CacheEntry<Object>> e : entries.entrySet()) {
            if (save(e.getKey(), e.getValue())) {
                written++;
            }
        }
        try {
            Set<String> stored = blobStore.keys();
            for (String key : stored) {
                if (!entries.containsKey(key)) {
                    remove(key);
                }
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to prune persistent cache storage", e);
        }
        return written;
    }

    public boolean save(String key, CacheEntry<Object> entry) {
        try {
            blobStore.write(key, objectMapper.writeValueAsBytes(PersistedEntry.from(entry)));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to persist cache entry: {}", key, e);
            return false;
        }
    }

    public void remove(String key) {
        try {
            blobStore.delete(key);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to remove cache entry from storage: {}", key, e);
        }
    }

    public void clear() {
        try {
            blobStore.clear();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to clear persistent cache storage", e);
        }
    }
}
