package com.example.cachesync.persistence;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Blob store that lives as long as the process; for tests and for running with
 * persistence switched off.
 */
public class InMemoryBlobStore implements BlobStore {

    private final ConcurrentHashMap<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public Set<String> keys() {
        return new TreeSet<>(blobs.keySet());
    }

    @Override
    public Optional<byte[]> read(String key) {
        byte[] blob = blobs.get(key);
        return blob == null ? Optional.empty() : Optional.of(blob.clone());
    }

    @Override
    public void write(String key, byte[] blob) {
        blobs.put(key, blob.clone());
    }

    @Override
    public void delete(String key) {
        blobs.remove(key);
    }

    public int size() {
        return blobs.size();
    }
}
