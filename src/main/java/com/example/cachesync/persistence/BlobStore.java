package com.example.cachesync.persistence;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable key to bytes storage. No transactional guarantees.
 */
public interface BlobStore {

    Set<String> keys() throws IOException;

    Optional<byte[]> read(String key) throws IOException;

    void write(String key, byte[] blob) throws IOException;

    void delete(String key) throws IOException;

    default Map<String, byte[]> readAll() throws IOException {
        Map<String, byte[]> all = new LinkedHashMap<>();
        for (String key : keys()) {
            Optional<byte[]> blob = read(key);
            if (blob.isPresent()) {
                all.put(key, blob.get());
            }
        }
        return all;
    }

    default void clear() throws IOException {
        for (String key : keys()) {
            delete(key);
        }
    }
}
