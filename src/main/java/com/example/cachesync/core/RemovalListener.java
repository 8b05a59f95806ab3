package com.example.cachesync.core;

/**
 * Notified after an entry leaves the {@link EntryStore}. Called outside the store lock.
 */
@FunctionalInterface
public interface RemovalListener {

    void onRemoval(String key, RemovalCause cause);
}
