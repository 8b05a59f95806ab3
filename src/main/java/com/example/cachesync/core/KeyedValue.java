package com.example.cachesync.core;

import java.util.Optional;

/**
 * One row of a batch lookup.
 */
public final class KeyedValue {

    private final String key;
    private final Object value;

    public KeyedValue(String key, Object value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public Optional<Object> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
