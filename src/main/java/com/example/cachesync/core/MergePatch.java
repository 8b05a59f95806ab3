package com.example.cachesync.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Patches for record-like values held as maps.
 */
public final class MergePatch {

    private MergePatch() {
    }

    /**
     * Shallow merge: a new map holding the current fields overlaid with {@code changes}.
     * The current value is never modified.
     */
    public static UnaryOperator<Map<String, Object>> fields(Map<String, ?> changes) {
        Map<String, Object> copy = new LinkedHashMap<>(changes);
        return current -> {
            Map<String, Object> merged = new LinkedHashMap<>(current);
            merged.putAll(copy);
            return merged;
        };
    }
}
