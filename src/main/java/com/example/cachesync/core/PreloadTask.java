package com.example.cachesync.core;

import java.util.concurrent.Callable;

public final class PreloadTask {

    private final String key;
    private final Callable<?> loader;
    private final int priority;

    public PreloadTask(String key, Callable<?> loader, int priority) {
        this.key = key;
        this.loader = loader;
        this.priority = priority;
    }

    public String getKey() {
        return key;
    }

    public Callable<?> getLoader() {
        return loader;
    }

    /** Higher runs first. */
    public int getPriority() {
        return priority;
    }
}
