package com.example.cachesync.core;

import java.time.Duration;

/**
 * Per-call knobs for {@link SyncEngine#read}. Immutable; the {@code with*} methods return copies.
 */
public final class ReadOptions {

    private static final ReadOptions DEFAULTS = new ReadOptions(false, null, null);

    private final boolean skipCache;
    private final Duration ttlOverride;
    private final Duration timeout;

    private ReadOptions(boolean skipCache, Duration ttlOverride, Duration timeout) {
        this.skipCache = skipCache;
        this.ttlOverride = ttlOverride;
        this.timeout = timeout;
    }

    public static ReadOptions defaults() {
        return DEFAULTS;
    }

    public ReadOptions withSkipCache(boolean skip) {
        return new ReadOptions(skip, ttlOverride, timeout);
    }

    public ReadOptions withTtl(Duration ttl) {
        return new ReadOptions(skipCache, ttl, timeout);
    }

    public ReadOptions withTimeout(Duration callTimeout) {
        return new ReadOptions(skipCache, ttlOverride, callTimeout);
    }

    public boolean isSkipCache() {
        return skipCache;
    }

    /** TTL for the loaded value instead of the namespace TTL; may be null. */
    public Duration getTtlOverride() {
        return ttlOverride;
    }

    /** Bound on the loader; null means the engine default. */
    public Duration getTimeout() {
        return timeout;
    }
}
