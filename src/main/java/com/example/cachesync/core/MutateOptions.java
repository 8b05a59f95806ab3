package com.example.cachesync.core;

import java.time.Duration;

public final class MutateOptions {

    private static final MutateOptions DEFAULTS = new MutateOptions(null, null);

    private final Duration timeout;
    private final Duration speculativeTtl;

    private MutateOptions(Duration timeout, Duration speculativeTtl) {
        this.timeout = timeout;
        this.speculativeTtl = speculativeTtl;
    }

    public static MutateOptions defaults() {
        return DEFAULTS;
    }

    public MutateOptions withTimeout(Duration callTimeout) {
        return new MutateOptions(callTimeout, speculativeTtl);
    }

    public MutateOptions withSpeculativeTtl(Duration ttl) {
        return new MutateOptions(timeout, ttl);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getSpeculativeTtl() {
        return speculativeTtl;
    }
}
