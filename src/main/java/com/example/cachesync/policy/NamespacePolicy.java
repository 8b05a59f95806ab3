package com.example.cachesync.policy;

import java.time.Duration;
import java.util.List;

/**
 * TTL, size bound and durability shared by every key of one namespace.
 * Keys match when they start with {@code prefix + ":"}.
 */
public final class NamespacePolicy {

    private final String prefix;
    private final Duration ttl;
    private final int maxSize;
    private final boolean durable;
    private final List<String> dependents;

    public NamespacePolicy(String prefix, Duration ttl, int maxSize, boolean durable, List<String> dependents) {
        this.prefix = prefix;
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.durable = durable;
        this.dependents = dependents == null ? List.of() : List.copyOf(dependents);
    }

    public NamespacePolicy(String prefix, Duration ttl, int maxSize, boolean durable) {
        this(prefix, ttl, maxSize, durable, List.of());
    }

    public String getPrefix() {
        return prefix;
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public boolean isDurable() {
        return durable;
    }

    /** Namespace prefixes invalidated after a confirmed mutation in this namespace. */
    public List<String> getDependents() {
        return dependents;
    }

    public boolean matches(String key) {
        return key.startsWith(prefix + NamespacePolicyTable.SEPARATOR);
    }

    @Override
    public String toString() {
        return "NamespacePolicy{" + prefix + ", ttl=" + ttl + ", maxSize=" + maxSize
            + ", durable=" + durable + ", dependents=" + dependents + "}";
    }
}
