package com.example.cachesync.policy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static prefix to policy mapping consulted on every write.
 *
 * <p>Lookup is longest-prefix-wins. A key no policy matches gets the default
 * policy and lives in the namespace named by its first segment, or in
 * {@value #DEFAULT_NAMESPACE} when it has no separator.
 */
public class NamespacePolicyTable {

    public static final String SEPARATOR = ":";
    public static final String DEFAULT_NAMESPACE = "default";

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_SIZE = 100;

    private final NamespacePolicy defaultPolicy;
    // longest prefix first
    private final List<NamespacePolicy> policies;
    private final Map<String, NamespacePolicy> byPrefix = new LinkedHashMap<>();

    public NamespacePolicyTable(NamespacePolicy defaultPolicy, Collection<NamespacePolicy> policies) {
        validate(defaultPolicy, true);
        for (NamespacePolicy policy : policies) {
            validate(policy, false);
            if (byPrefix.put(policy.getPrefix(), policy) != null) {
                throw new PolicyMisconfigurationException("Duplicate namespace prefix: " + policy.getPrefix());
            }
        }
        this.defaultPolicy = defaultPolicy;
        List<NamespacePolicy> sorted = new ArrayList<>(byPrefix.values());
        sorted.sort(Comparator.comparingInt((NamespacePolicy p) -> p.getPrefix().length()).reversed());
        this.policies = List.copyOf(sorted);
    }

    public NamespacePolicyTable(Collection<NamespacePolicy> policies) {
        this(new NamespacePolicy(DEFAULT_NAMESPACE, DEFAULT_TTL, DEFAULT_MAX_SIZE, false), policies);
    }

    public NamespacePolicy resolve(String key) {
        for (NamespacePolicy policy : policies) {
            if (policy.matches(key)) {
                return policy;
            }
        }
        return defaultPolicy;
    }

    public String namespaceOf(String key) {
        for (NamespacePolicy policy : policies) {
            if (policy.matches(key)) {
                return policy.getPrefix();
            }
        }
        int idx = key.indexOf(SEPARATOR);
        return idx > 0 ? key.substring(0, idx) : DEFAULT_NAMESPACE;
    }

    /** Max size for a namespace name as returned by {@link #namespaceOf(String)}. */
    public int maxSizeOf(String namespace) {
        NamespacePolicy policy = byPrefix.get(namespace);
        return policy != null ? policy.getMaxSize() : defaultPolicy.getMaxSize();
    }

    public NamespacePolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public Collection<NamespacePolicy> getPolicies() {
        return policies;
    }

    private static void validate(NamespacePolicy policy, boolean isDefault) {
        if (policy == null) {
            throw new PolicyMisconfigurationException("Namespace policy must not be null");
        }
        String prefix = policy.getPrefix();
        if (!isDefault && (prefix == null || prefix.isBlank() || prefix.chars().anyMatch(Character::isWhitespace))) {
            throw new PolicyMisconfigurationException("Invalid namespace prefix: '" + prefix + "'");
        }
        if (policy.getTtl() == null || policy.getTtl().isNegative() || policy.getTtl().isZero()) {
            throw new PolicyMisconfigurationException("TTL must be positive for namespace " + prefix + ": " + policy.getTtl());
        }
        if (policy.getMaxSize() < 1) {
            throw new PolicyMisconfigurationException("maxSize must be at least 1 for namespace " + prefix + ": " + policy.getMaxSize());
        }
        for (String dependent : policy.getDependents()) {
            if (dependent == null || dependent.isBlank()) {
                throw new PolicyMisconfigurationException("Blank dependent namespace declared by " + prefix);
            }
        }
    }
}
