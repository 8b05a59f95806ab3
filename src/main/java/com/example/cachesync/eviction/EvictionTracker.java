package com.example.cachesync.eviction;

import com.example.cachesync.policy.NamespacePolicyTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-namespace LRU ordering over live keys.
 *
 * <p>Each namespace keeps an access-ordered {@link LinkedHashMap}: the head is the
 * least recently used key, the tail the most recent. Keys touched in the same
 * millisecond keep the order in which they were touched.
 *
 * <p>Not thread-safe; the owning {@code EntryStore} calls it under its lock.
 */
public class EvictionTracker {

    private final NamespacePolicyTable policies;
    private final Map<String, LinkedHashMap<String, Boolean>> orders = new HashMap<>();

    public EvictionTracker(NamespacePolicyTable policies) {
        this.policies = policies;
    }

    public void touch(String key) {
        LinkedHashMap<String, Boolean> order = orders.computeIfAbsent(
            policies.namespaceOf(key), ns -> new LinkedHashMap<>(16, 0.75f, true));
        // access-order LinkedHashMap moves key to end on get/put
        order.put(key, Boolean.TRUE);
    }

    public void remove(String key) {
        String namespace = policies.namespaceOf(key);
        LinkedHashMap<String, Boolean> order = orders.get(namespace);
        if (order != null) {
            order.remove(key);
            if (order.isEmpty()) {
                orders.remove(namespace);
            }
        }
    }

    /**
     * Drops keys from the least recently used end of {@code namespace} until it holds
     * no more than its policy's max size.
     *
     * @return the evicted keys, oldest first
     */
    public List<String> evictIfOverCapacity(String namespace) {
        LinkedHashMap<String, Boolean> order = orders.get(namespace);
        if (order == null) {
            return Collections.emptyList();
        }
        int maxSize = policies.maxSizeOf(namespace);
        List<String> evicted = new ArrayList<>();
        Iterator<String> it = order.keySet().iterator();
        while (order.size() > maxSize && it.hasNext()) {
            evicted.add(it.next());
            it.remove();
        }
        return evicted;
    }

    public int size(String namespace) {
        LinkedHashMap<String, Boolean> order = orders.get(namespace);
        return order == null ? 0 : order.size();
    }

    /** Keys of a namespace, least recently used first. */
    public List<String> keys(String namespace) {
        LinkedHashMap<String, Boolean> order = orders.get(namespace);
        return order == null ? List.of() : List.copyOf(order.keySet());
    }

    public boolean contains(String key) {
        LinkedHashMap<String, Boolean> order = orders.get(policies.namespaceOf(key));
        return order != null && order.containsKey(key);
    }

    public void clear() {
        orders.clear();
    }
}
