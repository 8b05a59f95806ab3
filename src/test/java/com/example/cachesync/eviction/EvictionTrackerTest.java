package com.example.cachesync.eviction;

import com.example.cachesync.policy.NamespacePolicy;
import com.example.cachesync.policy.NamespacePolicyTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvictionTrackerTest {

    private EvictionTracker tracker;

    @BeforeEach
    void setUp() {
        NamespacePolicyTable policies = new NamespacePolicyTable(List.of(
            new NamespacePolicy("item", Duration.ofSeconds(1), 2, false),
            new NamespacePolicy("other", Duration.ofSeconds(1), 1, false)));
        tracker = new EvictionTracker(policies);
    }

    @Test
    void testEvictsLeastRecentlyTouched() {
        tracker.touch("item:1");
        tracker.touch("item:2");
        tracker.touch("item:1");
        tracker.touch("item:3");

        assertEquals(List.of("item:2"), tracker.evictIfOverCapacity("item"));
        assertEquals(List.of("item:1", "item:3"), tracker.keys("item"));
    }

    @Test
    void testTiesFollowInsertionOrder() {
        tracker.touch("item:a");
        tracker.touch("item:b");
        tracker.touch("item:c");
        tracker.touch("item:d");

        assertEquals(List.of("item:a", "item:b"), tracker.evictIfOverCapacity("item"));
    }

    @Test
    void testKeyAppearsOnce() {
        tracker.touch("item:1");
        tracker.touch("item:1");
        tracker.touch("item:1");

        assertEquals(1, tracker.size("item"));
        assertTrue(tracker.evictIfOverCapacity("item").isEmpty());
    }

    @Test
    void testNamespacesAreIndependent() {
        tracker.touch("item:1");
        tracker.touch("item:2");
        tracker.touch("other:1");

        assertTrue(tracker.evictIfOverCapacity("item").isEmpty());
        assertTrue(tracker.evictIfOverCapacity("other").isEmpty());
        tracker.touch("other:2");
        assertEquals(List.of("other:1"), tracker.evictIfOverCapacity("other"));
        assertEquals(2, tracker.size("item"));
    }

    @Test
    void testRemove() {
        tracker.touch("item:1");
        tracker.remove("item:1");
        tracker.remove("item:unknown");

        assertFalse(tracker.contains("item:1"));
        assertEquals(0, tracker.size("item"));
    }
}
