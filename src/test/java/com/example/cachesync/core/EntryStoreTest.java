package com.example.cachesync.core;

import com.example.cachesync.TestClock;
import com.example.cachesync.policy.NamespacePolicy;
import com.example.cachesync.policy.NamespacePolicyTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EntryStoreTest {

    private static final Duration ITEM_TTL = Duration.ofMillis(1000);

    private TestClock clock;
    private EntryStore store;
    private final List<String> removals = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        NamespacePolicyTable policies = new NamespacePolicyTable(List.of(
            new NamespacePolicy("item", ITEM_TTL, 2, false)));
        store = new EntryStore(policies, clock, (key, cause) -> removals.add(cause + ":" + key));
    }

    @Test
    void testLruScenario() {
        store.put("item:1", "A", ITEM_TTL);
        store.put("item:2", "B", ITEM_TTL);
        store.put("item:3", "C", ITEM_TTL);

        assertEquals(Optional.empty(), store.get("item:1"));
        assertEquals(Optional.of("B"), store.get("item:2"));
        assertEquals(Optional.of("C"), store.get("item:3"));
        assertEquals(List.of("EVICTED:item:1"), removals);
    }

    @Test
    void testReadRefreshesRecency() {
        store.put("item:1", "A", ITEM_TTL);
        store.put("item:2", "B", ITEM_TTL);
        store.get("item:1");
        store.put("item:3", "C", ITEM_TTL);

        assertTrue(store.get("item:1").isPresent());
        assertFalse(store.get("item:2").isPresent());
    }

    @Test
    void testExpiredEntryIsAbsentAndRemovedOnAccess() {
        store.put("item:1", "A", ITEM_TTL);

        clock.advanceMillis(1000);
        assertEquals(Optional.of("A"), store.get("item:1"));

        clock.advanceMillis(1);
        assertEquals(Optional.empty(), store.get("item:1"));
        assertEquals(0, store.size());
        assertTrue(store.recencyOrder("item").isEmpty());
        assertEquals(List.of("EXPIRED:item:1"), removals);
    }

    @Test
    void testPutResetsCreationAndAccessCount() {
        store.put("item:1", "A", ITEM_TTL);
        store.get("item:1");
        store.get("item:1");
        assertEquals(3, store.peek("item:1").orElseThrow().getAccessCount());

        clock.advanceMillis(800);
        store.put("item:1", "A2", ITEM_TTL);
        clock.advanceMillis(800);

        CacheEntry<Object> entry = store.peek("item:1").orElseThrow();
        assertEquals("A2", entry.getValue());
        assertEquals(1, entry.getAccessCount());
    }

    @Test
    void testStaleEntriesGoBeforeLiveOnesWhenFull() {
        store.put("item:1", "A", Duration.ofMillis(10));
        store.put("item:2", "B", ITEM_TTL);
        store.get("item:1");
        clock.advanceMillis(20);

        store.put("item:3", "C", ITEM_TTL);

        assertTrue(store.get("item:2").isPresent());
        assertTrue(store.get("item:3").isPresent());
        assertEquals(List.of("EXPIRED:item:1"), removals);
    }

    @Test
    void testSweepExpired() {
        store.put("item:1", "A", Duration.ofMillis(10));
        store.put("misc:1", "B", Duration.ofMillis(50));
        clock.advanceMillis(20);

        assertEquals(1, store.sweepExpired());
        assertEquals(1, store.size());
        assertTrue(store.peek("misc:1").isPresent());
    }

    @Test
    void testPeekDoesNotTouch() {
        store.put("item:1", "A", ITEM_TTL);
        store.put("item:2", "B", ITEM_TTL);
        store.peek("item:1");
        store.put("item:3", "C", ITEM_TTL);

        assertFalse(store.peek("item:1").isPresent());
    }

    @Test
    void testRestoreKeepsOriginalTimestamps() {
        CacheEntry<Object> old = new CacheEntry<>("A", clock.millis() - 500, 1000, 7, clock.millis() - 100);

        assertTrue(store.restore("item:1", old));
        clock.advanceMillis(501);

        assertFalse(store.get("item:1").isPresent());
        assertFalse(store.restore("item:2", old));
    }

    @Test
    void testRestoreIfCurrentOnlyReplacesExpectedValue() {
        CacheEntry<Object> original = store.put("item:1", "old", ITEM_TTL);
        Object speculative = "speculative";
        store.put("item:1", speculative, Duration.ofSeconds(5));

        assertTrue(store.restoreIfCurrent("item:1", speculative, original));
        assertEquals("old", store.peek("item:1").orElseThrow().getValue());

        store.put("item:1", "newer", ITEM_TTL);
        assertFalse(store.restoreIfCurrent("item:1", speculative, original));
        assertEquals("newer", store.peek("item:1").orElseThrow().getValue());
    }

    @Test
    void testDeleteIfRemovesMatchingKeysFromTracker() {
        store.put("item:1", "A", ITEM_TTL);
        store.put("misc:1", "B", ITEM_TTL);

        List<String> removed = store.deleteIf(key -> key.startsWith("item:"));

        assertEquals(List.of("item:1"), removed);
        assertTrue(store.recencyOrder("item").isEmpty());
        assertEquals(List.of("misc:1"), store.recencyOrder("misc"));
    }

    @Test
    void testTopAccessed() {
        store.put("misc:a", 1, ITEM_TTL);
        store.put("misc:b", 2, ITEM_TTL);
        store.get("misc:b");
        store.get("misc:b");
        store.get("misc:a");

        Map<String, Long> top = store.topAccessed(1);
        assertEquals(Map.of("misc:b", 3L), top);
    }

    @Test
    void testClear() {
        store.put("item:1", "A", ITEM_TTL);
        store.put("misc:1", "B", ITEM_TTL);

        store.clear();

        assertEquals(0, store.size());
        assertEquals(2, removals.size());
    }
}
