package com.example.cachesync.coalesce;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class CallCoalescerTest {

    private ExecutorService remotePool;
    private ExecutorService callers;
    private CallCoalescer coalescer;

    @BeforeEach
    void setUp() {
        remotePool = Executors.newFixedThreadPool(4);
        callers = Executors.newFixedThreadPool(8);
        coalescer = new CallCoalescer(new RemoteCallExecutor(remotePool, Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        remotePool.shutdownNow();
    }

    @Test
    void testConcurrentCallsShareOnePhysicalCall() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);

        List<Future<String>> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            results.add(callers.submit(() -> coalescer.invoke("item:9", () -> {
                invocations.incrementAndGet();
                release.await();
                return "value-for-item:9";
            })));
        }
        waitUntil(() -> coalescer.getJoinedCalls() == 4);
        release.countDown();

        for (Future<String> result : results) {
            assertEquals("value-for-item:9", result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, invocations.get());
        assertEquals(1, coalescer.getPhysicalCalls());
        assertEquals(0, coalescer.pendingCount());
    }

    @Test
    void testConcurrentCallersShareTheFailure() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        IOException failure = new IOException("backend down");

        List<Future<String>> results = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            results.add(callers.submit(() -> coalescer.invoke("item:1", () -> {
                release.await();
                throw failure;
            })));
        }
        waitUntil(() -> coalescer.getJoinedCalls() == 2);
        release.countDown();

        for (Future<String> result : results) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            RemoteCallException remote = assertInstanceOf(RemoteCallException.class, e.getCause());
            assertSame(failure, remote.getCause());
            assertFalse(remote.isTimeout());
        }
        assertFalse(coalescer.isPending("item:1"));
    }

    @Test
    void testPendingSlotReleasedBeforeSuccessHookAndWaiters() {
        AtomicBoolean pendingDuringHook = new AtomicBoolean(true);

        String value = RemoteCallExecutor.await("item:1", coalescer.submit("item:1", () -> "A", null,
            result -> pendingDuringHook.set(coalescer.isPending("item:1"))));

        assertEquals("A", value);
        assertFalse(pendingDuringHook.get());
    }

    @Test
    void testCallAfterCompletionIsNotCoalesced() {
        AtomicInteger invocations = new AtomicInteger();

        coalescer.invoke("item:1", invocations::incrementAndGet);
        coalescer.invoke("item:1", invocations::incrementAndGet);

        assertEquals(2, invocations.get());
        assertEquals(0, coalescer.getJoinedCalls());
    }

    @Test
    void testTimeoutFailsCallAndFreesSignature() {
        CountDownLatch never = new CountDownLatch(1);

        RemoteCallException e = assertThrows(RemoteCallException.class, () -> coalescer.invoke("slow", () -> {
            never.await();
            return "late";
        }, Duration.ofMillis(50)));

        assertTrue(e.isTimeout());
        assertFalse(coalescer.isPending("slow"));
        assertEquals("fast", coalescer.invoke("slow", () -> "fast"));
    }

    @Test
    void testSuccessHookRunsOnceForCoalescedCallers() throws Exception {
        AtomicInteger hookRuns = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);

        List<Future<Object>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            results.add(callers.submit(() -> RemoteCallExecutor.await("k", coalescer.submit("k", () -> {
                release.await();
                return "v";
            }, null, v -> hookRuns.incrementAndGet()))));
        }
        waitUntil(() -> coalescer.getJoinedCalls() == 3);
        release.countDown();
        for (Future<Object> result : results) {
            assertEquals("v", result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, hookRuns.get());
    }

    @Test
    void testDifferentSignaturesRunSeparately() {
        AtomicInteger invocations = new AtomicInteger();

        assertEquals(1, coalescer.<Integer>invoke("a", invocations::incrementAndGet));
        assertEquals(2, coalescer.<Integer>invoke("b", invocations::incrementAndGet));
    }

    static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }
}
