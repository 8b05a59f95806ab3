package com.example.cachesync.coalesce;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RemoteCallExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private final RemoteCallExecutor executor = new RemoteCallExecutor(pool, Duration.ofMillis(50));

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void testDefaultTimeoutInterruptsWorker() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        RemoteCallException e = assertThrows(RemoteCallException.class, () ->
            RemoteCallExecutor.await("slow", executor.execute("slow", () -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException ie) {
                    interrupted.countDown();
                    throw ie;
                }
                return "late";
            }, null)));

        assertTrue(e.isTimeout());
        assertEquals("slow", e.getSignature());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testExplicitTimeoutOverridesDefault() {
        String value = RemoteCallExecutor.await("k", executor.execute("k", () -> {
            Thread.sleep(100);
            return "ok";
        }, Duration.ofSeconds(5)));

        assertEquals("ok", value);
    }

    @Test
    void testRemoteCallExceptionIsNotWrappedTwice() {
        RemoteCallException original = new RemoteCallException("inner", new IllegalStateException("x"));

        RemoteCallException e = assertThrows(RemoteCallException.class, () ->
            RemoteCallExecutor.await("outer", executor.execute("outer", () -> { throw original; }, null)));

        assertSame(original, e);
    }

    @Test
    void testRejectedWhenPoolIsShutDown() {
        pool.shutdown();

        RemoteCallException e = assertThrows(RemoteCallException.class, () ->
            RemoteCallExecutor.await("k", executor.execute("k", () -> "v", null)));

        assertFalse(e.isTimeout());
    }
}
