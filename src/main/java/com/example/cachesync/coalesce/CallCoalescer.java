package com.example.cachesync.coalesce;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps at most one physical call in flight per signature; concurrent callers with the
 * same signature share its outcome.
 *
 * <p>When the call settles its pending slot is released first, then the success hook
 * runs (once), then the waiters are completed. A call issued right after completion
 * therefore starts a fresh physical call.
 */
public class CallCoalescer {

    private static final Logger log = LoggerFactory.getLogger(CallCoalescer.class);

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final RemoteCallExecutor callExecutor;
    private final AtomicLong physicalCalls = new AtomicLong();
    private final AtomicLong joinedCalls = new AtomicLong();

    public CallCoalescer(RemoteCallExecutor callExecutor) {
        this.callExecutor = callExecutor;
    }

    public <T> T invoke(String signature, Callable<T> operation) {
        return invoke(signature, operation, null);
    }

    public <T> T invoke(String signature, Callable<T> operation, Duration timeout) {
        return RemoteCallExecutor.await(signature, submit(signature, operation, timeout, null));
    }

    /**
     * Starts or joins the call for {@code signature}.
     *
     * @param timeout   bound on the physical call, {@code null} for the executor default
     * @param onSuccess run once with the result by the call that actually executed,
     *                  before any waiter is released; ignored when joining
     */
    public <T> CompletableFuture<T> submit(String signature, Callable<T> operation, Duration timeout,
                                          Consumer<? super T> onSuccess) {
        CompletableFuture<Object> shared = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(signature, shared);
        if (existing != null) {
            joinedCalls.incrementAndGet();
            log.debug("Joined in-flight call {}", signature);
            return view(existing);
        }

        physicalCalls.incrementAndGet();
        callExecutor.execute(signature, operation, timeout).whenComplete((value, error) -> {
            inFlight.remove(signature, shared);
            if (error != null) {
                shared.completeExceptionally(RemoteCallExecutor.toRemoteCallException(signature,
                    RemoteCallExecutor.unwrap(error)));
                return;
            }
            try {
                if (onSuccess != null) {
                    onSuccess.accept(value);
                }
            } catch (RuntimeException e) {
                shared.completeExceptionally(e);
                return;
            }
            shared.complete(value);
        });
        return view(shared);
    }

    public boolean isPending(String signature) {
        return inFlight.containsKey(signature);
    }

    public int pendingCount() {
        return inFlight.size();
    }

    public long getPhysicalCalls() {
        return physicalCalls.get();
    }

    public long getJoinedCalls() {
        return joinedCalls.get();
    }

    @SuppressWarnings("unchecked")
    private static <T> CompletableFuture<T> view(CompletableFuture<Object> shared) {
        // callers must not be able to complete the shared future
        return (CompletableFuture<T>) (CompletableFuture<?>) shared.copy();
    }
}
