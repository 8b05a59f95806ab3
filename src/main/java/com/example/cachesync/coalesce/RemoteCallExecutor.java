package com.example.cachesync.coalesce;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs remote work on a dedicated pool, each call bounded by a timeout.
 * A call that times out has its worker interrupted.
 */
public class RemoteCallExecutor {

    private final ExecutorService asyncExecutor;
    private final Duration defaultTimeout;

    public RemoteCallExecutor(ExecutorService asyncExecutor, Duration defaultTimeout) {
        this.asyncExecutor = asyncExecutor;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Starts {@code operation}. The returned future fails with a {@link RemoteCallException}
     * when the operation throws or runs past {@code timeout} ({@code null} for the default).
     */
    public <T> CompletableFuture<T> execute(String signature, Callable<T> operation, Duration timeout) {
        Duration bound = timeout != null ? timeout : defaultTimeout;
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = asyncExecutor.submit(() -> {
                try {
                    result.complete(operation.call());
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new RemoteCallException(signature,
                "Remote call rejected, executor is shut down: " + signature, e, false));
        }
        CompletableFuture<T> bounded = new CompletableFuture<>();
        result.orTimeout(bound.toMillis(), TimeUnit.MILLISECONDS).whenComplete((value, error) -> {
            if (error == null) {
                bounded.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                task.cancel(true);
                bounded.completeExceptionally(new RemoteCallException(signature,
                    "Remote call timed out after " + bound.toMillis() + "ms: " + signature, cause, true));
            } else {
                bounded.completeExceptionally(toRemoteCallException(signature, cause));
            }
        });
        return bounded;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Blocks for {@code future} and translates every failure into a {@link RemoteCallException}.
     */
    public static <T> T await(String signature, CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(signature, "Interrupted while waiting for " + signature, e, false);
        } catch (ExecutionException | CancellationException e) {
            throw toRemoteCallException(signature, unwrap(e));
        }
    }

    static RemoteCallException toRemoteCallException(String signature, Throwable cause) {
        if (cause instanceof RemoteCallException) {
            return (RemoteCallException) cause;
        }
        return new RemoteCallException(signature, cause);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
