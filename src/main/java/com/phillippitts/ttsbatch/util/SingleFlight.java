package com.phillippitts.ttsbatch.util;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Per-key duplicate call suppression: while a call for a key is in flight, further callers for
 * the same key wait for it and share its outcome (value or exception) instead of running the work
 * again.
 *
 * <p>The work runs on the thread of the first caller. The key is released as soon as the call
 * completes, so a later call for the same key starts fresh; results are never memoized.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe.
 *
 * @param <K> key type
 * @param <V> result type
 * @since 1.0
 */
public final class SingleFlight<K, V> {

    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * Runs {@code work} for {@code key}, or joins the call already in progress for it.
     *
     * <p>Runtime exceptions and errors thrown by the work are rethrown unchanged to every caller.
     *
     * @param key deduplication key
     * @param work the call to run if none is in flight
     * @return the shared result
     */
    public V execute(K key, Supplier<V> work) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(work, "work");

        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return await(existing);
        }
        try {
            V value = work.get();
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Returns true if a call for {@code key} is currently running.
     */
    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    /**
     * Number of keys with a call in progress.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private static <V> V await(CompletableFuture<V> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for in-flight call", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new CompletionException(cause);
        }
    }
}
