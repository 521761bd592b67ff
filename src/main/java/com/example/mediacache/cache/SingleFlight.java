package com.example.mediacache.cache;

import com.example.mediacache.MediaCacheException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Collapses concurrent calls for the same key into one execution; late callers wait for
 * and share the first caller's result or failure.
 */
final class SingleFlight<K, V> {
    private final ConcurrentHashMap<K, CompletableFuture<V>> calls = new ConcurrentHashMap<>();

    @FunctionalInterface
    interface Call<V> {
        V call() throws MediaCacheException;
    }

    V execute(K key, Call<V> call) throws MediaCacheException {
        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = calls.putIfAbsent(key, mine);
        if (existing != null) {
            return await(key, existing);
        }
        try {
            V value = call.call();
            mine.complete(value);
            return value;
        } catch (Throwable ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            calls.remove(key, mine);
        }
    }

    int inFlight() {
        return calls.size();
    }

    private V await(K key, CompletableFuture<V> pending) throws MediaCacheException {
        try {
            return pending.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MediaCacheException("Interrupted while waiting for " + key, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof MediaCacheException) {
                throw (MediaCacheException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new MediaCacheException("Generation of " + key + " failed", cause);
        }
    }
}
