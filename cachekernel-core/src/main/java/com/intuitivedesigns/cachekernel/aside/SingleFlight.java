/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.aside;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-key call coalescing.
 * <p>
 * The first caller for a key (the leader) runs the work on its own thread; callers arriving while it
 * runs (followers) block until it finishes and receive the same value or the same exception.
 * Different keys never wait on each other. Once the leader finishes the key is free again, so a later
 * call starts a fresh execution.
 */
public final class SingleFlight {

    private final ConcurrentHashMap<String, Call> inFlight = new ConcurrentHashMap<>();

    private static final class Call {
        final CompletableFuture<Object> promise = new CompletableFuture<>();
        final AtomicInteger followers = new AtomicInteger();
    }

    /**
     * Outcome of {@link #execute}; {@code shared} is true when more than one caller received this value.
     */
    public record Result<T>(T value, boolean shared) {}

    public <T> Result<T> execute(String key, CacheLoader<T> work) throws Exception {
        final Call call = new Call();
        final Call existing = inFlight.putIfAbsent(key, call);

        if (existing != null) {
            existing.followers.incrementAndGet();
            return new Result<>(awaitLeader(existing), true);
        }

        try {
            final T value = work.load();
            call.promise.complete(value);
            return new Result<>(value, call.followers.get() > 0);
        } catch (Throwable t) {
            call.promise.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(key, call);
        }
    }

    /**
     * @return number of keys currently being loaded
     */
    public int inFlight() {
        return inFlight.size();
    }

    @SuppressWarnings("unchecked")
    private static <T> T awaitLeader(Call call) throws Exception {
        try {
            return (T) call.promise.get();
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }
}
