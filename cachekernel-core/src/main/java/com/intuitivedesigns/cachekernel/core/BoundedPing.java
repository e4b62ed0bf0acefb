/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link CacheBackend#ping()} with a hard deadline.
 * <p>
 * The ping runs on a throwaway daemon thread; if it hangs past the deadline the caller moves on
 * and the thread is left to the backend's own socket timeout.
 */
public final class BoundedPing {

    private static final Executor PING_THREADS = r -> new NamedDaemonThreadFactory("cache-ping").newThread(r).start();

    private BoundedPing() {}

    public static void ping(CacheBackend backend, Duration timeout) throws CacheException {
        final CompletableFuture<Void> f = CompletableFuture.runAsync(() -> {
            try {
                backend.ping();
            } catch (CacheException e) {
                throw new CompletionException(e);
            }
        }, PING_THREADS);

        try {
            f.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof CacheException) {
                throw (CacheException) cause;
            }
            if (cause instanceof TimeoutException) {
                throw new BackendUnavailableException("ping", null, "no reply within " + timeout.toMillis() + "ms");
            }
            throw new BackendUnavailableException("ping", null, cause);
        }
    }
}
