/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon threads named {@code <name>-<n>}, so background cache work never blocks JVM exit.
 */
public final class NamedDaemonThreadFactory implements ThreadFactory {
    private final String name;
    private final AtomicInteger seq = new AtomicInteger();

    public NamedDaemonThreadFactory(String name) {
        this.name = name;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
