/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.aside;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SingleFlightTest {

    private final SingleFlight flight = new SingleFlight();

    @Test
    void testSoloCallIsNotShared() throws Exception {
        SingleFlight.Result<String> r = flight.execute("k", () -> "v");

        assertEquals("v", r.value());
        assertFalse(r.shared());
        assertEquals(0, flight.inFlight());
    }

    @Test
    void testFollowersReceiveLeaderFailure() throws Exception {
        CountDownLatch leaderStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        IOException failure = new IOException("db down");
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            Future<?> leader = pool.submit(() -> flight.execute("k", () -> {
                leaderStarted.countDown();
                release.await();
                throw failure;
            }));
            assertTrue(leaderStarted.await(5, TimeUnit.SECONDS));

            Future<?> follower = pool.submit(() -> flight.execute("k", () -> "never"));
            // Let the follower attach before the leader fails
            Thread.sleep(100);
            release.countDown();

            ExecutionException le = assertThrows(ExecutionException.class, () -> leader.get(5, TimeUnit.SECONDS));
            ExecutionException fe = assertThrows(ExecutionException.class, () -> follower.get(5, TimeUnit.SECONDS));
            assertSame(failure, le.getCause());
            assertSame(failure, fe.getCause());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(0, flight.inFlight());
    }

    @Test
    void testDifferentKeysDoNotBlockEachOther() throws Exception {
        CountDownLatch slowStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            Future<SingleFlight.Result<String>> slow = pool.submit(() -> flight.execute("slow", () -> {
                slowStarted.countDown();
                release.await();
                return "slow";
            }));
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

            Future<SingleFlight.Result<String>> fast = pool.submit(() -> flight.execute("fast", () -> "fast"));
            assertEquals("fast", fast.get(5, TimeUnit.SECONDS).value());

            release.countDown();
            assertEquals("slow", slow.get(5, TimeUnit.SECONDS).value());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testKeyIsReusableAfterCompletion() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> seen = new ArrayList<>();

        for (int i = 0; i < 3; i++) {
            seen.add(flight.execute("k", calls::incrementAndGet).value());
        }

        assertEquals(List.of(1, 2, 3), seen);
    }
}
