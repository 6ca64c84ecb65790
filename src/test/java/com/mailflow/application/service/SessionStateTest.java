package com.mailflow.application.service;

import com.mailflow.domain.model.BatchToken;
import com.mailflow.domain.model.Watermarks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionState")
class SessionStateTest {

    private SessionState newSession(long watermark) {
        return new SessionState(UUID.randomUUID(), Instant.now(), watermark);
    }

    @Nested
    @DisplayName("updateWatermark")
    class UpdateWatermarkTests {

        @Test
        @DisplayName("Should only move forward")
        void shouldOnlyMoveForward() {
            SessionState session = newSession(100);

            assertTrue(session.updateWatermark(150));
            assertFalse(session.updateWatermark(120));
            assertFalse(session.updateWatermark(150));

            assertEquals(150, session.currentWatermark());
        }

        @Test
        @DisplayName("Should treat ids above the signed range as larger")
        void shouldCompareUnsigned() {
            SessionState session = newSession(Long.MAX_VALUE);
            long huge = Long.parseUnsignedLong("9223372036854775900");

            assertTrue(session.updateWatermark(huge));
            assertEquals(huge, session.currentWatermark());
        }

        @Test
        @DisplayName("A fresh session has no watermark")
        void freshSessionHasNoWatermark() {
            SessionState session = newSession(Watermarks.NONE);

            assertFalse(session.hasWatermark());
            session.updateWatermark(1);
            assertTrue(session.hasWatermark());
        }
    }

    @Nested
    @DisplayName("advanceWatermark")
    class AdvanceWatermarkTests {

        @Test
        @DisplayName("Should return the previous value and keep the maximum")
        void shouldReturnPrevious() {
            SessionState session = newSession(100);

            assertEquals(100, session.advanceWatermark(150));
            assertEquals(150, session.advanceWatermark(120));
            assertEquals(150, session.currentWatermark());
        }

        @Test
        @DisplayName("Concurrent advances end at the highest candidate")
        void concurrentAdvancesKeepMaximum() throws Exception {
            SessionState session = newSession(0);
            int threads = 8;
            int perThread = 500;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);

            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int offset = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = perThread; i > 0; i--) {
                        session.advanceWatermark((long) i * threads + offset);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
            executor.shutdown();

            assertEquals((long) perThread * threads + threads - 1, session.currentWatermark());
        }
    }

    @Test
    @DisplayName("Batch tokens are unique and strictly increasing")
    void batchTokensAreUniqueAndIncreasing() throws Exception {
        SessionState session = newSession(0);
        int threads = 4;
        int perThread = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        Set<BatchToken> tokens = Collections.synchronizedSet(new HashSet<>());

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    tokens.add(session.nextBatchToken());
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get();
        }
        executor.shutdown();

        assertEquals(threads * perThread, tokens.size());
        assertEquals(threads * perThread, session.lastBatchToken());

        BatchToken a = session.nextBatchToken();
        BatchToken b = session.nextBatchToken();
        assertTrue(Long.compareUnsigned(a.value(), b.value()) < 0);
    }
}
