package com.mailflow.application.service;

import com.mailflow.domain.model.BatchToken;
import com.mailflow.domain.model.Watermarks;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Position of one subscription run in the mailbox change stream, plus the batch counter
 * used to correlate records with the notification they came from.
 *
 * <p>Safe for concurrent use: the watermark is only moved forward under a lock and the
 * batch counter is an atomic increment.
 */
public final class SessionState {

    private final UUID sessionId;
    private final Instant startedAt;
    private final Object watermarkLock = new Object();
    private final AtomicLong batchCounter = new AtomicLong();

    private long watermark;

    public SessionState(UUID sessionId, Instant startedAt, long initialWatermark) {
        this.sessionId = sessionId;
        this.startedAt = startedAt;
        this.watermark = initialWatermark;
    }

    public UUID sessionId() {
        return sessionId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public long currentWatermark() {
        synchronized (watermarkLock) {
            return watermark;
        }
    }

    public boolean hasWatermark() {
        return currentWatermark() != Watermarks.NONE;
    }

    /**
     * Moves the watermark to {@code candidate} if it is strictly greater.
     *
     * @return true if the watermark moved
     */
    public boolean updateWatermark(long candidate) {
        synchronized (watermarkLock) {
            if (Watermarks.isAfter(candidate, watermark)) {
                watermark = candidate;
                return true;
            }
            return false;
        }
    }

    /**
     * Reads the watermark and moves it to {@code candidate} in one step, so two concurrent
     * notifications never observe the same previous value.
     *
     * @return the watermark before the update
     */
    public long advanceWatermark(long candidate) {
        synchronized (watermarkLock) {
            long previous = watermark;
            if (Watermarks.isAfter(candidate, watermark)) {
                watermark = candidate;
            }
            return previous;
        }
    }

    public BatchToken nextBatchToken() {
        return new BatchToken(batchCounter.incrementAndGet());
    }

    public long lastBatchToken() {
        return batchCounter.get();
    }
}
