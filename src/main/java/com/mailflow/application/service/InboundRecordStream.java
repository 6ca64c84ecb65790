package com.mailflow.application.service;

import com.mailflow.domain.model.InboundRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded queue of records produced by concurrent notification handlers and read by a single consumer.
 *
 * <p>Records of one notification are published together, so they are contiguous in the queue.
 * After {@link #close()} nothing more is accepted; the consumer keeps reading until the queue is drained.
 */
public final class InboundRecordStream {

    private final LinkedBlockingQueue<InboundRecord> queue = new LinkedBlockingQueue<>();
    private final Object publishLock = new Object();
    private volatile boolean closed;

    /**
     * @return false if the stream was already closed and the records were dropped
     */
    public boolean publish(List<InboundRecord> records) {
        synchronized (publishLock) {
            if (closed) {
                return false;
            }
            queue.addAll(records);
            return true;
        }
    }

    public void close() {
        synchronized (publishLock) {
            closed = true;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * True once the stream is closed and every published record was read.
     */
    public boolean isFinished() {
        return closed && queue.isEmpty();
    }

    /**
     * Waits up to {@code timeout} for the next record, then returns it together with every queued
     * record carrying the same batch token. Returns an empty list on timeout.
     */
    public List<InboundRecord> nextBatch(Duration timeout) throws InterruptedException {
        InboundRecord first = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) {
            return List.of();
        }
        List<InboundRecord> batch = new ArrayList<>();
        batch.add(first);
        InboundRecord next;
        while ((next = queue.peek()) != null && next.batchToken().equals(first.batchToken())) {
            batch.add(queue.poll());
        }
        return batch;
    }

    public int pending() {
        return queue.size();
    }
}
