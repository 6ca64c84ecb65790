package com.mailflow.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of the current (or last) subscription run.
 */
public record SubscriptionStatus(
    String name,
    SubscriptionMode mode,
    UUID sessionId,
    Instant startedAt,
    long watermark,
    long lastBatchToken,
    boolean running,
    Instant endTime,
    WatchRegistration watch
) {
}
