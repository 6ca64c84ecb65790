package com.mailflow.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording sync metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementNotificationsReceived();

    void incrementRecordsEmitted(int count);

    void incrementRecordsFiltered();

    void incrementRecordFailures();

    void incrementPollCycles();

    void incrementWatchRenewals();

    <T> T recordHistoryResolve(Supplier<T> operation);
}
