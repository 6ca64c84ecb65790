package com.mailflow.infrastructure.metrics;

import com.mailflow.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter notificationsReceived;
    private final Counter recordsEmitted;
    private final Counter recordsFiltered;
    private final Counter recordFailures;
    private final Counter pollCycles;
    private final Counter watchRenewals;
    private final Timer historyResolveDuration;

    public AppMetrics(MeterRegistry registry) {
        this.notificationsReceived = Counter.builder("mailflow_notifications_received_total")
            .description("Total number of change notifications received")
            .register(registry);

        this.recordsEmitted = Counter.builder("mailflow_records_emitted_total")
            .description("Total number of matched records handed to output actions")
            .register(registry);

        this.recordsFiltered = Counter.builder("mailflow_records_filtered_total")
            .description("Total number of resolved records rejected by the filter")
            .register(registry);

        this.recordFailures = Counter.builder("mailflow_record_failures_total")
            .description("Total number of records that could not be fetched or decoded")
            .register(registry);

        this.pollCycles = Counter.builder("mailflow_poll_cycles_total")
            .description("Total number of polling cycles run")
            .register(registry);

        this.watchRenewals = Counter.builder("mailflow_watch_renewals_total")
            .description("Total number of watch registrations renewed before expiry")
            .register(registry);

        this.historyResolveDuration = Timer.builder("mailflow_history_resolve_duration_seconds")
            .description("Time taken to list a history window")
            .register(registry);
    }

    @Override
    public void incrementNotificationsReceived() {
        notificationsReceived.increment();
    }

    @Override
    public void incrementRecordsEmitted(int count) {
        recordsEmitted.increment(count);
    }

    @Override
    public void incrementRecordsFiltered() {
        recordsFiltered.increment();
    }

    @Override
    public void incrementRecordFailures() {
        recordFailures.increment();
    }

    @Override
    public void incrementPollCycles() {
        pollCycles.increment();
    }

    @Override
    public void incrementWatchRenewals() {
        watchRenewals.increment();
    }

    @Override
    public <T> T recordHistoryResolve(Supplier<T> operation) {
        return historyResolveDuration.record(operation);
    }
}
