package com.mailflow.application.strategy;

import com.mailflow.application.port.out.MetricsPort;
import com.mailflow.application.service.InboundRecordStream;
import com.mailflow.application.service.NotificationListener;
import com.mailflow.application.service.SessionState;
import com.mailflow.application.service.WatchLifecycleManager;
import com.mailflow.domain.model.BatchToken;
import com.mailflow.domain.model.InboundRecord;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.RecordOutcome;
import com.mailflow.domain.model.Subscription;
import com.mailflow.domain.model.SubscriptionMode;
import com.mailflow.domain.model.WatchRegistration;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import com.mailflow.infrastructure.context.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pull or push delivery: a {@link NotificationListener}, optionally backed by a
 * {@link WatchLifecycleManager} that keeps the registration feeding the topic alive.
 *
 * <p>The manager is always stopped when the run ends, whether it ended by cancellation or failure.
 */
public class NotificationSubscriptionStrategy implements SubscriptionStrategy {

    private static final Logger log = LoggerFactory.getLogger(NotificationSubscriptionStrategy.class);

    static final Duration POLL_TIMEOUT = Duration.ofMillis(200);

    private final Subscription subscription;
    private final SessionState session;
    private final NotificationListener listener;
    private final WatchLifecycleManager watchManager;
    private final BatchDelivery delivery;
    private final MetricsPort metrics;

    public NotificationSubscriptionStrategy(
            Subscription subscription,
            SessionState session,
            NotificationListener listener,
            WatchLifecycleManager watchManager,
            BatchDelivery delivery,
            MetricsPort metrics) {
        this.subscription = subscription;
        this.session = session;
        this.listener = listener;
        this.watchManager = watchManager;
        this.delivery = delivery;
        this.metrics = metrics;
    }

    @Override
    public SubscriptionMode mode() {
        return subscription.mode();
    }

    @Override
    public Optional<WatchRegistration> watchRegistration() {
        return watchManager == null ? Optional.empty() : watchManager.current();
    }

    @Override
    public void run(CancellationSignal cancellation) {
        try {
            if (watchManager != null) {
                startWatch(cancellation);
            }
            InboundRecordStream stream = listener.start(cancellation);
            consume(stream, cancellation);
            listener.fatalError().ifPresent(e -> {
                throw e;
            });
        } finally {
            listener.stop();
            if (watchManager != null) {
                watchManager.stop();
            }
        }
    }

    private void startWatch(CancellationSignal cancellation) {
        watchManager.start(subscription.topicName().path(), subscription.filter().labelIds(),
            subscription.endTime(), cancellation);
        long seed = watchManager.registrationHistoryId();
        if (!session.hasWatermark() && seed != Watermarks.NONE) {
            session.updateWatermark(seed);
            log.info("Watermark seeded from watch registration: watermark={}", Watermarks.format(seed));
        }
    }

    private void consume(InboundRecordStream stream, CancellationSignal cancellation) {
        boolean stopping = false;
        while (true) {
            if (!stopping && cancellation.isCancelled()) {
                log.info("Cancellation received ({}), draining notifications", cancellation.reason().orElse("unknown"));
                listener.stop();
                stopping = true;
            }
            List<InboundRecord> batch;
            try {
                batch = stream.nextBatch(POLL_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while consuming notifications, {} records not delivered", stream.pending());
                cancellation.cancel("interrupted");
                return;
            }
            if (batch.isEmpty()) {
                if (stream.isFinished()) {
                    return;
                }
                continue;
            }
            deliver(batch, cancellation);
        }
    }

    private void deliver(List<InboundRecord> batch, CancellationSignal cancellation) {
        BatchToken token = batch.get(0).batchToken();
        SessionContext.set(session.sessionId(), token);
        try {
            List<MailRecord> matched = new ArrayList<>();
            for (InboundRecord record : batch) {
                RecordOutcome outcome = record.outcome();
                if (outcome instanceof RecordOutcome.Matched m) {
                    matched.add(m.record());
                } else if (outcome instanceof RecordOutcome.Filtered f) {
                    metrics.incrementRecordsFiltered();
                    log.debug("Message filtered out: id={}", f.record().id());
                } else if (outcome instanceof RecordOutcome.Failed failed) {
                    metrics.incrementRecordFailures();
                    log.warn("Batch {} produced a failed record: {}", token, failed.reason());
                }
            }
            log.debug("Batch {} resolved: records={}, matched={}", token, batch.size(), matched.size());
            delivery.deliver(matched, cancellation);
        } finally {
            SessionContext.clearBatch();
        }
    }
}
