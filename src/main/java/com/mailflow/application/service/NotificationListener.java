package com.mailflow.application.service;

import com.mailflow.application.port.out.DeliveryClient;
import com.mailflow.application.port.out.DeliveryClient.AckDecision;
import com.mailflow.application.port.out.MetricsPort;
import com.mailflow.domain.error.NotificationError;
import com.mailflow.domain.model.BatchToken;
import com.mailflow.domain.model.Envelope;
import com.mailflow.domain.model.InboundRecord;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.Notification;
import com.mailflow.domain.model.RecordOutcome;
import com.mailflow.domain.model.Result;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import com.mailflow.infrastructure.context.SessionContext;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns delivered change notifications into correlated records.
 *
 * <p>For each envelope a batch token is minted, the watermark is advanced to the notified history id,
 * and the history between the previous and the new watermark is resolved. Every envelope is
 * acknowledged, including the ones whose processing failed; those yield one failed record instead.
 * Envelopes may be handled concurrently, so only the records of a single notification are ordered.
 */
public class NotificationListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationListener.class);

    private final DeliveryClient deliveryClient;
    private final NotificationDecoder decoder;
    private final HistoryResolver resolver;
    private final SessionState session;
    private final MetricsPort metrics;
    private final MailFilter filter;
    private final Duration stopTimeout;

    private final InboundRecordStream stream = new InboundRecordStream();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final AtomicReference<RuntimeException> fatalError = new AtomicReference<>();
    private volatile CancellationSignal cancellation;

    public NotificationListener(
            DeliveryClient deliveryClient,
            NotificationDecoder decoder,
            HistoryResolver resolver,
            SessionState session,
            MetricsPort metrics,
            MailFilter filter,
            Duration stopTimeout) {
        this.deliveryClient = deliveryClient;
        this.decoder = decoder;
        this.resolver = resolver;
        this.session = session;
        this.metrics = metrics;
        this.filter = filter;
        this.stopTimeout = stopTimeout;
    }

    /**
     * Starts the delivery client and returns the stream its notifications are resolved into.
     * An authorization failure while handling a notification cancels {@code cancellation}.
     */
    public InboundRecordStream start(CancellationSignal cancellation) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Listener already started");
        }
        this.cancellation = cancellation;
        deliveryClient.start(this::handle);
        log.info("Notification listener started: sessionId={}, watermark={}",
            session.sessionId(), Watermarks.format(session.currentWatermark()));
        return stream;
    }

    /**
     * Stops the delivery client, letting in-flight envelopes finish, then closes the stream.
     * Records already queued stay readable. Safe to call more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        boolean drained = deliveryClient.stop(stopTimeout);
        if (!drained) {
            log.warn("Delivery client did not drain within {}", stopTimeout);
        }
        stream.close();
        log.info("Notification listener stopped: sessionId={}, pending={}", session.sessionId(), stream.pending());
    }

    public InboundRecordStream stream() {
        return stream;
    }

    /**
     * The failure that made further progress impossible, if any.
     */
    public Optional<RuntimeException> fatalError() {
        return Optional.ofNullable(fatalError.get());
    }

    AckDecision handle(Envelope envelope) {
        metrics.incrementNotificationsReceived();
        Result<Notification, NotificationError> decoded = decoder.decode(envelope.data());
        BatchToken token = session.nextBatchToken();
        SessionContext.set(session.sessionId(), token);
        try {
            if (decoded.isFailure()) {
                NotificationError error = decoded.errorOrNull();
                log.warn("Discarding notification {}: {}", envelope.messageId(), error.message());
                publishFailure(token, RecordOutcome.Failed.of(error.message()));
                return AckDecision.ACK;
            }
            process(token, decoded.getOrThrow());
        } catch (MailboxAuthorizationException e) {
            log.error("Mailbox rejected credentials while handling notification {}", envelope.messageId());
            publishFailure(token, new RecordOutcome.Failed(e.getMessage(), e));
            if (fatalError.compareAndSet(null, e) && cancellation != null) {
                cancellation.cancel("authorization failure");
            }
        } catch (RuntimeException e) {
            log.warn("Failed to process notification {}: {}", envelope.messageId(), e.getMessage());
            publishFailure(token, new RecordOutcome.Failed("Failed to process notification: " + e.getMessage(), e));
        } finally {
            SessionContext.clear();
        }
        return AckDecision.ACK;
    }

    private void process(BatchToken token, Notification notification) {
        long received = notification.historyId();
        long previous = session.advanceWatermark(received);
        log.debug("Notification received: emailAddress={}, historyId={}, previous={}",
            notification.emailAddress(), Watermarks.format(received), Watermarks.format(previous));

        if (previous == Watermarks.NONE) {
            log.info("No watermark yet, seeding from first notification: watermark={}", Watermarks.format(received));
            return;
        }

        HistoryWindow window = resolver.resolve(previous, received, filter);
        List<InboundRecord> records = window.records()
            .map(outcome -> new InboundRecord(token, outcome))
            .toList();
        if (!records.isEmpty() && !stream.publish(records)) {
            log.warn("Stream closed, dropped {} records of batch {}", records.size(), token);
        }
    }

    private void publishFailure(BatchToken token, RecordOutcome.Failed failure) {
        if (!stream.publish(List.of(new InboundRecord(token, failure)))) {
            log.warn("Stream closed, dropped failure record of batch {}", token);
        }
    }
}
