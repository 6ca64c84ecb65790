package com.mailflow.application.service;

import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.port.out.MailboxClient.MailboxProfile;
import com.mailflow.application.port.out.MailboxClient.MessagePage;
import com.mailflow.application.port.out.MetricsPort;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.RecordOutcome;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import com.mailflow.infrastructure.exception.HistoryWindowException;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import com.mailflow.infrastructure.exception.MailboxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Periodically resolves everything added to the mailbox since the session watermark.
 *
 * <p>One engine serves one subscription run: {@code IDLE -> FETCHING -> WAITING -> FETCHING ... -> STOPPED}.
 */
public class PollingEngine {

    private static final Logger log = LoggerFactory.getLogger(PollingEngine.class);

    public enum State {
        IDLE,
        FETCHING,
        WAITING,
        STOPPED
    }

    private final HistoryResolver resolver;
    private final MailboxClient mailbox;
    private final MetricsPort metrics;
    private final SessionState session;
    private final MailFilter filter;
    private final Duration interval;

    private volatile State state = State.IDLE;

    public PollingEngine(
            HistoryResolver resolver,
            MailboxClient mailbox,
            MetricsPort metrics,
            SessionState session,
            MailFilter filter,
            Duration interval) {
        this.resolver = resolver;
        this.mailbox = mailbox;
        this.metrics = metrics;
        this.session = session;
        this.filter = filter;
        this.interval = interval;
    }

    public State state() {
        return state;
    }

    /**
     * Polls until {@code cancellation} fires. Each completed cycle hands its matched records to
     * {@code sink}, including empty batches; the bootstrap cycle hands over nothing.
     *
     * @throws MailboxAuthorizationException as soon as the mailbox rejects our credentials
     */
    public void run(Consumer<List<MailRecord>> sink, CancellationSignal cancellation) {
        log.info("Polling started: sessionId={}, interval={}, watermark={}",
            session.sessionId(), interval, Watermarks.format(session.currentWatermark()));
        try {
            while (!cancellation.isCancelled()) {
                state = State.FETCHING;
                try {
                    cycle().ifPresent(sink);
                } catch (MailboxAuthorizationException e) {
                    log.error("Polling stopped, mailbox rejected credentials: {}", e.getMessage());
                    throw e;
                } catch (HistoryWindowException e) {
                    if (e.isExpired()) {
                        log.warn("History from {} is no longer available, re-seeding watermark",
                            Watermarks.format(e.getStartHistoryId()));
                        reseed();
                    } else {
                        log.warn("Poll cycle failed, retrying next cycle: {}", e.getMessage());
                    }
                } catch (MailboxException e) {
                    log.warn("Poll cycle failed, retrying next cycle: {}", e.getMessage());
                }
                state = State.WAITING;
                if (cancellation.await(interval)) {
                    break;
                }
            }
        } finally {
            state = State.STOPPED;
            log.info("Polling stopped: sessionId={}, watermark={}",
                session.sessionId(), Watermarks.format(session.currentWatermark()));
        }
    }

    private void reseed() {
        try {
            bootstrap();
        } catch (MailboxAuthorizationException e) {
            log.error("Polling stopped, mailbox rejected credentials: {}", e.getMessage());
            throw e;
        } catch (MailboxException e) {
            log.warn("Re-seeding watermark failed, retrying next cycle: {}", e.getMessage());
        }
    }

    /**
     * Runs one cycle. Returns empty when the cycle only seeded the watermark.
     */
    Optional<List<MailRecord>> cycle() {
        metrics.incrementPollCycles();
        if (!session.hasWatermark()) {
            bootstrap();
            return Optional.empty();
        }

        long watermark = session.currentWatermark();
        HistoryWindow window = resolver.resolve(watermark, null, filter);
        List<MailRecord> matched = new ArrayList<>();
        window.records().forEach(outcome -> collect(outcome, matched));
        window.highestHistoryId().ifPresent(session::updateWatermark);

        log.debug("Poll cycle complete: from={}, matched={}, watermark={}",
            Watermarks.format(watermark), matched.size(), Watermarks.format(session.currentWatermark()));
        return Optional.of(matched);
    }

    /**
     * Seeds the watermark from the most recent message, or from the mailbox profile when the
     * mailbox has no message matching the filter. The fetched message is not emitted.
     */
    void bootstrap() {
        MessagePage page = mailbox.listMessages(filter.withMaxResults(1).withPageToken(null));
        long seed = Watermarks.NONE;
        if (!page.messageIds().isEmpty()) {
            seed = mailbox.getMessage(page.messageIds().get(0)).historyId();
        }
        if (seed == Watermarks.NONE) {
            MailboxProfile profile = mailbox.getProfile();
            seed = profile.historyId();
        }
        if (session.updateWatermark(seed)) {
            log.info("Watermark seeded: sessionId={}, watermark={}", session.sessionId(), Watermarks.format(seed));
        } else {
            log.debug("Bootstrap did not move watermark: candidate={}", Watermarks.format(seed));
        }
    }

    private void collect(RecordOutcome outcome, List<MailRecord> matched) {
        if (outcome instanceof RecordOutcome.Matched m) {
            matched.add(m.record());
        } else if (outcome instanceof RecordOutcome.Filtered f) {
            metrics.incrementRecordsFiltered();
            log.debug("Message filtered out: id={}", f.record().id());
        } else if (outcome instanceof RecordOutcome.Failed failed) {
            metrics.incrementRecordFailures();
            log.warn("Skipping message: {}", failed.reason());
        }
    }
}
