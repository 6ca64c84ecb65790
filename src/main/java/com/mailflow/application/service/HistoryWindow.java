package com.mailflow.application.service;

import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.RecordOutcome;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * The added messages of one resolved {@code (low, high]} history range, in ascending history order.
 *
 * <p>Messages are fetched only while {@link #records()} is consumed, and the stream can be consumed once.
 */
public final class HistoryWindow {

    private static final Logger log = LoggerFactory.getLogger(HistoryWindow.class);

    private final long low;
    private final Long high;
    private final List<AddedMessage> added;
    private final OptionalLong highestHistoryId;
    private final MailboxClient mailbox;
    private final MailFilter filter;
    private final AtomicBoolean consumed = new AtomicBoolean();

    HistoryWindow(long low, Long high, List<AddedMessage> added, OptionalLong highestHistoryId,
                  MailboxClient mailbox, MailFilter filter) {
        this.low = low;
        this.high = high;
        this.added = List.copyOf(added);
        this.highestHistoryId = highestHistoryId;
        this.mailbox = mailbox;
        this.filter = filter;
    }

    public long low() {
        return low;
    }

    public Long high() {
        return high;
    }

    public int size() {
        return added.size();
    }

    public boolean isEmpty() {
        return added.isEmpty();
    }

    /**
     * Highest history entry id retained in the window, empty when the window had no entries.
     */
    public OptionalLong highestHistoryId() {
        return highestHistoryId;
    }

    /**
     * Lazily fetches and classifies every added message. A message that cannot be fetched becomes
     * {@link RecordOutcome.Failed} and the remaining messages are still processed.
     *
     * @throws IllegalStateException if the records were already consumed
     * @throws MailboxAuthorizationException if the mailbox rejects our credentials while fetching
     */
    public Stream<RecordOutcome> records() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("History window records can only be consumed once");
        }
        return added.stream().map(this::fetch);
    }

    private RecordOutcome fetch(AddedMessage message) {
        try {
            MailRecord record = mailbox.getMessage(message.messageId());
            RecordOutcome outcome = RecordOutcome.classify(record, filter);
            log.debug("Resolved message: id={}, historyId={}, outcome={}",
                message.messageId(), Long.toUnsignedString(message.historyId()), outcome.getClass().getSimpleName());
            return outcome;
        } catch (MailboxAuthorizationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Failed to fetch message {}: {}", message.messageId(), e.getMessage());
            return new RecordOutcome.Failed("Failed to fetch message " + message.messageId() + ": " + e.getMessage(), e);
        }
    }

    record AddedMessage(long historyId, String messageId) {
    }
}
