package com.mailflow.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * A mailbox message resolved from the change stream.
 * Bodies are kept in memory only for the lifetime of a batch.
 */
public record MailRecord(
    String id,
    String threadId,
    long historyId,
    String from,
    String to,
    String subject,
    String snippet,
    String body,
    List<String> labels,
    boolean unread,
    Instant date
) {
    public MailRecord {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
