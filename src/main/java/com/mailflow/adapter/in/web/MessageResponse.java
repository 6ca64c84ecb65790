package com.mailflow.adapter.in.web;

import com.mailflow.domain.model.MailRecord;

import java.time.Instant;
import java.util.List;

public record MessageResponse(
    String id,
    String threadId,
    String historyId,
    String from,
    String to,
    String subject,
    String snippet,
    String body,
    List<String> labels,
    boolean unread,
    Instant date
) {
    public static MessageResponse from(MailRecord record) {
        return new MessageResponse(
            record.id(),
            record.threadId(),
            Long.toUnsignedString(record.historyId()),
            record.from(),
            record.to(),
            record.subject(),
            record.snippet(),
            record.body(),
            record.labels(),
            record.unread(),
            record.date()
        );
    }
}
