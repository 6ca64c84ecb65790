package com.mailflow.application.service;

import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.port.out.MetricsPort;
import com.mailflow.application.service.HistoryWindow.AddedMessage;
import com.mailflow.domain.model.HistoryEntry;
import com.mailflow.domain.model.HistoryPage;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.Watermarks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Turns a watermark range into the messages added within it.
 *
 * <p>The backend may return entries outside the requested range, so every entry is checked
 * against {@code low < id <= high} before it is kept.
 */
@Component
public class HistoryResolver {

    private static final Logger log = LoggerFactory.getLogger(HistoryResolver.class);

    private final MailboxClient mailbox;
    private final MetricsPort metrics;

    public HistoryResolver(MailboxClient mailbox, MetricsPort metrics) {
        this.mailbox = mailbox;
        this.metrics = metrics;
    }

    /**
     * Lists the history after {@code low}, up to and including {@code high}.
     *
     * @param high upper bound, or null for no upper bound
     * @throws com.mailflow.infrastructure.exception.HistoryWindowException if the history cannot be listed
     */
    public HistoryWindow resolve(long low, Long high, MailFilter filter) {
        if (high != null && !Watermarks.isAfter(high, low)) {
            log.debug("Empty history window ({}, {}]", Watermarks.format(low), Watermarks.format(high));
            return new HistoryWindow(low, high, List.of(), OptionalLong.empty(), mailbox, filter);
        }
        List<HistoryEntry> entries = metrics.recordHistoryResolve(() -> listWindow(low, high));
        OptionalLong highest = entries.isEmpty()
            ? OptionalLong.empty()
            : OptionalLong.of(entries.get(entries.size() - 1).id());
        return new HistoryWindow(low, high, toAddedMessages(entries), highest, mailbox, filter);
    }

    private List<HistoryEntry> listWindow(long low, Long high) {
        List<HistoryEntry> retained = new ArrayList<>();
        int discarded = 0;
        int pages = 0;
        String pageToken = null;
        do {
            HistoryPage page = mailbox.listHistory(low, pageToken);
            pages++;
            for (HistoryEntry entry : page.entries()) {
                if (Watermarks.inWindow(entry.id(), low, high)) {
                    retained.add(entry);
                } else {
                    discarded++;
                }
            }
            pageToken = page.hasNextPage() ? page.nextPageToken() : null;
        } while (pageToken != null);

        retained.sort(Comparator.comparing(HistoryEntry::id, Long::compareUnsigned));
        log.debug("Listed history window ({}, {}]: pages={}, entries={}, discarded={}",
            Watermarks.format(low), high == null ? "latest" : Watermarks.format(high),
            pages, retained.size(), discarded);
        return retained;
    }

    private List<AddedMessage> toAddedMessages(List<HistoryEntry> entries) {
        Set<String> seen = new LinkedHashSet<>();
        List<AddedMessage> added = new ArrayList<>();
        for (HistoryEntry entry : entries) {
            for (String messageId : entry.addedMessageIds()) {
                if (seen.add(messageId)) {
                    added.add(new AddedMessage(entry.id(), messageId));
                }
            }
        }
        return added;
    }
}
