package com.mailflow.application.service;

import com.mailflow.application.port.in.FetchMessagesUseCase;
import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.port.out.MailboxClient.MessagePage;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.Page;
import com.mailflow.domain.model.RecordOutcome;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot reads outside of a subscription run.
 */
@Service
public class MailFetchService implements FetchMessagesUseCase {

    private static final Logger log = LoggerFactory.getLogger(MailFetchService.class);

    private final MailboxClient mailbox;
    private final HistoryResolver resolver;

    public MailFetchService(MailboxClient mailbox, HistoryResolver resolver) {
        this.mailbox = mailbox;
        this.resolver = resolver;
    }

    @Override
    public Page<MailRecord> fetch(MailFilter filter) {
        log.debug("Fetching messages: query='{}', maxResults={}", filter.buildQuery(), filter.maxResults());
        MessagePage page = mailbox.listMessages(filter);

        List<MailRecord> records = new ArrayList<>();
        for (String messageId : page.messageIds()) {
            try {
                records.add(mailbox.getMessage(messageId));
            } catch (MailboxAuthorizationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Skipping message {}: {}", messageId, e.getMessage());
            }
        }
        log.info("Fetched {} of {} listed messages", records.size(), page.messageIds().size());
        return Page.of(records, page.nextPageToken());
    }

    @Override
    public List<MailRecord> fetchSince(long historyId, MailFilter filter) {
        HistoryWindow window = resolver.resolve(historyId, null, filter);
        List<MailRecord> matched = window.records()
            .filter(RecordOutcome.Matched.class::isInstance)
            .map(outcome -> ((RecordOutcome.Matched) outcome).record())
            .toList();
        log.info("Fetched {} matching messages added after history id {}", matched.size(), Long.toUnsignedString(historyId));
        return matched;
    }
}
