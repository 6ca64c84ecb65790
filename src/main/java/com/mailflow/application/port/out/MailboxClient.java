package com.mailflow.application.port.out;

import com.mailflow.domain.model.HistoryPage;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.WatchGrant;

import java.util.List;

/**
 * Port to the remote mailbox. Implementations throw
 * {@link com.mailflow.infrastructure.exception.MailboxAuthorizationException} when credentials are rejected
 * and {@link com.mailflow.infrastructure.exception.MailboxException} for anything else that may be retried.
 */
public interface MailboxClient {

    MessagePage listMessages(MailFilter filter);

    MailRecord getMessage(String messageId);

    /**
     * Lists "message added" history starting at {@code startHistoryId}.
     *
     * @throws com.mailflow.infrastructure.exception.HistoryWindowException if the listing fails
     */
    HistoryPage listHistory(long startHistoryId, String pageToken);

    WatchGrant createWatch(String topicName, List<String> labelIds);

    /**
     * Stops every watch held by the account. The mailbox API cannot stop a single one.
     */
    void stopWatch();

    MailboxProfile getProfile();

    record MessagePage(List<String> messageIds, String nextPageToken) {
        public MessagePage {
            messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
        }
    }

    record MailboxProfile(String emailAddress, long historyId) {
    }
}
