package com.mailflow.application.port.in;

import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.Page;

import java.util.List;

public interface FetchMessagesUseCase {

    Page<MailRecord> fetch(MailFilter filter);

    /**
     * Every message added after {@code historyId} that matches the filter, in history order.
     */
    List<MailRecord> fetchSince(long historyId, MailFilter filter);
}
