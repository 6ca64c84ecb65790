package com.mailflow.domain.model;

import java.util.List;

/**
 * One entry of the mailbox change history, reduced to the ids of messages it added.
 */
public record HistoryEntry(long id, List<String> addedMessageIds) {

    public HistoryEntry {
        addedMessageIds = addedMessageIds == null ? List.of() : List.copyOf(addedMessageIds);
    }
}
