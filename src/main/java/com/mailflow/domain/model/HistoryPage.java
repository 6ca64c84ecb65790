package com.mailflow.domain.model;

import java.util.List;

/**
 * One page of the history listing. {@code nextPageToken} is null on the last page.
 */
public record HistoryPage(List<HistoryEntry> entries, String nextPageToken, long historyId) {

    public HistoryPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
