package com.mailflow.application.port.in;

import java.time.Duration;
import java.util.List;

/**
 * Unvalidated subscription options as supplied by configuration or a caller.
 */
public record SubscriptionRequest(
    String name,
    String mode,
    String topicName,
    String subscriptionName,
    Duration pollingInterval,
    Duration duration,
    boolean setupWatch,
    boolean forceNewWatch,
    String initialHistoryId,
    FilterOptions filter
) {
    public record FilterOptions(
        String query,
        String from,
        String subject,
        String after,
        String before,
        List<String> labels,
        boolean unreadOnly,
        boolean includeSpamTrash,
        int maxResults
    ) {
        public static FilterOptions none() {
            return new FilterOptions(null, null, null, null, null, List.of(), false, false, 0);
        }
    }
}
