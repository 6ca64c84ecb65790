package com.mailflow.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Everything one subscription run needs: where changes come from, what to keep, and for how long.
 * {@code topicName} and {@code subscriptionName} are null when the mode does not use them;
 * a null {@code endTime} means the run continues until it is cancelled.
 */
public record Subscription(
    String name,
    SubscriptionMode mode,
    ResourceName topicName,
    ResourceName subscriptionName,
    MailFilter filter,
    Duration pollingInterval,
    Instant endTime,
    boolean setupWatch,
    boolean forceNewWatch,
    long initialWatermark
) {
    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(30);

    public Subscription {
        filter = filter == null ? MailFilter.DEFAULT : filter;
        pollingInterval = pollingInterval == null ? DEFAULT_POLLING_INTERVAL : pollingInterval;
    }

    public boolean hasEndTime() {
        return endTime != null;
    }
}
