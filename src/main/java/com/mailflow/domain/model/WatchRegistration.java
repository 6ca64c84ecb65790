package com.mailflow.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A time-bounded request asking the mailbox to publish change notifications to a topic.
 *
 * <p>{@code owned} is decided by the process holding the registration (it created it, or
 * adopted one someone else created) and is never read back from storage.
 */
public record WatchRegistration(
    String serviceType,
    String topicName,
    String applicationName,
    String watchId,
    Instant expiration,
    Instant createdAt,
    boolean owned,
    Map<String, Object> serviceSpecificData
) {
    public WatchRegistration {
        // state files may carry null values
        serviceSpecificData = serviceSpecificData == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(serviceSpecificData));
    }

    public boolean isActiveAt(Instant now) {
        return expiration != null && expiration.isAfter(now);
    }

    public WatchRegistration asOwned(boolean owned) {
        return new WatchRegistration(serviceType, topicName, applicationName, watchId, expiration,
            createdAt, owned, serviceSpecificData);
    }
}
