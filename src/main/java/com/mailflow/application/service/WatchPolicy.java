package com.mailflow.application.service;

import java.time.Duration;
import java.util.List;

/**
 * Timing and identity settings of a {@link WatchLifecycleManager}.
 */
public record WatchPolicy(
    String serviceType,
    String applicationName,
    List<String> defaultLabels,
    Duration safetyMargin,
    Duration renewalThreshold,
    Duration retryBackoff,
    Duration minimumDelay,
    Duration defaultExpiration,
    Duration stopTimeout,
    boolean forceNew
) {
    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofMinutes(15);
    public static final Duration DEFAULT_RENEWAL_THRESHOLD = Duration.ofMinutes(20);
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMinutes(5);
    public static final Duration DEFAULT_MINIMUM_DELAY = Duration.ofMinutes(1);
    public static final Duration DEFAULT_EXPIRATION = Duration.ofDays(7);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

    public WatchPolicy {
        defaultLabels = defaultLabels == null || defaultLabels.isEmpty() ? List.of("INBOX") : List.copyOf(defaultLabels);
        safetyMargin = safetyMargin == null ? DEFAULT_SAFETY_MARGIN : safetyMargin;
        renewalThreshold = renewalThreshold == null ? DEFAULT_RENEWAL_THRESHOLD : renewalThreshold;
        retryBackoff = retryBackoff == null ? DEFAULT_RETRY_BACKOFF : retryBackoff;
        minimumDelay = minimumDelay == null ? DEFAULT_MINIMUM_DELAY : minimumDelay;
        defaultExpiration = defaultExpiration == null ? DEFAULT_EXPIRATION : defaultExpiration;
        stopTimeout = stopTimeout == null ? DEFAULT_STOP_TIMEOUT : stopTimeout;
    }

    public static WatchPolicy defaults(String serviceType, String applicationName) {
        return new WatchPolicy(serviceType, applicationName, null, null, null, null, null, null, null, false);
    }

    public WatchPolicy withForceNew(boolean forceNew) {
        return new WatchPolicy(serviceType, applicationName, defaultLabels, safetyMargin, renewalThreshold,
            retryBackoff, minimumDelay, defaultExpiration, stopTimeout, forceNew);
    }
}
