package com.mailflow.adapter.in.web;

import com.mailflow.domain.model.WatchRegistration;

import java.time.Instant;
import java.util.Map;

public record WatchResponse(
    String serviceType,
    String applicationName,
    String topicName,
    String watchId,
    Instant expiration,
    Instant createdAt,
    Map<String, Object> serviceSpecificData
) {
    public static WatchResponse from(WatchRegistration registration) {
        return new WatchResponse(
            registration.serviceType(),
            registration.applicationName(),
            registration.topicName(),
            registration.watchId(),
            registration.expiration(),
            registration.createdAt(),
            registration.serviceSpecificData()
        );
    }
}
