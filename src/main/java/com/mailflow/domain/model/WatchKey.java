package com.mailflow.domain.model;

import java.util.Locale;

/**
 * Identifies the single registration a (service, application) pair may hold.
 */
public record WatchKey(String serviceType, String applicationName) {

    public WatchKey {
        if (serviceType == null || serviceType.isBlank()) {
            throw new IllegalArgumentException("serviceType must not be blank");
        }
        if (applicationName == null || applicationName.isBlank()) {
            throw new IllegalArgumentException("applicationName must not be blank");
        }
        serviceType = serviceType.trim().toLowerCase(Locale.ROOT);
        applicationName = applicationName.trim().toLowerCase(Locale.ROOT);
    }

    public static WatchKey of(WatchRegistration registration) {
        return new WatchKey(registration.serviceType(), registration.applicationName());
    }
}
