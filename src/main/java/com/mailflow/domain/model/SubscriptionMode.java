package com.mailflow.domain.model;

import java.util.Locale;

public enum SubscriptionMode {
    POLL,
    PULL,
    PUSH;

    public boolean usesNotifications() {
        return this != POLL;
    }

    public static SubscriptionMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return POLL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
