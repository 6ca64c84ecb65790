package com.mailflow.domain.error;

/**
 * Sealed type representing configuration and resource-name validation errors.
 * These are expected outcomes of validating caller input, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // Pub/Sub resource name errors
    sealed interface ResourceNameError extends ValidationError {

        record Empty(String kind) implements ResourceNameError {
            @Override
            public String message() {
                return kind + " name cannot be empty";
            }

            @Override
            public String code() {
                return kind.toUpperCase() + "_NAME_EMPTY";
            }
        }

        record InvalidFormat(String kind, String value, String expected) implements ResourceNameError {
            @Override
            public String message() {
                return "Invalid " + kind + " name '" + value + "'. Expected format: " + expected;
            }

            @Override
            public String code() {
                return kind.toUpperCase() + "_NAME_INVALID_FORMAT";
            }
        }
    }

    // Subscription option errors
    sealed interface SubscriptionError extends ValidationError {

        record PollingIntervalNotPositive(long seconds) implements SubscriptionError {
            @Override
            public String message() {
                return "Polling interval must be greater than 0 seconds (was " + seconds + ")";
            }

            @Override
            public String code() {
                return "POLLING_INTERVAL_NOT_POSITIVE";
            }
        }

        record MissingTopicName(String reason) implements SubscriptionError {
            @Override
            public String message() {
                return "Topic name is required " + reason;
            }

            @Override
            public String code() {
                return "TOPIC_NAME_REQUIRED";
            }
        }

        record MissingSubscriptionName() implements SubscriptionError {
            public static final MissingSubscriptionName INSTANCE = new MissingSubscriptionName();
            @Override
            public String message() {
                return "Subscription name is required in pull mode";
            }

            @Override
            public String code() {
                return "SUBSCRIPTION_NAME_REQUIRED";
            }
        }

        record InvalidDate(String field, String value) implements SubscriptionError {
            @Override
            public String message() {
                return "Filter date '" + field + "' must be an ISO date (yyyy-MM-dd): " + value;
            }

            @Override
            public String code() {
                return "FILTER_DATE_INVALID";
            }
        }

        record UnknownMode(String value) implements SubscriptionError {
            @Override
            public String message() {
                return "Unknown subscription mode '" + value + "'. Expected one of: poll, pull, push";
            }

            @Override
            public String code() {
                return "SUBSCRIPTION_MODE_UNKNOWN";
            }
        }

        record InvalidHistoryId(String value) implements SubscriptionError {
            @Override
            public String message() {
                return "Initial history id must be an unsigned 64-bit integer: " + value;
            }

            @Override
            public String code() {
                return "HISTORY_ID_INVALID";
            }
        }

        record DurationNotPositive(String value) implements SubscriptionError {
            @Override
            public String message() {
                return "Subscription duration must be positive: " + value;
            }

            @Override
            public String code() {
                return "DURATION_NOT_POSITIVE";
            }
        }
    }
}
