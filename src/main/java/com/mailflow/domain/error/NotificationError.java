package com.mailflow.domain.error;

/**
 * Sealed type for the ways an inbound change notification can fail to decode.
 * A decode failure is isolated to its own envelope and never stops the listener.
 */
public sealed interface NotificationError {

    record InvalidEncoding(String detail) implements NotificationError {
        @Override
        public String message() {
            return "Notification payload is not valid base64: " + detail;
        }

        @Override
        public String code() {
            return "NOTIFICATION_INVALID_ENCODING";
        }
    }

    record MalformedPayload(String detail) implements NotificationError {
        @Override
        public String message() {
            return "Notification payload is not valid JSON: " + detail;
        }

        @Override
        public String code() {
            return "NOTIFICATION_MALFORMED";
        }
    }

    record MissingHistoryId() implements NotificationError {
        public static final MissingHistoryId INSTANCE = new MissingHistoryId();
        @Override
        public String message() {
            return "Notification payload has no usable historyId";
        }

        @Override
        public String code() {
            return "NOTIFICATION_MISSING_HISTORY_ID";
        }
    }

    String message();

    String code();
}
