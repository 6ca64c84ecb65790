package com.mailflow.domain.model;

/**
 * Helpers for mailbox history ids. A history id is an unsigned 64-bit integer carried
 * in a {@code long}, so every comparison goes through {@link Long#compareUnsigned}.
 */
public final class Watermarks {

    /** Watermark of a session that has not observed any history yet. */
    public static final long NONE = 0L;

    private Watermarks() {}

    public static int compare(long left, long right) {
        return Long.compareUnsigned(left, right);
    }

    public static boolean isAfter(long candidate, long reference) {
        return compare(candidate, reference) > 0;
    }

    public static long max(long left, long right) {
        return isAfter(left, right) ? left : right;
    }

    /**
     * True when {@code low < id <= high}. A {@code null} upper bound means the window is open-ended.
     */
    public static boolean inWindow(long id, long low, Long high) {
        return isAfter(id, low) && (high == null || compare(id, high) <= 0);
    }

    public static long parse(String value) {
        return Long.parseUnsignedLong(value.trim());
    }

    public static String format(long watermark) {
        return Long.toUnsignedString(watermark);
    }
}
