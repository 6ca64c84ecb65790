package com.mailflow.domain.model;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing. {@code nextPageToken} is the mailbox's own continuation token.
 */
public record Page<T>(
    List<T> data,
    String nextPageToken,
    boolean hasMore
) {
    public static <T> Page<T> of(List<T> data, String nextPageToken) {
        boolean hasMore = nextPageToken != null && !nextPageToken.isBlank();
        return new Page<>(List.copyOf(data), hasMore ? nextPageToken : null, hasMore);
    }

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), null, false);
    }

    public <U> Page<U> map(Function<T, U> mapper) {
        return new Page<>(data.stream().map(mapper).toList(), nextPageToken, hasMore);
    }
}
