package com.mailflow.adapter.in.web;

import com.mailflow.domain.model.Page;

import java.util.List;
import java.util.function.Function;

public record PageResponse<T>(
    List<T> data,
    Pagination pagination
) {
    public static <S, T> PageResponse<T> from(Page<S> page, Function<S, T> mapper) {
        if (page == null) {
            return new PageResponse<>(List.of(), new Pagination(null, false));
        }
        Page<T> mapped = page.map(mapper);
        return new PageResponse<>(mapped.data(), new Pagination(mapped.nextPageToken(), mapped.hasMore()));
    }

    public record Pagination(
        String nextPageToken,
        boolean hasMore
    ) {}
}
