package com.mailflow.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Immutable predicate over resolved mail records.
 *
 * <p>The same filter drives two things: the search query sent to the mailbox when listing
 * messages ({@link #buildQuery()}), and the local match applied to records resolved from
 * history ({@link #matches(MailRecord)}), since the history endpoint cannot filter by content.
 * The free-text {@code query} only takes part in the former.
 */
public record MailFilter(
    String query,
    String fromEmail,
    String subject,
    List<String> labelIds,
    boolean unreadOnly,
    boolean includeSpamTrash,
    LocalDate dateStart,
    LocalDate dateEnd,
    int maxResults,
    String pageToken
) {
    public static final int DEFAULT_MAX_RESULTS = 10;

    private static final DateTimeFormatter QUERY_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    public static final MailFilter DEFAULT = builder().build();

    public MailFilter {
        query = query == null ? "" : query.trim();
        labelIds = labelIds == null ? List.of() : List.copyOf(labelIds);
        if (maxResults <= 0) {
            maxResults = DEFAULT_MAX_RESULTS;
        }
    }

    public boolean matches(MailRecord record) {
        if (unreadOnly && !record.unread()) {
            return false;
        }
        if (hasText(fromEmail) && !containsIgnoreCase(record.from(), fromEmail)) {
            return false;
        }
        if (hasText(subject) && !containsIgnoreCase(record.subject(), subject)) {
            return false;
        }
        if (record.date() != null) {
            if (dateStart != null && record.date().isBefore(startOfDay(dateStart))) {
                return false;
            }
            if (dateEnd != null && !record.date().isBefore(startOfDay(dateEnd))) {
                return false;
            }
        }
        return labelIds.isEmpty() || labelIds.stream().anyMatch(record.labels()::contains);
    }

    /**
     * Builds the mailbox search expression. Individual flags are appended to the free-text query.
     */
    public String buildQuery() {
        List<String> parts = new ArrayList<>();
        if (!query.isEmpty()) {
            parts.add(query);
        }
        if (unreadOnly) {
            parts.add("is:unread");
        }
        if (hasText(fromEmail)) {
            parts.add("from:" + fromEmail);
        }
        if (hasText(subject)) {
            parts.add("subject:\"" + subject + "\"");
        }
        if (dateStart != null) {
            parts.add("after:" + QUERY_DATE.format(dateStart));
        }
        if (dateEnd != null) {
            parts.add("before:" + QUERY_DATE.format(dateEnd));
        }
        return String.join(" ", parts);
    }

    public MailFilter withMaxResults(int maxResults) {
        return new MailFilter(query, fromEmail, subject, labelIds, unreadOnly, includeSpamTrash,
            dateStart, dateEnd, maxResults, pageToken);
    }

    public MailFilter withPageToken(String pageToken) {
        return new MailFilter(query, fromEmail, subject, labelIds, unreadOnly, includeSpamTrash,
            dateStart, dateEnd, maxResults, pageToken);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    public static final class Builder {
        private String query;
        private String fromEmail;
        private String subject;
        private List<String> labelIds = List.of();
        private boolean unreadOnly;
        private boolean includeSpamTrash;
        private LocalDate dateStart;
        private LocalDate dateEnd;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private String pageToken;

        private Builder() {}

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder fromEmail(String fromEmail) {
            this.fromEmail = fromEmail;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder labelIds(List<String> labelIds) {
            this.labelIds = labelIds;
            return this;
        }

        public Builder unreadOnly(boolean unreadOnly) {
            this.unreadOnly = unreadOnly;
            return this;
        }

        public Builder includeSpamTrash(boolean includeSpamTrash) {
            this.includeSpamTrash = includeSpamTrash;
            return this;
        }

        public Builder dateStart(LocalDate dateStart) {
            this.dateStart = dateStart;
            return this;
        }

        public Builder dateEnd(LocalDate dateEnd) {
            this.dateEnd = dateEnd;
            return this;
        }

        public Builder maxResults(int maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder pageToken(String pageToken) {
            this.pageToken = pageToken;
            return this;
        }

        public MailFilter build() {
            return new MailFilter(query, fromEmail, subject, labelIds, unreadOnly, includeSpamTrash,
                dateStart, dateEnd, maxResults, pageToken);
        }
    }
}
