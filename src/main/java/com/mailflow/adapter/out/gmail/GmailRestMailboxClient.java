package com.mailflow.adapter.out.gmail;

import com.mailflow.adapter.out.gmail.GmailResources.History;
import com.mailflow.adapter.out.gmail.GmailResources.HistoryList;
import com.mailflow.adapter.out.gmail.GmailResources.Message;
import com.mailflow.adapter.out.gmail.GmailResources.MessageAdded;
import com.mailflow.adapter.out.gmail.GmailResources.MessageList;
import com.mailflow.adapter.out.gmail.GmailResources.MessageRef;
import com.mailflow.adapter.out.gmail.GmailResources.Profile;
import com.mailflow.adapter.out.gmail.GmailResources.WatchRequest;
import com.mailflow.adapter.out.gmail.GmailResources.WatchResponse;
import com.mailflow.application.port.out.AccessTokenProvider;
import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.domain.model.HistoryEntry;
import com.mailflow.domain.model.HistoryPage;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.WatchGrant;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.config.AppProperties;
import com.mailflow.infrastructure.exception.HistoryWindowException;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import com.mailflow.infrastructure.exception.MailboxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link MailboxClient} over the Gmail REST API.
 */
@Component
public class GmailRestMailboxClient implements MailboxClient {

    private static final Logger log = LoggerFactory.getLogger(GmailRestMailboxClient.class);

    private static final String USER_PATH = "/gmail/v1/users/{userId}";
    private static final String LABEL_FILTER_INCLUDE = "include";

    private final RestClient restClient;
    private final AccessTokenProvider tokens;
    private final GmailMessageMapper mapper;
    private final String userId;

    public GmailRestMailboxClient(
            RestClient.Builder restClientBuilder,
            AccessTokenProvider tokens,
            GmailMessageMapper mapper,
            AppProperties appProperties) {
        this.restClient = restClientBuilder
            .baseUrl(appProperties.getGmail().getBaseUrl())
            .build();
        this.tokens = tokens;
        this.mapper = mapper;
        this.userId = appProperties.getGmail().getUserId();
    }

    @Override
    public MessagePage listMessages(MailFilter filter) {
        String query = filter.buildQuery();
        MessageList list = call("list messages", () -> restClient.get()
            .uri(b -> {
                b.path(USER_PATH + "/messages")
                    .queryParam("maxResults", filter.maxResults())
                    .queryParam("includeSpamTrash", filter.includeSpamTrash());
                if (!query.isEmpty()) {
                    b.queryParam("q", query);
                }
                if (filter.pageToken() != null && !filter.pageToken().isBlank()) {
                    b.queryParam("pageToken", filter.pageToken());
                }
                filter.labelIds().forEach(label -> b.queryParam("labelIds", label));
                return b.build(userId);
            })
            .headers(h -> h.setBearerAuth(tokens.accessToken()))
            .retrieve()
            .body(MessageList.class));

        List<String> ids = list == null || list.messages() == null
            ? List.of()
            : list.messages().stream().map(MessageRef::id).toList();
        log.debug("Listed {} messages for query '{}'", ids.size(), query);
        return new MessagePage(ids, list == null ? null : list.nextPageToken());
    }

    @Override
    public MailRecord getMessage(String messageId) {
        Message message = call("get message " + messageId, () -> restClient.get()
            .uri(USER_PATH + "/messages/{id}?format=full", userId, messageId)
            .headers(h -> h.setBearerAuth(tokens.accessToken()))
            .retrieve()
            .body(Message.class));
        if (message == null) {
            throw new MailboxException("Empty response for message " + messageId);
        }
        return mapper.toRecord(message);
    }

    @Override
    public HistoryPage listHistory(long startHistoryId, String pageToken) {
        HistoryList list;
        try {
            list = restClient.get()
                .uri(b -> b.path(USER_PATH + "/history")
                    .queryParam("startHistoryId", Watermarks.format(startHistoryId))
                    .queryParam("historyTypes", "messageAdded")
                    .queryParamIfPresent("pageToken", Optional.ofNullable(pageToken))
                    .build(userId))
                .headers(h -> h.setBearerAuth(tokens.accessToken()))
                .retrieve()
                .body(HistoryList.class);
        } catch (RestClientResponseException e) {
            if (isAuthorizationFailure(e)) {
                throw new MailboxAuthorizationException("Mailbox rejected credentials listing history", e);
            }
            boolean expired = e.getStatusCode().value() == HttpStatus.NOT_FOUND.value();
            throw new HistoryWindowException(startHistoryId, expired,
                "Listing history from " + Watermarks.format(startHistoryId) + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new HistoryWindowException(startHistoryId, false,
                "Listing history from " + Watermarks.format(startHistoryId) + " failed: " + e.getMessage(), e);
        }
        if (list == null) {
            return new HistoryPage(List.of(), null, startHistoryId);
        }

        List<HistoryEntry> entries = new ArrayList<>();
        if (list.history() != null) {
            for (History history : list.history()) {
                List<String> added = history.messagesAdded() == null
                    ? List.of()
                    : history.messagesAdded().stream()
                        .map(MessageAdded::message)
                        .filter(ref -> ref != null && ref.id() != null)
                        .map(MessageRef::id)
                        .toList();
                entries.add(new HistoryEntry(Watermarks.parse(history.id()), added));
            }
        }
        long latest = list.historyId() == null ? startHistoryId : Watermarks.parse(list.historyId());
        return new HistoryPage(entries, list.nextPageToken(), latest);
    }

    @Override
    public WatchGrant createWatch(String topicName, List<String> labelIds) {
        WatchResponse response = call("create watch", () -> restClient.post()
            .uri(USER_PATH + "/watch", userId)
            .headers(h -> h.setBearerAuth(tokens.accessToken()))
            .contentType(MediaType.APPLICATION_JSON)
            .body(new WatchRequest(topicName, labelIds, LABEL_FILTER_INCLUDE))
            .retrieve()
            .body(WatchResponse.class));
        if (response == null || response.historyId() == null) {
            throw new MailboxException("Watch response carried no historyId");
        }
        Instant expiration = response.expiration() == null
            ? null
            : Instant.ofEpochMilli(Long.parseLong(response.expiration()));
        return new WatchGrant(Watermarks.parse(response.historyId()), expiration);
    }

    @Override
    public void stopWatch() {
        call("stop watch", () -> restClient.post()
            .uri(USER_PATH + "/stop", userId)
            .headers(h -> h.setBearerAuth(tokens.accessToken()))
            .retrieve()
            .toBodilessEntity());
    }

    @Override
    public MailboxProfile getProfile() {
        Profile profile = call("get profile", () -> restClient.get()
            .uri(USER_PATH + "/profile", userId)
            .headers(h -> h.setBearerAuth(tokens.accessToken()))
            .retrieve()
            .body(Profile.class));
        if (profile == null) {
            throw new MailboxException("Empty profile response");
        }
        long historyId = profile.historyId() == null ? Watermarks.NONE : Watermarks.parse(profile.historyId());
        return new MailboxProfile(profile.emailAddress(), historyId);
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            if (isAuthorizationFailure(e)) {
                throw new MailboxAuthorizationException("Mailbox rejected credentials: " + operation, e);
            }
            throw new MailboxException(operation + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new MailboxException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean isAuthorizationFailure(RestClientResponseException e) {
        int status = e.getStatusCode().value();
        return status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value();
    }
}
