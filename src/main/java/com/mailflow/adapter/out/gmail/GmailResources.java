package com.mailflow.adapter.out.gmail;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Gmail REST payloads, reduced to the fields the mailbox client reads.
 * History ids and timestamps arrive as decimal strings.
 */
final class GmailResources {

    private GmailResources() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageList(List<MessageRef> messages, String nextPageToken, Long resultSizeEstimate) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageRef(String id, String threadId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(
        String id,
        String threadId,
        List<String> labelIds,
        String snippet,
        String historyId,
        String internalDate,
        MessagePart payload
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagePart(String mimeType, List<Header> headers, PartBody body, List<MessagePart> parts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Header(String name, String value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PartBody(String data, Integer size) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HistoryList(List<History> history, String nextPageToken, String historyId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record History(String id, List<MessageAdded> messagesAdded) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageAdded(MessageRef message) {
    }

    record WatchRequest(String topicName, List<String> labelIds, String labelFilterAction) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WatchResponse(String historyId, String expiration) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Profile(String emailAddress, Long messagesTotal, String historyId) {
    }
}
