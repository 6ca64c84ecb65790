package com.mailflow.adapter.out.pubsub;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Pub/Sub REST payloads used by the pull client.
 */
final class PubSubResources {

    private PubSubResources() {}

    record PullRequest(int maxMessages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PullResponse(List<ReceivedMessage> receivedMessages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ReceivedMessage(String ackId, PubsubMessage message, Integer deliveryAttempt) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PubsubMessage(String data, Map<String, String> attributes, String messageId, String publishTime) {
    }

    record AcknowledgeRequest(List<String> ackIds) {
    }

    record ModifyAckDeadlineRequest(List<String> ackIds, int ackDeadlineSeconds) {
    }
}
