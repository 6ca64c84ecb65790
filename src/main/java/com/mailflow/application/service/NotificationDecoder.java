package com.mailflow.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.domain.error.NotificationError;
import com.mailflow.domain.model.Notification;
import com.mailflow.domain.model.Result;
import com.mailflow.domain.model.Watermarks;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Decodes transport payloads (base64 of UTF-8 JSON) into {@link Notification}s.
 * Accepts {@code historyId} as either a JSON number or a numeric string.
 */
@Component
public class NotificationDecoder {

    private final ObjectMapper objectMapper;

    public NotificationDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Result<Notification, NotificationError> decode(String base64Data) {
        if (base64Data == null || base64Data.isBlank()) {
            return Result.failure(new NotificationError.InvalidEncoding("payload is empty"));
        }
        String json;
        try {
            json = new String(Base64.getDecoder().decode(base64Data.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Result.failure(new NotificationError.InvalidEncoding(e.getMessage()));
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (IOException e) {
            return Result.failure(new NotificationError.MalformedPayload(e.getMessage()));
        }
        if (node == null || !node.isObject()) {
            return Result.failure(new NotificationError.MalformedPayload("expected a JSON object"));
        }

        JsonNode historyNode = node.get("historyId");
        if (historyNode == null || historyNode.isNull() || !(historyNode.isNumber() || historyNode.isTextual())) {
            return Result.failure(NotificationError.MissingHistoryId.INSTANCE);
        }
        long historyId;
        try {
            historyId = Watermarks.parse(historyNode.asText());
        } catch (NumberFormatException e) {
            return Result.failure(NotificationError.MissingHistoryId.INSTANCE);
        }

        JsonNode emailNode = node.get("emailAddress");
        return Result.success(new Notification(emailNode != null ? emailNode.asText() : null, historyId));
    }
}
