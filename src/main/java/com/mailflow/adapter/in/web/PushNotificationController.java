package com.mailflow.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mailflow.adapter.out.pubsub.Envelopes;
import com.mailflow.adapter.out.pubsub.PushDeliveryClient;
import com.mailflow.application.port.out.DeliveryClient.AckDecision;
import com.mailflow.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Push endpoint for Pub/Sub. Any non-2xx response makes Pub/Sub redeliver the message.
 */
@RestController
@RequestMapping("/api/v1/push")
@Tag(name = "Push", description = "Pub/Sub push delivery endpoint")
public class PushNotificationController {

    private static final Logger log = LoggerFactory.getLogger(PushNotificationController.class);

    private final PushDeliveryClient pushDeliveryClient;

    public PushNotificationController(PushDeliveryClient pushDeliveryClient) {
        this.pushDeliveryClient = pushDeliveryClient;
    }

    @PostMapping("/notifications")
    @Operation(summary = "Receive a push notification", description = "Hands a pushed mailbox change notification to the running listener")
    public ResponseEntity<?> receive(@Valid @RequestBody PushRequest request) {
        PushMessage message = request.message();
        String messageId = message.messageId() != null ? message.messageId() : message.legacyMessageId();

        Optional<AckDecision> decision = pushDeliveryClient.deliver(
            Envelopes.of(messageId, message.data(), message.attributes(), message.publishTime()));

        if (decision.isEmpty()) {
            log.warn("Push notification {} received while no listener is running", messageId);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("LISTENER_NOT_RUNNING",
                    "No push subscription is currently running", RequestContext.getRequestId()));
        }
        if (decision.get() == AckDecision.NACK) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.noContent().build();
    }

    public record PushRequest(
        @NotNull @Valid PushMessage message,
        String subscription
    ) {}

    public record PushMessage(
        String data,
        Map<String, String> attributes,
        String messageId,
        @JsonProperty("message_id") String legacyMessageId,
        String publishTime
    ) {}
}
