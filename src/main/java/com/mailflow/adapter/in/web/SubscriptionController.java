package com.mailflow.adapter.in.web;

import com.mailflow.application.port.in.GetSubscriptionStatusUseCase;
import com.mailflow.application.port.in.SubscribeUseCase;
import com.mailflow.domain.model.SubscriptionMode;
import com.mailflow.domain.model.SubscriptionStatus;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/subscription")
@Tag(name = "Subscription", description = "Status of the running subscription")
public class SubscriptionController {

    private final GetSubscriptionStatusUseCase getSubscriptionStatusUseCase;
    private final SubscribeUseCase subscribeUseCase;

    public SubscriptionController(
            GetSubscriptionStatusUseCase getSubscriptionStatusUseCase,
            SubscribeUseCase subscribeUseCase) {
        this.getSubscriptionStatusUseCase = getSubscriptionStatusUseCase;
        this.subscribeUseCase = subscribeUseCase;
    }

    @GetMapping
    @Operation(summary = "Get subscription status", description = "Returns the current or most recent subscription run")
    public ResponseEntity<?> getStatus() {
        return getSubscriptionStatusUseCase.getStatus()
            .<ResponseEntity<?>>map(status -> ResponseEntity.ok(SubscriptionStatusResponse.from(status)))
            .orElseGet(SubscriptionController::notFound);
    }

    @DeleteMapping
    @Operation(summary = "Cancel the subscription", description = "Requests the running subscription to stop")
    public ResponseEntity<?> cancel() {
        return subscribeUseCase.cancel()
            ? ResponseEntity.accepted().build()
            : notFound();
    }

    private static ResponseEntity<?> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("SUBSCRIPTION_NOT_RUNNING", "No subscription has been started",
                RequestContext.getRequestId()));
    }

    public record SubscriptionStatusResponse(
        String name,
        SubscriptionMode mode,
        UUID sessionId,
        Instant startedAt,
        String watermark,
        long lastBatchToken,
        boolean running,
        Instant endTime,
        WatchResponse watch
    ) {
        public static SubscriptionStatusResponse from(SubscriptionStatus status) {
            return new SubscriptionStatusResponse(
                status.name(),
                status.mode(),
                status.sessionId(),
                status.startedAt(),
                status.watermark() == Watermarks.NONE ? null : Watermarks.format(status.watermark()),
                status.lastBatchToken(),
                status.running(),
                status.endTime(),
                status.watch() == null ? null : WatchResponse.from(status.watch())
            );
        }
    }
}
