package com.mailflow.adapter.in.web;

import com.mailflow.application.port.in.FetchMessagesUseCase;
import com.mailflow.domain.error.ValidationError;
import com.mailflow.domain.error.ValidationError.SubscriptionError;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.Page;
import com.mailflow.domain.model.Result;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Messages", description = "One-shot mailbox reads")
public class MessageController {

    private static final int MAX_RESULTS_LIMIT = 500;

    private final FetchMessagesUseCase fetchMessagesUseCase;

    public MessageController(FetchMessagesUseCase fetchMessagesUseCase) {
        this.fetchMessagesUseCase = fetchMessagesUseCase;
    }

    @GetMapping("/messages")
    @Operation(summary = "Fetch messages", description = "Lists messages matching the filter, or everything added after a history id")
    public ResponseEntity<?> fetchMessages(
            @Parameter(description = "Free-text mailbox search query")
            @RequestParam(required = false) String query,
            @Parameter(description = "Sender address or name fragment")
            @RequestParam(required = false) String from,
            @Parameter(description = "Subject fragment")
            @RequestParam(required = false) String subject,
            @Parameter(description = "Label ids, any of which must be present")
            @RequestParam(required = false) List<String> labels,
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @RequestParam(defaultValue = "false") boolean includeSpamTrash,
            @Parameter(description = "Only messages on or after this date (yyyy-MM-dd)")
            @RequestParam(required = false) String after,
            @Parameter(description = "Only messages before this date (yyyy-MM-dd)")
            @RequestParam(required = false) String before,
            @Parameter(description = "Maximum number of messages (max 500)")
            @RequestParam(required = false) Integer maxResults,
            @Parameter(description = "Page token from a previous response")
            @RequestParam(required = false) String pageToken,
            @Parameter(description = "Return everything added after this history id instead of listing")
            @RequestParam(required = false) String sinceHistoryId) {

        Result<LocalDate, ValidationError> afterDate = parseDate("after", after);
        if (afterDate.isFailure()) {
            return toErrorResponse(afterDate.errorOrNull());
        }
        Result<LocalDate, ValidationError> beforeDate = parseDate("before", before);
        if (beforeDate.isFailure()) {
            return toErrorResponse(beforeDate.errorOrNull());
        }

        MailFilter filter = MailFilter.builder()
            .query(query)
            .fromEmail(from)
            .subject(subject)
            .labelIds(labels)
            .unreadOnly(unreadOnly)
            .includeSpamTrash(includeSpamTrash)
            .dateStart(afterDate.getOrThrow())
            .dateEnd(beforeDate.getOrThrow())
            .maxResults(maxResults == null ? MailFilter.DEFAULT_MAX_RESULTS : Math.min(maxResults, MAX_RESULTS_LIMIT))
            .pageToken(pageToken)
            .build();

        if (sinceHistoryId != null && !sinceHistoryId.isBlank()) {
            long historyId;
            try {
                historyId = Watermarks.parse(sinceHistoryId);
            } catch (NumberFormatException e) {
                return toErrorResponse(new SubscriptionError.InvalidHistoryId(sinceHistoryId));
            }
            List<MailRecord> records = fetchMessagesUseCase.fetchSince(historyId, filter);
            return ResponseEntity.ok(PageResponse.from(Page.of(records, null), MessageResponse::from));
        }

        Page<MailRecord> page = fetchMessagesUseCase.fetch(filter);
        return ResponseEntity.ok(PageResponse.from(page, MessageResponse::from));
    }

    private static Result<LocalDate, ValidationError> parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return Result.success(null);
        }
        try {
            return Result.success(LocalDate.parse(value.trim()));
        } catch (DateTimeParseException e) {
            return Result.failure(new SubscriptionError.InvalidDate(field, value));
        }
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(ValidationError error) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }
}
