package com.mailflow.application.service;

import com.mailflow.application.port.in.SubscriptionRequest;
import com.mailflow.application.port.in.SubscriptionRequest.FilterOptions;
import com.mailflow.application.port.out.IdGenerator;
import com.mailflow.domain.error.ValidationError;
import com.mailflow.domain.error.ValidationError.SubscriptionError;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.ResourceName;
import com.mailflow.domain.model.Result;
import com.mailflow.domain.model.Subscription;
import com.mailflow.domain.model.SubscriptionMode;
import com.mailflow.domain.model.Watermarks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks subscription options before anything starts and turns them into a {@link Subscription}.
 * Options that the selected mode ignores are reported as warnings only.
 */
@Component
public class SubscriptionValidator {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionValidator.class);

    private final IdGenerator idGenerator;
    private final Clock clock;

    public SubscriptionValidator(IdGenerator idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public Result<Subscription, List<ValidationError>> validate(SubscriptionRequest request) {
        List<ValidationError> errors = new ArrayList<>();

        SubscriptionMode mode;
        try {
            mode = SubscriptionMode.fromString(request.mode());
        } catch (IllegalArgumentException e) {
            return Result.failure(List.of(new SubscriptionError.UnknownMode(request.mode())));
        }

        ResourceName topic = null;
        if (hasText(request.topicName())) {
            var parsed = ResourceName.parseTopic(request.topicName());
            if (parsed.isFailure()) {
                errors.add(parsed.errorOrNull());
            } else {
                topic = parsed.getOrThrow();
            }
        } else if (mode == SubscriptionMode.PUSH) {
            errors.add(new SubscriptionError.MissingTopicName("in push mode"));
        } else if (mode == SubscriptionMode.PULL && request.setupWatch()) {
            errors.add(new SubscriptionError.MissingTopicName("when setting up a watch"));
        }

        ResourceName subscriptionName = null;
        if (hasText(request.subscriptionName())) {
            var parsed = ResourceName.parseSubscription(request.subscriptionName());
            if (parsed.isFailure()) {
                errors.add(parsed.errorOrNull());
            } else {
                subscriptionName = parsed.getOrThrow();
            }
        } else if (mode == SubscriptionMode.PULL) {
            errors.add(SubscriptionError.MissingSubscriptionName.INSTANCE);
        }

        Duration pollingInterval = request.pollingInterval() == null
            ? Subscription.DEFAULT_POLLING_INTERVAL
            : request.pollingInterval();
        if (mode == SubscriptionMode.POLL && (pollingInterval.isNegative() || pollingInterval.isZero())) {
            errors.add(new SubscriptionError.PollingIntervalNotPositive(pollingInterval.getSeconds()));
        }

        Instant endTime = null;
        if (request.duration() != null) {
            if (request.duration().isNegative() || request.duration().isZero()) {
                errors.add(new SubscriptionError.DurationNotPositive(request.duration().toString()));
            } else {
                endTime = clock.instant().plus(request.duration());
            }
        }

        long initialWatermark = Watermarks.NONE;
        if (hasText(request.initialHistoryId())) {
            try {
                initialWatermark = Watermarks.parse(request.initialHistoryId());
            } catch (NumberFormatException e) {
                errors.add(new SubscriptionError.InvalidHistoryId(request.initialHistoryId()));
            }
        }

        MailFilter filter = toFilter(request.filter() == null ? FilterOptions.none() : request.filter(), errors);

        if (!errors.isEmpty()) {
            errors.forEach(error -> log.warn("Invalid subscription option: {}", error.message()));
            return Result.failure(List.copyOf(errors));
        }

        warnIrrelevantOptions(mode, request);

        String name = hasText(request.name()) ? request.name().trim() : "subscription-" + idGenerator.generate();
        return Result.success(new Subscription(
            name,
            mode,
            topic,
            subscriptionName,
            filter,
            pollingInterval,
            endTime,
            mode.usesNotifications() && request.setupWatch(),
            request.forceNewWatch(),
            initialWatermark
        ));
    }

    private MailFilter toFilter(FilterOptions options, List<ValidationError> errors) {
        return MailFilter.builder()
            .query(options.query())
            .fromEmail(options.from())
            .subject(options.subject())
            .labelIds(options.labels())
            .unreadOnly(options.unreadOnly())
            .includeSpamTrash(options.includeSpamTrash())
            .dateStart(parseDate("after", options.after(), errors))
            .dateEnd(parseDate("before", options.before(), errors))
            .maxResults(options.maxResults())
            .build();
    }

    private LocalDate parseDate(String field, String value, List<ValidationError> errors) {
        if (!hasText(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            errors.add(new SubscriptionError.InvalidDate(field, value));
            return null;
        }
    }

    private void warnIrrelevantOptions(SubscriptionMode mode, SubscriptionRequest request) {
        if (mode == SubscriptionMode.POLL) {
            if (hasText(request.topicName())) {
                log.warn("Topic name is ignored in poll mode");
            }
            if (hasText(request.subscriptionName())) {
                log.warn("Subscription name is ignored in poll mode");
            }
            if (request.setupWatch()) {
                log.warn("Watch setup is ignored in poll mode");
            }
        } else {
            if (request.pollingInterval() != null && !Subscription.DEFAULT_POLLING_INTERVAL.equals(request.pollingInterval())) {
                log.warn("Polling interval is ignored in {} mode", mode.name().toLowerCase());
            }
            if (mode == SubscriptionMode.PUSH && hasText(request.subscriptionName())) {
                log.warn("Subscription name is ignored in push mode");
            }
            if (request.forceNewWatch() && !request.setupWatch()) {
                log.warn("Force new watch has no effect without watch setup");
            }
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
