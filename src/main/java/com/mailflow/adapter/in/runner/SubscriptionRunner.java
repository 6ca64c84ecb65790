package com.mailflow.adapter.in.runner;

import com.mailflow.application.port.in.SubscribeUseCase;
import com.mailflow.application.port.in.SubscriptionRequest;
import com.mailflow.application.port.in.SubscriptionRequest.FilterOptions;
import com.mailflow.domain.error.ValidationError;
import com.mailflow.domain.model.Result;
import com.mailflow.domain.model.Subscription;
import com.mailflow.infrastructure.config.AppProperties;
import com.mailflow.infrastructure.exception.InvalidSubscriptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts the configured subscription once the context is up and blocks until it ends.
 * A failed run propagates, so the process exits non-zero.
 */
@Component
@ConditionalOnProperty(name = "app.subscription.enabled", havingValue = "true")
public class SubscriptionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRunner.class);

    private final SubscribeUseCase subscribeUseCase;
    private final AppProperties appProperties;

    public SubscriptionRunner(SubscribeUseCase subscribeUseCase, AppProperties appProperties) {
        this.subscribeUseCase = subscribeUseCase;
        this.appProperties = appProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        SubscriptionRequest request = toRequest(appProperties.getSubscription());
        Result<Subscription, List<ValidationError>> prepared = subscribeUseCase.prepare(request);
        if (prepared.isFailure()) {
            prepared.errorOrNull().forEach(error -> log.error("Invalid subscription option [{}]: {}", error.code(), error.message()));
            throw new InvalidSubscriptionException(prepared.errorOrNull());
        }
        subscribeUseCase.run(prepared.getOrThrow());
    }

    static SubscriptionRequest toRequest(AppProperties.Subscription config) {
        AppProperties.Filter filter = config.getFilter();
        FilterOptions filterOptions = filter == null
            ? FilterOptions.none()
            : new FilterOptions(
                filter.getQuery(),
                filter.getFrom(),
                filter.getSubject(),
                filter.getAfter(),
                filter.getBefore(),
                filter.getLabels(),
                filter.isUnreadOnly(),
                filter.isIncludeSpamTrash(),
                filter.getMaxResults());

        return new SubscriptionRequest(
            config.getName(),
            config.getMode(),
            config.getTopicName(),
            config.getSubscriptionName(),
            config.getPollingInterval(),
            config.getDuration(),
            config.isSetupWatch(),
            config.isForceNewWatch(),
            config.getInitialHistoryId(),
            filterOptions
        );
    }
}
