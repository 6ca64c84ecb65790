package com.mailflow.application.service;

import com.mailflow.application.port.in.GetSubscriptionStatusUseCase;
import com.mailflow.application.port.in.SubscribeUseCase;
import com.mailflow.application.port.in.SubscriptionRequest;
import com.mailflow.application.port.out.IdGenerator;
import com.mailflow.application.strategy.SubscriptionStrategy;
import com.mailflow.application.strategy.SubscriptionStrategyFactory;
import com.mailflow.domain.error.ValidationError;
import com.mailflow.domain.model.Result;
import com.mailflow.domain.model.Subscription;
import com.mailflow.domain.model.SubscriptionStatus;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import com.mailflow.infrastructure.context.SessionContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one subscription at a time and reports on it.
 *
 * <p>A run stops when the application shuts down, when the subscription's end time passes,
 * or when the strategy fails. Its session is kept afterwards for status reporting.
 */
@Service
public class SubscriptionService implements SubscribeUseCase, GetSubscriptionStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriptionValidator validator;
    private final SubscriptionStrategyFactory strategyFactory;
    private final IdGenerator idGenerator;
    private final Clock clock;

    private volatile ActiveRun activeRun;

    public SubscriptionService(
            SubscriptionValidator validator,
            SubscriptionStrategyFactory strategyFactory,
            IdGenerator idGenerator,
            Clock clock) {
        this.validator = validator;
        this.strategyFactory = strategyFactory;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public Result<Subscription, List<ValidationError>> prepare(SubscriptionRequest request) {
        return validator.validate(request);
    }

    @Override
    public void run(Subscription subscription) {
        UUID sessionId = idGenerator.generate();
        SessionState session = new SessionState(sessionId,
            Instant.ofEpochMilli(idGenerator.extractTimestamp(sessionId)), subscription.initialWatermark());
        CancellationSignal cancellation = CancellationSignal.create();
        if (subscription.hasEndTime()) {
            cancellation.cancelAt(subscription.endTime(), clock);
        }

        SubscriptionStrategy strategy = strategyFactory.create(subscription, session);
        ActiveRun run = new ActiveRun(subscription, session, strategy, cancellation);
        synchronized (this) {
            if (activeRun != null && activeRun.isRunning()) {
                throw new IllegalStateException("A subscription is already running: " + activeRun.subscription().name());
            }
            activeRun = run;
        }

        SessionContext.set(sessionId);
        log.info("Subscription started: name={}, mode={}, sessionId={}, endTime={}, watermark={}",
            subscription.name(), subscription.mode(), sessionId, subscription.endTime(),
            Watermarks.format(session.currentWatermark()));
        try {
            strategy.run(cancellation);
            log.info("Subscription finished: name={}, reason={}, watermark={}, batches={}",
                subscription.name(), cancellation.reason().orElse("completed"),
                Watermarks.format(session.currentWatermark()), session.lastBatchToken());
        } catch (RuntimeException e) {
            log.error("Subscription failed: name={}, error={}", subscription.name(), e.getMessage());
            throw e;
        } finally {
            cancellation.cancel("subscription ended");
            run.markStopped();
            SessionContext.clear();
        }
    }

    @Override
    public boolean cancel() {
        ActiveRun run = activeRun;
        if (run == null || !run.isRunning()) {
            return false;
        }
        return run.cancellation().cancel("cancelled by caller");
    }

    @Override
    public Optional<SubscriptionStatus> getStatus() {
        ActiveRun run = activeRun;
        if (run == null) {
            return Optional.empty();
        }
        SessionState session = run.session();
        return Optional.of(new SubscriptionStatus(
            run.subscription().name(),
            run.subscription().mode(),
            session.sessionId(),
            session.startedAt(),
            session.currentWatermark(),
            session.lastBatchToken(),
            run.isRunning(),
            run.subscription().endTime(),
            run.strategy().watchRegistration().orElse(null)
        ));
    }

    @PreDestroy
    public void shutdown() {
        ActiveRun run = activeRun;
        if (run != null && run.isRunning()) {
            log.info("Shutting down subscription: name={}", run.subscription().name());
            run.cancellation().cancel("application shutdown");
        }
    }

    private static final class ActiveRun {
        private final Subscription subscription;
        private final SessionState session;
        private final SubscriptionStrategy strategy;
        private final CancellationSignal cancellation;
        private volatile boolean running = true;

        ActiveRun(Subscription subscription, SessionState session, SubscriptionStrategy strategy,
                  CancellationSignal cancellation) {
            this.subscription = subscription;
            this.session = session;
            this.strategy = strategy;
            this.cancellation = cancellation;
        }

        Subscription subscription() {
            return subscription;
        }

        SessionState session() {
            return session;
        }

        SubscriptionStrategy strategy() {
            return strategy;
        }

        CancellationSignal cancellation() {
            return cancellation;
        }

        boolean isRunning() {
            return running;
        }

        void markStopped() {
            running = false;
        }
    }
}
