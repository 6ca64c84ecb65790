package com.mailflow.application.strategy;

import com.mailflow.application.port.out.DeliveryClientFactory;
import com.mailflow.application.port.out.IdGenerator;
import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.port.out.MetricsPort;
import com.mailflow.application.port.out.OutputAction;
import com.mailflow.application.port.out.WatchStateStore;
import com.mailflow.application.service.HistoryResolver;
import com.mailflow.application.service.NotificationDecoder;
import com.mailflow.application.service.NotificationListener;
import com.mailflow.application.service.PollingEngine;
import com.mailflow.application.service.SessionState;
import com.mailflow.application.service.WatchLifecycleManager;
import com.mailflow.application.service.WatchPolicy;
import com.mailflow.domain.model.Subscription;
import com.mailflow.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Composes the strategy for a subscription's mode: the polling engine for {@code poll}, a notification
 * listener (plus a watch manager when the subscription sets up its own watch) for {@code pull} and {@code push}.
 */
@Component
public class SubscriptionStrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionStrategyFactory.class);

    private final HistoryResolver resolver;
    private final MailboxClient mailbox;
    private final NotificationDecoder decoder;
    private final DeliveryClientFactory deliveryClients;
    private final WatchStateStore watchStateStore;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final List<OutputAction> outputs;
    private final WatchPolicy watchPolicy;
    private final AppProperties appProperties;
    private final Clock clock;

    public SubscriptionStrategyFactory(
            HistoryResolver resolver,
            MailboxClient mailbox,
            NotificationDecoder decoder,
            DeliveryClientFactory deliveryClients,
            WatchStateStore watchStateStore,
            IdGenerator idGenerator,
            MetricsPort metrics,
            List<OutputAction> outputs,
            WatchPolicy watchPolicy,
            AppProperties appProperties,
            Clock clock) {
        this.resolver = resolver;
        this.mailbox = mailbox;
        this.decoder = decoder;
        this.deliveryClients = deliveryClients;
        this.watchStateStore = watchStateStore;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.outputs = outputs;
        this.watchPolicy = watchPolicy;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public SubscriptionStrategy create(Subscription subscription, SessionState session) {
        BatchDelivery delivery = new BatchDelivery(outputs, metrics);
        if (!subscription.mode().usesNotifications()) {
            log.debug("Using polling strategy: interval={}", subscription.pollingInterval());
            PollingEngine engine = new PollingEngine(resolver, mailbox, metrics, session,
                subscription.filter(), subscription.pollingInterval());
            return new PollingSubscriptionStrategy(engine, delivery);
        }

        NotificationListener listener = new NotificationListener(
            deliveryClients.create(subscription),
            decoder,
            resolver,
            session,
            metrics,
            subscription.filter(),
            appProperties.getPubsub().getStopTimeout()
        );
        WatchLifecycleManager watchManager = null;
        if (subscription.setupWatch()) {
            watchManager = new WatchLifecycleManager(mailbox, watchStateStore, idGenerator, metrics,
                watchPolicy.withForceNew(subscription.forceNewWatch()), clock);
        }
        log.debug("Using notification strategy: mode={}, setupWatch={}", subscription.mode(), subscription.setupWatch());
        return new NotificationSubscriptionStrategy(subscription, session, listener, watchManager, delivery, metrics);
    }
}
