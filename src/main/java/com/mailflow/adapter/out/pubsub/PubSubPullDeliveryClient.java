package com.mailflow.adapter.out.pubsub;

import com.mailflow.adapter.out.pubsub.PubSubResources.AcknowledgeRequest;
import com.mailflow.adapter.out.pubsub.PubSubResources.ModifyAckDeadlineRequest;
import com.mailflow.adapter.out.pubsub.PubSubResources.PullRequest;
import com.mailflow.adapter.out.pubsub.PubSubResources.PullResponse;
import com.mailflow.adapter.out.pubsub.PubSubResources.ReceivedMessage;
import com.mailflow.application.port.out.AccessTokenProvider;
import com.mailflow.application.port.out.DeliveryClient;
import com.mailflow.domain.model.Envelope;
import com.mailflow.domain.model.ResourceName;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import com.mailflow.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pulls from a Pub/Sub subscription over REST and hands each message to a bounded handler pool.
 * A message is acknowledged or negative-acknowledged (ack deadline 0) according to the handler's decision.
 */
public class PubSubPullDeliveryClient implements DeliveryClient {

    private static final Logger log = LoggerFactory.getLogger(PubSubPullDeliveryClient.class);

    private final RestClient restClient;
    private final AccessTokenProvider tokens;
    private final ResourceName subscription;
    private final AppProperties.PubSub settings;

    private final AtomicBoolean running = new AtomicBoolean();
    private final CancellationSignal stopSignal = CancellationSignal.create();
    private volatile ExecutorService poller;
    private volatile ThreadPoolExecutor handlers;

    public PubSubPullDeliveryClient(
            RestClient.Builder restClientBuilder,
            AccessTokenProvider tokens,
            ResourceName subscription,
            AppProperties.PubSub settings) {
        this.restClient = restClientBuilder.baseUrl(settings.getBaseUrl()).build();
        this.tokens = tokens;
        this.subscription = subscription;
        this.settings = settings;
    }

    @Override
    public void start(DeliveryHandler handler) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Pull client already started for " + subscription);
        }
        int threads = Math.max(1, settings.getHandlerThreads());
        handlers = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(Math.max(1, settings.getMaxMessages()) * 2),
            new CustomizableThreadFactory("pubsub-handler-"),
            callerRunsUnlessShutdown());
        poller = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("pubsub-pull-"));
        poller.execute(() -> pullLoop(handler));
        log.info("Pulling from {}: maxMessages={}, handlerThreads={}", subscription, settings.getMaxMessages(), threads);
    }

    @Override
    public boolean stop(Duration timeout) {
        if (!running.compareAndSet(true, false)) {
            return true;
        }
        stopSignal.cancel("pull client stopped");
        long deadline = System.nanoTime() + timeout.toNanos();
        poller.shutdown();
        try {
            if (!poller.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS)) {
                poller.shutdownNow();
            }
            handlers.shutdown();
            boolean drained = handlers.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS);
            if (!drained) {
                log.warn("{} notification handlers still running after {}", handlers.getActiveCount(), timeout);
            }
            log.info("Stopped pulling from {}", subscription);
            return drained;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            poller.shutdownNow();
            handlers.shutdownNow();
            return false;
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void pullLoop(DeliveryHandler handler) {
        while (running.get()) {
            List<ReceivedMessage> messages;
            try {
                messages = pull();
            } catch (RuntimeException e) {
                log.warn("Pull from {} failed, retrying in {}: {}", subscription, settings.getPullInterval(), e.getMessage());
                stopSignal.await(settings.getPullInterval());
                continue;
            }
            if (messages.isEmpty()) {
                stopSignal.await(settings.getPullInterval());
                continue;
            }
            log.debug("Pulled {} messages from {}", messages.size(), subscription);
            for (ReceivedMessage message : messages) {
                dispatch(handler, message);
            }
        }
    }

    private void dispatch(DeliveryHandler handler, ReceivedMessage received) {
        if (!running.get()) {
            nack(received.ackId());
            return;
        }
        try {
            handlers.execute(() -> handle(handler, received));
        } catch (RejectedExecutionException e) {
            log.debug("Handler pool closed, returning message {}", received.message() == null ? null : received.message().messageId());
            nack(received.ackId());
        }
    }

    private void handle(DeliveryHandler handler, ReceivedMessage received) {
        Envelope envelope = received.message() == null
            ? Envelopes.of(null, "", null, null)
            : Envelopes.of(received.message().messageId(), received.message().data(),
                received.message().attributes(), received.message().publishTime());
        AckDecision decision;
        try {
            decision = handler.handle(envelope);
        } catch (RuntimeException e) {
            log.error("Handler failed for message {}: {}", envelope.messageId(), e.getMessage(), e);
            decision = AckDecision.NACK;
        }
        if (decision == AckDecision.ACK) {
            ack(received.ackId());
        } else {
            nack(received.ackId());
        }
    }

    List<ReceivedMessage> pull() {
        PullResponse response = restClient.post()
            .uri("/v1/" + subscription.path() + ":pull")
            .headers(h -> h.setBearerAuth(tokens.accessToken()))
            .contentType(MediaType.APPLICATION_JSON)
            .body(new PullRequest(settings.getMaxMessages()))
            .retrieve()
            .body(PullResponse.class);
        return response == null || response.receivedMessages() == null ? List.of() : response.receivedMessages();
    }

    private void ack(String ackId) {
        try {
            restClient.post()
                .uri("/v1/" + subscription.path() + ":acknowledge")
                .headers(h -> h.setBearerAuth(tokens.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(new AcknowledgeRequest(List.of(ackId)))
                .retrieve()
                .toBodilessEntity();
        } catch (RestClientException e) {
            log.warn("Acknowledge failed on {}, message will be redelivered: {}", subscription, e.getMessage());
        }
    }

    private void nack(String ackId) {
        try {
            restClient.post()
                .uri("/v1/" + subscription.path() + ":modifyAckDeadline")
                .headers(h -> h.setBearerAuth(tokens.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ModifyAckDeadlineRequest(List.of(ackId), 0))
                .retrieve()
                .toBodilessEntity();
        } catch (RestClientException e) {
            log.warn("Negative acknowledge failed on {}: {}", subscription, e.getMessage());
        }
    }

    /**
     * Runs a saturated task on the pulling thread, which throttles pulls. Once the pool is shut
     * down the task is rejected so the caller can return the message.
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (task, executor) -> {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Handler pool is shut down");
            }
            task.run();
        };
    }

    private static long remaining(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }
}
