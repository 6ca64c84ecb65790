package com.mailflow.application.service;

import com.mailflow.application.port.out.IdGenerator;
import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.port.out.MetricsPort;
import com.mailflow.application.port.out.WatchStateStore;
import com.mailflow.domain.model.WatchGrant;
import com.mailflow.domain.model.WatchKey;
import com.mailflow.domain.model.WatchRegistration;
import com.mailflow.domain.model.Watermarks;
import com.mailflow.infrastructure.concurrent.CancellationSignal;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one watch registration alive for a (service, application) key.
 *
 * <p>{@link #start} makes sure a registration is active, adopting a persisted one for the same topic
 * when possible, then runs a renewal loop on its own thread. Each check is scheduled
 * {@code safetyMargin} before expiry, but never sooner than {@code minimumDelay} from now.
 * Once {@link #stop()} has been requested no registration is created or renewed.
 */
public class WatchLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(WatchLifecycleManager.class);

    static final String HISTORY_ID_KEY = "historyId";
    static final String LABEL_IDS_KEY = "labelIds";

    private final MailboxClient mailbox;
    private final WatchStateStore store;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final WatchPolicy policy;
    private final Clock clock;
    private final WatchKey key;

    private final Object lock = new Object();
    private volatile WatchRegistration current;
    private volatile boolean stopRequested;
    private String topicName;
    private List<String> labelIds;
    private Instant endTime;
    private CancellationSignal loopSignal;
    private ExecutorService executor;

    public WatchLifecycleManager(
            MailboxClient mailbox,
            WatchStateStore store,
            IdGenerator idGenerator,
            MetricsPort metrics,
            WatchPolicy policy,
            Clock clock) {
        this.mailbox = mailbox;
        this.store = store;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.policy = policy;
        this.clock = clock;
        this.key = new WatchKey(policy.serviceType(), policy.applicationName());
    }

    /**
     * Ensures an active registration and starts the renewal loop. When the registration cannot be
     * set up the loop still starts and retries after the backoff.
     *
     * @param labels label ids to watch, the policy's default labels when null or empty
     * @param endTime when renewals stop, or null to renew until stopped
     * @return the registration in effect, empty if it could not be set up yet
     * @throws MailboxAuthorizationException if the mailbox rejects our credentials
     */
    public Optional<WatchRegistration> start(String topic, List<String> labels, Instant endTime,
                                             CancellationSignal cancellation) {
        Instant firstCheck;
        synchronized (lock) {
            if (stopRequested) {
                throw new IllegalStateException("Watch manager was stopped");
            }
            if (executor != null) {
                throw new IllegalStateException("Watch manager already started");
            }
            this.topicName = topic;
            this.labelIds = labels == null || labels.isEmpty() ? policy.defaultLabels() : List.copyOf(labels);
            this.endTime = endTime;
            try {
                WatchRegistration registration = ensureActive();
                firstCheck = nextCheckAt(clock.instant(), registration.expiration(),
                    policy.safetyMargin(), policy.minimumDelay());
            } catch (MailboxAuthorizationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to set up watch on {}, retrying in {}: {}",
                    topic, policy.retryBackoff(), e.getMessage(), e);
                firstCheck = clock.instant().plus(policy.retryBackoff());
            }
            this.loopSignal = cancellation.child();
            this.executor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("watch-renewal-"));
        }
        Instant check = firstCheck;
        executor.execute(() -> renewalLoop(check));
        return Optional.ofNullable(current);
    }

    /**
     * Stops the renewal loop. An owned registration is stopped remotely and its persisted state
     * cleared; an adopted one is left as it is, since another consumer may depend on it.
     */
    public void stop() {
        synchronized (lock) {
            if (stopRequested) {
                return;
            }
            stopRequested = true;
        }
        if (loopSignal != null) {
            loopSignal.cancel("watch manager stopped");
        }
        if (executor != null) {
            executor.shutdown();
            awaitLoop();
        }

        WatchRegistration registration = current;
        if (registration == null) {
            log.info("Watch manager stopped without a registration: key={}", key);
            return;
        }
        if (!registration.owned()) {
            log.info("Leaving adopted watch in place: watchId={}, expiration={}",
                registration.watchId(), registration.expiration());
            return;
        }
        try {
            mailbox.stopWatch();
            store.clear(key);
            log.info("Owned watch stopped and state cleared: watchId={}", registration.watchId());
        } catch (RuntimeException e) {
            log.error("Failed to stop owned watch {}: {}", registration.watchId(), e.getMessage(), e);
        }
    }

    public Optional<WatchRegistration> current() {
        return Optional.ofNullable(current);
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * History id returned when the current registration was created, if known.
     */
    public long registrationHistoryId() {
        WatchRegistration registration = current;
        if (registration == null) {
            return Watermarks.NONE;
        }
        Object value = registration.serviceSpecificData().get(HISTORY_ID_KEY);
        if (value == null) {
            return Watermarks.NONE;
        }
        try {
            return Watermarks.parse(value.toString());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparsable historyId '{}' in watch state", value);
            return Watermarks.NONE;
        }
    }

    /**
     * When the next renewal check is due: {@code safetyMargin} before expiry, clamped to
     * at least {@code minimumDelay} after {@code now}.
     */
    static Instant nextCheckAt(Instant now, Instant expiration, Duration safetyMargin, Duration minimumDelay) {
        Instant earliest = now.plus(minimumDelay);
        Instant target = expiration.minus(safetyMargin);
        return target.isBefore(earliest) ? earliest : target;
    }

    private void renewalLoop(Instant firstCheck) {
        Instant next = firstCheck;
        log.debug("Next watch check at {}", next);
        while (next != null && !loopSignal.isCancelled()) {
            Duration wait = Duration.between(clock.instant(), next);
            if (loopSignal.await(wait)) {
                break;
            }
            next = renewalCheck(clock.instant());
            if (next != null) {
                log.debug("Next watch check at {}", next);
            }
        }
        log.debug("Watch renewal loop exited: key={}", key);
    }

    /**
     * Runs one renewal check.
     *
     * @return when to check next, or null when renewals have ended
     */
    Instant renewalCheck(Instant now) {
        try {
            synchronized (lock) {
                if (stopRequested) {
                    return null;
                }
                WatchRegistration registration = current;
                if (registration == null || !registration.isActiveAt(now)) {
                    if (endTimePassed(now)) {
                        log.info("Watch expired after end time {}, not recreating", endTime);
                        return null;
                    }
                    log.warn("No active watch, creating a new one: key={}", key);
                    registration = create();
                } else if (Duration.between(now, registration.expiration()).compareTo(policy.renewalThreshold()) <= 0) {
                    if (endTimePassed(now)) {
                        log.info("End time {} has passed, renewals stopped", endTime);
                        return null;
                    }
                    registration = create();
                    metrics.incrementWatchRenewals();
                    log.info("Watch renewed: watchId={}, expiration={}", registration.watchId(), registration.expiration());
                }
                return nextCheckAt(now, registration.expiration(), policy.safetyMargin(), policy.minimumDelay());
            }
        } catch (RuntimeException e) {
            log.error("Watch check failed, retrying in {}: {}", policy.retryBackoff(), e.getMessage(), e);
            return now.plus(policy.retryBackoff());
        }
    }

    private WatchRegistration ensureActive() {
        Instant now = clock.instant();
        Optional<WatchRegistration> persisted = store.load(key);
        if (persisted.isPresent() && !policy.forceNew()) {
            WatchRegistration existing = persisted.get();
            if (!existing.isActiveAt(now)) {
                log.info("Persisted watch expired at {}, creating a new one", existing.expiration());
            } else if (!topicName.equals(existing.topicName())) {
                log.warn("Persisted watch targets topic {}, not {}; creating a new one", existing.topicName(), topicName);
            } else {
                current = existing.asOwned(false);
                log.info("Adopted existing watch: watchId={}, expiration={}", existing.watchId(), existing.expiration());
                return current;
            }
        }
        return create();
    }

    private WatchRegistration create() {
        WatchGrant grant = mailbox.createWatch(topicName, labelIds);
        Instant now = clock.instant();
        Instant expiration = grant.expiration() != null ? grant.expiration() : now.plus(policy.defaultExpiration());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(HISTORY_ID_KEY, Watermarks.format(grant.historyId()));
        data.put(LABEL_IDS_KEY, labelIds);

        WatchRegistration registration = new WatchRegistration(
            key.serviceType(),
            topicName,
            key.applicationName(),
            idGenerator.generate().toString(),
            expiration,
            now,
            true,
            data
        );
        store.save(registration);
        current = registration;
        log.info("Watch created: watchId={}, topic={}, labels={}, expiration={}, historyId={}",
            registration.watchId(), topicName, labelIds, expiration, Watermarks.format(grant.historyId()));
        return registration;
    }

    private boolean endTimePassed(Instant now) {
        return endTime != null && now.isAfter(endTime);
    }

    private void awaitLoop() {
        try {
            if (!executor.awaitTermination(policy.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Watch renewal loop did not exit within {}", policy.stopTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
