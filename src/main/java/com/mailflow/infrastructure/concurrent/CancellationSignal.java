package com.mailflow.infrastructure.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot cancellation flag shared by the background activities of a subscription run.
 *
 * <p>A signal is cancelled by an explicit {@link #cancel(String)}, by a deadline set with
 * {@link #cancelAt(Instant, Clock)}, or through its parent when created with {@link #child()}.
 * Cancelling a child never cancels its parent.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final CompletableFuture<String> cancelled = new CompletableFuture<>();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancel("cancelled");
    }

    /**
     * Cancels the signal. Only the first reason is kept.
     *
     * @return true if this call cancelled the signal
     */
    public boolean cancel(String reason) {
        boolean first = cancelled.complete(reason);
        if (first) {
            log.debug("Cancellation requested: {}", reason);
        }
        return first;
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    public Optional<String> reason() {
        return Optional.ofNullable(cancelled.getNow(null));
    }

    /**
     * Sleeps for {@code timeout} unless the signal is cancelled first.
     * An interrupt is treated as cancellation of the wait and the interrupt flag is restored.
     *
     * @return true if the signal was cancelled (or the thread interrupted) before the timeout elapsed
     */
    public boolean await(Duration timeout) {
        if (isCancelled()) {
            return true;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            return false;
        }
        try {
            cancelled.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } catch (ExecutionException e) {
            // never completed exceptionally
            throw new IllegalStateException(e);
        }
    }

    /**
     * Runs {@code action} once the signal is cancelled, immediately if it already is.
     * The action runs on the thread that cancels.
     */
    public void onCancel(Runnable action) {
        cancelled.thenRun(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Cancellation callback failed: {}", e.getMessage(), e);
            }
        });
    }

    /**
     * Creates a signal that is cancelled together with this one but can also be cancelled on its own.
     */
    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal();
        cancelled.thenAccept(reason -> child.cancel(reason));
        return child;
    }

    public void cancelAt(Instant deadline, Clock clock) {
        Duration delay = Duration.between(clock.instant(), deadline);
        if (delay.isNegative() || delay.isZero()) {
            cancel("deadline reached");
            return;
        }
        CompletableFuture.runAsync(
            () -> cancel("deadline reached"),
            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }
}
