package com.github.acprelay.messaging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Trailing-edge debounce: runs the action once {@code delayMs} has passed without a new trigger.
 */
final class Debouncer {
    private static final Logger LOG = LoggerFactory.getLogger(Debouncer.class);

    private final ScheduledExecutorService scheduler;
    private final long delayMs;
    private final Runnable action;
    private ScheduledFuture<?> pending;

    Debouncer(@NotNull ScheduledExecutorService scheduler, long delayMs, @NotNull Runnable action) {
        this.scheduler = scheduler;
        this.delayMs = Math.max(0, delayMs);
        this.action = action;
    }

    synchronized void trigger() {
        if (pending != null) pending.cancel(false);
        try {
            pending = scheduler.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            pending = null;
            LOG.debug("Debounced flush rejected, scheduler is shut down");
        }
    }

    synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void fire() {
        synchronized (this) {
            pending = null;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.warn("Debounced action failed", e);
        }
    }
}
