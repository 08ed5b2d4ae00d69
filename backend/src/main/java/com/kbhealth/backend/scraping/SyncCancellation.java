package com.kbhealth.backend.scraping;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal of one sync run: an external flag plus an optional wall-clock deadline.
 */
public class SyncCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private SyncCancellation(Duration budget) {
        this.hasDeadline = budget != null;
        this.deadlineNanos = budget != null ? System.nanoTime() + budget.toNanos() : 0L;
    }

    public static SyncCancellation none() {
        return new SyncCancellation(null);
    }

    public static SyncCancellation withBudget(Duration budget) {
        return new SyncCancellation(budget);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || isTimedOut();
    }

    public boolean isCancelRequested() {
        return cancelled.get();
    }

    public boolean isTimedOut() {
        return hasDeadline && System.nanoTime() - deadlineNanos > 0;
    }
}
