package com.flagship.prior_auth.integration.resilience;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Overall time budget for one caller request, shared by every attempt and backoff
 * sleep made on its behalf, plus a cancellation signal.
 *
 * Cancelling runs the registered hooks, which abort in-flight attempts.
 */
public final class CallDeadline {

    private final long deadlineNanos;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

    private CallDeadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static CallDeadline after(Duration budget) {
        if (budget == null || budget.isNegative()) {
            throw new IllegalArgumentException("Deadline budget must be a non-negative duration");
        }
        return new CallDeadline(System.nanoTime() + budget.toNanos());
    }

    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Cancels the call. Idempotent; hooks run once, on the first cancellation.
     */
    public void cancel() {
        synchronized (cancelled) {
            if (isCancelled()) {
                return;
            }
            cancelled.countDown();
        }
        for (Runnable hook : cancelHooks) {
            hook.run();
        }
        cancelHooks.clear();
    }

    /**
     * Registers a hook to run on cancellation. Runs it immediately if already cancelled.
     *
     * @return a handle that unregisters the hook
     */
    public Runnable onCancel(Runnable hook) {
        synchronized (cancelled) {
            if (!isCancelled()) {
                cancelHooks.add(hook);
                return () -> cancelHooks.remove(hook);
            }
        }
        hook.run();
        return () -> { };
    }

    /**
     * Sleeps for {@code delay} unless cancelled first.
     *
     * @return true if the full delay elapsed, false if the call was cancelled meanwhile
     */
    public boolean sleep(Duration delay) throws InterruptedException {
        return !cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Smaller of {@code limit} and the remaining budget.
     */
    public Duration cap(Duration limit) {
        Duration remaining = remaining();
        return remaining.compareTo(limit) < 0 ? remaining : limit;
    }
}
