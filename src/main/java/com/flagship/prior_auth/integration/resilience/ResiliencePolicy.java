package com.flagship.prior_auth.integration.resilience;

import com.flagship.prior_auth.error.AmbiguousFailureException;
import com.flagship.prior_auth.error.ConfigurationException;
import com.flagship.prior_auth.error.IntegrationUnavailableException;
import com.flagship.prior_auth.error.PriorAuthException;
import com.flagship.prior_auth.error.RemoteRejectionException;
import com.flagship.prior_auth.error.ValidationException;
import com.flagship.prior_auth.integration.TransientIntegrationException;
import com.flagship.prior_auth.integration.WireProtocolException;
import com.flagship.prior_auth.observability.PriorAuthMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Circuit breaker plus bounded retry for one upstream, both from Resilience4j.
 *
 * Call outcome handling:
 * - Transient failures (I/O, remote 5xx, attempt timeout) are recorded as breaker
 *   failures and retried with exponential backoff while attempts and deadline remain
 * - Malformed responses are recorded as breaker failures and not retried
 * - Business rejections, validation and configuration errors propagate untouched and
 *   are ignored by the breaker
 * - An OPEN breaker fails fast with no I/O and without spending retry budget
 *
 * Every attempt runs on this policy's bounded worker pool with a timeout of
 * {@code min(attemptTimeout, deadline.remaining())}. Timed-out or cancelled attempts are
 * interrupted so the underlying HTTP exchange is aborted.
 *
 * The breaker is a Resilience4j count-based state machine: a single permit in HALF_OPEN
 * gives the single trial-call admission gate, and the OPEN wait grows geometrically with
 * consecutive failed trial calls up to {@code maxOpenDuration}. The {@link Retry} wraps each
 * breaker-guarded attempt and waits {@link ResilienceSettings#retryBackoff()} between
 * attempts, cut short when the caller's deadline would pass first.
 */
@Slf4j
public class ResiliencePolicy {

    private final String upstream;
    private final ResilienceSettings settings;
    private final CircuitBreaker circuitBreaker;
    private final IntervalFunction openIntervals;
    private final ExecutorService executor;
    private final SharedCircuitState sharedState;
    private final PriorAuthMetrics metrics;
    private final IntervalFunction retryBackoff;
    private final Retry retry;
    private final ThreadLocal<CallState> currentCall = new ThreadLocal<>();
    private final AtomicInteger consecutiveOpens = new AtomicInteger(0);

    public ResiliencePolicy(String upstream,
                            ResilienceSettings settings,
                            ExecutorService executor,
                            SharedCircuitState sharedState,
                            PriorAuthMetrics metrics) {
        this.upstream = upstream;
        this.settings = settings;
        this.executor = executor;
        this.sharedState = sharedState;
        this.metrics = metrics;
        this.openIntervals = IntervalFunction.ofExponentialBackoff(
                settings.getOpenDuration().toMillis(),
                settings.getOpenDurationMultiplier(),
                settings.getMaxOpenDuration().toMillis());

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getSlidingWindowSize())
                .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
                .failureRateThreshold(settings.getFailureRateThreshold())
                .waitIntervalFunctionInOpenState(openIntervals)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .ignoreExceptions(RemoteRejectionException.class, ValidationException.class,
                        ConfigurationException.class)
                .build();

        this.circuitBreaker = CircuitBreaker.of(upstream, config);
        this.circuitBreaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State from = event.getStateTransition().getFromState();
            CircuitBreaker.State to = event.getStateTransition().getToState();
            metrics.recordBreakerTransition(upstream, from.name(), to.name());
            if (to == CircuitBreaker.State.OPEN) {
                Duration coolDown = currentCoolDown(consecutiveOpens.incrementAndGet());
                log.warn("Circuit breaker for upstream={} opened ({} -> {}), cool-down {}ms",
                        upstream, from, to, coolDown.toMillis());
                sharedState.markOpen(upstream, coolDown);
            } else if (to == CircuitBreaker.State.CLOSED) {
                consecutiveOpens.set(0);
                log.info("Circuit breaker for upstream={} closed ({} -> {})", upstream, from, to);
                sharedState.markClosed(upstream);
            } else {
                log.info("Circuit breaker for upstream={} transitioned {} -> {}", upstream, from, to);
            }
        });

        this.retryBackoff = settings.retryBackoff();
        RetryConfig retryConfig = RetryConfig.<Object>custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalBiFunction((retryNumber, outcome) -> waitBeforeRetry(retryNumber))
                .retryOnException(e -> e instanceof TransientIntegrationException
                        || e instanceof AttemptTimedOutException)
                .ignoreExceptions(RemoteRejectionException.class, ValidationException.class,
                        ConfigurationException.class, CallEndedException.class)
                .build();
        this.retry = Retry.of(upstream, retryConfig);
        this.retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying upstream={} in {}ms (attempt {} of {})", upstream,
                        event.getWaitInterval().toMillis(), event.getNumberOfRetryAttempts() + 1,
                        settings.getMaxAttempts()));
    }

    public String getUpstream() {
        return upstream;
    }

    public CircuitBreaker.State getState() {
        return circuitBreaker.getState();
    }

    public CircuitBreaker.Metrics getBreakerMetrics() {
        return circuitBreaker.getMetrics();
    }

    public Retry.Metrics getRetryMetrics() {
        return retry.getMetrics();
    }

    public ResilienceSettings getSettings() {
        return settings;
    }

    /**
     * Runs {@code call} with this upstream's default attempt timeout.
     */
    public <T> T execute(CallDeadline deadline, Supplier<T> call) {
        return execute(deadline, settings.getAttemptTimeout(), call);
    }

    /**
     * Runs {@code call} under breaker, retry, per-attempt timeout and caller deadline.
     *
     * @throws IntegrationUnavailableException breaker open, pool saturated, retries exhausted,
     *         deadline elapsed or call cancelled
     * @throws AmbiguousFailureException retries exhausted and the last attempt timed out
     * @throws PriorAuthException non-retryable domain errors raised by {@code call}
     */
    public <T> T execute(CallDeadline deadline, Duration attemptTimeout, Supplier<T> call) {
        long callStart = System.nanoTime();
        CallState state = new CallState(deadline, Thread.currentThread());
        CallState enclosing = currentCall.get();
        currentCall.set(state);
        Runnable unregister = deadline.onCancel(state::interruptBackoff);
        try {
            T result = retry.executeSupplier(() -> attempt(state, attemptTimeout, call));
            if (state.attempts > 1) {
                log.info("Call to upstream={} succeeded on attempt {}", upstream, state.attempts);
            }
            finish(callStart, "success", null);
            return result;

        } catch (CallEndedException e) {
            throw finish(callStart, e.getOutcome(), e.getError());

        } catch (TransientIntegrationException | AttemptTimedOutException e) {
            // retry budget spent on retryable failures
            if (state.clearBackoffInterrupt() || deadline.isCancelled()) {
                throw finish(callStart, "cancelled", unavailable("Call cancelled by caller", e));
            }
            throw finish(callStart, "exhausted", exhausted(state.attempts, e, state.lastAmbiguous,
                    "retry budget used"));
        } finally {
            unregister.run();
            state.clearBackoffInterrupt();
            if (enclosing != null) {
                currentCall.set(enclosing);
            } else {
                currentCall.remove();
            }
        }
    }

    /**
     * One pass through the breaker. Retryable failures escape as-is for the {@link Retry};
     * every other way the call ends is wrapped in a {@link CallEndedException}.
     */
    private <T> T attempt(CallState state, Duration attemptTimeout, Supplier<T> call) {
        CallDeadline deadline = state.deadline;
        state.backingOff = false;
        if (deadline.isCancelled()) {
            throw ended("cancelled", unavailable("Call cancelled by caller", state.lastFailure));
        }
        if (state.deadlineTooClose) {
            throw ended("deadline", exhausted(state.attempts, state.lastFailure, state.lastAmbiguous,
                    "deadline too close for another attempt"));
        }
        if (deadline.isExpired()) {
            throw ended("deadline", exhausted(state.attempts, state.lastFailure, state.lastAmbiguous,
                    "deadline elapsed"));
        }

        Instant sharedOpenUntil = sharedState.openUntil(upstream).orElse(null);
        if (sharedOpenUntil != null && circuitBreaker.getState() != CircuitBreaker.State.HALF_OPEN) {
            metrics.recordBreakerRejection(upstream);
            throw ended("rejected", new IntegrationUnavailableException(upstream,
                    "Upstream " + upstream + " is marked unavailable by another instance",
                    Duration.between(Instant.now(), sharedOpenUntil)));
        }

        if (!circuitBreaker.tryAcquirePermission()) {
            metrics.recordBreakerRejection(upstream);
            log.debug("Rejected call to upstream={} without I/O, breaker state={}",
                    upstream, circuitBreaker.getState());
            throw ended("rejected", new IntegrationUnavailableException(upstream,
                    "Circuit breaker for " + upstream + " is " + circuitBreaker.getState(),
                    currentCoolDown(Math.max(1, consecutiveOpens.get())), state.lastFailure));
        }

        state.attempts++;
        long attemptStart = System.nanoTime();
        try {
            T result = runAttempt(call, deadline.cap(attemptTimeout), deadline);
            circuitBreaker.onSuccess(System.nanoTime() - attemptStart, TimeUnit.NANOSECONDS);
            metrics.recordAttempt(upstream, "success");
            return result;

        } catch (AttemptAbortedException e) {
            circuitBreaker.releasePermission();
            metrics.recordAttempt(upstream, "aborted");
            throw ended("cancelled", unavailable(e.getMessage(), e.getCause()));

        } catch (AttemptTimedOutException e) {
            circuitBreaker.onError(System.nanoTime() - attemptStart, TimeUnit.NANOSECONDS, e);
            metrics.recordAttempt(upstream, "timeout");
            log.warn("Attempt {} to upstream={} timed out after {}ms, remote outcome unknown",
                    state.attempts, upstream, e.getTimeout().toMillis());
            state.lastFailure = e;
            state.lastAmbiguous = true;
            throw e;

        } catch (TransientIntegrationException e) {
            circuitBreaker.onError(System.nanoTime() - attemptStart, TimeUnit.NANOSECONDS, e);
            metrics.recordAttempt(upstream, "transient_failure");
            log.warn("Attempt {} to upstream={} failed transiently: {}", state.attempts, upstream, e.getMessage());
            state.lastFailure = e;
            state.lastAmbiguous = e.isAmbiguous();
            throw e;

        } catch (WireProtocolException e) {
            circuitBreaker.onError(System.nanoTime() - attemptStart, TimeUnit.NANOSECONDS, e);
            metrics.recordAttempt(upstream, "protocol_error");
            log.error("Upstream={} returned an undecodable response: {}", upstream, e.getMessage());
            throw ended("protocol_error", new IntegrationUnavailableException(upstream,
                    "Malformed response from " + upstream + ": " + e.getMessage(), null, e));

        } catch (PriorAuthException e) {
            // ignored by the breaker through ignoreExceptions
            circuitBreaker.onError(System.nanoTime() - attemptStart, TimeUnit.NANOSECONDS, e);
            metrics.recordAttempt(upstream, "rejected_by_remote");
            throw ended("non_retryable", e);

        } catch (RuntimeException e) {
            circuitBreaker.onError(System.nanoTime() - attemptStart, TimeUnit.NANOSECONDS, e);
            metrics.recordAttempt(upstream, "unexpected_error");
            log.error("Unexpected failure calling upstream={}", upstream, e);
            throw ended("unexpected_error", new IntegrationUnavailableException(upstream,
                    "Unexpected failure calling " + upstream + ": " + e.getMessage(), null, e));
        }
    }

    /**
     * Wait before retry {@code retryNumber}. A wait that would outlast the caller's deadline
     * is shortened to a millisecond and the following attempt fails without I/O.
     */
    private long waitBeforeRetry(int retryNumber) {
        long backoff = retryBackoff.apply(retryNumber);
        CallState state = currentCall.get();
        if (state == null) {
            return backoff;
        }
        if (backoff >= state.deadline.remaining().toMillis()) {
            state.deadlineTooClose = true;
            return 1L;
        }
        state.backingOff = true;
        return backoff;
    }

    private <T> T runAttempt(Supplier<T> call, Duration timeout, CallDeadline deadline) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future;
        try {
            future = executor.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return call.get();
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            throw new AttemptAbortedException("Worker pool for " + upstream + " is saturated", e);
        }

        Runnable unregister = deadline.onCancel(() -> future.cancel(true));
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (deadline.isCancelled()) {
                throw new AttemptAbortedException("Call cancelled by caller", e);
            }
            throw new AttemptTimedOutException(timeout);
        } catch (CancellationException e) {
            throw new AttemptAbortedException("Call cancelled by caller", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AttemptAbortedException("Caller thread interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TransientIntegrationException("Checked failure calling " + upstream, false, cause);
        } finally {
            unregister.run();
        }
    }

    private PriorAuthException exhausted(int attempts, RuntimeException lastFailure, boolean ambiguous, String why) {
        String message = String.format("Upstream %s unavailable after %d attempt(s): %s", upstream, attempts, why);
        if (ambiguous) {
            return new AmbiguousFailureException(upstream,
                    message + "; last attempt timed out with unknown remote outcome", lastFailure);
        }
        return new IntegrationUnavailableException(upstream, message, settings.getBaseDelay(), lastFailure);
    }

    private IntegrationUnavailableException unavailable(String message, Throwable cause) {
        return new IntegrationUnavailableException(upstream, message + " (" + upstream + ")", null, cause);
    }

    private static CallEndedException ended(String outcome, RuntimeException error) {
        return new CallEndedException(outcome, error);
    }

    private <E extends RuntimeException> E finish(long callStart, String outcome, E error) {
        metrics.recordCallDuration(upstream, outcome, Duration.ofNanos(System.nanoTime() - callStart));
        return error;
    }

    private Duration currentCoolDown(int consecutiveOpenCount) {
        return Duration.ofMillis(openIntervals.apply(consecutiveOpenCount));
    }

    /**
     * Per-call bookkeeping shared by the attempt supplier and the retry wait.
     */
    private static final class CallState {

        private final CallDeadline deadline;
        private final Thread caller;
        private int attempts;
        private RuntimeException lastFailure;
        private boolean lastAmbiguous;
        private boolean deadlineTooClose;
        private volatile boolean backingOff;
        private volatile boolean interruptedBackoff;

        CallState(CallDeadline deadline, Thread caller) {
            this.deadline = deadline;
            this.caller = caller;
        }

        void interruptBackoff() {
            if (backingOff) {
                interruptedBackoff = true;
                caller.interrupt();
            }
        }

        /**
         * Clears an interrupt this call delivered to wake the caller from its backoff.
         */
        boolean clearBackoffInterrupt() {
            if (interruptedBackoff) {
                interruptedBackoff = false;
                Thread.interrupted();
                return true;
            }
            return false;
        }
    }

    /**
     * Non-retryable end of a call, carrying the outcome tag for the call duration metric.
     */
    static final class CallEndedException extends RuntimeException {

        private final String outcome;
        private final RuntimeException error;

        CallEndedException(String outcome, RuntimeException error) {
            super(error.getMessage(), error, false, false);
            this.outcome = outcome;
            this.error = error;
        }

        String getOutcome() {
            return outcome;
        }

        RuntimeException getError() {
            return error;
        }
    }

    /**
     * Attempt exceeded its timeout. The request may have reached the remote.
     */
    static final class AttemptTimedOutException extends RuntimeException {

        private final Duration timeout;

        AttemptTimedOutException(Duration timeout) {
            super("Attempt timed out after " + timeout.toMillis() + "ms");
            this.timeout = timeout;
        }

        Duration getTimeout() {
            return timeout;
        }
    }

    /**
     * Attempt abandoned locally: caller cancelled, thread interrupted or pool saturated.
     * Not a verdict on the upstream, so the breaker permit is released unrecorded.
     */
    static final class AttemptAbortedException extends RuntimeException {

        AttemptAbortedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
