package com.nanik.finhub.router;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Circuit breaker of one worker instance.
 *
 * Counting and state transitions are done by a resilience4j {@link CircuitBreaker}.
 * On top of it every permit remembers the generation of the breaker state that
 * granted it; a transition starts a new generation. The outcome of a permit from
 * an older generation is dropped: a call granted while CLOSED cannot close a
 * breaker that opened meanwhile, and cannot end a HALF_OPEN trial it does not own.
 */
public class InstanceBreaker {

    private static final Logger log = LoggerFactory.getLogger(InstanceBreaker.class);

    private final CircuitBreaker delegate;
    private long generation;

    InstanceBreaker(CircuitBreaker delegate) {
        this.delegate = delegate;
        delegate.getEventPublisher().onStateTransition(event ->
                log.info("Circuit for {}: {}", delegate.getName(), event.getStateTransition()));
    }

    /**
     * @return a permit for one attempt, or null when the breaker refuses
     */
    public synchronized Permit tryAcquire() {
        CircuitBreaker.State before = delegate.getState();
        boolean granted = delegate.tryAcquirePermission();
        track(before);
        return granted ? new Permit(this, generation) : null;
    }

    private synchronized void succeeded(Permit permit, Duration elapsed) {
        if (isStale(permit, "success")) {
            return;
        }
        CircuitBreaker.State before = delegate.getState();
        delegate.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
        track(before);
    }

    private synchronized void failed(Permit permit, Duration elapsed, Throwable cause) {
        if (isStale(permit, "failure")) {
            return;
        }
        CircuitBreaker.State before = delegate.getState();
        delegate.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, cause);
        track(before);
    }

    private synchronized void released(Permit permit) {
        if (isStale(permit, "release")) {
            return;
        }
        delegate.releasePermission();
    }

    /**
     * Back to CLOSED with an empty failure window.
     */
    public synchronized void reset() {
        delegate.reset();
        generation++;
    }

    private boolean isStale(Permit permit, String outcome) {
        if (permit.generation == generation) {
            return false;
        }
        log.debug("Ignoring {} of {} granted before the circuit changed to {}",
                outcome, delegate.getName(), delegate.getState());
        return true;
    }

    private void track(CircuitBreaker.State before) {
        if (delegate.getState() != before) {
            generation++;
        }
    }

    public synchronized CircuitBreaker.State getState() {
        return delegate.getState();
    }

    /**
     * Failures counted in the current window.
     */
    public synchronized int getFailedCalls() {
        return delegate.getMetrics().getNumberOfFailedCalls();
    }

    public String getInstanceId() {
        return delegate.getName();
    }

    /**
     * Right to run one attempt. Exactly one of the outcome methods should be
     * called; later calls are ignored.
     */
    public static final class Permit {
        private final InstanceBreaker breaker;
        private final long generation;
        private boolean settled;

        private Permit(InstanceBreaker breaker, long generation) {
            this.breaker = breaker;
            this.generation = generation;
        }

        public void succeeded(Duration elapsed) {
            if (settle()) {
                breaker.succeeded(this, elapsed);
            }
        }

        public void failed(Duration elapsed, Throwable cause) {
            if (settle()) {
                breaker.failed(this, elapsed, cause);
            }
        }

        /**
         * The attempt ended without a verdict on the instance (cancelled, or never dispatched).
         */
        public void release() {
            if (settle()) {
                breaker.released(this);
            }
        }

        private synchronized boolean settle() {
            if (settled) {
                return false;
            }
            settled = true;
            return true;
        }

        public String getInstanceId() {
            return breaker.getInstanceId();
        }
    }
}
