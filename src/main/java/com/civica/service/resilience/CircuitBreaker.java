package com.civica.service.resilience;

import com.civica.provider.BackendOutcome;
import com.civica.provider.FailureKind;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Three-state circuit breaker guarding one downstream dependency.
 *
 * <ul>
 *   <li>CLOSED: calls pass; each failure increments a counter, a success resets it;
 *       reaching the threshold opens the breaker and stamps the failure time</li>
 *   <li>OPEN: calls are rejected without reaching the dependency while less than the
 *       open duration has passed since the last failure; the first attempt after
 *       that moves to HALF_OPEN and runs as the trial</li>
 *   <li>HALF_OPEN: exactly one trial is in flight; others are rejected. The trial's
 *       success closes the breaker and zeroes the counter, its failure re-opens it with a
 *       fresh stamp. Outcomes of calls admitted before the breaker opened never move it
 *       out of OPEN or HALF_OPEN</li>
 * </ul>
 *
 * Only this class mutates its state. One instance per endpoint; nothing is shared.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration openDuration;
    private final Clock clock;
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    // Guarded by this
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private boolean trialInFlight;
    private long trialSequence;
    private long currentTrialId;

    public CircuitBreaker(String name, int failureThreshold, Duration openDuration, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be positive: " + failureThreshold);
        }
        if (openDuration == null || openDuration.isNegative()) {
            throw new IllegalArgumentException("Open duration must not be negative: " + openDuration);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.openDuration = openDuration;
        this.clock = clock;
    }

    public void addListener(CircuitBreakerListener listener) {
        listeners.add(listener);
    }

    /**
     * Run a call through the breaker.
     *
     * SUCCESS resets the breaker, FAILURE counts against it. Outcomes that never
     * reached the dependency (UNAVAILABLE, REJECTED) release a trial permit without
     * counting. A call that throws is recorded as an UNKNOWN failure.
     *
     * @param call the guarded call
     * @return the call's outcome, or a CIRCUIT_OPEN rejection without running it
     */
    public BackendOutcome execute(Supplier<BackendOutcome> call) {
        Optional<Permit> acquired = tryAcquire();
        if (acquired.isEmpty()) {
            log.debug("Circuit '{}' is {}, rejecting call", name, getState());
            return BackendOutcome.rejected();
        }
        Permit permit = acquired.get();

        BackendOutcome outcome;
        try {
            outcome = call.get();
        } catch (RuntimeException e) {
            log.warn("Call through circuit '{}' threw: {}", name, e.toString());
            outcome = BackendOutcome.failure(FailureKind.UNKNOWN, e.getMessage());
        }

        switch (outcome.getStatus()) {
            case SUCCESS -> recordSuccess(permit);
            case FAILURE -> recordFailure(permit);
            default -> release(permit);
        }
        return outcome;
    }

    /**
     * Ask to run one call. A permit obliges the caller to report back through
     * {@link #recordSuccess}, {@link #recordFailure} or {@link #release}.
     *
     * @return a permit, or empty when the call must not reach the dependency
     */
    public Optional<Permit> tryAcquire() {
        Transition transition = null;
        Permit permit;

        synchronized (this) {
            switch (state) {
                case CLOSED -> permit = Permit.REGULAR;
                case OPEN -> {
                    if (Duration.between(lastFailureAt, clock.instant()).compareTo(openDuration) >= 0) {
                        transition = transitionTo(CircuitBreakerState.HALF_OPEN);
                        permit = startTrial();
                    } else {
                        permit = null;
                    }
                }
                case HALF_OPEN -> permit = trialInFlight ? null : startTrial();
                default -> throw new IllegalStateException("Unknown state " + state);
            }
        }

        fire(transition);
        return Optional.ofNullable(permit);
    }

    /**
     * Report a successful call. Only the current trial can close a HALF_OPEN breaker.
     */
    public void recordSuccess(Permit permit) {
        Transition transition = null;
        synchronized (this) {
            failureCount = 0;
            if (isCurrentTrial(permit)) {
                trialInFlight = false;
                transition = transitionTo(CircuitBreakerState.CLOSED);
            }
        }
        fire(transition);
    }

    /**
     * Report a failed call. A failure admitted before the breaker opened is counted
     * and stamped but leaves an open or half-open breaker where it is.
     */
    public void recordFailure(Permit permit) {
        Transition transition = null;
        synchronized (this) {
            failureCount++;
            lastFailureAt = clock.instant();
            if (isCurrentTrial(permit)) {
                trialInFlight = false;
                transition = transitionTo(CircuitBreakerState.OPEN);
            } else if (state == CircuitBreakerState.CLOSED && failureCount >= failureThreshold) {
                transition = transitionTo(CircuitBreakerState.OPEN);
            }
        }
        fire(transition);
    }

    /**
     * Give back a permit whose call never reached the dependency.
     */
    public synchronized void release(Permit permit) {
        if (isCurrentTrial(permit)) {
            trialInFlight = false;
        }
    }

    /**
     * Force CLOSED with a zero counter.
     */
    public void reset() {
        Transition transition = null;
        synchronized (this) {
            failureCount = 0;
            lastFailureAt = null;
            trialInFlight = false;
            currentTrialId = 0;
            if (state != CircuitBreakerState.CLOSED) {
                transition = transitionTo(CircuitBreakerState.CLOSED);
            }
        }
        fire(transition);
    }

    public synchronized CircuitBreakerState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureAt() {
        return lastFailureAt;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getOpenDuration() {
        return openDuration;
    }

    public String getName() {
        return name;
    }

    // Caller holds the lock
    private Permit startTrial() {
        trialInFlight = true;
        currentTrialId = ++trialSequence;
        return new Permit(currentTrialId);
    }

    // Caller holds the lock
    private boolean isCurrentTrial(Permit permit) {
        return state == CircuitBreakerState.HALF_OPEN
                && trialInFlight
                && permit.isTrial()
                && permit.getTrialId() == currentTrialId;
    }

    // Caller holds the lock
    private Transition transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = next;
        return new Transition(previous, next);
    }

    private void fire(Transition transition) {
        if (transition == null) {
            return;
        }
        log.info("Circuit '{}' state changed: {} -> {} (failures={})",
                name, transition.getFrom(), transition.getTo(), getFailureCount());
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onStateTransition(transition.getFrom(), transition.getTo());
            } catch (RuntimeException e) {
                log.warn("Circuit '{}' listener failed: {}", name, e.getMessage(), e);
            }
        }
    }

    /**
     * Right to run one call. The HALF_OPEN trial carries its own id; every other
     * permit is {@link #REGULAR}.
     */
    @Value
    public static class Permit {
        private static final Permit REGULAR = new Permit(0L);

        long trialId;

        public boolean isTrial() {
            return trialId != 0L;
        }
    }

    @Value
    private static class Transition {
        CircuitBreakerState from;
        CircuitBreakerState to;
    }
}
