package com.civica.service.resilience;

/**
 * Notified after every state transition, outside the breaker's lock.
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    void onStateTransition(CircuitBreakerState from, CircuitBreakerState to);
}
