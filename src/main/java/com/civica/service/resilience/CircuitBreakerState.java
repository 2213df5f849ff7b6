package com.civica.service.resilience;

/**
 * Circuit breaker states: CLOSED -> OPEN -> HALF_OPEN -> CLOSED.
 */
public enum CircuitBreakerState {

    /**
     * Calls pass through; consecutive failures are counted.
     */
    CLOSED,

    /**
     * Calls fail fast until the open duration has elapsed.
     */
    OPEN,

    /**
     * One trial call decides between CLOSED and OPEN.
     */
    HALF_OPEN
}
