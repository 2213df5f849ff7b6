package com.civica.model.dto;

import com.civica.service.resilience.CircuitBreakerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Backend service status information for external monitoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceStatus {

    /**
     * Circuit closed and a credential is configured.
     */
    private boolean available;

    private long requestsToday;

    private long failedRequestsToday;

    private Instant lastSuccessfulRequest;

    private CircuitBreakerState circuitBreakerState;

    private double cacheHitRate;
}
