package com.civica.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Daily backend call counters. The day rolls over at midnight UTC.
 */
@Slf4j
public class ServiceStatusTracker {

    private final Clock clock;

    // Guarded by this
    private LocalDate day;
    private long requestsToday;
    private long failedRequestsToday;
    private Instant lastSuccessfulRequest;

    public ServiceStatusTracker(Clock clock) {
        this.clock = clock;
        this.day = today();
    }

    public synchronized void recordSuccess() {
        rollOver();
        requestsToday++;
        lastSuccessfulRequest = clock.instant();
    }

    public synchronized void recordFailure() {
        rollOver();
        requestsToday++;
        failedRequestsToday++;
    }

    public synchronized long getRequestsToday() {
        rollOver();
        return requestsToday;
    }

    public synchronized long getFailedRequestsToday() {
        rollOver();
        return failedRequestsToday;
    }

    public synchronized Instant getLastSuccessfulRequest() {
        return lastSuccessfulRequest;
    }

    private void rollOver() {
        LocalDate now = today();
        if (!now.equals(day)) {
            log.info("Backend usage for {}: {} requests, {} failed", day, requestsToday, failedRequestsToday);
            day = now;
            requestsToday = 0;
            failedRequestsToday = 0;
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
