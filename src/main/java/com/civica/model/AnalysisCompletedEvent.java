package com.civica.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Published after a backend dispatch produced a result.
 */
@Value
public class AnalysisCompletedEvent {

    /**
     * Prompt content sent for the cluster's representative.
     */
    String content;

    AnalysisResult result;

    Duration processingTime;

    Instant completedAt;
}
