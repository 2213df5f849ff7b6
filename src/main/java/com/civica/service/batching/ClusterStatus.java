package com.civica.service.batching;

/**
 * Cluster lifecycle: PENDING -> PROCESSING -> COMPLETED | FAILED.
 */
public enum ClusterStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
