package com.civica.support;

import com.civica.model.ActorSnapshot;
import com.civica.model.RequestType;
import com.civica.service.batching.PendingRequest;

import java.time.Instant;

/**
 * PendingRequest factories shared by tests.
 */
public final class Requests {

    private Requests() {
    }

    public static PendingRequest pending(long sequence, ActorSnapshot snapshot, RequestType type, Instant enqueuedAt) {
        return pending(sequence, snapshot, type, null, enqueuedAt);
    }

    public static PendingRequest pending(long sequence, ActorSnapshot snapshot, RequestType type, String subject,
                                         Instant enqueuedAt) {
        return new PendingRequest(sequence, snapshot, type, subject, result -> { },
                enqueuedAt, "exact-" + sequence, "bucket-" + sequence);
    }
}
