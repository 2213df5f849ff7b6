package com.civica.service.batching;

import com.civica.model.ActorSnapshot;
import com.civica.model.AnalysisResult;
import com.civica.model.RequestType;
import com.civica.service.canonicalization.RequestKeyGenerator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One unit of work waiting for a result. Owned by the intake path until it is
 * answered from cache or absorbed into a cluster; its callback fires at most once.
 */
@Slf4j
@Getter
public class PendingRequest {

    private final long sequence;
    private final ActorSnapshot snapshot;
    private final RequestType requestType;
    private final String subject;
    private final Instant enqueuedAt;
    private final String exactKey;
    private final String bucketKey;

    @Getter(lombok.AccessLevel.NONE)
    private final Consumer<AnalysisResult> callback;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean completed = new AtomicBoolean(false);

    public PendingRequest(long sequence,
                          ActorSnapshot snapshot,
                          RequestType requestType,
                          String subject,
                          Consumer<AnalysisResult> callback,
                          Instant enqueuedAt,
                          String exactKey,
                          String bucketKey) {
        this.sequence = sequence;
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.requestType = Objects.requireNonNull(requestType, "requestType");
        this.subject = RequestKeyGenerator.normalizeSubject(subject);
        this.callback = callback;
        this.enqueuedAt = enqueuedAt;
        this.exactKey = exactKey;
        this.bucketKey = bucketKey;
    }

    /**
     * Deliver the result. Later calls are ignored; a throwing callback is logged
     * and does not reach the caller.
     *
     * @return true if this call delivered the result
     */
    public boolean complete(AnalysisResult result) {
        if (!completed.compareAndSet(false, true)) {
            log.debug("Request {} already completed, dropping duplicate delivery", sequence);
            return false;
        }
        if (callback == null) {
            return true;
        }
        try {
            callback.accept(result);
        } catch (RuntimeException e) {
            log.warn("Result callback for actor {} failed: {}", snapshot.getActorId(), e.getMessage(), e);
        }
        return true;
    }

    public boolean isCompleted() {
        return completed.get();
    }
}
