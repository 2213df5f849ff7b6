package com.civica.service.batching;

import com.civica.model.ActorSnapshot;
import com.civica.model.AnalysisResult;
import com.civica.model.RequestType;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Requests sharing one representative dispatch. Lives from the batch tick that
 * formed it until every member callback has fired.
 */
@Getter
public class RequestCluster {

    private final String id;
    private final List<PendingRequest> members;
    private final ActorSnapshot representative;
    private final RequestType requestType;
    private final String subject;
    private final Instant createdAt;

    private volatile ClusterStatus status = ClusterStatus.PENDING;
    private volatile Instant completedAt;
    private volatile AnalysisResult result;

    public RequestCluster(List<PendingRequest> members, ActorSnapshot representative, Instant createdAt) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one member");
        }
        this.id = UUID.randomUUID().toString();
        this.members = List.copyOf(members);
        this.representative = representative;
        this.requestType = members.get(0).getRequestType();
        this.subject = members.get(0).getSubject();
        this.createdAt = createdAt;
    }

    public int size() {
        return members.size();
    }

    public synchronized void markProcessing() {
        requireStatus(ClusterStatus.PENDING);
        status = ClusterStatus.PROCESSING;
    }

    public synchronized void markCompleted(AnalysisResult representativeResult, Instant now) {
        requireStatus(ClusterStatus.PROCESSING);
        this.result = representativeResult;
        this.completedAt = now;
        this.status = ClusterStatus.COMPLETED;
    }

    public synchronized void markFailed(AnalysisResult fallbackResult, Instant now) {
        requireStatus(ClusterStatus.PROCESSING);
        this.result = fallbackResult;
        this.completedAt = now;
        this.status = ClusterStatus.FAILED;
    }

    public boolean isFinished() {
        ClusterStatus s = status;
        return s == ClusterStatus.COMPLETED || s == ClusterStatus.FAILED;
    }

    private void requireStatus(ClusterStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Cluster " + id + " is " + status + ", expected " + expected);
        }
    }
}
