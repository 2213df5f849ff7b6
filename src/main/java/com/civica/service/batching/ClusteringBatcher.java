package com.civica.service.batching;

import com.civica.config.CivicaProperties;
import com.civica.service.similarity.SimilarityMetrics;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Groups cache-miss requests into clusters of mutually similar requests.
 *
 * Algorithm (deterministic for a given input order and thresholds):
 * <ol>
 *   <li>Walk requests in arrival order; the first unconsumed request seeds a cluster</li>
 *   <li>Scan the rest and add every unconsumed request of the same type and subject
 *       that passes all similarity gates against the seed and every member already
 *       added, up to the cluster cap</li>
 *   <li>A request joins at most one cluster</li>
 *   <li>Clusters above the batch size are split into consecutive batches</li>
 * </ol>
 *
 * A whole cluster below the minimum batch size is held back for a later tick until
 * its oldest member has waited the batch timeout; split remainders always go out.
 */
@Slf4j
public class ClusteringBatcher {

    private final SimilarityMetrics similarity;
    private final int maxClusterSize;
    private final int maxBatchSize;
    private final int minBatchSize;
    private final Duration batchTimeout;
    private final Clock clock;

    public ClusteringBatcher(CivicaProperties.BatchingConfig config, SimilarityMetrics similarity, Clock clock) {
        this(similarity,
                config.getMaxClusterSize(),
                config.getMaxBatchSize(),
                config.getMinBatchSize(),
                config.getBatchTimeout(),
                clock);
    }

    public ClusteringBatcher(SimilarityMetrics similarity,
                             int maxClusterSize,
                             int maxBatchSize,
                             int minBatchSize,
                             Duration batchTimeout,
                             Clock clock) {
        if (maxClusterSize < 1 || maxBatchSize < 1 || minBatchSize < 1) {
            throw new IllegalArgumentException("Batch and cluster sizes must be positive");
        }
        if (minBatchSize > Math.min(maxClusterSize, maxBatchSize)) {
            throw new IllegalArgumentException("Minimum batch size " + minBatchSize
                    + " exceeds the largest possible cluster " + Math.min(maxClusterSize, maxBatchSize));
        }
        this.similarity = similarity;
        this.maxClusterSize = maxClusterSize;
        this.maxBatchSize = maxBatchSize;
        this.minBatchSize = minBatchSize;
        this.batchTimeout = batchTimeout;
        this.clock = clock;
    }

    /**
     * Greedy similarity partition followed by size splitting.
     *
     * @param requests requests in arrival order
     * @return groups in formation order; every request appears in exactly one group
     */
    public List<List<PendingRequest>> partition(List<PendingRequest> requests) {
        return formGroups(requests).stream().map(Group::getMembers).toList();
    }

    /**
     * Partition and decide which groups are dispatched now.
     *
     * @param requests drained requests in arrival order
     * @param force    dispatch undersized groups regardless of age
     */
    public Plan plan(List<PendingRequest> requests, boolean force) {
        Instant now = clock.instant();
        List<List<PendingRequest>> dispatch = new ArrayList<>();
        List<PendingRequest> deferred = new ArrayList<>();

        for (Group group : formGroups(requests)) {
            List<PendingRequest> members = group.getMembers();
            if (force || group.isSplit() || members.size() >= minBatchSize || hasTimedOut(members, now)) {
                dispatch.add(members);
            } else {
                deferred.addAll(members);
            }
        }

        // Deferred members go back in arrival order
        deferred.sort(Comparator.comparingLong(PendingRequest::getSequence));

        if (!requests.isEmpty()) {
            log.debug("Planned {} requests: {} groups to dispatch, {} requests deferred",
                    requests.size(), dispatch.size(), deferred.size());
        }
        return new Plan(dispatch, deferred);
    }

    private List<Group> formGroups(List<PendingRequest> requests) {
        List<Group> groups = new ArrayList<>();
        boolean[] consumed = new boolean[requests.size()];

        for (int i = 0; i < requests.size(); i++) {
            if (consumed[i]) {
                continue;
            }

            PendingRequest seed = requests.get(i);
            List<PendingRequest> cluster = new ArrayList<>();
            cluster.add(seed);
            consumed[i] = true;

            for (int j = i + 1; j < requests.size() && cluster.size() < maxClusterSize; j++) {
                if (consumed[j]) {
                    continue;
                }
                PendingRequest candidate = requests.get(j);
                if (joinsAll(cluster, candidate)) {
                    cluster.add(candidate);
                    consumed[j] = true;
                }
            }

            split(cluster, groups);
        }

        return groups;
    }

    private boolean joinsAll(List<PendingRequest> cluster, PendingRequest candidate) {
        for (PendingRequest member : cluster) {
            if (!canJoin(member, candidate)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Same type, same subject, and within every similarity threshold of each other.
     */
    boolean canJoin(PendingRequest member, PendingRequest candidate) {
        if (member.getRequestType() != candidate.getRequestType()) {
            return false;
        }
        if (!Objects.equals(member.getSubject(), candidate.getSubject())) {
            return false;
        }
        return similarity.areSimilar(member.getSnapshot(), candidate.getSnapshot());
    }

    private void split(List<PendingRequest> cluster, List<Group> out) {
        if (cluster.size() <= maxBatchSize) {
            out.add(new Group(cluster, false));
            return;
        }
        for (int from = 0; from < cluster.size(); from += maxBatchSize) {
            int to = Math.min(from + maxBatchSize, cluster.size());
            out.add(new Group(new ArrayList<>(cluster.subList(from, to)), true));
        }
        log.debug("Split cluster of {} into batches of at most {}", cluster.size(), maxBatchSize);
    }

    private boolean hasTimedOut(List<PendingRequest> group, Instant now) {
        Instant oldest = group.get(0).getEnqueuedAt();
        for (PendingRequest request : group) {
            if (request.getEnqueuedAt().isBefore(oldest)) {
                oldest = request.getEnqueuedAt();
            }
        }
        return Duration.between(oldest, now).compareTo(batchTimeout) >= 0;
    }

    public int getMinBatchSize() {
        return minBatchSize;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public int getMaxClusterSize() {
        return maxClusterSize;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    /**
     * Outcome of one planning pass.
     */
    @Value
    public static class Plan {
        /**
         * Groups to dispatch now, in formation order.
         */
        List<List<PendingRequest>> dispatch;

        /**
         * Requests to keep for the next tick, in arrival order.
         */
        List<PendingRequest> deferred;
    }

    @Value
    private static class Group {
        List<PendingRequest> members;
        boolean split;
    }
}
