package com.civica.service.batching;

import com.civica.model.ActorSnapshot;
import com.civica.model.BehaviorVector;
import com.civica.model.OpinionVector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Synthesizes the single actor profile sent to the backend on behalf of a cluster.
 * Numeric fields are averaged; categorical fields take the most frequent value,
 * ties going to the value seen first in arrival order.
 */
public final class RepresentativeBuilder {

    /**
     * Actor id carried by synthesized profiles.
     */
    public static final long REPRESENTATIVE_ACTOR_ID = -1L;

    private RepresentativeBuilder() {
    }

    public static ActorSnapshot build(List<PendingRequest> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a representative for an empty cluster");
        }
        if (members.size() == 1) {
            return members.get(0).getSnapshot();
        }

        List<ActorSnapshot> snapshots = members.stream().map(PendingRequest::getSnapshot).toList();

        OpinionVector opinion = OpinionVector.builder()
                .economic(mean(snapshots, s -> s.getOpinion().getEconomic()))
                .social(mean(snapshots, s -> s.getOpinion().getSocial()))
                .environmental(mean(snapshots, s -> s.getOpinion().getEnvironmental()))
                .build();

        BehaviorVector behavior = BehaviorVector.builder()
                .satisfaction(mean(snapshots, s -> s.getBehavior().getSatisfaction()))
                .engagement(mean(snapshots, s -> s.getBehavior().getEngagement()))
                .volatility(mean(snapshots, s -> s.getBehavior().getVolatility()))
                .build();

        return ActorSnapshot.builder()
                .actorId(REPRESENTATIVE_ACTOR_ID)
                .age((int) Math.round(mean(snapshots, ActorSnapshot::getAge)))
                .educationLevel(mode(snapshots, ActorSnapshot::getEducationLevel))
                .incomeBracket(mode(snapshots, ActorSnapshot::getIncomeBracket))
                .region(mode(snapshots, ActorSnapshot::getRegion))
                .opinion(opinion)
                .behavior(behavior)
                .build();
    }

    static double mean(List<ActorSnapshot> snapshots, ToDoubleFunction<ActorSnapshot> field) {
        return snapshots.stream().mapToDouble(field).average().orElse(0.0);
    }

    /**
     * Most frequent non-null value; null only when every value is null.
     */
    static <T> T mode(List<ActorSnapshot> snapshots, Function<ActorSnapshot, T> field) {
        Map<T, Integer> counts = new LinkedHashMap<>();
        for (ActorSnapshot snapshot : snapshots) {
            T value = field.apply(snapshot);
            if (value != null) {
                counts.merge(value, 1, Integer::sum);
            }
        }

        T best = null;
        int bestCount = 0;
        // Strictly greater keeps the earliest value on ties
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
