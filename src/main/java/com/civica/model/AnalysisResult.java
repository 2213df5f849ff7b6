package com.civica.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result delivered to a request callback.
 *
 * Caches hold their own {@link #copy()} and hand out fresh copies, so a caller
 * may modify the result it receives.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {

    private RequestType requestType;

    @Builder.Default
    private List<PartyRecommendation> partyRecommendations = new ArrayList<>();

    private PredictedBehavior predictedBehavior;

    @Builder.Default
    private List<String> influenceFactors = new ArrayList<>();

    /**
     * Overall confidence (0.0-1.0).
     */
    private double confidence;

    private double reasoningDepth;

    /**
     * Generated reaction text (generation requests) or a short summary (analysis requests).
     */
    private String text;

    /**
     * Number of requests that shared the dispatch producing this result.
     */
    private int batchSize;

    private long processingTimeMs;

    private ResultSource source;

    /**
     * Deep copy: lists and party recommendations are copied, strings and enums shared.
     */
    public AnalysisResult copy() {
        return toBuilder()
                .partyRecommendations(partyRecommendations.stream()
                        .map(p -> p.toBuilder().build())
                        .collect(Collectors.toCollection(ArrayList::new)))
                .influenceFactors(new ArrayList<>(influenceFactors))
                .build();
    }
}
