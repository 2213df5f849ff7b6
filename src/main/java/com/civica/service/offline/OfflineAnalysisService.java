package com.civica.service.offline;

import com.civica.model.ActorSnapshot;
import com.civica.model.AnalysisResult;
import com.civica.model.BehaviorVector;
import com.civica.model.OpinionVector;
import com.civica.model.Party;
import com.civica.model.PartyRecommendation;
import com.civica.model.PredictedBehavior;
import com.civica.model.RequestType;
import com.civica.model.ResultSource;
import com.civica.service.similarity.SimilarityMetrics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based analysis for when the backend is unavailable or a batch failed.
 *
 * Recommends the parties closest to the profile's opinions, derives behavior
 * from engagement, and keeps confidence at or below {@link #MAX_CONFIDENCE}.
 */
public class OfflineAnalysisService {

    static final double MAX_CONFIDENCE = 0.5;
    static final int RECOMMENDED_PARTIES = 3;
    static final double STRONG_OPINION = 0.5;
    static final double LOW_SATISFACTION = 0.3;

    private final OfflineResponseGenerator generator;

    public OfflineAnalysisService(OfflineResponseGenerator generator) {
        this.generator = generator;
    }

    public AnalysisResult analyze(ActorSnapshot profile, RequestType type, String summary) {
        String text = generator.generate(summary, type.getContentTypeHint());
        double confidence = MAX_CONFIDENCE - 0.2 * profile.getBehavior().getVolatility();

        AnalysisResult.AnalysisResultBuilder result = AnalysisResult.builder()
                .requestType(type)
                .text(text)
                .confidence(clamp(confidence))
                .reasoningDepth(0.2)
                .source(ResultSource.OFFLINE_FALLBACK);

        if (type.isGeneration()) {
            return result.build();
        }
        return result
                .partyRecommendations(recommendParties(profile.getOpinion()))
                .predictedBehavior(predictBehavior(profile.getBehavior()))
                .influenceFactors(influenceFactors(profile))
                .build();
    }

    public OfflineResponseGenerator getGenerator() {
        return generator;
    }

    static List<PartyRecommendation> recommendParties(OpinionVector opinion) {
        List<PartyRecommendation> recommendations = new ArrayList<>();
        Arrays.stream(Party.values())
                .sorted(Comparator.comparingDouble(p -> SimilarityMetrics.opinionDistance(opinion, p.getPosition())))
                .limit(RECOMMENDED_PARTIES)
                .forEach(party -> {
                    double distance = SimilarityMetrics.opinionDistance(opinion, party.getPosition());
                    recommendations.add(PartyRecommendation.builder()
                            .partyId(party.getDisplayName())
                            .confidence(clamp((1.0 - distance) * MAX_CONFIDENCE))
                            .reasoning(String.format(Locale.ROOT,
                                    "Closest party position on the opinion axes (distance %.2f)", distance))
                            .build());
                });
        return recommendations;
    }

    static PredictedBehavior predictBehavior(BehaviorVector behavior) {
        double engagement = behavior.getEngagement();
        if (engagement < 0.2) {
            return PredictedBehavior.ABSTAIN;
        }
        if (engagement < 0.4) {
            return PredictedBehavior.UNLIKELY;
        }
        if (engagement < 0.6) {
            return PredictedBehavior.POSSIBLE;
        }
        if (engagement < 0.8) {
            return PredictedBehavior.LIKELY;
        }
        return PredictedBehavior.CERTAIN;
    }

    static List<String> influenceFactors(ActorSnapshot profile) {
        List<String> factors = new ArrayList<>();
        OpinionVector opinion = profile.getOpinion();
        if (Math.abs(opinion.getEconomic()) >= STRONG_OPINION) {
            factors.add("economy");
        }
        if (Math.abs(opinion.getSocial()) >= STRONG_OPINION) {
            factors.add("social issues");
        }
        if (Math.abs(opinion.getEnvironmental()) >= STRONG_OPINION) {
            factors.add("climate and environment");
        }
        if (profile.getBehavior().getSatisfaction() < LOW_SATISFACTION) {
            factors.add("dissatisfaction with government");
        }
        if (factors.isEmpty()) {
            factors.add("general political climate");
        }
        return factors;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(MAX_CONFIDENCE, value));
    }
}
