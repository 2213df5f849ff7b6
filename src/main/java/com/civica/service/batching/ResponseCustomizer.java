package com.civica.service.batching;

import com.civica.model.ActorSnapshot;
import com.civica.model.AnalysisResult;
import com.civica.model.ResultSource;

import java.util.Random;

/**
 * Adapts a cluster's shared result to each member.
 *
 * Confidence is jittered by a factor in [0.95, 1.05), raised by 10% for
 * university-educated actors, lowered by 10% for volatile actors (volatility
 * above 0.7), then clamped to [0, 1]. Everything else is copied unchanged.
 */
public class ResponseCustomizer {

    static final double JITTER = 0.05;
    static final double UNIVERSITY_FACTOR = 1.1;
    static final double VOLATILE_FACTOR = 0.9;
    static final double VOLATILITY_CUTOFF = 0.7;

    private final Random random;

    public ResponseCustomizer(Random random) {
        this.random = random;
    }

    public AnalysisResult customize(AnalysisResult shared, ActorSnapshot member, int batchSize, ResultSource source) {
        AnalysisResult customized = shared.copy();

        double confidence = shared.getConfidence() * (1.0 - JITTER + random.nextDouble() * 2 * JITTER);
        if (member.isUniversityEducated()) {
            confidence *= UNIVERSITY_FACTOR;
        }
        if (member.getBehavior().getVolatility() > VOLATILITY_CUTOFF) {
            confidence *= VOLATILE_FACTOR;
        }

        customized.setConfidence(clamp(confidence));
        customized.setBatchSize(batchSize);
        customized.setSource(source);
        return customized;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
