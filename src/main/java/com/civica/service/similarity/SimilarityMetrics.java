package com.civica.service.similarity;

import com.civica.config.CivicaProperties;
import com.civica.model.ActorSnapshot;
import com.civica.model.BehaviorVector;
import com.civica.model.OpinionVector;

/**
 * Distance checks deciding whether two actors may share one backend dispatch.
 *
 * Three independent gates, all of which must pass:
 * <ol>
 *   <li>Opinion: Euclidean distance over the three axes, normalized to [0,1]</li>
 *   <li>Behavior: mean absolute difference of satisfaction, engagement, volatility</li>
 *   <li>Demographics: age within the configured gap and identical education level</li>
 * </ol>
 */
public class SimilarityMetrics {

    // Axes span [-1, 1], so the farthest two opinion vectors are 2 * sqrt(3) apart
    private static final double MAX_OPINION_DISTANCE = 2.0 * Math.sqrt(3.0);

    private final double opinionThreshold;
    private final double behaviorThreshold;
    private final int maxAgeDifference;

    public SimilarityMetrics(CivicaProperties.SimilarityConfig config) {
        this(config.getOpinionThreshold(), config.getBehaviorThreshold(), config.getMaxAgeDifference());
    }

    public SimilarityMetrics(double opinionThreshold, double behaviorThreshold, int maxAgeDifference) {
        this.opinionThreshold = opinionThreshold;
        this.behaviorThreshold = behaviorThreshold;
        this.maxAgeDifference = maxAgeDifference;
    }

    /**
     * Normalized opinion distance (0.0 identical, 1.0 opposite corners).
     */
    public static double opinionDistance(OpinionVector a, OpinionVector b) {
        double economic = a.getEconomic() - b.getEconomic();
        double social = a.getSocial() - b.getSocial();
        double environmental = a.getEnvironmental() - b.getEnvironmental();
        double euclidean = Math.sqrt(economic * economic + social * social + environmental * environmental);
        return Math.min(1.0, euclidean / MAX_OPINION_DISTANCE);
    }

    /**
     * Mean absolute difference of the behavior components.
     */
    public static double behaviorDistance(BehaviorVector a, BehaviorVector b) {
        return (Math.abs(a.getSatisfaction() - b.getSatisfaction())
                + Math.abs(a.getEngagement() - b.getEngagement())
                + Math.abs(a.getVolatility() - b.getVolatility())) / 3.0;
    }

    public boolean demographicsCompatible(ActorSnapshot a, ActorSnapshot b) {
        return Math.abs(a.getAge() - b.getAge()) <= maxAgeDifference
                && a.getEducationLevel() == b.getEducationLevel();
    }

    /**
     * All three gates pass. Request type is checked by the caller.
     */
    public boolean areSimilar(ActorSnapshot a, ActorSnapshot b) {
        if (opinionDistance(a.getOpinion(), b.getOpinion()) > opinionThreshold) {
            return false;
        }
        if (behaviorDistance(a.getBehavior(), b.getBehavior()) > behaviorThreshold) {
            return false;
        }
        return demographicsCompatible(a, b);
    }

    public double getOpinionThreshold() {
        return opinionThreshold;
    }

    public double getBehaviorThreshold() {
        return behaviorThreshold;
    }

    public int getMaxAgeDifference() {
        return maxAgeDifference;
    }
}
