package com.civica.service.offline;

import com.civica.config.CivicaProperties;
import com.civica.model.ActorSnapshot;
import com.civica.model.AnalysisResult;
import com.civica.model.BehaviorVector;
import com.civica.model.Party;
import com.civica.model.PredictedBehavior;
import com.civica.model.RequestType;
import com.civica.model.ResultSource;
import com.civica.support.Actors;
import com.civica.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OfflineAnalysisService.
 */
class OfflineAnalysisServiceTest {

    private OfflineAnalysisService offlineAnalysis;

    @BeforeEach
    void setUp() {
        OfflineResponseGenerator generator = new OfflineResponseGenerator(new CivicaProperties.OfflineConfig(),
                MutableClock.startingAt("2024-05-01T12:00:00Z"), new Random(3));
        offlineAnalysis = new OfflineAnalysisService(generator);
    }

    @Test
    void testRecommendsClosestParties() {
        Party gl = Party.GL;
        ActorSnapshot voter = Actors.voter(1, 30, 5,
                gl.getPosition().getEconomic(), gl.getPosition().getSocial(), gl.getPosition().getEnvironmental());

        AnalysisResult result = offlineAnalysis.analyze(voter, RequestType.PARTY_RECOMMENDATION, "summary");

        assertEquals(3, result.getPartyRecommendations().size());
        assertEquals("GL", result.getPartyRecommendations().get(0).getPartyId());
        assertEquals(OfflineAnalysisService.MAX_CONFIDENCE, result.getPartyRecommendations().get(0).getConfidence(), 1e-9);
        assertEquals(ResultSource.OFFLINE_FALLBACK, result.getSource());
        assertNotNull(result.getText());
    }

    @Test
    void testConfidenceStaysLow() {
        ActorSnapshot calm = Actors.withBehavior(Actors.voter(1, 30, 3), 0.5, 0.5, 0.0);

        AnalysisResult result = offlineAnalysis.analyze(calm, RequestType.GENERAL_ANALYSIS, "summary");

        assertTrue(result.getConfidence() <= OfflineAnalysisService.MAX_CONFIDENCE);
        result.getPartyRecommendations().forEach(p -> assertTrue(p.getConfidence() <= OfflineAnalysisService.MAX_CONFIDENCE));
    }

    @Test
    void testBehaviorFollowsEngagement() {
        assertEquals(PredictedBehavior.ABSTAIN, OfflineAnalysisService.predictBehavior(new BehaviorVector(0.5, 0.1, 0.5)));
        assertEquals(PredictedBehavior.UNLIKELY, OfflineAnalysisService.predictBehavior(new BehaviorVector(0.5, 0.3, 0.5)));
        assertEquals(PredictedBehavior.POSSIBLE, OfflineAnalysisService.predictBehavior(new BehaviorVector(0.5, 0.5, 0.5)));
        assertEquals(PredictedBehavior.LIKELY, OfflineAnalysisService.predictBehavior(new BehaviorVector(0.5, 0.7, 0.5)));
        assertEquals(PredictedBehavior.CERTAIN, OfflineAnalysisService.predictBehavior(new BehaviorVector(0.5, 0.9, 0.5)));
    }

    @Test
    void testInfluenceFactors() {
        ActorSnapshot strong = Actors.withBehavior(Actors.voter(1, 30, 3, 0.8, 0.1, -0.9), 0.1, 0.5, 0.5);

        assertEquals(List.of("economy", "climate and environment", "dissatisfaction with government"),
                OfflineAnalysisService.influenceFactors(strong));
        assertEquals(List.of("general political climate"),
                OfflineAnalysisService.influenceFactors(Actors.voter(2, 30, 3, 0.1, 0.1, 0.1)));
    }

    @Test
    void testGenerationFallbackCarriesTextOnly() {
        AnalysisResult result = offlineAnalysis.analyze(Actors.voter(1, 30, 3), RequestType.REACTION_GENERATION, "summary");

        assertNotNull(result.getText());
        assertFalse(result.getText().isBlank());
        assertTrue(result.getPartyRecommendations().isEmpty());
        assertNull(result.getPredictedBehavior());
    }
}
