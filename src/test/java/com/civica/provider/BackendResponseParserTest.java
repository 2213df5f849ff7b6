package com.civica.provider;

import com.civica.config.JacksonConfiguration;
import com.civica.model.AnalysisResult;
import com.civica.model.PredictedBehavior;
import com.civica.model.RequestType;
import com.civica.model.ResultSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackendResponseParser.
 */
class BackendResponseParserTest {

    private BackendResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new BackendResponseParser(JacksonConfiguration.create());
    }

    @Test
    void testParsesAnalysisObject() {
        String reply = """
                {"parties":[{"party":"GL","confidence":0.7,"reasoning":"climate"},
                            {"party":"D66","confidence":0.5}],
                 "predicted_behavior":"likely",
                 "influence_factors":["climate","housing"],
                 "confidence":0.8,
                 "reasoning_depth":0.6,
                 "summary":"Progressive urban voter"}""";

        AnalysisResult result = parser.parse(RequestType.PARTY_RECOMMENDATION, reply);

        assertEquals(RequestType.PARTY_RECOMMENDATION, result.getRequestType());
        assertEquals(2, result.getPartyRecommendations().size());
        assertEquals("GL", result.getPartyRecommendations().get(0).getPartyId());
        assertEquals(0.7, result.getPartyRecommendations().get(0).getConfidence());
        assertEquals(PredictedBehavior.LIKELY, result.getPredictedBehavior());
        assertEquals(List.of("climate", "housing"), result.getInfluenceFactors());
        assertEquals(0.8, result.getConfidence());
        assertEquals(0.6, result.getReasoningDepth());
        assertEquals("Progressive urban voter", result.getText());
        assertEquals(ResultSource.BACKEND, result.getSource());
    }

    @Test
    void testToleratesCodeFencesAndProse() {
        String reply = "Here is the analysis:\n```json\n{\"confidence\": 0.4, \"predicted_behavior\": \"ABSTAIN\"}\n```";

        AnalysisResult result = parser.parse(RequestType.VOTING_PREDICTION, reply);

        assertEquals(0.4, result.getConfidence());
        assertEquals(PredictedBehavior.ABSTAIN, result.getPredictedBehavior());
    }

    @Test
    void testDefaultsAndClamping() {
        AnalysisResult result = parser.parse(RequestType.GENERAL_ANALYSIS,
                "{\"predicted_behavior\":\"MAYBE\",\"parties\":[{\"party\":\"SP\",\"confidence\":3}]}");

        assertEquals(PredictedBehavior.POSSIBLE, result.getPredictedBehavior());
        assertEquals(BackendResponseParser.DEFAULT_CONFIDENCE, result.getConfidence());
        assertEquals(1.0, result.getPartyRecommendations().get(0).getConfidence());
    }

    @Test
    void testAnalysisWithoutJsonIsMalformed() {
        assertThrows(MalformedResponseException.class,
                () -> parser.parse(RequestType.GENERAL_ANALYSIS, "I cannot help with that."));
        assertThrows(MalformedResponseException.class,
                () -> parser.parse(RequestType.GENERAL_ANALYSIS, "{\"confidence\": 0.5,"));
        assertThrows(MalformedResponseException.class,
                () -> parser.parse(RequestType.GENERAL_ANALYSIS, null));
    }

    @Test
    void testGenerationTakesTrimmedText() {
        AnalysisResult result = parser.parse(RequestType.REACTION_GENERATION, "  Eindelijk iets aan de woningnood!  ");

        assertEquals("Eindelijk iets aan de woningnood!", result.getText());
        assertTrue(result.getPartyRecommendations().isEmpty());
    }

    @Test
    void testBlankGenerationIsMalformed() {
        assertThrows(MalformedResponseException.class, () -> parser.parse(RequestType.REACTION_GENERATION, "   "));
    }
}
