package com.civica.provider;

import com.civica.model.AnalysisResult;
import com.civica.model.PartyRecommendation;
import com.civica.model.PredictedBehavior;
import com.civica.model.RequestType;
import com.civica.model.ResultSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the model's reply into an {@link AnalysisResult}.
 *
 * Analysis replies must carry one JSON object (markdown code fences and leading
 * prose are tolerated). Generation replies must carry non-blank text.
 */
@Slf4j
public class BackendResponseParser {

    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double GENERATION_CONFIDENCE = 0.8;

    private final ObjectMapper objectMapper;

    public BackendResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MalformedResponseException if the content is missing or unusable
     */
    public AnalysisResult parse(RequestType type, String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedResponseException("Backend reply has no content");
        }
        return type.isGeneration() ? parseGeneration(type, content) : parseAnalysis(type, content);
    }

    private AnalysisResult parseGeneration(RequestType type, String content) {
        return AnalysisResult.builder()
                .requestType(type)
                .text(content.trim())
                .confidence(GENERATION_CONFIDENCE)
                .source(ResultSource.BACKEND)
                .build();
    }

    private AnalysisResult parseAnalysis(RequestType type, String content) {
        JsonNode root = readObject(content);

        List<PartyRecommendation> parties = new ArrayList<>();
        for (JsonNode party : root.path("parties")) {
            String id = party.path("party").asText(null);
            if (id == null || id.isBlank()) {
                continue;
            }
            parties.add(PartyRecommendation.builder()
                    .partyId(id)
                    .confidence(clamp(party.path("confidence").asDouble(DEFAULT_CONFIDENCE)))
                    .reasoning(party.path("reasoning").asText(null))
                    .build());
        }

        List<String> factors = new ArrayList<>();
        for (JsonNode factor : root.path("influence_factors")) {
            if (factor.isTextual() && !factor.asText().isBlank()) {
                factors.add(factor.asText());
            }
        }

        return AnalysisResult.builder()
                .requestType(type)
                .partyRecommendations(parties)
                .predictedBehavior(parseBehavior(root.path("predicted_behavior").asText(null)))
                .influenceFactors(factors)
                .confidence(clamp(root.path("confidence").asDouble(DEFAULT_CONFIDENCE)))
                .reasoningDepth(clamp(root.path("reasoning_depth").asDouble(0.0)))
                .text(root.path("summary").asText(null))
                .source(ResultSource.BACKEND)
                .build();
    }

    private JsonNode readObject(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MalformedResponseException("Backend reply contains no JSON object");
        }
        try {
            JsonNode node = objectMapper.readTree(content.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new MalformedResponseException("Backend reply is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Backend reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static PredictedBehavior parseBehavior(String value) {
        if (value == null || value.isBlank()) {
            return PredictedBehavior.POSSIBLE;
        }
        try {
            return PredictedBehavior.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown predicted behavior '{}', using POSSIBLE", value);
            return PredictedBehavior.POSSIBLE;
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
