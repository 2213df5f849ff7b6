package com.civica.provider;

import com.civica.config.CivicaProperties;
import com.civica.model.ActorSnapshot;
import com.civica.model.ChatCompletionRequest;
import com.civica.model.Message;
import com.civica.model.RequestType;

import java.util.List;
import java.util.Locale;

/**
 * Turns a cluster's representative profile into the backend chat request.
 */
public class PromptBuilder {

    static final String ANALYSIS_SYSTEM_PROMPT = """
            You are an expert analyst of Dutch politics. Analyze voters in the context of:
            - Dutch political parties (VVD, PVV, CDA, D66, SP, PvdA, GL, CU, SGP, DENK, FvD, Volt, etc.)
            - Dutch political issues (immigration, housing, climate, healthcare, economy)
            - Dutch political spectrum and coalition dynamics
            - Regional differences within the Netherlands

            Reply with a single JSON object and nothing else:
            {"parties":[{"party":"<id>","confidence":<0..1>,"reasoning":"<short>"}],
             "predicted_behavior":"UNLIKELY|POSSIBLE|LIKELY|CERTAIN|ABSTAIN",
             "influence_factors":["<factor>"],
             "confidence":<0..1>,
             "reasoning_depth":<0..1>,
             "summary":"<one sentence>"}""";

    static final String GENERATION_SYSTEM_PROMPT =
            "Generate a realistic, short social media reaction of a Dutch voter to political content, "
                    + "written in the first person and consistent with the voter's demographics and views. "
                    + "Reply with the reaction text only.";

    private final CivicaProperties.BackendConfig config;

    public PromptBuilder(CivicaProperties.BackendConfig config) {
        this.config = config;
    }

    public ChatCompletionRequest build(ActorSnapshot representative, RequestType type, String subject) {
        boolean generation = type.isGeneration();
        return ChatCompletionRequest.builder()
                .model(config.getModel())
                .messages(List.of(
                        Message.system(generation ? GENERATION_SYSTEM_PROMPT : ANALYSIS_SYSTEM_PROMPT),
                        Message.user(summarize(representative, type, subject))))
                .maxTokens(generation ? config.getGenerationMaxTokens() : config.getAnalysisMaxTokens())
                .temperature(generation ? config.getGenerationTemperature() : config.getAnalysisTemperature())
                .build();
    }

    /**
     * User message for a request. Also serves as the offline generator's key and
     * as the content of completion events.
     */
    public String summarize(ActorSnapshot profile, RequestType type, String subject) {
        StringBuilder text = new StringBuilder();
        text.append("Task: ").append(describe(type)).append('\n');
        text.append(String.format(Locale.ROOT,
                "Voter profile: age %d, education level %d/5, income bracket %d/9, region %s\n",
                profile.getAge(),
                profile.getEducationLevel(),
                profile.getIncomeBracket(),
                profile.getRegion() == null ? "unknown" : profile.getRegion()));
        text.append(String.format(Locale.ROOT,
                "Opinions (-1..1): economic %.2f, social %.2f, environmental %.2f\n",
                profile.getOpinion().getEconomic(),
                profile.getOpinion().getSocial(),
                profile.getOpinion().getEnvironmental()));
        text.append(String.format(Locale.ROOT,
                "Behavior (0..1): satisfaction %.2f, engagement %.2f, volatility %.2f",
                profile.getBehavior().getSatisfaction(),
                profile.getBehavior().getEngagement(),
                profile.getBehavior().getVolatility()));
        if (subject != null && !subject.isBlank()) {
            text.append("\nPolitical content: ").append(subject.trim());
        }
        return text.toString();
    }

    private static String describe(RequestType type) {
        return switch (type) {
            case GENERAL_ANALYSIS -> "general political analysis of this voter";
            case PARTY_RECOMMENDATION -> "recommend the parties this voter is most likely to support";
            case VOTING_PREDICTION -> "predict whether this voter will vote";
            case ISSUE_ANALYSIS -> "identify the issues that matter most to this voter";
            case INFLUENCE_ANALYSIS -> "identify what influences this voter's opinions";
            case BEHAVIOR_PREDICTION -> "predict how this voter's behavior will change";
            case REACTION_GENERATION -> "write this voter's reaction to the political content";
        };
    }
}
