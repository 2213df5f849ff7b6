package com.civica.model;

/**
 * Kinds of work the simulation asks the backend for.
 *
 * Analysis types expect a structured reply; generation types expect free text
 * written from the actor's point of view. Requests of different types are
 * never clustered together.
 */
public enum RequestType {

    GENERAL_ANALYSIS(false, "analysis"),
    PARTY_RECOMMENDATION(false, "analysis"),
    VOTING_PREDICTION(false, "analysis"),
    ISSUE_ANALYSIS(false, "analysis"),
    INFLUENCE_ANALYSIS(false, "analysis"),
    BEHAVIOR_PREDICTION(false, "analysis"),

    /**
     * Short in-character reaction to a piece of political content.
     */
    REACTION_GENERATION(true, "opinion");

    private final boolean generation;
    private final String contentTypeHint;

    RequestType(boolean generation, String contentTypeHint) {
        this.generation = generation;
        this.contentTypeHint = contentTypeHint;
    }

    public boolean isGeneration() {
        return generation;
    }

    /**
     * Content type handed to the offline generator when this request falls back.
     */
    public String getContentTypeHint() {
        return contentTypeHint;
    }
}
