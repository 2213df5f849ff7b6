package com.civica.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Minimal view of a simulated voter, captured at enqueue time.
 * The simulation keeps mutating its own state; a snapshot never changes.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class ActorSnapshot {

    /**
     * Simulation-side identifier. Not part of any cache key.
     */
    long actorId;

    int age;

    /**
     * Education level on a 1-5 scale, 5 being university.
     */
    int educationLevel;

    /**
     * Income bracket (0-9, deciles).
     */
    int incomeBracket;

    /**
     * Province or region label, may be null.
     */
    String region;

    @NonNull
    OpinionVector opinion;

    @NonNull
    BehaviorVector behavior;

    public static final int UNIVERSITY_EDUCATION = 5;

    public boolean isUniversityEducated() {
        return educationLevel >= UNIVERSITY_EDUCATION;
    }
}
