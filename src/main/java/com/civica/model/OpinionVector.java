package com.civica.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Political spectrum position of an actor. Every axis is in [-1.0, 1.0].
 */
@Value
@Builder
@AllArgsConstructor
public class OpinionVector {

    /**
     * Left (-1) to right (+1).
     */
    double economic;

    /**
     * Conservative (-1) to progressive (+1).
     */
    double social;

    /**
     * Skeptical (-1) to activist (+1).
     */
    double environmental;
}
