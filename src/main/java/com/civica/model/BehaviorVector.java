package com.civica.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Behavioral state of an actor. Every component is in [0.0, 1.0].
 */
@Value
@Builder
@AllArgsConstructor
public class BehaviorVector {

    /**
     * Satisfaction with the current government.
     */
    double satisfaction;

    /**
     * Political engagement.
     */
    double engagement;

    /**
     * How readily opinions change.
     */
    double volatility;
}
