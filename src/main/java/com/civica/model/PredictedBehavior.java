package com.civica.model;

/**
 * Predicted voting behavior categories.
 */
public enum PredictedBehavior {
    UNLIKELY,
    POSSIBLE,
    LIKELY,
    CERTAIN,
    ABSTAIN
}
