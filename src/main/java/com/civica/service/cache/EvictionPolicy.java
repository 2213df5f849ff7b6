package com.civica.service.cache;

/**
 * Which entry a full cache gives up on insertion.
 */
public enum EvictionPolicy {

    /**
     * Entry with the oldest creation timestamp (first in, first out).
     */
    OLDEST,

    /**
     * Entry whose last lookup hit is oldest.
     */
    LEAST_RECENTLY_USED
}
