package com.civica.model;

/**
 * Where a delivered result came from.
 */
public enum ResultSource {
    BACKEND,
    EXACT_CACHE,
    BUCKET_CACHE,
    OFFLINE_FALLBACK
}
