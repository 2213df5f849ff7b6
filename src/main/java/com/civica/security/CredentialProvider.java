package com.civica.security;

import java.util.Optional;

/**
 * Source of backend secrets. Queried on every dispatch attempt, so a key added
 * or removed at runtime takes effect on the next batch.
 */
public interface CredentialProvider {

    Optional<String> getSecret(String name);
}
