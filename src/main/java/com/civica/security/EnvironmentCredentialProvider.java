package com.civica.security;

import org.springframework.core.env.Environment;

import java.util.Locale;
import java.util.Optional;

/**
 * Looks a secret up as a Spring property first ({@code nvidia_nim_api_key}),
 * then as an upper-case environment variable ({@code NVIDIA_NIM_API_KEY}).
 * Blank values count as absent.
 */
public class EnvironmentCredentialProvider implements CredentialProvider {

    private final Environment environment;

    public EnvironmentCredentialProvider(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> getSecret(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String value = environment.getProperty(name);
        if (value == null || value.isBlank()) {
            value = environment.getProperty(name.toUpperCase(Locale.ROOT));
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
