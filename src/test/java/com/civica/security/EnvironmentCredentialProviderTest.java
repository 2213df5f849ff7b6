package com.civica.security;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EnvironmentCredentialProvider.
 */
class EnvironmentCredentialProviderTest {

    @Test
    void testReadsPropertyByName() {
        MockEnvironment environment = new MockEnvironment().withProperty("nvidia_nim_api_key", " nvapi-123 ");

        assertEquals(Optional.of("nvapi-123"), new EnvironmentCredentialProvider(environment).getSecret("nvidia_nim_api_key"));
    }

    @Test
    void testFallsBackToUpperCaseName() {
        MockEnvironment environment = new MockEnvironment().withProperty("NVIDIA_NIM_API_KEY", "nvapi-456");

        assertEquals(Optional.of("nvapi-456"), new EnvironmentCredentialProvider(environment).getSecret("nvidia_nim_api_key"));
    }

    @Test
    void testBlankOrMissingIsAbsent() {
        MockEnvironment environment = new MockEnvironment().withProperty("nvidia_nim_api_key", "  ");
        EnvironmentCredentialProvider provider = new EnvironmentCredentialProvider(environment);

        assertTrue(provider.getSecret("nvidia_nim_api_key").isEmpty());
        assertTrue(provider.getSecret("other").isEmpty());
        assertTrue(provider.getSecret(null).isEmpty());
    }
}
