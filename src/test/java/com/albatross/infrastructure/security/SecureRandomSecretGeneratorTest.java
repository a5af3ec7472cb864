package com.albatross.infrastructure.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SecureRandomSecretGenerator")
class SecureRandomSecretGeneratorTest {

    private final SecureRandomSecretGenerator generator = new SecureRandomSecretGenerator();

    @Test
    @DisplayName("Should produce distinct alphanumeric secrets")
    void shouldGenerateSecrets() {
        String first = generator.newSecret();
        String second = generator.newSecret();

        assertEquals(32, first.length());
        assertTrue(first.matches("[A-Za-z0-9]+"));
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("Should digest deterministically to hex SHA-256")
    void shouldDigest() {
        assertEquals(
            "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            generator.digest("abc"));
    }
}
