package com.scanhub.pairing.identity;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanhub.pairing.config.PairingHubProperties;

class IdentityTokenVerifierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private PairingHubProperties properties;
    private IdentityTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new PairingHubProperties();
        properties.getIdentity().setTokenSecret("unit-test-secret");
        verifier = new IdentityTokenVerifier(properties, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should extract the login from a valid credential")
    void testValidToken() {
        String token = verifier.issue("alice", NOW.plusSeconds(3600));

        assertEquals(Optional.of("alice"), verifier.verify(token));
    }

    @Test
    @DisplayName("Should accept a credential without expiry")
    void testNoExpiry() {
        assertEquals(Optional.of("alice"), verifier.verify(verifier.issue("alice", null)));
    }

    @Test
    @DisplayName("Should reject an expired credential")
    void testExpired() {
        String token = verifier.issue("alice", NOW.minusSeconds(1));

        assertTrue(verifier.verify(token).isEmpty());
    }

    @Test
    @DisplayName("Should reject a credential signed with another secret")
    void testWrongSecret() {
        PairingHubProperties other = new PairingHubProperties();
        other.getIdentity().setTokenSecret("another-secret");
        String token = new IdentityTokenVerifier(other, new ObjectMapper()).issue("alice", null);

        assertTrue(verifier.verify(token).isEmpty());
    }

    @Test
    @DisplayName("Should reject a credential whose payload was altered")
    void testTamperedPayload() {
        String[] parts = verifier.issue("alice", null).split("\\.");
        String forged = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"login\":\"mallory\"}".getBytes(StandardCharsets.UTF_8));

        assertTrue(verifier.verify(parts[0] + "." + forged + "." + parts[2]).isEmpty());
    }

    @Test
    @DisplayName("Should reject a credential declaring another algorithm")
    void testAlgorithmNone() {
        String[] parts = verifier.issue("alice", null).split("\\.");
        String header = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));

        assertTrue(verifier.verify(header + "." + parts[1] + "." + parts[2]).isEmpty());
    }

    @Test
    @DisplayName("Should reject malformed credentials")
    void testMalformed() {
        assertTrue(verifier.verify(null).isEmpty());
        assertTrue(verifier.verify("   ").isEmpty());
        assertTrue(verifier.verify("not-a-token").isEmpty());
        assertTrue(verifier.verify("a.b.c").isEmpty());
    }

    @Test
    @DisplayName("Should refuse to start without a secret")
    void testMissingSecret() {
        properties.getIdentity().setTokenSecret(" ");

        assertThrows(IllegalStateException.class, () -> new IdentityTokenVerifier(properties, new ObjectMapper()));
    }
}
