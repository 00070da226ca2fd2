package com.scanhub.pairing.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanhub.pairing.config.PairingHubProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Verifies HS256 bearer credentials ({@code header.payload.signature}, base64url) and
 * extracts the {@code login} claim. An {@code exp} claim, when present, is honoured.
 */
@Component
@Slf4j
public class IdentityTokenVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String LOGIN_CLAIM = "login";
    private static final String EXPIRY_CLAIM = "exp";
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};

    private final byte[] secret;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public IdentityTokenVerifier(PairingHubProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, Clock.systemUTC());
    }

    IdentityTokenVerifier(PairingHubProperties properties, ObjectMapper objectMapper, Clock clock) {
        String configured = properties.getIdentity().getTokenSecret();
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException("scanhub.pairing.identity.token-secret must be set");
        }
        this.secret = configured.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param token the bearer credential
     * @return the login the credential was issued for, or empty if it is invalid or expired
     */
    public Optional<String> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String[] parts = token.trim().split("\\.");
        if (parts.length != 3) {
            log.debug("IDENTITY: Malformed token ({} segments)", parts.length);
            return Optional.empty();
        }
        try {
            Map<String, Object> header = decodeJson(parts[0]);
            if (!"HS256".equals(header.get("alg"))) {
                log.debug("IDENTITY: Unsupported token algorithm {}", header.get("alg"));
                return Optional.empty();
            }

            byte[] expected = sign(parts[0] + "." + parts[1]);
            byte[] actual = Base64.getUrlDecoder().decode(parts[2]);
            if (!MessageDigest.isEqual(expected, actual)) {
                log.debug("IDENTITY: Token signature mismatch");
                return Optional.empty();
            }

            Map<String, Object> claims = decodeJson(parts[1]);
            Object exp = claims.get(EXPIRY_CLAIM);
            if (exp instanceof Number
                    && Instant.ofEpochSecond(((Number) exp).longValue()).isBefore(clock.instant())) {
                log.debug("IDENTITY: Token expired");
                return Optional.empty();
            }

            Object login = claims.get(LOGIN_CLAIM);
            if (login instanceof String && !((String) login).isBlank()) {
                return Optional.of((String) login);
            }
            return Optional.empty();

        } catch (Exception e) {
            log.debug("IDENTITY: Token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Create a credential for a login. {@code expiresAt} may be null for a credential
     * without expiry.
     */
    public String issue(String login, Instant expiresAt) {
        try {
            Map<String, Object> claims = new LinkedHashMap<>();
            claims.put(LOGIN_CLAIM, login);
            if (expiresAt != null) {
                claims.put(EXPIRY_CLAIM, expiresAt.getEpochSecond());
            }
            String header = encodeJson(Map.of("alg", "HS256", "typ", "JWT"));
            String payload = encodeJson(claims);
            String signature = Base64.getUrlEncoder().withoutPadding().encodeToString(sign(header + "." + payload));
            return header + "." + payload + "." + signature;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to issue token for " + login, e);
        }
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private byte[] sign(String signingInput) throws Exception {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(secret, ALGORITHM));
        return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
    }

    private Map<String, Object> decodeJson(String segment) throws Exception {
        byte[] json = Base64.getUrlDecoder().decode(segment);
        return objectMapper.readValue(json, CLAIMS_TYPE);
    }

    private String encodeJson(Map<String, Object> value) throws Exception {
        byte[] json = objectMapper.writeValueAsBytes(value);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
    }
}
