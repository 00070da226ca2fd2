package com.scanhub.pairing.service;

import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanhub.pairing.config.PairingHubProperties;
import com.scanhub.pairing.exception.RegistrationRejectedException;
import com.scanhub.pairing.identity.IdentityMetadata;
import com.scanhub.pairing.identity.IdentityResolver;
import com.scanhub.pairing.identity.IdentityTokenVerifier;
import com.scanhub.pairing.model.dto.InboundMessageDTO;
import com.scanhub.pairing.model.enums.ConnectionRole;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates the first message of a connection and resolves who is connecting.
 *
 * Nothing is mutated here; the caller registers the connection only after
 * {@link #accept(String)} returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionHandshakeService {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final IdentityTokenVerifier tokenVerifier;
    private final IdentityResolver identityResolver;
    private final PairingHubProperties properties;

    /**
     * Accepted register message.
     */
    public record AcceptedRegistration(IdentityMetadata identity, ConnectionRole role) {

        public String login() {
            return identity.login();
        }
    }

    /**
     * @param payload raw text of the first message
     * @return the resolved identity and requested role
     * @throws RegistrationRejectedException if the message is not an acceptable register message
     */
    public AcceptedRegistration accept(String payload) {
        InboundMessageDTO message = parse(payload);

        Set<ConstraintViolation<InboundMessageDTO>> violations = validator.validate(message);
        if (!violations.isEmpty()) {
            throw new RegistrationRejectedException(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .collect(Collectors.joining(", ")));
        }

        if (!InboundMessageDTO.REGISTER.equals(message.getEvent())) {
            throw new RegistrationRejectedException("first message must be register, got " + message.getEvent());
        }

        String login = resolveLogin(message);
        IdentityMetadata identity = identityResolver.resolve(login)
                .orElseThrow(() -> new RegistrationRejectedException("unknown identity " + login));

        ConnectionRole role = message.requestedRole();
        log.info("HANDSHAKE: Accepted {} as {}", identity.login(), role);
        return new AcceptedRegistration(identity, role);
    }

    private InboundMessageDTO parse(String payload) {
        try {
            InboundMessageDTO message = objectMapper.readValue(payload, InboundMessageDTO.class);
            if (message == null) {
                throw new RegistrationRejectedException("empty message");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new RegistrationRejectedException("malformed message", e);
        }
    }

    private String resolveLogin(InboundMessageDTO message) {
        if (message.getToken() != null && !message.getToken().isBlank()) {
            return tokenVerifier.verify(message.getToken())
                    .orElseThrow(() -> new RegistrationRejectedException("invalid credential"));
        }
        if (!properties.getIdentity().isAllowBareLogin()) {
            throw new RegistrationRejectedException("credential required");
        }
        if (message.getLogin() == null || message.getLogin().isBlank()) {
            throw new RegistrationRejectedException("login or token required");
        }
        return message.getLogin().trim();
    }
}
