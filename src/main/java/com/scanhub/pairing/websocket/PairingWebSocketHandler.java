package com.scanhub.pairing.websocket;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanhub.pairing.config.PairingHubProperties;
import com.scanhub.pairing.exception.PairingCommitException;
import com.scanhub.pairing.exception.RegistrationRejectedException;
import com.scanhub.pairing.model.dto.IdentitySnapshotDTO;
import com.scanhub.pairing.model.dto.InboundMessageDTO;
import com.scanhub.pairing.model.dto.OutboundEvent;
import com.scanhub.pairing.model.enums.ConnectionRole;
import com.scanhub.pairing.service.ConnectionHandshakeService;
import com.scanhub.pairing.service.ConnectionHandshakeService.AcceptedRegistration;
import com.scanhub.pairing.service.PairingCoordinator;
import com.scanhub.pairing.session.SessionRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * WebSocket endpoint for scanners and dashboards.
 *
 * The first text frame must be a register message; anything else closes the session
 * with 1008 (policy violation) before any state is touched. Once registered, the session
 * receives a snapshot of its identity and may send new_pairing messages (scanners only).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PairingWebSocketHandler extends TextWebSocketHandler {

    static final String REGISTRATION_ATTRIBUTE = "scanhub.registration";

    private final ConnectionHandshakeService handshakeService;
    private final SessionRegistry registry;
    private final PairingCoordinator coordinator;
    private final ObjectMapper objectMapper;
    private final PairingHubProperties properties;

    /**
     * Registration bound to a session.
     */
    record BoundConnection(String login, ConnectionRole role, WebSocketClientConnection connection) {}

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.debug("WS: Session {} opened from {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        BoundConnection bound = (BoundConnection) session.getAttributes().get(REGISTRATION_ATTRIBUTE);
        if (bound == null) {
            register(session, message.getPayload());
            return;
        }

        InboundMessageDTO inbound;
        try {
            inbound = objectMapper.readValue(message.getPayload(), InboundMessageDTO.class);
        } catch (JsonProcessingException e) {
            log.warn("WS: Unreadable message from {} on session {}: {}", bound.login(), session.getId(), e.getOriginalMessage());
            return;
        }
        if (inbound == null || !InboundMessageDTO.NEW_PAIRING.equals(inbound.getEvent())) {
            log.debug("WS: Ignoring event {} from {}", inbound != null ? inbound.getEvent() : null, bound.login());
            return;
        }
        handlePairing(bound, inbound);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WS: Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        BoundConnection bound = (BoundConnection) session.getAttributes().remove(REGISTRATION_ATTRIBUTE);
        if (bound == null) {
            log.debug("WS: Unregistered session {} closed ({})", session.getId(), status);
            return;
        }
        log.info("WS: Disconnect: {} ({}, session {}, {})", bound.login(), bound.role(), session.getId(), status);
        registry.unregister(bound.connection(), bound.login(), bound.role());
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void register(WebSocketSession session, String payload) throws Exception {
        AcceptedRegistration accepted;
        try {
            accepted = handshakeService.accept(payload);
        } catch (RegistrationRejectedException e) {
            log.warn("WS: Session {} rejected: {}", session.getId(), e.getMessage());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        PairingHubProperties.WebSocketConfig config = properties.getWebsocket();
        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                session, config.getSendTimeLimitMs(), config.getSendBufferSizeBytes());
        WebSocketClientConnection connection = new WebSocketClientConnection(concurrentSession, objectMapper);

        session.getAttributes().put(REGISTRATION_ATTRIBUTE,
                new BoundConnection(accepted.login(), accepted.role(), connection));

        IdentitySnapshotDTO snapshot = registry.register(connection, accepted.login(), accepted.role(), accepted.identity());
        connection.send(OutboundEvent.registerSuccess(snapshot));
    }

    private void handlePairing(BoundConnection bound, InboundMessageDTO inbound) {
        if (!bound.role().canWrite()) {
            log.warn("WS: new_pairing from non-producer connection of {} ignored", bound.login());
            return;
        }
        if (inbound.getPlatform() == null) {
            log.warn("WS: new_pairing without platform from {} ignored", bound.login());
            return;
        }
        try {
            coordinator.handleNewPairing(bound.login(), inbound.getPlatform(), inbound.getProduct());
        } catch (PairingCommitException e) {
            log.error("WS: Pairing from {} not applied: {}", bound.login(), e.getMessage());
        }
    }
}
