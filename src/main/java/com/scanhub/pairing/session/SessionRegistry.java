package com.scanhub.pairing.session;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanhub.pairing.identity.IdentityMetadata;
import com.scanhub.pairing.model.dto.IdentitySnapshotDTO;
import com.scanhub.pairing.model.dto.OutboundEvent;
import com.scanhub.pairing.model.enums.ConnectionRole;
import com.scanhub.pairing.store.PairingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the login -> {@link IdentityContext} mapping.
 *
 * A context exists exactly while it holds at least one connection. Creation, connection
 * list changes and removal of a login's context all happen inside the map's per-key
 * {@code compute}, so a context cannot be dropped while another connection of the same
 * login is being added. Events are sent after the map entry is released.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionRegistry {

    private final Map<String, IdentityContext> contexts = new ConcurrentHashMap<>();

    private final PairingStore store;
    private final Broadcaster broadcaster;
    private final ObjectMapper objectMapper;

    /**
     * Attach a connection to its identity, creating the context on first reference.
     *
     * A producer connection announces {@code producer_connected} to the identity's other
     * dashboards. A dashboard connection joining while a producer is present gets
     * {@code producer_connected} for itself only.
     *
     * A connection with role NONE is not attached; the returned snapshot then describes
     * the identity as it already was.
     *
     * @return snapshot of the identity after registration
     */
    public IdentitySnapshotDTO register(
            ClientConnection connection,
            String identityKey,
            ConnectionRole role,
            IdentityMetadata metadata) {

        if (role == ConnectionRole.NONE) {
            log.info("REGISTRY: Connection {} of {} registered without capabilities", connection.getId(), identityKey);
            return snapshot(identityKey).orElseGet(() -> emptySnapshot(identityKey, metadata));
        }

        // Looked up before compute when the context is missing. If it disappears between
        // the check and compute, the lookup runs inside compute instead.
        boolean hintLookedUp = !contexts.containsKey(identityKey);
        Integer prefetchedHint = hintLookedUp ? recoverPlatform(identityKey) : null;

        IdentityContext context = contexts.compute(identityKey, (key, existing) -> {
            IdentityContext ctx = existing;
            if (ctx == null) {
                Integer platformHint = hintLookedUp ? prefetchedHint : recoverPlatform(key);
                ctx = new IdentityContext(metadataFor(key, metadata), platformHint);
                log.info("REGISTRY: Context created for {}, recovered platform: {}", key, platformHint);
            }
            if (role.canWrite()) {
                ctx.addInput(connection);
            }
            if (role.canRead()) {
                ctx.addOutput(connection);
            }
            return ctx;
        });

        if (role.canWrite() && context.hasInput()) {
            broadcaster.sendToOthers(context, connection, OutboundEvent.producerConnected());
        }
        if (role.canRead() && context.hasInput()) {
            broadcaster.unicast(connection, OutboundEvent.producerConnected());
        }

        logState();
        return context.toSnapshot();
    }

    /**
     * Detach a connection. Removing the last producer announces
     * {@code producer_disconnected}; removing the last connection destroys the context.
     */
    public void unregister(ClientConnection connection, String identityKey, ConnectionRole role) {
        AtomicBoolean lastInputRemoved = new AtomicBoolean(false);
        AtomicReference<IdentityContext> remaining = new AtomicReference<>();

        contexts.computeIfPresent(identityKey, (key, ctx) -> {
            if (role.canWrite() && ctx.removeInput(connection) && !ctx.hasInput()) {
                lastInputRemoved.set(true);
            }
            if (role.canRead()) {
                ctx.removeOutput(connection);
            }
            if (ctx.isEmpty()) {
                log.info("REGISTRY: Context destroyed for {}", key);
                return null;
            }
            remaining.set(ctx);
            return ctx;
        });

        IdentityContext context = remaining.get();
        if (lastInputRemoved.get() && context != null) {
            broadcaster.sendTo(context, OutboundEvent.producerDisconnected());
        }
        log.debug("REGISTRY: Connection {} of {} unregistered", connection.getId(), identityKey);
    }

    public Optional<IdentityContext> lookup(String identityKey) {
        return Optional.ofNullable(contexts.get(identityKey));
    }

    /**
     * Every context currently bound to the platform, possibly none.
     */
    public List<IdentityContext> contextsBoundTo(int platform) {
        return contexts.values().stream()
                .filter(context -> context.isBoundTo(platform))
                .toList();
    }

    public Optional<IdentitySnapshotDTO> snapshot(String identityKey) {
        return lookup(identityKey).map(IdentityContext::toSnapshot);
    }

    public List<IdentitySnapshotDTO> snapshots() {
        return contexts.values().stream()
                .map(IdentityContext::toSnapshot)
                .sorted(Comparator.comparing(IdentitySnapshotDTO::getLogin))
                .toList();
    }

    public int size() {
        return contexts.size();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private Integer recoverPlatform(String identityKey) {
        try {
            return store.findLatestPlatformForIdentity(identityKey).orElse(null);
        } catch (RuntimeException e) {
            log.warn("REGISTRY: Could not recover platform for {}: {}", identityKey, e.getMessage());
            return null;
        }
    }

    private static IdentityMetadata metadataFor(String key, IdentityMetadata metadata) {
        return metadata != null ? metadata : IdentityMetadata.ofLogin(key);
    }

    private static IdentitySnapshotDTO emptySnapshot(String identityKey, IdentityMetadata metadata) {
        IdentityMetadata resolved = metadataFor(identityKey, metadata);
        return IdentitySnapshotDTO.builder()
                .login(identityKey)
                .id(resolved.id())
                .fullName(resolved.fullName())
                .build();
    }

    private void logState() {
        if (!log.isDebugEnabled()) {
            return;
        }
        try {
            log.debug("REGISTRY: Users state: {}", objectMapper.writeValueAsString(snapshots()));
        } catch (JsonProcessingException e) {
            log.warn("REGISTRY: Could not serialize users state: {}", e.getMessage());
        }
    }
}
