package com.scanhub.pairing.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.scanhub.pairing.model.dto.OutboundEvent;
import com.scanhub.pairing.service.LegacyReconciliationWorker.ReconciliationTask;
import com.scanhub.pairing.session.Broadcaster;
import com.scanhub.pairing.session.DeliveryReport;
import com.scanhub.pairing.session.IdentityContext;
import com.scanhub.pairing.session.SessionRegistry;
import com.scanhub.pairing.store.PairingStore;
import com.scanhub.pairing.store.PairingStore.CommitResult;
import com.scanhub.pairing.store.PairingStore.NewPairing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the pairing commit protocol for messages sent by scanners.
 *
 * Order of effects for one call:
 * 1. rebind the identity to the platform and announce platform_changed to its dashboards
 * 2. supersede the product's previous record and insert the new one (one store unit)
 * 3. announce new_pairing to the new platform and, if the product came from another
 *    platform, product_moved to that one
 * 4. hand the record to the reconciliation worker without waiting for it
 *
 * Calls for the same identity are serialized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PairingCoordinator {

    private final SessionRegistry registry;
    private final Broadcaster broadcaster;
    private final PairingStore store;
    private final LegacyReconciliationWorker reconciliationWorker;

    /**
     * Handle a scanner's pairing message.
     *
     * @param login    identity that sent the message
     * @param platform platform the scanner is at
     * @param product  scanned product, or null when only the platform was scanned
     * @return what was done; nothing at all when {@code login} has no registered context
     * @throws com.scanhub.pairing.exception.PairingCommitException if the store could not commit
     */
    public PairingOutcome handleNewPairing(String login, int platform, Long product) {
        Optional<IdentityContext> found = registry.lookup(login);
        if (found.isEmpty()) {
            log.debug("PAIRING: No context for {}, pairing {}-{} ignored", login, platform, product);
            return PairingOutcome.ignored(login, platform, product);
        }

        IdentityContext context = found.get();
        context.getPairingLock().lock();
        try {
            List<DeliveryReport> deliveries = new ArrayList<>();

            boolean platformChanged = changePlatform(context, platform, deliveries);

            if (product == null) {
                return new PairingOutcome(login, platform, null, true, platformChanged,
                        null, null, false, deliveries);
            }

            CommitResult commit = store.commitPairing(new NewPairing(login, platform, product));
            Integer previousPlatform = commit.prior().map(PairingStore.PriorPairing::platform).orElse(null);
            boolean moved = previousPlatform != null && previousPlatform != platform;

            OutboundEvent newPairing = OutboundEvent.newPairing(platform, product, commit.recordId(), commit.overwrite());
            deliveries.add(sendToPlatform(platform, newPairing));
            if (moved) {
                deliveries.add(sendToPlatform(previousPlatform, OutboundEvent.productMoved(product, previousPlatform, platform)));
                log.info("PAIRING: Product {} moved from platform {} to {} by {}", product, previousPlatform, platform, login);
            } else {
                log.info("PAIRING: Product {} paired with platform {} by {} (record {}, overwrite={})",
                        product, platform, login, commit.recordId(), commit.overwrite());
            }

            reconciliationWorker.submit(new ReconciliationTask(commit.recordId(), platform, product));

            return new PairingOutcome(login, platform, product, true, platformChanged,
                    commit.recordId(), previousPlatform, moved, deliveries);
        } finally {
            context.getPairingLock().unlock();
        }
    }

    private boolean changePlatform(IdentityContext context, int platform, List<DeliveryReport> deliveries) {
        if (Objects.equals(context.getCurrentPlatform(), platform)) {
            return false;
        }
        Integer previous = context.getCurrentPlatform();
        context.setCurrentPlatform(platform);
        log.info("PAIRING: {} moved from platform {} to {}", context.getLogin(), previous, platform);
        deliveries.add(broadcaster.sendTo(context, OutboundEvent.platformChanged(platform)));
        return true;
    }

    private DeliveryReport sendToPlatform(int platform, OutboundEvent event) {
        return broadcaster.sendToAll(registry.contextsBoundTo(platform), event);
    }
}
