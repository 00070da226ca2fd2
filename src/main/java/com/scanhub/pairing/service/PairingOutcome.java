package com.scanhub.pairing.service;

import java.util.List;

import com.scanhub.pairing.session.DeliveryReport;

/**
 * What one {@code handleNewPairing} call did.
 *
 * @param applied          false when the identity was not registered and nothing happened
 * @param platformChanged  true when the identity's binding moved to {@code platform}
 * @param recordId         id of the committed record, null without a product
 * @param previousPlatform platform of the superseded record, null if there was none
 * @param moved            true when the product left another platform
 * @param deliveries       fan-out reports in emission order
 */
public record PairingOutcome(
        String login,
        int platform,
        Long product,
        boolean applied,
        boolean platformChanged,
        Long recordId,
        Integer previousPlatform,
        boolean moved,
        List<DeliveryReport> deliveries
) {
    public PairingOutcome {
        deliveries = List.copyOf(deliveries);
    }

    public static PairingOutcome ignored(String login, int platform, Long product) {
        return new PairingOutcome(login, platform, product, false, false, null, null, false, List.of());
    }

    public boolean overwrite() {
        return previousPlatform != null;
    }
}
