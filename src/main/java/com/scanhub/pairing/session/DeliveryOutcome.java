package com.scanhub.pairing.session;

/**
 * Result of delivering one event to one connection.
 */
public record DeliveryOutcome(String connectionId, boolean delivered, String error) {

    public static DeliveryOutcome delivered(String connectionId) {
        return new DeliveryOutcome(connectionId, true, null);
    }

    public static DeliveryOutcome failed(String connectionId, String error) {
        return new DeliveryOutcome(connectionId, false, error);
    }
}
