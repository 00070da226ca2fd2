package com.scanhub.pairing.model.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event pushed to a connection, serialized as {@code {"type": ..., "data": {...}}}.
 */
public record OutboundEvent(String type, Map<String, Object> data) {

    public static final String REGISTER_SUCCESS = "register_success";
    public static final String PRODUCER_CONNECTED = "producer_connected";
    public static final String PRODUCER_DISCONNECTED = "producer_disconnected";
    public static final String PLATFORM_CHANGED = "platform_changed";
    public static final String NEW_PAIRING = "new_pairing";
    public static final String PRODUCT_MOVED = "product_moved";

    public OutboundEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static OutboundEvent registerSuccess(IdentitySnapshotDTO snapshot) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("login", snapshot.getLogin());
        data.put("id", snapshot.getId());
        data.put("fullname", snapshot.getFullName());
        data.put("input_count", snapshot.getInputCount());
        data.put("output_count", snapshot.getOutputCount());
        data.put("current_platform", snapshot.getCurrentPlatform());
        data.put("input_ids", snapshot.getInputIds());
        data.put("output_ids", snapshot.getOutputIds());
        return new OutboundEvent(REGISTER_SUCCESS, data);
    }

    public static OutboundEvent producerConnected() {
        return new OutboundEvent(PRODUCER_CONNECTED, Map.of());
    }

    public static OutboundEvent producerDisconnected() {
        return new OutboundEvent(PRODUCER_DISCONNECTED, Map.of());
    }

    public static OutboundEvent platformChanged(int platform) {
        return new OutboundEvent(PLATFORM_CHANGED, Map.of("platform", platform));
    }

    public static OutboundEvent newPairing(int platform, long product, long recordId, boolean overwrite) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("platform", platform);
        data.put("product", Map.of("id", product));
        data.put("recordId", recordId);
        data.put("overwrite", overwrite);
        return new OutboundEvent(NEW_PAIRING, data);
    }

    public static OutboundEvent productMoved(long product, int fromPlatform, int toPlatform) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("product", product);
        data.put("from", fromPlatform);
        data.put("to", toPlatform);
        return new OutboundEvent(PRODUCT_MOVED, data);
    }
}
