package com.scanhub.pairing.session;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-recipient outcomes of one fan-out.
 */
public record DeliveryReport(String eventType, List<DeliveryOutcome> outcomes) {

    public DeliveryReport {
        outcomes = List.copyOf(outcomes);
    }

    public static DeliveryReport empty(String eventType) {
        return new DeliveryReport(eventType, List.of());
    }

    public int recipients() {
        return outcomes.size();
    }

    public long deliveredCount() {
        return outcomes.stream().filter(DeliveryOutcome::delivered).count();
    }

    public long failedCount() {
        return outcomes.size() - deliveredCount();
    }

    public DeliveryReport merge(DeliveryReport other) {
        List<DeliveryOutcome> merged = new ArrayList<>(outcomes);
        merged.addAll(other.outcomes());
        return new DeliveryReport(eventType, merged);
    }
}
