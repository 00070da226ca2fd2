package com.scanhub.pairing.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.scanhub.pairing.adapter.LegacySink;
import com.scanhub.pairing.service.LegacyReconciliationWorker;
import com.scanhub.pairing.session.SessionRegistry;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for legacy reconciliation.
 *
 * Reports UP when the legacy system answers its connection test, DOWN otherwise.
 * Reconciliation keeps running while DOWN; failed saves are recorded as FAILURE.
 */
@Component
@RequiredArgsConstructor
public class ReconciliationHealthIndicator implements HealthIndicator {

    private final LegacySink legacySink;
    private final LegacyReconciliationWorker reconciliationWorker;
    private final SessionRegistry sessionRegistry;

    @Override
    public Health health() {
        LegacySink.ConnectionTestResult test = legacySink.testConnection();

        Health.Builder builder = test.success() ? Health.up() : Health.down();
        builder.withDetail("legacy-mode", legacySink.getMode())
                .withDetail("reconciliation-in-flight", reconciliationWorker.inFlightCount())
                .withDetail("active-identities", sessionRegistry.size());

        if (test.success()) {
            builder.withDetail("legacy-response-ms", test.responseTimeMs());
        } else {
            builder.withDetail("legacy-error", String.valueOf(test.message()));
        }
        return builder.build();
    }
}
