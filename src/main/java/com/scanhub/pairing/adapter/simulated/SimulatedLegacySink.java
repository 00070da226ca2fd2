package com.scanhub.pairing.adapter.simulated;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.scanhub.pairing.adapter.LegacySink;
import com.scanhub.pairing.config.PairingHubProperties;
import com.scanhub.pairing.config.PairingHubProperties.LegacyConfig;
import com.scanhub.pairing.config.PairingHubProperties.LegacyMode;
import com.scanhub.pairing.exception.LegacySinkException;

import lombok.extern.slf4j.Slf4j;

/**
 * Stand-in for the legacy system used in standalone mode.
 *
 * Every save waits a random time between the configured bounds and is rejected with the
 * configured probability.
 */
@Component
@ConditionalOnProperty(prefix = "scanhub.pairing.legacy", name = "mode", havingValue = "SIMULATED", matchIfMissing = true)
@Slf4j
public class SimulatedLegacySink implements LegacySink {

    private final Duration minDelay;
    private final Duration maxDelay;
    private final double failureRate;

    public SimulatedLegacySink(PairingHubProperties properties) {
        LegacyConfig config = properties.getLegacy();
        this.minDelay = config.getSimulatedMinDelay() != null ? config.getSimulatedMinDelay() : Duration.ZERO;
        this.maxDelay = config.getSimulatedMaxDelay() != null && config.getSimulatedMaxDelay().compareTo(minDelay) > 0
                ? config.getSimulatedMaxDelay() : minDelay;
        this.failureRate = Math.max(0.0, Math.min(1.0, config.getSimulatedFailureRate()));
        log.info("LEGACY: Simulated legacy system active (delay {}..{}, failure rate {})",
                minDelay, maxDelay, failureRate);
    }

    @Override
    public LegacyMode getMode() {
        return LegacyMode.SIMULATED;
    }

    @Override
    public SaveResult attemptSave(int platform, long product) {
        log.info("LEGACY: Saving pair {}-{}", platform, product);

        pause(randomDelay());

        ThreadLocalRandom random = ThreadLocalRandom.current();
        if (random.nextDouble() < failureRate) {
            log.error("LEGACY: Save of pair {}-{} rejected", platform, product);
            return SaveResult.failure("Legacy system rejected pair " + platform + "-" + product);
        }

        log.info("LEGACY: Pair {}-{} saved", platform, product);
        return SaveResult.saved();
    }

    @Override
    public ConnectionTestResult testConnection() {
        return ConnectionTestResult.success("Simulated legacy system", 0);
    }

    private Duration randomDelay() {
        long min = minDelay.toMillis();
        long max = maxDelay.toMillis();
        if (max <= min) {
            return minDelay;
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(min, max + 1));
    }

    private static void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LegacySinkException("Interrupted while waiting for the legacy system", e);
        }
    }
}
