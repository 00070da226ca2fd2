package com.scanhub.pairing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.scanhub.pairing.config.PairingHubProperties;

/**
 * Scanhub Pairing Hub.
 *
 * Scanners (producers) report which product now sits on which platform; operator
 * dashboards (consumers) are told about platform changes, new pairings and products
 * moved away from their platform. Every committed pairing is propagated to the legacy
 * system of record in the background.
 */
@SpringBootApplication
@EnableConfigurationProperties(PairingHubProperties.class)
public class PairingHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(PairingHubApplication.class, args);
    }
}
