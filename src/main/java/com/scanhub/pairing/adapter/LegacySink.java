package com.scanhub.pairing.adapter;

import com.scanhub.pairing.config.PairingHubProperties.LegacyMode;

/**
 * The legacy system of record that every committed pairing is propagated to.
 *
 * Calls may take arbitrarily long and may fail; callers run them off the interactive path.
 */
public interface LegacySink {

    /**
     * Which implementation this is.
     */
    LegacyMode getMode();

    /**
     * Save a platform/product pairing in the legacy system.
     *
     * @param platform platform id
     * @param product  product id
     * @return success, or failure with a diagnostic message
     * @throws RuntimeException if the legacy system could not be reached at all
     */
    SaveResult attemptSave(int platform, long product);

    /**
     * Test the connection to the legacy system.
     */
    ConnectionTestResult testConnection();

    // ========================================================================
    // RESULT TYPES
    // ========================================================================

    /**
     * Result of a save.
     */
    record SaveResult(boolean success, String message) {

        public static SaveResult saved() {
            return new SaveResult(true, null);
        }

        public static SaveResult failure(String message) {
            return new SaveResult(false, message);
        }
    }

    /**
     * Result of a connection test.
     */
    record ConnectionTestResult(
            boolean success,
            String message,
            long responseTimeMs
    ) {
        public static ConnectionTestResult success(String message, long responseTime) {
            return new ConnectionTestResult(true, message, responseTime);
        }

        public static ConnectionTestResult failure(String message) {
            return new ConnectionTestResult(false, message, 0);
        }
    }
}
