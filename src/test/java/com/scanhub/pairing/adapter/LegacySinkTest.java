package com.scanhub.pairing.adapter;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LegacySinkTest {

    @Test
    @DisplayName("Should report a saved pair as successful without a message")
    void testSaved() {
        LegacySink.SaveResult result = LegacySink.SaveResult.saved();

        assertTrue(result.success());
        assertNull(result.message());
    }

    @Test
    @DisplayName("Should carry the rejection message of a failed save")
    void testFailure() {
        LegacySink.SaveResult result = LegacySink.SaveResult.failure("platform locked");

        assertFalse(result.success());
        assertEquals("platform locked", result.message());
    }

    @Test
    @DisplayName("Should report a reachable legacy system with its response time")
    void testConnectionSuccess() {
        LegacySink.ConnectionTestResult result = LegacySink.ConnectionTestResult.success("ok", 12L);

        assertTrue(result.success());
        assertEquals(12L, result.responseTimeMs());
    }
}
