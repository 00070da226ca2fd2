package com.scanhub.pairing.session;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.scanhub.pairing.identity.IdentityMetadata;
import com.scanhub.pairing.model.dto.OutboundEvent;

class BroadcasterTest {

    private Broadcaster broadcaster;
    private IdentityContext context;

    @BeforeEach
    void setUp() {
        broadcaster = new Broadcaster();
        context = new IdentityContext(IdentityMetadata.ofLogin("alice"), null);
    }

    @Test
    @DisplayName("Should deliver to healthy recipients when one of them fails")
    void testPartialFailure() {
        RecordingConnection first = new RecordingConnection("d1");
        RecordingConnection broken = RecordingConnection.failing("d2");
        RecordingConnection last = new RecordingConnection("d3");
        context.addOutput(first);
        context.addOutput(broken);
        context.addOutput(last);

        DeliveryReport report = broadcaster.sendTo(context, OutboundEvent.platformChanged(4));

        assertEquals(3, report.recipients());
        assertEquals(2, report.deliveredCount());
        assertEquals(1, report.failedCount());
        assertEquals(1, first.received().size());
        assertEquals(1, last.received().size());

        DeliveryOutcome failed = report.outcomes().get(1);
        assertEquals("d2", failed.connectionId());
        assertFalse(failed.delivered());
        assertEquals("broken pipe", failed.error());
    }

    @Test
    @DisplayName("Should skip the excluded connection")
    void testSendToOthers() {
        RecordingConnection self = new RecordingConnection("rw");
        RecordingConnection other = new RecordingConnection("d1");
        context.addOutput(self);
        context.addOutput(other);

        DeliveryReport report = broadcaster.sendToOthers(context, self, OutboundEvent.producerConnected());

        assertEquals(1, report.recipients());
        assertTrue(self.received().isEmpty());
        assertEquals(List.of(OutboundEvent.PRODUCER_CONNECTED), other.receivedTypes());
    }

    @Test
    @DisplayName("Should not deliver to scanner connections")
    void testInputsNotRecipients() {
        RecordingConnection scanner = new RecordingConnection("s1");
        context.addInput(scanner);

        DeliveryReport report = broadcaster.sendTo(context, OutboundEvent.producerDisconnected());

        assertEquals(0, report.recipients());
        assertTrue(scanner.received().isEmpty());
    }

    @Test
    @DisplayName("Should merge reports across identities")
    void testSendToAll() {
        IdentityContext other = new IdentityContext(IdentityMetadata.ofLogin("bob"), null);
        RecordingConnection aliceDashboard = new RecordingConnection("d1");
        RecordingConnection bobDashboard = new RecordingConnection("d2");
        context.addOutput(aliceDashboard);
        other.addOutput(bobDashboard);

        DeliveryReport report = broadcaster.sendToAll(List.of(context, other),
                OutboundEvent.newPairing(4, 100L, 1L, false));

        assertEquals(OutboundEvent.NEW_PAIRING, report.eventType());
        assertEquals(2, report.deliveredCount());
        assertEquals(1, aliceDashboard.received().size());
        assertEquals(1, bobDashboard.received().size());
    }

    @Test
    @DisplayName("Should report an empty fan-out for no identities")
    void testSendToNone() {
        DeliveryReport report = broadcaster.sendToAll(List.of(), OutboundEvent.platformChanged(1));

        assertEquals(0, report.recipients());
        assertEquals(0, report.failedCount());
    }
}
