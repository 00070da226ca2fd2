package com.scanhub.pairing.session;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.springframework.stereotype.Component;

import com.scanhub.pairing.model.dto.OutboundEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * Fans events out to dashboard connections.
 *
 * A failing recipient is logged and recorded in the returned report; it never stops
 * delivery to the others and never reaches the caller as an exception. A failed send
 * does not unregister the connection, the transport's close path does that.
 */
@Component
@Slf4j
public class Broadcaster {

    /**
     * Deliver to every output connection of one identity.
     */
    public DeliveryReport sendTo(IdentityContext context, OutboundEvent event) {
        return deliver(context.getLogin(), context.getOutputConnections(), event);
    }

    /**
     * Deliver to every output connection of one identity except {@code excluded}.
     */
    public DeliveryReport sendToOthers(IdentityContext context, ClientConnection excluded, OutboundEvent event) {
        List<ClientConnection> recipients = context.getOutputConnections().stream()
                .filter(connection -> connection != excluded)
                .toList();
        return deliver(context.getLogin(), recipients, event);
    }

    /**
     * Deliver to every output connection of each of the given identities.
     */
    public DeliveryReport sendToAll(Collection<IdentityContext> contexts, OutboundEvent event) {
        DeliveryReport report = DeliveryReport.empty(event.type());
        for (IdentityContext context : contexts) {
            report = report.merge(sendTo(context, event));
        }
        return report;
    }

    /**
     * Deliver to a single connection.
     */
    public DeliveryOutcome unicast(ClientConnection connection, OutboundEvent event) {
        try {
            connection.send(event);
            return DeliveryOutcome.delivered(connection.getId());
        } catch (Exception e) {
            log.warn("BROADCAST: Failed to deliver {} to connection {}: {}",
                    event.type(), connection.getId(), e.getMessage());
            return DeliveryOutcome.failed(connection.getId(), describe(e));
        }
    }

    private DeliveryReport deliver(String login, List<ClientConnection> recipients, OutboundEvent event) {
        List<DeliveryOutcome> outcomes = new ArrayList<>(recipients.size());
        for (ClientConnection connection : recipients) {
            outcomes.add(unicast(connection, event));
        }
        DeliveryReport report = new DeliveryReport(event.type(), outcomes);
        if (report.failedCount() > 0) {
            log.warn("BROADCAST: {} of {} deliveries of {} to {} failed",
                    report.failedCount(), report.recipients(), event.type(), login);
        } else {
            log.debug("BROADCAST: {} delivered to {} connection(s) of {}", event.type(), report.recipients(), login);
        }
        return report;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
