package com.scanhub.pairing.session;

import java.io.IOException;

import com.scanhub.pairing.model.dto.OutboundEvent;

/**
 * A single bidirectional channel held by a scanner or a dashboard.
 */
public interface ClientConnection {

    /**
     * Stable id of the underlying channel.
     */
    String getId();

    /**
     * Deliver one event to the peer.
     *
     * @throws IOException if the channel refused or lost the message
     */
    void send(OutboundEvent event) throws IOException;

    boolean isOpen();
}
