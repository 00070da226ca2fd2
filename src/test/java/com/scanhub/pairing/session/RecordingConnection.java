package com.scanhub.pairing.session;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.scanhub.pairing.model.dto.OutboundEvent;

/**
 * Connection that keeps every event sent to it. Can be switched to fail every send.
 */
public class RecordingConnection implements ClientConnection {

    private final String id;
    private final List<OutboundEvent> received = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public RecordingConnection(String id) {
        this.id = id;
    }

    public static RecordingConnection failing(String id) {
        RecordingConnection connection = new RecordingConnection(id);
        connection.failing = true;
        return connection;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void send(OutboundEvent event) throws IOException {
        if (failing) {
            throw new IOException("broken pipe");
        }
        received.add(event);
    }

    @Override
    public boolean isOpen() {
        return !failing;
    }

    public List<OutboundEvent> received() {
        return List.copyOf(received);
    }

    public List<String> receivedTypes() {
        return received.stream().map(OutboundEvent::type).toList();
    }

    public long count(String type) {
        return received.stream().filter(event -> event.type().equals(type)).count();
    }

    public void clear() {
        received.clear();
    }

    @Override
    public String toString() {
        return "RecordingConnection[" + id + "]";
    }
}
