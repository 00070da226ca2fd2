package com.scanhub.pairing.session;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

import com.scanhub.pairing.identity.IdentityMetadata;
import com.scanhub.pairing.model.dto.IdentitySnapshotDTO;

/**
 * Per-identity session state: the scanner (input) and dashboard (output) connections of
 * one login plus the platform that login is currently bound to.
 *
 * Connection lists are only mutated by {@link SessionRegistry} while it holds the map
 * entry for this login.
 */
public class IdentityContext {

    private final String login;
    private final Long id;
    private final String fullName;
    private final List<ClientConnection> inputConnections = new CopyOnWriteArrayList<>();
    private final List<ClientConnection> outputConnections = new CopyOnWriteArrayList<>();
    private final ReentrantLock pairingLock = new ReentrantLock();
    private volatile Integer currentPlatform;

    IdentityContext(IdentityMetadata metadata, Integer initialPlatform) {
        this.login = metadata.login();
        this.id = metadata.id();
        this.fullName = metadata.fullName();
        this.currentPlatform = initialPlatform;
    }

    public String getLogin() {
        return login;
    }

    public Long getId() {
        return id;
    }

    public String getFullName() {
        return fullName;
    }

    public Integer getCurrentPlatform() {
        return currentPlatform;
    }

    public void setCurrentPlatform(Integer currentPlatform) {
        this.currentPlatform = currentPlatform;
    }

    public boolean isBoundTo(int platform) {
        Integer bound = currentPlatform;
        return bound != null && bound == platform;
    }

    /**
     * Serializes pairing commits issued by this identity.
     */
    public ReentrantLock getPairingLock() {
        return pairingLock;
    }

    public List<ClientConnection> getInputConnections() {
        return List.copyOf(inputConnections);
    }

    public List<ClientConnection> getOutputConnections() {
        return List.copyOf(outputConnections);
    }

    public boolean hasInput() {
        return !inputConnections.isEmpty();
    }

    public boolean isEmpty() {
        return inputConnections.isEmpty() && outputConnections.isEmpty();
    }

    void addInput(ClientConnection connection) {
        inputConnections.add(connection);
    }

    void addOutput(ClientConnection connection) {
        outputConnections.add(connection);
    }

    boolean removeInput(ClientConnection connection) {
        return inputConnections.remove(connection);
    }

    boolean removeOutput(ClientConnection connection) {
        return outputConnections.remove(connection);
    }

    public IdentitySnapshotDTO toSnapshot() {
        List<ClientConnection> inputs = getInputConnections();
        List<ClientConnection> outputs = getOutputConnections();
        return IdentitySnapshotDTO.builder()
                .login(login)
                .id(id)
                .fullName(fullName)
                .inputCount(inputs.size())
                .outputCount(outputs.size())
                .currentPlatform(currentPlatform)
                .inputIds(inputs.stream().map(ClientConnection::getId).toList())
                .outputIds(outputs.stream().map(ClientConnection::getId).toList())
                .build();
    }
}
