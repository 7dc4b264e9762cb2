package com.usatiuk.ringmesh.transport;

import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.EndpointId;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;

/**
 * The point-to-point transport the mesh runs over.
 * Lifecycle and discovery events come back through a {@link TransportListener}.
 */
public interface Transport {
    /**
     * Dials a discovered endpoint.
     *
     * @param localName the name to present to the remote device
     * @param endpoint  the endpoint to dial
     * @return completes when the connection request was issued, fails with {@link AlreadyConnectedException}
     * if the endpoint is already connected, or with any other exception if the request failed
     */
    CompletableFuture<Void> requestConnection(DeviceName localName, EndpointId endpoint);

    void acceptConnection(EndpointId endpoint);

    void rejectConnection(EndpointId endpoint);

    void disconnectFromEndpoint(EndpointId endpoint);

    void startDiscovery();

    void stopDiscovery();

    void startAdvertising();

    /**
     * Stops discovery and advertising. Established connections are kept.
     */
    void stopAll();

    /**
     * Sends a payload to every connected endpoint.
     *
     * @param payload the bytes to send
     */
    void broadcast(byte[] payload);

    void sendPayload(Collection<EndpointId> endpoints, byte[] payload);
}
