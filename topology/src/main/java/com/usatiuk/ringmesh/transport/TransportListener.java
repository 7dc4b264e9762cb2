package com.usatiuk.ringmesh.transport;

import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.EndpointId;

public interface TransportListener {
    void onEndpointFound(EndpointId endpoint, DeviceName name);

    void onEndpointLost(EndpointId endpoint);

    /**
     * A connection handshake started, either dialed by us or by the remote device.
     * The listener must answer with {@link Transport#acceptConnection} or {@link Transport#rejectConnection}.
     */
    void onConnectionInitiated(EndpointId endpoint, DeviceName remoteName);

    void onConnectionResult(EndpointId endpoint, ConnectionStatus status);

    void onDisconnected(EndpointId endpoint);

    void onPayloadReceived(EndpointId endpoint, byte[] payload);
}
