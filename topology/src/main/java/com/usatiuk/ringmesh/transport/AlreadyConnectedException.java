package com.usatiuk.ringmesh.transport;

import com.usatiuk.ringmesh.peers.EndpointId;

/**
 * Both sides dialed each other and the transport already holds the connection.
 */
public class AlreadyConnectedException extends TransportException {
    private final EndpointId _endpoint;

    public AlreadyConnectedException(EndpointId endpoint) {
        super("Already connected to " + endpoint);
        _endpoint = endpoint;
    }

    public EndpointId getEndpoint() {
        return _endpoint;
    }
}
