package com.usatiuk.ringmesh.strategy;

import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.EndpointId;

/**
 * A policy deciding which peers to connect to and which connections to drop.
 * <p>
 * The lifecycle callbacks are invoked after the {@link com.usatiuk.ringmesh.peers.MeshStateStore}
 * has been updated with the event.
 */
public interface ConnectionStrategy {
    void start();

    /**
     * Cancels every task of the strategy and forgets its pending attempts.
     * Nothing of the strategy touches the mesh state afterwards.
     */
    void stop();

    /**
     * Must answer with either accepting or rejecting the connection.
     */
    void onConnectionInitiated(EndpointId endpoint, DeviceName remoteName);

    /**
     * @return true if we requested the connection to this endpoint and its result is not known yet
     */
    boolean isDialing(EndpointId endpoint);

    void onConnectionResult(EndpointId endpoint, boolean success);

    void onDisconnected(EndpointId endpoint);
}
