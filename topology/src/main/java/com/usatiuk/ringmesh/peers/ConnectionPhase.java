package com.usatiuk.ringmesh.peers;

/**
 * Connection state of a known device.
 */
public enum ConnectionPhase {
    DISCOVERED,
    CONNECTING,
    CONNECTED,
    ERROR,
    DISCONNECTED;

    /**
     * @return true if the device occupies a connection slot
     */
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED;
    }

    /**
     * A device that failed or dropped stays a potential peer until it is forgotten, so it can be dialed again.
     *
     * @return true if a device in this phase is a potential peer
     */
    public boolean isPotential() {
        return !isActive();
    }
}
