package com.usatiuk.ringmesh.peers;

/**
 * Immutable state of a known device.
 *
 * @param endpoint   the current transport endpoint of the device
 * @param name       the persistent name of the device
 * @param phase      the connection phase
 * @param retryCount failed connection attempts since the last successful one, kept per name
 * @param lastSeenAt the time of the last change of this entry, in milliseconds
 */
public record DeviceState(EndpointId endpoint, DeviceName name, ConnectionPhase phase,
                          int retryCount, long lastSeenAt) {
    public DeviceState withPhase(ConnectionPhase phase, long lastSeenAt) {
        return new DeviceState(endpoint, name, phase, retryCount, lastSeenAt);
    }

    public DeviceState withName(DeviceName name) {
        return new DeviceState(endpoint, name, phase, retryCount, lastSeenAt);
    }

    public DeviceState withRetryCount(int retryCount) {
        return new DeviceState(endpoint, name, phase, retryCount, lastSeenAt);
    }

    public DeviceState withLastSeenAt(long lastSeenAt) {
        return new DeviceState(endpoint, name, phase, retryCount, lastSeenAt);
    }

    public boolean isActive() {
        return phase.isActive();
    }

    @Override
    public String toString() {
        return name + " (" + endpoint + "): " + phase;
    }
}
