package com.usatiuk.ringmesh.peers;

import org.apache.commons.lang3.Validate;

import java.io.Serializable;

/**
 * Transport-level handle of one physical connection attempt.
 * Not stable across reconnects, the same device may show up under several endpoints over time.
 *
 * @param value the handle assigned by the transport
 */
public record EndpointId(String value) implements Serializable {
    public EndpointId {
        Validate.notBlank(value, "Endpoint id must not be blank");
    }

    public static EndpointId of(String value) {
        return new EndpointId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
