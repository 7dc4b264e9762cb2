package com.usatiuk.ringmesh.peers;

import org.apache.commons.lang3.Validate;

import java.io.Serializable;

/**
 * Stable identity of a device, chosen once per installation.
 * Names are totally ordered by their string value, which is the order of the ring overlay.
 *
 * @param value the name
 */
public record DeviceName(String value) implements Serializable, Comparable<DeviceName> {
    public DeviceName {
        Validate.notBlank(value, "Device name must not be blank");
    }

    public static DeviceName of(String value) {
        return new DeviceName(value);
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public int compareTo(DeviceName o) {
        return value.compareTo(o.value);
    }
}
