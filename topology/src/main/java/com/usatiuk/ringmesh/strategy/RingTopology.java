package com.usatiuk.ringmesh.strategy;

import com.usatiuk.ringmesh.peers.DeviceName;
import org.apache.commons.lang3.Validate;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The ring overlay as seen from one device: all known device names in lexicographic order, wrapping around.
 * <p>
 * Every device wants its successor, its predecessor and one opposite, a device far away on the ring.
 * Devices within {@value #MIN_OPPOSITE_DISTANCE} hops are never an opposite, so rings of up to five
 * devices have none.
 */
public final class RingTopology {
    static final int MIN_OPPOSITE_DISTANCE = 2;

    private final List<DeviceName> _ring;
    private final DeviceName _self;
    private final int _selfIndex;

    private RingTopology(List<DeviceName> ring, DeviceName self) {
        _ring = ring;
        _self = self;
        _selfIndex = ring.indexOf(self);
    }

    /**
     * @param names the known device names, duplicates are ignored, may or may not contain self
     * @param self  the local device
     * @return the ring
     */
    public static RingTopology of(Collection<DeviceName> names, DeviceName self) {
        var ring = Stream.concat(names.stream(), Stream.of(self)).distinct().sorted().toList();
        return new RingTopology(ring, self);
    }

    /**
     * @return the minimal hop count between two positions of a ring, in {@code [0, size / 2]}
     */
    public static int distance(int i, int j, int size) {
        Validate.isTrue(size > 0, "Ring must not be empty");
        var forward = Math.floorMod(j - i, size);
        var backward = Math.floorMod(i - j, size);
        return Math.min(forward, backward);
    }

    /**
     * Starts at the diametrically opposite position and walks forward past every position
     * that is too close to {@code index}.
     *
     * @return the index of the opposite, or empty if every other position is too close
     */
    public static OptionalInt oppositeIndex(int index, int size) {
        if (size <= 3) return OptionalInt.empty();
        var candidate = (index + size / 2) % size;
        while (distance(index, candidate, size) <= MIN_OPPOSITE_DISTANCE) {
            candidate = (candidate + 1) % size;
            if (candidate == index)
                return OptionalInt.empty();
        }
        return OptionalInt.of(candidate);
    }

    public List<DeviceName> ring() {
        return _ring;
    }

    public int size() {
        return _ring.size();
    }

    public DeviceName self() {
        return _self;
    }

    public int selfIndex() {
        return _selfIndex;
    }

    public DeviceName successor() {
        return _ring.get((_selfIndex + 1) % size());
    }

    public DeviceName predecessor() {
        return _ring.get((_selfIndex - 1 + size()) % size());
    }

    public Optional<DeviceName> opposite() {
        var index = oppositeIndex(_selfIndex, size());
        return index.isPresent() ? Optional.of(_ring.get(index.getAsInt())) : Optional.empty();
    }

    /**
     * @return the hop count from self to the device, or -1 if it is not on the ring
     */
    public int distanceTo(DeviceName name) {
        var index = _ring.indexOf(name);
        if (index < 0) return -1;
        return distance(_selfIndex, index, size());
    }

    /**
     * @return the devices actively dialed by us, the successor and the opposite if there is one
     */
    public Set<DeviceName> desired() {
        var desired = new HashSet<DeviceName>();
        if (size() > 1) desired.add(successor());
        opposite().ifPresent(desired::add);
        return desired;
    }

    /**
     * @return the devices whose connection is kept when pruning: successor, predecessor and opposite
     */
    public Set<DeviceName> important() {
        var important = desired();
        if (size() > 1) important.add(predecessor());
        return important;
    }

    /**
     * @return the same ring without the given device
     */
    public RingTopology without(DeviceName name) {
        Validate.isTrue(!name.equals(_self), "Cannot remove self from the ring");
        return new RingTopology(_ring.stream().filter(n -> !n.equals(name)).toList(), _self);
    }

    @Override
    public String toString() {
        return "Ring" + _ring + " self=" + _self;
    }
}
