package com.usatiuk.ringmesh.graph;

import com.usatiuk.ringmesh.peers.DeviceName;
import org.pcollections.HashTreePMap;
import org.pcollections.HashTreePSet;
import org.pcollections.PMap;
import org.pcollections.PSet;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Eventually consistent view of the mesh: for every device, the devices it is believed to be directly connected to.
 * Not necessarily accurate for any device at any instant.
 * <p>
 * {@link #merge(NetworkGraph)} is a per-device set union, so it is commutative, idempotent and never loses edges.
 *
 * @param adjacency device name to the names of its neighbors
 */
public record NetworkGraph(PMap<DeviceName, PSet<DeviceName>> adjacency) {
    private static final NetworkGraph EMPTY = new NetworkGraph(HashTreePMap.empty());

    public static NetworkGraph empty() {
        return EMPTY;
    }

    public static NetworkGraph of(Map<DeviceName, ? extends Collection<DeviceName>> adjacency) {
        PMap<DeviceName, PSet<DeviceName>> map = HashTreePMap.empty();
        for (var e : adjacency.entrySet()) {
            map = map.plus(e.getKey(), HashTreePSet.from(e.getValue()));
        }
        return new NetworkGraph(map);
    }

    public PSet<DeviceName> neighbors(DeviceName device) {
        return adjacency.getOrDefault(device, HashTreePSet.empty());
    }

    public int degree(DeviceName device) {
        return neighbors(device).size();
    }

    public boolean hasEdge(DeviceName from, DeviceName to) {
        return neighbors(from).contains(to);
    }

    /**
     * @return every device mentioned in the graph, either as a key or as someone's neighbor
     */
    public Set<DeviceName> vertices() {
        return Stream.concat(adjacency.keySet().stream(), adjacency.values().stream().flatMap(Collection::stream))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean containsVertex(DeviceName device) {
        return adjacency.containsKey(device)
                || adjacency.values().stream().anyMatch(n -> n.contains(device));
    }

    public boolean isEmpty() {
        return adjacency.isEmpty();
    }

    /**
     * Replaces the neighbor set of a device.
     *
     * @param device    the device
     * @param neighbors its new neighbors
     * @return the new graph, or this graph if nothing changed
     */
    public NetworkGraph withNeighbors(DeviceName device, Collection<DeviceName> neighbors) {
        var newNeighbors = HashTreePSet.from(neighbors);
        if (newNeighbors.equals(adjacency.get(device)))
            return this;
        return new NetworkGraph(adjacency.plus(device, newNeighbors));
    }

    /**
     * Merges another graph into this one by per-device set union.
     *
     * @param other the graph to merge
     * @return the merged graph, or this very instance if the other graph added nothing
     */
    public NetworkGraph merge(NetworkGraph other) {
        var merged = adjacency;
        for (var e : other.adjacency.entrySet()) {
            var current = merged.get(e.getKey());
            if (current == null) {
                merged = merged.plus(e.getKey(), e.getValue());
            } else if (!current.containsAll(e.getValue())) {
                merged = merged.plus(e.getKey(), current.plusAll(e.getValue()));
            }
        }
        if (merged == adjacency)
            return this;
        return new NetworkGraph(merged);
    }

    /**
     * @param device the device
     * @return the graph without the given device's row, edges pointing to it are kept
     */
    public NetworkGraph withoutRow(DeviceName device) {
        if (!adjacency.containsKey(device))
            return this;
        return new NetworkGraph(adjacency.minus(device));
    }

    @Override
    public String toString() {
        return "NetworkGraph" + adjacency;
    }
}
