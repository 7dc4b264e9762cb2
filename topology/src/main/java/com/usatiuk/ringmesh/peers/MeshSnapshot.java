package com.usatiuk.ringmesh.peers;

import com.usatiuk.ringmesh.graph.NetworkGraph;
import org.apache.commons.collections4.MultiValuedMap;
import org.apache.commons.collections4.multimap.ArrayListValuedHashMap;
import org.pcollections.HashTreePMap;
import org.pcollections.HashTreePSet;
import org.pcollections.PMap;
import org.pcollections.PSet;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Consistent, immutable view of the whole mesh state at one instant.
 * Strategies make every decision of one cycle against a single snapshot.
 */
public final class MeshSnapshot {
    private static final Comparator<DeviceState> PREFERRED = Comparator
            .comparing((DeviceState d) -> d.phase() == ConnectionPhase.CONNECTED)
            .thenComparing(d -> d.phase() == ConnectionPhase.CONNECTING)
            .thenComparingLong(DeviceState::lastSeenAt);

    private final PMap<EndpointId, DeviceState> _devices;
    private final PSet<EndpointId> _potentialPeers;
    private final PMap<DeviceName, Integer> _retryCounts;
    private final NetworkGraph _graph;
    private final long _version;
    private final MultiValuedMap<DeviceName, DeviceState> _byName = new ArrayListValuedHashMap<>();

    MeshSnapshot(PMap<EndpointId, DeviceState> devices, PSet<EndpointId> potentialPeers,
                 PMap<DeviceName, Integer> retryCounts, NetworkGraph graph, long version) {
        _devices = devices;
        _potentialPeers = potentialPeers;
        _retryCounts = retryCounts;
        _graph = graph;
        _version = version;
        for (var d : devices.values())
            _byName.put(d.name(), d);
    }

    static MeshSnapshot empty() {
        return new MeshSnapshot(HashTreePMap.empty(), HashTreePSet.empty(), HashTreePMap.empty(), NetworkGraph.empty(), 0);
    }

    MeshSnapshot with(PMap<EndpointId, DeviceState> devices, PSet<EndpointId> potentialPeers,
                      PMap<DeviceName, Integer> retryCounts, NetworkGraph graph) {
        return new MeshSnapshot(devices, potentialPeers, retryCounts, graph, _version);
    }

    MeshSnapshot withVersion(long version) {
        return new MeshSnapshot(_devices, _potentialPeers, _retryCounts, _graph, version);
    }

    PMap<EndpointId, DeviceState> devices() {
        return _devices;
    }

    PMap<DeviceName, Integer> retryCounts() {
        return _retryCounts;
    }

    /**
     * @return a counter incremented on every effective change of the store
     */
    public long version() {
        return _version;
    }

    public Optional<DeviceState> device(EndpointId endpoint) {
        return Optional.ofNullable(_devices.get(endpoint));
    }

    public Collection<DeviceState> allDevices() {
        return _devices.values();
    }

    public PSet<EndpointId> potentialPeers() {
        return _potentialPeers;
    }

    public NetworkGraph graph() {
        return _graph;
    }

    public int retryCount(DeviceName name) {
        return _retryCounts.getOrDefault(name, 0);
    }

    /**
     * @return the known devices that are still potential peers
     */
    public List<DeviceState> potentialDevices() {
        return _potentialPeers.stream().map(_devices::get).filter(d -> d != null).toList();
    }

    public List<DeviceState> inPhase(ConnectionPhase phase) {
        return _devices.values().stream().filter(d -> d.phase() == phase).toList();
    }

    public List<DeviceState> connected() {
        return inPhase(ConnectionPhase.CONNECTED);
    }

    public List<DeviceState> active() {
        return _devices.values().stream().filter(DeviceState::isActive).toList();
    }

    /**
     * @param excluded the endpoint not to count
     * @return the number of CONNECTED or CONNECTING devices other than the given endpoint
     */
    public int activeCountExcluding(EndpointId excluded) {
        return (int) _devices.values().stream().filter(d -> d.isActive() && !d.endpoint().equals(excluded)).count();
    }

    public Set<DeviceName> connectedNames() {
        return connected().stream().map(DeviceState::name).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Finds the entry of a device by name. If the device is known under several endpoints,
     * a connected entry wins over a connecting one, which wins over the most recently seen one.
     *
     * @param name the device name
     * @return the preferred entry for that name
     */
    public Optional<DeviceState> findByName(DeviceName name) {
        return _byName.get(name).stream().max(PREFERRED);
    }

    /**
     * @return true if any endpoint of the device is CONNECTED or CONNECTING
     */
    public boolean isNameActive(DeviceName name) {
        return _byName.get(name).stream().anyMatch(DeviceState::isActive);
    }

    @Override
    public String toString() {
        return "MeshSnapshot{" +
                "version=" + _version +
                ", devices=" + _devices.values() +
                ", potentialPeers=" + _potentialPeers +
                ", graph=" + _graph +
                '}';
    }
}
