package com.usatiuk.ringmesh.strategy;

import com.usatiuk.ringmesh.peers.ConnectionPhase;
import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.DeviceState;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshSnapshot;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.utils.TaskGroup;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Fills the free slots, frees a slot for a novel device by dropping one side of a triangle,
 * and periodically drops a leaf neighbor to make room for new devices.
 */
public class BaseConnectionStrategy implements ConnectionStrategy {
    private static final Logger LOG = Logger.getLogger(BaseConnectionStrategy.class);

    private final MeshStateStore _store;
    private final Transport _transport;
    private final TaskGroup _tasks;
    private final ConnectionRequester _requester;
    private final Random _random;
    private final int _maxConnections;
    private final long _manageIntervalMs;
    private final long _rotationIntervalMs;
    private final long _rotationJitterMs;

    public BaseConnectionStrategy(MeshStateStore store, Transport transport, ScheduledExecutorService executor,
                                  Random random, int maxConnections,
                                  long manageIntervalMs, long rotationIntervalMs, long rotationJitterMs) {
        _store = store;
        _transport = transport;
        _tasks = new TaskGroup("base-strategy", executor);
        _requester = new ConnectionRequester(store, transport, _tasks);
        _random = random;
        _maxConnections = maxConnections;
        _manageIntervalMs = manageIntervalMs;
        _rotationIntervalMs = rotationIntervalMs;
        _rotationJitterMs = rotationJitterMs;
    }

    @Override
    public void start() {
        if (!_tasks.activate()) return;
        LOG.info("Starting base strategy");
        _tasks.loop(0, () -> _manageIntervalMs, this::manageConnections);
        _tasks.loop(nextRotationDelay(), this::nextRotationDelay, this::connectionRotation);
    }

    @Override
    public void stop() {
        LOG.info("Stopping base strategy");
        _tasks.cancelAll();
        _requester.clear();
    }

    private long nextRotationDelay() {
        return _rotationIntervalMs + (_rotationJitterMs > 0 ? _random.nextLong(_rotationJitterMs) : 0);
    }

    /**
     * Dials a potential peer if there is a free slot, or tries to free a slot for a novel one.
     */
    void manageConnections() {
        var snapshot = _store.snapshot();
        var candidate = pickCandidate(snapshot);
        if (candidate.isEmpty()) return;

        if (snapshot.active().size() < _maxConnections) {
            LOG.debugv("Attempting to connect to {0}", candidate.get());
            _store.updatePhase(candidate.get().endpoint(), ConnectionPhase.CONNECTING)
                    .ifPresent(_requester::dial);
        } else if (isNovel(snapshot, candidate.get().name())) {
            tryDisconnectRedundantPeer(candidate.get().endpoint());
        }
    }

    /**
     * Prefers potential peers that are not in the network graph yet, to widen the known mesh.
     */
    Optional<DeviceState> pickCandidate(MeshSnapshot snapshot) {
        var available = snapshot.potentialDevices().stream()
                .filter(d -> !snapshot.isNameActive(d.name()))
                .sorted(Comparator.comparing(DeviceState::endpoint, Comparator.comparing(EndpointId::value)))
                .toList();
        return available.stream()
                .filter(d -> isNovel(snapshot, d.name()))
                .findFirst()
                .or(() -> available.stream().findFirst());
    }

    private static boolean isNovel(MeshSnapshot snapshot, DeviceName name) {
        return !snapshot.graph().containsVertex(name);
    }

    /**
     * Looks for two of our neighbors that are also connected to each other,
     * and drops one of them at random: we still reach it through the other.
     *
     * @param candidate the endpoint the slot is freed for
     * @return true if a connection was dropped
     */
    public boolean tryDisconnectRedundantPeer(EndpointId candidate) {
        var snapshot = _store.snapshot();
        var graph = snapshot.graph();
        var neighbors = graph.neighbors(_store.self()).stream().sorted().toList();

        for (int i = 0; i < neighbors.size(); i++) {
            for (int j = i + 1; j < neighbors.size(); j++) {
                var n1 = neighbors.get(i);
                var n2 = neighbors.get(j);
                if (!graph.hasEdge(n1, n2) && !graph.hasEdge(n2, n1)) continue;

                var victim = _random.nextBoolean() ? n1 : n2;
                var endpoint = snapshot.findByName(victim)
                        .filter(d -> d.phase() == ConnectionPhase.CONNECTED)
                        .map(DeviceState::endpoint);
                if (endpoint.isEmpty()) {
                    LOG.warnv("Wanted to disconnect redundant peer {0}, but it is not connected", victim);
                    continue;
                }
                LOG.infov("At capacity, disconnecting redundant peer {0} to make room for {1}", victim, candidate);
                _transport.disconnectFromEndpoint(endpoint.get());
                return true;
            }
        }
        return false;
    }

    /**
     * When at capacity, drops a random neighbor that is connected to nobody but us.
     *
     * @return the dropped neighbor, if any
     */
    Optional<DeviceName> connectionRotation() {
        var snapshot = _store.snapshot();
        var graph = snapshot.graph();
        var neighbors = graph.neighbors(_store.self());
        if (neighbors.size() < _maxConnections) return Optional.empty();

        var leaves = neighbors.stream().filter(n -> graph.degree(n) == 1).sorted().toList();
        if (leaves.isEmpty()) return Optional.empty();

        var victim = leaves.get(_random.nextInt(leaves.size()));
        var endpoint = snapshot.findByName(victim).map(DeviceState::endpoint);
        if (endpoint.isEmpty()) return Optional.empty();

        LOG.infov("Connection rotation: disconnecting leaf {0} to find new peers", victim);
        _transport.disconnectFromEndpoint(endpoint.get());
        return Optional.of(victim);
    }

    @Override
    public void onConnectionInitiated(EndpointId endpoint, DeviceName remoteName) {
        if (_requester.isOutgoing(endpoint)) {
            _transport.acceptConnection(endpoint);
            return;
        }
        var active = _store.snapshot().activeCountExcluding(endpoint);
        if (active < _maxConnections) {
            LOG.infov("Accepting connection from {0}", remoteName);
            _transport.acceptConnection(endpoint);
        } else {
            LOG.warnv("Rejecting {0}, capacity reached ({1}/{2})", remoteName, active, _maxConnections);
            _transport.rejectConnection(endpoint);
        }
    }

    @Override
    public boolean isDialing(EndpointId endpoint) {
        return _requester.isOutgoing(endpoint);
    }

    @Override
    public void onConnectionResult(EndpointId endpoint, boolean success) {
        _requester.settled(endpoint);
    }

    @Override
    public void onDisconnected(EndpointId endpoint) {
        _requester.settled(endpoint);
    }
}
