package com.usatiuk.ringmesh.strategy;

import com.usatiuk.ringmesh.peers.ConnectionPhase;
import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.DeviceState;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshSnapshot;
import com.usatiuk.ringmesh.peers.MeshStateListener;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.utils.Debouncer;
import com.usatiuk.utils.TaskGroup;
import jakarta.annotation.Nullable;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps the device connected to its successor, predecessor and opposite on the ring of all known device names.
 * <p>
 * The successor and the opposite are dialed by us, the predecessor is expected to dial us.
 * Connections to other devices are kept as spares as long as they do not take
 * the slots needed by the missing ring neighbors.
 * <p>
 * The ring is re-evaluated on every change of the mesh state, at most one evaluation is queued at a time.
 */
public class RingConnectionStrategy implements ConnectionStrategy, MeshStateListener {
    private static final Logger LOG = Logger.getLogger(RingConnectionStrategy.class);

    private final MeshStateStore _store;
    private final Transport _transport;
    private final TaskGroup _tasks;
    private final ConnectionRequester _requester;
    private final Random _random;
    private final int _maxConnections;
    private final ExponentialBackoff _backoff;
    private final boolean _reduceDiscoveryWhenStable;
    private final Debouncer<Boolean> _stability;

    private final AtomicBoolean _evaluationQueued = new AtomicBoolean(false);
    private final AtomicBoolean _discoveryReduced = new AtomicBoolean(false);
    // Names with a dial waiting for its backoff
    private final Set<DeviceName> _pendingDials = ConcurrentHashMap.newKeySet();

    public RingConnectionStrategy(MeshStateStore store, Transport transport, ScheduledExecutorService executor,
                                  Random random, int maxConnections, ExponentialBackoff backoff,
                                  long stabilityDebounceMs, boolean reduceDiscoveryWhenStable) {
        _store = store;
        _transport = transport;
        _tasks = new TaskGroup("ring-strategy", executor);
        _requester = new ConnectionRequester(store, transport, _tasks);
        _random = random;
        _maxConnections = maxConnections;
        _backoff = backoff;
        _reduceDiscoveryWhenStable = reduceDiscoveryWhenStable;
        _stability = new Debouncer<>(executor, stabilityDebounceMs, this::onStabilitySettled);
    }

    @Override
    public void start() {
        if (!_tasks.activate()) return;
        LOG.info("Starting ring strategy");
        _store.addListener(this);
        requestEvaluation();
    }

    @Override
    public void stop() {
        LOG.info("Stopping ring strategy");
        _store.removeListener(this);
        _tasks.cancelAll();
        _stability.reset();
        _pendingDials.clear();
        _requester.clear();
        _evaluationQueued.set(false);
    }

    @Override
    public void handleMeshStateChanged(MeshSnapshot snapshot) {
        requestEvaluation();
    }

    private void requestEvaluation() {
        if (!_tasks.isActive()) return;
        if (!_evaluationQueued.compareAndSet(false, true)) return;
        _tasks.execute(() -> {
            _evaluationQueued.set(false);
            evaluate();
        });
    }

    /**
     * Runs one evaluation of the ring against the current mesh state:
     * dials the missing desired peers, prunes excess spares and updates the stability signal.
     *
     * @return the ring, or null if there are not enough devices to form one
     */
    @Nullable
    RingTopology evaluate() {
        var snapshot = _store.snapshot();
        var ring = ringOf(snapshot, null);
        if (ring.size() < 2) {
            LOG.debug("Not enough devices for a ring, waiting for more peers");
            submitStability(false);
            return null;
        }
        LOG.debugv("Evaluating {0}", ring);

        for (var name : ring.desired())
            connectTo(snapshot, name);

        prune(snapshot, ring);
        submitStability(isStable(snapshot, ring));
        return ring;
    }

    /**
     * @return whether the last evaluated ring was complete, settled or not
     */
    public boolean isStable() {
        return Boolean.TRUE.equals(_stability.current());
    }

    int pendingDialCount() {
        return _pendingDials.size();
    }

    static boolean isStable(MeshSnapshot snapshot, RingTopology ring) {
        var connected = snapshot.connectedNames();
        var hasOpposite = ring.opposite().map(connected::contains).orElse(true);
        return connected.contains(ring.successor())
                && connected.contains(ring.predecessor())
                && hasOpposite
                && connected.size() >= 2;
    }

    /**
     * Builds the ring of every potential and active device, and self.
     *
     * @param extra a device to put on the ring even if it is not known yet
     */
    RingTopology ringOf(MeshSnapshot snapshot, @Nullable DeviceName extra) {
        var names = Stream.concat(snapshot.potentialDevices().stream(), snapshot.active().stream())
                .map(DeviceState::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (extra != null) names.add(extra);
        return RingTopology.of(names, _store.self());
    }

    private void connectTo(MeshSnapshot snapshot, DeviceName name) {
        if (snapshot.isNameActive(name)) return;
        if (snapshot.findByName(name).isEmpty()) return;
        if (!_pendingDials.add(name)) return;

        var retries = snapshot.retryCount(name);
        var delay = _backoff.delayMs(retries, _random);
        if (delay > 0)
            LOG.infov("Backing off connection to {0} for {1}ms (retry #{2})", name, delay, retries);
        _tasks.schedule(() -> dialAfterBackoff(name), delay);
    }

    private void dialAfterBackoff(DeviceName name) {
        try {
            var snapshot = _store.snapshot();
            if (snapshot.isNameActive(name)) {
                LOG.debugv("Connection to {0} no longer needed after backoff", name);
                return;
            }
            var target = snapshot.findByName(name);
            if (target.isEmpty()) {
                LOG.debugv("{0} disappeared during backoff", name);
                return;
            }
            _store.updatePhase(target.get().endpoint(), ConnectionPhase.CONNECTING)
                    .ifPresent(_requester::dial);
        } finally {
            _pendingDials.remove(name);
        }
    }

    /**
     * Disconnects the spare connections that take slots reserved for missing ring neighbors.
     *
     * @return the number of disconnected spares
     */
    int prune(MeshSnapshot snapshot, RingTopology ring) {
        var important = ring.important();
        var connected = snapshot.connected().stream()
                .sorted(Comparator.comparing(DeviceState::name))
                .toList();
        var importantCount = (int) connected.stream().filter(d -> important.contains(d.name())).count();
        var spares = connected.stream().filter(d -> !important.contains(d.name())).toList();
        var missing = (int) important.stream().filter(n -> !snapshot.isNameActive(n)).count();
        var maxSpares = _maxConnections - importantCount - missing;

        if (spares.size() <= maxSpares) {
            LOG.debugv("Keeping {0} spare connections, allowed {1}", spares.size(), maxSpares);
            return 0;
        }
        var toPrune = spares.size() - Math.max(0, maxSpares);
        for (var spare : spares.subList(0, toPrune)) {
            LOG.infov("Pruning spare connection to {0} to make room for ring neighbors", spare.name());
            _transport.disconnectFromEndpoint(spare.endpoint());
        }
        return toPrune;
    }

    @Override
    public void onConnectionInitiated(EndpointId endpoint, DeviceName remoteName) {
        if (_requester.isOutgoing(endpoint)) {
            LOG.infov("Accepting connection to {0} dialed by us", remoteName);
            _transport.acceptConnection(endpoint);
            return;
        }

        var snapshot = _store.snapshot();
        var ring = ringOf(snapshot, remoteName);
        if (remoteName.equals(ring.successor()) || remoteName.equals(ring.predecessor())) {
            disconnectDisplacedNeighbors(snapshot, ring, remoteName);
            LOG.infov("Accepting connection from ring neighbor {0}", remoteName);
            _transport.acceptConnection(endpoint);
            return;
        }

        var connected = snapshot.connected().stream().filter(d -> !d.endpoint().equals(endpoint)).count();
        if (connected < _maxConnections) {
            LOG.infov("Accepting connection from non-neighbor {0}", remoteName);
            _transport.acceptConnection(endpoint);
        } else {
            LOG.warnv("Rejecting connection from {0}, no capacity ({1}/{2})", remoteName, connected, _maxConnections);
            _transport.rejectConnection(endpoint);
        }
    }

    /**
     * A device that sorts between us and our current successor or predecessor cuts in:
     * the neighbor it displaces is no longer wanted and is disconnected.
     */
    private void disconnectDisplacedNeighbors(MeshSnapshot snapshot, RingTopology ring, DeviceName incoming) {
        var before = ring.without(incoming);
        if (before.size() < 2) return;
        var important = ring.important();
        for (var displaced : List.of(before.successor(), before.predecessor())) {
            if (important.contains(displaced)) continue;
            for (var device : snapshot.connected()) {
                if (!device.name().equals(displaced)) continue;
                LOG.infov("{0} cuts in, disconnecting former neighbor {1}", incoming, displaced);
                _transport.disconnectFromEndpoint(device.endpoint());
            }
        }
    }

    @Override
    public boolean isDialing(EndpointId endpoint) {
        return _requester.isOutgoing(endpoint);
    }

    @Override
    public void onConnectionResult(EndpointId endpoint, boolean success) {
        _requester.settled(endpoint);
        submitStability(false);
        requestEvaluation();
    }

    @Override
    public void onDisconnected(EndpointId endpoint) {
        _requester.settled(endpoint);
        submitStability(false);
        requestEvaluation();
    }

    private void submitStability(boolean stable) {
        if (!_tasks.isActive()) return;
        if (!stable && _discoveryReduced.compareAndSet(true, false)) {
            LOG.info("Ring is unstable, resuming discovery");
            _transport.startDiscovery();
        }
        _stability.submit(stable);
    }

    private void onStabilitySettled(Boolean stable) {
        if (!_tasks.isActive()) return;
        if (!stable) {
            LOG.info("Ring is unstable, discovering");
            _transport.startDiscovery();
        } else if (_reduceDiscoveryWhenStable) {
            if (_discoveryReduced.compareAndSet(false, true)) {
                LOG.info("Ring is stable, stopping discovery");
                _transport.stopDiscovery();
            }
        } else {
            LOG.info("Ring is stable, keeping discovery active");
        }
    }
}
