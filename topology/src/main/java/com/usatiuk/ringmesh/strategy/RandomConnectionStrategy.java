package com.usatiuk.ringmesh.strategy;

import com.usatiuk.ringmesh.peers.ConnectionPhase;
import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.DeviceState;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.utils.TaskGroup;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Ignores the topology and relies on randomness.
 * <p>
 * Free slots are filled with any discovered device, fresh ones first.
 * When at capacity, every cycle drops a random connection with a small probability,
 * so that no partition of the mesh can persist forever.
 */
public class RandomConnectionStrategy implements ConnectionStrategy {
    private static final Logger LOG = Logger.getLogger(RandomConnectionStrategy.class);
    private static final long STARVATION_LOG_INTERVAL_MS = 30_000;

    private final MeshStateStore _store;
    private final Transport _transport;
    private final TaskGroup _tasks;
    private final ConnectionRequester _requester;
    private final Random _random;
    private final int _maxConnections;
    private final long _loopIntervalMs;
    private final long _loopJitterMs;
    private final double _churnProbability;
    private final ExponentialBackoff _backoff;

    // Endpoints waiting for their backoff, guards against concurrent attempts to the same endpoint
    private final Set<EndpointId> _pending = ConcurrentHashMap.newKeySet();
    private volatile long _lastStarvationLog = 0;

    public RandomConnectionStrategy(MeshStateStore store, Transport transport, ScheduledExecutorService executor,
                                    Random random, int maxConnections, long loopIntervalMs, long loopJitterMs,
                                    double churnProbability, ExponentialBackoff backoff) {
        _store = store;
        _transport = transport;
        _tasks = new TaskGroup("random-strategy", executor);
        _requester = new ConnectionRequester(store, transport, _tasks);
        _random = random;
        _maxConnections = maxConnections;
        _loopIntervalMs = loopIntervalMs;
        _loopJitterMs = loopJitterMs;
        _churnProbability = churnProbability;
        _backoff = backoff;
    }

    @Override
    public void start() {
        if (!_tasks.activate()) return;
        LOG.info("Starting random strategy");
        _tasks.loop(nextLoopDelay(), this::nextLoopDelay, this::runCycle);
    }

    @Override
    public void stop() {
        LOG.info("Stopping random strategy");
        _tasks.cancelAll();
        _pending.clear();
        _requester.clear();
    }

    private long nextLoopDelay() {
        return _loopIntervalMs + (_loopJitterMs > 0 ? _random.nextLong(_loopJitterMs) : 0);
    }

    /**
     * One decision cycle: fill a free slot, or maybe drop a random connection when at capacity.
     */
    void runCycle() {
        var snapshot = _store.snapshot();
        var active = snapshot.active();
        if (active.size() < _maxConnections) {
            pickCandidate(snapshot.potentialDevices()).ifPresentOrElse(
                    c -> connectToPeer(c.name(), c.endpoint()),
                    () -> logStarvation(snapshot.potentialPeers().size(), active.size()));
        } else {
            considerIslandBreaking(active.stream().filter(d -> d.phase() == ConnectionPhase.CONNECTED).toList());
        }
    }

    /**
     * Picks a discovered device that is not being dialed, preferring the ones that never failed.
     */
    Optional<DeviceState> pickCandidate(List<DeviceState> potential) {
        var eligible = potential.stream()
                .filter(d -> d.phase() == ConnectionPhase.DISCOVERED)
                .filter(d -> !_pending.contains(d.endpoint()))
                .sorted(Comparator.comparing(DeviceState::endpoint, Comparator.comparing(EndpointId::value)))
                .toList();
        if (eligible.isEmpty()) return Optional.empty();

        var fresh = eligible.stream().filter(d -> _store.getRetryCount(d.name()) == 0).toList();
        var pool = fresh.isEmpty() ? eligible : fresh;
        return Optional.of(pool.get(_random.nextInt(pool.size())));
    }

    private void considerIslandBreaking(List<DeviceState> connected) {
        if (_random.nextDouble() >= _churnProbability) return;
        if (connected.isEmpty()) return;
        var victim = connected.get(_random.nextInt(connected.size()));
        LOG.infov("Island breaker: disconnecting {0} to shake up the topology", victim.name());
        _transport.disconnectFromEndpoint(victim.endpoint());
    }

    /**
     * Dials a device after its backoff, if it is still only discovered by then.
     *
     * @return completes when the attempt is over
     */
    CompletableFuture<Void> connectToPeer(DeviceName name, EndpointId endpoint) {
        if (!_tasks.isActive()) return CompletableFuture.completedFuture(null);
        if (!_pending.add(endpoint)) return CompletableFuture.completedFuture(null);

        var result = new CompletableFuture<Void>();
        var delay = _backoff.delayMs(_store.getRetryCount(name), _random);
        if (delay > 0)
            LOG.debugv("Backing off connection to {0} for {1}ms", name, delay);
        _tasks.schedule(() -> {
            try {
                if (!_store.transitionPhase(endpoint, ConnectionPhase.DISCOVERED, ConnectionPhase.CONNECTING)) {
                    LOG.debugv("{0} is no longer just discovered, skipping", name);
                    result.complete(null);
                    return;
                }
                var target = _store.getDeviceState(endpoint);
                if (target.isEmpty()) {
                    result.complete(null);
                    return;
                }
                _requester.dial(target.get()).whenComplete((v, e) -> result.complete(null));
            } finally {
                _pending.remove(endpoint);
            }
        }, delay);
        return result;
    }

    boolean isPending(EndpointId endpoint) {
        return _pending.contains(endpoint);
    }

    private void logStarvation(int poolSize, int activeCount) {
        var now = System.currentTimeMillis();
        if (now - _lastStarvationLog > STARVATION_LOG_INTERVAL_MS) {
            LOG.debugv("No suitable candidates found (pool: {0}, active: {1})", poolSize, activeCount);
            _lastStarvationLog = now;
        }
    }

    @Override
    public void onConnectionInitiated(EndpointId endpoint, DeviceName remoteName) {
        if (_requester.isOutgoing(endpoint)) {
            LOG.infov("Accepting connection to {0} dialed by us", remoteName);
            _transport.acceptConnection(endpoint);
            return;
        }
        var active = _store.snapshot().activeCountExcluding(endpoint);
        if (active < _maxConnections) {
            LOG.infov("Accepting incoming connection from {0}", remoteName);
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
