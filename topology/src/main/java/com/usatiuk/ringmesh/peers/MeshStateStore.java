package com.usatiuk.ringmesh.peers;

import com.usatiuk.ringmesh.graph.NetworkGraph;
import jakarta.annotation.Nullable;
import org.jboss.logging.Logger;
import org.pcollections.PMap;
import org.pcollections.PSet;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;
import java.util.function.UnaryOperator;

/**
 * Single source of truth for the state of all known devices, the potential peer pool,
 * the per-device retry counters and the gossiped network graph.
 * <p>
 * Potential peers are the known devices without a connection slot: a device leaves the pool when it starts
 * connecting and comes back when it fails or disconnects. Only forgetting the device drops it for good.
 * <p>
 * The state is one immutable {@link MeshSnapshot}, every mutation is a compare-and-swap of the whole snapshot,
 * so concurrent updates are never lost and readers always see a consistent view.
 * The row of the local device in the network graph is re-derived from the connected devices on every change.
 */
public class MeshStateStore {
    private static final Logger LOG = Logger.getLogger(MeshStateStore.class);

    private final DeviceName _self;
    private final LongSupplier _clock;
    private final AtomicReference<MeshSnapshot> _state = new AtomicReference<>(MeshSnapshot.empty());
    private final List<MeshStateListener> _listeners = new CopyOnWriteArrayList<>();

    public MeshStateStore(DeviceName self) {
        this(self, System::currentTimeMillis);
    }

    /**
     * @param self  the name of the local device
     * @param clock the time source for {@link DeviceState#lastSeenAt()}
     */
    public MeshStateStore(DeviceName self, LongSupplier clock) {
        _self = self;
        _clock = clock;
    }

    public DeviceName self() {
        return _self;
    }

    public void addListener(MeshStateListener listener) {
        _listeners.add(listener);
    }

    public void removeListener(MeshStateListener listener) {
        _listeners.remove(listener);
    }

    public MeshSnapshot snapshot() {
        return _state.get();
    }

    public Optional<DeviceState> getDeviceState(EndpointId endpoint) {
        return snapshot().device(endpoint);
    }

    public Collection<DeviceState> allDevices() {
        return snapshot().allDevices();
    }

    public PSet<EndpointId> potentialPeers() {
        return snapshot().potentialPeers();
    }

    public NetworkGraph networkGraph() {
        return snapshot().graph();
    }

    public int getRetryCount(DeviceName name) {
        return snapshot().retryCount(name);
    }

    /**
     * Records a discovered device: creates or refreshes it as DISCOVERED and adds it to the potential peers.
     * A device that is already connecting or connected keeps its phase.
     *
     * @param endpoint the endpoint of the device
     * @param name     the name it advertises
     * @return the resulting state
     */
    public DeviceState deviceDiscovered(EndpointId endpoint, DeviceName name) {
        var result = new AtomicReference<DeviceState>();
        update(s -> {
            var now = _clock.getAsLong();
            var existing = s.devices().get(endpoint);
            DeviceState next;
            if (existing != null && existing.isActive())
                next = existing.withName(name).withLastSeenAt(now);
            else
                next = new DeviceState(endpoint, name, ConnectionPhase.DISCOVERED, s.retryCount(name), now);
            result.set(next);
            return putDevice(s, next);
        });
        return result.get();
    }

    /**
     * Moves a known device to a new phase.
     *
     * @param endpoint the endpoint of the device
     * @param phase    the new phase
     * @return the new state, or empty if the device is not known
     */
    public Optional<DeviceState> updatePhase(EndpointId endpoint, ConnectionPhase phase) {
        var result = new AtomicReference<DeviceState>();
        update(s -> {
            var existing = s.devices().get(endpoint);
            result.set(null);
            if (existing == null) return s;
            var next = existing.withPhase(phase, _clock.getAsLong());
            result.set(next);
            return putDevice(s, next);
        });
        if (result.get() == null)
            LOG.debugv("Ignoring phase {0} for unknown endpoint {1}", phase, endpoint);
        return Optional.ofNullable(result.get());
    }

    /**
     * Moves a device to a new phase, creating it if it is not known yet.
     *
     * @param endpoint the endpoint of the device
     * @param name     the name of the device
     * @param phase    the new phase
     * @return the new state
     */
    public DeviceState updatePhase(EndpointId endpoint, DeviceName name, ConnectionPhase phase) {
        var result = new AtomicReference<DeviceState>();
        update(s -> {
            var now = _clock.getAsLong();
            var existing = s.devices().get(endpoint);
            var next = existing != null
                    ? existing.withName(name).withRetryCount(s.retryCount(name)).withPhase(phase, now)
                    : new DeviceState(endpoint, name, phase, s.retryCount(name), now);
            result.set(next);
            return putDevice(s, next);
        });
        return result.get();
    }

    /**
     * Moves a device to a new phase only if it is currently in the expected one.
     *
     * @param endpoint the endpoint of the device
     * @param expected the phase the device must be in
     * @param next     the new phase
     * @return true if the transition happened
     */
    public boolean transitionPhase(EndpointId endpoint, ConnectionPhase expected, ConnectionPhase next) {
        var applied = new AtomicReference<Boolean>(false);
        update(s -> {
            var existing = s.devices().get(endpoint);
            applied.set(false);
            if (existing == null || existing.phase() != expected) return s;
            applied.set(true);
            return putDevice(s, existing.withPhase(next, _clock.getAsLong()));
        });
        return applied.get();
    }

    /**
     * Applies a timeout to a device, if it did not change since the given state was observed.
     *
     * @param observed the state the timeout was computed for
     * @param next     the phase to move to, or null to forget the device
     * @return true if the device was changed
     */
    public boolean expire(DeviceState observed, @Nullable ConnectionPhase next) {
        var applied = new AtomicReference<Boolean>(false);
        update(s -> {
            var existing = s.devices().get(observed.endpoint());
            applied.set(false);
            if (existing == null || existing.phase() != observed.phase() || existing.lastSeenAt() != observed.lastSeenAt())
                return s;
            applied.set(true);
            if (next == null)
                return withDevices(s, s.devices().minus(observed.endpoint()), s.potentialPeers().minus(observed.endpoint()), s.retryCounts());
            return putDevice(s, existing.withPhase(next, _clock.getAsLong()));
        });
        return applied.get();
    }

    /**
     * Forgets a device. Its retry counter is kept, so it backs off again if it reappears.
     *
     * @param endpoint the endpoint of the device
     * @return the removed state, or empty if it was not known
     */
    public Optional<DeviceState> remove(EndpointId endpoint) {
        var result = new AtomicReference<DeviceState>();
        update(s -> {
            var existing = s.devices().get(endpoint);
            result.set(existing);
            if (existing == null && !s.potentialPeers().contains(endpoint)) return s;
            return withDevices(s, s.devices().minus(endpoint), s.potentialPeers().minus(endpoint), s.retryCounts());
        });
        return Optional.ofNullable(result.get());
    }

    /**
     * @param name the device name
     * @return the new retry count
     */
    public int incrementRetry(DeviceName name) {
        var snapshot = update(s -> setRetry(s, name, s.retryCount(name) + 1));
        return snapshot.retryCount(name);
    }

    /**
     * Union-merges a remote graph into the local one.
     * The row describing the local device is ignored, it is derived from local observation only.
     *
     * @param remote the received graph
     * @return true if the local graph changed
     */
    public boolean mergeGraph(NetworkGraph remote) {
        var changed = new AtomicReference<Boolean>(false);
        update(s -> {
            var merged = s.graph().merge(remote.withoutRow(_self));
            changed.set(merged != s.graph());
            if (merged == s.graph()) return s;
            return s.with(s.devices(), s.potentialPeers(), s.retryCounts(), merged);
        });
        return changed.get();
    }

    private MeshSnapshot setRetry(MeshSnapshot s, DeviceName name, int count) {
        var devices = s.devices();
        for (var d : s.devices().values()) {
            if (d.name().equals(name))
                devices = devices.plus(d.endpoint(), d.withRetryCount(count));
        }
        return s.with(devices, s.potentialPeers(), s.retryCounts().plus(name, count), s.graph());
    }

    private MeshSnapshot putDevice(MeshSnapshot s, DeviceState device) {
        var retryCounts = s.retryCounts();
        if (device.phase() == ConnectionPhase.CONNECTED && s.retryCount(device.name()) != 0) {
            retryCounts = retryCounts.plus(device.name(), 0);
            device = device.withRetryCount(0);
        }
        var potential = device.phase().isPotential()
                ? s.potentialPeers().plus(device.endpoint())
                : s.potentialPeers().minus(device.endpoint());
        var devices = s.devices().plus(device.endpoint(), device);
        if (retryCounts != s.retryCounts()) {
            for (var d : devices.values()) {
                if (d.name().equals(device.name()))
                    devices = devices.plus(d.endpoint(), d.withRetryCount(0));
            }
        }
        return withDevices(s, devices, potential, retryCounts);
    }

    private MeshSnapshot withDevices(MeshSnapshot s, PMap<EndpointId, DeviceState> devices,
                                     PSet<EndpointId> potential, PMap<DeviceName, Integer> retryCounts) {
        var connectedNames = devices.values().stream()
                .filter(d -> d.phase() == ConnectionPhase.CONNECTED)
                .map(DeviceState::name)
                .toList();
        var graph = s.graph();
        if (!connectedNames.isEmpty() || graph.adjacency().containsKey(_self))
            graph = graph.withNeighbors(_self, connectedNames);
        return s.with(devices, potential, retryCounts, graph);
    }

    private MeshSnapshot update(UnaryOperator<MeshSnapshot> updater) {
        MeshSnapshot prev;
        MeshSnapshot next;
        do {
            prev = _state.get();
            next = updater.apply(prev);
            if (next == prev) return prev;
            next = next.withVersion(prev.version() + 1);
        } while (!_state.compareAndSet(prev, next));

        for (var l : _listeners) {
            try {
                l.handleMeshStateChanged(next);
            } catch (Exception e) {
                LOG.errorv(e, "Mesh state listener {0} failed", l);
            }
        }
        return next;
    }
}
