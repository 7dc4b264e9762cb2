package com.usatiuk.ringmesh.routing;

import com.usatiuk.ringmesh.peers.DeviceState;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.ringmesh.wire.FrameCodec;
import com.usatiuk.utils.TaskGroup;
import jakarta.annotation.Nullable;
import org.apache.commons.lang3.Validate;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.LongSupplier;

/**
 * Best-effort flooding of {@link RoutedMessage}s over the connected neighbors.
 * <p>
 * Every message is handled at most once per node, copies are recognized by their id, source and destination
 * for as long as the seen cache keeps them. Each hop decrements the time to live,
 * a message is only forwarded while it has hops left.
 */
public class FloodRouter {
    private static final Logger LOG = Logger.getLogger(FloodRouter.class);

    private final MeshStateStore _store;
    private final Transport _transport;
    private final FrameCodec _codec;
    private final TaskGroup _tasks;
    private final LongSupplier _clock;
    private final int _defaultTtl;
    private final long _seenTtlMs;
    private final long _cleanupIntervalMs;
    private final int _maxPayloadBytes;

    private final Map<RoutedMessage.Key, Long> _seen = new ConcurrentHashMap<>();
    private final List<RoutedMessageListener> _listeners = new CopyOnWriteArrayList<>();

    public FloodRouter(MeshStateStore store, Transport transport, FrameCodec codec,
                       ScheduledExecutorService executor, LongSupplier clock,
                       int defaultTtl, long seenTtlMs, long cleanupIntervalMs, int maxPayloadBytes) {
        _store = store;
        _transport = transport;
        _codec = codec;
        _tasks = new TaskGroup("flood-router", executor);
        _clock = clock;
        _defaultTtl = defaultTtl;
        _seenTtlMs = seenTtlMs;
        _cleanupIntervalMs = cleanupIntervalMs;
        _maxPayloadBytes = maxPayloadBytes;
    }

    public void start() {
        if (!_tasks.activate()) return;
        _tasks.loop(_cleanupIntervalMs, () -> _cleanupIntervalMs, this::cleanup);
    }

    public void stop() {
        _tasks.cancelAll();
        _seen.clear();
    }

    public void addListener(RoutedMessageListener listener) {
        _listeners.add(listener);
    }

    public void removeListener(RoutedMessageListener listener) {
        _listeners.remove(listener);
    }

    /**
     * Originates a message and sends it to every connected neighbor.
     *
     * @param destId  the name of the destination device, or {@link RoutedMessage#BROADCAST}
     * @param payload the payload
     * @return the sent message
     * @throws IllegalArgumentException if the payload is too large
     */
    public RoutedMessage send(String destId, byte[] payload) {
        Validate.isTrue(payload.length <= _maxPayloadBytes,
                "Payload of %d bytes exceeds the limit of %d bytes", payload.length, _maxPayloadBytes);
        var message = RoutedMessage.create(_store.self(), destId, _defaultTtl, payload);
        _seen.put(message.key(), _clock.getAsLong());
        LOG.tracev("Sending {0}", message);
        _transport.broadcast(_codec.encodeRouted(message));
        return message;
    }

    public RoutedMessage broadcast(byte[] payload) {
        return send(RoutedMessage.BROADCAST, payload);
    }

    /**
     * Handles a message received from a neighbor.
     *
     * @param from    the endpoint the message came from
     * @param message the message
     * @return what was done with it
     */
    public RouteResult handleIncoming(@Nullable EndpointId from, RoutedMessage message) {
        if (message.ttl() <= 0) {
            LOG.tracev("Dropping expired {0}", message);
            return RouteResult.EXPIRED;
        }
        if (message.payload().length > _maxPayloadBytes) {
            LOG.warnv("Dropping {0} from {1}, payload exceeds {2} bytes", message, from, _maxPayloadBytes);
            return RouteResult.OVERSIZED;
        }
        if (_seen.putIfAbsent(message.key(), _clock.getAsLong()) != null) {
            LOG.tracev("Dropping duplicate {0}", message);
            return RouteResult.DUPLICATE;
        }

        if (message.isAddressedTo(_store.self())) {
            deliver(from, message);
            return RouteResult.DELIVERED;
        }
        if (message.isBroadcast()) {
            deliver(from, message);
            forward(from, message);
            return RouteResult.DELIVERED;
        }
        forward(from, message);
        return RouteResult.FORWARDED;
    }

    /**
     * Forgets the messages seen longer ago than the cache time to live.
     *
     * @return the number of forgotten messages
     */
    public int cleanup() {
        var cutoff = _clock.getAsLong() - _seenTtlMs;
        var before = _seen.size();
        _seen.values().removeIf(t -> t < cutoff);
        var removed = before - _seen.size();
        if (removed > 0)
            LOG.debugv("Forgot {0} seen messages", removed);
        return removed;
    }

    public int seenCount() {
        return _seen.size();
    }

    Set<RoutedMessage.Key> seenKeys() {
        return Set.copyOf(_seen.keySet());
    }

    private void deliver(@Nullable EndpointId from, RoutedMessage message) {
        LOG.tracev("Delivering {0}", message);
        for (var l : _listeners) {
            try {
                l.handleMessage(from, message);
            } catch (Exception e) {
                LOG.errorv(e, "Listener {0} failed to handle {1}", l, message);
            }
        }
    }

    private void forward(@Nullable EndpointId from, RoutedMessage message) {
        var ttl = message.ttl() - 1;
        if (ttl <= 0) {
            LOG.tracev("Not forwarding {0}, no hops left", message);
            return;
        }
        var targets = _store.snapshot().connected().stream()
                .map(DeviceState::endpoint)
                .filter(e -> !e.equals(from))
                .toList();
        if (targets.isEmpty()) return;
        LOG.tracev("Forwarding {0} to {1}", message, targets);
        _transport.sendPayload(targets, _codec.encodeRouted(message.withTtl(ttl)));
    }
}
