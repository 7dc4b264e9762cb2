package com.usatiuk.ringmesh.peers;

import com.usatiuk.utils.TaskGroup;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Bounds the time a device may spend in a transitional phase.
 * <p>
 * Every phase change arms a timer for the device. When it fires and the device did not change since,
 * CONNECTING devices move to ERROR with their retry counter incremented,
 * DISCONNECTED and ERROR devices are forgotten until they are discovered again.
 */
public class PhaseWatchdog implements MeshStateListener {
    private static final Logger LOG = Logger.getLogger(PhaseWatchdog.class);

    private final MeshStateStore _store;
    private final TaskGroup _tasks;
    private final long _connectingTimeoutMs;
    private final long _disconnectedTimeoutMs;
    private final long _errorTimeoutMs;
    private final Map<EndpointId, Armed> _armed = new ConcurrentHashMap<>();

    private record Armed(ConnectionPhase phase, long stamp) {
    }

    public PhaseWatchdog(MeshStateStore store, ScheduledExecutorService executor,
                         long connectingTimeoutMs, long disconnectedTimeoutMs, long errorTimeoutMs) {
        _store = store;
        _tasks = new TaskGroup("phase-watchdog", executor);
        _connectingTimeoutMs = connectingTimeoutMs;
        _disconnectedTimeoutMs = disconnectedTimeoutMs;
        _errorTimeoutMs = errorTimeoutMs;
    }

    public void start() {
        if (!_tasks.activate()) return;
        _store.addListener(this);
        handleMeshStateChanged(_store.snapshot());
    }

    public void stop() {
        _store.removeListener(this);
        _tasks.cancelAll();
        _armed.clear();
    }

    /**
     * @param phase the phase
     * @return the time a device may stay in the phase, or -1 if it may stay forever
     */
    public long timeoutFor(ConnectionPhase phase) {
        return switch (phase) {
            case CONNECTING -> _connectingTimeoutMs;
            case DISCONNECTED -> _disconnectedTimeoutMs;
            case ERROR -> _errorTimeoutMs;
            case DISCOVERED, CONNECTED -> -1;
        };
    }

    @Override
    public void handleMeshStateChanged(MeshSnapshot snapshot) {
        if (!_tasks.isActive()) return;

        _armed.keySet().removeIf(e -> snapshot.device(e).isEmpty());

        for (var device : snapshot.allDevices()) {
            var timeout = timeoutFor(device.phase());
            if (timeout < 0) {
                _armed.remove(device.endpoint());
                continue;
            }
            var armed = new Armed(device.phase(), device.lastSeenAt());
            if (armed.equals(_armed.put(device.endpoint(), armed)))
                continue;
            _tasks.schedule(() -> onTimeout(device), timeout);
        }
    }

    private void onTimeout(DeviceState observed) {
        _armed.remove(observed.endpoint(), new Armed(observed.phase(), observed.lastSeenAt()));
        switch (observed.phase()) {
            case CONNECTING -> {
                if (_store.expire(observed, ConnectionPhase.ERROR)) {
                    var retries = _store.incrementRetry(observed.name());
                    LOG.warnv("Connection to {0} timed out, retry count {1}", observed.name(), retries);
                } else {
                    LOG.debugv("Watchdog for {0} is stale", observed);
                }
            }
            case DISCONNECTED, ERROR -> {
                if (_store.expire(observed, null))
                    LOG.debugv("Forgetting {0}", observed);
                else
                    LOG.debugv("Watchdog for {0} is stale", observed);
            }
            default -> LOG.debugv("No timeout for {0}", observed);
        }
    }
}
