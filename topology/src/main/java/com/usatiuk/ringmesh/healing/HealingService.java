package com.usatiuk.ringmesh.healing;

import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.utils.TaskGroup;
import org.jboss.logging.Logger;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Heals partitions of the mesh: periodically discovers for a short window, then only advertises for a long one.
 * Runs regardless of how many connections the strategy holds,
 * so that two separated parts of the mesh eventually see each other.
 */
public class HealingService {
    private static final Logger LOG = Logger.getLogger(HealingService.class);

    public enum Window {
        IDLE,
        DISCOVERING,
        ADVERTISING
    }

    private final Transport _transport;
    private final TaskGroup _tasks;
    private final long _discoveryWindowMs;
    private final long _advertisingWindowMs;
    private volatile Window _window = Window.IDLE;

    public HealingService(Transport transport, ScheduledExecutorService executor,
                          long discoveryWindowMs, long advertisingWindowMs) {
        _transport = transport;
        _tasks = new TaskGroup("healing", executor);
        _discoveryWindowMs = discoveryWindowMs;
        _advertisingWindowMs = advertisingWindowMs;
    }

    public void start() {
        if (!_tasks.activate()) return;
        _tasks.execute(this::beginDiscovery);
    }

    public void stop() {
        _tasks.cancelAll();
        _window = Window.IDLE;
    }

    public Window getWindow() {
        return _window;
    }

    // The next window is scheduled first, a failing transport call must not end the cycle
    private void beginDiscovery() {
        LOG.debug("Starting periodic discovery");
        _window = Window.DISCOVERING;
        _tasks.schedule(this::beginAdvertising, _discoveryWindowMs);
        _transport.startDiscovery();
    }

    private void beginAdvertising() {
        LOG.debug("Discovery window over, advertising only");
        _window = Window.ADVERTISING;
        _tasks.schedule(this::beginDiscovery, _advertisingWindowMs);
        _transport.stopAll();
        _transport.startAdvertising();
    }
}
