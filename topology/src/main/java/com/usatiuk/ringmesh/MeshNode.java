package com.usatiuk.ringmesh;

import com.usatiuk.ringmesh.config.MeshConfig;
import com.usatiuk.ringmesh.gossip.GossipManager;
import com.usatiuk.ringmesh.healing.HealingService;
import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.peers.PhaseWatchdog;
import com.usatiuk.ringmesh.routing.FloodRouter;
import com.usatiuk.ringmesh.strategy.ConnectionStrategies;
import com.usatiuk.ringmesh.strategy.ConnectionStrategy;
import com.usatiuk.ringmesh.transport.MeshEventDispatcher;
import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.ringmesh.transport.TransportListener;
import com.usatiuk.ringmesh.wire.FrameCodec;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.jboss.logging.Logger;

import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * One device of the mesh: wires every component together over a shared scheduler.
 * <p>
 * The transport must deliver its events to {@link #getTransportListener()}.
 */
public class MeshNode {
    private static final Logger LOG = Logger.getLogger(MeshNode.class);
    private static final int SCHEDULER_THREADS = 2;
    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final DeviceName _self;
    private final MeshConfig _config;
    private final ScheduledExecutorService _executor;
    private final boolean _ownsExecutor;

    private final MeshStateStore _store;
    private final PhaseWatchdog _watchdog;
    private final ConnectionStrategy _strategy;
    private final GossipManager _gossipManager;
    private final HealingService _healingService;
    private final FloodRouter _router;
    private final MeshEventDispatcher _dispatcher;

    private boolean _running = false;

    /**
     * Creates a node with its own scheduler, a real clock and a real source of randomness.
     */
    public static MeshNode create(MeshConfig config, DeviceName self, Transport transport) {
        BasicThreadFactory factory = new BasicThreadFactory.Builder()
                .namingPattern("ringmesh-%d")
                .daemon(true)
                .build();
        var executor = Executors.newScheduledThreadPool(SCHEDULER_THREADS, factory);
        return new MeshNode(config, self, transport, executor, true, new Random(), System::currentTimeMillis);
    }

    /**
     * @param executor     the scheduler shared by every component
     * @param ownsExecutor whether {@link #stop()} shuts the scheduler down
     * @param random       the source of every random decision
     * @param clock        the time source of the mesh state and the seen message cache
     */
    public MeshNode(MeshConfig config, DeviceName self, Transport transport, ScheduledExecutorService executor,
                    boolean ownsExecutor, Random random, LongSupplier clock) {
        _self = self;
        _config = config;
        _executor = executor;
        _ownsExecutor = ownsExecutor;

        var codec = new FrameCodec();
        _store = new MeshStateStore(self, clock);
        _watchdog = new PhaseWatchdog(_store, executor,
                config.watchdog().connectingTimeoutMs(),
                config.watchdog().disconnectedTimeoutMs(),
                config.watchdog().errorTimeoutMs());
        _strategy = ConnectionStrategies.create(config.strategy(), config, _store, transport, executor, random);
        _gossipManager = new GossipManager(_store, transport, codec, executor, config.gossip().intervalMs());
        _healingService = new HealingService(transport, executor,
                config.healing().discoveryWindowMs(), config.healing().advertisingWindowMs());
        _router = new FloodRouter(_store, transport, codec, executor, clock,
                config.routing().defaultTtl(), config.routing().seenCacheTtlMs(),
                config.routing().cleanupIntervalMs(), config.routing().maxPayloadBytes());
        _dispatcher = new MeshEventDispatcher(_store, _strategy, _gossipManager, _router, codec);
    }

    public synchronized void start() {
        if (_running) return;
        _running = true;
        LOG.infov("Starting mesh node {0} with {1} strategy", _self, _config.strategy());
        _watchdog.start();
        _router.start();
        _gossipManager.start();
        _healingService.start();
        _strategy.start();
    }

    public synchronized void stop() {
        if (!_running) return;
        _running = false;
        LOG.infov("Stopping mesh node {0}", _self);
        _strategy.stop();
        _healingService.stop();
        _gossipManager.stop();
        _router.stop();
        _watchdog.stop();

        if (!_ownsExecutor) return;
        _executor.shutdownNow();
        try {
            if (!_executor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS))
                LOG.error("Mesh scheduler did not terminate");
        } catch (InterruptedException e) {
            LOG.error("Interrupted while stopping the mesh scheduler");
            Thread.currentThread().interrupt();
        }
    }

    public synchronized boolean isRunning() {
        return _running;
    }

    public DeviceName getSelf() {
        return _self;
    }

    public TransportListener getTransportListener() {
        return _dispatcher;
    }

    public MeshStateStore getStore() {
        return _store;
    }

    public ConnectionStrategy getStrategy() {
        return _strategy;
    }

    public FloodRouter getRouter() {
        return _router;
    }

    public GossipManager getGossipManager() {
        return _gossipManager;
    }

    public HealingService getHealingService() {
        return _healingService;
    }
}
