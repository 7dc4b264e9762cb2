package com.usatiuk.ringmesh.strategy;

import com.usatiuk.ringmesh.config.MeshConfig;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.Transport;

import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Creates the configured strategy.
 */
public final class ConnectionStrategies {
    private ConnectionStrategies() {
    }

    public static ConnectionStrategy create(StrategyType type, MeshConfig config, MeshStateStore store,
                                            Transport transport, ScheduledExecutorService executor, Random random) {
        return switch (type) {
            case BASE -> new BaseConnectionStrategy(store, transport, executor, random, config.maxConnections(),
                    config.base().manageIntervalMs(), config.base().rotationIntervalMs(),
                    config.base().rotationJitterMs());
            case RING -> new RingConnectionStrategy(store, transport, executor, random, config.maxConnections(),
                    ExponentialBackoff.ring(config.ring().backoffBaseMs(), config.ring().backoffCap(),
                            config.ring().backoffJitterMs()),
                    config.ring().stabilityDebounceMs(), config.ring().reduceDiscoveryWhenStable());
            case RANDOM -> new RandomConnectionStrategy(store, transport, executor, random, config.maxConnections(),
                    config.random().loopIntervalMs(), config.random().loopJitterMs(),
                    config.random().churnProbability(),
                    ExponentialBackoff.random(config.random().backoffBaseMs(), config.random().backoffCap()));
        };
    }
}
