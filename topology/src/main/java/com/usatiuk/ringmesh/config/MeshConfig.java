package com.usatiuk.ringmesh.config;

import com.usatiuk.ringmesh.strategy.StrategyType;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "ringmesh")
public interface MeshConfig {
    /**
     * Maximum number of simultaneously connected peers.
     */
    @WithDefault("4")
    int maxConnections();

    @WithDefault("RANDOM")
    StrategyType strategy();

    Base base();

    Ring ring();

    Random random();

    Gossip gossip();

    Healing healing();

    Watchdog watchdog();

    Routing routing();

    interface Base {
        @WithDefault("5000")
        long manageIntervalMs();

        @WithDefault("300000")
        long rotationIntervalMs();

        @WithDefault("60000")
        long rotationJitterMs();
    }

    interface Ring {
        @WithDefault("60000")
        long stabilityDebounceMs();

        @WithDefault("2000")
        long backoffBaseMs();

        @WithDefault("6")
        int backoffCap();

        @WithDefault("2000")
        long backoffJitterMs();

        /**
         * Stop discovering once the ring was stable for a whole debounce window.
         */
        @WithDefault("false")
        boolean reduceDiscoveryWhenStable();
    }

    interface Random {
        @WithDefault("5000")
        long loopIntervalMs();

        @WithDefault("5000")
        long loopJitterMs();

        @WithDefault("0.1")
        double churnProbability();

        @WithDefault("1000")
        long backoffBaseMs();

        @WithDefault("5")
        int backoffCap();
    }

    interface Gossip {
        @WithDefault("30000")
        long intervalMs();
    }

    interface Healing {
        @WithDefault("15000")
        long discoveryWindowMs();

        @WithDefault("300000")
        long advertisingWindowMs();
    }

    interface Watchdog {
        @WithDefault("30000")
        long connectingTimeoutMs();

        @WithDefault("30000")
        long disconnectedTimeoutMs();

        @WithDefault("30000")
        long errorTimeoutMs();
    }

    interface Routing {
        @WithDefault("10")
        int defaultTtl();

        @WithDefault("600000")
        long seenCacheTtlMs();

        @WithDefault("60000")
        long cleanupIntervalMs();

        @WithDefault("32768")
        int maxPayloadBytes();
    }
}
