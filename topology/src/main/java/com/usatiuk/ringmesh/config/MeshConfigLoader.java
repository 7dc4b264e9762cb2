package com.usatiuk.ringmesh.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.apache.commons.lang3.Validate;

import java.util.Map;

/**
 * Builds {@link MeshConfig} outside of a container.
 */
public final class MeshConfigLoader {
    private static final int OVERRIDES_ORDINAL = 500;

    private MeshConfigLoader() {
    }

    /**
     * @return the configuration from system properties, environment and {@code META-INF/microprofile-config.properties}
     */
    public static MeshConfig load() {
        return load(Map.of());
    }

    /**
     * @param overrides properties that take precedence over every other source
     * @return the validated configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public static MeshConfig load(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDiscoveredConverters()
                .withSources(new PropertiesConfigSource(overrides, "ringmesh-overrides", OVERRIDES_ORDINAL))
                .withMapping(MeshConfig.class)
                .build();
        var mesh = config.getConfigMapping(MeshConfig.class);
        validate(mesh);
        return mesh;
    }

    static void validate(MeshConfig config) {
        Validate.isTrue(config.maxConnections() > 0, "ringmesh.max-connections must be positive");
        Validate.inclusiveBetween(0.0, 1.0, config.random().churnProbability(),
                "ringmesh.random.churn-probability must be within [0, 1]");
        Validate.isTrue(config.ring().backoffCap() >= 1, "ringmesh.ring.backoff-cap must be at least 1");
        Validate.isTrue(config.random().backoffCap() >= 0, "ringmesh.random.backoff-cap must not be negative");
        Validate.isTrue(config.routing().defaultTtl() > 0, "ringmesh.routing.default-ttl must be positive");
        Validate.isTrue(config.routing().maxPayloadBytes() > 0, "ringmesh.routing.max-payload-bytes must be positive");
        Validate.isTrue(config.gossip().intervalMs() > 0, "ringmesh.gossip.interval-ms must be positive");
    }
}
