package com.usatiuk.ringmesh.strategy;

public enum StrategyType {
    /**
     * Fill to capacity, prune triangles, rotate leaves.
     */
    BASE,
    /**
     * Successor, predecessor and opposite of a ring ordered by device name.
     */
    RING,
    /**
     * Fill to capacity, randomly drop connections.
     */
    RANDOM
}
