package com.usatiuk.ringmesh.routing;

/**
 * What the router did with an incoming message.
 */
public enum RouteResult {
    /**
     * Handed to the local listeners, possibly forwarded too.
     */
    DELIVERED,
    /**
     * Not for us, forwarded to the neighbors if it had hops left.
     */
    FORWARDED,
    DUPLICATE,
    EXPIRED,
    /**
     * Payload above the size limit, dropped without being remembered.
     */
    OVERSIZED
}
