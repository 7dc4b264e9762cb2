package com.usatiuk.ringmesh.routing;

import com.usatiuk.ringmesh.peers.EndpointId;

public interface RoutedMessageListener {
    void handleMessage(EndpointId from, RoutedMessage message);
}
