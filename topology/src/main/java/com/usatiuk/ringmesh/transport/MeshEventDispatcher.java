package com.usatiuk.ringmesh.transport;

import com.google.protobuf.InvalidProtocolBufferException;
import com.usatiuk.ringmesh.gossip.GossipManager;
import com.usatiuk.ringmesh.peers.ConnectionPhase;
import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.routing.FloodRouter;
import com.usatiuk.ringmesh.strategy.ConnectionStrategy;
import com.usatiuk.ringmesh.wire.FrameCodec;
import org.jboss.logging.Logger;

/**
 * Applies transport events to the mesh state, then hands them to the component responsible for them.
 */
public class MeshEventDispatcher implements TransportListener {
    private static final Logger LOG = Logger.getLogger(MeshEventDispatcher.class);

    private final MeshStateStore _store;
    private final ConnectionStrategy _strategy;
    private final GossipManager _gossipManager;
    private final FloodRouter _router;
    private final FrameCodec _codec;

    public MeshEventDispatcher(MeshStateStore store, ConnectionStrategy strategy, GossipManager gossipManager,
                               FloodRouter router, FrameCodec codec) {
        _store = store;
        _strategy = strategy;
        _gossipManager = gossipManager;
        _router = router;
        _codec = codec;
    }

    @Override
    public void onEndpointFound(EndpointId endpoint, DeviceName name) {
        if (name.equals(_store.self())) {
            LOG.debugv("Ignoring our own endpoint {0}", endpoint);
            return;
        }
        LOG.debugv("Found {0} at {1}", name, endpoint);
        _store.deviceDiscovered(endpoint, name);
    }

    @Override
    public void onEndpointLost(EndpointId endpoint) {
        _store.remove(endpoint).ifPresent(d -> LOG.debugv("Lost {0}", d));
    }

    @Override
    public void onConnectionInitiated(EndpointId endpoint, DeviceName remoteName) {
        _store.updatePhase(endpoint, remoteName, ConnectionPhase.CONNECTING);
        _strategy.onConnectionInitiated(endpoint, remoteName);
    }

    @Override
    public void onConnectionResult(EndpointId endpoint, ConnectionStatus status) {
        if (status.isSuccess()) {
            _store.updatePhase(endpoint, ConnectionPhase.CONNECTED)
                    .ifPresent(d -> LOG.infov("Connected to {0}", d.name()));
        } else {
            // Retries count failed attempts of our own only
            var dialed = _strategy.isDialing(endpoint);
            _store.getDeviceState(endpoint).ifPresent(d -> {
                if (dialed) {
                    var retries = _store.incrementRetry(d.name());
                    LOG.warnv("Connection to {0} failed with {1}, retry count {2}", d.name(), status, retries);
                } else {
                    LOG.infov("Inbound connection from {0} ended with {1}", d.name(), status);
                }
            });
            _store.updatePhase(endpoint, ConnectionPhase.ERROR);
        }
        _strategy.onConnectionResult(endpoint, status.isSuccess());
    }

    @Override
    public void onDisconnected(EndpointId endpoint) {
        _store.updatePhase(endpoint, ConnectionPhase.DISCONNECTED)
                .ifPresent(d -> LOG.infov("Disconnected from {0}", d.name()));
        _strategy.onDisconnected(endpoint);
    }

    @Override
    public void onPayloadReceived(EndpointId endpoint, byte[] payload) {
        try {
            var frame = _codec.decode(payload);
            switch (frame.type()) {
                case TOPOLOGY_GOSSIP -> _gossipManager.handleGossip(endpoint, _codec.decodeGossip(frame));
                case ROUTED_MESSAGE -> {
                    var result = _router.handleIncoming(endpoint, _codec.decodeRouted(frame));
                    LOG.tracev("Routed message from {0}: {1}", endpoint, result);
                }
            }
        } catch (InvalidProtocolBufferException e) {
            LOG.warnv("Dropping malformed frame of {0} bytes from {1}: {2}", payload.length, endpoint, e.getMessage());
        }
    }
}
