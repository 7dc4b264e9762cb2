package com.usatiuk.ringmesh.gossip;

import com.usatiuk.ringmesh.graph.NetworkGraph;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.ringmesh.wire.FrameCodec;
import com.usatiuk.utils.TaskGroup;
import org.jboss.logging.Logger;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Anti-entropy for the network graph: periodically broadcasts the local graph,
 * and merges the graphs received from the neighbors into it.
 */
public class GossipManager {
    private static final Logger LOG = Logger.getLogger(GossipManager.class);

    private final MeshStateStore _store;
    private final Transport _transport;
    private final FrameCodec _codec;
    private final TaskGroup _tasks;
    private final long _intervalMs;

    public GossipManager(MeshStateStore store, Transport transport, FrameCodec codec,
                         ScheduledExecutorService executor, long intervalMs) {
        _store = store;
        _transport = transport;
        _codec = codec;
        _tasks = new TaskGroup("gossip", executor);
        _intervalMs = intervalMs;
    }

    public void start() {
        if (!_tasks.activate()) return;
        _tasks.loop(0, () -> _intervalMs, this::gossip);
    }

    public void stop() {
        _tasks.cancelAll();
    }

    /**
     * Broadcasts the local graph, unless it is empty.
     *
     * @return true if something was sent
     */
    public boolean gossip() {
        var graph = _store.networkGraph();
        if (graph.isEmpty()) {
            LOG.trace("Nothing to gossip");
            return false;
        }
        LOG.tracev("Gossiping graph of {0} devices", graph.adjacency().size());
        _transport.broadcast(_codec.encodeGossip(graph));
        return true;
    }

    /**
     * @param from  the endpoint the graph came from
     * @param graph the received graph
     * @return true if the local graph changed
     */
    public boolean handleGossip(EndpointId from, NetworkGraph graph) {
        var changed = _store.mergeGraph(graph);
        if (changed)
            LOG.debugv("Merged graph from {0}, now {1} devices", from, _store.networkGraph().vertices().size());
        return changed;
    }
}
