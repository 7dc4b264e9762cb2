package com.usatiuk.ringmesh.wire;

import com.usatiuk.ringmesh.graph.NetworkGraph;
import com.usatiuk.ringmesh.peers.DeviceName;
import org.pcollections.HashTreePMap;
import org.pcollections.HashTreePSet;
import org.pcollections.PMap;
import org.pcollections.PSet;

public class NetworkGraphProtoSerializer implements ProtoSerializer<TopologyGossipP, NetworkGraph> {
    @Override
    public NetworkGraph deserialize(TopologyGossipP message) {
        PMap<DeviceName, PSet<DeviceName>> adjacency = HashTreePMap.empty();
        for (var e : message.getDataMap().entrySet()) {
            PSet<DeviceName> neighbors = HashTreePSet.empty();
            for (var n : e.getValue().getNeighborsList())
                neighbors = neighbors.plus(DeviceName.of(n));
            adjacency = adjacency.plus(DeviceName.of(e.getKey()), neighbors);
        }
        return new NetworkGraph(adjacency);
    }

    @Override
    public TopologyGossipP serialize(NetworkGraph object) {
        var builder = TopologyGossipP.newBuilder();
        for (var e : object.adjacency().entrySet()) {
            var set = NeighborSetP.newBuilder();
            e.getValue().stream().sorted().forEach(n -> set.addNeighbors(n.value()));
            builder.putData(e.getKey().value(), set.build());
        }
        return builder.build();
    }
}
