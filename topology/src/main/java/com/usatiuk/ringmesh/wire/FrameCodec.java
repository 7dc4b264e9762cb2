package com.usatiuk.ringmesh.wire;

import com.google.protobuf.InvalidProtocolBufferException;
import com.usatiuk.ringmesh.graph.NetworkGraph;
import com.usatiuk.ringmesh.routing.RoutedMessage;

/**
 * Converts the messages of the mesh to and from the bytes sent over the transport.
 */
public class FrameCodec {
    private final NetworkGraphProtoSerializer _graphSerializer = new NetworkGraphProtoSerializer();
    private final RoutedMessageProtoSerializer _messageSerializer = new RoutedMessageProtoSerializer();

    public byte[] encode(TransportFrame frame) {
        return TransportFrameP.newBuilder()
                .setType(frame.type().toProto())
                .setPayload(frame.payload())
                .build()
                .toByteArray();
    }

    /**
     * @param bytes the received bytes
     * @return the frame
     * @throws InvalidProtocolBufferException if the bytes are not a frame of a known type
     */
    public TransportFrame decode(byte[] bytes) throws InvalidProtocolBufferException {
        var proto = TransportFrameP.parseFrom(bytes);
        try {
            return new TransportFrame(FrameType.fromProto(proto.getType()), proto.getPayload());
        } catch (IllegalArgumentException e) {
            throw new InvalidProtocolBufferException(e.getMessage());
        }
    }

    public byte[] encodeGossip(NetworkGraph graph) {
        return encode(new TransportFrame(FrameType.TOPOLOGY_GOSSIP, _graphSerializer.serialize(graph).toByteString()));
    }

    /**
     * @throws InvalidProtocolBufferException also if the graph names a blank device
     */
    public NetworkGraph decodeGossip(TransportFrame frame) throws InvalidProtocolBufferException {
        checkType(frame, FrameType.TOPOLOGY_GOSSIP);
        var proto = TopologyGossipP.parseFrom(frame.payload());
        try {
            return _graphSerializer.deserialize(proto);
        } catch (IllegalArgumentException e) {
            throw new InvalidProtocolBufferException("Malformed gossip: " + e.getMessage());
        }
    }

    public byte[] encodeRouted(RoutedMessage message) {
        return encode(new TransportFrame(FrameType.ROUTED_MESSAGE, _messageSerializer.serialize(message).toByteString()));
    }

    /**
     * @throws InvalidProtocolBufferException also if the envelope misses a mandatory id
     */
    public RoutedMessage decodeRouted(TransportFrame frame) throws InvalidProtocolBufferException {
        checkType(frame, FrameType.ROUTED_MESSAGE);
        var proto = RoutedMessageP.parseFrom(frame.payload());
        try {
            return _messageSerializer.deserialize(proto);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidProtocolBufferException("Malformed routed message: " + e.getMessage());
        }
    }

    private static void checkType(TransportFrame frame, FrameType expected) {
        if (frame.type() != expected)
            throw new IllegalArgumentException("Expected a " + expected + " frame, got " + frame.type());
    }
}
