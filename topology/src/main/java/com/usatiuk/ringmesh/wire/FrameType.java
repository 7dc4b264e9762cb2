package com.usatiuk.ringmesh.wire;

public enum FrameType {
    TOPOLOGY_GOSSIP(FrameTypeP.TOPOLOGY_GOSSIP),
    ROUTED_MESSAGE(FrameTypeP.ROUTED_MESSAGE);

    private final FrameTypeP _proto;

    FrameType(FrameTypeP proto) {
        _proto = proto;
    }

    public FrameTypeP toProto() {
        return _proto;
    }

    public static FrameType fromProto(FrameTypeP proto) {
        return switch (proto) {
            case TOPOLOGY_GOSSIP -> TOPOLOGY_GOSSIP;
            case ROUTED_MESSAGE -> ROUTED_MESSAGE;
            case FRAME_TYPE_UNSPECIFIED, UNRECOGNIZED ->
                    throw new IllegalArgumentException("Unknown frame type " + proto);
        };
    }
}
