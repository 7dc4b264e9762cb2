package com.usatiuk.ringmesh.wire;

import com.google.protobuf.ByteString;

/**
 * The tagged envelope every payload exchanged over the transport is wrapped in.
 *
 * @param type    what the payload holds
 * @param payload the encoded message
 */
public record TransportFrame(FrameType type, ByteString payload) {
}
