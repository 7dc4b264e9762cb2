package com.usatiuk.ringmesh.wire;

import com.google.protobuf.Message;

/**
 * Maps a mesh type to the protobuf message it travels as.
 *
 * @param <P> the protobuf message
 * @param <T> the mesh type
 */
public interface ProtoSerializer<P extends Message, T> {
    /**
     * @throws IllegalArgumentException if the message holds a value the mesh type does not allow
     */
    T deserialize(P message);

    P serialize(T object);
}
