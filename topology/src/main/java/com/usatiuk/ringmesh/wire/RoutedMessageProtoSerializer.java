package com.usatiuk.ringmesh.wire;

import com.google.protobuf.ByteString;
import com.usatiuk.ringmesh.routing.RoutedMessage;

public class RoutedMessageProtoSerializer implements ProtoSerializer<RoutedMessageP, RoutedMessage> {
    @Override
    public RoutedMessage deserialize(RoutedMessageP message) {
        return new RoutedMessage(message.getMessageId(), message.getSourceId(), message.getDestId(),
                message.getTtl(), message.getPayload().toByteArray());
    }

    @Override
    public RoutedMessageP serialize(RoutedMessage object) {
        return RoutedMessageP.newBuilder()
                .setMessageId(object.messageId())
                .setSourceId(object.sourceId())
                .setDestId(object.destId())
                .setTtl(object.ttl())
                .setPayload(ByteString.copyFrom(object.payload()))
                .build();
    }
}
