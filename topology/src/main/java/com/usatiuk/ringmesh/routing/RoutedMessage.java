package com.usatiuk.ringmesh.routing;

import com.usatiuk.ringmesh.peers.DeviceName;
import org.apache.commons.lang3.Validate;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope of a message flooded through the mesh.
 * <p>
 * Two copies of the same message are equal whatever their remaining time to live,
 * equality and hash code only cover the message id, the source and the destination.
 */
public final class RoutedMessage {
    public static final String BROADCAST = "BROADCAST";

    private final String _messageId;
    private final String _sourceId;
    private final String _destId;
    private final int _ttl;
    private final byte[] _payload;

    public RoutedMessage(String messageId, String sourceId, String destId, int ttl, byte[] payload) {
        Validate.notBlank(messageId, "Message id must not be blank");
        Validate.notBlank(sourceId, "Source id must not be blank");
        Validate.notBlank(destId, "Destination id must not be blank");
        _messageId = messageId;
        _sourceId = sourceId;
        _destId = destId;
        _ttl = ttl;
        _payload = Objects.requireNonNull(payload, "payload");
    }

    /**
     * Creates a new message with a random id.
     */
    public static RoutedMessage create(DeviceName source, String destId, int ttl, byte[] payload) {
        return new RoutedMessage(UUID.randomUUID().toString(), source.value(), destId, ttl, payload);
    }

    public String messageId() {
        return _messageId;
    }

    public String sourceId() {
        return _sourceId;
    }

    public String destId() {
        return _destId;
    }

    public int ttl() {
        return _ttl;
    }

    public byte[] payload() {
        return _payload;
    }

    public boolean isBroadcast() {
        return BROADCAST.equals(_destId);
    }

    public boolean isAddressedTo(DeviceName device) {
        return _destId.equals(device.value());
    }

    /**
     * @return what identifies this message across its copies
     */
    public Key key() {
        return new Key(_messageId, _sourceId, _destId);
    }

    /**
     * @param ttl the remaining time to live
     * @return a copy of this message with the given time to live
     */
    public RoutedMessage withTtl(int ttl) {
        return new RoutedMessage(_messageId, _sourceId, _destId, ttl, _payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoutedMessage that)) return false;
        return _messageId.equals(that._messageId)
                && _sourceId.equals(that._sourceId)
                && _destId.equals(that._destId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_messageId, _sourceId, _destId);
    }

    @Override
    public String toString() {
        return "RoutedMessage{" +
                "id=" + _messageId +
                ", from=" + _sourceId +
                ", to=" + _destId +
                ", ttl=" + _ttl +
                ", payload=" + _payload.length + " bytes" +
                '}';
    }

    public record Key(String messageId, String sourceId, String destId) {
    }

    /**
     * Compares everything including the time to live and the payload.
     */
    public boolean contentEquals(RoutedMessage other) {
        return equals(other) && _ttl == other._ttl && Arrays.equals(_payload, other._payload);
    }
}
