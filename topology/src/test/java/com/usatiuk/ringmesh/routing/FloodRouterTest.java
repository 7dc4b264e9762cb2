package com.usatiuk.ringmesh.routing;

import com.google.protobuf.InvalidProtocolBufferException;
import com.usatiuk.ringmesh.ManualScheduler;
import com.usatiuk.ringmesh.peers.ConnectionPhase;
import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.Transport;
import com.usatiuk.ringmesh.wire.FrameCodec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class FloodRouterTest {
    private static final DeviceName SELF = DeviceName.of("me");
    private static final EndpointId A = EndpointId.of("ea");
    private static final EndpointId B = EndpointId.of("eb");
    private static final EndpointId C = EndpointId.of("ec");
    private static final long SEEN_TTL_MS = 300_000;

    private final FrameCodec _codec = new FrameCodec();
    private final List<RoutedMessage> _delivered = new ArrayList<>();
    private ManualScheduler _scheduler;
    private Transport _transport;
    private FloodRouter _router;

    private static RoutedMessage message(String id, String dest, int ttl) {
        return new RoutedMessage(id, "origin", dest, ttl, "hello".getBytes(StandardCharsets.UTF_8));
    }

    @BeforeEach
    void setup() {
        _scheduler = new ManualScheduler();
        _transport = Mockito.mock(Transport.class);
        var store = new MeshStateStore(SELF, _scheduler.clock());
        store.updatePhase(A, DeviceName.of("a"), ConnectionPhase.CONNECTED);
        store.updatePhase(B, DeviceName.of("b"), ConnectionPhase.CONNECTED);
        store.updatePhase(C, DeviceName.of("c"), ConnectionPhase.CONNECTED);
        _router = new FloodRouter(store, _transport, _codec, _scheduler, _scheduler.clock(),
                5, SEEN_TTL_MS, 60_000, 1024);
        _router.addListener((from, m) -> _delivered.add(m));
    }

    @SuppressWarnings("unchecked")
    private ArgumentCaptor<Collection<EndpointId>> targetsCaptor() {
        return ArgumentCaptor.forClass(Collection.class);
    }

    @Test
    void broadcastIsDeliveredAndForwardedToOthers() throws InvalidProtocolBufferException {
        var msg = message("m1", RoutedMessage.BROADCAST, 3);
        Assertions.assertEquals(RouteResult.DELIVERED, _router.handleIncoming(A, msg));
        Assertions.assertEquals(List.of(msg), _delivered);

        var targets = targetsCaptor();
        var bytes = ArgumentCaptor.forClass(byte[].class);
        verify(_transport).sendPayload(targets.capture(), bytes.capture());
        Assertions.assertEquals(Set.of(B, C), Set.copyOf(targets.getValue()));

        var forwarded = _codec.decodeRouted(_codec.decode(bytes.getValue()));
        Assertions.assertEquals(2, forwarded.ttl());
        Assertions.assertTrue(forwarded.contentEquals(msg.withTtl(2)));
    }

    @Test
    void lastHopIsDeliveredButNotForwarded() {
        Assertions.assertEquals(RouteResult.DELIVERED, _router.handleIncoming(A, message("m1", RoutedMessage.BROADCAST, 1)));
        Assertions.assertEquals(1, _delivered.size());
        verify(_transport, never()).sendPayload(any(), any());
    }

    @Test
    void expiredMessageIsDropped() {
        Assertions.assertEquals(RouteResult.EXPIRED, _router.handleIncoming(A, message("m1", RoutedMessage.BROADCAST, 0)));
        Assertions.assertTrue(_delivered.isEmpty());
        Assertions.assertEquals(0, _router.seenCount());
        verify(_transport, never()).sendPayload(any(), any());
    }

    @Test
    void duplicatesAreRecognizedWhateverTheirTtl() {
        Assertions.assertEquals(RouteResult.DELIVERED, _router.handleIncoming(A, message("m1", RoutedMessage.BROADCAST, 4)));
        Assertions.assertEquals(RouteResult.DUPLICATE, _router.handleIncoming(B, message("m1", RoutedMessage.BROADCAST, 2)));
        Assertions.assertEquals(1, _delivered.size());
        verify(_transport, Mockito.times(1)).sendPayload(any(), any());
    }

    @Test
    void messageForUsIsNotForwarded() {
        Assertions.assertEquals(RouteResult.DELIVERED, _router.handleIncoming(A, message("m1", "me", 5)));
        Assertions.assertEquals(1, _delivered.size());
        verify(_transport, never()).sendPayload(any(), any());
    }

    @Test
    void messageForSomeoneElseIsOnlyForwarded() {
        Assertions.assertEquals(RouteResult.FORWARDED, _router.handleIncoming(A, message("m1", "x", 5)));
        Assertions.assertTrue(_delivered.isEmpty());
        var targets = targetsCaptor();
        verify(_transport).sendPayload(targets.capture(), any());
        Assertions.assertEquals(Set.of(B, C), Set.copyOf(targets.getValue()));
    }

    @Test
    void locallyInjectedMessageGoesToEveryNeighbor() {
        _router.handleIncoming(null, message("m1", "x", 5));
        var targets = targetsCaptor();
        verify(_transport).sendPayload(targets.capture(), any());
        Assertions.assertEquals(Set.of(A, B, C), Set.copyOf(targets.getValue()));
    }

    @Test
    void sentMessageIsNotHandledAgain() throws InvalidProtocolBufferException {
        var sent = _router.broadcast("ping".getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals(SELF.value(), sent.sourceId());
        Assertions.assertEquals(5, sent.ttl());

        var bytes = ArgumentCaptor.forClass(byte[].class);
        verify(_transport).broadcast(bytes.capture());
        var echoed = _codec.decodeRouted(_codec.decode(bytes.getValue()));
        Assertions.assertEquals(RouteResult.DUPLICATE, _router.handleIncoming(A, echoed.withTtl(4)));
        Assertions.assertTrue(_delivered.isEmpty());
    }

    @Test
    void oversizedPayloadIsRefused() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> _router.send("x", new byte[1025]));
        verify(_transport, never()).broadcast(any());
        Assertions.assertEquals(0, _router.seenCount());
    }

    @Test
    void seenCacheKeepsOnlyMessageKeys() {
        var msg = message("m1", RoutedMessage.BROADCAST, 3);
        _router.handleIncoming(A, msg);
        var sent = _router.broadcast(new byte[1024]);
        Assertions.assertEquals(Set.of(new RoutedMessage.Key("m1", "origin", RoutedMessage.BROADCAST), sent.key()),
                _router.seenKeys());
    }

    @Test
    void oversizedIncomingMessageIsDropped() {
        var msg = new RoutedMessage("m1", "origin", RoutedMessage.BROADCAST, 3, new byte[1025]);
        Assertions.assertEquals(RouteResult.OVERSIZED, _router.handleIncoming(A, msg));
        Assertions.assertTrue(_delivered.isEmpty());
        Assertions.assertEquals(0, _router.seenCount());
        verify(_transport, never()).sendPayload(any(), any());
    }

    @Test
    void seenCacheForgetsOldMessages() {
        _router.handleIncoming(A, message("m1", "me", 5));
        _scheduler.advance(SEEN_TTL_MS / 2);
        _router.handleIncoming(A, message("m2", "me", 5));
        Assertions.assertEquals(0, _router.cleanup());

        _scheduler.advance(SEEN_TTL_MS / 2 + 1);
        Assertions.assertEquals(1, _router.cleanup());
        Assertions.assertEquals(1, _router.seenCount());
        Assertions.assertEquals(RouteResult.DELIVERED, _router.handleIncoming(A, message("m1", "me", 5)));
    }

    @Test
    void cleanupRunsPeriodically() {
        _router.start();
        _router.handleIncoming(A, message("m1", "me", 5));
        _scheduler.advance(SEEN_TTL_MS + 60_000);
        Assertions.assertEquals(0, _router.seenCount());
        _router.stop();
        Assertions.assertEquals(0, _scheduler.queued());
    }

    @Test
    void failingListenerDoesNotStopDelivery() {
        var router = new FloodRouter(new MeshStateStore(SELF, _scheduler.clock()), _transport, _codec, _scheduler,
                _scheduler.clock(), 5, SEEN_TTL_MS, 60_000, 1024);
        var received = new ArrayList<RoutedMessage>();
        router.addListener((from, m) -> {
            throw new IllegalStateException("broken");
        });
        router.addListener((from, m) -> received.add(m));
        Assertions.assertEquals(RouteResult.DELIVERED, router.handleIncoming(A, message("m1", "me", 5)));
        Assertions.assertEquals(1, received.size());
    }
}
