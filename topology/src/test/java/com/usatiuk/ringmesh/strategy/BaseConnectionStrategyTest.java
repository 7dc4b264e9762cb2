package com.usatiuk.ringmesh.strategy;

import com.usatiuk.ringmesh.ManualScheduler;
import com.usatiuk.ringmesh.graph.NetworkGraph;
import com.usatiuk.ringmesh.peers.ConnectionPhase;
import com.usatiuk.ringmesh.peers.DeviceName;
import com.usatiuk.ringmesh.peers.EndpointId;
import com.usatiuk.ringmesh.peers.MeshStateStore;
import com.usatiuk.ringmesh.transport.Transport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class BaseConnectionStrategyTest {
    private static final DeviceName SELF = DeviceName.of("s");

    private ManualScheduler _scheduler;
    private Transport _transport;
    private MeshStateStore _store;
    private BaseConnectionStrategy _strategy;

    private static DeviceName n(String name) {
        return DeviceName.of(name);
    }

    private static EndpointId e(String name) {
        return EndpointId.of("e-" + name);
    }

    private void connect(String... names) {
        for (var name : names)
            _store.updatePhase(e(name), n(name), ConnectionPhase.CONNECTED);
    }

    private void knownGraph(Map<String, List<String>> rows) {
        var graph = NetworkGraph.empty();
        for (var row : rows.entrySet())
            graph = graph.withNeighbors(n(row.getKey()), row.getValue().stream().map(DeviceName::of).toList());
        _store.mergeGraph(graph);
    }

    @BeforeEach
    void setup() {
        _scheduler = new ManualScheduler();
        _transport = Mockito.mock(Transport.class);
        when(_transport.requestConnection(any(), any())).thenReturn(new CompletableFuture<>());
        _store = new MeshStateStore(SELF, _scheduler.clock());
        _strategy = new BaseConnectionStrategy(_store, _transport, _scheduler, new Random(3), 4,
                5000, 300_000, 0);
    }

    @AfterEach
    void teardown() {
        _strategy.stop();
    }

    @Test
    void dialsCandidateWhenThereIsAFreeSlot() {
        connect("a");
        _store.deviceDiscovered(e("z"), n("z"));
        _strategy.start();
        _scheduler.runPending();

        verify(_transport).requestConnection(SELF, e("z"));
        Assertions.assertEquals(ConnectionPhase.CONNECTING, _store.getDeviceState(e("z")).orElseThrow().phase());
    }

    @Test
    void prefersDevicesMissingFromTheGraph() {
        knownGraph(Map.of("a", List.of("b")));
        _store.deviceDiscovered(e("a"), n("a"));
        _store.deviceDiscovered(e("z"), n("z"));
        Assertions.assertEquals(n("z"), _strategy.pickCandidate(_store.snapshot()).orElseThrow().name());
    }

    @Test
    void dropsOneSideOfTriangleForNovelDevice() {
        connect("a", "b", "c", "d");
        knownGraph(Map.of("a", List.of("s", "b"), "b", List.of("s", "a")));
        _store.deviceDiscovered(e("z"), n("z"));
        _strategy.start();
        _scheduler.runPending();

        var captor = ArgumentCaptor.forClass(EndpointId.class);
        verify(_transport).disconnectFromEndpoint(captor.capture());
        Assertions.assertTrue(Set.of(e("a"), e("b")).contains(captor.getValue()));
        verify(_transport, never()).requestConnection(any(), any());
    }

    @Test
    void keepsConnectionsWithoutTriangle() {
        connect("a", "b", "c", "d");
        knownGraph(Map.of("a", List.of("s"), "b", List.of("s")));
        Assertions.assertFalse(_strategy.tryDisconnectRedundantPeer(e("z")));
        verify(_transport, never()).disconnectFromEndpoint(any());
    }

    @Test
    void knownCandidateDoesNotFreeASlot() {
        connect("a", "b", "c", "d");
        knownGraph(Map.of("a", List.of("s", "b"), "b", List.of("s", "a"), "x", List.of("y")));
        _store.deviceDiscovered(e("x"), n("x"));
        _strategy.manageConnections();
        verify(_transport, never()).disconnectFromEndpoint(any());
    }

    @Test
    void rotationDropsALeafAtCapacity() {
        connect("a", "b", "c", "d");
        knownGraph(Map.of(
                "a", List.of("s"),
                "b", List.of("s", "c"),
                "c", List.of("s", "b"),
                "d", List.of("s")));
        var dropped = _strategy.connectionRotation().orElseThrow();
        Assertions.assertTrue(Set.of(n("a"), n("d")).contains(dropped));
        verify(_transport).disconnectFromEndpoint(e(dropped.value()));
    }

    @Test
    void rotationWaitsForCapacity() {
        connect("a", "b");
        knownGraph(Map.of("a", List.of("s"), "b", List.of("s")));
        Assertions.assertTrue(_strategy.connectionRotation().isEmpty());
        verify(_transport, never()).disconnectFromEndpoint(any());
    }

    @Test
    void admissionRejectsAtCapacity() {
        connect("a", "b", "c", "d");
        _store.updatePhase(e("z"), n("z"), ConnectionPhase.CONNECTING);
        _strategy.onConnectionInitiated(e("z"), n("z"));
        verify(_transport).rejectConnection(e("z"));
    }

    @Test
    void stopCancelsLoops() {
        _strategy.start();
        Assertions.assertEquals(2, _scheduler.queued());
        _strategy.stop();
        Assertions.assertEquals(0, _scheduler.queued());
    }
}
