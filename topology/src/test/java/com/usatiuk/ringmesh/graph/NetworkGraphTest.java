package com.usatiuk.ringmesh.graph;

import com.usatiuk.ringmesh.peers.DeviceName;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

public class NetworkGraphTest {
    private static DeviceName n(String name) {
        return DeviceName.of(name);
    }

    private static NetworkGraph randomGraph(Random random) {
        var names = List.of("a", "b", "c", "d", "e", "f");
        var graph = NetworkGraph.empty();
        for (var from : names) {
            if (random.nextBoolean()) continue;
            var neighbors = names.stream().filter(x -> !x.equals(from) && random.nextInt(3) == 0).map(DeviceName::of).toList();
            graph = graph.withNeighbors(n(from), neighbors);
        }
        return graph;
    }

    @Test
    void mergeIsIdempotent() {
        var random = new Random(7);
        for (int i = 0; i < 50; i++) {
            var g = randomGraph(random);
            Assertions.assertEquals(g, g.merge(g));
            Assertions.assertSame(g, g.merge(g));
        }
    }

    @Test
    void mergeIsCommutative() {
        var random = new Random(11);
        for (int i = 0; i < 50; i++) {
            var g = randomGraph(random);
            var a = randomGraph(random);
            var b = randomGraph(random);
            Assertions.assertEquals(g.merge(a).merge(b), g.merge(b).merge(a));
            Assertions.assertEquals(a.merge(b), b.merge(a));
        }
    }

    @Test
    void mergeNeverLosesEdges() {
        var random = new Random(13);
        for (int i = 0; i < 50; i++) {
            var a = randomGraph(random);
            var b = randomGraph(random);
            var merged = a.merge(b);
            for (var g : List.of(a, b)) {
                for (var e : g.adjacency().entrySet()) {
                    Assertions.assertTrue(merged.adjacency().containsKey(e.getKey()));
                    Assertions.assertTrue(merged.neighbors(e.getKey()).containsAll(e.getValue()));
                }
            }
        }
    }

    @Test
    void mergeKeepsDevicesWithoutNeighbors() {
        var a = NetworkGraph.of(Map.of(n("a"), Set.of()));
        var merged = NetworkGraph.empty().merge(a);
        Assertions.assertTrue(merged.adjacency().containsKey(n("a")));
        Assertions.assertEquals(0, merged.degree(n("a")));
    }

    @Test
    void verticesIncludeNeighborsOnly() {
        var g = NetworkGraph.of(Map.of(n("a"), Set.of(n("b"), n("c"))));
        Assertions.assertEquals(Set.of(n("a"), n("b"), n("c")), g.vertices());
        Assertions.assertTrue(g.containsVertex(n("c")));
        Assertions.assertFalse(g.containsVertex(n("d")));
        Assertions.assertTrue(g.hasEdge(n("a"), n("b")));
        Assertions.assertFalse(g.hasEdge(n("b"), n("a")));
    }

    @Test
    void withNeighborsReturnsSameGraphIfUnchanged() {
        var g = NetworkGraph.of(Map.of(n("a"), Set.of(n("b"))));
        Assertions.assertSame(g, g.withNeighbors(n("a"), List.of(n("b"))));
        Assertions.assertNotSame(g, g.withNeighbors(n("a"), List.of(n("c"))));
    }

    @Test
    void withoutRowKeepsIncomingEdges() {
        var g = NetworkGraph.of(Map.of(n("a"), Set.of(n("b")), n("b"), Set.of(n("a"))));
        var without = g.withoutRow(n("a"));
        Assertions.assertFalse(without.adjacency().containsKey(n("a")));
        Assertions.assertTrue(without.hasEdge(n("b"), n("a")));
    }
}
