package org.calista.morphon.engine.graph;

import org.calista.morphon.engine.Fixtures;
import org.calista.morphon.engine.morphology.Decomposer;
import org.calista.morphon.engine.morphology.MorphemeComponents;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.Assert.*;

public class CompatibilityGraphTest {

    private static final double EPS = 1e-9;

    private final Decomposer decomposer = Fixtures.decomposer();

    private List<List<MorphemeComponents>> records(List<List<String>> raw) {
        List<List<MorphemeComponents>> out = new ArrayList<>();
        for (List<String> r : raw) out.add(decomposer.decomposeAll(r));
        return out;
    }

    // middles: chol -> ol, shey -> ey, daiin -> iin
    private List<List<MorphemeComponents>> small() {
        return records(List.of(
                List.of("chol", "shey"),
                List.of("chol", "shey"),
                List.of("chol", "daiin")));
    }

    @Test
    public void testEdgesAtThresholdOne() {
        CompatibilityGraph g = new CompatibilityGraphBuilder(1).build(small());
        assertEquals(List.of("ey", "iin", "ol"), g.nodes());
        assertEquals(2, g.edgeCount());
        assertEquals(Compatibility.COMPATIBLE, g.query("ol", "ey"));
        assertEquals(Compatibility.COMPATIBLE, g.query("ol", "iin"));
        assertEquals(Compatibility.INCOMPATIBLE, g.query("ey", "iin"));
        assertEquals(2, g.support("ey", "ol"));
        assertEquals(1, g.support("iin", "ol"));
    }

    @Test
    public void testHigherThresholdDropsWeakEdges() {
        CompatibilityGraph g = new CompatibilityGraphBuilder(2).build(small());
        assertEquals(1, g.edgeCount());
        assertTrue(g.areCompatible("ey", "ol"));
        assertFalse(g.areCompatible("iin", "ol"));
        // support is kept regardless of threshold
        assertEquals(1, g.support("iin", "ol"));

        CompatibilityGraph same = new CompatibilityGraphBuilder(1).build(small()).atThreshold(2);
        assertEquals(1, same.edgeCount());
    }

    @Test
    public void testSymmetry() {
        CompatibilityGraph g = new CompatibilityGraphBuilder(1).build(small());
        for (String a : g.nodes()) {
            for (String b : g.nodes()) {
                assertEquals(a + "/" + b, g.query(a, b), g.query(b, a));
                assertEquals(g.support(a, b), g.support(b, a));
            }
        }
    }

    @Test
    public void testUnknownMorpheme() {
        CompatibilityGraph g = new CompatibilityGraphBuilder(1).build(small());
        assertEquals(Compatibility.UNKNOWN_MORPHEME, g.query("ol", "zz"));
        assertEquals(Compatibility.UNKNOWN_MORPHEME, g.query(null, "ol"));
        assertFalse(g.areCompatible("zz", "zz"));
        assertTrue(g.areCompatible("ol", "ol"));
        assertFalse(g.connectedComponent("zz").isPresent());
        assertFalse(g.neighbors("zz").isPresent());
        assertEquals(0, g.support("zz", "ol"));
    }

    @Test
    public void testConnectedComponents() {
        assertEquals(Set.of("ey", "iin", "ol"),
                new CompatibilityGraphBuilder(1).build(small()).connectedComponent("ey").get());
        assertEquals(Set.of("ey", "ol"),
                new CompatibilityGraphBuilder(2).build(small()).connectedComponent("ey").get());
        assertEquals(Set.of("iin"),
                new CompatibilityGraphBuilder(2).build(small()).connectedComponent("iin").get());
    }

    @Test
    public void testDensities() {
        CompatibilityGraph g = new CompatibilityGraphBuilder(1).build(small());
        assertEquals(2.0 / 3.0, g.density(), EPS);
        // ch, sh, da: one MIDDLE per family, every edge crosses families
        assertEquals(2.0 / 3.0, g.crossFamilyDensity(), EPS);
        Map<String, Double> fd = g.familyDensity();
        assertEquals(3, fd.size());
        for (double d : fd.values()) assertEquals(0.0, d, EPS);
        assertEquals("ch", g.familyOf("ol"));
    }

    @Test
    public void testUnparsedTokensAreIgnored() {
        CompatibilityGraph g = new CompatibilityGraphBuilder(1)
                .build(records(List.of(List.of("chol", "y*dy"), List.of("shey"))));
        assertEquals(List.of("ey", "ol"), g.nodes());
        assertEquals(0, g.edgeCount());
        assertEquals(0.0, g.density(), EPS);
    }

    @Test
    public void testEdgesAreSorted() {
        List<CompatibilityGraph.Edge> edges = new CompatibilityGraphBuilder(1).build(small()).edges();
        assertEquals(2, edges.size());
        assertEquals("ey", edges.get(0).a);
        assertEquals("ol", edges.get(0).b);
        assertEquals(2, edges.get(0).support);
        assertEquals("iin", edges.get(1).a);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThresholdBelowOneRejected() {
        new CompatibilityGraphBuilder(0);
    }

    @Test
    public void testParallelBuildMatchesSequential() throws Exception {
        String[] vocab = {"chol", "shey", "daiin", "qokaiin", "okedy", "chedy", "dar", "ykar", "shckhy", "qotedy"};
        List<List<String>> raw = new ArrayList<>();
        for (int i = 0; i < 130; i++) {
            raw.add(List.of(vocab[i % vocab.length], vocab[(i * 3 + 1) % vocab.length], vocab[(i * 7 + 2) % vocab.length]));
        }
        List<List<MorphemeComponents>> recs = records(raw);

        CompatibilityGraph seq = new CompatibilityGraphBuilder(1).build(recs);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CompatibilityGraph par = new CompatibilityGraphBuilder(1).pool(pool, 2).build(recs);
            assertEquals(seq.nodes(), par.nodes());
            assertEquals(seq.edgeCount(), par.edgeCount());
            assertEquals(seq.edges().toString(), par.edges().toString());
        } finally {
            pool.shutdownNow();
        }
    }
}
