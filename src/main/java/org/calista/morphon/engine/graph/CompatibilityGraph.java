package org.calista.morphon.engine.graph;

import org.calista.morphon.engine.classify.ClassTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * CompatibilityGraph — undirected graph over MIDDLE morphemes.
 *
 * <p>Sparse representation: a sorted node index, one {@link BitSet} adjacency row per
 * node, and co-occurrence counts keyed by a packed (low, high) index pair. An edge
 * exists iff its count is at or above the support threshold, so the graph is
 * symmetric by construction and raising the threshold never adds edges.
 *
 * <p>Read-only after construction; shared between workers without locking.
 */
public final class CompatibilityGraph {

    /** Undirected edge, {@code a < b} lexicographically. */
    public static final class Edge {
        public final String a;
        public final String b;
        public final int support;

        Edge(String a, String b, int support) {
            this.a = a;
            this.b = b;
            this.support = support;
        }

        @Override
        public String toString() {
            return a + "~" + b + "(" + support + ")";
        }
    }

    private final String[] nodes;
    private final Map<String, Integer> index;
    private final Map<Long, Integer> counts;
    private final Map<String, String> familyOf;
    private final int threshold;
    private final BitSet[] adjacency;
    private final long edgeCount;

    CompatibilityGraph(String[] sortedNodes, Map<Long, Integer> counts, Map<String, String> familyOf, int threshold) {
        if (threshold < 1) throw new IllegalArgumentException("support threshold must be >= 1: " + threshold);
        this.nodes = sortedNodes;
        this.counts = counts;
        this.familyOf = familyOf;
        this.threshold = threshold;

        Map<String, Integer> idx = new HashMap<>(nodes.length * 2);
        for (int i = 0; i < nodes.length; i++) idx.put(nodes[i], i);
        this.index = idx;

        this.adjacency = new BitSet[nodes.length];
        for (int i = 0; i < nodes.length; i++) adjacency[i] = new BitSet(nodes.length);

        long e = 0;
        for (Map.Entry<Long, Integer> en : counts.entrySet()) {
            if (en.getValue() < threshold) continue;
            int lo = low(en.getKey());
            int hi = high(en.getKey());
            adjacency[lo].set(hi);
            adjacency[hi].set(lo);
            e++;
        }
        this.edgeCount = e;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public int threshold() { return threshold; }

    public int nodeCount() { return nodes.length; }

    public long edgeCount() { return edgeCount; }

    public boolean contains(String middle) {
        return middle != null && index.containsKey(middle);
    }

    public List<String> nodes() {
        return Collections.unmodifiableList(Arrays.asList(nodes));
    }

    /** Same MIDDLE twice is compatible when it is a node. */
    public boolean areCompatible(String m1, String m2) {
        return query(m1, m2) == Compatibility.COMPATIBLE;
    }

    public Compatibility query(String m1, String m2) {
        Integer a = (m1 == null) ? null : index.get(m1);
        Integer b = (m2 == null) ? null : index.get(m2);
        if (a == null || b == null) return Compatibility.UNKNOWN_MORPHEME;
        if (a.equals(b)) return Compatibility.COMPATIBLE;
        return adjacency[a].get(b) ? Compatibility.COMPATIBLE : Compatibility.INCOMPATIBLE;
    }

    /** Co-occurrence count regardless of threshold; 0 for unknown pairs. */
    public int support(String m1, String m2) {
        Integer a = (m1 == null) ? null : index.get(m1);
        Integer b = (m2 == null) ? null : index.get(m2);
        if (a == null || b == null || a.equals(b)) return 0;
        return counts.getOrDefault(pack(a, b), 0);
    }

    public Optional<Set<String>> neighbors(String middle) {
        Integer i = (middle == null) ? null : index.get(middle);
        if (i == null) return Optional.empty();
        Set<String> out = new TreeSet<>();
        BitSet row = adjacency[i];
        for (int j = row.nextSetBit(0); j >= 0; j = row.nextSetBit(j + 1)) out.add(nodes[j]);
        return Optional.of(Collections.unmodifiableSet(out));
    }

    /** Connected component containing {@code middle}; empty for an unknown morpheme. */
    public Optional<Set<String>> connectedComponent(String middle) {
        Integer start = (middle == null) ? null : index.get(middle);
        if (start == null) return Optional.empty();

        BitSet seen = new BitSet(nodes.length);
        Deque<Integer> queue = new ArrayDeque<>();
        seen.set(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            int cur = queue.poll();
            BitSet row = adjacency[cur];
            for (int j = row.nextSetBit(0); j >= 0; j = row.nextSetBit(j + 1)) {
                if (!seen.get(j)) {
                    seen.set(j);
                    queue.add(j);
                }
            }
        }

        Set<String> out = new TreeSet<>();
        for (int j = seen.nextSetBit(0); j >= 0; j = seen.nextSetBit(j + 1)) out.add(nodes[j]);
        return Optional.of(Collections.unmodifiableSet(out));
    }

    /** edges / possible pairs; 0 below two nodes. */
    public double density() {
        return ratio(edgeCount, pairs(nodes.length));
    }

    /** Dominant prefix family of a MIDDLE in the snapshot ({@link ClassTable#BARE} if never prefixed). */
    public String familyOf(String middle) {
        return familyOf.get(middle);
    }

    /** Density of the subgraph induced by each family's MIDDLEs. */
    public Map<String, Double> familyDensity() {
        Map<String, long[]> acc = new TreeMap<>(); // family -> {nodes, edges}
        for (String n : nodes) acc.computeIfAbsent(family(n), f -> new long[2])[0]++;

        for (int i = 0; i < nodes.length; i++) {
            BitSet row = adjacency[i];
            String fi = family(nodes[i]);
            for (int j = row.nextSetBit(i + 1); j >= 0; j = row.nextSetBit(j + 1)) {
                if (fi.equals(family(nodes[j]))) acc.get(fi)[1]++;
            }
        }

        Map<String, Double> out = new TreeMap<>();
        for (Map.Entry<String, long[]> e : acc.entrySet()) {
            out.put(e.getKey(), ratio(e.getValue()[1], pairs(e.getValue()[0])));
        }
        return out;
    }

    /** Density of edges joining MIDDLEs of different families. */
    public double crossFamilyDensity() {
        Map<String, Long> sizes = new HashMap<>();
        for (String n : nodes) sizes.merge(family(n), 1L, Long::sum);

        long within = 0;
        for (long s : sizes.values()) within += pairs(s);
        long crossPairs = pairs(nodes.length) - within;

        long crossEdges = 0;
        for (int i = 0; i < nodes.length; i++) {
            BitSet row = adjacency[i];
            String fi = family(nodes[i]);
            for (int j = row.nextSetBit(i + 1); j >= 0; j = row.nextSetBit(j + 1)) {
                if (!fi.equals(family(nodes[j]))) crossEdges++;
            }
        }
        return ratio(crossEdges, crossPairs);
    }

    /** Edges at the current threshold, sorted by (a, b). */
    public List<Edge> edges() {
        List<Edge> out = new ArrayList<>((int) Math.min(Integer.MAX_VALUE, edgeCount));
        for (int i = 0; i < nodes.length; i++) {
            BitSet row = adjacency[i];
            for (int j = row.nextSetBit(i + 1); j >= 0; j = row.nextSetBit(j + 1)) {
                out.add(new Edge(nodes[i], nodes[j], counts.get(pack(i, j))));
            }
        }
        return out;
    }

    /** Same counts, different threshold. */
    public CompatibilityGraph atThreshold(int newThreshold) {
        if (newThreshold == threshold) return this;
        return new CompatibilityGraph(nodes, counts, familyOf, newThreshold);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private String family(String middle) {
        return Objects.requireNonNullElse(familyOf.get(middle), ClassTable.BARE);
    }

    static long pack(int i, int j) {
        int lo = Math.min(i, j);
        int hi = Math.max(i, j);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }

    private static int low(long key) {
        return (int) (key >>> 32);
    }

    private static int high(long key) {
        return (int) key;
    }

    private static long pairs(long n) {
        return n < 2 ? 0 : n * (n - 1) / 2;
    }

    private static double ratio(long num, long den) {
        return den == 0 ? 0.0 : (double) num / (double) den;
    }
}
