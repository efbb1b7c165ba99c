package org.calista.morphon.engine.graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.morphon.engine.classify.ClassTable;
import org.calista.morphon.engine.core.Chunks;
import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;

/**
 * Single pass over records: per-chunk counters of unordered MIDDLE pairs co-occurring
 * in one record, merged at one point into the graph's count table.
 *
 * <p>Unparsed components carry no MIDDLE and are skipped. A MIDDLE repeated inside a
 * record counts once for that record.
 */
public final class CompatibilityGraphBuilder {
    private static final Logger log = LogManager.getLogger(CompatibilityGraphBuilder.class);

    private static final int MIN_CHUNK = 64;

    private final int supportThreshold;
    private ExecutorService pool;
    private int parallelism = 1;

    public CompatibilityGraphBuilder(int supportThreshold) {
        if (supportThreshold < 1) throw new IllegalArgumentException("support threshold must be >= 1: " + supportThreshold);
        this.supportThreshold = supportThreshold;
    }

    /** Optional worker pool; without one the build runs inline. */
    public CompatibilityGraphBuilder pool(ExecutorService pool, int parallelism) {
        this.pool = pool;
        this.parallelism = Math.max(1, parallelism);
        return this;
    }

    public CompatibilityGraph build(List<List<MorphemeComponents>> records) {
        // node index + dominant family, sequential
        TreeSet<String> middles = new TreeSet<>();
        Map<String, Map<String, Integer>> familyVotes = new HashMap<>();
        for (List<MorphemeComponents> rec : records) {
            for (MorphemeComponents c : rec) {
                if (!c.isParsed()) continue;
                middles.add(c.middle());
                String f = (c.prefixFamily() == null) ? ClassTable.BARE : c.prefixFamily();
                familyVotes.computeIfAbsent(c.middle(), k -> new TreeMap<>()).merge(f, 1, Integer::sum);
            }
        }

        String[] nodes = middles.toArray(new String[0]);
        Map<String, Integer> index = new HashMap<>(nodes.length * 2);
        for (int i = 0; i < nodes.length; i++) index.put(nodes[i], i);

        // sharded pair counts
        List<Map<Long, Integer>> shards = Chunks.map(pool, parallelism, records, MIN_CHUNK,
                chunk -> countPairs(chunk, index));

        Map<Long, Integer> counts = new HashMap<>();
        for (Map<Long, Integer> shard : shards) {
            for (Map.Entry<Long, Integer> e : shard.entrySet()) counts.merge(e.getKey(), e.getValue(), Integer::sum);
        }

        CompatibilityGraph g = new CompatibilityGraph(nodes, counts, dominantFamilies(familyVotes), supportThreshold);
        log.info("Compatibility graph built: nodes={}, pairsSeen={}, edges={} (threshold={}, shards={})",
                g.nodeCount(), counts.size(), g.edgeCount(), supportThreshold, shards.size());
        return g;
    }

    private static Map<Long, Integer> countPairs(List<List<MorphemeComponents>> chunk, Map<String, Integer> index) {
        Map<Long, Integer> local = new HashMap<>();
        for (List<MorphemeComponents> rec : chunk) {
            TreeSet<Integer> ids = new TreeSet<>();
            for (MorphemeComponents c : rec) {
                if (c.isParsed()) ids.add(index.get(c.middle()));
            }
            Integer[] arr = ids.toArray(new Integer[0]);
            for (int i = 0; i < arr.length; i++) {
                for (int j = i + 1; j < arr.length; j++) {
                    local.merge(CompatibilityGraph.pack(arr[i], arr[j]), 1, Integer::sum);
                }
            }
        }
        return local;
    }

    /** Most frequent prefix family per MIDDLE; ties go to the smallest label. */
    private static Map<String, String> dominantFamilies(Map<String, Map<String, Integer>> votes) {
        Map<String, String> out = new HashMap<>(votes.size() * 2);
        for (Map.Entry<String, Map<String, Integer>> e : votes.entrySet()) {
            String best = null;
            int bestCount = 0;
            for (Map.Entry<String, Integer> v : e.getValue().entrySet()) {
                if (v.getValue() > bestCount) {
                    best = v.getKey();
                    bestCount = v.getValue();
                }
            }
            out.put(e.getKey(), best);
        }
        return out;
    }
}
