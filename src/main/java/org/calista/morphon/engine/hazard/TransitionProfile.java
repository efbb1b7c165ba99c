package org.calista.morphon.engine.hazard;

import org.calista.morphon.engine.classify.ClassifiedToken;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Member-level transition frequencies: for every (from class, to class) pair, how often
 * each concrete token pair realized it. Classes are not interchangeable downstream, so
 * two members of one class can show very different successors.
 *
 * <p>Not thread-safe; build one per worker and {@link #merge} them.
 */
public final class TransitionProfile {

    private final Map<Long, Map<String, Integer>> byClassPair = new HashMap<>();
    private long total;

    public void add(List<ClassifiedToken> sequence) {
        for (int i = 0; i + 1 < sequence.size(); i++) {
            ClassifiedToken a = sequence.get(i);
            ClassifiedToken b = sequence.get(i + 1);
            if (!a.isClassified() || !b.isClassified()) continue;
            byClassPair.computeIfAbsent(key(a.classId(), b.classId()), k -> new TreeMap<>())
                    .merge(a.token() + ">" + b.token(), 1, Integer::sum);
            total++;
        }
    }

    public TransitionProfile merge(TransitionProfile other) {
        for (Map.Entry<Long, Map<String, Integer>> e : other.byClassPair.entrySet()) {
            Map<String, Integer> dst = byClassPair.computeIfAbsent(e.getKey(), k -> new TreeMap<>());
            for (Map.Entry<String, Integer> m : e.getValue().entrySet()) dst.merge(m.getKey(), m.getValue(), Integer::sum);
        }
        total += other.total;
        return this;
    }

    /** Class-level count for {@code from -> to}. */
    public int classTransitions(int from, int to) {
        Map<String, Integer> m = byClassPair.get(key(from, to));
        if (m == null) return 0;
        int n = 0;
        for (int v : m.values()) n += v;
        return n;
    }

    /** "fromToken>toToken" -> count, sorted by token pair. */
    public Map<String, Integer> memberTransitions(int from, int to) {
        Map<String, Integer> m = byClassPair.get(key(from, to));
        return m == null ? Collections.emptyMap() : Collections.unmodifiableMap(m);
    }

    public long total() { return total; }

    private static long key(int from, int to) {
        return ((long) from << 32) | (to & 0xffffffffL);
    }
}
