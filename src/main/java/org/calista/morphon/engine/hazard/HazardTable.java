package org.calista.morphon.engine.hazard;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.morphon.engine.classify.ClassTable;
import org.calista.morphon.engine.core.InvalidInputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Closed set of directed disfavored transitions over the 49 classes.
 *
 * <p>Exactly {@value #EDGE_COUNT} edges, no duplicates, class ids within range, and per-category
 * counts equal to {@link HazardCategory#expectedCount()}. Edges are taken as declared:
 * nothing here infers or symmetrizes a transition.
 */
public final class HazardTable {

    public static final int EDGE_COUNT = 17;

    private final String source;
    private final List<HazardTransition> transitions;
    private final Map<Long, HazardTransition> byPair;
    private final Map<HazardCategory, Integer> counts;
    private final Set<Integer> sources;

    private HazardTable(String source, List<HazardTransition> declared) {
        this.source = source;

        Map<Long, HazardTransition> pairs = new HashMap<>();
        Map<HazardCategory, Integer> c = new EnumMap<>(HazardCategory.class);
        Set<Integer> from = new TreeSet<>();

        for (HazardTransition t : declared) {
            checkClass(t.from());
            checkClass(t.to());
            if (t.from() == t.to()) fail("self transition C" + t.from() + " is not a valid hazard");
            if (pairs.putIfAbsent(key(t.from(), t.to()), t) != null) fail("duplicate transition " + t);
            c.merge(t.category(), 1, Integer::sum);
            from.add(t.from());
        }

        if (declared.size() != EDGE_COUNT) {
            fail("expected " + EDGE_COUNT + " transitions, found " + declared.size());
        }
        for (HazardCategory cat : HazardCategory.values()) {
            int n = c.getOrDefault(cat, 0);
            if (n != cat.expectedCount()) {
                fail("category " + cat.label() + " must hold " + cat.expectedCount() + " transitions, found " + n);
            }
        }

        this.transitions = Collections.unmodifiableList(new ArrayList<>(declared));
        this.byPair = pairs;
        this.counts = Collections.unmodifiableMap(c);
        this.sources = Collections.unmodifiableSet(from);
    }

    public static HazardTable of(String source, List<HazardTransition> transitions) {
        return new HazardTable(source, Objects.requireNonNull(transitions, "transitions"));
    }

    public static HazardTable fromJson(String source, String json, ObjectMapper mapper) {
        Definition def;
        try {
            def = mapper.readValue(json, Definition.class);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException(source, "hazard table is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.transitions == null) throw new InvalidInputException(source, "hazard table is empty");

        List<HazardTransition> list = new ArrayList<>(def.transitions.size());
        for (TransitionDef d : def.transitions) {
            if (d == null) throw new InvalidInputException(source, "null transition entry");
            HazardCategory cat;
            try {
                cat = HazardCategory.parse(d.category);
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException(source, "C" + d.from + "->C" + d.to + ": " + e.getMessage(), e);
            }
            double sev = (d.severity == null) ? 1.0 : d.severity;
            list.add(new HazardTransition(d.from, d.to, cat, sev, d.exemplar));
        }
        return new HazardTable(source, list);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public String source() { return source; }

    public List<HazardTransition> transitions() { return transitions; }

    public int size() { return transitions.size(); }

    public Optional<HazardTransition> lookup(int from, int to) {
        return Optional.ofNullable(byPair.get(key(from, to)));
    }

    public boolean isDisfavored(int from, int to) {
        return byPair.containsKey(key(from, to));
    }

    public Map<HazardCategory, Integer> countByCategory() { return counts; }

    /** Classes that start at least one declared transition. */
    public Set<Integer> sources() { return sources; }

    private static long key(int from, int to) {
        return ((long) from << 32) | (to & 0xffffffffL);
    }

    private void checkClass(int id) {
        if (id < 1 || id > ClassTable.CLASS_COUNT) fail("class id out of range 1.." + ClassTable.CLASS_COUNT + ": " + id);
    }

    private void fail(String message) {
        throw new InvalidInputException(source, message);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Definition {
        public List<TransitionDef> transitions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class TransitionDef {
        public int from;
        public int to;
        public String category;
        public Double severity;
        public String exemplar;
    }
}
