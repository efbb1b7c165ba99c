package org.calista.morphon.engine.classify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.morphon.engine.core.InvalidInputException;
import org.calista.morphon.engine.morphology.Decomposer;
import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * ClassTable — lookup table keyed by (prefix family, MIDDLE, suffix family).
 *
 * <p>Built from the reference members of the 49 classes: every member is decomposed
 * and registered under its key. Two classes claiming one key is a contradictory
 * table and fails the load.
 *
 * <p>Besides exact keys, three relaxed indexes carry member support per class:
 * (prefix family, MIDDLE), (MIDDLE, suffix family) and MIDDLE alone.
 */
public final class ClassTable {

    public static final int CLASS_COUNT = 49;

    /** Marker for an absent prefix or suffix family inside a key. */
    public static final String BARE = "-";

    /** Immutable lookup key. */
    public static final class Key {
        public final String prefixFamily;
        public final String middle;
        public final String suffixFamily;

        public Key(String prefixFamily, String middle, String suffixFamily) {
            this.prefixFamily = label(prefixFamily);
            this.middle = Objects.requireNonNull(middle, "middle");
            this.suffixFamily = label(suffixFamily);
        }

        public static Key of(MorphemeComponents c) {
            return new Key(c.prefixFamily(), c.middle(), c.suffixFamily());
        }

        static String label(String family) {
            return family == null ? BARE : family;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key k = (Key) o;
            return prefixFamily.equals(k.prefixFamily) && middle.equals(k.middle) && suffixFamily.equals(k.suffixFamily);
        }

        @Override
        public int hashCode() {
            return Objects.hash(prefixFamily, middle, suffixFamily);
        }

        @Override
        public String toString() {
            return prefixFamily + "|" + middle + "|" + suffixFamily;
        }
    }

    private final String source;
    private final Map<Integer, InstructionClass> classes;
    private final Set<Integer> bareClasses;
    private final Map<Key, Integer> exact;
    private final Map<String, Map<Integer, Integer>> byPrefixMiddle;
    private final Map<String, Map<Integer, Integer>> byMiddleSuffix;
    private final Map<String, Map<Integer, Integer>> byMiddle;

    private ClassTable(String source, Definition def, Decomposer decomposer) {
        this.source = source;

        Map<Integer, InstructionClass> cls = new TreeMap<>();
        Map<Key, Integer> ex = new HashMap<>();
        Map<String, Map<Integer, Integer>> pm = new HashMap<>();
        Map<String, Map<Integer, Integer>> ms = new HashMap<>();
        Map<String, Map<Integer, Integer>> m = new HashMap<>();

        if (def.classes == null) fail("no classes declared");
        for (ClassDef c : def.classes) {
            if (c == null) fail("null class entry");
            if (c.id < 1 || c.id > CLASS_COUNT) fail("class id out of range 1.." + CLASS_COUNT + ": " + c.id);
            if (cls.containsKey(c.id)) fail("duplicate class id " + c.id);
            if (c.members == null || c.members.isEmpty()) fail("class " + c.id + " has no members");

            ClassRole role;
            try {
                role = ClassRole.parse(c.role);
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException(source, "class " + c.id + ": " + e.getMessage(), e);
            }
            cls.put(c.id, new InstructionClass(c.id, role, c.members));

            for (String member : c.members) {
                MorphemeComponents mc = decomposer.decompose(member);
                if (!mc.isParsed()) fail("member '" + member + "' of class " + c.id + " does not decompose (" + mc.failure() + ")");

                Key k = Key.of(mc);
                Integer prev = ex.putIfAbsent(k, c.id);
                if (prev != null && prev != c.id) {
                    fail("key " + k + " (member '" + member + "') is claimed by classes " + prev + " and " + c.id);
                }

                pm.computeIfAbsent(k.prefixFamily + "|" + k.middle, x -> new TreeMap<>()).merge(c.id, 1, Integer::sum);
                ms.computeIfAbsent(k.middle + "|" + k.suffixFamily, x -> new TreeMap<>()).merge(c.id, 1, Integer::sum);
                m.computeIfAbsent(k.middle, x -> new TreeMap<>()).merge(c.id, 1, Integer::sum);
            }
        }
        if (cls.size() != CLASS_COUNT) fail("expected " + CLASS_COUNT + " classes, found " + cls.size());

        Set<Integer> bare = new TreeSet<>();
        if (def.bareClasses != null) {
            for (Integer id : def.bareClasses) {
                if (id == null || !cls.containsKey(id)) fail("bare class " + id + " is not a declared class");
                bare.add(id);
            }
        }

        this.classes = Collections.unmodifiableMap(cls);
        this.bareClasses = Collections.unmodifiableSet(bare);
        this.exact = Collections.unmodifiableMap(ex);
        this.byPrefixMiddle = pm;
        this.byMiddleSuffix = ms;
        this.byMiddle = m;
    }

    public static ClassTable fromJson(String source, String json, ObjectMapper mapper, Decomposer decomposer) {
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(decomposer, "decomposer");
        Definition def;
        try {
            def = mapper.readValue(json, Definition.class);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException(source, "class table is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (def == null) throw new InvalidInputException(source, "class table is empty");
        return new ClassTable(source, def, decomposer);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public String source() { return source; }

    public Map<Integer, InstructionClass> classes() { return classes; }

    public InstructionClass get(int id) { return classes.get(id); }

    public Set<Integer> bareClasses() { return bareClasses; }

    /** @return class id for an exact key, or {@code null} */
    public Integer exact(Key key) {
        return exact.get(key);
    }

    /** classId -> member support for (prefix family, MIDDLE, any suffix). */
    public Map<Integer, Integer> byPrefixMiddle(String prefixFamily, String middle) {
        return view(byPrefixMiddle.get(Key.label(prefixFamily) + "|" + middle));
    }

    /** classId -> member support for (any prefix, MIDDLE, suffix family). */
    public Map<Integer, Integer> byMiddleSuffix(String middle, String suffixFamily) {
        return view(byMiddleSuffix.get(middle + "|" + Key.label(suffixFamily)));
    }

    /** classId -> member support for MIDDLE alone. */
    public Map<Integer, Integer> byMiddle(String middle) {
        return view(byMiddle.get(middle));
    }

    /** All reference members in class order. */
    public List<String> referenceVocabulary() {
        return classes.values().stream()
                .flatMap(c -> c.members().stream())
                .collect(Collectors.toList());
    }

    public int keyCount() {
        return exact.size();
    }

    private static Map<Integer, Integer> view(Map<Integer, Integer> m) {
        return m == null ? Collections.emptyMap() : Collections.unmodifiableMap(m);
    }

    private void fail(String message) {
        throw new InvalidInputException(source, message);
    }

    // ---------------------------------------------------------------------
    // JSON shape
    // ---------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Definition {
        public List<Integer> bareClasses;
        public List<ClassDef> classes;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ClassDef {
        public int id;
        public String role;
        public List<String> members;
    }
}
