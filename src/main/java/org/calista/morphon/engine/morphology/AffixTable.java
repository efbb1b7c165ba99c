package org.calista.morphon.engine.morphology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.morphon.engine.core.InvalidInputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered affix inventory: prefix families, suffix families, articulators, the
 * sister relation between prefix families, and the alphabet tokens are drawn from.
 *
 * <p>Validated once at construction; a contradictory table is an
 * {@link InvalidInputException}. Immutable afterwards.
 */
public final class AffixTable {

    /** One affix string with the family it belongs to. */
    public static final class Affix {
        public final String text;
        public final String family;
        public final int priority;

        Affix(String text, String family, int priority) {
            this.text = text;
            this.family = family;
            this.priority = priority;
        }

        @Override
        public String toString() {
            return text + "[" + family + "]";
        }
    }

    private static final Comparator<Affix> LONGEST_FIRST = Comparator
            .comparingInt((Affix a) -> -a.text.length())
            .thenComparingInt(a -> a.priority)
            .thenComparing(a -> a.text);

    private static final Comparator<Affix> FAMILY_FIRST = Comparator
            .comparingInt((Affix a) -> a.priority)
            .thenComparingInt(a -> -a.text.length())
            .thenComparing(a -> a.text);

    private final String source;
    private final String alphabet;
    private final List<String> articulators;
    private final List<Affix> prefixes;
    private final List<Affix> suffixes;
    private final Map<String, String> sisters;
    private final Map<String, String> prefixFamilyByAffix;
    private final Map<String, String> suffixFamilyByAffix;

    private AffixTable(String source, Definition def) {
        this.source = source;

        if (def.alphabet == null || def.alphabet.isEmpty()) fail("alphabet is empty");
        this.alphabet = def.alphabet;

        List<String> arts = new ArrayList<>();
        if (def.articulators != null) {
            for (String a : def.articulators) {
                if (a == null || a.isEmpty()) fail("blank articulator");
                requireAlphabet(a, "articulator");
                if (arts.contains(a)) fail("duplicate articulator '" + a + "'");
                arts.add(a);
            }
        }
        this.articulators = Collections.unmodifiableList(arts);

        this.prefixFamilyByAffix = new HashMap<>();
        this.suffixFamilyByAffix = new HashMap<>();
        this.prefixes = Collections.unmodifiableList(flatten("prefix", def.prefixFamilies, prefixFamilyByAffix));
        this.suffixes = Collections.unmodifiableList(flatten("suffix", def.suffixFamilies, suffixFamilyByAffix));
        this.sisters = Collections.unmodifiableMap(validateSisters(def.sisters));
    }

    // ---------------------------------------------------------------------
    // Loading
    // ---------------------------------------------------------------------

    public static AffixTable fromJson(String source, String json, ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper");
        Definition def;
        try {
            def = mapper.readValue(json, Definition.class);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException(source, "affix table is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (def == null) throw new InvalidInputException(source, "affix table is empty");
        return new AffixTable(source, def);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Programmatic construction, same validation as the JSON path. */
    public static final class Builder {
        private final Definition def = new Definition();

        private Builder() {
            def.prefixFamilies = new ArrayList<>();
            def.suffixFamilies = new ArrayList<>();
            def.articulators = new ArrayList<>();
            def.sisters = new LinkedHashMap<>();
        }

        public Builder alphabet(String alphabet) {
            def.alphabet = alphabet;
            return this;
        }

        public Builder articulators(String... arts) {
            def.articulators.addAll(List.of(arts));
            return this;
        }

        public Builder prefixFamily(String name, int priority, String... members) {
            def.prefixFamilies.add(family(name, priority, members));
            return this;
        }

        public Builder suffixFamily(String name, int priority, String... members) {
            def.suffixFamilies.add(family(name, priority, members));
            return this;
        }

        /** Declares one direction; call twice for a reciprocal pair. */
        public Builder sister(String family, String sisterFamily) {
            def.sisters.put(family, sisterFamily);
            return this;
        }

        public AffixTable build() {
            return new AffixTable("builder", def);
        }

        private static FamilyDef family(String name, int priority, String... members) {
            FamilyDef f = new FamilyDef();
            f.name = name;
            f.priority = priority;
            f.members = new ArrayList<>(List.of(members));
            return f;
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public String source() { return source; }

    public String alphabet() { return alphabet; }

    public List<String> articulators() { return articulators; }

    /** Prefix candidates in the requested match order. */
    public List<Affix> prefixes(MatchOrder order) {
        return sorted(prefixes, order);
    }

    /** Suffix candidates in the requested match order. */
    public List<Affix> suffixes(MatchOrder order) {
        return sorted(suffixes, order);
    }

    public boolean inAlphabet(char c) {
        return alphabet.indexOf(c) >= 0;
    }

    public String prefixFamilyOf(String prefix) {
        return prefixFamilyByAffix.get(prefix);
    }

    public String suffixFamilyOf(String suffix) {
        return suffixFamilyByAffix.get(suffix);
    }

    /** @return sister family of a prefix family, or {@code null} */
    public String sisterOf(String prefixFamily) {
        return prefixFamily == null ? null : sisters.get(prefixFamily);
    }

    // ---------------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------------

    private List<Affix> flatten(String kind, List<FamilyDef> families, Map<String, String> familyByAffix) {
        List<Affix> out = new ArrayList<>();
        if (families == null) return out;

        Map<String, Integer> seenFamilies = new HashMap<>();
        for (FamilyDef f : families) {
            if (f == null || f.name == null || f.name.isBlank()) fail(kind + " family without a name");
            if (seenFamilies.put(f.name, f.priority) != null) fail("duplicate " + kind + " family '" + f.name + "'");
            if (f.members == null || f.members.isEmpty()) fail(kind + " family '" + f.name + "' has no members");

            for (String m : f.members) {
                if (m == null || m.isEmpty()) fail("blank " + kind + " in family '" + f.name + "'");
                requireAlphabet(m, kind);
                String prev = familyByAffix.putIfAbsent(m, f.name);
                if (prev != null) {
                    fail(kind + " '" + m + "' is declared in both '" + prev + "' and '" + f.name + "'");
                }
                out.add(new Affix(m, f.name, f.priority));
            }
        }
        return out;
    }

    private Map<String, String> validateSisters(Map<String, String> declared) {
        Map<String, String> out = new HashMap<>();
        if (declared == null) return out;

        for (Map.Entry<String, String> e : declared.entrySet()) {
            String a = e.getKey();
            String b = e.getValue();
            if (!prefixFamilyByAffixContainsFamily(a)) fail("sister pair names unknown prefix family '" + a + "'");
            if (!prefixFamilyByAffixContainsFamily(b)) fail("sister pair names unknown prefix family '" + b + "'");
            if (a.equals(b)) fail("prefix family '" + a + "' cannot be its own sister");
            if (!a.equals(declared.get(b))) {
                fail("sister pair " + a + " -> " + b + " is not reciprocal");
            }
            out.put(a, b);
        }
        return out;
    }

    private boolean prefixFamilyByAffixContainsFamily(String family) {
        return family != null && prefixFamilyByAffix.containsValue(family);
    }

    private void requireAlphabet(String s, String kind) {
        for (int i = 0; i < s.length(); i++) {
            if (!inAlphabet(s.charAt(i))) fail(kind + " '" + s + "' uses a character outside the alphabet");
        }
    }

    private void fail(String message) {
        throw new InvalidInputException(source, message);
    }

    private static List<Affix> sorted(List<Affix> in, MatchOrder order) {
        List<Affix> out = new ArrayList<>(in);
        out.sort(order == MatchOrder.FAMILY_FIRST ? FAMILY_FIRST : LONGEST_FIRST);
        return out;
    }

    // ---------------------------------------------------------------------
    // JSON shape
    // ---------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Definition {
        public String alphabet;
        public List<String> articulators;
        public List<FamilyDef> prefixFamilies;
        public List<FamilyDef> suffixFamilies;
        public Map<String, String> sisters;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class FamilyDef {
        public String name;
        public int priority;
        public List<String> members;
    }
}
