package org.calista.morphon.engine.legality;

import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/** MIDDLE / PREFIX / SUFFIX values in use by one record. Unparsed tokens contribute nothing. */
public final class VocabularyBundle {

    private static final VocabularyBundle EMPTY = new VocabularyBundle(Set.of(), Set.of(), Set.of());

    private final Set<String> middles;
    private final Set<String> prefixes;
    private final Set<String> suffixes;

    private VocabularyBundle(Set<String> middles, Set<String> prefixes, Set<String> suffixes) {
        this.middles = Collections.unmodifiableSet(new TreeSet<>(middles));
        this.prefixes = Collections.unmodifiableSet(new TreeSet<>(prefixes));
        this.suffixes = Collections.unmodifiableSet(new TreeSet<>(suffixes));
    }

    public static VocabularyBundle of(Collection<String> middles, Collection<String> prefixes, Collection<String> suffixes) {
        return new VocabularyBundle(
                new TreeSet<>(Objects.requireNonNull(middles, "middles")),
                new TreeSet<>(Objects.requireNonNull(prefixes, "prefixes")),
                new TreeSet<>(Objects.requireNonNull(suffixes, "suffixes")));
    }

    public static VocabularyBundle fromComponents(Collection<MorphemeComponents> components) {
        Set<String> m = new TreeSet<>();
        Set<String> p = new TreeSet<>();
        Set<String> s = new TreeSet<>();
        for (MorphemeComponents c : components) {
            if (!c.isParsed()) continue;
            m.add(c.middle());
            if (c.hasPrefix()) p.add(c.prefix());
            if (c.hasSuffix()) s.add(c.suffix());
        }
        return new VocabularyBundle(m, p, s);
    }

    public static VocabularyBundle empty() { return EMPTY; }

    public Set<String> middles() { return middles; }
    public Set<String> prefixes() { return prefixes; }
    public Set<String> suffixes() { return suffixes; }

    /** Total distinct values; used to rank how specific a vocabulary is. */
    public int size() {
        return middles.size() + prefixes.size() + suffixes.size();
    }

    public boolean isEmpty() { return size() == 0; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VocabularyBundle)) return false;
        VocabularyBundle b = (VocabularyBundle) o;
        return middles.equals(b.middles) && prefixes.equals(b.prefixes) && suffixes.equals(b.suffixes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(middles, prefixes, suffixes);
    }

    @Override
    public String toString() {
        return "Vocabulary{M=" + middles + ", P=" + prefixes + ", S=" + suffixes + "}";
    }
}
