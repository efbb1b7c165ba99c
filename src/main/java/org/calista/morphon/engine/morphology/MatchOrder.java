package org.calista.morphon.engine.morphology;

import java.util.Locale;

/**
 * Affix candidate ordering used when several affixes match at the same position.
 */
public enum MatchOrder {
    /** Maximal munch: longest affix first, family priority breaks ties. */
    LONGEST_FIRST,
    /** Family priority first, longest member within the family next. */
    FAMILY_FIRST;

    public static MatchOrder parse(String s) {
        if (s == null || s.isBlank()) return LONGEST_FIRST;
        String v = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (MatchOrder m : values()) {
            if (m.name().equals(v)) return m;
        }
        throw new IllegalArgumentException("Unknown match order: " + s);
    }
}
