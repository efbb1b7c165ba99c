package org.calista.morphon.engine.corpus;

import java.util.Locale;

/**
 * Mutually exclusive record tag. Only {@link #EXECUTABLE} records are classified
 * and checked for hazards; the compatibility graph spans all three.
 */
public enum SystemTag {
    EXECUTABLE("executable", "b"),
    REGISTRY("registry", "a"),
    POSITIONAL("positional", "azc");

    private final String label;
    private final String alias;

    SystemTag(String label, String alias) {
        this.label = label;
        this.alias = alias;
    }

    public String label() {
        return label;
    }

    public static SystemTag parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("Missing system tag");
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (SystemTag t : values()) {
            if (t.label.equals(v) || t.alias.equals(v)) return t;
        }
        throw new IllegalArgumentException("Unknown system tag: " + s);
    }
}
