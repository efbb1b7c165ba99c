package org.calista.morphon.engine.classify;

import java.util.Locale;

/** What classification does with tokens that failed decomposition. */
public enum UnparsedPolicy {
    /** Unparsed tokens become UNCLASSIFIED and drop out of downstream counts. */
    DROP("drop"),
    /** Unparsed tokens are kept in the overflow bucket. */
    RETAIN_AS_OVERFLOW("retain-as-overflow");

    private final String label;

    UnparsedPolicy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static UnparsedPolicy parse(String s) {
        if (s == null || s.isBlank()) return DROP;
        String v = s.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (UnparsedPolicy p : values()) {
            if (p.label.equals(v)) return p;
        }
        throw new IllegalArgumentException("Unknown unparsed policy: " + s + " (expected drop | retain-as-overflow)");
    }
}
