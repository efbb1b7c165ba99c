package org.calista.morphon.engine.check;

/**
 * Report severity of a check entry. Derived from tier and verdict only; it never
 * influences how a value is computed. Only a disagreement carries a severity.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFORMATIONAL,
    NONE;

    public static Severity of(int tier, Verdict verdict) {
        switch (verdict) {
            case AGREE:
            case INSUFFICIENT_DATA:
                return NONE;
            default:
                if (tier <= 1) return CRITICAL;
                if (tier == 2) return WARNING;
                return INFORMATIONAL;
        }
    }
}
