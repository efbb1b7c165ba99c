package org.calista.morphon.engine.check;

import java.util.Locale;

/** Direction of an assertion; always computed value against asserted value. */
public enum Comparison {
    EQUALS {
        @Override
        boolean holds(double computed, double asserted, double tolerance) {
            return Math.abs(computed - asserted) <= tolerance + EPS;
        }
    },
    AT_LEAST {
        @Override
        boolean holds(double computed, double asserted, double tolerance) {
            return computed + tolerance + EPS >= asserted;
        }
    },
    AT_MOST {
        @Override
        boolean holds(double computed, double asserted, double tolerance) {
            return computed - tolerance - EPS <= asserted;
        }
    };

    // float noise on percentages, e.g. 4.1 vs 4.6 at tolerance 0.5
    private static final double EPS = 1e-9;

    abstract boolean holds(double computed, double asserted, double tolerance);

    /** Blank means EQUALS; {@code >=} and {@code <=} are accepted as aliases. */
    public static Comparison parse(String s) {
        if (s == null || s.isBlank()) return EQUALS;
        String v = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (v) {
            case "==":
            case "EQ":
                return EQUALS;
            case ">=":
                return AT_LEAST;
            case "<=":
                return AT_MOST;
            default:
                try {
                    return valueOf(v);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("unknown comparison: " + s, e);
                }
        }
    }
}
