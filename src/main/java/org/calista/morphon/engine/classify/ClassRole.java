package org.calista.morphon.engine.classify;

import java.util.Locale;

/** Functional role of an instruction class. */
public enum ClassRole {
    AUXILIARY,
    CORE_CONTROL,
    FREQUENT_OPERATOR,
    FLOW_OPERATOR,
    ENERGY_OPERATOR;

    public static ClassRole parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("Missing class role");
        return valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
