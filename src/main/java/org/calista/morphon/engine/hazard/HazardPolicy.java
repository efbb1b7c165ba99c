package org.calista.morphon.engine.hazard;

import java.util.Locale;

/**
 * Hazard validation mode. Transitions are statistically disfavored, not forbidden;
 * no mode rejects a sequence.
 */
public enum HazardPolicy {
    ADVISORY,
    NONE;

    public static HazardPolicy parse(String s) {
        if (s == null || s.isBlank()) return ADVISORY;
        String v = s.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "advisory":
                return ADVISORY;
            case "none":
                return NONE;
            case "reject":
                throw new IllegalArgumentException(
                        "hazard policy 'reject' is not supported: hazard transitions are advisory only");
            default:
                throw new IllegalArgumentException("Unknown hazard policy: " + s + " (expected advisory | none)");
        }
    }
}
