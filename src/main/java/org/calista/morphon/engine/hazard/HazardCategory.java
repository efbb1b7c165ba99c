package org.calista.morphon.engine.hazard;

import java.util.Locale;

/** Named partition of the disfavored transitions, with the fixed size of each part. */
public enum HazardCategory {
    PHASE_ORDERING("phase-ordering", 7),
    COMPOSITION_JUMP("composition-jump", 4),
    CONTAINMENT_TIMING("containment-timing", 4),
    RATE_MISMATCH("rate-mismatch", 1),
    ENERGY_OVERSHOOT("energy-overshoot", 1);

    private final String label;
    private final int expectedCount;

    HazardCategory(String label, int expectedCount) {
        this.label = label;
        this.expectedCount = expectedCount;
    }

    public String label() { return label; }

    public int expectedCount() { return expectedCount; }

    public static HazardCategory parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("Missing hazard category");
        String v = s.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (HazardCategory c : values()) {
            if (c.label.equals(v)) return c;
        }
        throw new IllegalArgumentException("Unknown hazard category: " + s);
    }
}
