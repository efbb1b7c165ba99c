package org.calista.morphon.engine.corpus;

import java.util.Locale;

/**
 * Positional zone label of a record. Selects which record's vocabulary governs
 * legality filtering; it never changes the cascade itself.
 */
public enum Zone {
    C, P, R1, R2, R3, S,
    /** No placement: the record is not gated through a positional record. */
    UNPLACED;

    /**
     * @return the zone, {@link #UNPLACED} for null or blank labels
     * @throws IllegalArgumentException for an unknown label
     */
    public static Zone parse(String label) {
        if (label == null || label.isBlank()) return UNPLACED;
        String s = label.trim().toUpperCase(Locale.ROOT);
        for (Zone z : values()) {
            if (z.name().equals(s)) return z;
        }
        throw new IllegalArgumentException("Unknown zone label: " + label);
    }
}
