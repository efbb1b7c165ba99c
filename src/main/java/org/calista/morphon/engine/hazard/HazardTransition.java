package org.calista.morphon.engine.hazard;

import java.util.Objects;

/** Directed class pair {@code from -> to}. The reverse pair is a different transition. */
public final class HazardTransition {
    private final int from;
    private final int to;
    private final HazardCategory category;
    private final double severity;
    private final String exemplar;

    public HazardTransition(int from, int to, HazardCategory category, double severity, String exemplar) {
        this.from = from;
        this.to = to;
        this.category = Objects.requireNonNull(category, "category");
        this.severity = severity;
        this.exemplar = exemplar;
    }

    public int from() { return from; }
    public int to() { return to; }
    public HazardCategory category() { return category; }

    /** Informational weight; never used to gate anything. */
    public double severity() { return severity; }

    /** Token-level example of the transition, may be null. */
    public String exemplar() { return exemplar; }

    @Override
    public String toString() {
        return "C" + from + "->C" + to + " [" + category.label() + "]";
    }
}
