package org.calista.morphon.engine.hazard;

/** One matched disfavored transition inside a sequence. */
public final class Violation {
    public final String recordId;
    /** Index of the first token of the pair. */
    public final int position;
    public final int fromClass;
    public final int toClass;
    public final String fromToken;
    public final String toToken;
    public final HazardCategory category;
    public final double severity;

    public Violation(String recordId, int position, HazardTransition t, String fromToken, String toToken) {
        this.recordId = recordId;
        this.position = position;
        this.fromClass = t.from();
        this.toClass = t.to();
        this.fromToken = fromToken;
        this.toToken = toToken;
        this.category = t.category();
        this.severity = t.severity();
    }

    @Override
    public String toString() {
        return "Violation{" + (recordId == null ? "" : recordId + "@") + position
                + " C" + fromClass + "->C" + toClass + " " + category.label() + "}";
    }
}
