package org.calista.morphon.engine.classify;

import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.Objects;

/**
 * Classification result that keeps its originating token, so members of one class
 * stay distinguishable downstream (transition profiles, reports).
 */
public final class ClassifiedToken {

    public static final int OVERFLOW_ID = 0;
    public static final int UNCLASSIFIED_ID = -1;

    private final MorphemeComponents components;
    private final Outcome outcome;
    private final int classId;
    private final MatchKind kind;

    private ClassifiedToken(MorphemeComponents components, Outcome outcome, int classId, MatchKind kind) {
        this.components = Objects.requireNonNull(components, "components");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.classId = classId;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static ClassifiedToken classified(MorphemeComponents c, int classId, MatchKind kind) {
        if (classId < 1) throw new IllegalArgumentException("class id must be positive: " + classId);
        return new ClassifiedToken(c, Outcome.CLASSIFIED, classId, kind);
    }

    public static ClassifiedToken overflow(MorphemeComponents c, MatchKind kind) {
        return new ClassifiedToken(c, Outcome.OVERFLOW, OVERFLOW_ID, kind);
    }

    public static ClassifiedToken unclassified(MorphemeComponents c) {
        return new ClassifiedToken(c, Outcome.UNCLASSIFIED, UNCLASSIFIED_ID, MatchKind.UNPARSED);
    }

    public String token() { return components.token(); }
    public MorphemeComponents components() { return components; }
    public Outcome outcome() { return outcome; }
    public int classId() { return classId; }
    public MatchKind kind() { return kind; }

    public boolean isClassified() { return outcome == Outcome.CLASSIFIED; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassifiedToken)) return false;
        ClassifiedToken that = (ClassifiedToken) o;
        return classId == that.classId && outcome == that.outcome && kind == that.kind
                && components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(components, outcome, classId, kind);
    }

    @Override
    public String toString() {
        String cls = (outcome == Outcome.CLASSIFIED) ? ("C" + classId) : outcome.name();
        return token() + " -> " + cls + " (" + kind + ")";
    }
}
