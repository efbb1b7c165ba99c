package org.calista.morphon.engine.classify;

/**
 * Diagnostic for a parsed token no lookup step could place. The token itself is
 * routed to overflow; the gap is surfaced in the run journal.
 */
public final class ClassificationGap {
    public final String token;
    public final String prefixFamily;
    public final String middle;
    public final String suffixFamily;

    private ClassificationGap(String token, String prefixFamily, String middle, String suffixFamily) {
        this.token = token;
        this.prefixFamily = prefixFamily;
        this.middle = middle;
        this.suffixFamily = suffixFamily;
    }

    public static ClassificationGap of(ClassifiedToken t) {
        if (t.kind() != MatchKind.GAP) throw new IllegalArgumentException("Not a gap: " + t);
        return new ClassificationGap(t.token(),
                t.components().prefixFamily(), t.components().middle(), t.components().suffixFamily());
    }

    @Override
    public String toString() {
        return "ClassificationGap{" + token + ": " + ClassTable.Key.label(prefixFamily) + "|" + middle + "|"
                + ClassTable.Key.label(suffixFamily) + "}";
    }
}
