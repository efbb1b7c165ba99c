package org.calista.morphon.engine.classify.impl;

import org.calista.morphon.engine.classify.ClassTable;
import org.calista.morphon.engine.classify.ClassifiedToken;
import org.calista.morphon.engine.classify.Classifier;
import org.calista.morphon.engine.classify.MatchKind;
import org.calista.morphon.engine.classify.UnparsedPolicy;
import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * TableClassifier — lookup with a fixed fallback chain:
 * <ol>
 *     <li>exact (prefix family, MIDDLE, suffix family)</li>
 *     <li>(prefix family, MIDDLE, any suffix)</li>
 *     <li>(any prefix, MIDDLE, suffix family)</li>
 *     <li>MIDDLE only</li>
 * </ol>
 * Bare tokens (no prefix) only fall back into the table's bare classes. Among several
 * candidates the class with most supporting members wins, then the lowest id.
 * Nothing found: overflow with {@link MatchKind#GAP}.
 */
public final class TableClassifier implements Classifier {

    private final ClassTable table;
    private final UnparsedPolicy unparsedPolicy;

    public TableClassifier(ClassTable table) {
        this(table, UnparsedPolicy.DROP);
    }

    public TableClassifier(ClassTable table, UnparsedPolicy unparsedPolicy) {
        this.table = Objects.requireNonNull(table, "table");
        this.unparsedPolicy = Objects.requireNonNull(unparsedPolicy, "unparsedPolicy");
    }

    public ClassTable table() { return table; }

    public UnparsedPolicy unparsedPolicy() { return unparsedPolicy; }

    @Override
    public ClassifiedToken classify(MorphemeComponents c) {
        Objects.requireNonNull(c, "components");

        if (!c.isParsed()) {
            return (unparsedPolicy == UnparsedPolicy.RETAIN_AS_OVERFLOW)
                    ? ClassifiedToken.overflow(c, MatchKind.UNPARSED)
                    : ClassifiedToken.unclassified(c);
        }

        Integer exact = table.exact(ClassTable.Key.of(c));
        if (exact != null) return ClassifiedToken.classified(c, exact, MatchKind.EXACT);

        Set<Integer> restrictTo = c.isBare() ? table.bareClasses() : null;

        int id = best(table.byPrefixMiddle(c.prefixFamily(), c.middle()), restrictTo);
        if (id > 0) return ClassifiedToken.classified(c, id, MatchKind.PREFIX_FALLBACK);

        id = best(table.byMiddleSuffix(c.middle(), c.suffixFamily()), restrictTo);
        if (id > 0) return ClassifiedToken.classified(c, id, MatchKind.SUFFIX_FALLBACK);

        id = best(table.byMiddle(c.middle()), restrictTo);
        if (id > 0) return ClassifiedToken.classified(c, id, MatchKind.MIDDLE_FALLBACK);

        return ClassifiedToken.overflow(c, MatchKind.GAP);
    }

    /** @return winning class id, or 0 when there is no admissible candidate */
    private static int best(Map<Integer, Integer> supportByClass, Set<Integer> restrictTo) {
        int bestId = 0;
        int bestSupport = 0;
        // ids iterate ascending, strict '>' keeps the lowest id on ties
        for (Map.Entry<Integer, Integer> e : supportByClass.entrySet()) {
            if (restrictTo != null && !restrictTo.contains(e.getKey())) continue;
            if (e.getValue() > bestSupport) {
                bestSupport = e.getValue();
                bestId = e.getKey();
            }
        }
        return bestId;
    }
}
