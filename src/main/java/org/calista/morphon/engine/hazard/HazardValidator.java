package org.calista.morphon.engine.hazard;

import org.calista.morphon.engine.classify.ClassifiedToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Scans consecutive class pairs against the {@link HazardTable}.
 *
 * <p>Advisory only: the sequence is never rejected, reordered or corrected. Ids outside
 * 1..49 (overflow, unclassified) never match a transition, and neither does a pair
 * with a missing (null) id.
 */
public final class HazardValidator {

    /** Per-record scan outcome. */
    public static final class RecordScan {
        public final String recordId;
        /** Consecutive pairs looked at. */
        public final int transitions;
        /** Pairs whose first class starts some declared transition. */
        public final int opportunities;
        public final List<Violation> violations;

        RecordScan(String recordId, int transitions, int opportunities, List<Violation> violations) {
            this.recordId = recordId;
            this.transitions = transitions;
            this.opportunities = opportunities;
            this.violations = Collections.unmodifiableList(violations);
        }
    }

    private final HazardTable table;

    public HazardValidator(HazardTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public HazardTable table() { return table; }

    public List<Violation> validate(List<Integer> classSequence) {
        Objects.requireNonNull(classSequence, "classSequence");
        List<Violation> out = new ArrayList<>();
        for (int i = 0; i + 1 < classSequence.size(); i++) {
            final int pos = i;
            Integer a = classSequence.get(i);
            Integer b = classSequence.get(i + 1);
            if (a == null || b == null) continue;
            table.lookup(a, b).ifPresent(t -> out.add(new Violation(null, pos, t, null, null)));
        }
        return out;
    }

    public RecordScan scan(String recordId, List<ClassifiedToken> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        List<Violation> out = new ArrayList<>();
        int opportunities = 0;
        int transitions = Math.max(0, tokens.size() - 1);

        for (int i = 0; i + 1 < tokens.size(); i++) {
            ClassifiedToken a = tokens.get(i);
            ClassifiedToken b = tokens.get(i + 1);
            if (table.sources().contains(a.classId())) opportunities++;

            final int pos = i;
            table.lookup(a.classId(), b.classId())
                    .ifPresent(t -> out.add(new Violation(recordId, pos, t, a.token(), b.token())));
        }
        return new RecordScan(recordId, transitions, opportunities, out);
    }
}
