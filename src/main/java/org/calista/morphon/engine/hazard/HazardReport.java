package org.calista.morphon.engine.hazard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Corpus-level hazard summary: violations per category and empirical compliance,
 * i.e. the share of opportunities where the disfavored successor did not follow.
 */
public final class HazardReport {

    private final HazardPolicy policy;
    private final int records;
    private final long transitions;
    private final long opportunities;
    private final List<Violation> violations;
    private final Map<HazardCategory, Integer> byCategory;

    private HazardReport(HazardPolicy policy, int records, long transitions, long opportunities,
                         List<Violation> violations) {
        this.policy = policy;
        this.records = records;
        this.transitions = transitions;
        this.opportunities = opportunities;
        this.violations = Collections.unmodifiableList(violations);

        Map<HazardCategory, Integer> m = new EnumMap<>(HazardCategory.class);
        for (HazardCategory c : HazardCategory.values()) m.put(c, 0);
        for (Violation v : violations) m.merge(v.category, 1, Integer::sum);
        this.byCategory = Collections.unmodifiableMap(m);
    }

    public static HazardReport of(HazardPolicy policy, List<HazardValidator.RecordScan> scans) {
        long tr = 0;
        long op = 0;
        List<Violation> all = new ArrayList<>();
        for (HazardValidator.RecordScan s : scans) {
            tr += s.transitions;
            op += s.opportunities;
            all.addAll(s.violations);
        }
        return new HazardReport(policy, scans.size(), tr, op, all);
    }

    /** Validator switched off: nothing scanned. */
    public static HazardReport disabled() {
        return new HazardReport(HazardPolicy.NONE, 0, 0, 0, List.of());
    }

    public HazardPolicy policy() { return policy; }
    public int records() { return records; }
    public long transitions() { return transitions; }
    public long opportunities() { return opportunities; }
    public List<Violation> violations() { return violations; }
    public Map<HazardCategory, Integer> byCategory() { return byCategory; }

    /** Percentage in [0,100]; NaN when there was no opportunity at all. */
    public double compliancePct() {
        if (opportunities == 0) return Double.NaN;
        return 100.0 * (opportunities - violations.size()) / opportunities;
    }
}
