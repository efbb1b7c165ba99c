package org.calista.morphon.engine.check;

import org.calista.morphon.engine.classify.ClassifiedToken;
import org.calista.morphon.engine.classify.Outcome;
import org.calista.morphon.engine.corpus.CorpusSnapshot;
import org.calista.morphon.engine.graph.CompatibilityGraph;
import org.calista.morphon.engine.hazard.HazardCategory;
import org.calista.morphon.engine.hazard.HazardReport;
import org.calista.morphon.engine.hazard.HazardTable;
import org.calista.morphon.engine.legality.CascadeStage;
import org.calista.morphon.engine.legality.LegalitySet;
import org.calista.morphon.engine.legality.LegalityStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Serves metric keys from one analyzed snapshot.
 *
 * <pre>
 * corpus.records | corpus.tokens | decompose.unparsed
 * class.coverage_pct | class.overflow_pct | class.distinct
 * graph.nodes | graph.edges | graph.edge_density_pct
 * hazard.edges | hazard.category.&lt;label&gt; | hazard.violations | hazard.compliance_pct
 * legality.size (scope = record id) | legality.mean_size | legality.empty_records
 * legality.stage_reduction_pct.&lt;STAGE&gt;
 * </pre>
 *
 * Percentages are on a 0..100 scale. Class metrics cover executable tokens only.
 */
public final class SnapshotMetricProbe implements MetricProbe {

    private static final String CATEGORY = "hazard.category.";
    private static final String STAGE_REDUCTION = "legality.stage_reduction_pct.";

    private final CorpusSnapshot corpus;
    private final List<ClassifiedToken> tokens;
    private final long unparsed;
    private final CompatibilityGraph graph;
    private final HazardTable hazards;
    private final HazardReport hazardReport;
    private final Map<String, LegalitySet> legality;

    private SnapshotMetricProbe(Builder b) {
        this.corpus = Objects.requireNonNull(b.corpus, "corpus");
        this.tokens = List.copyOf(b.tokens);
        this.unparsed = b.unparsed;
        this.graph = b.graph;
        this.hazards = b.hazards;
        this.hazardReport = b.hazardReport;
        Map<String, LegalitySet> l = new HashMap<>();
        for (LegalitySet s : b.legality) {
            if (s.recordId() != null) l.put(s.recordId(), s);
        }
        this.legality = l;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public OptionalDouble measure(String metric, String scope) {
        if (metric == null) return OptionalDouble.empty();
        String m = metric.trim();

        switch (m) {
            case "corpus.records":
                return OptionalDouble.of(corpus.size());
            case "corpus.tokens":
                return OptionalDouble.of(corpus.tokenCount());
            case "decompose.unparsed":
                return OptionalDouble.of(unparsed);
            case "class.coverage_pct":
                return pct(count(Outcome.CLASSIFIED), tokens.size());
            case "class.overflow_pct":
                return pct(count(Outcome.OVERFLOW), tokens.size());
            case "class.distinct":
                return OptionalDouble.of(distinctClasses());
            case "graph.nodes":
                return graph == null ? OptionalDouble.empty() : OptionalDouble.of(graph.nodeCount());
            case "graph.edges":
                return graph == null ? OptionalDouble.empty() : OptionalDouble.of(graph.edgeCount());
            case "graph.edge_density_pct":
                return (graph == null || graph.nodeCount() < 2) ? OptionalDouble.empty() : OptionalDouble.of(100.0 * graph.density());
            case "hazard.edges":
                return hazards == null ? OptionalDouble.empty() : OptionalDouble.of(hazards.size());
            case "hazard.violations":
                return hazardReport == null ? OptionalDouble.empty() : OptionalDouble.of(hazardReport.violations().size());
            case "hazard.compliance_pct":
                return hazardReport == null ? OptionalDouble.empty() : defined(hazardReport.compliancePct());
            case "legality.size":
                return legalitySize(scope);
            case "legality.mean_size":
                return meanLegalitySize();
            case "legality.empty_records":
                return legality.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(emptyRecords());
            default:
                break;
        }

        if (m.startsWith(CATEGORY)) return categoryCount(m.substring(CATEGORY.length()));
        if (m.startsWith(STAGE_REDUCTION)) return stageReduction(m.substring(STAGE_REDUCTION.length()));
        return OptionalDouble.empty();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private long count(Outcome o) {
        long n = 0;
        for (ClassifiedToken t : tokens) {
            if (t.outcome() == o) n++;
        }
        return n;
    }

    private int distinctClasses() {
        Set<Integer> ids = new TreeSet<>();
        for (ClassifiedToken t : tokens) {
            if (t.isClassified()) ids.add(t.classId());
        }
        return ids.size();
    }

    private OptionalDouble categoryCount(String label) {
        if (hazards == null) return OptionalDouble.empty();
        HazardCategory c;
        try {
            c = HazardCategory.parse(label);
        } catch (IllegalArgumentException e) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(hazards.countByCategory().getOrDefault(c, 0));
    }

    private OptionalDouble legalitySize(String recordId) {
        if (recordId == null) return OptionalDouble.empty();
        LegalitySet s = legality.get(recordId);
        return s == null ? OptionalDouble.empty() : OptionalDouble.of(s.size());
    }

    private OptionalDouble meanLegalitySize() {
        if (legality.isEmpty()) return OptionalDouble.empty();
        double sum = 0;
        for (LegalitySet s : legality.values()) sum += s.size();
        return OptionalDouble.of(sum / legality.size());
    }

    private long emptyRecords() {
        long n = 0;
        for (LegalitySet s : legality.values()) {
            if (s.isEmpty()) n++;
        }
        return n;
    }

    /** Mean share of candidates one stage removes, over sets that actually ran the cascade. */
    private OptionalDouble stageReduction(String stageName) {
        CascadeStage stage;
        try {
            stage = CascadeStage.parse(stageName);
        } catch (IllegalArgumentException e) {
            return OptionalDouble.empty();
        }

        List<Double> samples = new ArrayList<>();
        for (LegalitySet s : legality.values()) {
            if (s.status() == LegalityStatus.BLOCKED) continue;
            int before = s.initialSize();
            for (LegalitySet.Step step : s.trace()) {
                if (step.stage == stage) {
                    if (before > 0) samples.add(100.0 * (before - step.size) / before);
                    break;
                }
                before = step.size;
            }
        }
        if (samples.isEmpty()) return OptionalDouble.empty();
        double sum = 0;
        for (double d : samples) sum += d;
        return OptionalDouble.of(sum / samples.size());
    }

    private static OptionalDouble pct(long part, long whole) {
        return whole == 0 ? OptionalDouble.empty() : OptionalDouble.of(100.0 * part / whole);
    }

    private static OptionalDouble defined(double v) {
        return Double.isNaN(v) ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public static final class Builder {
        private CorpusSnapshot corpus;
        private List<ClassifiedToken> tokens = List.of();
        private long unparsed;
        private CompatibilityGraph graph;
        private HazardTable hazards;
        private HazardReport hazardReport;
        private List<LegalitySet> legality = List.of();

        public Builder corpus(CorpusSnapshot v) { this.corpus = v; return this; }
        /** Classified executable tokens, in corpus order. */
        public Builder tokens(List<ClassifiedToken> v) { this.tokens = Objects.requireNonNull(v); return this; }
        public Builder unparsed(long v) { this.unparsed = v; return this; }
        public Builder graph(CompatibilityGraph v) { this.graph = v; return this; }
        public Builder hazards(HazardTable table, HazardReport report) {
            this.hazards = table;
            this.hazardReport = report;
            return this;
        }
        public Builder legality(List<LegalitySet> v) { this.legality = Objects.requireNonNull(v); return this; }

        public SnapshotMetricProbe build() {
            return new SnapshotMetricProbe(this);
        }
    }
}
