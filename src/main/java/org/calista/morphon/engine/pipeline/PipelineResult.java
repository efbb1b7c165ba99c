package org.calista.morphon.engine.pipeline;

import org.calista.morphon.engine.check.CheckEntry;
import org.calista.morphon.engine.classify.ClassificationGap;
import org.calista.morphon.engine.classify.ClassifiedToken;
import org.calista.morphon.engine.corpus.CorpusSnapshot;
import org.calista.morphon.engine.graph.CompatibilityGraph;
import org.calista.morphon.engine.hazard.HazardReport;
import org.calista.morphon.engine.hazard.HazardValidator;
import org.calista.morphon.engine.hazard.TransitionProfile;
import org.calista.morphon.engine.legality.LegalitySet;
import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Everything one run derived from a snapshot. Read-only. */
public final class PipelineResult {

    public final CorpusSnapshot corpus;
    /** record id -> components, in corpus order; every record. */
    public final Map<String, List<MorphemeComponents>> components;
    /** record id -> classified tokens; executable records only. */
    public final Map<String, List<ClassifiedToken>> classified;
    public final List<ClassificationGap> gaps;
    public final long unparsed;
    public final CompatibilityGraph graph;
    public final List<HazardValidator.RecordScan> hazardScans;
    public final HazardReport hazards;
    public final TransitionProfile transitions;
    public final List<LegalitySet> legality;
    public final List<CheckEntry> checks;

    PipelineResult(CorpusSnapshot corpus,
                   Map<String, List<MorphemeComponents>> components,
                   Map<String, List<ClassifiedToken>> classified,
                   List<ClassificationGap> gaps,
                   long unparsed,
                   CompatibilityGraph graph,
                   List<HazardValidator.RecordScan> hazardScans,
                   HazardReport hazards,
                   TransitionProfile transitions,
                   List<LegalitySet> legality,
                   List<CheckEntry> checks) {
        this.corpus = corpus;
        this.components = Collections.unmodifiableMap(components);
        this.classified = Collections.unmodifiableMap(classified);
        this.gaps = Collections.unmodifiableList(gaps);
        this.unparsed = unparsed;
        this.graph = graph;
        this.hazardScans = Collections.unmodifiableList(hazardScans);
        this.hazards = hazards;
        this.transitions = transitions;
        this.legality = Collections.unmodifiableList(legality);
        this.checks = Collections.unmodifiableList(checks);
    }

    /** Classified executable tokens in corpus order. */
    public List<ClassifiedToken> classifiedTokens() {
        List<ClassifiedToken> out = new ArrayList<>();
        for (List<ClassifiedToken> l : classified.values()) out.addAll(l);
        return out;
    }

    public LegalitySet legalityOf(String recordId) {
        for (LegalitySet s : legality) {
            if (recordId.equals(s.recordId())) return s;
        }
        return null;
    }

    public CheckEntry checkOf(String assertionId) {
        for (CheckEntry e : checks) {
            if (e.assertionId.equals(assertionId)) return e;
        }
        return null;
    }
}
