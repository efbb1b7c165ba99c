package org.calista.morphon.engine.legality;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.morphon.engine.corpus.Record;
import org.calista.morphon.engine.corpus.SystemTag;
import org.calista.morphon.engine.corpus.Zone;
import org.calista.morphon.engine.graph.CompatibilityGraph;
import org.calista.morphon.engine.morphology.MorphemeComponents;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * LegalityPropagator — derives the downstream-legal token set of a record.
 *
 * <p>Candidates are the closed global vocabulary. The configured stages run in order
 * and each one filters the survivors of the previous, so the result only shrinks and
 * always stays inside the global vocabulary.
 *
 * <p>Zone gating: for a placed, non-positional record the compatibility graph is asked
 * first whether its MIDDLEs can co-occur at all, then {@link ZoneVocabularyIndex} picks
 * the positional record of the same zone that governs. The cascade then runs over the
 * governor's vocabulary, not the record's own. No governor means BLOCKED with an empty
 * set. Unplaced records are not gated and cascade over their own vocabulary.
 *
 * <p>Immutable; safe to share across worker threads.
 */
public final class LegalityPropagator {
    private static final Logger log = LogManager.getLogger(LegalityPropagator.class);

    private final Map<String, MorphemeComponents> vocabulary;
    private final CompatibilityGraph graph;
    private final ZoneVocabularyIndex zones;
    private final List<CascadeStage> stages;

    /**
     * @param globalVocabulary decomposed candidates; unparsed entries are ignored and
     *                         duplicates collapse to the first occurrence
     */
    public LegalityPropagator(Collection<MorphemeComponents> globalVocabulary, CompatibilityGraph graph,
                              ZoneVocabularyIndex zones, List<CascadeStage> stages) {
        Objects.requireNonNull(globalVocabulary, "globalVocabulary");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.zones = Objects.requireNonNull(zones, "zones");
        this.stages = List.copyOf(Objects.requireNonNull(stages, "stages"));
        if (new TreeSet<>(this.stages).size() != this.stages.size()) {
            throw new IllegalArgumentException("cascade stage listed twice: " + this.stages);
        }

        Map<String, MorphemeComponents> v = new LinkedHashMap<>();
        for (MorphemeComponents c : globalVocabulary) {
            if (c.isParsed()) v.putIfAbsent(c.token(), c);
        }
        this.vocabulary = Collections.unmodifiableMap(v);
    }

    public List<CascadeStage> stages() { return stages; }

    public Set<String> globalVocabulary() {
        return Collections.unmodifiableSet(new TreeSet<>(vocabulary.keySet()));
    }

    /** Legality of one record given its decomposed tokens. */
    public LegalitySet propagate(Record record, List<MorphemeComponents> components) {
        Objects.requireNonNull(record, "record");
        VocabularyBundle own = VocabularyBundle.fromComponents(components);

        if (record.zone() == Zone.UNPLACED) {
            return cascade(record.id(), record.zone(), record.id(), LegalityStatus.UNGATED, own);
        }
        if (record.system() == SystemTag.POSITIONAL) {
            return cascade(record.id(), record.zone(), record.id(), LegalityStatus.GOVERNED, own);
        }
        return propagate(record.id(), own, record.zone());
    }

    /** Legality of an explicit bundle under a zone label (no record behind it). */
    public LegalitySet propagate(VocabularyBundle bundle, Zone zone) {
        return propagate(null, bundle, zone);
    }

    private LegalitySet propagate(String recordId, VocabularyBundle bundle, Zone zone) {
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(zone, "zone");
        if (zone == Zone.UNPLACED) {
            return cascade(recordId, zone, recordId, LegalityStatus.UNGATED, bundle);
        }

        if (!pairwiseCompatible(bundle.middles())) {
            log.debug("Legality {}: middles {} cannot co-occur, blocked", recordId, bundle.middles());
            return blocked(recordId, zone);
        }

        Optional<ZoneVocabularyIndex.Entry> gov = zones.governing(bundle.middles(), zone);
        if (gov.isEmpty()) {
            log.debug("Legality {}: no {} record supplies {}", recordId, zone, bundle.middles());
            return blocked(recordId, zone);
        }
        // the record's MIDDLEs only select the governor; its vocabulary drives the cascade
        ZoneVocabularyIndex.Entry g = gov.get();
        return cascade(recordId, zone, g.recordId, LegalityStatus.GOVERNED, g.vocabulary);
    }

    /** Runs the configured stages over the global vocabulary without any zone gating. */
    public LegalitySet cascade(VocabularyBundle bundle) {
        return cascade(null, Zone.UNPLACED, null, LegalityStatus.UNGATED, bundle);
    }

    private LegalitySet cascade(String recordId, Zone zone, String governing, LegalityStatus status,
                                VocabularyBundle bundle) {
        List<MorphemeComponents> alive = new ArrayList<>(vocabulary.values());
        List<LegalitySet.Step> trace = new ArrayList<>(stages.size());

        for (CascadeStage stage : stages) {
            List<MorphemeComponents> next = new ArrayList<>(alive.size());
            for (MorphemeComponents c : alive) {
                if (stage.admits(c, bundle)) next.add(c);
            }
            alive = next;
            trace.add(new LegalitySet.Step(stage, alive.size()));
        }

        Set<String> tokens = new TreeSet<>();
        for (MorphemeComponents c : alive) tokens.add(c.token());
        return new LegalitySet(recordId, zone, governing, status, vocabulary.size(), trace, tokens);
    }

    private LegalitySet blocked(String recordId, Zone zone) {
        List<LegalitySet.Step> trace = new ArrayList<>(stages.size());
        for (CascadeStage s : stages) trace.add(new LegalitySet.Step(s, 0));
        return new LegalitySet(recordId, zone, null, LegalityStatus.BLOCKED, vocabulary.size(), trace, Set.of());
    }

    private boolean pairwiseCompatible(Set<String> middles) {
        List<String> m = new ArrayList<>(middles);
        for (int i = 0; i < m.size(); i++) {
            for (int j = i + 1; j < m.size(); j++) {
                if (!graph.areCompatible(m.get(i), m.get(j))) return false;
            }
        }
        return true;
    }
}
