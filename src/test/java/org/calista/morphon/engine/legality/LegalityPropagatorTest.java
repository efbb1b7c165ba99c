package org.calista.morphon.engine.legality;

import org.calista.morphon.engine.corpus.Record;
import org.calista.morphon.engine.corpus.SystemTag;
import org.calista.morphon.engine.corpus.Zone;
import org.calista.morphon.engine.graph.CompatibilityGraph;
import org.calista.morphon.engine.graph.CompatibilityGraphBuilder;
import org.calista.morphon.engine.morphology.AffixTable;
import org.calista.morphon.engine.morphology.Decomposer;
import org.calista.morphon.engine.morphology.MorphemeComponents;
import org.calista.morphon.engine.morphology.impl.AffixDecomposer;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class LegalityPropagatorTest {

    private static final List<CascadeStage> DEFAULT_STAGES =
            List.of(CascadeStage.MIDDLE, CascadeStage.PREFIX, CascadeStage.SUFFIX);

    private final Decomposer decomposer = new AffixDecomposer(AffixTable.builder()
            .alphabet("abcdefghijklmnopqrstuvwxyz")
            .prefixFamily("qo", 1, "qo")
            .prefixFamily("ch", 2, "ch")
            .suffixFamily("dy", 1, "dy")
            .suffixFamily("y", 2, "y")
            .build());

    // qotedy = qo+te+dy, qotey = qo+te+y, chtedy = ch+te+dy, chkedy = ch+ke+dy
    private final List<MorphemeComponents> vocabulary =
            decomposer.decomposeAll(List.of("qotedy", "qotey", "chtedy", "chkedy"));

    private CompatibilityGraph graph(List<List<String>> raw) {
        List<List<MorphemeComponents>> recs = new ArrayList<>();
        for (List<String> r : raw) recs.add(decomposer.decomposeAll(r));
        return new CompatibilityGraphBuilder(1).build(recs);
    }

    private LegalityPropagator propagator(ZoneVocabularyIndex zones, List<CascadeStage> stages) {
        return new LegalityPropagator(vocabulary, graph(List.of(List.of("qotedy", "chkedy"))), zones, stages);
    }

    private static VocabularyBundle bundle(Set<String> m, Set<String> p, Set<String> s) {
        return VocabularyBundle.of(m, p, s);
    }

    @Test
    public void testCascadeNarrowsStageByStage() {
        LegalitySet r = propagator(ZoneVocabularyIndex.builder().build(), DEFAULT_STAGES)
                .cascade(bundle(Set.of("te"), Set.of("qo"), Set.of("dy")));

        assertEquals(Set.of("qotedy"), r.tokens());
        assertEquals(4, r.initialSize());
        assertEquals(3, r.trace().size());
        assertEquals(CascadeStage.MIDDLE, r.trace().get(0).stage);
        assertEquals(3, r.trace().get(0).size);
        assertEquals(2, r.trace().get(1).size);
        assertEquals(1, r.trace().get(2).size);
        assertEquals(LegalityStatus.UNGATED, r.status());
    }

    @Test
    public void testStageOrderDoesNotChangeTheFinalSet() {
        VocabularyBundle b = bundle(Set.of("te", "ke"), Set.of("ch"), Set.of("dy"));
        LegalitySet forward = propagator(ZoneVocabularyIndex.builder().build(), DEFAULT_STAGES).cascade(b);
        LegalitySet reverse = propagator(ZoneVocabularyIndex.builder().build(),
                List.of(CascadeStage.SUFFIX, CascadeStage.PREFIX, CascadeStage.MIDDLE)).cascade(b);

        assertEquals(Set.of("chkedy", "chtedy"), forward.tokens());
        assertEquals(forward.tokens(), reverse.tokens());
        assertEquals(CascadeStage.SUFFIX, reverse.trace().get(0).stage);
    }

    @Test
    public void testTraceIsMonotone() {
        LegalityPropagator p = propagator(ZoneVocabularyIndex.builder().build(), DEFAULT_STAGES);
        List<VocabularyBundle> bundles = List.of(
                bundle(Set.of("te"), Set.of(), Set.of()),
                bundle(Set.of("te", "ke"), Set.of("qo", "ch"), Set.of("y")),
                bundle(Set.of("zz"), Set.of("qo"), Set.of("dy")),
                VocabularyBundle.empty());
        for (VocabularyBundle b : bundles) {
            LegalitySet r = p.cascade(b);
            int prev = r.initialSize();
            for (LegalitySet.Step s : r.trace()) {
                assertTrue(b + " " + r, s.size <= prev);
                prev = s.size;
            }
            assertEquals(prev, r.size());
            assertTrue(p.globalVocabulary().containsAll(r.tokens()));
        }
    }

    @Test
    public void testUnaffixedTokensPassAffixStages() {
        // a bundle with no prefixes still admits tokens that carry none
        LegalityPropagator p = new LegalityPropagator(decomposer.decomposeAll(List.of("te", "qote")),
                graph(List.of(List.of("te"))), ZoneVocabularyIndex.builder().build(), DEFAULT_STAGES);
        LegalitySet r = p.cascade(bundle(Set.of("te"), Set.of(), Set.of()));
        assertEquals(Set.of("te"), r.tokens());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateStageRejected() {
        propagator(ZoneVocabularyIndex.builder().build(), List.of(CascadeStage.MIDDLE, CascadeStage.MIDDLE));
    }

    @Test
    public void testGovernedBySmallestCoveringPositionalRecord() {
        ZoneVocabularyIndex zones = ZoneVocabularyIndex.builder()
                .add("big", Zone.C, bundle(Set.of("te", "ke", "xo"), Set.of("qo", "ch"), Set.of("dy", "y")))
                .add("small", Zone.C, bundle(Set.of("te", "ke"), Set.of("ch"), Set.of("dy")))
                .add("other-zone", Zone.P, bundle(Set.of("te"), Set.of(), Set.of()))
                .build();

        LegalitySet r = propagator(zones, DEFAULT_STAGES).propagate(bundle(Set.of("te"), Set.of("qo"), Set.of("dy")), Zone.C);
        assertEquals(LegalityStatus.GOVERNED, r.status());
        assertEquals("small", r.governingRecordId());
        // the governor's prefixes apply, not the record's own qo
        assertEquals(Set.of("chkedy", "chtedy"), r.tokens());
        assertEquals(4, r.trace().get(0).size);
        assertEquals(2, r.trace().get(1).size);
        assertEquals(2, r.trace().get(2).size);
    }

    @Test
    public void testDifferentGovernorsGiveDifferentSets() {
        VocabularyBundle local = bundle(Set.of("te"), Set.of("qo"), Set.of("dy"));

        ZoneVocabularyIndex chOnly = ZoneVocabularyIndex.builder()
                .add("c-ch", Zone.C, bundle(Set.of("te"), Set.of("ch"), Set.of("dy")))
                .build();
        ZoneVocabularyIndex qoOnly = ZoneVocabularyIndex.builder()
                .add("c-qo", Zone.C, bundle(Set.of("te"), Set.of("qo"), Set.of("y")))
                .build();

        LegalitySet a = propagator(chOnly, DEFAULT_STAGES).propagate(local, Zone.C);
        LegalitySet b = propagator(qoOnly, DEFAULT_STAGES).propagate(local, Zone.C);

        assertEquals("c-ch", a.governingRecordId());
        assertEquals(Set.of("chtedy"), a.tokens());
        assertEquals("c-qo", b.governingRecordId());
        assertEquals(Set.of("qotey"), b.tokens());
        assertNotEquals(a.tokens(), b.tokens());
    }

    @Test
    public void testSmallerGovernorNarrowsTheSet() {
        VocabularyBundle local = bundle(Set.of("te"), Set.of(), Set.of());
        VocabularyBundle big = bundle(Set.of("te", "ke"), Set.of("qo", "ch"), Set.of("dy", "y"));
        VocabularyBundle small = bundle(Set.of("te"), Set.of("qo"), Set.of("dy", "y"));

        LegalitySet both = propagator(ZoneVocabularyIndex.builder()
                .add("big", Zone.R2, big)
                .add("small", Zone.R2, small)
                .build(), DEFAULT_STAGES).propagate(local, Zone.R2);
        LegalitySet bigOnly = propagator(ZoneVocabularyIndex.builder()
                .add("big", Zone.R2, big)
                .build(), DEFAULT_STAGES).propagate(local, Zone.R2);

        assertEquals("small", both.governingRecordId());
        assertEquals(Set.of("qotedy", "qotey"), both.tokens());
        assertEquals("big", bigOnly.governingRecordId());
        assertEquals(Set.of("qotedy", "qotey", "chtedy", "chkedy"), bigOnly.tokens());
    }

    @Test
    public void testEqualSizeTieBrokenByRecordId() {
        VocabularyBundle same = bundle(Set.of("te"), Set.of("qo"), Set.of());
        ZoneVocabularyIndex zones = ZoneVocabularyIndex.builder()
                .add("f57v.b", Zone.S, same)
                .add("f57v.a", Zone.S, same)
                .build();
        assertEquals("f57v.a", zones.governing(Set.of("te"), Zone.S).get().recordId);
        assertEquals(2, zones.candidates(Set.of("te"), Zone.S).size());
        assertEquals(2, zones.size(Zone.S));
        assertEquals(0, zones.size(Zone.C));
    }

    @Test
    public void testBlockedWhenNoPositionalRecordSuppliesTheMiddles() {
        ZoneVocabularyIndex zones = ZoneVocabularyIndex.builder()
                .add("p1", Zone.P, bundle(Set.of("ke"), Set.of("ch"), Set.of("dy")))
                .build();
        LegalitySet r = propagator(zones, DEFAULT_STAGES).propagate(bundle(Set.of("te"), Set.of("qo"), Set.of("dy")), Zone.P);
        assertEquals(LegalityStatus.BLOCKED, r.status());
        assertTrue(r.isEmpty());
        assertNull(r.governingRecordId());
        for (LegalitySet.Step s : r.trace()) assertEquals(0, s.size);
    }

    @Test
    public void testBlockedWhenMiddlesNeverCoOccur() {
        // te and ke only ever appear apart
        LegalityPropagator p = new LegalityPropagator(vocabulary,
                graph(List.of(List.of("qotedy"), List.of("chkedy"))),
                ZoneVocabularyIndex.builder()
                        .add("c1", Zone.C, bundle(Set.of("te", "ke"), Set.of("qo", "ch"), Set.of("dy")))
                        .build(),
                DEFAULT_STAGES);
        LegalitySet r = p.propagate(bundle(Set.of("te", "ke"), Set.of("ch"), Set.of("dy")), Zone.C);
        assertEquals(LegalityStatus.BLOCKED, r.status());
        assertTrue(r.isEmpty());
    }

    @Test
    public void testRecordRules() {
        ZoneVocabularyIndex zones = ZoneVocabularyIndex.builder()
                .add("pos", Zone.R1, bundle(Set.of("te", "ke"), Set.of("qo", "ch"), Set.of("dy", "y")))
                .build();
        LegalityPropagator p = propagator(zones, DEFAULT_STAGES);

        Record unplaced = new Record("u", Zone.UNPLACED, SystemTag.REGISTRY, List.of("qotey"));
        LegalitySet u = p.propagate(unplaced, decomposer.decomposeAll(unplaced.tokens()));
        assertEquals(LegalityStatus.UNGATED, u.status());
        assertEquals("u", u.governingRecordId());
        assertEquals(Set.of("qotey"), u.tokens());

        Record positional = new Record("pos", Zone.R1, SystemTag.POSITIONAL, List.of("chkedy"));
        LegalitySet self = p.propagate(positional, decomposer.decomposeAll(positional.tokens()));
        assertEquals(LegalityStatus.GOVERNED, self.status());
        assertEquals("pos", self.governingRecordId());
        assertEquals(Set.of("chkedy"), self.tokens());

        Record registry = new Record("reg", Zone.R1, SystemTag.REGISTRY, List.of("qotedy"));
        LegalitySet gov = p.propagate(registry, decomposer.decomposeAll(registry.tokens()));
        assertEquals(LegalityStatus.GOVERNED, gov.status());
        assertEquals("pos", gov.governingRecordId());
        assertEquals("reg", gov.recordId());
        assertEquals(Zone.R1, gov.zone());
        assertEquals(Set.of("qotedy", "qotey", "chtedy", "chkedy"), gov.tokens());
    }
}
