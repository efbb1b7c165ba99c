package org.calista.morphon.engine.classify.impl;

import org.calista.morphon.engine.Fixtures;
import org.calista.morphon.engine.classify.ClassTable;
import org.calista.morphon.engine.classify.ClassificationGap;
import org.calista.morphon.engine.classify.ClassifiedToken;
import org.calista.morphon.engine.classify.InstructionClass;
import org.calista.morphon.engine.classify.MatchKind;
import org.calista.morphon.engine.classify.Outcome;
import org.calista.morphon.engine.classify.UnparsedPolicy;
import org.calista.morphon.engine.core.InvalidInputException;
import org.calista.morphon.engine.morphology.impl.AffixDecomposer;
import org.junit.Test;

import java.util.Set;
import java.util.TreeSet;

import static org.junit.Assert.*;

public class TableClassifierTest {

    private final AffixDecomposer decomposer = Fixtures.decomposer();
    private final TableClassifier classifier = Fixtures.classifier();

    private ClassifiedToken classify(String token) {
        return classifier.classify(decomposer.decompose(token));
    }

    @Test
    public void testEveryReferenceMemberIsExactToItsClass() {
        ClassTable table = Fixtures.classes();
        Set<Integer> seen = new TreeSet<>();
        int members = 0;
        for (InstructionClass c : table.classes().values()) {
            members += c.members().size();
            for (String member : c.members()) {
                ClassifiedToken t = classify(member);
                assertEquals(member, MatchKind.EXACT, t.kind());
                assertEquals(member, c.id(), t.classId());
                seen.add(t.classId());
            }
        }
        assertEquals(ClassTable.CLASS_COUNT, seen.size());
        assertEquals(members, table.referenceVocabulary().size());
        assertTrue(table.keyCount() > 0);
        assertTrue(table.keyCount() <= members);
    }

    @Test
    public void testExactLookups() {
        assertEquals(18, classify("kaiin").classId());
        assertEquals(27, classify("tedy").classId());
        assertEquals(1, classify("dain").classId());
        assertEquals(MatchKind.EXACT, classify("shey").kind());
    }

    @Test
    public void testPrefixFallbackPicksLowestIdOnTie() {
        ClassifiedToken t = classify("qokam");
        assertEquals(MatchKind.PREFIX_FALLBACK, t.kind());
        assertEquals(32, t.classId());
    }

    @Test
    public void testSuffixFallback() {
        ClassifiedToken a = classify("shkaiin");
        assertEquals(MatchKind.SUFFIX_FALLBACK, a.kind());
        assertEquals(32, a.classId());

        ClassifiedToken b = classify("qoedy");
        assertEquals(MatchKind.SUFFIX_FALLBACK, b.kind());
        assertEquals(34, b.classId());
    }

    @Test
    public void testMiddleFallback() {
        ClassifiedToken a = classify("chtom");
        assertEquals(MatchKind.MIDDLE_FALLBACK, a.kind());
        assertEquals(39, a.classId());

        ClassifiedToken b = classify("shlom");
        assertEquals(MatchKind.MIDDLE_FALLBACK, b.kind());
        assertEquals(4, b.classId());
    }

    @Test
    public void testBareTokensOnlyReachBareClasses() {
        ClassifiedToken rain = classify("rain");
        assertEquals(MatchKind.PREFIX_FALLBACK, rain.kind());
        assertEquals(2, rain.classId());
        assertTrue(Fixtures.classes().bareClasses().contains(rain.classId()));

        ClassifiedToken oedy = classify("oedy");
        assertEquals(15, oedy.classId());

        // edy only appears under prefixed classes
        ClassifiedToken edy = classify("edy");
        assertEquals(Outcome.OVERFLOW, edy.outcome());
        assertEquals(MatchKind.GAP, edy.kind());
    }

    @Test
    public void testUnknownMiddleIsGap() {
        ClassifiedToken t = classify("qotchedy");
        assertEquals(Outcome.OVERFLOW, t.outcome());
        assertEquals(ClassifiedToken.OVERFLOW_ID, t.classId());
        assertEquals(MatchKind.GAP, t.kind());

        ClassificationGap gap = ClassificationGap.of(t);
        assertEquals("qotchedy", gap.token);
        assertEquals("qo", gap.prefixFamily);
        assertEquals("tch", gap.middle);
        assertEquals("dy", gap.suffixFamily);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGapOfClassifiedTokenRejected() {
        ClassificationGap.of(classify("chol"));
    }

    @Test
    public void testUnparsedDropped() {
        ClassifiedToken t = classify("y*dy");
        assertEquals(Outcome.UNCLASSIFIED, t.outcome());
        assertEquals(ClassifiedToken.UNCLASSIFIED_ID, t.classId());
        assertEquals(MatchKind.UNPARSED, t.kind());
    }

    @Test
    public void testUnparsedRetainedAsOverflow() {
        TableClassifier retain = new TableClassifier(Fixtures.classes(), UnparsedPolicy.RETAIN_AS_OVERFLOW);
        ClassifiedToken t = retain.classify(decomposer.decompose("y*dy"));
        assertEquals(Outcome.OVERFLOW, t.outcome());
        assertEquals(ClassifiedToken.OVERFLOW_ID, t.classId());
        assertEquals(MatchKind.UNPARSED, t.kind());
    }

    @Test
    public void testClassificationIsDeterministic() {
        TableClassifier other = new TableClassifier(Fixtures.classes());
        for (String s : new String[]{"qokam", "shkaiin", "chtom", "qotchedy", "y*dy", "daiin"}) {
            assertEquals(s, classify(s), other.classify(decomposer.decompose(s)));
        }
    }

    @Test
    public void testConflictingMembersRejectedAtLoad() {
        String json = "{\"classes\":["
                + "{\"id\":1,\"role\":\"AUXILIARY\",\"members\":[\"chol\"]},"
                + "{\"id\":2,\"role\":\"AUXILIARY\",\"members\":[\"chol\"]}]}";
        try {
            ClassTable.fromJson("conflict.json", json, Fixtures.MAPPER, decomposer);
            fail("expected InvalidInputException");
        } catch (InvalidInputException e) {
            assertEquals("conflict.json", e.source());
            assertTrue(e.getMessage(), e.getMessage().contains("claimed by classes 1 and 2"));
        }
    }

    @Test(expected = InvalidInputException.class)
    public void testIncompleteTableRejected() {
        String json = "{\"classes\":[{\"id\":1,\"role\":\"AUXILIARY\",\"members\":[\"daiin\"]}]}";
        ClassTable.fromJson("short.json", json, Fixtures.MAPPER, decomposer);
    }

    @Test(expected = InvalidInputException.class)
    public void testUndecomposableMemberRejected() {
        String json = "{\"classes\":[{\"id\":1,\"role\":\"AUXILIARY\",\"members\":[\"d*in\"]}]}";
        ClassTable.fromJson("bad-member.json", json, Fixtures.MAPPER, decomposer);
    }
}
