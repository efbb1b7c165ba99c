package org.calista.morphon.engine.hazard;

import org.calista.morphon.engine.Fixtures;
import org.calista.morphon.engine.core.InvalidInputException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class HazardTableTest {

    @Test
    public void testBundledTableIsTheClosedPartition() {
        HazardTable t = Fixtures.hazards();
        assertEquals(HazardTable.EDGE_COUNT, t.size());
        Map<HazardCategory, Integer> c = t.countByCategory();
        assertEquals(Integer.valueOf(7), c.get(HazardCategory.PHASE_ORDERING));
        assertEquals(Integer.valueOf(4), c.get(HazardCategory.COMPOSITION_JUMP));
        assertEquals(Integer.valueOf(4), c.get(HazardCategory.CONTAINMENT_TIMING));
        assertEquals(Integer.valueOf(1), c.get(HazardCategory.RATE_MISMATCH));
        assertEquals(Integer.valueOf(1), c.get(HazardCategory.ENERGY_OVERSHOOT));
    }

    @Test
    public void testTransitionsAreDirected() {
        HazardTable t = Fixtures.hazards();
        assertTrue(t.isDisfavored(7, 30));
        assertFalse(t.isDisfavored(30, 7));
        assertEquals(HazardCategory.CONTAINMENT_TIMING, t.lookup(7, 30).get().category());
        assertFalse(t.lookup(30, 7).isPresent());
        assertTrue(t.sources().contains(7));
        assertFalse(t.sources().contains(30));
    }

    @Test
    public void testMissingTransitionRejected() {
        List<HazardTransition> l = new ArrayList<>(Fixtures.hazards().transitions());
        l.remove(l.size() - 1);
        try {
            HazardTable.of("short", l);
            fail("expected InvalidInputException");
        } catch (InvalidInputException e) {
            assertEquals("short", e.source());
        }
    }

    @Test(expected = InvalidInputException.class)
    public void testWrongCategorySizesRejected() {
        List<HazardTransition> l = new ArrayList<>(Fixtures.hazards().transitions());
        HazardTransition last = l.remove(l.size() - 1);
        l.add(new HazardTransition(last.from(), last.to(), HazardCategory.RATE_MISMATCH, 0.5, null));
        HazardTable.of("skewed", l);
    }

    @Test(expected = InvalidInputException.class)
    public void testDuplicatePairRejected() {
        List<HazardTransition> l = new ArrayList<>(Fixtures.hazards().transitions());
        HazardTransition first = l.get(0);
        l.set(1, new HazardTransition(first.from(), first.to(), first.category(), 0.1, null));
        HazardTable.of("dup", l);
    }

    @Test(expected = InvalidInputException.class)
    public void testClassOutOfRangeRejected() {
        List<HazardTransition> l = new ArrayList<>(Fixtures.hazards().transitions());
        HazardTransition first = l.get(0);
        l.set(0, new HazardTransition(50, first.to(), first.category(), 0.1, null));
        HazardTable.of("range", l);
    }

    @Test(expected = InvalidInputException.class)
    public void testUnknownCategoryInJsonRejected() {
        HazardTable.fromJson("bad.json",
                "{\"transitions\":[{\"from\":1,\"to\":2,\"category\":\"time-travel\"}]}", Fixtures.MAPPER);
    }

    @Test
    public void testPolicyParsing() {
        assertEquals(HazardPolicy.ADVISORY, HazardPolicy.parse(null));
        assertEquals(HazardPolicy.ADVISORY, HazardPolicy.parse("Advisory"));
        assertEquals(HazardPolicy.NONE, HazardPolicy.parse("none"));
        try {
            HazardPolicy.parse("reject");
            fail("reject must not be accepted");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("advisory only"));
        }
    }
}
