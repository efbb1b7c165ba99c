package org.calista.morphon.engine.check;

import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.Assert.*;

public class ConsistencyCheckerTest {

    private static MetricProbe probe(Map<String, Double> values) {
        return (metric, scope) -> values.containsKey(metric)
                ? OptionalDouble.of(values.get(metric))
                : OptionalDouble.empty();
    }

    private static ConstraintAssertion density(int tier, Double tolerance) {
        return new ConstraintAssertion("GR-01", tier, "graph is sparse", null,
                "graph.edge_density_pct", 4.3, Comparison.EQUALS, tolerance);
    }

    @Test
    public void testWithinToleranceAgrees() {
        CheckEntry e = new ConsistencyChecker(probe(Map.of("graph.edge_density_pct", 4.1)), 0.5)
                .check(density(2, null));
        assertEquals(Verdict.AGREE, e.verdict);
        assertEquals(Severity.NONE, e.severity);
        assertEquals(4.1, e.computed, 1e-12);
        assertEquals(4.3, e.asserted, 1e-12);
        assertEquals(0.5, e.tolerance, 1e-12);
    }

    @Test
    public void testOutsideToleranceDisagrees() {
        CheckEntry e = new ConsistencyChecker(probe(Map.of("graph.edge_density_pct", 3.5)), 0.5)
                .check(density(2, null));
        assertEquals(Verdict.DISAGREE, e.verdict);
        assertEquals(Severity.WARNING, e.severity);
    }

    @Test
    public void testToleranceBoundaryIsInclusive() {
        ConsistencyChecker at = new ConsistencyChecker(probe(Map.of("graph.edge_density_pct", 3.8)), 0.5);
        assertEquals(Verdict.AGREE, at.check(density(2, null)).verdict);

        ConsistencyChecker above = new ConsistencyChecker(probe(Map.of("graph.edge_density_pct", 4.81)), 0.5);
        assertEquals(Verdict.DISAGREE, above.check(density(2, null)).verdict);
    }

    @Test
    public void testAssertionToleranceOverridesDefault() {
        ConsistencyChecker c = new ConsistencyChecker(probe(Map.of("graph.edge_density_pct", 3.5)), 0.5);
        CheckEntry e = c.check(density(2, 1.0));
        assertEquals(Verdict.AGREE, e.verdict);
        assertEquals(1.0, e.tolerance, 1e-12);
    }

    @Test
    public void testDirectionalComparisons() {
        ConsistencyChecker c = new ConsistencyChecker(probe(Map.of("class.distinct", 49.0)), 0.0);
        ConstraintAssertion atMost = new ConstraintAssertion("CL-01", 1, "", "global", "class.distinct", 49, Comparison.AT_MOST, null);
        ConstraintAssertion atLeast = new ConstraintAssertion("CL-09", 1, "", "global", "class.distinct", 50, Comparison.AT_LEAST, null);
        assertEquals(Verdict.AGREE, c.check(atMost).verdict);
        assertEquals(Verdict.DISAGREE, c.check(atLeast).verdict);
        assertEquals(Severity.CRITICAL, c.check(atLeast).severity);
    }

    @Test
    public void testUnknownMetricIsInsufficientData() {
        ConstraintAssertion a = new ConstraintAssertion("X-01", 0, "", null, "no.such.metric", 1, Comparison.EQUALS, null);
        CheckEntry e = new ConsistencyChecker(probe(Map.of()), 0.5).check(a);
        assertEquals(Verdict.INSUFFICIENT_DATA, e.verdict);
        // tier 0, but there is nothing to disagree with
        assertEquals(Severity.NONE, e.severity);
        assertTrue(Double.isNaN(e.computed));
    }

    @Test
    public void testNaNMeasurementIsInsufficientData() {
        CheckEntry e = new ConsistencyChecker(probe(Map.of("graph.edge_density_pct", Double.NaN)), 0.5)
                .check(density(0, null));
        assertEquals(Verdict.INSUFFICIENT_DATA, e.verdict);
    }

    @Test
    public void testCheckingIsIdempotentAndLeavesAssertionsAlone() {
        ConstraintAssertion a = density(2, null);
        ConstraintAssertion copy = density(2, null);
        ConsistencyChecker c = new ConsistencyChecker(probe(Map.of("graph.edge_density_pct", 47.1)), 0.5);

        List<CheckEntry> first = c.checkAll(List.of(a));
        List<CheckEntry> second = c.checkAll(List.of(a));
        assertEquals(first.get(0).verdict, second.get(0).verdict);
        assertEquals(first.get(0).computed, second.get(0).computed, 0.0);
        assertEquals(copy, a);
        assertEquals(4.3, a.value(), 0.0);
    }

    @Test
    public void testSeverityMapping() {
        assertEquals(Severity.CRITICAL, Severity.of(0, Verdict.DISAGREE));
        assertEquals(Severity.CRITICAL, Severity.of(1, Verdict.DISAGREE));
        assertEquals(Severity.WARNING, Severity.of(2, Verdict.DISAGREE));
        assertEquals(Severity.INFORMATIONAL, Severity.of(3, Verdict.DISAGREE));
        assertEquals(Severity.INFORMATIONAL, Severity.of(4, Verdict.DISAGREE));
        assertEquals(Severity.NONE, Severity.of(0, Verdict.AGREE));
        assertEquals(Severity.NONE, Severity.of(0, Verdict.INSUFFICIENT_DATA));
        assertEquals(Severity.NONE, Severity.of(4, Verdict.INSUFFICIENT_DATA));
    }

    @Test
    public void testComparisonParsing() {
        assertEquals(Comparison.EQUALS, Comparison.parse(null));
        assertEquals(Comparison.EQUALS, Comparison.parse("=="));
        assertEquals(Comparison.AT_LEAST, Comparison.parse(">="));
        assertEquals(Comparison.AT_MOST, Comparison.parse("at-most"));
        assertTrue(Comparison.EQUALS.holds(4.1, 4.6, 0.5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTierOutOfRangeRejected() {
        new ConstraintAssertion("T-01", 5, "", null, "graph.edges", 1, Comparison.EQUALS, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeToleranceRejected() {
        new ConstraintAssertion("T-02", 2, "", null, "graph.edges", 1, Comparison.EQUALS, -0.1);
    }
}
