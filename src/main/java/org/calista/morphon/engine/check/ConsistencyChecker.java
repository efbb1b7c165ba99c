package org.calista.morphon.engine.check;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Compares live values with asserted ones. Pure with respect to its probe: checking the
 * same assertions twice yields the same entries.
 */
public final class ConsistencyChecker {
    private static final Logger log = LogManager.getLogger(ConsistencyChecker.class);

    private final MetricProbe probe;
    private final double defaultTolerance;

    public ConsistencyChecker(MetricProbe probe, double defaultTolerance) {
        this.probe = Objects.requireNonNull(probe, "probe");
        if (defaultTolerance < 0 || Double.isNaN(defaultTolerance)) {
            throw new IllegalArgumentException("tolerance must be >= 0: " + defaultTolerance);
        }
        this.defaultTolerance = defaultTolerance;
    }

    public double defaultTolerance() { return defaultTolerance; }

    public CheckEntry check(ConstraintAssertion a) {
        Objects.requireNonNull(a, "assertion");
        double tol = (a.tolerance() != null) ? a.tolerance() : defaultTolerance;

        OptionalDouble v = probe.measure(a.metric(), a.scope());
        if (v.isEmpty() || Double.isNaN(v.getAsDouble())) {
            return new CheckEntry(a, Double.NaN, tol, Verdict.INSUFFICIENT_DATA);
        }

        double computed = v.getAsDouble();
        Verdict verdict = a.comparison().holds(computed, a.value(), tol) ? Verdict.AGREE : Verdict.DISAGREE;
        CheckEntry e = new CheckEntry(a, computed, tol, verdict);
        if (e.severity == Severity.CRITICAL) {
            log.warn("Assertion {} (tier {}) disagrees: computed={} asserted={} {}", a.id(), a.tier(), computed, a.comparison(), a.value());
        }
        return e;
    }

    public List<CheckEntry> checkAll(Collection<ConstraintAssertion> assertions) {
        List<CheckEntry> out = new ArrayList<>(assertions.size());
        for (ConstraintAssertion a : assertions) out.add(check(a));
        return out;
    }
}
