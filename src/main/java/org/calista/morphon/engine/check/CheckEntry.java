package org.calista.morphon.engine.check;

/** One row of the check report. {@code computed} is NaN when no value could be derived. */
public final class CheckEntry {
    public final String assertionId;
    public final int tier;
    public final String metric;
    public final String scope;
    public final Comparison comparison;
    public final double asserted;
    public final double computed;
    public final double tolerance;
    public final Verdict verdict;
    public final Severity severity;

    CheckEntry(ConstraintAssertion a, double computed, double tolerance, Verdict verdict) {
        this.assertionId = a.id();
        this.tier = a.tier();
        this.metric = a.metric();
        this.scope = a.scope();
        this.comparison = a.comparison();
        this.asserted = a.value();
        this.computed = computed;
        this.tolerance = tolerance;
        this.verdict = verdict;
        this.severity = Severity.of(a.tier(), verdict);
    }

    @Override
    public String toString() {
        return assertionId + ": " + verdict + " (" + severity + ") computed=" + computed + " asserted=" + asserted;
    }
}
