package org.calista.morphon.engine.check;

import java.util.Objects;

/**
 * Externally authored claim about a measurable quantity. Read-only input: the engine
 * never edits one, the ledger only adds revisions.
 */
public final class ConstraintAssertion {

    public static final int MIN_TIER = 0;
    public static final int MAX_TIER = 4;

    private final String id;
    private final int tier;
    private final String claim;
    private final String scope;
    private final String metric;
    private final double value;
    private final Comparison comparison;
    private final Double tolerance;

    public ConstraintAssertion(String id, int tier, String claim, String scope, String metric,
                               double value, Comparison comparison, Double tolerance) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("assertion id is blank");
        if (tier < MIN_TIER || tier > MAX_TIER) {
            throw new IllegalArgumentException("assertion " + id + ": tier out of range " + MIN_TIER + ".." + MAX_TIER + ": " + tier);
        }
        if (metric == null || metric.isBlank()) throw new IllegalArgumentException("assertion " + id + ": metric is blank");
        if (Double.isNaN(value)) throw new IllegalArgumentException("assertion " + id + ": value is NaN");
        if (tolerance != null && (tolerance < 0 || tolerance.isNaN())) {
            throw new IllegalArgumentException("assertion " + id + ": negative tolerance " + tolerance);
        }
        this.id = id.trim();
        this.tier = tier;
        this.claim = claim == null ? "" : claim;
        this.scope = (scope == null || scope.isBlank()) ? null : scope.trim();
        this.metric = metric.trim();
        this.value = value;
        this.comparison = Objects.requireNonNull(comparison, "comparison");
        this.tolerance = tolerance;
    }

    public String id() { return id; }
    public int tier() { return tier; }
    public String claim() { return claim; }
    /** {@code null} for corpus-wide claims. */
    public String scope() { return scope; }
    public String metric() { return metric; }
    public double value() { return value; }
    public Comparison comparison() { return comparison; }
    /** {@code null} means the checker's default tolerance applies. */
    public Double tolerance() { return tolerance; }

    /** Tier 0 and 1 claims cannot be silently replaced. */
    public boolean isProtected() { return tier <= 1; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstraintAssertion)) return false;
        ConstraintAssertion a = (ConstraintAssertion) o;
        return tier == a.tier && Double.compare(value, a.value) == 0 && id.equals(a.id)
                && claim.equals(a.claim) && Objects.equals(scope, a.scope) && metric.equals(a.metric)
                && comparison == a.comparison && Objects.equals(tolerance, a.tolerance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tier, claim, scope, metric, value, comparison, tolerance);
    }

    @Override
    public String toString() {
        return id + "[t" + tier + "] " + metric + (scope == null ? "" : "@" + scope)
                + " " + comparison + " " + value + (tolerance == null ? "" : " ±" + tolerance);
    }
}
