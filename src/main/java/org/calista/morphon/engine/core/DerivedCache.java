package org.calista.morphon.engine.core;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Derived artifacts (compatibility graph, ...) keyed by the fingerprint of what they
 * were derived from. A key that did not change is never rebuilt.
 */
public final class DerivedCache {

    private final ConcurrentMap<String, Object> values = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong builds = new AtomicLong();

    public static String key(String kind, long... fingerprints) {
        StringBuilder b = new StringBuilder(kind);
        for (long f : fingerprints) b.append(':').append(Long.toHexString(f));
        return b.toString();
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrBuild(String key, Supplier<T> builder) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(builder, "builder");
        Object v = values.get(key);
        if (v != null) {
            hits.incrementAndGet();
            return (T) v;
        }
        return (T) values.computeIfAbsent(key, k -> {
            builds.incrementAndGet();
            return Objects.requireNonNull(builder.get(), "derived value");
        });
    }

    public void invalidateAll() {
        values.clear();
    }

    public long hits() { return hits.get(); }

    public long builds() { return builds.get(); }

    public int size() { return values.size(); }
}
