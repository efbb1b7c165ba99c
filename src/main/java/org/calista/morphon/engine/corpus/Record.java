package org.calista.morphon.engine.corpus;

import java.util.List;
import java.util.Objects;

/**
 * Ordered token sequence with a zone label and a system tag. Immutable.
 */
public final class Record {
    private final String id;
    private final Zone zone;
    private final SystemTag system;
    private final List<String> tokens;

    public Record(String id, Zone zone, SystemTag system, List<String> tokens) {
        this.id = Objects.requireNonNull(id, "id");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.system = Objects.requireNonNull(system, "system");
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    public String id() { return id; }
    public Zone zone() { return zone; }
    public SystemTag system() { return system; }
    public List<String> tokens() { return tokens; }
    public int size() { return tokens.size(); }

    @Override
    public String toString() {
        return "Record{" + id + ", " + zone + ", " + system.label() + ", " + tokens.size() + " tokens}";
    }
}
