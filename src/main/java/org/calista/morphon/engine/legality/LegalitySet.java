package org.calista.morphon.engine.legality;

import org.calista.morphon.engine.corpus.Zone;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Downstream-legal tokens derived for one record, plus the size after each cascade
 * stage. Computed on demand; an empty set is a valid result.
 */
public final class LegalitySet {

    /** Candidate count left after one stage. */
    public static final class Step {
        public final CascadeStage stage;
        public final int size;

        public Step(CascadeStage stage, int size) {
            this.stage = Objects.requireNonNull(stage, "stage");
            this.size = size;
        }

        @Override
        public String toString() {
            return stage + "=" + size;
        }
    }

    private final String recordId;
    private final Zone zone;
    private final String governingRecordId;
    private final LegalityStatus status;
    private final int initialSize;
    private final List<Step> trace;
    private final Set<String> tokens;

    public LegalitySet(String recordId, Zone zone, String governingRecordId, LegalityStatus status,
                       int initialSize, List<Step> trace, Set<String> tokens) {
        this.recordId = recordId;
        this.zone = Objects.requireNonNull(zone, "zone");
        this.governingRecordId = governingRecordId;
        this.status = Objects.requireNonNull(status, "status");
        this.initialSize = initialSize;
        this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
        this.tokens = Collections.unmodifiableSet(new TreeSet<>(tokens));
    }

    public String recordId() { return recordId; }
    public Zone zone() { return zone; }
    /** {@code null} when BLOCKED. */
    public String governingRecordId() { return governingRecordId; }
    public LegalityStatus status() { return status; }
    /** Global vocabulary size the cascade started from. */
    public int initialSize() { return initialSize; }
    public List<Step> trace() { return trace; }
    public Set<String> tokens() { return tokens; }
    public int size() { return tokens.size(); }
    public boolean isEmpty() { return tokens.isEmpty(); }

    @Override
    public String toString() {
        return "LegalitySet{" + recordId + " " + status + " via " + governingRecordId + " " + trace + " -> " + tokens.size() + "}";
    }
}
