package org.calista.morphon.engine.legality;

/** How the governing vocabulary of a LegalitySet was resolved. */
public enum LegalityStatus {
    /** A positional record of the zone (or the record itself) governs. */
    GOVERNED,
    /** Unplaced record: its own vocabulary governs without zone gating. */
    UNGATED,
    /** No record can supply the vocabulary in use; the set is empty. */
    BLOCKED
}
