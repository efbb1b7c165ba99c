package org.calista.morphon.engine.graph;

/** Answer of a pairwise compatibility query. */
public enum Compatibility {
    COMPATIBLE,
    INCOMPATIBLE,
    /** At least one MIDDLE is not a node of the graph. The query alone is affected. */
    UNKNOWN_MORPHEME
}
