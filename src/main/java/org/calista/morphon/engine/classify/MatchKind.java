package org.calista.morphon.engine.classify;

/** Which lookup step produced a classification. */
public enum MatchKind {
    /** (prefix family, MIDDLE, suffix family) found as-is. */
    EXACT,
    /** Prefix family and MIDDLE matched, suffix family relaxed. */
    PREFIX_FALLBACK,
    /** MIDDLE and suffix family matched, prefix family relaxed. */
    SUFFIX_FALLBACK,
    /** MIDDLE alone matched. */
    MIDDLE_FALLBACK,
    /** Known or unknown affixes around an unknown MIDDLE: routed to overflow. */
    GAP,
    /** Token did not decompose. */
    UNPARSED
}
