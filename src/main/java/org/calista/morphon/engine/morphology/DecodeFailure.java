package org.calista.morphon.engine.morphology;

/** Why a token could not be decomposed. */
public enum DecodeFailure {
    EMPTY,
    /** Character outside the table alphabet, including the uncertain-reading marker '*'. */
    ILLEGAL_CHARACTER
}
