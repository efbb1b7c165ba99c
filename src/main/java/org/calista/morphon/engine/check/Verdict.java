package org.calista.morphon.engine.check;

public enum Verdict {
    AGREE,
    DISAGREE,
    /** Metric unknown or undefined on this snapshot. */
    INSUFFICIENT_DATA
}
