package org.calista.morphon.engine.classify;

public enum Outcome {
    CLASSIFIED,
    OVERFLOW,
    UNCLASSIFIED
}
