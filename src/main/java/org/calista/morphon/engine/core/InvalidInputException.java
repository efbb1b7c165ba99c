package org.calista.morphon.engine.core;

/**
 * Malformed input detected at load time: broken corpus lines, empty records,
 * contradictory affix or class tables, a hazard table outside the closed partition.
 * Fails the run.
 */
public class InvalidInputException extends IllegalArgumentException {

    private final String source;

    public InvalidInputException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public InvalidInputException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    /** File, resource or table the problem was found in. */
    public String source() {
        return source;
    }
}
