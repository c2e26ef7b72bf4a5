package org.turingsim.runtime;

/**
 * Thrown when a move pattern contains something other than left, right or none.
 * <p>
 * This indicates a malformed transition table, not a runtime data condition, and is
 * never recovered from. The engine does not catch it; the run is aborted.
 */
public class InvalidDirectionException extends RuntimeException {

    /**
     * Creates an exception for an unknown move-pattern character.
     *
     * @param code the offending character.
     */
    public InvalidDirectionException(char code) {
        super("Unknown direction '" + code + "'");
    }

    /**
     * Creates an exception with the specified message.
     *
     * @param message Description of the invalid direction
     */
    public InvalidDirectionException(String message) {
        super(message);
    }
}
