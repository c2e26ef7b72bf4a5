package org.turingsim.runtime;

import java.util.OptionalInt;

/**
 * Thrown when no transition matches the symbols under the heads in the required state.
 * <p>
 * The machine is deterministic, so this always means a malformed table or a
 * configuration the table was not designed for. It is fatal and never retried.
 */
public class NoMatchingTransitionException extends RuntimeException {

    private final String readKey;
    private final OptionalInt expectedState;

    /**
     * Creates the exception for a failed lookup.
     *
     * @param readKey       the composite key read from all tapes.
     * @param expectedState the state the matching row had to belong to, empty for the entry lookup.
     */
    public NoMatchingTransitionException(String readKey, OptionalInt expectedState) {
        super(expectedState.isPresent()
            ? String.format("No transition for key %s in state %d", readKey, expectedState.getAsInt())
            : String.format("No entry transition for key %s", readKey));
        this.readKey = readKey;
        this.expectedState = expectedState;
    }

    public String getReadKey() {
        return readKey;
    }

    public OptionalInt getExpectedState() {
        return expectedState;
    }
}
