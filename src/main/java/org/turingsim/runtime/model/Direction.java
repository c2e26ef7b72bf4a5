package org.turingsim.runtime.model;

import org.turingsim.runtime.InvalidDirectionException;

/**
 * Head movement applied to a tape after a transition has written its symbol.
 */
public enum Direction {

    LEFT('L', -1),
    RIGHT('R', 1),
    NONE('N', 0);

    private final char code;
    private final int delta;

    Direction(char code, int delta) {
        this.code = code;
        this.delta = delta;
    }

    /**
     * @return the character used for this direction in move patterns.
     */
    public char code() {
        return code;
    }

    /**
     * @return the signed change applied to the head position.
     */
    public int delta() {
        return delta;
    }

    /**
     * Resolves a move-pattern character to its direction.
     *
     * @param code one of {@code L}, {@code R} or {@code N}.
     * @return the matching direction.
     * @throws InvalidDirectionException for any other character.
     */
    public static Direction fromCode(char code) {
        return switch (code) {
            case 'L' -> LEFT;
            case 'R' -> RIGHT;
            case 'N' -> NONE;
            default -> throw new InvalidDirectionException(code);
        };
    }
}
