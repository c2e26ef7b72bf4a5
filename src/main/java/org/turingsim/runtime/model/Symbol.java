package org.turingsim.runtime.model;

/**
 * A tape symbol of the unary multiplication machine.
 * <p>
 * Each symbol has a code character used in transition patterns and composite
 * read keys, and a display character used when rendering tapes.
 */
public enum Symbol {

    /** The unary digit. */
    ZERO('0', '0'),

    /** Separator between the two factors on the input tape. */
    ONE('1', '1'),

    /** Implicit value of every cell that was never written. */
    BLANK('B', ' ');

    private final char code;
    private final char display;

    Symbol(char code, char display) {
        this.code = code;
        this.display = display;
    }

    /**
     * @return the character used for this symbol in transition patterns.
     */
    public char code() {
        return code;
    }

    /**
     * @return the character used for this symbol when a tape is rendered.
     */
    public char display() {
        return display;
    }

    public boolean isBlank() {
        return this == BLANK;
    }

    /**
     * Resolves a pattern character to its symbol.
     *
     * @param code one of {@code 0}, {@code 1} or {@code B}.
     * @return the matching symbol.
     * @throws IllegalArgumentException if the character is not part of the alphabet.
     */
    public static Symbol fromCode(char code) {
        return switch (code) {
            case '0' -> ZERO;
            case '1' -> ONE;
            case 'B' -> BLANK;
            default -> throw new IllegalArgumentException("Unknown tape symbol '" + code + "'");
        };
    }
}
