package org.turingsim.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A single row of a transition table.
 * <p>
 * A transition fires when the machine is in {@code stateNumber} and the symbols under
 * the heads, read in tape order, equal {@code read}. It then writes {@code write} and
 * moves each head by {@code move}, tape by tape, and continues in {@code nextState}.
 *
 * @param stateNumber the state this row belongs to.
 * @param read        the symbols that must be under the heads, one per tape.
 * @param write       the symbols written at the heads, one per tape.
 * @param move        the head movements applied after writing, one per tape.
 * @param nextState   the successor state, or {@link #HALT}.
 */
public record Transition(int stateNumber, List<Symbol> read, List<Symbol> write, List<Direction> move, int nextState) {

    /** Successor value that stops the machine. */
    public static final int HALT = -1;

    public Transition {
        if (stateNumber < 0) {
            throw new IllegalArgumentException("State number must not be negative: " + stateNumber);
        }
        if (nextState < 0 && nextState != HALT) {
            throw new IllegalArgumentException("Invalid next state: " + nextState);
        }
        read = List.copyOf(read);
        write = List.copyOf(write);
        move = List.copyOf(move);
        if (read.size() != write.size() || read.size() != move.size()) {
            throw new IllegalArgumentException(String.format(
                "Pattern widths differ in state %d: read=%d, write=%d, move=%d",
                stateNumber, read.size(), write.size(), move.size()));
        }
    }

    /**
     * Builds a transition from compact pattern strings, e.g.
     * {@code Transition.of(0, "0BB", "B0B", "RRN", 0)}.
     *
     * @param stateNumber the state this row belongs to.
     * @param read        symbol codes to match.
     * @param write       symbol codes to write.
     * @param move        direction codes ({@code L}, {@code R}, {@code N}).
     * @param nextState   the successor state, or {@link #HALT}.
     * @return the transition.
     * @throws org.turingsim.runtime.InvalidDirectionException if {@code move} contains an unknown code.
     */
    public static Transition of(int stateNumber, String read, String write, String move, int nextState) {
        return new Transition(stateNumber, parseSymbols(read), parseSymbols(write), parseDirections(move), nextState);
    }

    /**
     * @return the number of tapes this transition addresses.
     */
    public int width() {
        return read.size();
    }

    public boolean isHalting() {
        return nextState == HALT;
    }

    /**
     * @return the read pattern as a composite key, e.g. {@code "0BB"}.
     */
    public String readKey() {
        return symbolKey(read);
    }

    public String writeKey() {
        return symbolKey(write);
    }

    public String moveKey() {
        StringBuilder sb = new StringBuilder(move.size());
        for (Direction direction : move) {
            sb.append(direction.code());
        }
        return sb.toString();
    }

    /**
     * @return the successor state for display, {@code "HALT"} for the sentinel.
     */
    public String nextStateLabel() {
        return isHalting() ? "HALT" : Integer.toString(nextState);
    }

    /**
     * Concatenates symbol codes in order.
     *
     * @param symbols the symbols to join.
     * @return the composite key.
     */
    public static String symbolKey(List<Symbol> symbols) {
        StringBuilder sb = new StringBuilder(symbols.size());
        for (Symbol symbol : symbols) {
            sb.append(symbol.code());
        }
        return sb.toString();
    }

    private static List<Symbol> parseSymbols(String codes) {
        List<Symbol> symbols = new ArrayList<>(codes.length());
        for (int i = 0; i < codes.length(); i++) {
            symbols.add(Symbol.fromCode(codes.charAt(i)));
        }
        return symbols;
    }

    private static List<Direction> parseDirections(String codes) {
        List<Direction> directions = new ArrayList<>(codes.length());
        for (int i = 0; i < codes.length(); i++) {
            directions.add(Direction.fromCode(codes.charAt(i)));
        }
        return directions;
    }

    @Override
    public String toString() {
        return String.format("%d: %s -> %s %s -> %s", stateNumber, readKey(), writeKey(), moveKey(), nextStateLabel());
    }
}
