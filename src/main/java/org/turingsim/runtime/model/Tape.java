package org.turingsim.runtime.model;

import org.turingsim.runtime.InvalidDirectionException;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * An unbounded, sparsely populated tape with a single read/write head.
 * <p>
 * Only cells that have been written are stored; every other position reads as
 * {@link Symbol#BLANK}. The head starts at position 0 and may move to negative
 * positions.
 * <p>
 * Thread Safety: Not thread-safe. A tape is owned and mutated by exactly one machine.
 */
public class Tape {

    private final Int2ObjectOpenHashMap<Symbol> cells = new Int2ObjectOpenHashMap<>();
    private int head = 0;

    /**
     * Creates an empty tape.
     */
    public Tape() {
        this.cells.defaultReturnValue(Symbol.BLANK);
    }

    /**
     * Creates a tape with the given symbols written contiguously from position 0.
     * The head is left at position 0.
     *
     * @param initialContent the pattern characters to write, e.g. {@code "00100"}.
     */
    public Tape(String initialContent) {
        this();
        for (int i = 0; i < initialContent.length(); i++) {
            cells.put(i, Symbol.fromCode(initialContent.charAt(i)));
        }
    }

    /**
     * @return the symbol under the head, {@link Symbol#BLANK} if the cell was never written.
     */
    public Symbol read() {
        return cells.get(head);
    }

    /**
     * Reads an arbitrary position without moving the head.
     *
     * @param position the cell position.
     * @return the stored symbol, or {@link Symbol#BLANK} if the cell was never written.
     */
    public Symbol read(int position) {
        return cells.get(position);
    }

    /**
     * Writes a symbol at the head position, replacing any previous value.
     *
     * @param value the symbol to store.
     */
    public void write(Symbol value) {
        cells.put(head, value);
    }

    /**
     * Moves the head one cell in the given direction.
     *
     * @param direction the direction to move.
     * @throws InvalidDirectionException if {@code direction} is null.
     */
    public void move(Direction direction) {
        if (direction == null) {
            throw new InvalidDirectionException("Move direction must not be null");
        }
        head += direction.delta();
    }

    public int getHead() {
        return head;
    }

    /**
     * @return the number of cells holding a non-blank symbol.
     */
    public int occupiedCount() {
        int count = 0;
        for (Symbol symbol : cells.values()) {
            if (!symbol.isBlank()) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return the number of cells that have ever been written, blanks included.
     */
    public int getVisitedCount() {
        return cells.size();
    }

    /**
     * Projects the cells around the head for display.
     * <p>
     * Position {@code head - padding} maps to index 0 and the head itself to index
     * {@code padding}. Blank and unvisited cells render as a space.
     *
     * @param padding number of cells shown on each side of the head.
     * @return {@code 2 * padding + 1} display characters.
     */
    public char[] renderWindow(int padding) {
        if (padding < 0) {
            throw new IllegalArgumentException("Padding must not be negative: " + padding);
        }
        char[] window = new char[2 * padding + 1];
        int start = head - padding;
        for (int i = 0; i < window.length; i++) {
            window[i] = cells.get(start + i).display();
        }
        return window;
    }
}
