package org.turingsim.cli.rendering;

import org.turingsim.runtime.TuringMachine;
import org.turingsim.runtime.model.Transition;

/**
 * Renders the fired transition, the step counter and a window of every tape.
 * <p>
 * Example with a padding of 2:
 * <pre>
 * Computing 2 x 3
 *
 * Current State:
 *  Number: 0
 *  Read:   0BB
 *  Write:  B0B
 *  Move:   RRN
 *  Next:   0
 *
 * Step #1
 *
 *      R
 * | | |0|1|0|
 * | |0| | | |
 * | | | | | |
 * </pre>
 * The {@code R} marks the column under which every head sits.
 */
public class StateInfoRenderer implements IMachineRenderer {

    private final int padding;

    /**
     * @param padding number of cells shown on each side of the head.
     */
    public StateInfoRenderer(int padding) {
        if (padding < 0) {
            throw new IllegalArgumentException("Padding must not be negative: " + padding);
        }
        this.padding = padding;
    }

    @Override
    public String render(TuringMachine machine, Transition fired) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Computing %d x %d%n%n", machine.getMultiplier(), machine.getMultiplicand()));

        sb.append(String.format("Current State:%n"));
        if (fired != null) {
            appendField(sb, "Number: ", Integer.toString(fired.stateNumber()));
            appendField(sb, "Read:   ", fired.readKey());
            appendField(sb, "Write:  ", fired.writeKey());
            appendField(sb, "Move:   ", fired.moveKey());
            appendField(sb, "Next:   ", fired.nextStateLabel());
        } else {
            appendField(sb, "Number: ", "");
            appendField(sb, "Read:   ", "");
            appendField(sb, "Write:  ", "");
            appendField(sb, "Move:   ", "");
            appendField(sb, "Next:   ", "");
        }
        sb.append(String.format("%n"));

        sb.append(String.format("Step #%d%n%n", machine.getStepCount()));

        sb.append(" ".repeat(1 + 2 * padding)).append('R').append(String.format("%n"));
        for (char[] window : machine.renderTapes(padding)) {
            sb.append(formatWindow(window)).append(String.format("%n"));
        }
        return sb.toString();
    }

    /**
     * Joins tape cells with {@code |} separators, e.g. {@code |0|1| |}.
     *
     * @param window the display characters of a tape window.
     * @return the formatted line without a line separator.
     */
    static String formatWindow(char[] window) {
        StringBuilder sb = new StringBuilder(window.length * 2 + 1);
        sb.append('|');
        for (char cell : window) {
            sb.append(cell).append('|');
        }
        return sb.toString();
    }

    private static void appendField(StringBuilder sb, String label, String value) {
        sb.append(' ').append(label).append(value).append(String.format("%n"));
    }
}
