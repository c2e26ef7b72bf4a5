package org.turingsim.cli.rendering;

import java.util.ArrayList;
import java.util.List;

import org.turingsim.runtime.TuringMachine;
import org.turingsim.runtime.model.Transition;

/**
 * Draws the states of the machine's table as a row of ASCII boxes.
 * <p>
 * The state the machine is currently in is drawn with {@code #} borders, all other
 * states with {@code +-|}. The transition that fired last is shown as an edge below
 * the boxes:
 * <pre>
 * +---+  +---+  #####  +---+  +------+
 * | 0 |  | 1 |  # 2 #  | 3 |  | HALT |
 * +---+  +---+  #####  +---+  +------+
 *   1 --[0BB/0BB/NLN]--> 2
 * </pre>
 * Before the first step the first declared state is the current one.
 */
public class StateDiagramRenderer implements IMachineRenderer {

    private static final String HALT_LABEL = "HALT";
    private static final String GAP = "  ";

    @Override
    public String render(TuringMachine machine, Transition fired) {
        List<String> labels = new ArrayList<>();
        for (Integer state : machine.getTransitionTable().getStates()) {
            labels.add(Integer.toString(state));
        }
        labels.add(HALT_LABEL);

        String active = activeLabel(machine, fired);

        StringBuilder top = new StringBuilder();
        StringBuilder middle = new StringBuilder();
        StringBuilder bottom = new StringBuilder();
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) {
                top.append(GAP);
                middle.append(GAP);
                bottom.append(GAP);
            }
            String label = labels.get(i);
            boolean highlighted = label.equals(active);
            String border = highlighted
                ? "#".repeat(label.length() + 4)
                : "+" + "-".repeat(label.length() + 2) + "+";
            char side = highlighted ? '#' : '|';
            top.append(border);
            middle.append(side).append(' ').append(label).append(' ').append(side);
            bottom.append(border);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(top).append(String.format("%n"));
        sb.append(middle).append(String.format("%n"));
        sb.append(bottom).append(String.format("%n"));
        if (fired != null) {
            sb.append(String.format("  %d --[%s/%s/%s]--> %s%n",
                fired.stateNumber(), fired.readKey(), fired.writeKey(), fired.moveKey(), fired.nextStateLabel()));
        }
        return sb.toString();
    }

    private static String activeLabel(TuringMachine machine, Transition fired) {
        if (fired != null) {
            return fired.nextStateLabel();
        }
        return Integer.toString(machine.getTransitionTable().getStates().get(0));
    }
}
