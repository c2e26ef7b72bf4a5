package org.turingsim.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.turingsim.runtime.model.Transition;

/**
 * Immutable, ordered set of transitions with indexed lookup.
 * <p>
 * Rows are matched on {@code (required state, composite read key)}. The entry lookup,
 * used before any transition has fired, ignores the state and matches on the read key
 * alone. In both cases the first row in definition order wins, so the indexes return
 * exactly what a linear scan of the rows would.
 * <p>
 * Thread Safety: Instances are immutable and may be shared between machines.
 */
public final class TransitionTable {

    /**
     * The unary multiplication program for three tapes.
     * <p>
     * Tape 0 holds {@code 0^a 1 0^b}. State 0 copies the multiplier onto tape 1,
     * states 1-3 append one copy of the multiplier to tape 2 per multiplicand digit.
     */
    public static final TransitionTable UNARY_MULTIPLICATION = new TransitionTable(3, List.of(
        Transition.of(0, "0BB", "B0B", "RRN", 0),
        Transition.of(0, "1BB", "BBB", "RNN", 1),
        Transition.of(1, "0BB", "0BB", "NLN", 2),
        Transition.of(1, "BBB", "BBB", "NNN", Transition.HALT),
        Transition.of(2, "00B", "00B", "NLN", 2),
        Transition.of(2, "0BB", "0BB", "NRN", 3),
        Transition.of(3, "0BB", "BBB", "RNN", 1),
        Transition.of(3, "00B", "000", "NRR", 3)
    ));

    private final int tapeCount;
    private final List<Transition> transitions;
    private final Map<StateKey, Transition> byStateAndKey = new HashMap<>();
    private final Map<String, Transition> entryByKey = new HashMap<>();

    private record StateKey(int state, String readKey) {}

    /**
     * Creates a table and builds its lookup indexes.
     *
     * @param tapeCount   the number of tapes every row must address.
     * @param transitions the rows in definition order.
     * @throws IllegalArgumentException if the table is empty or a row has the wrong width.
     */
    public TransitionTable(int tapeCount, List<Transition> transitions) {
        if (tapeCount < 1) {
            throw new IllegalArgumentException("Tape count must be positive: " + tapeCount);
        }
        if (transitions.isEmpty()) {
            throw new IllegalArgumentException("Transition table must not be empty");
        }
        this.tapeCount = tapeCount;
        this.transitions = List.copyOf(transitions);

        for (Transition transition : this.transitions) {
            if (transition.width() != tapeCount) {
                throw new IllegalArgumentException(String.format(
                    "Transition '%s' addresses %d tapes, table has %d", transition, transition.width(), tapeCount));
            }
            byStateAndKey.putIfAbsent(new StateKey(transition.stateNumber(), transition.readKey()), transition);
            entryByKey.putIfAbsent(transition.readKey(), transition);
        }
    }

    /**
     * Looks up the row to fire in a given state.
     *
     * @param requiredState the state the row must belong to.
     * @param readKey       the composite key read from all tapes.
     * @return the first matching row in definition order, or empty if none matches.
     */
    public Optional<Transition> find(int requiredState, String readKey) {
        return Optional.ofNullable(byStateAndKey.get(new StateKey(requiredState, readKey)));
    }

    /**
     * Looks up the first row to fire, before any state has been entered.
     *
     * @param readKey the composite key read from all tapes.
     * @return the first row in definition order with this read key, in any state.
     */
    public Optional<Transition> findEntry(String readKey) {
        return Optional.ofNullable(entryByKey.get(readKey));
    }

    public int getTapeCount() {
        return tapeCount;
    }

    /**
     * @return all rows in definition order.
     */
    public List<Transition> getTransitions() {
        return transitions;
    }

    /**
     * @return the declared state numbers in order of first appearance.
     */
    public List<Integer> getStates() {
        Set<Integer> states = new LinkedHashSet<>();
        for (Transition transition : transitions) {
            states.add(transition.stateNumber());
        }
        return new ArrayList<>(states);
    }
}
