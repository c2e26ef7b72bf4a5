package org.turingsim.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import org.turingsim.runtime.model.Tape;
import org.turingsim.runtime.model.Transition;
import org.turingsim.runtime.spi.IStepListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic multi-tape Turing machine driven by a {@link TransitionTable}.
 * <p>
 * The machine advances one transition per {@link #step()}. Each step reads the symbol
 * under every head, looks up the row for that composite key in the state named by the
 * previously fired transition, writes and moves each tape in order, and remembers the
 * fired row for the next lookup. The first step uses the entry lookup, which matches
 * the read key in any state.
 * <p>
 * For multiplication the first tape starts with {@code multiplier} zeros, a {@code 1}
 * separator and {@code multiplicand} zeros; the product is the number of non-blank
 * cells on the last tape once the machine has halted.
 * <p>
 * Thread Safety: Not thread-safe. A machine and its tapes are driven by one thread.
 */
public class TuringMachine {

    private static final Logger LOG = LoggerFactory.getLogger(TuringMachine.class);

    private final int multiplier;
    private final int multiplicand;
    private final TransitionTable transitionTable;
    private final List<Tape> tapes;
    private long stepCount = 0L;
    private Transition lastFiredTransition;

    /**
     * Creates a machine that multiplies two non-negative integers with
     * {@link TransitionTable#UNARY_MULTIPLICATION}.
     *
     * @param multiplier   the first factor.
     * @param multiplicand the second factor.
     * @throws IllegalArgumentException if either factor is negative.
     */
    public TuringMachine(int multiplier, int multiplicand) {
        this(multiplier, multiplicand, TransitionTable.UNARY_MULTIPLICATION,
            encodeFactors(multiplier, multiplicand));
    }

    /**
     * Creates a machine with an explicit table and first-tape content.
     * The remaining tapes start empty.
     *
     * @param multiplier      the first factor, kept for reporting.
     * @param multiplicand    the second factor, kept for reporting.
     * @param transitionTable the table to run.
     * @param initialContent  symbol codes written to the first tape from position 0.
     */
    public TuringMachine(int multiplier, int multiplicand, TransitionTable transitionTable, String initialContent) {
        this.multiplier = multiplier;
        this.multiplicand = multiplicand;
        this.transitionTable = transitionTable;

        List<Tape> created = new ArrayList<>(transitionTable.getTapeCount());
        created.add(new Tape(initialContent));
        for (int i = 1; i < transitionTable.getTapeCount(); i++) {
            created.add(new Tape());
        }
        this.tapes = Collections.unmodifiableList(created);
    }

    /**
     * Builds the unary input {@code 0^multiplier 1 0^multiplicand}.
     *
     * @param multiplier   the first factor.
     * @param multiplicand the second factor.
     * @return the initial content of the first tape.
     */
    static String encodeFactors(int multiplier, int multiplicand) {
        if (multiplier < 0 || multiplicand < 0) {
            throw new IllegalArgumentException(String.format(
                "Factors must not be negative: %d x %d", multiplier, multiplicand));
        }
        return "0".repeat(multiplier) + "1" + "0".repeat(multiplicand);
    }

    /**
     * Finds the transition to fire for the current head symbols.
     *
     * @param previous the previously fired transition, or null before the first step.
     * @return the matching transition.
     * @throws NoMatchingTransitionException if no row matches.
     */
    public Transition findMatchingTransition(Transition previous) {
        String readKey = readKey();
        if (previous == null) {
            return transitionTable.findEntry(readKey)
                .orElseThrow(() -> new NoMatchingTransitionException(readKey, OptionalInt.empty()));
        }
        int requiredState = previous.nextState();
        return transitionTable.find(requiredState, readKey)
            .orElseThrow(() -> new NoMatchingTransitionException(readKey, OptionalInt.of(requiredState)));
    }

    /**
     * Writes and moves every tape as the given transition prescribes, in tape order.
     *
     * @param transition the transition to apply.
     */
    public void applyTransition(Transition transition) {
        for (int i = 0; i < tapes.size(); i++) {
            Tape tape = tapes.get(i);
            tape.write(transition.write().get(i));
            tape.move(transition.move().get(i));
        }
    }

    /**
     * Advances the machine by one transition.
     *
     * @return the transition that fired.
     * @throws IllegalStateException         if the machine has already halted.
     * @throws NoMatchingTransitionException if no row matches the current configuration.
     */
    public Transition step() {
        if (isHalted()) {
            throw new IllegalStateException("Machine has already halted after " + stepCount + " steps");
        }
        stepCount++;
        Transition transition = findMatchingTransition(lastFiredTransition);
        applyTransition(transition);
        lastFiredTransition = transition;

        if (LOG.isDebugEnabled()) {
            LOG.debug("Step {}: state {} read {} -> next {}",
                stepCount, transition.stateNumber(), transition.readKey(), transition.nextStateLabel());
        }
        if (transition.isHalting()) {
            LOG.info("Machine halted after {} steps, {} x {} = {}", stepCount, multiplier, multiplicand, result());
        }
        return transition;
    }

    /**
     * @return true once a transition leading to {@link Transition#HALT} has fired.
     */
    public boolean isHalted() {
        return lastFiredTransition != null && lastFiredTransition.isHalting();
    }

    /**
     * Steps the machine until it halts.
     */
    public void run() {
        run(null);
    }

    /**
     * Steps the machine until it halts, notifying the listener after every step.
     * Returns immediately if the machine has already halted.
     *
     * @param listener called after each step, may be null.
     * @throws NoMatchingTransitionException if the machine reaches an undefined configuration.
     */
    public void run(IStepListener listener) {
        while (!isHalted()) {
            Transition fired = step();
            if (listener != null) {
                listener.onStep(this, fired);
            }
        }
    }

    /**
     * @return the number of non-blank cells on the last tape.
     */
    public int result() {
        return tapes.get(tapes.size() - 1).occupiedCount();
    }

    /**
     * Reads the symbol under every head and concatenates their codes in tape order.
     *
     * @return the composite read key.
     */
    public String readKey() {
        StringBuilder sb = new StringBuilder(tapes.size());
        for (Tape tape : tapes) {
            sb.append(tape.read().code());
        }
        return sb.toString();
    }

    /**
     * Renders the window around every head, see {@link Tape#renderWindow(int)}.
     *
     * @param padding number of cells shown on each side of the head.
     * @return one window per tape, in tape order.
     */
    public List<char[]> renderTapes(int padding) {
        List<char[]> windows = new ArrayList<>(tapes.size());
        for (Tape tape : tapes) {
            windows.add(tape.renderWindow(padding));
        }
        return windows;
    }

    public long getStepCount() {
        return stepCount;
    }

    public Optional<Transition> getLastFiredTransition() {
        return Optional.ofNullable(lastFiredTransition);
    }

    public int getMultiplier() {
        return multiplier;
    }

    public int getMultiplicand() {
        return multiplicand;
    }

    public TransitionTable getTransitionTable() {
        return transitionTable;
    }

    /**
     * @return the tapes in order; the list is unmodifiable, the tapes are live.
     */
    public List<Tape> getTapes() {
        return tapes;
    }

    public Tape getTape(int index) {
        return tapes.get(index);
    }
}
