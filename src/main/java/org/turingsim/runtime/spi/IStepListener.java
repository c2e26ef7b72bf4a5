package org.turingsim.runtime.spi;

import org.turingsim.runtime.TuringMachine;
import org.turingsim.runtime.model.Transition;

/**
 * Callback invoked by {@link TuringMachine#run(IStepListener)} after every step.
 * <p>
 * Listeners run synchronously on the stepping thread and may block, e.g. to render
 * the machine, wait for a keypress or throttle the run. They should treat the machine
 * as read-only. An exception thrown by a listener aborts the run and propagates to
 * the caller of {@code run}.
 */
@FunctionalInterface
public interface IStepListener {

    /**
     * Called once per step, including the step that halts the machine.
     *
     * @param machine the machine after the transition was applied.
     * @param fired   the transition that was applied.
     */
    void onStep(TuringMachine machine, Transition fired);
}
