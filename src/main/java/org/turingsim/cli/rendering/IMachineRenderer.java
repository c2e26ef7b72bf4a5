package org.turingsim.cli.rendering;

import org.turingsim.runtime.TuringMachine;
import org.turingsim.runtime.model.Transition;

/**
 * Text renderer for the state of a {@link TuringMachine}.
 * <p>
 * Renderers only read the machine through its inspection methods. Rendering the
 * same machine twice without stepping it in between yields the same text.
 */
public interface IMachineRenderer {

    /**
     * Renders the machine.
     *
     * @param machine the machine to render.
     * @param fired   the transition that fired last, or null before the first step.
     * @return the rendered text, ending with a line separator.
     */
    String render(TuringMachine machine, Transition fired);
}
