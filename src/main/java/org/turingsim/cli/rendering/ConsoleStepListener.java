package org.turingsim.cli.rendering;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;

import org.turingsim.runtime.TuringMachine;
import org.turingsim.runtime.model.Transition;
import org.turingsim.runtime.spi.IStepListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Step listener that drives the console presentation of a run.
 * <p>
 * After every step, in this order: clears the screen, writes each renderer's output,
 * sleeps for the configured delay and waits for a line on the interactive input.
 * Each part is skipped when it is not configured.
 */
public class ConsoleStepListener implements IStepListener {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleStepListener.class);

    /** Moves the cursor home and clears the screen. */
    static final String CLEAR_SCREEN = "\u001B[H\u001B[2J";

    /**
     * Blocking pause between steps, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final PrintWriter out;
    private final List<IMachineRenderer> renderers;
    private final boolean clearScreen;
    private final Duration delay;
    private final BufferedReader interactiveInput;
    private final Sleeper sleeper;

    /**
     * @param out              destination of rendered output.
     * @param renderers        renderers applied in order, may be empty.
     * @param clearScreen      whether to clear the screen before rendering.
     * @param delay            pause after rendering, {@link Duration#ZERO} for none.
     * @param interactiveInput source of confirmation lines, or null to run without pausing.
     * @param sleeper          performs the pause.
     */
    public ConsoleStepListener(PrintWriter out, List<IMachineRenderer> renderers, boolean clearScreen,
                               Duration delay, BufferedReader interactiveInput, Sleeper sleeper) {
        this.out = out;
        this.renderers = List.copyOf(renderers);
        this.clearScreen = clearScreen;
        this.delay = delay;
        this.interactiveInput = interactiveInput;
        this.sleeper = sleeper;
    }

    @Override
    public void onStep(TuringMachine machine, Transition fired) {
        show(machine, fired);
        pause();
        awaitConfirmation();
    }

    /**
     * Clears the screen if configured and writes every renderer's output.
     *
     * @param machine the machine to render.
     * @param fired   the transition that fired last, or null before the first step.
     */
    public void show(TuringMachine machine, Transition fired) {
        if (renderers.isEmpty()) {
            return;
        }
        if (clearScreen) {
            out.print(CLEAR_SCREEN);
        }
        for (IMachineRenderer renderer : renderers) {
            out.println();
            out.print(renderer.render(machine, fired));
        }
        out.flush();
    }

    private void pause() {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pausing between steps", e);
        }
    }

    private void awaitConfirmation() {
        if (interactiveInput == null) {
            return;
        }
        try {
            if (interactiveInput.readLine() == null) {
                LOG.debug("Interactive input closed, continuing without confirmation");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read interactive input", e);
        }
    }
}
