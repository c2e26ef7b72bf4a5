package org.turingsim.cli.commands;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

import org.turingsim.cli.CommandLineInterface;
import org.turingsim.cli.rendering.ConsoleStepListener;
import org.turingsim.cli.rendering.IMachineRenderer;
import org.turingsim.cli.rendering.StateDiagramRenderer;
import org.turingsim.cli.rendering.StateInfoRenderer;
import org.turingsim.runtime.InvalidDirectionException;
import org.turingsim.runtime.NoMatchingTransitionException;
import org.turingsim.runtime.TuringMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that multiplies two unary numbers on the Turing machine.
 * <p>
 * Without options only the final result is printed. The rendering options print the
 * machine before the first step and after every step; {@code --sleep} and
 * {@code --interactive} throttle the run between steps.
 */
@Command(
    name = "multiply",
    description = "Multiply two non-negative integers on the three-tape machine"
)
public class MultiplyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MultiplyCommand.class);

    @Parameters(index = "0", paramLabel = "MULTIPLIER", description = "First factor (non-negative)")
    private int multiplier;

    @Parameters(index = "1", paramLabel = "MULTIPLICAND", description = "Second factor (non-negative)")
    private int multiplicand;

    @Option(names = {"-i", "--interactive"}, description = "Wait for Enter after each step")
    private boolean interactive;

    @Option(names = {"-s", "--sleep"}, description = "Pause between steps (cli.sleep-delay)")
    private boolean sleep;

    @Option(names = {"-p", "--print"}, description = "Print state and tapes at every step")
    private boolean print;

    @Option(names = {"-d", "--diagram"}, description = "Print the state diagram at every step")
    private boolean diagram;

    @Option(names = {"-c", "--clear"}, description = "Clear the screen before every print")
    private boolean clear;

    @Option(names = "--padding", description = "Cells shown on each side of the head (default: cli.print-padding)")
    private Integer padding;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private Supplier<BufferedReader> inputSupplier =
        () -> new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

    private ConsoleStepListener.Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

    @Override
    public Integer call() {
        if (multiplier < 0 || multiplicand < 0) {
            throw new ParameterException(spec.commandLine(), String.format(
                "Factors must not be negative: %d x %d", multiplier, multiplicand));
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        final Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        int cellPadding = padding != null ? padding : config.getInt("cli.print-padding");
        if (cellPadding < 0) {
            throw new ParameterException(spec.commandLine(), "Padding must not be negative: " + cellPadding);
        }
        Duration delay = sleep ? config.getDuration("cli.sleep-delay") : Duration.ZERO;

        List<IMachineRenderer> renderers = new ArrayList<>();
        if (print) {
            renderers.add(new StateInfoRenderer(cellPadding));
        }
        if (diagram) {
            renderers.add(new StateDiagramRenderer());
        }
        BufferedReader input = interactive ? inputSupplier.get() : null;
        ConsoleStepListener listener = new ConsoleStepListener(out, renderers, clear, delay, input, sleeper);

        TuringMachine machine = new TuringMachine(multiplier, multiplicand);
        log.debug("Starting {} x {}", multiplier, multiplicand);
        try {
            listener.show(machine, null);
            machine.run(listener);
        } catch (NoMatchingTransitionException | InvalidDirectionException e) {
            log.error("Machine aborted after {} steps: {}", machine.getStepCount(), e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (!renderers.isEmpty()) {
            out.println();
        }
        out.printf("Computing done: %d x %d = %d in %d steps.%n",
            multiplier, multiplicand, machine.result(), machine.getStepCount());
        out.flush();
        return 0;
    }

    void setInputSupplier(Supplier<BufferedReader> inputSupplier) {
        this.inputSupplier = inputSupplier;
    }

    void setSleeper(ConsoleStepListener.Sleeper sleeper) {
        this.sleeper = sleeper;
    }
}
