package org.turingsim.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.turingsim.runtime.TransitionTable;
import org.turingsim.runtime.model.Transition;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Prints the transition table of the multiplication machine.
 */
@Command(
    name = "table",
    description = "Print the transition table"
)
public class TableCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        TransitionTable table = TransitionTable.UNARY_MULTIPLICATION;

        out.printf("%-6s %-5s %-5s %-5s %s%n", "State", "Read", "Write", "Move", "Next");
        for (Transition transition : table.getTransitions()) {
            out.printf("%-6d %-5s %-5s %-5s %s%n",
                transition.stateNumber(), transition.readKey(), transition.writeKey(),
                transition.moveKey(), transition.nextStateLabel());
        }
        out.flush();
        return 0;
    }
}
