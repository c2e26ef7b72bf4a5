package org.turingsim.test.utils;

import org.turingsim.runtime.TuringMachine;

/**
 * Helpers for driving machines in tests.
 */
public final class MachineTestUtils {

    /** Upper bound on steps for any run in the test suite. */
    public static final int MAX_TEST_STEPS = 100_000;

    private MachineTestUtils() {
    }

    /**
     * Runs a fresh multiplication machine to completion.
     *
     * @param multiplier   the first factor.
     * @param multiplicand the second factor.
     * @return the halted machine.
     */
    public static TuringMachine runToHalt(int multiplier, int multiplicand) {
        return runToHalt(new TuringMachine(multiplier, multiplicand));
    }

    /**
     * Steps the machine until it halts, failing if it does not halt within
     * {@link #MAX_TEST_STEPS} steps.
     *
     * @param machine the machine to run.
     * @return the same machine, halted.
     */
    public static TuringMachine runToHalt(TuringMachine machine) {
        while (!machine.isHalted()) {
            if (machine.getStepCount() >= MAX_TEST_STEPS) {
                throw new AssertionError("Machine did not halt within " + MAX_TEST_STEPS + " steps");
            }
            machine.step();
        }
        return machine;
    }
}
