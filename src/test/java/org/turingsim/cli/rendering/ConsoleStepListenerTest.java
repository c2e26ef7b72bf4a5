package org.turingsim.cli.rendering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.turingsim.runtime.TuringMachine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConsoleStepListener}.
 */
@Tag("unit")
class ConsoleStepListenerTest {

    private final StringWriter output = new StringWriter();
    private final PrintWriter out = new PrintWriter(output);
    private final List<Duration> sleeps = new ArrayList<>();
    private final ConsoleStepListener.Sleeper recordingSleeper = sleeps::add;

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void onStep_rendersEveryStepWithEachRenderer() {
        IMachineRenderer first = mock(IMachineRenderer.class);
        IMachineRenderer second = mock(IMachineRenderer.class);
        when(first.render(any(), any())).thenReturn("first");
        when(second.render(any(), any())).thenReturn("second");
        ConsoleStepListener listener = new ConsoleStepListener(
            out, List.of(first, second), false, Duration.ZERO, null, recordingSleeper);
        TuringMachine machine = new TuringMachine(1, 1);

        machine.run(listener);

        verify(first, times(8)).render(any(), any());
        verify(second, times(8)).render(any(), any());
        assertThat(output.toString()).contains("first" + System.lineSeparator() + "second").doesNotContain(ConsoleStepListener.CLEAR_SCREEN);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void onStep_clearScreen_precedesRendering() {
        IMachineRenderer renderer = mock(IMachineRenderer.class);
        when(renderer.render(any(), any())).thenReturn("state");
        ConsoleStepListener listener = new ConsoleStepListener(
            out, List.of(renderer), true, Duration.ZERO, null, recordingSleeper);

        listener.show(new TuringMachine(0, 0), null);

        assertThat(output.toString()).startsWith(ConsoleStepListener.CLEAR_SCREEN).endsWith("state");
    }

    @Test
    void show_withoutRenderers_writesNothing() {
        ConsoleStepListener listener = new ConsoleStepListener(
            out, List.of(), true, Duration.ZERO, null, recordingSleeper);

        listener.show(new TuringMachine(0, 0), null);

        assertThat(output.toString()).isEmpty();
    }

    @Test
    void onStep_sleepsConfiguredDelay() {
        ConsoleStepListener listener = new ConsoleStepListener(
            out, List.of(), false, Duration.ofMillis(10), null, recordingSleeper);

        new TuringMachine(0, 0).run(listener);

        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(10));
    }

    @Test
    void onStep_interactive_consumesOneLinePerStep() throws Exception {
        BufferedReader input = new BufferedReader(new StringReader("a\nb\nc\n"));
        ConsoleStepListener listener = new ConsoleStepListener(
            out, List.of(), false, Duration.ZERO, input, recordingSleeper);

        new TuringMachine(0, 0).run(listener);

        assertThat(input.readLine()).isEqualTo("c");
    }

    @Test
    void onStep_interactiveInputClosed_keepsRunning() {
        BufferedReader input = new BufferedReader(new StringReader(""));
        ConsoleStepListener listener = new ConsoleStepListener(
            out, List.of(), false, Duration.ZERO, input, recordingSleeper);
        TuringMachine machine = new TuringMachine(2, 2);

        machine.run(listener);

        assertThat(machine.result()).isEqualTo(4);
    }

    @Test
    void onStep_interruptedSleep_abortsRunAndKeepsInterruptFlag() {
        ConsoleStepListener.Sleeper interrupted = duration -> {
            throw new InterruptedException("interrupted");
        };
        IMachineRenderer renderer = mock(IMachineRenderer.class);
        when(renderer.render(any(), any())).thenReturn("");
        ConsoleStepListener listener = new ConsoleStepListener(
            out, List.of(renderer), false, Duration.ofMillis(1), null, interrupted);
        TuringMachine machine = new TuringMachine(2, 2);

        assertThatThrownBy(() -> machine.run(listener)).isInstanceOf(IllegalStateException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(machine.getStepCount()).isEqualTo(1);
        verify(renderer, times(1)).render(any(), any());
    }
}
