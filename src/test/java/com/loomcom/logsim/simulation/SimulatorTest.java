package com.loomcom.logsim.simulation;

import com.loomcom.logsim.Fixtures;
import com.loomcom.logsim.SimulatorConfig;
import com.loomcom.logsim.exceptions.OscillationException;
import com.loomcom.logsim.network.Circuit;
import com.loomcom.logsim.network.CircuitLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.loomcom.logsim.Fixtures.definition;
import static org.junit.jupiter.api.Assertions.*;

public class SimulatorTest {

    private SimulatorConfig config;
    private CircuitLoader loader;

    @BeforeEach
    public void setUp() {
        config = SimulatorConfig.defaults();
        loader = new CircuitLoader(config);
    }

    private Simulator simulator(String text) throws Exception {
        Circuit circuit = loader.loadOrThrow(text);
        return new Simulator(circuit, config);
    }

    private static String bits(boolean[] samples) {
        StringBuilder sb = new StringBuilder();
        for (boolean sample : samples) {
            sb.append(sample ? '1' : '0');
        }
        return sb.toString();
    }

    @Test
    public void andGateOfLowAndHighIsLow() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("and_gate.txt"));

        MonitorTrace trace = sim.run(1);

        assertEquals(1, trace.getCycleCount());
        assertFalse(trace.getValue("G1", 0));
        assertEquals(SimulatorState.HALTED, sim.getState());
        assertEquals(HaltReason.COMPLETED, sim.getHaltReason());
    }

    @Test
    public void clockedFlipFlopLatchesHighData() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("clocked_dtype.txt"));

        MonitorTrace trace = sim.run(2);

        assertTrue(trace.getValue("D1.Q", 1));
        assertFalse(trace.getValue("D1.QBAR", 1));
        assertEquals("10", bits(trace.getSamples("CLK1")));
        assertEquals("11", bits(trace.getSamples("D1.Q")));
    }

    @Test
    public void dividerHalvesTheClock() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("divider.txt"));

        MonitorTrace trace = sim.run(8);

        assertEquals("10101010", bits(trace.getSamples("CK")));
        assertEquals("11001100", bits(trace.getSamples("FF.Q")));
        assertEquals("01100110", bits(trace.getSamples("X")));
    }

    @Test
    public void selfFeedingGateOscillates() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("ring_oscillator.txt"));

        OscillationException e = assertThrows(OscillationException.class, () -> sim.run(5));

        assertEquals(1, e.getCycle());
        assertEquals(config.settleBound(1), e.getPasses());
        assertEquals("cycle 1", e.getDiagnostic().getSubject());
        assertEquals(0, sim.getTrace().getCycleCount());
        assertEquals(SimulatorState.HALTED, sim.getState());
        assertEquals(HaltReason.OSCILLATION, sim.getHaltReason());
        assertThrows(IllegalStateException.class, () -> sim.run(1));

        sim.reset();
        assertEquals(SimulatorState.READY, sim.getState());
    }

    @Test
    public void oscillationKeepsCompletedCycles() throws Exception {
        Simulator sim = simulator(definition(
                "{ id: EN; kind: SWITCH; qual: 0; };\n{ id: N; kind: NAND; qual: 2; };",
                "EN : N.I1;\nN : N.I2;",
                "N;"));

        sim.run(3);
        sim.setSwitch("EN", true);
        OscillationException e = assertThrows(OscillationException.class, () -> sim.run(2));

        assertEquals(4, e.getCycle());
        assertEquals(3, sim.getTrace().getCycleCount());
        assertEquals("111", bits(sim.getTrace().getSamples("N")));
        assertTrue(e.getMessage().contains("still changing: N"), e.getMessage());
    }

    @Test
    public void setWinsOverClear() throws Exception {
        Simulator sim = simulator(definition(
                "{ id: HI; kind: SWITCH; qual: 1; };\n{ id: FF; kind: DTYPE; };",
                "HI : FF.SET;\nHI : FF.CLEAR;",
                "FF.Q; FF.QBAR;"));

        MonitorTrace trace = sim.run(1);

        assertTrue(trace.getValue("FF.Q", 0));
        assertFalse(trace.getValue("FF.QBAR", 0));
    }

    @Test
    public void clearWinsOverClockEdge() throws Exception {
        Simulator sim = simulator(definition(
                "{ id: HI; kind: SWITCH; qual: 1; };\n{ id: CK; kind: CLOCK; qual: 1; };\n{ id: FF; kind: DTYPE; };",
                "HI : FF.DATA;\nCK : FF.CLK;\nHI : FF.CLEAR;",
                "FF.Q;"));

        assertEquals("0000", bits(sim.run(4).getSamples("FF.Q")));
    }

    @Test
    public void runningInStepsMatchesOneRun() throws Exception {
        String text = Fixtures.circuit("divider.txt");
        Simulator once = simulator(text);
        Simulator stepped = simulator(text);

        once.run(7);
        stepped.run(3);
        stepped.run(0);
        stepped.run(4);

        assertEquals(once.getTrace().formatWaveforms(), stepped.getTrace().formatWaveforms());
        for (int cycle = 0; cycle < 7; cycle++) {
            assertArrayEquals(once.getTrace().getRow(cycle), stepped.getTrace().getRow(cycle));
        }
    }

    @Test
    public void settlesChainsDeclaredBackwards() throws Exception {
        Simulator sim = simulator(definition(
                "{ id: G3; kind: AND; qual: 1; };\n{ id: G2; kind: AND; qual: 1; };\n" +
                "{ id: G1; kind: AND; qual: 1; };\n{ id: S; kind: SWITCH; qual: 1; };",
                "G2 : G3.I1;\nG1 : G2.I1;\nS : G1.I1;",
                "G3;"));

        assertTrue(sim.run(1).getValue("G3", 0));
    }

    @Test
    public void unboundInputsReadLow() throws Exception {
        Simulator sim = simulator(definition("{ id: N; kind: NOR; qual: 2; };", "", "N;"));

        assertTrue(sim.run(1).getValue("N", 0));
    }

    @Test
    public void clockHalfPeriod() throws Exception {
        String text = definition("{ id: CK; kind: CLOCK; qual: 2; };", "", "CK;");

        assertEquals("01100110", bits(simulator(text).run(8).getSamples("CK")));

        Simulator startHigh = new Simulator(loader.loadOrThrow(text), config.withClockInitialLevel(true));
        assertEquals("10011001", bits(startHigh.run(8).getSamples("CK")));
    }

    @Test
    public void switchChangesApplyFromTheNextCycle() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("and_gate.txt"));

        sim.run(2);
        sim.setSwitch("A", true);
        sim.run(2);

        assertEquals("0011", bits(sim.getTrace().getSamples("G1")));
        assertTrue(sim.getLevel("A"));
        assertThrows(IllegalArgumentException.class, () -> sim.setSwitch("G1", true));
        assertThrows(IllegalArgumentException.class, () -> sim.setSwitch("Q", true));
    }

    @Test
    public void resetIsAColdStart() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("and_gate.txt"));
        sim.setSwitch("A", true);
        sim.run(3);

        sim.reset();

        assertEquals(SimulatorState.READY, sim.getState());
        assertNull(sim.getHaltReason());
        assertEquals(0, sim.getTrace().getCycleCount());
        assertFalse(sim.getLevel("A"));
        assertFalse(sim.run(1).getValue("G1", 0));
    }

    @Test
    public void listenersSeeEveryCycle() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("divider.txt"));
        List<Integer> seen = new ArrayList<>();
        CycleListener listener = (cycle, trace) -> {
            assertEquals(cycle, trace.getCycleCount());
            seen.add(cycle);
        };
        sim.addCycleListener(listener);

        sim.run(3);
        sim.removeCycleListener(listener);
        sim.run(1);

        assertEquals(List.of(1, 2, 3), seen);
    }

    @Test
    public void stopRequestHaltsAtCycleBoundary() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("divider.txt"));
        sim.addCycleListener((cycle, trace) -> {
            if (cycle == 3) {
                sim.requestStop();
            }
        });

        sim.run(10);
        assertEquals(3, sim.getTrace().getCycleCount());
        assertEquals(HaltReason.STOPPED, sim.getHaltReason());

        sim.run(2);
        assertEquals(5, sim.getTrace().getCycleCount());
        assertEquals(HaltReason.COMPLETED, sim.getHaltReason());
    }

    @Test
    public void listenerCannotReenterTheSimulator() throws Exception {
        Simulator sim = simulator(Fixtures.circuit("and_gate.txt"));
        sim.addCycleListener((cycle, trace) -> sim.setSwitch("A", true));

        assertThrows(IllegalStateException.class, () -> sim.run(2));
        assertEquals(SimulatorState.HALTED, sim.getState());
        assertEquals(1, sim.getTrace().getCycleCount());
    }

    @Test
    public void contractViolations() throws Exception {
        Simulator empty = new Simulator(config);
        assertEquals(SimulatorState.UNINITIALIZED, empty.getState());
        assertThrows(IllegalStateException.class, () -> empty.run(1));

        Simulator sim = simulator(Fixtures.circuit("and_gate.txt"));
        assertEquals(SimulatorState.READY, sim.getState());
        assertThrows(IllegalArgumentException.class, () -> sim.run(-1));
        assertThrows(IllegalArgumentException.class, () -> sim.getLevel("G1.Q"));
    }
}
