package com.loomcom.logsim;

import com.loomcom.logsim.network.LoadResult;
import com.loomcom.logsim.simulation.MonitorTrace;
import com.loomcom.logsim.simulation.Simulator;
import com.loomcom.logsim.simulation.SimulatorState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LogicSimulatorTest {

    private final LogicSimulator logsim = new LogicSimulator(SimulatorConfig.defaults());

    @Test
    public void parseAndRun() throws Exception {
        LoadResult result = logsim.parse(Fixtures.circuit("divider.txt"));
        assertTrue(result.isSuccess());

        MonitorTrace trace = logsim.run(result.getCircuit(), 4);

        assertEquals(4, trace.getCycleCount());
        assertTrue(trace.formatWaveforms().contains("FF.Q --__"), trace.formatWaveforms());
    }

    @Test
    public void runsAreIndependent() throws Exception {
        LoadResult result = logsim.parse(Fixtures.circuit("divider.txt"));

        MonitorTrace first = logsim.run(result.getCircuit(), 3);
        MonitorTrace second = logsim.run(result.getCircuit(), 3);

        assertNotSame(first, second);
        assertEquals(first.formatWaveforms(), second.formatWaveforms());
    }

    @Test
    public void undeclaredDeviceIsRejectedBeforeSimulation() {
        LoadResult result = logsim.parse(Fixtures.definition(
                "{ id: G; kind: OR; qual: 1; };", "GHOST : G.I1;", "G;"));

        assertFalse(result.isSuccess());
        assertNull(result.getCircuit());
        assertEquals("GHOST : G.I1", result.getErrors().get(0).getSubject());
    }

    @Test
    public void newSimulatorIsReady() {
        LoadResult result = logsim.parse(Fixtures.circuit("and_gate.txt"));

        Simulator sim = logsim.newSimulator(result.getCircuit());

        assertEquals(SimulatorState.READY, sim.getState());
        assertSame(logsim.getConfig(), sim.getConfig());
    }
}
