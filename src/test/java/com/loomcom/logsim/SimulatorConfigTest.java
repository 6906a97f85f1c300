package com.loomcom.logsim;

import org.junit.After;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.*;

public class SimulatorConfigTest {

    @After
    public void clearOverrides() {
        System.clearProperty(SimulatorConfig.MAX_GATE_INPUTS);
    }

    @Test
    public void defaults() {
        SimulatorConfig config = SimulatorConfig.defaults();

        assertEquals(16, config.getMaxGateInputs());
        assertEquals(2, config.getSettlePassesPerDevice());
        assertFalse(config.getClockInitialLevel());
        assertEquals(2 * 5 + 1, config.settleBound(5));
        assertEquals(3, config.settleBound(0));
    }

    @Test
    public void loadsClasspathProperties() {
        SimulatorConfig config = SimulatorConfig.load();

        assertEquals(16, config.getMaxGateInputs());
        assertEquals(2, config.getSettlePassesPerDevice());
    }

    @Test
    public void systemPropertyOverridesFile() {
        System.setProperty(SimulatorConfig.MAX_GATE_INPUTS, "4");

        assertEquals(4, SimulatorConfig.load().getMaxGateInputs());
    }

    @Test
    public void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty(SimulatorConfig.MAX_GATE_INPUTS, " 8 ");
        properties.setProperty(SimulatorConfig.CLOCK_INITIAL_LEVEL, "1");

        SimulatorConfig config = SimulatorConfig.fromProperties(properties);

        assertEquals(8, config.getMaxGateInputs());
        assertTrue(config.getClockInitialLevel());
        assertEquals(2, config.getSettlePassesPerDevice());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonNumericValue() {
        Properties properties = new Properties();
        properties.setProperty(SimulatorConfig.SETTLE_PASSES_PER_DEVICE, "many");
        SimulatorConfig.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBadClockLevel() {
        Properties properties = new Properties();
        properties.setProperty(SimulatorConfig.CLOCK_INITIAL_LEVEL, "2");
        SimulatorConfig.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsZeroMaxInputs() {
        SimulatorConfig.defaults().withMaxGateInputs(0);
    }

    @Test
    public void withersReturnModifiedCopies() {
        SimulatorConfig base = SimulatorConfig.defaults();
        SimulatorConfig changed = base.withSettlePassesPerDevice(5).withClockInitialLevel(true);

        assertEquals(2, base.getSettlePassesPerDevice());
        assertEquals(5, changed.getSettlePassesPerDevice());
        assertTrue(changed.getClockInitialLevel());
    }
}
