/*
 * Copyright (c) 2025 Waffle2e Computer Project
 *
 * Permission is hereby granted, free of charge, to any person obtaining
 * a copy of this software and associated documentation files (the
 * "Software"), to deal in the Software without restriction, including
 * without limitation the rights to use, copy, modify, merge, publish,
 * distribute, sublicense, and/or sell copies of the Software, and to
 * permit persons to whom the Software is furnished to do so, subject to
 * the following conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 */

package com.loomcom.logsim.simulation;

import com.loomcom.logsim.SimulatorConfig;
import com.loomcom.logsim.devices.Clock;
import com.loomcom.logsim.devices.CombinationalDevice;
import com.loomcom.logsim.devices.DType;
import com.loomcom.logsim.devices.Device;
import com.loomcom.logsim.devices.Switch;
import com.loomcom.logsim.exceptions.OscillationException;
import com.loomcom.logsim.network.Circuit;
import com.loomcom.logsim.network.OutputPin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cycle-based, zero-delay simulation of a {@link Circuit}.
 *
 * Each cycle advances the clocks, settles the combinational logic, updates
 * the flip-flops, settles again and samples the monitors. Device levels live
 * here in flat arrays indexed like the circuit's device table; the circuit
 * itself is never modified.
 *
 * A simulator has a single writer. {@link #requestStop()} and reads of the
 * trace are the only calls meant for other threads.
 */
public class Simulator {

    private final static Logger logger = LoggerFactory.getLogger(Simulator.class.getName());

    private final SimulatorConfig config;
    private final List<CycleListener> listeners = new CopyOnWriteArrayList<>();

    private Circuit circuit;
    private MonitorTrace trace;

    private boolean[][] outputs;        // [device][output pin]
    private boolean[][] inputBuffers;   // [device][input pin], scratch for evaluation
    private boolean[] switchLevels;
    private int[] clockCounters;
    private boolean[] previousClk;      // DTYPE only

    private SimulatorState state = SimulatorState.UNINITIALIZED;
    private HaltReason haltReason;
    private volatile boolean stopRequested;

    public Simulator() {
        this(SimulatorConfig.load());
    }

    public Simulator(SimulatorConfig config) {
        this.config = config;
    }

    public Simulator(Circuit circuit, SimulatorConfig config) {
        this(config);
        load(circuit);
    }

    /**
     * Install a circuit and cold-start it. Any previous circuit and trace are
     * discarded.
     */
    public void load(Circuit circuit) {
        requireNotRunning("load a circuit");
        this.circuit = circuit;

        int count = circuit.getDeviceCount();
        outputs = new boolean[count][];
        inputBuffers = new boolean[count][];
        for (int i = 0; i < count; i++) {
            Device device = circuit.getDevice(i);
            outputs[i] = new boolean[device.getOutputCount()];
            inputBuffers[i] = new boolean[device.getInputCount()];
        }
        switchLevels = new boolean[count];
        clockCounters = new int[count];
        previousClk = new boolean[count];

        List<String> labels = new ArrayList<>();
        for (OutputPin monitor : circuit.getMonitors()) {
            labels.add(circuit.signalName(monitor));
        }
        trace = new MonitorTrace(labels);

        coldStart();
        logger.debug("Loaded {}", circuit);
    }

    /**
     * Return every device to its power-on state and clear the trace. Switches
     * go back to their declared levels, undoing any {@link #setSwitch}.
     */
    public void reset() {
        requireCircuit();
        requireNotRunning("reset");
        coldStart();
        logger.info("Simulator reset");
    }

    private void coldStart() {
        for (int i = 0; i < circuit.getDeviceCount(); i++) {
            Device device = circuit.getDevice(i);
            Arrays.fill(outputs[i], false);
            clockCounters[i] = 0;
            previousClk[i] = false;
            if (device instanceof Switch) {
                switchLevels[i] = ((Switch) device).getInitialLevel();
                outputs[i][0] = switchLevels[i];
            } else if (device instanceof Clock) {
                outputs[i][0] = config.getClockInitialLevel();
            } else if (device instanceof DType) {
                outputs[i][DType.QBAR_OUTPUT] = true;
            }
        }
        trace.clear();
        haltReason = null;
        stopRequested = false;
        state = SimulatorState.READY;
    }

    /**
     * Change a switch level. The new level is seen from the next cycle on.
     *
     * @throws IllegalArgumentException if no switch has that name
     */
    public void setSwitch(String name, boolean level) {
        requireCircuit();
        requireNotRunning("set a switch");
        int index = circuit.indexOf(name);
        if (index < 0 || !(circuit.getDevice(index) instanceof Switch)) {
            throw new IllegalArgumentException("No switch named " + name);
        }
        switchLevels[index] = level;
        outputs[index][0] = level;
        logger.debug("Switch {} set to {}", name, level ? 1 : 0);
    }

    /**
     * Simulate further cycles, continuing from the current state.
     *
     * @param cycles number of cycles to add to the trace
     * @return the trace, holding every cycle since the last cold start
     * @throws OscillationException if a cycle fails to settle; the trace keeps
     *         every cycle completed before it and the simulator halts until
     *         {@link #reset()}
     */
    public MonitorTrace run(int cycles) throws OscillationException {
        if (cycles < 0) {
            throw new IllegalArgumentException("Cycle count must not be negative: " + cycles);
        }
        requireCircuit();
        requireNotRunning("run");
        if (haltReason == HaltReason.OSCILLATION) {
            throw new IllegalStateException("Simulation halted after oscillation; reset before running again");
        }

        stopRequested = false;
        state = SimulatorState.RUNNING;
        logger.debug("Running {} cycle(s) from cycle {}", cycles, trace.getCycleCount());
        try {
            for (int i = 0; i < cycles; i++) {
                if (stopRequested) {
                    halt(HaltReason.STOPPED);
                    logger.warn("Run stopped after {} cycle(s)", trace.getCycleCount());
                    return trace;
                }
                step();
            }
        } catch (OscillationException e) {
            halt(HaltReason.OSCILLATION);
            logger.error(e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            // listener failure ends the run with the trace intact
            halt(HaltReason.STOPPED);
            throw e;
        }
        halt(HaltReason.COMPLETED);
        logger.info("Run completed, {} cycle(s) recorded", trace.getCycleCount());
        return trace;
    }

    /**
     * Ask a run in progress to stop at the next cycle boundary. Safe to call
     * from any thread, including from a {@link CycleListener}.
     */
    public void requestStop() {
        stopRequested = true;
    }

    private void step() throws OscillationException {
        int cycle = trace.getCycleCount() + 1;

        advanceClocks();
        settle(cycle);
        updateFlipFlops();
        settle(cycle);

        List<OutputPin> monitors = circuit.getMonitors();
        boolean[] row = new boolean[monitors.size()];
        for (int i = 0; i < row.length; i++) {
            OutputPin monitor = monitors.get(i);
            row[i] = outputs[monitor.getDevice()][monitor.getPin()];
        }
        trace.append(row);

        for (CycleListener listener : listeners) {
            listener.cycleCompleted(cycle, trace);
        }
    }

    private void advanceClocks() {
        for (int i = 0; i < circuit.getDeviceCount(); i++) {
            Device device = circuit.getDevice(i);
            if (device instanceof Clock && ++clockCounters[i] >= ((Clock) device).getHalfPeriod()) {
                clockCounters[i] = 0;
                outputs[i][0] = !outputs[i][0];
            }
        }
    }

    /**
     * Relax combinational outputs in device-table order until a pass changes
     * nothing.
     */
    private void settle(int cycle) throws OscillationException {
        int bound = config.settleBound(circuit.getDeviceCount());
        for (int pass = 1; ; pass++) {
            String changed = null;
            for (int i = 0; i < circuit.getDeviceCount(); i++) {
                Device device = circuit.getDevice(i);
                if (!(device instanceof CombinationalDevice)) {
                    continue;
                }
                boolean level = ((CombinationalDevice) device).evaluate(readInputs(i));
                if (level != outputs[i][0]) {
                    outputs[i][0] = level;
                    changed = device.getName();
                }
            }
            if (changed == null) {
                return;
            }
            if (pass >= bound) {
                throw new OscillationException(cycle, pass, changed);
            }
        }
    }

    private void updateFlipFlops() {
        // sample every flip-flop before changing any of them
        List<Integer> flipFlops = new ArrayList<>();
        List<Boolean> next = new ArrayList<>();
        for (int i = 0; i < circuit.getDeviceCount(); i++) {
            if (!(circuit.getDevice(i) instanceof DType)) {
                continue;
            }
            boolean[] in = readInputs(i);
            boolean clk = in[DType.CLK_INPUT];
            boolean risingEdge = clk && !previousClk[i];
            previousClk[i] = clk;
            flipFlops.add(i);
            next.add(DType.nextState(outputs[i][DType.Q_OUTPUT], in[DType.DATA_INPUT], risingEdge,
                                     in[DType.SET_INPUT], in[DType.CLEAR_INPUT]));
        }
        for (int k = 0; k < flipFlops.size(); k++) {
            int i = flipFlops.get(k);
            boolean q = next.get(k);
            outputs[i][DType.Q_OUTPUT] = q;
            outputs[i][DType.QBAR_OUTPUT] = !q;
        }
    }

    /**
     * Current input levels of a device. Unbound inputs read 0.
     */
    private boolean[] readInputs(int device) {
        boolean[] in = inputBuffers[device];
        for (int pin = 0; pin < in.length; pin++) {
            OutputPin driver = circuit.getDriver(device, pin);
            in[pin] = driver != null && outputs[driver.getDevice()][driver.getPin()];
        }
        return in;
    }

    private void halt(HaltReason reason) {
        haltReason = reason;
        state = SimulatorState.HALTED;
    }

    private void requireCircuit() {
        if (circuit == null) {
            throw new IllegalStateException("No circuit loaded");
        }
    }

    private void requireNotRunning(String action) {
        if (state == SimulatorState.RUNNING) {
            throw new IllegalStateException("Cannot " + action + " while a run is in progress");
        }
    }

    /**
     * Present level of an output signal.
     *
     * @param signal {@code DEV} or {@code DEV.PIN}
     */
    public boolean getLevel(String signal) {
        requireCircuit();
        OutputPin output = circuit.findOutput(signal);
        if (output == null) {
            throw new IllegalArgumentException("No output signal named " + signal);
        }
        return outputs[output.getDevice()][output.getPin()];
    }

    public void addCycleListener(CycleListener listener) {
        listeners.add(listener);
    }

    public void removeCycleListener(CycleListener listener) {
        listeners.remove(listener);
    }

    public SimulatorState getState() {
        return state;
    }

    /**
     * @return why the last run ended, or null if nothing has run since the last cold start
     */
    public HaltReason getHaltReason() {
        return haltReason;
    }

    public MonitorTrace getTrace() {
        return trace;
    }

    public Circuit getCircuit() {
        return circuit;
    }

    public SimulatorConfig getConfig() {
        return config;
    }
}
