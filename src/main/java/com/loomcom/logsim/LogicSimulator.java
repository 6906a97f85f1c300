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

package com.loomcom.logsim;

import com.loomcom.logsim.exceptions.SimulationException;
import com.loomcom.logsim.network.Circuit;
import com.loomcom.logsim.network.CircuitLoader;
import com.loomcom.logsim.network.LoadResult;
import com.loomcom.logsim.simulation.MonitorTrace;
import com.loomcom.logsim.simulation.Simulator;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point for programs that embed the simulator: load a definition,
 * run it, and read back the trace.
 *
 * <pre>
 * LogicSimulator logsim = new LogicSimulator();
 * LoadResult result = logsim.parse(text);
 * if (result.isSuccess()) {
 *     MonitorTrace trace = logsim.run(result.getCircuit(), 10);
 *     System.out.print(trace.formatWaveforms());
 * } else {
 *     System.err.println(result.formatDiagnostics());
 * }
 * </pre>
 */
public class LogicSimulator {

    private final SimulatorConfig config;
    private final CircuitLoader loader;

    public LogicSimulator() {
        this(SimulatorConfig.load());
    }

    public LogicSimulator(SimulatorConfig config) {
        this.config = config;
        this.loader = new CircuitLoader(config);
    }

    /**
     * Parse and validate a definition. Never throws for bad input; every
     * problem is reported in the result.
     */
    public LoadResult parse(String text) {
        return loader.load(text);
    }

    public LoadResult parseFile(Path file) throws IOException {
        return loader.loadFile(file);
    }

    /**
     * Cold-start a circuit and simulate it.
     *
     * @throws SimulationException if the network fails to settle
     */
    public MonitorTrace run(Circuit circuit, int cycles) throws SimulationException {
        return newSimulator(circuit).run(cycles);
    }

    /**
     * A simulator with the circuit loaded and ready, for callers that want
     * to attach listeners, set switches or run in steps.
     */
    public Simulator newSimulator(Circuit circuit) {
        return new Simulator(circuit, config);
    }

    public SimulatorConfig getConfig() {
        return config;
    }
}
