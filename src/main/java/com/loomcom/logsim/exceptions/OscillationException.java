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

package com.loomcom.logsim.exceptions;

import com.loomcom.logsim.diagnostics.Diagnostic;

/**
 * The combinational network did not reach a fixed point within the
 * settle bound. The run halts; cycles completed before this one stay in
 * the trace.
 */
public class OscillationException extends SimulationException {

    private final int cycle;
    private final int passes;
    private final Diagnostic diagnostic;

    public OscillationException(int cycle, int passes, String unstableDevice) {
        super("Network failed to settle in cycle " + cycle + " after " + passes + " passes"
              + (unstableDevice != null ? " (still changing: " + unstableDevice + ")" : ""));
        this.cycle = cycle;
        this.passes = passes;
        this.diagnostic = Diagnostic.runtime(getMessage(), "cycle " + cycle);
    }

    /**
     * @return 1-based index of the cycle that failed to settle
     */
    public int getCycle() {
        return cycle;
    }

    public int getPasses() {
        return passes;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
