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

package com.loomcom.logsim.devices;

import java.util.List;

/**
 * Positive edge-triggered D-type flip-flop with asynchronous set and clear.
 *
 * Priority when several inputs are active in the same cycle:
 * SET, then CLEAR, then a rising edge on CLK.
 */
public class DType extends Device {

    public static final String DATA = "DATA";
    public static final String CLK = "CLK";
    public static final String SET = "SET";
    public static final String CLEAR = "CLEAR";
    public static final String Q = "Q";
    public static final String QBAR = "QBAR";

    // Pin indices
    public static final int DATA_INPUT = 0;
    public static final int CLK_INPUT = 1;
    public static final int SET_INPUT = 2;
    public static final int CLEAR_INPUT = 3;
    public static final int Q_OUTPUT = 0;
    public static final int QBAR_OUTPUT = 1;

    private static final List<String> INPUT_PINS = List.of(DATA, CLK, SET, CLEAR);
    private static final List<String> OUTPUT_PINS = List.of(Q, QBAR);

    public DType(String name) {
        super(name, DeviceKind.DTYPE);
    }

    /**
     * Next latch value.
     *
     * @param latched   value currently held
     * @param data      DATA input level
     * @param risingEdge whether CLK went from 0 to 1 this cycle
     * @param set       SET input level
     * @param clear     CLEAR input level
     */
    public static boolean nextState(boolean latched, boolean data, boolean risingEdge, boolean set, boolean clear) {
        if (set) {
            return true;
        }
        if (clear) {
            return false;
        }
        if (risingEdge) {
            return data;
        }
        return latched;
    }

    @Override
    public Integer getQualifier() {
        return null;
    }

    @Override
    public List<String> getInputPins() {
        return INPUT_PINS;
    }

    @Override
    public List<String> getOutputPins() {
        return OUTPUT_PINS;
    }
}
