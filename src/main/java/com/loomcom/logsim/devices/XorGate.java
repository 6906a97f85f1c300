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
 * Two-input exclusive OR.
 */
public class XorGate extends CombinationalDevice {

    private static final List<String> INPUT_PINS = List.of("I1", "I2");

    public XorGate(String name) {
        super(name, DeviceKind.XOR);
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
    public boolean evaluate(boolean[] inputs) {
        return inputs[0] ^ inputs[1];
    }
}
