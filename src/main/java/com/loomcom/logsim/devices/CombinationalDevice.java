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

/**
 * A device whose single output is a pure function of its inputs.
 */
public abstract class CombinationalDevice extends Device {

    protected CombinationalDevice(String name, DeviceKind kind) {
        super(name, kind);
    }

    /**
     * Compute the output level.
     *
     * @param inputs current input levels in pin-index order
     */
    public abstract boolean evaluate(boolean[] inputs);
}
