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
 * Free-running square wave source. The output toggles every
 * {@code halfPeriod} cycles.
 */
public class Clock extends Device {

    private final int halfPeriod;

    public Clock(String name, int halfPeriod) {
        super(name, DeviceKind.CLOCK);
        if (halfPeriod < 1) {
            throw new IllegalArgumentException("Clock half period must be at least 1, got " + halfPeriod);
        }
        this.halfPeriod = halfPeriod;
    }

    public int getHalfPeriod() {
        return halfPeriod;
    }

    @Override
    public Integer getQualifier() {
        return halfPeriod;
    }
}
