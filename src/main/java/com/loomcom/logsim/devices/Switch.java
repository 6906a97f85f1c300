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
 * A constant source whose level is set by the definition file and may be
 * changed between runs.
 */
public class Switch extends Device {

    private final boolean initialLevel;

    public Switch(String name, boolean initialLevel) {
        super(name, DeviceKind.SWITCH);
        this.initialLevel = initialLevel;
    }

    public boolean getInitialLevel() {
        return initialLevel;
    }

    @Override
    public Integer getQualifier() {
        return initialLevel ? 1 : 0;
    }
}
