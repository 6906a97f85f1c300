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

package com.loomcom.logsim.definition;

import com.loomcom.logsim.diagnostics.SourcePosition;

/**
 * Textual reference to a pin: {@code DEV} or {@code DEV.PIN}.
 */
public final class SignalReference {

    private final String deviceName;
    private final String pinName;          // null when omitted
    private final SourcePosition position;
    private final SourcePosition pinPosition;

    public SignalReference(String deviceName, String pinName, SourcePosition position, SourcePosition pinPosition) {
        this.deviceName = deviceName;
        this.pinName = pinName;
        this.position = position;
        this.pinPosition = pinPosition;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public String getPinName() {
        return pinName;
    }

    public boolean hasPin() {
        return pinName != null;
    }

    public SourcePosition getPosition() {
        return position;
    }

    /**
     * Position of the pin name, or of the device name when there is none.
     */
    public SourcePosition getPinPosition() {
        return pinPosition != null ? pinPosition : position;
    }

    @Override
    public String toString() {
        return pinName == null ? deviceName : deviceName + "." + pinName;
    }
}
