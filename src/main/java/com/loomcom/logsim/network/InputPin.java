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

package com.loomcom.logsim.network;

/**
 * Handle to one input of a device in a {@link Circuit}.
 */
public final class InputPin {

    private final int device;
    private final int pin;

    public InputPin(int device, int pin) {
        this.device = device;
        this.pin = pin;
    }

    public int getDevice() {
        return device;
    }

    public int getPin() {
        return pin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InputPin)) return false;
        InputPin other = (InputPin) o;
        return device == other.device && pin == other.pin;
    }

    @Override
    public int hashCode() {
        return 31 * device + pin;
    }

    @Override
    public String toString() {
        return device + ":" + pin;
    }
}
