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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named component of a logic network.
 *
 * The concrete subclasses form a closed set, one per family of kinds, each
 * holding only what that family needs. Devices describe pins and behaviour
 * only; the levels they produce during a run belong to the simulator.
 */
public abstract class Device {

    private final String name;
    private final DeviceKind kind;

    protected Device(String name, DeviceKind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String getName() {
        return name;
    }

    public DeviceKind getKind() {
        return kind;
    }

    /**
     * @return the qualifier as it would be written in a definition file, or null
     */
    public abstract Integer getQualifier();

    /**
     * Input pin names in pin-index order.
     */
    public List<String> getInputPins() {
        return Collections.emptyList();
    }

    /**
     * Output pin names in pin-index order. A device with a single output
     * has one unnamed output, listed as null.
     */
    public List<String> getOutputPins() {
        return Collections.singletonList(null);
    }

    public int getInputCount() {
        return getInputPins().size();
    }

    public int getOutputCount() {
        return getOutputPins().size();
    }

    /**
     * @return index of the named input, or -1
     */
    public int inputIndex(String pin) {
        return pin == null ? -1 : getInputPins().indexOf(pin);
    }

    /**
     * Resolve an output pin. A null name selects the single unnamed output.
     *
     * @return index of the output, or -1 if there is no such output
     */
    public int outputIndex(String pin) {
        List<String> outputs = getOutputPins();
        if (pin == null) {
            return outputs.size() == 1 && outputs.get(0) == null ? 0 : -1;
        }
        return outputs.indexOf(pin);
    }

    /**
     * Signal name of one of this device's outputs: {@code SW1} or {@code FF1.Q}.
     */
    public String signalName(int outputIndex) {
        String pin = getOutputPins().get(outputIndex);
        return pin == null ? name : name + "." + pin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Device)) return false;
        Device other = (Device) o;
        return name.equals(other.name) && kind == other.kind && Objects.equals(getQualifier(), other.getQualifier());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, getQualifier());
    }

    @Override
    public String toString() {
        Integer qualifier = getQualifier();
        return name + " (" + kind + (qualifier != null ? " " + qualifier : "") + ")";
    }
}
