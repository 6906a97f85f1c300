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

import com.loomcom.logsim.devices.Device;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A validated logic network: a flat table of devices addressed by index,
 * the driver of every input pin, and the outputs to monitor.
 *
 * Topology is fixed once built. Signal levels and device state live in the
 * simulator, so one circuit can back any number of simulators.
 */
public final class Circuit {

    private final List<Device> devices;
    private final Map<String, Integer> deviceIndex;
    private final OutputPin[][] drivers;
    private final List<Connection> connections;
    private final List<OutputPin> monitors;

    Circuit(List<Device> devices, OutputPin[][] drivers, List<Connection> connections, List<OutputPin> monitors) {
        this.devices = Collections.unmodifiableList(new ArrayList<>(devices));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < devices.size(); i++) {
            index.put(devices.get(i).getName(), i);
        }
        this.deviceIndex = Collections.unmodifiableMap(index);
        this.drivers = new OutputPin[drivers.length][];
        for (int i = 0; i < drivers.length; i++) {
            this.drivers[i] = drivers[i].clone();
        }
        this.connections = Collections.unmodifiableList(new ArrayList<>(connections));
        this.monitors = Collections.unmodifiableList(new ArrayList<>(monitors));
    }

    public int getDeviceCount() {
        return devices.size();
    }

    public List<Device> getDevices() {
        return devices;
    }

    public Device getDevice(int index) {
        return devices.get(index);
    }

    /**
     * @return the device, or null if no device has that name
     */
    public Device getDevice(String name) {
        Integer index = deviceIndex.get(name);
        return index == null ? null : devices.get(index);
    }

    /**
     * @return index of the named device, or -1
     */
    public int indexOf(String name) {
        Integer index = deviceIndex.get(name);
        return index == null ? -1 : index;
    }

    /**
     * @return the output driving the given input, or null if it is unbound
     */
    public OutputPin getDriver(int device, int inputPin) {
        return drivers[device][inputPin];
    }

    public OutputPin getDriver(InputPin input) {
        return getDriver(input.getDevice(), input.getPin());
    }

    /**
     * Connections in declaration order.
     */
    public List<Connection> getConnections() {
        return connections;
    }

    /**
     * Monitored outputs in declaration order.
     */
    public List<OutputPin> getMonitors() {
        return monitors;
    }

    public List<InputPin> getUnboundInputs() {
        List<InputPin> unbound = new ArrayList<>();
        for (int d = 0; d < drivers.length; d++) {
            for (int p = 0; p < drivers[d].length; p++) {
                if (drivers[d][p] == null) {
                    unbound.add(new InputPin(d, p));
                }
            }
        }
        return unbound;
    }

    /**
     * {@code DEV} or {@code DEV.PIN} for an output.
     */
    public String signalName(OutputPin output) {
        return devices.get(output.getDevice()).signalName(output.getPin());
    }

    /**
     * {@code DEV.PIN} for an input.
     */
    public String inputName(InputPin input) {
        Device device = devices.get(input.getDevice());
        return device.getName() + "." + device.getInputPins().get(input.getPin());
    }

    /**
     * Resolve a signal name to an output handle.
     *
     * @param signal {@code DEV} or {@code DEV.PIN}
     * @return the output, or null if the signal does not name an output
     */
    public OutputPin findOutput(String signal) {
        int dot = signal.indexOf('.');
        String name = dot < 0 ? signal : signal.substring(0, dot);
        String pin = dot < 0 ? null : signal.substring(dot + 1);
        int device = indexOf(name);
        if (device < 0) {
            return null;
        }
        int output = devices.get(device).outputIndex(pin);
        return output < 0 ? null : new OutputPin(device, output);
    }

    private Set<String> connectionNames() {
        Set<String> names = new HashSet<>();
        for (Connection connection : connections) {
            names.add(signalName(connection.getSource()) + ":" + inputName(connection.getDestination()));
        }
        return names;
    }

    private List<String> monitorNames() {
        List<String> names = new ArrayList<>();
        for (OutputPin monitor : monitors) {
            names.add(signalName(monitor));
        }
        return names;
    }

    /**
     * Same devices in the same order, same connections and same monitors,
     * compared by name.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Circuit)) return false;
        Circuit other = (Circuit) o;
        return devices.equals(other.devices)
               && connectionNames().equals(other.connectionNames())
               && monitorNames().equals(other.monitorNames());
    }

    @Override
    public int hashCode() {
        return devices.hashCode() * 31 + monitorNames().hashCode();
    }

    @Override
    public String toString() {
        return "Circuit[" + devices.size() + " devices, " + connections.size() + " connections, "
               + monitors.size() + " monitors]";
    }
}
