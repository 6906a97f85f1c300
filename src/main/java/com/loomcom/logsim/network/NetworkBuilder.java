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

import com.loomcom.logsim.SimulatorConfig;
import com.loomcom.logsim.definition.ConnectionDeclaration;
import com.loomcom.logsim.definition.DeviceDeclaration;
import com.loomcom.logsim.definition.ParseResult;
import com.loomcom.logsim.definition.SignalReference;
import com.loomcom.logsim.devices.Clock;
import com.loomcom.logsim.devices.CombinationalDevice;
import com.loomcom.logsim.devices.DType;
import com.loomcom.logsim.devices.Device;
import com.loomcom.logsim.devices.DeviceKind;
import com.loomcom.logsim.devices.Gate;
import com.loomcom.logsim.devices.Switch;
import com.loomcom.logsim.devices.XorGate;
import com.loomcom.logsim.diagnostics.Diagnostic;
import com.loomcom.logsim.diagnostics.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw declarations into a {@link Circuit}, checking every structural
 * rule on the way.
 *
 * Checks never stop at the first failure: a bad device, connection or
 * monitor is reported and dropped, and validation carries on with the rest.
 * A circuit is only produced when no error-level diagnostic exists, parse
 * diagnostics included.
 */
public class NetworkBuilder {

    private final static Logger logger = LoggerFactory.getLogger(NetworkBuilder.class.getName());

    private final int maxGateInputs;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<Device> devices = new ArrayList<>();
    private final Map<String, Integer> deviceIndex = new HashMap<>();
    private final Map<String, SourcePosition> declaredNames = new LinkedHashMap<>();
    private final Set<String> invalidNames = new HashSet<>();
    private final List<SourcePosition> devicePositions = new ArrayList<>();
    private OutputPin[][] drivers;
    private boolean built = false;

    public NetworkBuilder(int maxGateInputs) {
        this.maxGateInputs = maxGateInputs;
    }

    public NetworkBuilder(SimulatorConfig config) {
        this(config.getMaxGateInputs());
    }

    /**
     * Validate parsed declarations and build the circuit. A builder can only
     * be used once.
     *
     * @param parsed     output of the parser, its diagnostics included
     * @param sourceText the text that was parsed, kept for formatting diagnostics
     */
    public LoadResult build(ParseResult parsed, String sourceText) {
        if (built) {
            throw new IllegalStateException("NetworkBuilder has already been used");
        }
        built = true;
        diagnostics.addAll(parsed.getDiagnostics());
        invalidNames.addAll(parsed.getDiscardedDeviceNames());

        for (DeviceDeclaration declaration : parsed.getDevices()) {
            addDevice(declaration);
        }

        drivers = new OutputPin[devices.size()][];
        for (int i = 0; i < devices.size(); i++) {
            drivers[i] = new OutputPin[devices.get(i).getInputCount()];
        }
        List<Connection> connections = new ArrayList<>();
        for (ConnectionDeclaration declaration : parsed.getConnections()) {
            Connection connection = addConnection(declaration);
            if (connection != null) {
                connections.add(connection);
            }
        }

        List<OutputPin> monitors = new ArrayList<>();
        for (SignalReference reference : parsed.getMonitors()) {
            OutputPin output = resolveOutput(reference, "Monitor", reference.toString());
            if (output == null) {
                continue;
            }
            if (monitors.contains(output)) {
                diagnostics.add(Diagnostic.warning("Signal " + reference + " is already monitored",
                                                   reference.getPosition(), reference.toString()));
                continue;
            }
            monitors.add(output);
        }

        reportUnboundInputs();

        if (Diagnostic.containsErrors(diagnostics)) {
            logger.debug("Rejected definition with {} diagnostics", diagnostics.size());
            return new LoadResult(null, diagnostics, sourceText);
        }
        Circuit circuit = new Circuit(devices, drivers, connections, monitors);
        logger.debug("Built {}", circuit);
        return new LoadResult(circuit, diagnostics, sourceText);
    }

    // ---------------- devices ----------------

    private void addDevice(DeviceDeclaration declaration) {
        String name = declaration.getName();
        if (name == null) {
            error("Device entry has no id", declaration.getPosition(), null);
            return;
        }
        SourcePosition firstDeclared = declaredNames.get(name);
        if (firstDeclared != null) {
            error("Device " + name + " is already defined at line " + firstDeclared.getLine(),
                  declaration.getNamePosition(), name);
            return;
        }
        declaredNames.put(name, declaration.getNamePosition());

        Device device = createDevice(declaration);
        if (device == null) {
            invalidNames.add(name);
            return;
        }
        deviceIndex.put(name, devices.size());
        devices.add(device);
        devicePositions.add(declaration.getNamePosition());
    }

    private Device createDevice(DeviceDeclaration declaration) {
        String name = declaration.getName();
        if (declaration.getKind() == null) {
            error("Device " + name + " has no kind", declaration.getNamePosition(), name);
            return null;
        }
        DeviceKind kind = DeviceKind.fromName(declaration.getKind());
        if (kind == null) {
            error("Unknown device kind '" + declaration.getKind() + "' for " + name,
                  declaration.getKindPosition(), name);
            return null;
        }

        Integer qualifier = declaration.getQualifier();
        switch (kind.checkQualifier(qualifier, maxGateInputs)) {
            case MISSING:
                error(kind + " device " + name + " needs a qualifier: " + kind.describeQualifier(maxGateInputs),
                      declaration.getKindPosition(), name);
                return null;
            case OUT_OF_RANGE:
                error("Qualifier " + qualifier + " is out of range for " + kind + " device " + name
                      + "; expected " + kind.describeQualifier(maxGateInputs),
                      declaration.getQualifierPosition(), name);
                return null;
            case NOT_ALLOWED:
                error(kind + " device " + name + " does not take a qualifier",
                      declaration.getQualifierPosition(), name);
                return null;
            default:
                break;
        }

        switch (kind) {
            case SWITCH:
                return new Switch(name, qualifier == 1);
            case CLOCK:
                return new Clock(name, qualifier);
            case XOR:
                return new XorGate(name);
            case DTYPE:
                return new DType(name);
            default:
                return new Gate(name, kind, qualifier);
        }
    }

    // ---------------- connections ----------------

    private Connection addConnection(ConnectionDeclaration declaration) {
        String subject = declaration.toString();
        OutputPin source = resolveOutput(declaration.getSource(), "Connection", subject);
        InputPin destination = resolveInput(declaration.getDestination(), subject);
        if (source == null || destination == null) {
            return null;
        }
        OutputPin existing = drivers[destination.getDevice()][destination.getPin()];
        if (existing != null) {
            error("Input " + declaration.getDestination() + " is already driven by "
                  + devices.get(existing.getDevice()).signalName(existing.getPin()),
                  declaration.getDestination().getPosition(), subject);
            return null;
        }
        drivers[destination.getDevice()][destination.getPin()] = source;
        return new Connection(source, destination);
    }

    /**
     * Resolve a signal used as a source, either of a connection or of a monitor.
     *
     * @return the output, or null after reporting why it could not be resolved
     */
    private OutputPin resolveOutput(SignalReference reference, String context, String subject) {
        Integer index = lookup(reference, context, subject);
        if (index == null) {
            return null;
        }
        Device device = devices.get(index);

        if (!reference.hasPin()) {
            int output = device.outputIndex(null);
            if (output < 0) {
                error(device.getKind() + " device " + device.getName() + " has several outputs; use "
                      + String.join(" or ", qualifiedOutputs(device)),
                      reference.getPosition(), subject);
                return null;
            }
            return new OutputPin(index, output);
        }

        String pin = reference.getPinName();
        int output = device.outputIndex(pin);
        if (output >= 0) {
            return new OutputPin(index, output);
        }
        if (device.inputIndex(pin) >= 0) {
            error(reference + " is an input and cannot be used as a signal source",
                  reference.getPinPosition(), subject);
        } else if (device.outputIndex(null) >= 0) {
            error("Device " + device.getName() + " has a single unnamed output; write " + device.getName()
                  + " instead of " + reference, reference.getPinPosition(), subject);
        } else {
            error("Device " + device.getName() + " has no output pin '" + pin + "'; expected "
                  + String.join(" or ", qualifiedOutputs(device)), reference.getPinPosition(), subject);
        }
        return null;
    }

    private InputPin resolveInput(SignalReference reference, String subject) {
        Integer index = lookup(reference, "Connection", subject);
        if (index == null) {
            return null;
        }
        Device device = devices.get(index);
        String pin = reference.getPinName();

        int input = device.inputIndex(pin);
        if (input >= 0) {
            return new InputPin(index, input);
        }
        if (device.getInputCount() == 0) {
            error(device.getKind() + " device " + device.getName() + " has no inputs",
                  reference.getPinPosition(), subject);
        } else if (pin == null) {
            error("Destination " + reference + " must name an input pin, one of " + device.getInputPins(),
                  reference.getPosition(), subject);
        } else if (device.outputIndex(pin) >= 0) {
            error(reference + " is an output and cannot be driven", reference.getPinPosition(), subject);
        } else if (device instanceof CombinationalDevice && Gate.inputNumber(pin) > device.getInputCount()) {
            error("Pin " + reference + " exceeds the " + device.getInputCount() + " input(s) of "
                  + device.getKind() + " gate " + device.getName(), reference.getPinPosition(), subject);
        } else {
            error("Device " + device.getName() + " has no input pin '" + pin + "'; expected one of "
                  + device.getInputPins(), reference.getPinPosition(), subject);
        }
        return null;
    }

    private Integer lookup(SignalReference reference, String context, String subject) {
        String name = reference.getDeviceName();
        Integer index = deviceIndex.get(name);
        if (index != null) {
            return index;
        }
        if (invalidNames.contains(name)) {
            error(context + " refers to device " + name + ", which has errors",
                  reference.getPosition(), subject);
        } else {
            error(context + " refers to unknown device " + name, reference.getPosition(), subject);
        }
        return null;
    }

    private static List<String> qualifiedOutputs(Device device) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < device.getOutputCount(); i++) {
            names.add(device.signalName(i));
        }
        return names;
    }

    private void reportUnboundInputs() {
        for (int d = 0; d < drivers.length; d++) {
            Device device = devices.get(d);
            for (int p = 0; p < drivers[d].length; p++) {
                if (drivers[d][p] == null) {
                    String input = device.getName() + "." + device.getInputPins().get(p);
                    diagnostics.add(Diagnostic.warning("Input " + input + " is not connected and reads as 0",
                                                       devicePositions.get(d), input));
                }
            }
        }
    }

    private void error(String message, SourcePosition position, String subject) {
        diagnostics.add(Diagnostic.error(message, position, subject));
    }
}
