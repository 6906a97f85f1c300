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

import com.loomcom.logsim.diagnostics.Diagnostic;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Raw declarations recognized by the parser, plus everything it reported.
 */
public final class ParseResult {

    private final List<DeviceDeclaration> devices;
    private final List<ConnectionDeclaration> connections;
    private final List<SignalReference> monitors;
    private final List<Diagnostic> diagnostics;
    private final Set<String> discardedDeviceNames;

    public ParseResult(List<DeviceDeclaration> devices,
                       List<ConnectionDeclaration> connections,
                       List<SignalReference> monitors,
                       List<Diagnostic> diagnostics,
                       Set<String> discardedDeviceNames) {
        this.devices = Collections.unmodifiableList(devices);
        this.connections = Collections.unmodifiableList(connections);
        this.monitors = Collections.unmodifiableList(monitors);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.discardedDeviceNames = Collections.unmodifiableSet(discardedDeviceNames);
    }

    public List<DeviceDeclaration> getDevices() {
        return devices;
    }

    public List<ConnectionDeclaration> getConnections() {
        return connections;
    }

    public List<SignalReference> getMonitors() {
        return monitors;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Names of device entries dropped because of syntax errors inside them.
     * References to these are not reported as unknown devices.
     */
    public Set<String> getDiscardedDeviceNames() {
        return discardedDeviceNames;
    }

    public boolean hasErrors() {
        return Diagnostic.containsErrors(diagnostics);
    }
}
