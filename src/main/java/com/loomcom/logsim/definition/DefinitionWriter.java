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

import com.loomcom.logsim.devices.Device;
import com.loomcom.logsim.network.Circuit;
import com.loomcom.logsim.network.Connection;
import com.loomcom.logsim.network.OutputPin;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes a circuit back out in the definition language. Reading the output
 * with {@link Parser} builds an equal circuit.
 */
public class DefinitionWriter {

    private static final String INDENT = "    ";
    private static final String NEWLINE = "\n";

    public static String toDefinition(Circuit circuit) {
        StringBuilder sb = new StringBuilder();
        write(circuit, sb);
        return sb.toString();
    }

    public static void write(Circuit circuit, Writer out) throws IOException {
        try {
            write(circuit, (Appendable) out);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static void write(Circuit circuit, Appendable out) {
        append(out, Lexer.DEVICES + " [" + NEWLINE);
        for (Device device : circuit.getDevices()) {
            StringBuilder entry = new StringBuilder(INDENT);
            entry.append("{ ").append(Parser.ATTR_ID).append(": ").append(device.getName()).append("; ")
                 .append(Parser.ATTR_KIND).append(": ").append(device.getKind()).append(';');
            Integer qualifier = device.getQualifier();
            if (qualifier != null) {
                entry.append(' ').append(Parser.ATTR_QUAL).append(": ").append(qualifier).append(';');
            }
            entry.append(" };").append(NEWLINE);
            append(out, entry);
        }
        append(out, "];" + NEWLINE + NEWLINE);

        append(out, Lexer.CONNECTIONS + " [" + NEWLINE);
        for (Connection connection : circuit.getConnections()) {
            append(out, INDENT + circuit.signalName(connection.getSource()) + " : "
                        + circuit.inputName(connection.getDestination()) + ";" + NEWLINE);
        }
        append(out, "];" + NEWLINE + NEWLINE);

        append(out, Lexer.MONITORS + " [" + NEWLINE);
        for (OutputPin monitor : circuit.getMonitors()) {
            append(out, INDENT + circuit.signalName(monitor) + ";" + NEWLINE);
        }
        append(out, "];" + NEWLINE);
    }

    private static void append(Appendable out, CharSequence text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
