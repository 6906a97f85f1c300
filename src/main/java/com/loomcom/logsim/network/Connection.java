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
 * A validated edge from a device output to a device input.
 */
public final class Connection {

    private final OutputPin source;
    private final InputPin destination;

    public Connection(OutputPin source, InputPin destination) {
        this.source = source;
        this.destination = destination;
    }

    public OutputPin getSource() {
        return source;
    }

    public InputPin getDestination() {
        return destination;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Connection)) return false;
        Connection other = (Connection) o;
        return source.equals(other.source) && destination.equals(other.destination);
    }

    @Override
    public int hashCode() {
        return 31 * source.hashCode() + destination.hashCode();
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
