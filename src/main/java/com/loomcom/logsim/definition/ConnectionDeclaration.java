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

/**
 * {@code source : destination;} as written in the CONNECTIONS block.
 */
public final class ConnectionDeclaration {

    private final SignalReference source;
    private final SignalReference destination;

    public ConnectionDeclaration(SignalReference source, SignalReference destination) {
        this.source = source;
        this.destination = destination;
    }

    public SignalReference getSource() {
        return source;
    }

    public SignalReference getDestination() {
        return destination;
    }

    @Override
    public String toString() {
        return source + " : " + destination;
    }
}
