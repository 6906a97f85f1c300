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

package com.loomcom.logsim.exceptions;

import com.loomcom.logsim.diagnostics.Diagnostic;

import java.util.Collections;
import java.util.List;

/**
 * Raised when a definition file cannot be turned into a runnable circuit.
 * Carries every diagnostic collected while loading, not just the first.
 */
public class CircuitDefinitionException extends Exception {

    private final List<Diagnostic> diagnostics;

    public CircuitDefinitionException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
