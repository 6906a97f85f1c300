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

package com.loomcom.logsim.diagnostics;

/**
 * Error taxonomy for everything reported while loading or running a circuit.
 *
 * Only SEMANTIC_WARNING is non-fatal. Any other kind present after loading
 * prevents a circuit from being built.
 */
public enum DiagnosticKind {
    LEXICAL_ERROR("lexical error", true),       // unrecognized character, unterminated comment
    SYNTAX_ERROR("syntax error", true),         // grammar violation
    SEMANTIC_ERROR("error", true),              // unknown name/kind/pin, bad qualifier, duplicate driver
    SEMANTIC_WARNING("warning", false),         // unbound input, duplicate attribute
    RUNTIME_ERROR("runtime error", true);       // oscillation during a run

    private final String label;
    private final boolean error;

    DiagnosticKind(String label, boolean error) {
        this.label = label;
        this.error = error;
    }

    public String getLabel() {
        return label;
    }

    public boolean isError() {
        return error;
    }
}
