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

import com.loomcom.logsim.diagnostics.Diagnostic;
import com.loomcom.logsim.diagnostics.DiagnosticKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of loading a definition: every diagnostic, and a circuit when
 * none of them is an error.
 */
public final class LoadResult {

    private final Circuit circuit;
    private final List<Diagnostic> diagnostics;
    private final String sourceText;

    public LoadResult(Circuit circuit, List<Diagnostic> diagnostics, String sourceText) {
        if (circuit != null && Diagnostic.containsErrors(diagnostics)) {
            throw new IllegalArgumentException("A circuit cannot be built from a definition with errors");
        }
        this.circuit = circuit;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.sourceText = sourceText;
    }

    public boolean isSuccess() {
        return circuit != null;
    }

    /**
     * @return the circuit, or null if loading failed
     */
    public Circuit getCircuit() {
        return circuit;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                errors.add(d);
            }
        }
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        return ofKind(DiagnosticKind.SEMANTIC_WARNING);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        List<Diagnostic> matching = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.getKind() == kind) {
                matching.add(d);
            }
        }
        return matching;
    }

    /**
     * All diagnostics with source excerpts, followed by a summary line.
     */
    public String formatDiagnostics() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d.format(sourceText)).append(System.lineSeparator());
        }
        sb.append(getErrors().size()).append(" error(s), ")
          .append(getWarnings().size()).append(" warning(s)");
        return sb.toString();
    }
}
