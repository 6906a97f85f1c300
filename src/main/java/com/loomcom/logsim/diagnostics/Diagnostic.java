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

import java.util.Collection;
import java.util.Objects;

/**
 * A single problem found in a definition file or during a run.
 *
 * A diagnostic always carries enough to locate the offending input: a source
 * position when one is known, and a subject naming the device, connection or
 * cycle it concerns.
 */
public final class Diagnostic {

    private final DiagnosticKind kind;
    private final String message;
    private final SourcePosition position;   // null for runtime diagnostics
    private final String subject;            // null when the position says it all

    public Diagnostic(DiagnosticKind kind, String message, SourcePosition position, String subject) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.position = position;
        this.subject = subject;
    }

    public static Diagnostic lexical(String message, SourcePosition position) {
        return new Diagnostic(DiagnosticKind.LEXICAL_ERROR, message, position, null);
    }

    public static Diagnostic syntax(String message, SourcePosition position) {
        return new Diagnostic(DiagnosticKind.SYNTAX_ERROR, message, position, null);
    }

    public static Diagnostic error(String message, SourcePosition position, String subject) {
        return new Diagnostic(DiagnosticKind.SEMANTIC_ERROR, message, position, subject);
    }

    public static Diagnostic warning(String message, SourcePosition position, String subject) {
        return new Diagnostic(DiagnosticKind.SEMANTIC_WARNING, message, position, subject);
    }

    public static Diagnostic runtime(String message, String subject) {
        return new Diagnostic(DiagnosticKind.RUNTIME_ERROR, message, null, subject);
    }

    public static boolean containsErrors(Collection<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                return true;
            }
        }
        return false;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public String getSubject() {
        return subject;
    }

    public boolean isError() {
        return kind.isError();
    }

    /**
     * Render this diagnostic with the offending source line and a caret
     * under the reported column.
     *
     * @param sourceText the full text the diagnostic was produced from
     * @return a one-line summary, followed by the excerpt when the line exists
     */
    public String format(String sourceText) {
        String summary = toString();
        if (position == null || sourceText == null) {
            return summary;
        }
        String[] lines = sourceText.split("\r?\n", -1);
        if (position.getLine() > lines.length) {
            return summary;
        }
        String line = lines[position.getLine() - 1];
        StringBuilder caret = new StringBuilder();
        for (int i = 1; i < position.getColumn(); i++) {
            // keep tabs so the caret lines up under tab-indented text
            caret.append(i <= line.length() && line.charAt(i - 1) == '\t' ? '\t' : ' ');
        }
        caret.append('^');
        return summary + System.lineSeparator() + line + System.lineSeparator() + caret;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (position != null) {
            sb.append("line ").append(position.getLine())
              .append(", column ").append(position.getColumn()).append(": ");
        }
        sb.append(kind.getLabel()).append(": ").append(message);
        if (subject != null) {
            sb.append(" [").append(subject).append(']');
        }
        return sb.toString();
    }
}
