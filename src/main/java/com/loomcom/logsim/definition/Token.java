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

import com.loomcom.logsim.diagnostics.SourcePosition;

/**
 * A lexeme with its category and where it started.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final SourcePosition position;

    public Token(TokenType type, String text, int line, int column) {
        this.type = type;
        this.text = text;
        this.position = new SourcePosition(line, column);
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    /**
     * Value of a NUMBER token.
     */
    public int intValue() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Not a number token: " + this);
        }
        return Integer.parseInt(text);
    }

    /**
     * Short form used in diagnostics, e.g. {@code ';'} or {@code identifier 'SW1'}.
     */
    public String describe() {
        switch (type) {
            case EOF:
                return "end of input";
            case IDENTIFIER:
                return "identifier '" + text + "'";
            case NUMBER:
                return "number " + text;
            case KEYWORD:
                return "keyword " + text;
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
