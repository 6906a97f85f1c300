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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Hand written lexer for circuit definition files.
 *
 * Whitespace is insignificant. Two comment forms are discarded: '/' runs to
 * the end of the line, and '#' runs to the next '#' (newlines included).
 * Anything unrecognized becomes an ERROR token; the lexer itself never fails.
 *
 * Each call to {@link #iterator()} lexes lazily from the start of the text,
 * so the token sequence can be walked any number of times.
 */
public class Lexer implements Iterable<Token> {

    public static final String DEVICES = "DEVICES";
    public static final String CONNECTIONS = "CONNECTIONS";
    public static final String MONITORS = "MONITORS";

    private static final Set<String> KEYWORDS = Set.of(DEVICES, CONNECTIONS, MONITORS);

    static final char LINE_COMMENT = '/';
    static final char BLOCK_COMMENT = '#';

    private final String input;

    public Lexer(String input) {
        this.input = input == null ? "" : input;
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    public String getInput() {
        return input;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Cursor();
    }

    /**
     * Lex the whole input.
     *
     * @return every token, the last one always EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    private class Cursor implements Iterator<Token> {

        private final int length = input.length();
        private int pos = 0;
        private int line = 1;
        private int column = 1;
        private boolean done = false;

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) {
                throw new NoSuchElementException("Lexer already returned EOF");
            }
            Token token = scan();
            if (token.is(TokenType.EOF)) {
                done = true;
            }
            return token;
        }

        private Token scan() {
            while (!isAtEnd()) {
                char c = peek();

                if (Character.isWhitespace(c)) {
                    advance();
                    continue;
                }
                if (c == LINE_COMMENT) {
                    skipLineComment();
                    continue;
                }

                int startLine = line;
                int startColumn = column;

                if (c == BLOCK_COMMENT) {
                    if (input.indexOf(BLOCK_COMMENT, pos + 1) < 0) {
                        // unpaired: report it and lex what follows as ordinary text
                        advance();
                        return new Token(TokenType.ERROR, String.valueOf(BLOCK_COMMENT), startLine, startColumn);
                    }
                    skipBlockComment();
                    continue;
                }

                if (Character.isLetter(c)) {
                    String word = readWhile(true);
                    TokenType type = isKeyword(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
                    return new Token(type, word, startLine, startColumn);
                }

                if (Character.isDigit(c)) {
                    String digits = readWhile(false);
                    if (!fitsInt(digits)) {
                        return new Token(TokenType.ERROR, digits, startLine, startColumn);
                    }
                    return new Token(TokenType.NUMBER, digits, startLine, startColumn);
                }

                advance();
                switch (c) {
                    case '{':
                        return new Token(TokenType.LEFT_BRACE, "{", startLine, startColumn);
                    case '}':
                        return new Token(TokenType.RIGHT_BRACE, "}", startLine, startColumn);
                    case '[':
                        return new Token(TokenType.LEFT_BRACKET, "[", startLine, startColumn);
                    case ']':
                        return new Token(TokenType.RIGHT_BRACKET, "]", startLine, startColumn);
                    case ';':
                        return new Token(TokenType.SEMICOLON, ";", startLine, startColumn);
                    case ':':
                        return new Token(TokenType.COLON, ":", startLine, startColumn);
                    case '.':
                        return new Token(TokenType.DOT, ".", startLine, startColumn);
                    default:
                        return new Token(TokenType.ERROR, String.valueOf(c), startLine, startColumn);
                }
            }
            return new Token(TokenType.EOF, "", line, column);
        }

        private boolean isAtEnd() {
            return pos >= length;
        }

        private char peek() {
            return input.charAt(pos);
        }

        private char advance() {
            char c = input.charAt(pos++);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return c;
        }

        private void skipLineComment() {
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
        }

        // Caller has checked that a closing '#' exists.
        private void skipBlockComment() {
            advance();
            while (peek() != BLOCK_COMMENT) {
                advance();
            }
            advance();
        }

        private String readWhile(boolean identifier) {
            StringBuilder sb = new StringBuilder();
            while (!isAtEnd()) {
                char c = peek();
                boolean accept = identifier ? Character.isLetterOrDigit(c) : Character.isDigit(c);
                if (!accept) {
                    break;
                }
                sb.append(advance());
            }
            return sb.toString();
        }

        private boolean fitsInt(String digits) {
            try {
                Integer.parseInt(digits);
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
    }
}
