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
 * Token categories produced by the lexer.
 */
public enum TokenType {

    IDENTIFIER,      // device names, kinds, pin names, attribute keys
    NUMBER,          // unsigned decimal integer
    KEYWORD,         // DEVICES, CONNECTIONS, MONITORS

    LEFT_BRACE,      // {
    RIGHT_BRACE,     // }
    LEFT_BRACKET,    // [
    RIGHT_BRACKET,   // ]
    SEMICOLON,       // ;
    COLON,           // :
    DOT,             // .

    ERROR,           // unrecognized character or unterminated comment
    EOF
}
