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

import com.loomcom.logsim.diagnostics.Diagnostic;
import com.loomcom.logsim.diagnostics.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for circuit definition files.
 *
 * <pre>
 * file        := devicesBlock connectionsBlock monitorsBlock
 * devicesBlock:= "DEVICES" "[" device* "]" ";"?
 * device      := "{" attr (";" attr)* ";"? "}" ";"
 * attr        := ("id" | "kind" | "qual") ":" value
 * connBlock   := "CONNECTIONS" "[" (signalRef ":" pinRef ";")* "]" ";"?
 * monBlock    := "MONITORS" "[" signalRef (";" signalRef)* ";"? "]" ";"?
 * signalRef   := identifier ("." pinName)?
 * pinRef      := identifier "." pinName
 * </pre>
 *
 * The parser never stops at the first problem. A syntax error is recorded
 * and the parser enters {@link Mode#RECOVERING}; further syntax errors are
 * suppressed until it resynchronizes (skipping to the next ';' or up to the
 * enclosing block closer) and returns to {@link Mode#NORMAL}. Stray ERROR
 * tokens from the lexer are reported and skipped wherever they appear.
 */
public class Parser {

    private final static Logger logger = LoggerFactory.getLogger(Parser.class.getName());

    static final String ATTR_ID = "id";
    static final String ATTR_KIND = "kind";
    static final String ATTR_QUAL = "qual";

    private static final String[] SECTION_ORDER = {Lexer.DEVICES, Lexer.CONNECTIONS, Lexer.MONITORS};

    public enum Mode {
        NORMAL,       // reporting errors
        RECOVERING    // discarding input until a resynchronization point
    }

    private final Iterator<Token> tokens;
    private Token current;
    private Mode mode = Mode.NORMAL;
    private boolean parsed = false;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<DeviceDeclaration> devices = new ArrayList<>();
    private final List<ConnectionDeclaration> connections = new ArrayList<>();
    private final List<SignalReference> monitors = new ArrayList<>();
    private final Set<String> discardedDeviceNames = new LinkedHashSet<>();

    private int syntaxErrorCount = 0;

    public Parser(Lexer lexer) {
        this.tokens = lexer.iterator();
    }

    public Parser(String text) {
        this(new Lexer(text));
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * Parse the whole definition. A parser instance can only be used once.
     */
    public ParseResult parse() {
        if (parsed) {
            throw new IllegalStateException("Parser has already consumed its input");
        }
        parsed = true;

        advance();
        if (current.is(TokenType.EOF)) {
            syntaxError("Empty definition file; expected a DEVICES block");
            resume();
        } else {
            parseSections();
        }

        logger.debug("Parsed {} devices, {} connections, {} monitors with {} diagnostics",
                     devices.size(), connections.size(), monitors.size(), diagnostics.size());
        return new ParseResult(devices, connections, monitors, diagnostics, discardedDeviceNames);
    }

    // ---------------- sections ----------------

    private void parseSections() {
        boolean[] seen = new boolean[SECTION_ORDER.length];
        int next = 0;

        while (!current.is(TokenType.EOF)) {
            if (!current.is(TokenType.KEYWORD)) {
                syntaxError("Expected DEVICES, CONNECTIONS or MONITORS, found " + current.describe());
                while (!current.is(TokenType.KEYWORD) && !current.is(TokenType.EOF)) {
                    advance();
                }
                resume();
                continue;
            }

            int index = sectionIndex(current.getText());
            boolean keep = true;
            if (seen[index]) {
                syntaxError("Duplicate " + SECTION_ORDER[index] + " block");
                resume();
                keep = false;
            } else {
                if (index < next) {
                    syntaxError(SECTION_ORDER[index] + " block out of order; it must come before "
                                + SECTION_ORDER[next - 1]);
                    resume();
                }
                seen[index] = true;
                next = Math.max(next, index + 1);
            }

            switch (index) {
                case 0:
                    parseDevicesBlock(keep);
                    break;
                case 1:
                    parseConnectionsBlock(keep);
                    break;
                default:
                    parseMonitorsBlock(keep);
                    break;
            }
        }

        for (int i = 0; i < SECTION_ORDER.length; i++) {
            if (!seen[i]) {
                syntaxError("Missing " + SECTION_ORDER[i] + " block");
                resume();
            }
        }
    }

    private static int sectionIndex(String keyword) {
        for (int i = 0; i < SECTION_ORDER.length; i++) {
            if (SECTION_ORDER[i].equals(keyword)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Not a section keyword: " + keyword);
    }

    /**
     * Consume the section keyword and its '['.
     *
     * @return false if the '[' was missing and the section was skipped
     */
    private boolean openSection() {
        String name = current.getText();
        advance();
        if (!expect(TokenType.LEFT_BRACKET, "'[' after " + name)) {
            while (!current.is(TokenType.KEYWORD) && !current.is(TokenType.EOF)) {
                advance();
            }
            resume();
            return false;
        }
        return true;
    }

    private void closeSection(String name) {
        if (accept(TokenType.RIGHT_BRACKET)) {
            accept(TokenType.SEMICOLON);
            logger.debug("Parsed {} block", name);
        } else {
            syntaxError("Missing ']' to close the " + name + " block, found " + current.describe());
            resume();
        }
    }

    private boolean atListEnd() {
        return current.is(TokenType.RIGHT_BRACKET) || current.is(TokenType.KEYWORD) || current.is(TokenType.EOF);
    }

    // ---------------- devices ----------------

    private void parseDevicesBlock(boolean keep) {
        if (!openSection()) {
            return;
        }
        while (!atListEnd()) {
            if (current.is(TokenType.LEFT_BRACE)) {
                DeviceDeclaration device = parseDeviceEntry();
                if (device != null && keep) {
                    devices.add(device);
                }
            } else {
                syntaxError("Expected '{' to start a device entry or ']' to end the DEVICES block, found "
                            + current.describe());
                synchronizeToEntry();
            }
        }
        closeSection(Lexer.DEVICES);
    }

    /**
     * @return the declaration, or null when the entry contained a syntax error
     */
    private DeviceDeclaration parseDeviceEntry() {
        int errorsBefore = syntaxErrorCount;
        SourcePosition start = current.getPosition();
        advance();   // '{'

        DeviceAttributes attributes = new DeviceAttributes();
        while (!current.is(TokenType.RIGHT_BRACE)) {
            if (atListEnd() || current.is(TokenType.LEFT_BRACE)) {
                syntaxError("Missing '}' to close the device entry, found " + current.describe());
                resume();
                break;
            }
            if (parseAttribute(attributes)) {
                continue;   // recovery already consumed the separator
            }
            if (accept(TokenType.SEMICOLON) || current.is(TokenType.RIGHT_BRACE)
                    || current.is(TokenType.LEFT_BRACE) || atListEnd()) {
                continue;
            }
            syntaxError("Expected ';' or '}' after attribute, found " + current.describe());
            synchronize(TokenType.RIGHT_BRACE, TokenType.LEFT_BRACE);
        }

        boolean clean = syntaxErrorCount == errorsBefore;
        if (accept(TokenType.RIGHT_BRACE)) {
            if (!accept(TokenType.SEMICOLON) && !atListEnd()) {
                syntaxError("Missing ';' after device entry, found " + current.describe());
                if (current.is(TokenType.LEFT_BRACE)) {
                    // the next entry is intact: report and keep going
                    resume();
                } else {
                    synchronizeToEntry();
                }
            }
        }

        if (!clean) {
            if (attributes.name != null) {
                discardedDeviceNames.add(attributes.name);
            }
            return null;
        }
        return new DeviceDeclaration(start,
                                     attributes.name, attributes.namePosition,
                                     attributes.kind, attributes.kindPosition,
                                     attributes.qualifier, attributes.qualifierPosition);
    }

    /**
     * Parse {@code key : value}.
     *
     * @return true if error recovery consumed the ';' that follows the attribute
     */
    private boolean parseAttribute(DeviceAttributes attributes) {
        if (!current.is(TokenType.IDENTIFIER)) {
            syntaxError("Expected attribute name (id, kind or qual), found " + current.describe());
            return synchronize(TokenType.RIGHT_BRACE, TokenType.LEFT_BRACE);
        }
        Token key = current;
        advance();
        if (!expect(TokenType.COLON, "':' after '" + key.getText() + "'")) {
            return synchronize(TokenType.RIGHT_BRACE, TokenType.LEFT_BRACE);
        }

        Token value = current;
        if (value.is(TokenType.KEYWORD)) {
            syntaxError("Keyword " + value.getText() + " cannot be used as the value of '" + key.getText() + "'");
            advance();
            return synchronize(TokenType.RIGHT_BRACE, TokenType.LEFT_BRACE);
        }
        switch (key.getText()) {
            case ATTR_ID:
                if (!value.is(TokenType.IDENTIFIER)) {
                    syntaxError("Device name must be alphanumeric and start with a letter, found " + value.describe());
                    return synchronize(TokenType.RIGHT_BRACE, TokenType.LEFT_BRACE);
                }
                checkDuplicate(attributes.name != null, key);
                attributes.name = value.getText();
                attributes.namePosition = value.getPosition();
                break;
            case ATTR_KIND:
                if (!value.is(TokenType.IDENTIFIER)) {
                    syntaxError("Device kind must be a name, found " + value.describe());
                    return synchronize(TokenType.RIGHT_BRACE, TokenType.LEFT_BRACE);
                }
                checkDuplicate(attributes.kind != null, key);
                attributes.kind = value.getText();
                attributes.kindPosition = value.getPosition();
                break;
            case ATTR_QUAL:
                if (!value.is(TokenType.NUMBER)) {
                    syntaxError("Qualifier must be a non-negative integer, found " + value.describe());
                    return synchronize(TokenType.RIGHT_BRACE, TokenType.LEFT_BRACE);
                }
                checkDuplicate(attributes.qualifier != null, key);
                attributes.qualifier = value.intValue();
                attributes.qualifierPosition = value.getPosition();
                break;
            default:
                diagnostics.add(Diagnostic.error("Unknown attribute '" + key.getText()
                                                 + "'; expected id, kind or qual", key.getPosition(), null));
                if (!value.is(TokenType.IDENTIFIER) && !value.is(TokenType.NUMBER)) {
                    syntaxError("Expected a value for '" + key.getText() + "', found " + value.describe());
                    return synchronize(TokenType.RIGHT_BRACE, TokenType.LEFT_BRACE);
                }
                break;
        }
        advance();
        return false;
    }

    private void checkDuplicate(boolean alreadySet, Token key) {
        if (alreadySet) {
            diagnostics.add(Diagnostic.warning("Duplicate attribute '" + key.getText() + "'; the last value wins",
                                               key.getPosition(), null));
        }
    }

    // ---------------- connections ----------------

    private void parseConnectionsBlock(boolean keep) {
        if (!openSection()) {
            return;
        }
        while (!atListEnd()) {
            ConnectionDeclaration connection = parseConnection();
            if (connection != null && keep) {
                connections.add(connection);
            }
        }
        closeSection(Lexer.CONNECTIONS);
    }

    private ConnectionDeclaration parseConnection() {
        SignalReference source = parseSignalReference(false);
        if (source == null) {
            synchronize(TokenType.RIGHT_BRACKET);
            return null;
        }
        if (!expect(TokenType.COLON, "':' after connection source '" + source + "'")) {
            synchronize(TokenType.RIGHT_BRACKET);
            return null;
        }
        SignalReference destination = parseSignalReference(true);
        if (destination == null) {
            synchronize(TokenType.RIGHT_BRACKET);
            return null;
        }
        if (!endStatement()) {
            return null;
        }
        return new ConnectionDeclaration(source, destination);
    }

    // ---------------- monitors ----------------

    private void parseMonitorsBlock(boolean keep) {
        if (!openSection()) {
            return;
        }
        while (!atListEnd()) {
            SignalReference signal = parseSignalReference(false);
            if (signal == null) {
                synchronize(TokenType.RIGHT_BRACKET);
                continue;
            }
            if (endStatement() && keep) {
                monitors.add(signal);
            }
        }
        closeSection(Lexer.MONITORS);
    }

    /**
     * A list statement ends with ';', which may be omitted before ']'.
     */
    private boolean endStatement() {
        if (accept(TokenType.SEMICOLON) || current.is(TokenType.RIGHT_BRACKET)) {
            return true;
        }
        syntaxError("Expected ';' after statement, found " + current.describe());
        synchronize(TokenType.RIGHT_BRACKET);
        return false;
    }

    /**
     * Parse {@code DEV} or {@code DEV.PIN}.
     *
     * @param pinRequired whether the {@code .PIN} part is mandatory
     * @return the reference, or null after reporting a syntax error
     */
    private SignalReference parseSignalReference(boolean pinRequired) {
        if (current.is(TokenType.KEYWORD)) {
            syntaxError("Keyword " + current.getText() + " cannot be used as a signal name");
            return null;
        }
        if (!current.is(TokenType.IDENTIFIER)) {
            syntaxError("Expected a device name, found " + current.describe());
            return null;
        }
        Token device = current;
        advance();

        if (!current.is(TokenType.DOT)) {
            if (pinRequired) {
                syntaxError("Expected '.' and an input pin name after '" + device.getText()
                            + "', found " + current.describe());
                return null;
            }
            return new SignalReference(device.getText(), null, device.getPosition(), null);
        }
        advance();
        if (!current.is(TokenType.IDENTIFIER)) {
            syntaxError("Expected a pin name after '" + device.getText() + ".', found " + current.describe());
            return null;
        }
        Token pin = current;
        advance();
        return new SignalReference(device.getText(), pin.getText(), device.getPosition(), pin.getPosition());
    }

    // ---------------- token handling and recovery ----------------

    private void advance() {
        if (current != null && current.is(TokenType.EOF)) {
            return;
        }
        current = tokens.next();
        while (current.is(TokenType.ERROR)) {
            diagnostics.add(Diagnostic.lexical(describeLexicalError(current), current.getPosition()));
            current = tokens.next();
        }
    }

    private static String describeLexicalError(Token token) {
        String text = token.getText();
        if (text.equals(String.valueOf(Lexer.BLOCK_COMMENT))) {
            return "Unterminated comment: no closing '#' (use '/' for a line comment)";
        }
        if (!text.isEmpty() && Character.isDigit(text.charAt(0))) {
            return "Number " + text + " is too large";
        }
        return "Unexpected character '" + text + "'";
    }

    private boolean accept(TokenType type) {
        if (current.is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean expect(TokenType type, String what) {
        if (accept(type)) {
            return true;
        }
        syntaxError("Expected " + what + ", found " + current.describe());
        return false;
    }

    private void syntaxError(String message) {
        if (mode == Mode.RECOVERING) {
            logger.debug("Suppressed while recovering: {}", message);
            return;
        }
        syntaxErrorCount++;
        diagnostics.add(Diagnostic.syntax(message, current.getPosition()));
        mode = Mode.RECOVERING;
    }

    /**
     * Leave recovery without discarding anything.
     */
    private void resume() {
        mode = Mode.NORMAL;
    }

    /**
     * Discard tokens up to and including the next ';', stopping early in
     * front of any of {@code stopBefore}, a section keyword or end of input.
     *
     * @return true if a ';' was consumed
     */
    private boolean synchronize(TokenType... stopBefore) {
        Set<TokenType> stops = EnumSet.of(TokenType.EOF, TokenType.KEYWORD);
        for (TokenType type : stopBefore) {
            stops.add(type);
        }
        boolean consumedTerminator = false;
        while (!stops.contains(current.getType())) {
            if (current.is(TokenType.SEMICOLON)) {
                advance();
                consumedTerminator = true;
                break;
            }
            advance();
        }
        resume();
        return consumedTerminator;
    }

    /**
     * Discard tokens until something that can start or end a DEVICES entry list.
     */
    private void synchronizeToEntry() {
        while (!current.is(TokenType.LEFT_BRACE) && !atListEnd()) {
            advance();
        }
        resume();
    }

    private static final class DeviceAttributes {
        String name;
        SourcePosition namePosition;
        String kind;
        SourcePosition kindPosition;
        Integer qualifier;
        SourcePosition qualifierPosition;
    }
}
