package com.loomcom.logsim.definition;

import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.loomcom.logsim.diagnostics.SourcePosition;

import java.util.Iterator;
import java.util.List;

/**
 * Tokenizing of definition text: comments, whitespace, positions and
 * lexical errors.
 */
public class LexerTest extends TestCase {

    public LexerTest(String testName) {
        super(testName);
    }

    public static Test suite() {
        return new TestSuite(LexerTest.class);
    }

    private static void assertToken(Token token, TokenType type, String text, int line, int column) {
        assertEquals(type, token.getType());
        assertEquals(text, token.getText());
        assertEquals(new SourcePosition(line, column), token.getPosition());
    }

    public void testPunctuationAndWords() {
        List<Token> tokens = new Lexer("DEVICES [ { id: SW1; qual: 12 } ].").tokenize();

        assertEquals(14, tokens.size());
        assertToken(tokens.get(0), TokenType.KEYWORD, "DEVICES", 1, 1);
        assertToken(tokens.get(1), TokenType.LEFT_BRACKET, "[", 1, 9);
        assertToken(tokens.get(2), TokenType.LEFT_BRACE, "{", 1, 11);
        assertToken(tokens.get(3), TokenType.IDENTIFIER, "id", 1, 13);
        assertToken(tokens.get(4), TokenType.COLON, ":", 1, 15);
        assertToken(tokens.get(5), TokenType.IDENTIFIER, "SW1", 1, 17);
        assertToken(tokens.get(6), TokenType.SEMICOLON, ";", 1, 20);
        assertToken(tokens.get(7), TokenType.IDENTIFIER, "qual", 1, 22);
        assertToken(tokens.get(9), TokenType.NUMBER, "12", 1, 28);
        assertToken(tokens.get(10), TokenType.RIGHT_BRACE, "}", 1, 31);
        assertToken(tokens.get(11), TokenType.RIGHT_BRACKET, "]", 1, 33);
        assertToken(tokens.get(12), TokenType.DOT, ".", 1, 34);
        assertToken(tokens.get(13), TokenType.EOF, "", 1, 35);
    }

    public void testKeywordsAreCaseSensitive() {
        List<Token> tokens = new Lexer("MONITORS monitors Monitors").tokenize();

        assertEquals(TokenType.KEYWORD, tokens.get(0).getType());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
        assertEquals(TokenType.IDENTIFIER, tokens.get(2).getType());
    }

    public void testLineCommentRunsToEndOfLine() {
        List<Token> tokens = new Lexer("A / this is ignored ; [ ]\nB").tokenize();

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), TokenType.IDENTIFIER, "A", 1, 1);
        assertToken(tokens.get(1), TokenType.IDENTIFIER, "B", 2, 1);
    }

    public void testBlockCommentSpansLines() {
        List<Token> tokens = new Lexer("A # one\ntwo\n three # B").tokenize();

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), TokenType.IDENTIFIER, "A", 1, 1);
        assertToken(tokens.get(1), TokenType.IDENTIFIER, "B", 3, 10);
    }

    public void testUnpairedHashIsAnErrorToken() {
        List<Token> tokens = new Lexer("A\n  # B").tokenize();

        assertEquals(4, tokens.size());
        assertToken(tokens.get(1), TokenType.ERROR, "#", 2, 3);
        assertToken(tokens.get(2), TokenType.IDENTIFIER, "B", 2, 5);
    }

    public void testUnrecognizedCharacter() {
        List<Token> tokens = new Lexer("A*B").tokenize();

        assertToken(tokens.get(0), TokenType.IDENTIFIER, "A", 1, 1);
        assertToken(tokens.get(1), TokenType.ERROR, "*", 1, 2);
        assertToken(tokens.get(2), TokenType.IDENTIFIER, "B", 1, 3);
    }

    public void testIdentifierStopsAtDot() {
        List<Token> tokens = new Lexer("FF1.QBAR").tokenize();

        assertToken(tokens.get(0), TokenType.IDENTIFIER, "FF1", 1, 1);
        assertToken(tokens.get(1), TokenType.DOT, ".", 1, 4);
        assertToken(tokens.get(2), TokenType.IDENTIFIER, "QBAR", 1, 5);
    }

    public void testNumberTooLargeIsAnErrorToken() {
        List<Token> tokens = new Lexer("99999999999").tokenize();

        assertEquals(TokenType.ERROR, tokens.get(0).getType());
        assertEquals("99999999999", tokens.get(0).getText());
    }

    public void testTabsAndCarriageReturnsAreWhitespace() {
        List<Token> tokens = new Lexer("\tA\r\n\tB").tokenize();

        assertToken(tokens.get(0), TokenType.IDENTIFIER, "A", 1, 2);
        assertToken(tokens.get(1), TokenType.IDENTIFIER, "B", 2, 2);
    }

    public void testEmptyInputIsJustEof() {
        List<Token> tokens = new Lexer("  / nothing here").tokenize();

        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).getType());
        assertEquals("end of input", tokens.get(0).describe());
    }

    public void testLexingIsRestartable() {
        Lexer lexer = new Lexer("A : B.I1;");

        assertEquals(lexer.tokenize().size(), lexer.tokenize().size());

        Iterator<Token> first = lexer.iterator();
        first.next();
        Iterator<Token> second = lexer.iterator();
        assertEquals("A", second.next().getText());
        assertEquals(":", first.next().getText());
    }
}
