package com.dualedit.expression.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExpressionLexerTest {

    private final ExpressionLexer lexer = new ExpressionLexer();

    private List<TokenType> types(String text) {
        return lexer.tokenize(text).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void tokenize_classifiesEveryTokenAndEndsWithEof() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.KEYWORD,
                        TokenType.BOOLEAN, TokenType.QUESTION, TokenType.STRING, TokenType.COLON,
                        TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.COMMA,
                        TokenType.NUMBER, TokenType.RPAREN, TokenType.EOF),
                types("a >= 2 and true ? 'x' : f(b, 1)"));
    }

    @Test
    void tokenize_recordsSpansOfOriginalText() {
        List<Token> tokens = lexer.tokenize("  foo  <= 12.5");

        assertEquals(2, tokens.get(0).start());
        assertEquals(5, tokens.get(0).end());
        assertEquals("<=", tokens.get(1).text());
        assertEquals(12.5, tokens.get(2).value());
        assertEquals(14, tokens.get(3).start());
    }

    @Test
    void tokenize_numbersWithExponentAndLeadingDot() {
        List<Token> tokens = lexer.tokenize("1e3 .5 2.5E-1");

        assertEquals(1000.0, tokens.get(0).value());
        assertEquals(0.5, tokens.get(1).value());
        assertEquals(0.25, tokens.get(2).value());
    }

    @Test
    void tokenize_stringEscapesAndBothQuotes() {
        List<Token> tokens = lexer.tokenize("\"a\\\"b\" 'it\\'s'");

        assertEquals("a\"b", tokens.get(0).value());
        assertEquals("it's", tokens.get(1).value());
    }

    @Test
    void tokenize_malformedInputBecomesErrorTokens() {
        List<Token> tokens = lexer.tokenize("a = 1 # \"open");

        assertEquals(TokenType.ERROR, tokens.get(1).type());
        assertEquals("Assignment is not supported, use '=='", tokens.get(1).error());
        assertEquals(TokenType.ERROR, tokens.get(3).type());
        assertEquals("Unterminated string literal", tokens.get(4).error());
        assertEquals(TokenType.EOF, tokens.get(5).type());
    }

    @Test
    void tokenize_badExponentIsError() {
        assertEquals(TokenType.ERROR, lexer.tokenize("1e+").get(0).type());
    }
}
