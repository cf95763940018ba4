package com.dualedit.expression.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits expression text into tokens. Never throws: malformed input becomes {@link TokenType#ERROR}
 * tokens, so callers that only need spans (position mapping over hand-edited text) can keep going.
 * The list always ends with an {@link TokenType#EOF} token.
 */
public final class ExpressionLexer {

    private static final Set<String> KEYWORDS = Set.of("and", "or", "not");
    private static final Set<String> TWO_CHAR_OPERATORS = Set.of("==", "!=", "<=", ">=");

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = text.length();
        while (true) {
            pos = skipWhitespace(text, pos);
            if (pos >= length) {
                tokens.add(Token.of(TokenType.EOF, "", length, length));
                return tokens;
            }
            Token token = next(text, pos);
            tokens.add(token);
            pos = token.end();
        }
    }

    public static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private Token next(String text, int start) {
        char c = text.charAt(start);
        if (Character.isDigit(c) || (c == '.' && start + 1 < text.length() && Character.isDigit(text.charAt(start + 1)))) {
            return number(text, start);
        }
        if (c == '"' || c == '\'') {
            return string(text, start, c);
        }
        if (Character.isLetter(c) || c == '_' || c == '$') {
            int end = start + 1;
            while (end < text.length() && isIdentifierPart(text.charAt(end))) {
                end++;
            }
            String word = text.substring(start, end);
            if (word.equals("true") || word.equals("false")) {
                return new Token(TokenType.BOOLEAN, word, start, end, Boolean.valueOf(word), null);
            }
            return Token.of(KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER, word, start, end);
        }
        if (start + 1 < text.length()) {
            String two = text.substring(start, start + 2);
            if (TWO_CHAR_OPERATORS.contains(two)) {
                return Token.of(TokenType.OPERATOR, two, start, start + 2);
            }
        }
        switch (c) {
            case '+': case '-': case '*': case '/': case '%': case '^': case '<': case '>':
                return Token.of(TokenType.OPERATOR, String.valueOf(c), start, start + 1);
            case '(':
                return Token.of(TokenType.LPAREN, "(", start, start + 1);
            case ')':
                return Token.of(TokenType.RPAREN, ")", start, start + 1);
            case ',':
                return Token.of(TokenType.COMMA, ",", start, start + 1);
            case '?':
                return Token.of(TokenType.QUESTION, "?", start, start + 1);
            case ':':
                return Token.of(TokenType.COLON, ":", start, start + 1);
            case '=':
                return error(text, start, start + 1, "Assignment is not supported, use '=='");
            default:
                return error(text, start, start + 1, "Unexpected character '" + c + "'");
        }
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static Token number(String text, int start) {
        int end = digits(text, start);
        if (end < text.length() && text.charAt(end) == '.') {
            end = digits(text, end + 1);
        }
        if (end < text.length() && (text.charAt(end) == 'e' || text.charAt(end) == 'E')) {
            int exp = end + 1;
            if (exp < text.length() && (text.charAt(exp) == '+' || text.charAt(exp) == '-')) {
                exp++;
            }
            int expEnd = digits(text, exp);
            if (expEnd == exp) {
                return error(text, start, exp, "Malformed exponent in number");
            }
            end = expEnd;
        }
        String literal = text.substring(start, end);
        return new Token(TokenType.NUMBER, literal, start, end, Double.parseDouble(literal), null);
    }

    private static int digits(String text, int pos) {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static Token string(String text, int start, char quote) {
        StringBuilder value = new StringBuilder();
        int pos = start + 1;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == quote) {
                return new Token(TokenType.STRING, text.substring(start, pos + 1), start, pos + 1, value.toString(), null);
            }
            if (c == '\\' && pos + 1 < text.length()) {
                char escaped = text.charAt(pos + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
                pos += 2;
                continue;
            }
            value.append(c);
            pos++;
        }
        return error(text, start, text.length(), "Unterminated string literal");
    }

    private static Token error(String text, int start, int end, String message) {
        return new Token(TokenType.ERROR, text.substring(start, end), start, end, null, message);
    }
}
