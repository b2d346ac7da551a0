package com.marker.parse;

import com.marker.exception.MarkerParseException;

import java.util.ArrayList;
import java.util.List;

import static com.marker.parse.MarkerSyntax.KEYWORDS;
import static com.marker.parse.MarkerSyntax.Operators;

/**
 * Tokenizer for marker text.
 * Converts input string into a sequence of tokens.
 */
public final class MarkerTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public MarkerTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, ending with EOF
     * @throws MarkerParseException on an unknown character or unterminated string
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", start));
                }
                case Operators.EQUALS -> {
                    advance();
                    expectEquals("=", start);
                    if (!isAtEnd() && peek() == Operators.EQUALS) {
                        throw error("Arbitrary equality (===) is not supported in markers", start);
                    }
                    tokens.add(new Token(TokenType.EQ, "==", start));
                }
                case Operators.BANG -> {
                    advance();
                    expectEquals("!", start);
                    tokens.add(new Token(TokenType.NE, "!=", start));
                }
                case Operators.TILDE -> {
                    advance();
                    expectEquals("~", start);
                    tokens.add(new Token(TokenType.TILDE_EQ, "~=", start));
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GTE, ">=", start));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", start));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.LTE, "<=", start));
                    } else {
                        tokens.add(new Token(TokenType.LT, "<", start));
                    }
                }
                case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> tokens.add(readString());
                default -> {
                    if (isIdentifierPart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    private void expectEquals(String operator, int start) {
        if (!match(Operators.EQUALS)) {
            throw error("Expected a valid marker operator (such as '>=' or 'not in'), found '"
                    + operator + "'", start);
        }
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        TokenType keywordType = KEYWORDS.get(text);
        if (keywordType != null) {
            return new Token(keywordType, text, start);
        }
        return new Token(TokenType.IDENT, text, start);
    }

    // No escapes: a string ends at the next matching quote
    private Token readString() {
        int start = pos;
        char quote = advance();
        int contentStart = pos;

        while (!isAtEnd() && peek() != quote) {
            advance();
        }

        if (isAtEnd()) {
            throw error("Missing closing quote " + quote, start);
        }

        String value = input.substring(contentStart, pos);
        advance();
        return new Token(TokenType.STRING, value, start);
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE || c == Operators.DOT;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private MarkerParseException error(String message, int position) {
        return new MarkerParseException(message, position, input);
    }
}
