package com.spreadsheet.calc.engine.parser;

/**
 * One lexical unit of a formula body. {@code start} and {@code end} are offsets
 * into the text that was tokenized ({@code end} exclusive), so callers can splice
 * the original text around a token.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int start;
    private final int end;

    public Token(TokenType type, String text, int start, int end) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public TokenType getType() {
        return type;
    }

    /**
     * Source text of the token; for STRING tokens, the unquoted contents.
     */
    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + start;
    }
}
