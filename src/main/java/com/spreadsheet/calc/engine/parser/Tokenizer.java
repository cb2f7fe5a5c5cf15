package com.spreadsheet.calc.engine.parser;

import com.spreadsheet.calc.exceptions.FormulaException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a formula body (the text after "=") into tokens.
 * Anything outside the formula alphabet is rejected rather than skipped.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    /**
     * @return the tokens of {@code source}, always terminated by an END token
     * @throws FormulaException on an unexpected character or an unterminated string
     */
    public static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int len = source.length();
        int i = 0;
        while (i < len) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isDigit(c) || (c == '.' && i + 1 < len && isDigit(source.charAt(i + 1)))) {
                i = readNumber(source, i, tokens);
            } else if (c == '"') {
                i = readString(source, i, tokens);
            } else if (c == '$' || isLetter(c)) {
                i = readWord(source, i, tokens);
            } else {
                i = readSymbol(source, i, tokens);
            }
        }
        tokens.add(new Token(TokenType.END, "", len, len));
        return tokens;
    }

    private static int readNumber(String source, int start, List<Token> tokens) {
        int i = start;
        while (i < source.length() && isDigit(source.charAt(i))) {
            i++;
        }
        if (i < source.length() && source.charAt(i) == '.') {
            i++;
            while (i < source.length() && isDigit(source.charAt(i))) {
                i++;
            }
        }
        tokens.add(new Token(TokenType.NUMBER, source.substring(start, i), start, i));
        return i;
    }

    // "" inside a string stands for one quote character
    private static int readString(String source, int start, List<Token> tokens) {
        StringBuilder contents = new StringBuilder();
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '"') {
                    contents.append('"');
                    i += 2;
                    continue;
                }
                tokens.add(new Token(TokenType.STRING, contents.toString(), start, i + 1));
                return i + 1;
            }
            contents.append(c);
            i++;
        }
        throw new FormulaException("Unterminated string literal at position " + start);
    }

    /**
     * A reference ([$]LETTERS[$]DIGITS) or a bare identifier (function name, TRUE, FALSE).
     */
    private static int readWord(String source, int start, List<Token> tokens) {
        int len = source.length();
        int i = start;
        boolean marked = false;
        if (source.charAt(i) == '$') {
            marked = true;
            i++;
        }
        int lettersStart = i;
        while (i < len && isLetter(source.charAt(i))) {
            i++;
        }
        if (i == lettersStart) {
            throw new FormulaException("Expected column letters at position " + i);
        }
        int lettersEnd = i;
        if (i < len && source.charAt(i) == '$') {
            marked = true;
            i++;
        }
        int digitsStart = i;
        while (i < len && isDigit(source.charAt(i))) {
            i++;
        }
        if (i > digitsStart) {
            tokens.add(new Token(TokenType.REFERENCE, source.substring(start, i).toUpperCase(), start, i));
            return i;
        }
        if (marked) {
            throw new FormulaException("Incomplete reference at position " + start);
        }
        tokens.add(new Token(TokenType.IDENTIFIER,
                source.substring(lettersStart, lettersEnd).toUpperCase(), start, lettersEnd));
        return lettersEnd;
    }

    private static int readSymbol(String source, int start, List<Token> tokens) {
        char c = source.charAt(start);
        char next = start + 1 < source.length() ? source.charAt(start + 1) : '\0';
        TokenType type;
        int width = 1;
        switch (c) {
            case '+':
                type = TokenType.PLUS;
                break;
            case '-':
                type = TokenType.MINUS;
                break;
            case '*':
                type = TokenType.STAR;
                break;
            case '/':
                type = TokenType.SLASH;
                break;
            case '(':
                type = TokenType.LEFT_PAREN;
                break;
            case ')':
                type = TokenType.RIGHT_PAREN;
                break;
            case ',':
                type = TokenType.COMMA;
                break;
            case ':':
                type = TokenType.COLON;
                break;
            case '=':
                type = TokenType.EQUAL;
                break;
            case '<':
                if (next == '=') {
                    type = TokenType.LESS_EQUAL;
                    width = 2;
                } else if (next == '>') {
                    type = TokenType.NOT_EQUAL;
                    width = 2;
                } else {
                    type = TokenType.LESS;
                }
                break;
            case '>':
                if (next == '=') {
                    type = TokenType.GREATER_EQUAL;
                    width = 2;
                } else {
                    type = TokenType.GREATER;
                }
                break;
            default:
                throw new FormulaException("Unexpected character '" + c + "' at position " + start);
        }
        tokens.add(new Token(type, source.substring(start, start + width), start, start + width));
        return start + width;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
