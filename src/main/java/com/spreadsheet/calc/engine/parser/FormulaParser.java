package com.spreadsheet.calc.engine.parser;

import com.spreadsheet.calc.engine.reference.ReferenceResolver;
import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for formula text.
 * <pre>
 * expression := additive ( ( "=" | "&lt;&gt;" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=" ) additive )*
 * additive   := term ( ( "+" | "-" ) term )*
 * term       := unary ( ( "*" | "/" ) unary )*
 * unary      := ( "-" | "+" ) unary | primary
 * primary    := NUMBER | STRING | TRUE | FALSE
 *             | REFERENCE [ ":" REFERENCE ]
 *             | IDENTIFIER "(" [ expression ( "," expression )* ] ")"
 *             | "(" expression ")"
 * </pre>
 * Instances are stateless and can be shared.
 */
public class FormulaParser {

    /**
     * Parses a formula, with or without its leading "=".
     *
     * @throws FormulaException if the text is not a well-formed formula
     * @throws com.spreadsheet.calc.exceptions.InvalidReferenceException if a reference is out of range
     */
    public Expr parse(String formulaText) {
        if (formulaText == null) {
            throw new FormulaException("Missing formula");
        }
        String body = stripEquals(formulaText);
        if (body.trim().isEmpty()) {
            throw new FormulaException("Empty formula");
        }
        Cursor cursor = new Cursor(Tokenizer.tokenize(body));
        Expr expr = parseExpression(cursor);
        if (!cursor.peek().is(TokenType.END)) {
            throw new FormulaException("Unexpected '" + cursor.peek().getText()
                    + "' at position " + cursor.peek().getStart());
        }
        return expr;
    }

    /**
     * The formula body: the text after the first "=", or the trimmed text if there is none.
     */
    public static String stripEquals(String formulaText) {
        String trimmed = formulaText.trim();
        return trimmed.startsWith("=") ? trimmed.substring(1) : trimmed;
    }

    private Expr parseExpression(Cursor cursor) {
        Expr left = parseAdditive(cursor);
        while (true) {
            BinaryOperator op = comparisonOperator(cursor.peek().getType());
            if (op == null) {
                return left;
            }
            cursor.next();
            left = new Expr.Binary(op, left, parseAdditive(cursor));
        }
    }

    private Expr parseAdditive(Cursor cursor) {
        Expr left = parseTerm(cursor);
        while (cursor.peek().is(TokenType.PLUS) || cursor.peek().is(TokenType.MINUS)) {
            BinaryOperator op = cursor.next().is(TokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            left = new Expr.Binary(op, left, parseTerm(cursor));
        }
        return left;
    }

    private Expr parseTerm(Cursor cursor) {
        Expr left = parseUnary(cursor);
        while (cursor.peek().is(TokenType.STAR) || cursor.peek().is(TokenType.SLASH)) {
            BinaryOperator op = cursor.next().is(TokenType.STAR) ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
            left = new Expr.Binary(op, left, parseUnary(cursor));
        }
        return left;
    }

    private Expr parseUnary(Cursor cursor) {
        if (cursor.peek().is(TokenType.MINUS)) {
            cursor.next();
            return new Expr.Negate(parseUnary(cursor));
        }
        if (cursor.peek().is(TokenType.PLUS)) {
            cursor.next();
            return parseUnary(cursor);
        }
        return parsePrimary(cursor);
    }

    private Expr parsePrimary(Cursor cursor) {
        Token token = cursor.next();
        switch (token.getType()) {
            case NUMBER:
                try {
                    return new Expr.NumberLiteral(Double.parseDouble(token.getText()));
                } catch (NumberFormatException e) {
                    throw new FormulaException("Invalid number: " + token.getText(), e);
                }
            case STRING:
                return new Expr.StringLiteral(token.getText());
            case REFERENCE:
                return parseReference(token, cursor);
            case IDENTIFIER:
                return parseIdentifier(token, cursor);
            case LEFT_PAREN:
                Expr inner = parseExpression(cursor);
                cursor.expect(TokenType.RIGHT_PAREN);
                return inner;
            case END:
                throw new FormulaException("Unexpected end of formula");
            default:
                throw new FormulaException("Unexpected '" + token.getText() + "' at position " + token.getStart());
        }
    }

    private Expr parseReference(Token token, Cursor cursor) {
        CellAddress start = ReferenceResolver.textToAddress(token.getText());
        if (!cursor.peek().is(TokenType.COLON)) {
            return new Expr.Reference(start);
        }
        cursor.next();
        Token endToken = cursor.expect(TokenType.REFERENCE);
        CellAddress end = ReferenceResolver.textToAddress(endToken.getText());
        return new Expr.RangeReference(new CellRange(start, end));
    }

    private Expr parseIdentifier(Token token, Cursor cursor) {
        if (cursor.peek().is(TokenType.LEFT_PAREN)) {
            cursor.next();
            List<Expr> arguments = new ArrayList<>();
            if (!cursor.peek().is(TokenType.RIGHT_PAREN)) {
                arguments.add(parseExpression(cursor));
                while (cursor.peek().is(TokenType.COMMA)) {
                    cursor.next();
                    arguments.add(parseExpression(cursor));
                }
            }
            cursor.expect(TokenType.RIGHT_PAREN);
            return new Expr.FunctionCall(token.getText(), arguments);
        }
        if ("TRUE".equals(token.getText())) {
            return new Expr.NumberLiteral(1d);
        }
        if ("FALSE".equals(token.getText())) {
            return new Expr.NumberLiteral(0d);
        }
        throw new FormulaException("Unknown name: " + token.getText());
    }

    private static BinaryOperator comparisonOperator(TokenType type) {
        switch (type) {
            case EQUAL:
                return BinaryOperator.EQUAL;
            case NOT_EQUAL:
                return BinaryOperator.NOT_EQUAL;
            case LESS:
                return BinaryOperator.LESS;
            case LESS_EQUAL:
                return BinaryOperator.LESS_EQUAL;
            case GREATER:
                return BinaryOperator.GREATER;
            case GREATER_EQUAL:
                return BinaryOperator.GREATER_EQUAL;
            default:
                return null;
        }
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int position;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(position);
        }

        Token next() {
            Token token = tokens.get(position);
            if (!token.is(TokenType.END)) {
                position++;
            }
            return token;
        }

        Token expect(TokenType type) {
            Token token = next();
            if (!token.is(type)) {
                throw new FormulaException("Expected " + type + " but found '" + token.getText()
                        + "' at position " + token.getStart());
            }
            return token;
        }
    }
}
