package com.spreadsheet.calc.engine.parser;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parsed formula expression. Node types are the nested classes below;
 * consumers walk a tree through {@link Visitor}.
 */
public abstract class Expr {

    public interface Visitor<R> {
        R visitNumber(NumberLiteral node);

        R visitString(StringLiteral node);

        R visitReference(Reference node);

        R visitRange(RangeReference node);

        R visitFunctionCall(FunctionCall node);

        R visitBinary(Binary node);

        R visitNegate(Negate node);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Formula text for this (sub)expression, without the leading "=".
     */
    @Override
    public abstract String toString();

    public static class NumberLiteral extends Expr {
        private final double value;

        public NumberLiteral(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }

        @Override
        public String toString() {
            return value == Math.rint(value) && Math.abs(value) < 1e15
                    ? Long.toString((long) value)
                    : Double.toString(value);
        }
    }

    public static class StringLiteral extends Expr {
        private final String value;

        public StringLiteral(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }

        @Override
        public String toString() {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
    }

    public static class Reference extends Expr {
        private final CellAddress address;

        public Reference(CellAddress address) {
            this.address = address;
        }

        public CellAddress getAddress() {
            return address;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReference(this);
        }

        @Override
        public String toString() {
            return address.toString();
        }
    }

    /**
     * Only meaningful as a function argument.
     */
    public static class RangeReference extends Expr {
        private final CellRange range;

        public RangeReference(CellRange range) {
            this.range = range;
        }

        public CellRange getRange() {
            return range;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRange(this);
        }

        @Override
        public String toString() {
            return range.toString();
        }
    }

    public static class FunctionCall extends Expr {
        private final String name;
        private final List<Expr> arguments;

        public FunctionCall(String name, List<Expr> arguments) {
            this.name = name;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        /**
         * Upper-case function name, e.g. "SUM".
         */
        public String getName() {
            return name;
        }

        public List<Expr> getArguments() {
            return arguments;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }

        @Override
        public String toString() {
            return name + arguments.stream().map(Expr::toString).collect(Collectors.joining(",", "(", ")"));
        }
    }

    public static class Binary extends Expr {
        private final BinaryOperator operator;
        private final Expr left;
        private final Expr right;

        public Binary(BinaryOperator operator, Expr left, Expr right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public BinaryOperator getOperator() {
            return operator;
        }

        public Expr getLeft() {
            return left;
        }

        public Expr getRight() {
            return right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return "(" + left + operator.getSymbol() + right + ")";
        }
    }

    public static class Negate extends Expr {
        private final Expr operand;

        public Negate(Expr operand) {
            this.operand = operand;
        }

        public Expr getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNegate(this);
        }

        @Override
        public String toString() {
            return "-" + operand;
        }
    }
}
