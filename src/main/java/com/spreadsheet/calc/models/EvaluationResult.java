package com.spreadsheet.calc.models;

import java.util.Objects;

/**
 * Outcome of evaluating a formula or resolving a cell:
 * exactly one of a number, a piece of text, or an error.
 */
public final class EvaluationResult {

    public enum Kind {
        NUMBER,
        TEXT,
        ERROR
    }

    private static final EvaluationResult ZERO = new EvaluationResult(Kind.NUMBER, 0d, null, null);
    private static final EvaluationResult EMPTY_TEXT = new EvaluationResult(Kind.TEXT, 0d, "", null);

    private final Kind kind;
    private final double number;
    private final String text;
    private final ErrorKind error;

    private EvaluationResult(Kind kind, double number, String text, ErrorKind error) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.error = error;
    }

    public static EvaluationResult number(double value) {
        return value == 0d && Double.doubleToRawLongBits(value) == 0L
                ? ZERO
                : new EvaluationResult(Kind.NUMBER, value, null, null);
    }

    public static EvaluationResult bool(boolean value) {
        return number(value ? 1d : 0d);
    }

    public static EvaluationResult text(String value) {
        Objects.requireNonNull(value, "value");
        return value.isEmpty() ? EMPTY_TEXT : new EvaluationResult(Kind.TEXT, 0d, value, null);
    }

    public static EvaluationResult error(ErrorKind kind) {
        return new EvaluationResult(Kind.ERROR, 0d, null, Objects.requireNonNull(kind, "kind"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public double getNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return number;
    }

    public String getText() {
        if (kind != Kind.TEXT) {
            throw new IllegalStateException("Not text: " + this);
        }
        return text;
    }

    public ErrorKind getError() {
        if (kind != Kind.ERROR) {
            throw new IllegalStateException("Not an error: " + this);
        }
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationResult)) {
            return false;
        }
        EvaluationResult that = (EvaluationResult) o;
        return kind == that.kind
                && Double.compare(number, that.number) == 0
                && Objects.equals(text, that.text)
                && error == that.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text, error);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return "Number(" + number + ")";
            case TEXT:
                return "Text(" + text + ")";
            default:
                return "Error(" + error + ")";
        }
    }
}
