package com.spreadsheet.calc.engine.evaluator;

import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.models.EvaluationResult;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Coercion rules shared by the evaluator and the function library.
 */
public final class Values {

    // Plain decimal literals only: no exponents, no "NaN"/"Infinity", no locale separators
    private static final Pattern DECIMAL = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)$");

    private Values() {
    }

    /**
     * The value of a non-formula cell: numbers stay numbers, booleans become 1/0,
     * empty becomes 0, anything else is text.
     */
    public static EvaluationResult fromLiteral(Object raw) {
        if (raw == null) {
            return EvaluationResult.number(0d);
        }
        if (raw instanceof Number) {
            return EvaluationResult.number(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean) {
            return EvaluationResult.bool((Boolean) raw);
        }
        String text = raw.toString();
        return text.isEmpty() ? EvaluationResult.number(0d) : EvaluationResult.text(text);
    }

    public static boolean isDecimal(String text) {
        return text != null && DECIMAL.matcher(text.trim()).matches();
    }

    /**
     * Numeric reading of a value, or null if it has none. Text counts when it is a decimal literal.
     */
    public static Double toNumber(EvaluationResult value) {
        if (value.isNumber()) {
            return value.getNumber();
        }
        if (value.isText() && isDecimal(value.getText())) {
            return Double.parseDouble(value.getText().trim());
        }
        return null;
    }

    /**
     * Numeric reading for aggregates: anything without one contributes 0.
     */
    public static double toNumberOrZero(EvaluationResult value) {
        Double number = toNumber(value);
        return number == null ? 0d : number;
    }

    /**
     * @throws FormulaException if the value has no numeric reading
     */
    public static double requireNumber(EvaluationResult value) {
        Double number = toNumber(value);
        if (number == null) {
            throw new FormulaException("Expected a number but got " + value);
        }
        return number;
    }

    /**
     * Unformatted text of a value; numbers in their shortest decimal form.
     */
    public static String toText(EvaluationResult value) {
        switch (value.getKind()) {
            case NUMBER:
                double number = value.getNumber();
                if (Double.isNaN(number) || Double.isInfinite(number)) {
                    return Double.toString(number);
                }
                BigDecimal decimal = BigDecimal.valueOf(number);
                return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
            case TEXT:
                return value.getText();
            default:
                return value.getError().getDisplayText();
        }
    }

    /**
     * Truth value of a condition: non-zero numbers, "TRUE", and non-zero decimal text are true.
     * Errors and other text are false.
     */
    public static boolean isTruthy(EvaluationResult value) {
        if (value.isText()) {
            String text = value.getText().trim();
            if ("TRUE".equalsIgnoreCase(text)) {
                return true;
            }
            if ("FALSE".equalsIgnoreCase(text)) {
                return false;
            }
        }
        Double number = toNumber(value);
        return number != null && number != 0d;
    }

    /**
     * Orders two values numerically when both have a numeric reading,
     * otherwise as case-insensitive text.
     */
    public static int compare(EvaluationResult left, EvaluationResult right) {
        Double leftNumber = toNumber(left);
        Double rightNumber = toNumber(right);
        if (leftNumber != null && rightNumber != null) {
            if (leftNumber < rightNumber) {
                return -1;
            }
            return leftNumber > rightNumber ? 1 : 0;
        }
        return toText(left).compareToIgnoreCase(toText(right));
    }
}
