package com.spreadsheet.calc.engine.functions;

import com.spreadsheet.calc.engine.evaluator.Values;
import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.models.EvaluationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument checks and conversions shared by the built-in functions.
 */
final class Arguments {

    private Arguments() {
    }

    static void requireCount(String function, List<Expr> arguments, int min, int max) {
        int count = arguments.size();
        if (count < min || count > max) {
            String expected = min == max ? String.valueOf(min)
                    : max == Integer.MAX_VALUE ? "at least " + min : min + " to " + max;
            throw new FormulaException(function + " expects " + expected + " argument(s), got " + count);
        }
    }

    /**
     * Numbers from every argument, in order; empty cells and values without a numeric
     * reading count as 0.
     */
    static double[] numbers(List<Expr> arguments, FunctionContext context) {
        List<double[]> parts = new ArrayList<>(arguments.size());
        int total = 0;
        for (Expr argument : arguments) {
            double[] part = context.numbers(argument);
            parts.add(part);
            total += part.length;
        }
        double[] numbers = new double[total];
        int offset = 0;
        for (double[] part : parts) {
            System.arraycopy(part, 0, numbers, offset, part.length);
            offset += part.length;
        }
        return numbers;
    }

    static double[] numbers(Expr argument, FunctionContext context) {
        return context.numbers(argument);
    }

    static List<EvaluationResult> values(List<Expr> arguments, FunctionContext context) {
        List<EvaluationResult> values = new ArrayList<>();
        for (Expr argument : arguments) {
            values.addAll(context.values(argument));
        }
        return values;
    }

    /**
     * @throws FormulaException if the argument has no numeric reading
     */
    static double number(Expr argument, FunctionContext context) {
        return Values.requireNumber(context.evaluate(argument));
    }
}
