package com.spreadsheet.calc.engine.functions;

import com.spreadsheet.calc.engine.evaluator.Values;
import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.models.EvaluationResult;

import java.util.List;

/**
 * Range aggregates: SUM, AVERAGE, COUNT, COUNTA, COUNTBLANK, MIN, MAX,
 * PRODUCT, MEDIAN, MODE, STDEV, VAR.
 * Each accepts any mix of ranges, references and scalar expressions.
 * Empty cells are skipped; text and error cells count as 0 in numeric aggregates.
 */
final class AggregateFunctions {

    private AggregateFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("SUM", (args, ctx) -> numeric("SUM", args, ctx, Statistics::sum));
        library.register("AVERAGE", (args, ctx) -> numeric("AVERAGE", args, ctx, Statistics::mean));
        library.register("MIN", (args, ctx) -> numeric("MIN", args, ctx, Statistics::min));
        library.register("MAX", (args, ctx) -> numeric("MAX", args, ctx, Statistics::max));
        library.register("PRODUCT", (args, ctx) -> numeric("PRODUCT", args, ctx, Statistics::product));
        library.register("MEDIAN", (args, ctx) -> numeric("MEDIAN", args, ctx, Statistics::median));
        library.register("MODE", (args, ctx) -> numeric("MODE", args, ctx, Statistics::mode));
        library.register("STDEV", (args, ctx) -> numeric("STDEV", args, ctx, Statistics::sampleStdev));
        library.register("VAR", (args, ctx) -> numeric("VAR", args, ctx, Statistics::sampleVariance));
        library.register("COUNT", AggregateFunctions::count);
        library.register("COUNTA", AggregateFunctions::countA);
        library.register("COUNTBLANK", AggregateFunctions::countBlank);
    }

    private interface Kernel {
        double apply(double[] values);
    }

    private static EvaluationResult numeric(String name, List<Expr> args, FunctionContext ctx, Kernel kernel) {
        Arguments.requireCount(name, args, 1, Integer.MAX_VALUE);
        return EvaluationResult.number(kernel.apply(Arguments.numbers(args, ctx)));
    }

    /**
     * Counts values with a numeric reading.
     */
    static EvaluationResult count(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("COUNT", args, 1, Integer.MAX_VALUE);
        int count = 0;
        for (EvaluationResult value : Arguments.values(args, ctx)) {
            if (Values.toNumber(value) != null) {
                count++;
            }
        }
        return EvaluationResult.number(count);
    }

    /**
     * Counts non-empty values of any kind.
     */
    static EvaluationResult countA(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("COUNTA", args, 1, Integer.MAX_VALUE);
        return EvaluationResult.number(Arguments.values(args, ctx).size());
    }

    static EvaluationResult countBlank(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("COUNTBLANK", args, 1, Integer.MAX_VALUE);
        int blanks = 0;
        for (Expr arg : args) {
            blanks += ctx.countBlanks(arg);
        }
        return EvaluationResult.number(blanks);
    }
}
