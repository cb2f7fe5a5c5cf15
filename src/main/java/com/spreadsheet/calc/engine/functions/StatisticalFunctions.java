package com.spreadsheet.calc.engine.functions;

import com.spreadsheet.calc.engine.evaluator.Values;
import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.models.EvaluationResult;

import java.util.List;

/**
 * CORREL, PERCENTILE, QUARTILE and RANK.
 */
final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("CORREL", StatisticalFunctions::correl);
        library.register("PERCENTILE", StatisticalFunctions::percentile);
        library.register("QUARTILE", StatisticalFunctions::quartile);
        library.register("RANK", StatisticalFunctions::rank);
    }

    // CORREL(range1, range2)
    static EvaluationResult correl(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("CORREL", args, 2, 2);
        double[] xs = Arguments.numbers(args.get(0), ctx);
        double[] ys = Arguments.numbers(args.get(1), ctx);
        return EvaluationResult.number(Statistics.correlation(xs, ys));
    }

    // PERCENTILE(range, k)
    static EvaluationResult percentile(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("PERCENTILE", args, 2, 2);
        double[] values = Arguments.numbers(args.get(0), ctx);
        double k = Arguments.number(args.get(1), ctx);
        return EvaluationResult.number(Statistics.percentile(values, k));
    }

    // QUARTILE(range, quart); fractional quarts are truncated
    static EvaluationResult quartile(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("QUARTILE", args, 2, 2);
        double[] values = Arguments.numbers(args.get(0), ctx);
        int quart = (int) Arguments.number(args.get(1), ctx);
        return EvaluationResult.number(Statistics.quartile(values, quart));
    }

    /**
     * RANK(number, range, [order]): order 0 (default) ranks descending, anything else ascending.
     * A non-numeric number yields 0.
     */
    static EvaluationResult rank(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("RANK", args, 2, 3);
        Double number = Values.toNumber(ctx.evaluate(args.get(0)));
        double[] values = Arguments.numbers(args.get(1), ctx);
        int order = args.size() > 2 ? (int) Arguments.number(args.get(2), ctx) : 0;
        if (number == null) {
            return EvaluationResult.number(0d);
        }
        return EvaluationResult.number(Statistics.rank(number, values, order != 0));
    }
}
