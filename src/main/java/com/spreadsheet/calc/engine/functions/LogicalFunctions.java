package com.spreadsheet.calc.engine.functions;

import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.models.ErrorKind;
import com.spreadsheet.calc.models.EvaluationResult;

import java.util.List;

/**
 * IF, IFS, IFERROR, IFNA, AND, OR, NOT.
 * AND/OR/NOT return 1 or 0.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("IF", LogicalFunctions::ifFunction);
        library.register("IFS", LogicalFunctions::ifs);
        library.register("IFERROR", LogicalFunctions::ifError);
        library.register("IFNA", LogicalFunctions::ifNa);
        library.register("AND", LogicalFunctions::and);
        library.register("OR", LogicalFunctions::or);
        library.register("NOT", LogicalFunctions::not);
    }

    // IF(condition, valueIfTrue, [valueIfFalse]); a missing false branch gives empty text
    static EvaluationResult ifFunction(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("IF", args, 2, 3);
        if (ctx.condition(args.get(0))) {
            return ctx.evaluate(args.get(1));
        }
        return args.size() > 2 ? ctx.evaluate(args.get(2)) : EvaluationResult.text("");
    }

    // IFS(cond1, value1, cond2, value2, ...): first true condition wins, else #N/A
    static EvaluationResult ifs(List<Expr> args, FunctionContext ctx) {
        if (args.isEmpty() || args.size() % 2 != 0) {
            throw new FormulaException("IFS expects condition/value pairs, got " + args.size() + " argument(s)");
        }
        for (int i = 0; i < args.size(); i += 2) {
            if (ctx.condition(args.get(i))) {
                return ctx.evaluate(args.get(i + 1));
            }
        }
        return EvaluationResult.error(ErrorKind.LOOKUP_NOT_FOUND);
    }

    /**
     * IFERROR(value, fallback): the fallback replaces any result whose text starts with "#",
     * and any failure while evaluating the value.
     */
    static EvaluationResult ifError(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("IFERROR", args, 2, 2);
        EvaluationResult result;
        try {
            result = ctx.evaluate(args.get(0));
        } catch (FormulaException | InvalidReferenceException e) {
            return ctx.evaluate(args.get(1));
        }
        if (result.isError() || (result.isText() && result.getText().startsWith("#"))) {
            return ctx.evaluate(args.get(1));
        }
        return result;
    }

    // IFNA(value, fallback): only an exact #N/A triggers the fallback
    static EvaluationResult ifNa(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("IFNA", args, 2, 2);
        EvaluationResult result = ctx.evaluate(args.get(0));
        boolean notAvailable = (result.isError() && result.getError() == ErrorKind.LOOKUP_NOT_FOUND)
                || (result.isText() && ErrorKind.NOT_AVAILABLE_TEXT.equals(result.getText()));
        return notAvailable ? ctx.evaluate(args.get(1)) : result;
    }

    static EvaluationResult and(List<Expr> args, FunctionContext ctx) {
        for (Expr arg : args) {
            if (!ctx.condition(arg)) {
                return EvaluationResult.bool(false);
            }
        }
        return EvaluationResult.bool(true);
    }

    static EvaluationResult or(List<Expr> args, FunctionContext ctx) {
        for (Expr arg : args) {
            if (ctx.condition(arg)) {
                return EvaluationResult.bool(true);
            }
        }
        return EvaluationResult.bool(false);
    }

    static EvaluationResult not(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("NOT", args, 1, 1);
        return EvaluationResult.bool(!ctx.condition(args.get(0)));
    }
}
